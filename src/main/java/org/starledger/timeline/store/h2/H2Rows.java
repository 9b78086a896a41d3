package org.starledger.timeline.store.h2;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.EntityKind;
import org.starledger.timeline.model.EventKind;
import org.starledger.timeline.model.EventSubject;
import org.starledger.timeline.model.HistoricalEvent;
import org.starledger.timeline.model.PointRecord;
import org.starledger.timeline.model.PointRecordKind;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;

/**
 * Row mapping shared by the store and its transactions.
 */
final class H2Rows {

    static final String EVENT_COLUMNS = "ID, KIND, START_DAY, END_DAY, OBSERVED_UNTIL, COUNTRY_ID, "
            + "TARGET_COUNTRY_ID, LEADER_ID, SYSTEM_ID, PLANET_ID, FACTION_ID, WAR_ID, DESCRIPTION, "
            + "KNOWN_TO_OBSERVER, CREATED_DAY";

    static final String[] SUBJECT_COLUMNS = {
            "COUNTRY_ID", "TARGET_COUNTRY_ID", "LEADER_ID", "SYSTEM_ID", "PLANET_ID", "FACTION_ID", "WAR_ID"
    };

    private H2Rows() {}

    static HistoricalEvent readEvent(ResultSet rs) throws SQLException {
        EventSubject subject = new EventSubject(
                nullableLong(rs, "COUNTRY_ID"),
                nullableLong(rs, "TARGET_COUNTRY_ID"),
                nullableLong(rs, "LEADER_ID"),
                nullableLong(rs, "SYSTEM_ID"),
                nullableLong(rs, "PLANET_ID"),
                nullableLong(rs, "FACTION_ID"),
                nullableLong(rs, "WAR_ID"));
        int end = rs.getInt("END_DAY");
        Integer endDay = rs.wasNull() ? null : end;
        return new HistoricalEvent(
                rs.getLong("ID"),
                EventKind.fromId(rs.getString("KIND")),
                subject,
                rs.getString("DESCRIPTION"),
                rs.getInt("START_DAY"),
                endDay,
                rs.getInt("OBSERVED_UNTIL"),
                rs.getBoolean("KNOWN_TO_OBSERVER"),
                rs.getInt("CREATED_DAY"));
    }

    static Long[] subjectValues(EventSubject s) {
        return new Long[] {s.country(), s.targetCountry(), s.leader(), s.system(), s.planet(), s.faction(), s.war()};
    }

    static Entity readEntity(ResultSet rs) throws SQLException {
        return new Entity(
                EntityKind.valueOf(rs.getString("KIND")),
                rs.getLong("SOURCE_ID"),
                rs.getInt("CREATED_DAY"),
                parseObject(rs.getString("ATTRIBUTES")));
    }

    static PointRecord readPointRecord(ResultSet rs) throws SQLException {
        return new PointRecord(
                PointRecordKind.valueOf(rs.getString("KIND")),
                rs.getLong("ENTITY_ID"),
                rs.getInt("SNAPSHOT_DAY"),
                rs.getString("BREAKDOWN"),
                parseObject(rs.getString("METRICS")));
    }

    static JsonObject parseObject(String json) {
        return json == null || json.isEmpty() ? new JsonObject() : JsonParser.parseString(json).getAsJsonObject();
    }

    static void setNullableLong(PreparedStatement stmt, int index, Long value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.BIGINT);
        } else {
            stmt.setLong(index, value);
        }
    }

    static void setNullableInt(PreparedStatement stmt, int index, Integer value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setInt(index, value);
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
