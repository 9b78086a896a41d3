package org.starledger.timeline.store.h2;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

/**
 * DDL for the series catalog and the per-series schemas.
 * <p>
 * Every series lives in its own schema {@code SERIES_<NAME>_<HASH>}, so dropping a series is a single
 * {@code DROP SCHEMA} and series never share rows.
 */
final class H2Schema {

    static final String SERIES_TABLE = "PUBLIC.SERIES";

    private H2Schema() {}

    static void createCatalog(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS " + SERIES_TABLE + " ("
                    + "NAME VARCHAR PRIMARY KEY, "
                    + "SCHEMA_NAME VARCHAR NOT NULL, "
                    + "METADATA CHARACTER LARGE OBJECT, "
                    + "CREATED_AT TIMESTAMP DEFAULT CURRENT_TIMESTAMP, "
                    + "UPDATED_AT TIMESTAMP DEFAULT CURRENT_TIMESTAMP)");
        }
    }

    /**
     * Derives the schema name of a series.
     * <p>
     * {@code My Game-1} -> {@code SERIES_MY_GAME_1_<hash>}
     *
     * @param seriesName The series name.
     * @return The schema name.
     */
    static String schemaName(String seriesName) {
        String sanitized = seriesName.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_");
        if (sanitized.length() > 40) {
            sanitized = sanitized.substring(0, 40);
        }
        return "SERIES_" + sanitized + "_" + Integer.toHexString(seriesName.hashCode()).toUpperCase(Locale.ROOT);
    }

    static void createSeriesSchema(Connection conn, String schema) throws SQLException {
        String q = quote(schema);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE SCHEMA IF NOT EXISTS " + q);
            stmt.execute("CREATE TABLE IF NOT EXISTS " + q + ".SNAPSHOTS ("
                    + "SNAPSHOT_DAY INT PRIMARY KEY, "
                    + "IMPORTED_AT TIMESTAMP DEFAULT CURRENT_TIMESTAMP)");
            stmt.execute("CREATE TABLE IF NOT EXISTS " + q + ".ENTITIES ("
                    + "KIND VARCHAR(32) NOT NULL, "
                    + "SOURCE_ID BIGINT NOT NULL, "
                    + "ATTRIBUTES CHARACTER LARGE OBJECT NOT NULL, "
                    + "CREATED_DAY INT NOT NULL, "
                    + "PRIMARY KEY (KIND, SOURCE_ID))");
            stmt.execute("CREATE TABLE IF NOT EXISTS " + q + ".EVENTS ("
                    + "ID BIGINT AUTO_INCREMENT PRIMARY KEY, "
                    + "KIND VARCHAR(64) NOT NULL, "
                    + "START_DAY INT NOT NULL, "
                    + "END_DAY INT, "
                    + "OBSERVED_UNTIL INT NOT NULL, "
                    + "COUNTRY_ID BIGINT, "
                    + "TARGET_COUNTRY_ID BIGINT, "
                    + "LEADER_ID BIGINT, "
                    + "SYSTEM_ID BIGINT, "
                    + "PLANET_ID BIGINT, "
                    + "FACTION_ID BIGINT, "
                    + "WAR_ID BIGINT, "
                    + "DESCRIPTION VARCHAR, "
                    + "KNOWN_TO_OBSERVER BOOLEAN NOT NULL, "
                    + "CREATED_DAY INT NOT NULL)");
            stmt.execute("CREATE INDEX IF NOT EXISTS " + q + ".IDX_EVENTS_KIND ON " + q + ".EVENTS (KIND, END_DAY)");
            stmt.execute("CREATE INDEX IF NOT EXISTS " + q + ".IDX_EVENTS_COUNTRY ON " + q + ".EVENTS (COUNTRY_ID)");
            stmt.execute("CREATE TABLE IF NOT EXISTS " + q + ".POINT_RECORDS ("
                    + "KIND VARCHAR(32) NOT NULL, "
                    + "ENTITY_KIND VARCHAR(32) NOT NULL, "
                    + "ENTITY_ID BIGINT NOT NULL, "
                    + "SNAPSHOT_DAY INT NOT NULL, "
                    + "BREAKDOWN VARCHAR NOT NULL, "
                    + "METRICS CHARACTER LARGE OBJECT NOT NULL, "
                    + "PRIMARY KEY (KIND, ENTITY_ID, SNAPSHOT_DAY, BREAKDOWN))");
            stmt.execute("CREATE TABLE IF NOT EXISTS " + q + ".UNDO_LOG ("
                    + "SEQ BIGINT AUTO_INCREMENT PRIMARY KEY, "
                    + "SNAPSHOT_DAY INT NOT NULL, "
                    + "TARGET_TABLE VARCHAR(16) NOT NULL, "
                    + "ROW_KEY VARCHAR NOT NULL, "
                    + "BEFORE_IMAGE CHARACTER LARGE OBJECT NOT NULL)");
        }
    }

    static String quote(String schema) {
        return "\"" + schema + "\"";
    }

    static String table(String schema, String table) {
        return quote(schema) + "." + table;
    }
}
