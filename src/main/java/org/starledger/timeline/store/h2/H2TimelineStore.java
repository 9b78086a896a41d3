package org.starledger.timeline.store.h2;

import com.google.gson.JsonObject;
import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.EntityKind;
import org.starledger.timeline.model.EventFilter;
import org.starledger.timeline.model.HistoricalEvent;
import org.starledger.timeline.model.PointRecord;
import org.starledger.timeline.model.PointRecordKind;
import org.starledger.timeline.model.Series;
import org.starledger.timeline.model.SeriesSummary;
import org.starledger.timeline.store.ITimelineReader;
import org.starledger.timeline.store.ITimelineStore;
import org.starledger.timeline.store.ITimelineTransaction;
import org.starledger.timeline.store.StoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * H2 timeline store using HikariCP for connection pooling.
 * <p>
 * Configuration (the {@code starledger.database} block):
 * <pre>
 * database {
 *   jdbcUrl = "jdbc:h2:./data/starledger"
 *   username = "sa"
 *   password = ""
 *   maxPoolSize = 4
 *   minIdle = 1
 * }
 * </pre>
 * Writers hold a per-series lock from {@link #begin(String, int)} until the transaction ends. Readers use
 * separate pooled connections and see committed data only.
 */
public class H2TimelineStore implements ITimelineStore, ITimelineReader {

    private static final Logger log = LoggerFactory.getLogger(H2TimelineStore.class);

    private final HikariDataSource dataSource;
    private final Map<String, ReentrantLock> seriesLocks = new ConcurrentHashMap<>();

    public H2TimelineStore(Config options) {
        if (!options.hasPath("jdbcUrl")) {
            throw new IllegalArgumentException("'jdbcUrl' must be configured for the timeline store.");
        }
        final String jdbcUrl = options.getString("jdbcUrl");
        final String username = options.hasPath("username") ? options.getString("username") : "sa";
        final String password = options.hasPath("password") ? options.getString("password") : "";

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 4);
        hikariConfig.setMinimumIdle(options.hasPath("minIdle") ? options.getInt("minIdle") : 1);
        hikariConfig.setUsername(username);
        hikariConfig.setPassword(password);
        hikariConfig.setPoolName("timeline-store");

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
            log.debug("Timeline store connection pool started (max={}, minIdle={})",
                    hikariConfig.getMaximumPoolSize(), hikariConfig.getMinimumIdle());
        } catch (Exception e) {
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            String causeMsg = cause.getMessage() != null ? cause.getMessage() : "";

            if (causeMsg.contains("already in use") || causeMsg.contains("file is locked")) {
                String errorMsg = String.format(
                        "Cannot open timeline database: file already in use by another process. File: %s.mv.db",
                        jdbcUrl.replace("jdbc:h2:", ""));
                log.error(errorMsg);
                throw new StoreException(errorMsg, e);
            }
            if (causeMsg.contains("Wrong user name or password")) {
                String errorMsg = String.format(
                        "Failed to connect to timeline database: Wrong username/password. URL=%s, User=%s",
                        jdbcUrl, username.isEmpty() ? "(empty)" : username);
                log.error(errorMsg);
                throw new StoreException(errorMsg, e);
            }
            String errorMsg = String.format("Failed to initialize timeline database: %s. Database: %s. Error: %s",
                    cause.getClass().getSimpleName(), jdbcUrl, causeMsg);
            log.error(errorMsg);
            throw new StoreException(errorMsg, e);
        }

        try (Connection conn = dataSource.getConnection()) {
            H2Schema.createCatalog(conn);
        } catch (SQLException e) {
            dataSource.close();
            throw new StoreException("Failed to create series catalog", e);
        }
    }

    @Override
    public synchronized Series getOrCreateSeries(String name) {
        Optional<Series> existing = findSeries(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        String schema = H2Schema.schemaName(name);
        try (Connection conn = dataSource.getConnection()) {
            H2Schema.createSeriesSchema(conn, schema);
            try (PreparedStatement stmt = conn.prepareStatement(
                    "INSERT INTO " + H2Schema.SERIES_TABLE + " (NAME, SCHEMA_NAME, METADATA) VALUES (?, ?, ?)")) {
                stmt.setString(1, name);
                stmt.setString(2, schema);
                stmt.setString(3, "{}");
                stmt.executeUpdate();
            }
            log.info("Created series '{}' in schema {}", name, schema);
            return new Series(name, schema, new JsonObject());
        } catch (SQLException e) {
            throw new StoreException("Failed to create series '" + name + "'", e);
        }
    }

    @Override
    public Optional<Series> findSeries(String name) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                     "SELECT NAME, SCHEMA_NAME, METADATA FROM " + H2Schema.SERIES_TABLE + " WHERE NAME = ?")) {
            stmt.setString(1, name);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(readSeries(rs));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read series '" + name + "'", e);
        }
    }

    @Override
    public void updateSeriesMetadata(String name, JsonObject metadata) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("UPDATE " + H2Schema.SERIES_TABLE
                     + " SET METADATA = ?, UPDATED_AT = CURRENT_TIMESTAMP WHERE NAME = ?")) {
            stmt.setString(1, metadata.toString());
            stmt.setString(2, name);
            if (stmt.executeUpdate() == 0) {
                throw new IllegalArgumentException("Unknown series: " + name);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to update metadata of series '" + name + "'", e);
        }
    }

    @Override
    public boolean snapshotExists(String series, int day) {
        return snapshotDays(series).contains(day);
    }

    @Override
    public OptionalInt latestSnapshotDay(String series) {
        List<Integer> days = snapshotDays(series);
        return days.isEmpty() ? OptionalInt.empty() : OptionalInt.of(days.get(days.size() - 1));
    }

    @Override
    public ITimelineTransaction begin(String seriesName, int day) {
        Series series = findSeries(seriesName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown series: " + seriesName));
        ReentrantLock lock = seriesLocks.computeIfAbsent(seriesName, k -> new ReentrantLock());
        lock.lock();
        try {
            Connection conn = dataSource.getConnection();
            conn.setAutoCommit(false);
            log.debug("Began transaction for series '{}' day {}", seriesName, day);
            return new H2TimelineTransaction(series, day, conn, lock);
        } catch (SQLException | RuntimeException e) {
            lock.unlock();
            throw new StoreException("Failed to begin transaction for series '" + seriesName + "'", e);
        }
    }

    // ========================================================================
    // ITimelineReader
    // ========================================================================

    @Override
    public List<SeriesSummary> listSeries() {
        List<Series> all = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                     "SELECT NAME, SCHEMA_NAME, METADATA FROM " + H2Schema.SERIES_TABLE + " ORDER BY NAME");
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                all.add(readSeries(rs));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to list series", e);
        }
        List<SeriesSummary> result = new ArrayList<>();
        for (Series series : all) {
            List<Integer> days = snapshotDays(series.name());
            result.add(new SeriesSummary(series, days.size(),
                    days.isEmpty() ? null : days.get(0),
                    days.isEmpty() ? null : days.get(days.size() - 1)));
        }
        return result;
    }

    @Override
    public List<Integer> snapshotDays(String seriesName) {
        Optional<Series> series = findSeries(seriesName);
        if (series.isEmpty()) {
            return List.of();
        }
        List<Integer> days = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT SNAPSHOT_DAY FROM "
                     + H2Schema.table(series.get().schemaName(), "SNAPSHOTS") + " ORDER BY SNAPSHOT_DAY");
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                days.add(rs.getInt(1));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read snapshots of series '" + seriesName + "'", e);
        }
        return days;
    }

    @Override
    public List<HistoricalEvent> events(String seriesName, EventFilter filter) {
        Optional<Series> series = findSeries(seriesName);
        if (series.isEmpty()) {
            return List.of();
        }
        StringBuilder sql = new StringBuilder("SELECT " + H2Rows.EVENT_COLUMNS + " FROM "
                + H2Schema.table(series.get().schemaName(), "EVENTS") + " WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (filter.kind() != null) {
            sql.append(" AND KIND = ?");
            params.add(filter.kind().id());
        }
        if (filter.country() != null) {
            sql.append(" AND (COUNTRY_ID = ? OR TARGET_COUNTRY_ID = ?)");
            params.add(filter.country());
            params.add(filter.country());
        }
        if (filter.subject() != null) {
            Long[] values = H2Rows.subjectValues(filter.subject());
            for (int i = 0; i < values.length; i++) {
                if (values[i] != null) {
                    sql.append(" AND ").append(H2Rows.SUBJECT_COLUMNS[i]).append(" = ?");
                    params.add(values[i]);
                }
            }
        }
        if (filter.fromDay() != null) {
            sql.append(" AND (END_DAY IS NULL OR END_DAY >= ?)");
            params.add(filter.fromDay());
        }
        if (filter.toDay() != null) {
            sql.append(" AND START_DAY <= ?");
            params.add(filter.toDay());
        }
        if (filter.knownOnly()) {
            sql.append(" AND KNOWN_TO_OBSERVER = TRUE");
        }
        sql.append(" ORDER BY START_DAY, ID");

        List<HistoricalEvent> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(H2Rows.readEvent(rs));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read events of series '" + seriesName + "'", e);
        }
        return result;
    }

    @Override
    public List<PointRecord> pointRecords(String seriesName, PointRecordKind kind, long entityId) {
        Optional<Series> series = findSeries(seriesName);
        if (series.isEmpty()) {
            return List.of();
        }
        List<PointRecord> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT KIND, ENTITY_ID, SNAPSHOT_DAY, BREAKDOWN, METRICS FROM "
                     + H2Schema.table(series.get().schemaName(), "POINT_RECORDS")
                     + " WHERE KIND = ? AND ENTITY_ID = ? ORDER BY SNAPSHOT_DAY, BREAKDOWN")) {
            stmt.setString(1, kind.name());
            stmt.setLong(2, entityId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(H2Rows.readPointRecord(rs));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read point records of series '" + seriesName + "'", e);
        }
        return result;
    }

    @Override
    public Optional<Entity> findEntity(String seriesName, EntityKind kind, long sourceId) {
        Optional<Series> series = findSeries(seriesName);
        if (series.isEmpty()) {
            return Optional.empty();
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT KIND, SOURCE_ID, ATTRIBUTES, CREATED_DAY FROM "
                     + H2Schema.table(series.get().schemaName(), "ENTITIES") + " WHERE KIND = ? AND SOURCE_ID = ?")) {
            stmt.setString(1, kind.name());
            stmt.setLong(2, sourceId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(H2Rows.readEntity(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read entity " + kind + "#" + sourceId, e);
        }
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.debug("Timeline store connection pool closed");
        }
    }

    private static Series readSeries(ResultSet rs) throws SQLException {
        return new Series(rs.getString("NAME"), rs.getString("SCHEMA_NAME"),
                H2Rows.parseObject(rs.getString("METADATA")));
    }
}
