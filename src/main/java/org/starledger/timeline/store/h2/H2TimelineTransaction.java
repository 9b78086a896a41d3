package org.starledger.timeline.store.h2;

import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.EntityKind;
import org.starledger.timeline.model.EventKind;
import org.starledger.timeline.model.EventSubject;
import org.starledger.timeline.model.HistoricalEvent;
import org.starledger.timeline.model.PointRecord;
import org.starledger.timeline.model.Series;
import org.starledger.timeline.store.ITimelineTransaction;
import org.starledger.timeline.store.StoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Write transaction over one dedicated connection with auto-commit disabled.
 * <p>
 * Every change to a row that an earlier snapshot created is journaled in {@code UNDO_LOG} with the row's
 * previous state, tagged with the current day. Rewinding a day restores those images newest first and
 * deletes the rows the day created. Journal rows of earlier days are pruned on commit, so only the newest
 * snapshot can be rewound.
 */
final class H2TimelineTransaction implements ITimelineTransaction {

    private static final Logger log = LoggerFactory.getLogger(H2TimelineTransaction.class);

    private static final String UNDO_ENTITY = "ENTITY";
    private static final String UNDO_EVENT = "EVENT";

    private final Series series;
    private final int day;
    private final Connection conn;
    private final ReentrantLock lock;

    private final Map<EntityKind, TreeMap<Long, Entity>> identityCache = new HashMap<>();
    private final Map<String, String> loadedImages = new HashMap<>();
    private final Set<EntityKind> fullyLoaded = EnumSet.noneOf(EntityKind.class);
    private boolean active = true;

    H2TimelineTransaction(Series series, int day, Connection conn, ReentrantLock lock) {
        this.series = series;
        this.day = day;
        this.conn = conn;
        this.lock = lock;
    }

    @Override
    public String series() {
        return series.name();
    }

    @Override
    public int day() {
        return day;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    // ========================================================================
    // Entities
    // ========================================================================

    @Override
    public Optional<Entity> findEntity(EntityKind kind, long sourceId) {
        ensureActive();
        TreeMap<Long, Entity> cache = cacheOf(kind);
        Entity cached = cache.get(sourceId);
        if (cached != null || fullyLoaded.contains(kind)) {
            return Optional.ofNullable(cached);
        }
        try (PreparedStatement stmt = conn.prepareStatement("SELECT KIND, SOURCE_ID, ATTRIBUTES, CREATED_DAY FROM "
                + table("ENTITIES") + " WHERE KIND = ? AND SOURCE_ID = ?")) {
            stmt.setString(1, kind.name());
            stmt.setLong(2, sourceId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(remember(rs.getString("ATTRIBUTES"), H2Rows.readEntity(rs)));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read entity " + kind + "#" + sourceId, e);
        }
    }

    @Override
    public Entity getOrCreateEntity(EntityKind kind, long sourceId) {
        return findEntity(kind, sourceId).orElseGet(() -> {
            Entity created = new Entity(kind, sourceId, day);
            cacheOf(kind).put(sourceId, created);
            return created;
        });
    }

    @Override
    public Collection<Entity> entities(EntityKind kind) {
        ensureActive();
        TreeMap<Long, Entity> cache = cacheOf(kind);
        if (!fullyLoaded.contains(kind)) {
            try (PreparedStatement stmt = conn.prepareStatement("SELECT KIND, SOURCE_ID, ATTRIBUTES, CREATED_DAY FROM "
                    + table("ENTITIES") + " WHERE KIND = ?")) {
                stmt.setString(1, kind.name());
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        if (!cache.containsKey(rs.getLong("SOURCE_ID"))) {
                            remember(rs.getString("ATTRIBUTES"), H2Rows.readEntity(rs));
                        }
                    }
                }
            } catch (SQLException e) {
                throw new StoreException("Failed to read entities of kind " + kind, e);
            }
            fullyLoaded.add(kind);
        }
        return List.copyOf(cache.values());
    }

    private Entity remember(String storedAttributes, Entity entity) {
        cacheOf(entity.kind()).put(entity.sourceId(), entity);
        loadedImages.put(entityKey(entity.kind(), entity.sourceId()), storedAttributes);
        return entity;
    }

    private TreeMap<Long, Entity> cacheOf(EntityKind kind) {
        return identityCache.computeIfAbsent(kind, k -> new TreeMap<>());
    }

    private void flushEntities() throws SQLException {
        int written = 0;
        try (PreparedStatement merge = conn.prepareStatement("MERGE INTO " + table("ENTITIES")
                + " (KIND, SOURCE_ID, ATTRIBUTES, CREATED_DAY) KEY(KIND, SOURCE_ID) VALUES (?, ?, ?, ?)")) {
            for (TreeMap<Long, Entity> cache : identityCache.values()) {
                for (Entity entity : cache.values()) {
                    if (!entity.isDirty()) {
                        continue;
                    }
                    String key = entityKey(entity.kind(), entity.sourceId());
                    String before = loadedImages.get(key);
                    if (before != null && entity.createdDay() < day) {
                        journal(UNDO_ENTITY, key, before);
                    }
                    merge.setString(1, entity.kind().name());
                    merge.setLong(2, entity.sourceId());
                    merge.setString(3, entity.attributes().toString());
                    merge.setInt(4, entity.createdDay());
                    merge.addBatch();
                    written++;
                }
            }
            if (written > 0) {
                merge.executeBatch();
            }
        }
        log.debug("Wrote {} modified entities for series '{}' day {}", written, series.name(), day);
    }

    // ========================================================================
    // Events
    // ========================================================================

    @Override
    public HistoricalEvent appendEvent(HistoricalEvent draft) {
        ensureActive();
        if (draft.id() != 0L) {
            throw new IllegalArgumentException("Event is already stored: " + draft);
        }
        String sql = "INSERT INTO " + table("EVENTS") + " (KIND, START_DAY, END_DAY, OBSERVED_UNTIL, COUNTRY_ID, "
                + "TARGET_COUNTRY_ID, LEADER_ID, SYSTEM_ID, PLANET_ID, FACTION_ID, WAR_ID, DESCRIPTION, "
                + "KNOWN_TO_OBSERVER, CREATED_DAY) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setString(1, draft.kind().id());
            stmt.setInt(2, draft.startDay());
            H2Rows.setNullableInt(stmt, 3, draft.isOpen() ? null : draft.endDay().getAsInt());
            stmt.setInt(4, draft.observedUntil());
            Long[] subject = H2Rows.subjectValues(draft.subject());
            for (int i = 0; i < subject.length; i++) {
                H2Rows.setNullableLong(stmt, 5 + i, subject[i]);
            }
            stmt.setString(12, draft.description().orElse(null));
            stmt.setBoolean(13, draft.knownToObserver());
            stmt.setInt(14, draft.createdDay());
            stmt.executeUpdate();
            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new StoreException("No id generated for event " + draft);
                }
                return draft.withId(keys.getLong(1));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to append event " + draft, e);
        }
    }

    @Override
    public List<HistoricalEvent> findEvents(EventKind kind, EventSubject subject, boolean openOnly) {
        ensureActive();
        StringBuilder sql = new StringBuilder("SELECT " + H2Rows.EVENT_COLUMNS + " FROM " + table("EVENTS")
                + " WHERE KIND = ?");
        Long[] values = H2Rows.subjectValues(subject);
        List<Long> params = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (values[i] != null) {
                sql.append(" AND ").append(H2Rows.SUBJECT_COLUMNS[i]).append(" = ?");
                params.add(values[i]);
            }
        }
        if (openOnly) {
            sql.append(" AND END_DAY IS NULL");
        }
        sql.append(" ORDER BY START_DAY, ID");
        List<HistoricalEvent> result = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            stmt.setString(1, kind.id());
            for (int i = 0; i < params.size(); i++) {
                stmt.setLong(i + 2, params.get(i));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(H2Rows.readEvent(rs));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read events of kind " + kind.id(), e);
        }
        return result;
    }

    @Override
    public void updateEvent(HistoricalEvent event) {
        ensureActive();
        if (event.id() == 0L) {
            throw new IllegalArgumentException("Event has not been stored: " + event);
        }
        try {
            if (event.createdDay() < day) {
                journalEvent(event.id());
            }
            try (PreparedStatement stmt = conn.prepareStatement("UPDATE " + table("EVENTS")
                    + " SET END_DAY = ?, OBSERVED_UNTIL = ?, KNOWN_TO_OBSERVER = KNOWN_TO_OBSERVER OR ? WHERE ID = ?")) {
                H2Rows.setNullableInt(stmt, 1, event.isOpen() ? null : event.endDay().getAsInt());
                stmt.setInt(2, event.observedUntil());
                stmt.setBoolean(3, event.knownToObserver());
                stmt.setLong(4, event.id());
                if (stmt.executeUpdate() == 0) {
                    throw new StoreException("Event no longer exists: " + event);
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to update event " + event, e);
        }
    }

    private void journalEvent(long id) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT END_DAY, OBSERVED_UNTIL, KNOWN_TO_OBSERVER FROM "
                + table("EVENTS") + " WHERE ID = ?")) {
            stmt.setLong(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return;
                }
                JsonObject image = new JsonObject();
                int end = rs.getInt("END_DAY");
                if (!rs.wasNull()) {
                    image.addProperty("end", end);
                }
                image.addProperty("observedUntil", rs.getInt("OBSERVED_UNTIL"));
                image.addProperty("known", rs.getBoolean("KNOWN_TO_OBSERVER"));
                journal(UNDO_EVENT, Long.toString(id), image.toString());
            }
        }
    }

    // ========================================================================
    // Point records
    // ========================================================================

    @Override
    public void insertPointRecord(PointRecord record) {
        ensureActive();
        if (record.day() != day) {
            throw new IllegalArgumentException("Record of day " + record.day() + " written in snapshot " + day);
        }
        try (PreparedStatement stmt = conn.prepareStatement("INSERT INTO " + table("POINT_RECORDS")
                + " (KIND, ENTITY_KIND, ENTITY_ID, SNAPSHOT_DAY, BREAKDOWN, METRICS) VALUES (?, ?, ?, ?, ?, ?)")) {
            stmt.setString(1, record.kind().name());
            stmt.setString(2, record.kind().entityKind().name());
            stmt.setLong(3, record.entityId());
            stmt.setInt(4, record.day());
            stmt.setString(5, record.breakdown());
            stmt.setString(6, record.metrics().toString());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert " + record.kind() + " record for entity " + record.entityId(), e);
        }
    }

    // ========================================================================
    // Snapshot lifecycle
    // ========================================================================

    @Override
    public void rewindLatestSnapshot() {
        ensureActive();
        try {
            int restored = 0;
            try (PreparedStatement select = conn.prepareStatement("SELECT TARGET_TABLE, ROW_KEY, BEFORE_IMAGE FROM "
                    + table("UNDO_LOG") + " WHERE SNAPSHOT_DAY = ? ORDER BY SEQ DESC")) {
                select.setInt(1, day);
                try (ResultSet rs = select.executeQuery()) {
                    while (rs.next()) {
                        restore(rs.getString("TARGET_TABLE"), rs.getString("ROW_KEY"), rs.getString("BEFORE_IMAGE"));
                        restored++;
                    }
                }
            }
            int entities = deleteByDay("ENTITIES", "CREATED_DAY");
            int events = deleteByDay("EVENTS", "CREATED_DAY");
            int records = deleteByDay("POINT_RECORDS", "SNAPSHOT_DAY");
            deleteByDay("UNDO_LOG", "SNAPSHOT_DAY");
            deleteByDay("SNAPSHOTS", "SNAPSHOT_DAY");
            identityCache.clear();
            loadedImages.clear();
            fullyLoaded.clear();
            log.debug("Rewound series '{}' day {}: restored {} rows, removed {} entities, {} events, {} records",
                    series.name(), day, restored, entities, events, records);
        } catch (SQLException e) {
            throw new StoreException("Failed to rewind series '" + series.name() + "' day " + day, e);
        }
    }

    private void restore(String targetTable, String rowKey, String image) throws SQLException {
        if (UNDO_ENTITY.equals(targetTable)) {
            int separator = rowKey.indexOf(':');
            try (PreparedStatement stmt = conn.prepareStatement("UPDATE " + table("ENTITIES")
                    + " SET ATTRIBUTES = ? WHERE KIND = ? AND SOURCE_ID = ?")) {
                stmt.setString(1, image);
                stmt.setString(2, rowKey.substring(0, separator));
                stmt.setLong(3, Long.parseLong(rowKey.substring(separator + 1)));
                stmt.executeUpdate();
            }
        } else if (UNDO_EVENT.equals(targetTable)) {
            JsonObject before = H2Rows.parseObject(image);
            try (PreparedStatement stmt = conn.prepareStatement("UPDATE " + table("EVENTS")
                    + " SET END_DAY = ?, OBSERVED_UNTIL = ?, KNOWN_TO_OBSERVER = ? WHERE ID = ?")) {
                H2Rows.setNullableInt(stmt, 1, before.has("end") ? before.get("end").getAsInt() : null);
                stmt.setInt(2, before.get("observedUntil").getAsInt());
                stmt.setBoolean(3, before.get("known").getAsBoolean());
                stmt.setLong(4, Long.parseLong(rowKey));
                stmt.executeUpdate();
            }
        } else {
            throw new StoreException("Unknown undo journal target: " + targetTable);
        }
    }

    private int deleteByDay(String tableName, String dayColumn) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "DELETE FROM " + table(tableName) + " WHERE " + dayColumn + " = ?")) {
            stmt.setInt(1, day);
            return stmt.executeUpdate();
        }
    }

    @Override
    public void commit() {
        ensureActive();
        try {
            flushEntities();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "INSERT INTO " + table("SNAPSHOTS") + " (SNAPSHOT_DAY) VALUES (?)")) {
                stmt.setInt(1, day);
                stmt.executeUpdate();
            }
            try (PreparedStatement stmt = conn.prepareStatement(
                    "DELETE FROM " + table("UNDO_LOG") + " WHERE SNAPSHOT_DAY < ?")) {
                stmt.setInt(1, day);
                stmt.executeUpdate();
            }
            conn.commit();
            log.debug("Committed series '{}' day {}", series.name(), day);
        } catch (SQLException e) {
            try {
                conn.rollback();
            } catch (SQLException rollbackEx) {
                log.warn("Rollback failed (connection may be closed): {}", rollbackEx.getMessage());
            }
            throw new StoreException("Failed to commit series '" + series.name() + "' day " + day, e);
        } finally {
            finish();
        }
    }

    @Override
    public void rollback() {
        ensureActive();
        try {
            conn.rollback();
            log.debug("Rolled back series '{}' day {}", series.name(), day);
        } catch (SQLException e) {
            throw new StoreException("Failed to roll back series '" + series.name() + "' day " + day, e);
        } finally {
            finish();
        }
    }

    private void finish() {
        active = false;
        identityCache.clear();
        loadedImages.clear();
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Failed to return connection to pool: {}", e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private void journal(String targetTable, String rowKey, String image) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("INSERT INTO " + table("UNDO_LOG")
                + " (SNAPSHOT_DAY, TARGET_TABLE, ROW_KEY, BEFORE_IMAGE) VALUES (?, ?, ?, ?)")) {
            stmt.setInt(1, day);
            stmt.setString(2, targetTable);
            stmt.setString(3, rowKey);
            stmt.setString(4, image);
            stmt.executeUpdate();
        }
    }

    private void ensureActive() {
        if (!active) {
            throw new IllegalStateException("Transaction for series '" + series.name() + "' day " + day + " has ended");
        }
    }

    private String table(String name) {
        return H2Schema.table(series.schemaName(), name);
    }

    private static String entityKey(EntityKind kind, long sourceId) {
        return kind.name() + ":" + sourceId;
    }
}
