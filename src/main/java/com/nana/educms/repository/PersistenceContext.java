package com.nana.educms.repository;

import com.nana.educms.domain.BaseEntity;
import com.nana.educms.repository.Repository.RepositoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * PersistenceContext — Change Tracker over One JDBC Connection
 *
 * <p>Every {@link UnitOfWork} owns exactly one context; every repository of
 * that unit works through it. The context is the single place where SQL is
 * executed for entity data.
 *
 * <p>RESPONSIBILITIES:
 * <ul>
 *   <li>Identity map: at most one tracked instance per entity type and id.
 *       A row read twice yields the same object.</li>
 *   <li>Staging: {@code add}, {@code update}, {@code delete} and
 *       {@code softDelete} only record the change. The list of staged
 *       entries keeps the order in which entities were first staged.</li>
 *   <li>Read-your-writes: reads merge stored rows with staged state, so an
 *       added entity is visible before it is saved and a deleted one
 *       disappears at once.</li>
 *   <li>Flush: {@link #saveChanges()} writes every staged entry in order.
 *       Without an explicit transaction the flush runs in its own store
 *       transaction and either all of it lands or none of it does.</li>
 *   <li>Cancellation: every store access first checks the calling thread's
 *       interrupt flag and throws {@link CancellationException} if set.</li>
 * </ul>
 *
 * <p>THREAD SAFETY: none. A context belongs to one logical operation at a time.
 */
public class PersistenceContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PersistenceContext.class);

    enum EntryState { UNCHANGED, ADDED, MODIFIED, DELETED }

    /** Tracking record for one entity instance. Identity-based equality. */
    private static final class EntityEntry {
        final EntityMapping<?> mapping;
        BaseEntity entity;
        EntryState state;

        EntityEntry(EntityMapping<?> mapping, BaseEntity entity, EntryState state) {
            this.mapping = mapping;
            this.entity = entity;
            this.state = state;
        }
    }

    private final Connection connection;
    private final Clock clock;
    private final IdGenerator idGenerator;

    private final Map<Class<?>, Map<UUID, EntityEntry>> tracked = new HashMap<>();
    private final Set<EntityEntry> pending = new LinkedHashSet<>();
    private boolean closed;

    /**
     * @param connection  open connection; owned and closed by this context
     * @param clock       source of every timestamp assigned here
     * @param idGenerator source of new entity ids
     */
    public PersistenceContext(Connection connection, Clock clock, IdGenerator idGenerator) {
        this.connection  = Objects.requireNonNull(connection, "connection");
        this.clock       = Objects.requireNonNull(clock, "clock");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    /** @return the current wall-clock time of this context's clock, in the clock's zone */
    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /** @return true if at least one change is waiting for {@link #saveChanges()} */
    public boolean hasPendingChanges() {
        return !pending.isEmpty();
    }

    // -----------------------------------------------------------------------
    // READ
    // -----------------------------------------------------------------------

    /**
     * Loads every entity of one type, merged with the staged state of this
     * context.
     *
     * @param includeDeleted true to keep soft-deleted entities in the result
     */
    <T extends BaseEntity> List<T> query(EntityMapping<T> mapping, boolean includeDeleted) {
        ensureUsable();
        Map<UUID, EntityEntry> entries = entriesFor(mapping);
        List<T> result = new ArrayList<>();

        try (PreparedStatement ps = connection.prepareStatement(mapping.selectSql(includeDeleted));
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                UUID id = EntityMapping.readUuid(rs, "id");
                EntityEntry entry = entries.get(id);
                if (entry == null) {
                    T entity = mapping.mapRow(rs);
                    entries.put(id, new EntityEntry(mapping, entity, EntryState.UNCHANGED));
                    result.add(entity);
                } else if (entry.state != EntryState.DELETED) {
                    result.add(mapping.getEntityType().cast(entry.entity));
                }
            }

        } catch (SQLException ex) {
            throw new RepositoryException("Failed to query " + mapping.getTable() + ".", ex);
        }

        for (EntityEntry entry : entries.values()) {
            if (entry.state == EntryState.ADDED) {
                result.add(mapping.getEntityType().cast(entry.entity));
            }
        }
        if (!includeDeleted) {
            result.removeIf(BaseEntity::isDeleted);
        }

        log.debug("query({}) returned {} entities.", mapping.getTable(), result.size());
        return result;
    }

    /**
     * Looks up one entity by id, consulting the identity map before the store.
     *
     * @param includeDeleted true to return the entity even if soft deleted
     */
    <T extends BaseEntity> Optional<T> find(EntityMapping<T> mapping, UUID id, boolean includeDeleted) {
        requireArgument(id, "id");
        ensureUsable();

        T entity;
        EntityEntry entry = entriesFor(mapping).get(id);
        if (entry != null) {
            if (entry.state == EntryState.DELETED) {
                return Optional.empty();
            }
            entity = mapping.getEntityType().cast(entry.entity);
        } else {
            entity = load(mapping, id);
            if (entity == null) {
                return Optional.empty();
            }
        }

        if (!includeDeleted && entity.isDeleted()) {
            return Optional.empty();
        }
        return Optional.of(entity);
    }

    private <T extends BaseEntity> T load(EntityMapping<T> mapping, UUID id) {
        try (PreparedStatement ps = connection.prepareStatement(mapping.selectByIdSql())) {
            ps.setString(1, id.toString());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                T entity = mapping.mapRow(rs);
                entriesFor(mapping).put(id, new EntityEntry(mapping, entity, EntryState.UNCHANGED));
                return entity;
            }
        } catch (SQLException ex) {
            throw new RepositoryException(
                    "Failed to find " + mapping.getTable() + " row by id: " + id, ex);
        }
    }

    // -----------------------------------------------------------------------
    // STAGING
    // -----------------------------------------------------------------------

    <T extends BaseEntity> T add(EntityMapping<T> mapping, T entity) {
        requireArgument(entity, "entity");
        ensureUsable();
        if (entity.getId() != null) {
            EntityEntry existing = entriesFor(mapping).get(entity.getId());
            if (existing != null && existing.entity == entity) {
                throw new IllegalArgumentException(
                        "Entity " + entity.getId() + " is already tracked; use update instead.");
            }
        }

        LocalDateTime now = now();
        entity.setId(idGenerator.next());
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        mapping.applyDefaults(entity);

        EntityEntry entry = new EntityEntry(mapping, entity, EntryState.ADDED);
        entriesFor(mapping).put(entity.getId(), entry);
        pending.add(entry);
        log.debug("Staged insert into {} id={}.", mapping.getTable(), entity.getId());
        return entity;
    }

    <T extends BaseEntity> T update(EntityMapping<T> mapping, T entity) {
        requireArgument(entity, "entity");
        requireTrackable(entity);
        ensureUsable();
        entity.setUpdatedAt(now());
        markModified(mapping, entity);
        return entity;
    }

    <T extends BaseEntity> void softDelete(EntityMapping<T> mapping, T entity) {
        requireArgument(entity, "entity");
        requireTrackable(entity);
        ensureUsable();
        entity.markDeleted(now());
        markModified(mapping, entity);
        log.debug("Staged soft delete of {} id={}.", mapping.getTable(), entity.getId());
    }

    <T extends BaseEntity> void delete(EntityMapping<T> mapping, T entity) {
        requireArgument(entity, "entity");
        requireTrackable(entity);
        ensureUsable();

        Map<UUID, EntityEntry> entries = entriesFor(mapping);
        EntityEntry entry = entries.get(entity.getId());
        if (entry != null && entry.state == EntryState.ADDED) {
            // never reached the store
            entries.remove(entity.getId());
            pending.remove(entry);
            return;
        }
        if (entry == null) {
            entry = new EntityEntry(mapping, entity, EntryState.DELETED);
            entries.put(entity.getId(), entry);
        } else {
            entry.entity = entity;
            entry.state = EntryState.DELETED;
        }
        pending.add(entry);
        log.debug("Staged delete from {} id={}.", mapping.getTable(), entity.getId());
    }

    private void markModified(EntityMapping<?> mapping, BaseEntity entity) {
        Map<UUID, EntityEntry> entries = entriesFor(mapping);
        EntityEntry entry = entries.get(entity.getId());
        if (entry == null) {
            entry = new EntityEntry(mapping, entity, EntryState.MODIFIED);
            entries.put(entity.getId(), entry);
        } else {
            if (entry.entity != entity) {
                entity.setCreatedAt(entry.entity.getCreatedAt());
                entry.entity = entity;
            }
            if (entry.state != EntryState.ADDED) {
                entry.state = EntryState.MODIFIED;
            }
        }
        pending.add(entry);
    }

    // -----------------------------------------------------------------------
    // FLUSH
    // -----------------------------------------------------------------------

    /**
     * Writes every staged change to the store, in staging order.
     *
     * <p>TRANSACTION STRATEGY:
     * <ol>
     *   <li>If the connection is in auto-commit mode (no explicit
     *       transaction), auto-commit is switched off for the flush.</li>
     *   <li>Each staged entry becomes one INSERT, UPDATE or DELETE.</li>
     *   <li>On success the flush transaction is committed; on any failure it
     *       is rolled back and the failure propagates.</li>
     *   <li>Auto-commit is restored in a {@code finally} block.</li>
     * </ol>
     * Inside an explicit transaction the statements simply join it and the
     * caller decides whether they are committed.
     *
     * <p>After a successful flush, added and modified entries become
     * unchanged and deleted ones are detached. After a failed flush every
     * tracked entity is detached: nothing staged is kept for a later call,
     * and the next read sees only what the store holds.
     *
     * @return number of rows affected
     * @throws RepositoryException   if any statement fails
     * @throws CancellationException if the calling thread is interrupted
     */
    public int saveChanges() {
        ensureUsable();
        if (pending.isEmpty()) {
            log.debug("saveChanges(): nothing staged.");
            return 0;
        }

        boolean ownTransaction;
        try {
            ownTransaction = connection.getAutoCommit();
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to read connection transaction state.", ex);
        }

        int affected = 0;
        try {
            if (ownTransaction) {
                connection.setAutoCommit(false);
            }
            for (EntityEntry entry : pending) {
                checkCancelled();
                affected += flush(entry.mapping, entry);
            }
            if (ownTransaction) {
                connection.commit();
            }
        } catch (SQLException ex) {
            if (ownTransaction) {
                rollbackAfterFailure(ex);
            }
            detachAll();
            throw new RepositoryException("Failed to save changes.", ex);
        } catch (RuntimeException ex) {
            if (ownTransaction) {
                rollbackAfterFailure(ex);
            }
            detachAll();
            throw ex;
        } finally {
            if (ownTransaction) {
                try {
                    connection.setAutoCommit(true);
                } catch (SQLException acEx) {
                    log.error("Failed to re-enable auto-commit after saveChanges().", acEx);
                }
            }
        }

        acceptChanges();
        log.debug("saveChanges() wrote {} rows.", affected);
        return affected;
    }

    private <T extends BaseEntity> int flush(EntityMapping<T> mapping, EntityEntry entry) throws SQLException {
        T entity = mapping.getEntityType().cast(entry.entity);
        switch (entry.state) {
            case ADDED: {
                try (PreparedStatement ps = connection.prepareStatement(mapping.insertSql())) {
                    mapping.bindInsert(ps, entity);
                    return ps.executeUpdate();
                }
            }
            case MODIFIED: {
                try (PreparedStatement ps = connection.prepareStatement(mapping.updateSql())) {
                    mapping.bindUpdate(ps, entity);
                    int rows = ps.executeUpdate();
                    if (rows == 0) {
                        throw new RepositoryException("Update affected 0 rows: " + mapping.getTable()
                                                      + " id=" + entity.getId() + " not found.");
                    }
                    return rows;
                }
            }
            case DELETED: {
                try (PreparedStatement ps = connection.prepareStatement(mapping.deleteSql())) {
                    ps.setString(1, entity.getId().toString());
                    return ps.executeUpdate();
                }
            }
            default:
                return 0;
        }
    }

    private void acceptChanges() {
        for (EntityEntry entry : pending) {
            if (entry.state == EntryState.DELETED) {
                entriesFor(entry.mapping).remove(entry.entity.getId());
            } else {
                entry.state = EntryState.UNCHANGED;
            }
        }
        pending.clear();
    }

    private void rollbackAfterFailure(Exception cause) {
        log.error("saveChanges() failed; rolling back.", cause);
        try {
            connection.rollback();
        } catch (SQLException rollbackEx) {
            cause.addSuppressed(rollbackEx);
            log.error("Rollback also failed.", rollbackEx);
        }
    }

    // -----------------------------------------------------------------------
    // TRANSACTIONS / LIFECYCLE
    // -----------------------------------------------------------------------

    /**
     * Opens an explicit store transaction on this context's connection.
     *
     * @throws RepositoryException if the driver refuses
     */
    JdbcTransaction beginTransaction() {
        ensureUsable();
        try {
            return new JdbcTransaction(connection);
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to begin transaction.", ex);
        }
    }

    /**
     * Throws {@link CancellationException} if the calling thread has been
     * interrupted. The interrupt flag is left set.
     */
    public void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Operation cancelled.");
        }
    }

    /**
     * Forgets every tracked entity and every staged change. Called whenever
     * the store may no longer match the identity map: after a rollback and
     * after a failed flush.
     */
    void detachAll() {
        if (!pending.isEmpty()) {
            log.debug("Detaching context with {} unsaved changes; they are discarded.", pending.size());
        }
        pending.clear();
        tracked.clear();
    }

    /** Drops all tracked state and closes the connection. Safe to call twice. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        detachAll();
        try {
            connection.close();
        } catch (SQLException ex) {
            log.warn("Failed to close database connection.", ex);
        }
    }

    boolean isClosed() {
        return closed;
    }

    // -----------------------------------------------------------------------
    // HELPERS
    // -----------------------------------------------------------------------

    private Map<UUID, EntityEntry> entriesFor(EntityMapping<?> mapping) {
        return tracked.computeIfAbsent(mapping.getEntityType(), type -> new LinkedHashMap<>());
    }

    private void ensureUsable() {
        if (closed) {
            throw new IllegalStateException("Persistence context is closed.");
        }
        checkCancelled();
    }

    private static void requireArgument(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null.");
        }
    }

    private static void requireTrackable(BaseEntity entity) {
        if (entity.getId() == null) {
            throw new IllegalArgumentException("Entity has no id; add it before updating or deleting it.");
        }
    }
}
