package com.nana.educms.repository;

import com.nana.educms.domain.BaseEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * EntityMapping — Row Mapper and Statement Binder for One Entity Type
 *
 * <p>Holds everything the {@link PersistenceContext} needs to move one entity
 * type in and out of its table: the table name, the business columns, the
 * row mapper and the statement binders. The five lifecycle columns shared by
 * every table are handled here once; subclasses deal with their own columns
 * only.
 *
 * <p>SQL CONSTRUCTION:
 * All statements are built once, in the constructor, from the fixed column
 * list of the subclass. Values are always bound as parameters; nothing that
 * reaches a statement at run time is concatenated into SQL.
 *
 * <p>STORAGE FORMATS:
 * <ul>
 *   <li>ids — canonical {@link UUID#toString()} text</li>
 *   <li>timestamps — fixed-width {@code yyyy-MM-dd'T'HH:mm:ss.SSSSSSSSS}
 *       text, so stored values sort the same way as the times they hold</li>
 *   <li>dates — ISO {@code yyyy-MM-dd}</li>
 *   <li>enums — constant name</li>
 *   <li>booleans — INTEGER 0/1</li>
 * </ul>
 *
 * @param <T> the mapped entity type
 */
public abstract class EntityMapping<T extends BaseEntity> {

    private static final Logger log = LoggerFactory.getLogger(EntityMapping.class);

    /** Lifecycle columns present in every table, in statement order. */
    static final List<String> BASE_COLUMNS =
            List.of("id", "created_at", "updated_at", "is_deleted", "deleted_at");

    public static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSSSSS");

    private final Class<T> entityType;
    private final String table;
    private final List<String> columns;

    private final String selectSql;
    private final String selectActiveSql;
    private final String selectByIdSql;
    private final String insertSql;
    private final String updateSql;
    private final String deleteSql;

    /**
     * @param entityType concrete entity class
     * @param table      table name
     * @param columns    business columns, in the order {@link #bindColumns}
     *                   binds them
     */
    protected EntityMapping(Class<T> entityType, String table, String... columns) {
        this.entityType = entityType;
        this.table = table;
        this.columns = List.of(columns);

        List<String> all = new ArrayList<>(BASE_COLUMNS);
        all.addAll(this.columns);
        String columnList = String.join(", ", all);

        this.selectSql       = "SELECT " + columnList + " FROM " + table;
        this.selectActiveSql = selectSql + " WHERE is_deleted = 0";
        this.selectByIdSql   = selectSql + " WHERE id = ?";
        this.insertSql       = "INSERT INTO " + table + " (" + columnList + ") VALUES ("
                               + String.join(", ", Collections.nCopies(all.size(), "?")) + ")";

        List<String> assignments = new ArrayList<>();
        assignments.add("updated_at = ?");
        assignments.add("is_deleted = ?");
        assignments.add("deleted_at = ?");
        for (String column : this.columns) {
            assignments.add(column + " = ?");
        }
        this.updateSql = "UPDATE " + table + " SET " + String.join(", ", assignments) + " WHERE id = ?";
        this.deleteSql = "DELETE FROM " + table + " WHERE id = ?";
    }

    // -----------------------------------------------------------------------
    // SUBCLASS CONTRACT
    // -----------------------------------------------------------------------

    /** @return a blank instance for the row mapper to populate */
    protected abstract T newInstance();

    /**
     * Binds the business columns of {@code entity}, in constructor order,
     * starting at parameter index {@code index}.
     *
     * @return the next free parameter index
     */
    protected abstract int bindColumns(PreparedStatement ps, T entity, int index) throws SQLException;

    /** Copies the business columns of the current row into {@code entity}. */
    protected abstract void readColumns(ResultSet rs, T entity) throws SQLException;

    /**
     * Fills in entity-specific defaults once the context has assigned the id
     * and timestamps of a newly added entity. Does nothing by default.
     */
    protected void applyDefaults(T entity) {
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public Class<T> getEntityType() { return entityType; }

    public String getTable()        { return table; }

    String selectSql(boolean includeDeleted) {
        return includeDeleted ? selectSql : selectActiveSql;
    }

    String selectByIdSql() { return selectByIdSql; }

    String insertSql()     { return insertSql; }

    String updateSql()     { return updateSql; }

    String deleteSql()     { return deleteSql; }

    // -----------------------------------------------------------------------
    // ROW MAPPING / BINDING
    // -----------------------------------------------------------------------

    /**
     * Maps the current row of {@code rs} to a new entity.
     *
     * @throws SQLException if a column cannot be read or holds unreadable data
     */
    T mapRow(ResultSet rs) throws SQLException {
        T entity = newInstance();
        entity.setId(readUuid(rs, "id"));
        entity.setCreatedAt(readTimestamp(rs, "created_at"));
        entity.setUpdatedAt(readTimestamp(rs, "updated_at"));
        try {
            entity.restoreDeletionState(rs.getInt("is_deleted") != 0, readTimestamp(rs, "deleted_at"));
        } catch (IllegalArgumentException ex) {
            throw new SQLException("Inconsistent soft-delete state in " + table
                                   + " row " + entity.getId() + ": " + ex.getMessage(), ex);
        }
        readColumns(rs, entity);
        return entity;
    }

    void bindInsert(PreparedStatement ps, T entity) throws SQLException {
        ps.setString(1, entity.getId().toString());
        setTimestamp(ps, 2, entity.getCreatedAt());
        setTimestamp(ps, 3, entity.getUpdatedAt());
        ps.setInt(4, entity.isDeleted() ? 1 : 0);
        setTimestamp(ps, 5, entity.getDeletedAt());
        bindColumns(ps, entity, 6);
    }

    void bindUpdate(PreparedStatement ps, T entity) throws SQLException {
        setTimestamp(ps, 1, entity.getUpdatedAt());
        ps.setInt(2, entity.isDeleted() ? 1 : 0);
        setTimestamp(ps, 3, entity.getDeletedAt());
        int next = bindColumns(ps, entity, 4);
        ps.setString(next, entity.getId().toString());
    }

    // -----------------------------------------------------------------------
    // COLUMN HELPERS (shared by the concrete mappings)
    // -----------------------------------------------------------------------

    protected static void setTimestamp(PreparedStatement ps, int index, LocalDateTime value)
            throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value.format(TIMESTAMP_FORMAT));
        }
    }

    protected static void setDate(PreparedStatement ps, int index, LocalDate value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value.toString());
        }
    }

    protected static void setUuid(PreparedStatement ps, int index, UUID value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value.toString());
        }
    }

    protected static void setBoolean(PreparedStatement ps, int index, boolean value) throws SQLException {
        ps.setInt(index, value ? 1 : 0);
    }

    protected static LocalDateTime readTimestamp(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value, TIMESTAMP_FORMAT);
        } catch (DateTimeParseException ex) {
            throw new SQLException("Unreadable timestamp '" + value + "' in column " + column, ex);
        }
    }

    protected static LocalDate readDate(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException ex) {
            throw new SQLException("Unreadable date '" + value + "' in column " + column, ex);
        }
    }

    protected static UUID readUuid(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        if (value == null) {
            return null;
        }
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException ex) {
            throw new SQLException("Unreadable id '" + value + "' in column " + column, ex);
        }
    }

    protected static boolean readBoolean(ResultSet rs, String column) throws SQLException {
        return rs.getInt(column) != 0;
    }

    /**
     * Reads an enum stored by constant name. An unknown value falls back to
     * {@code fallback} with a warning so one legacy row cannot break a listing.
     */
    protected static <E extends Enum<E>> E readEnum(ResultSet rs, String column, Class<E> type, E fallback)
            throws SQLException {
        String value = rs.getString(column);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            log.warn("Unknown {} value '{}' in column {}; using {}.",
                    type.getSimpleName(), value, column, fallback);
            return fallback;
        }
    }
}
