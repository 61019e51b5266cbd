package com.nana.educms.repository;

import com.nana.educms.domain.BaseEntity;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Repository — Generic Data Access Contract
 *
 * <p>One instance serves one entity type and gives it the full set of CRUD,
 * filtering and paging operations without per-entity boilerplate. Instances
 * are obtained from a {@link UnitOfWork}; every repository of the same unit
 * shares one persistence context, so each sees the others' staged changes.
 *
 * <p>READ RULES:
 * <ul>
 *   <li>Every read excludes soft-deleted entities. The only lookup that
 *       bypasses this filter is the one inside {@link #softDelete(UUID)}.</li>
 *   <li>Reads observe changes staged in the same unit of work but not yet
 *       saved (read-your-writes).</li>
 *   <li>Multi-result reads return a {@link List}, never null.</li>
 * </ul>
 *
 * <p>WRITE RULES:
 * Mutations are staged only. Nothing becomes durable until
 * {@link UnitOfWork#saveChanges()} succeeds. Ids and timestamps are always
 * assigned here, never taken from the caller. This layer performs no
 * uniqueness checks; business rules belong to the service layer.
 *
 * <p>EXCEPTION STRATEGY:
 * A null entity, id or collection is rejected with
 * {@link IllegalArgumentException}. Store failures surface as the unchecked
 * {@link RepositoryException}, with the underlying
 * {@link java.sql.SQLException} kept as the cause.
 *
 * @param <T> the entity type served by this repository
 */
public interface Repository<T extends BaseEntity> {

    /** Page size used when the caller asks for less than one item per page. */
    int DEFAULT_PAGE_SIZE = 10;

    /** Upper bound applied to every requested page size. */
    int MAX_PAGE_SIZE = 100;

    // -----------------------------------------------------------------------
    // READ
    // -----------------------------------------------------------------------

    /**
     * Looks up one entity by its identifier.
     *
     * @param id the identifier; must not be null
     * @return the entity, or {@link Optional#empty()} if it does not exist
     *         or has been soft deleted
     */
    Optional<T> getById(UUID id);

    /**
     * Returns every non-deleted entity of this type.
     *
     * <p>Materialises the whole set; meant for small result sets such as
     * statistics and export.
     */
    List<T> getAll();

    /**
     * Returns every non-deleted entity matching {@code predicate}.
     *
     * @param predicate filter to apply; {@code null} means no filter
     */
    List<T> getAll(Predicate<? super T> predicate);

    /**
     * Returns one page of entities in the default order (newest first).
     *
     * @see #getPaged(int, int, Predicate, Comparator)
     */
    PagedResult<T> getPaged(int pageNumber, int pageSize);

    /**
     * Returns one page of the filtered, ordered set.
     *
     * <p>CLAMPING: a page number below 1 becomes 1; a page size below 1
     * becomes {@link #DEFAULT_PAGE_SIZE}; a page size above
     * {@link #MAX_PAGE_SIZE} becomes {@code MAX_PAGE_SIZE}. The returned
     * {@link PagedResult} carries the clamped values.
     *
     * <p>The total count is taken over the filtered set before paging, so it
     * reflects every match regardless of the requested page. Without an
     * ordering the default is {@code createdAt} descending. Ties under any
     * ordering are broken by id, so consecutive pages never overlap.
     *
     * @param pageNumber 1-based page number
     * @param pageSize   requested page size
     * @param predicate  filter; {@code null} means no filter
     * @param ordering   ordering; {@code null} means newest first
     * @return the requested page, never null
     */
    PagedResult<T> getPaged(int pageNumber, int pageSize,
                            Predicate<? super T> predicate,
                            Comparator<? super T> ordering);

    /**
     * Returns every non-deleted entity matching {@code predicate}.
     *
     * @param predicate filter; must not be null
     */
    List<T> find(Predicate<? super T> predicate);

    /**
     * Returns the first non-deleted entity matching {@code predicate}.
     *
     * @param predicate filter; must not be null
     */
    Optional<T> findFirst(Predicate<? super T> predicate);

    /**
     * @param predicate filter; must not be null
     * @return true if at least one non-deleted entity matches
     */
    boolean any(Predicate<? super T> predicate);

    /** @return number of non-deleted entities */
    int count();

    /**
     * @param predicate filter; {@code null} counts everything
     * @return number of non-deleted entities matching {@code predicate}
     */
    int count(Predicate<? super T> predicate);

    // -----------------------------------------------------------------------
    // WRITE (staged until UnitOfWork.saveChanges)
    // -----------------------------------------------------------------------

    /**
     * Stages a new entity. A fresh id is generated and {@code createdAt} and
     * {@code updatedAt} are both set to the current time, overwriting
     * anything the caller supplied.
     *
     * @param entity the entity to add; must not be null
     * @return the same instance, now carrying its id and timestamps
     */
    T add(T entity);

    /**
     * Stages every entity of {@code entities} exactly as {@link #add} would.
     *
     * @param entities entities to add; neither the collection nor any element may be null
     */
    void addRange(Collection<? extends T> entities);

    /**
     * Stages an update. Refreshes {@code updatedAt}; {@code createdAt} is
     * never written back to the store.
     *
     * @param entity a previously added entity; must not be null
     * @return the same instance
     */
    T update(T entity);

    /**
     * Stages a hard delete: the row is removed on save.
     *
     * @param entity the entity to remove; must not be null
     */
    void delete(T entity);

    /**
     * Stages a hard delete by id. Does nothing if no non-deleted entity has this id.
     *
     * @param id identifier; must not be null
     */
    void delete(UUID id);

    /**
     * Stages a soft delete: sets {@code deleted}, {@code deletedAt} and
     * {@code updatedAt}. The row stays in the store and drops out of every
     * default read.
     *
     * @param entity the entity to soft delete; must not be null
     */
    void softDelete(T entity);

    /**
     * Stages a soft delete by id. The lookup includes already soft-deleted
     * rows; repeating the call keeps the original {@code deletedAt} and only
     * refreshes {@code updatedAt}. Does nothing if no row has this id.
     *
     * @param id identifier; must not be null
     */
    void softDelete(UUID id);

    // -----------------------------------------------------------------------
    // EXCEPTION
    // -----------------------------------------------------------------------

    /**
     * Unchecked exception raised for any failure of the underlying store.
     *
     * <p>Wraps {@link java.sql.SQLException} so callers above the
     * persistence layer never deal with JDBC types.
     */
    class RepositoryException extends RuntimeException {

        public RepositoryException(String message, Throwable cause) {
            super(message, cause);
        }

        /**
         * Used when the failure is detected by the persistence layer itself
         * (e.g., an update that matched no row) rather than by the driver.
         */
        public RepositoryException(String message) {
            super(message);
        }
    }
}
