package com.nana.educms.repository;

import com.nana.educms.domain.BaseEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * JdbcRepository — Generic {@link Repository} over a {@link PersistenceContext}
 *
 * <p>One class serves every entity type; the per-type knowledge lives in the
 * {@link EntityMapping} it is constructed with. Reads load the non-deleted
 * rows of the table through the context (merged with staged changes) and
 * apply filtering, ordering and paging in memory.
 *
 * <p>SCALING NOTE: filtering in memory keeps predicates as plain Java
 * conditions, at the cost of reading the whole table for each query.
 * Suitable for institutional data volumes.
 *
 * @param <T> entity type
 */
public class JdbcRepository<T extends BaseEntity> implements Repository<T> {

    private static final Logger log = LoggerFactory.getLogger(JdbcRepository.class);

    private final PersistenceContext context;
    private final EntityMapping<T> mapping;

    public JdbcRepository(PersistenceContext context, EntityMapping<T> mapping) {
        if (context == null || mapping == null) {
            throw new IllegalArgumentException("context and mapping must not be null.");
        }
        this.context = context;
        this.mapping = mapping;
    }

    /** Newest first; id breaks ties between equal creation times. */
    private Comparator<T> defaultOrdering() {
        return Comparator.comparing((T e) -> e.getCreatedAt(), Comparator.reverseOrder())
                         .thenComparing(e -> e.getId());
    }

    // -----------------------------------------------------------------------
    // READ
    // -----------------------------------------------------------------------

    @Override
    public Optional<T> getById(UUID id) {
        log.debug("Finding {} by id={}.", mapping.getTable(), id);
        return context.find(mapping, id, false);
    }

    @Override
    public List<T> getAll() {
        return context.query(mapping, false);
    }

    @Override
    public List<T> getAll(Predicate<? super T> predicate) {
        if (predicate == null) {
            return getAll();
        }
        return filtered(predicate).collect(Collectors.toList());
    }

    @Override
    public PagedResult<T> getPaged(int pageNumber, int pageSize) {
        return getPaged(pageNumber, pageSize, null, null);
    }

    @Override
    public PagedResult<T> getPaged(int pageNumber, int pageSize,
                                   Predicate<? super T> predicate,
                                   Comparator<? super T> ordering) {
        int page = Math.max(pageNumber, 1);
        int size = pageSize < 1 ? DEFAULT_PAGE_SIZE : Math.min(pageSize, MAX_PAGE_SIZE);

        List<T> matches = predicate == null
                ? getAll()
                : filtered(predicate).collect(Collectors.toList());

        Comparator<T> order = defaultOrdering();
        if (ordering != null) {
            Comparator<T> requested = ordering::compare;
            order = requested.thenComparing(e -> e.getId());
        }

        List<T> items = matches.stream()
                .sorted(order)
                .skip((long) (page - 1) * size)
                .limit(size)
                .collect(Collectors.toList());

        log.debug("getPaged({}) page={} size={} total={} returned={}.",
                mapping.getTable(), page, size, matches.size(), items.size());
        return new PagedResult<>(items, matches.size(), page, size);
    }

    @Override
    public List<T> find(Predicate<? super T> predicate) {
        return filtered(requirePredicate(predicate)).collect(Collectors.toList());
    }

    @Override
    public Optional<T> findFirst(Predicate<? super T> predicate) {
        return filtered(requirePredicate(predicate)).findFirst();
    }

    @Override
    public boolean any(Predicate<? super T> predicate) {
        return filtered(requirePredicate(predicate)).findAny().isPresent();
    }

    @Override
    public int count() {
        return getAll().size();
    }

    @Override
    public int count(Predicate<? super T> predicate) {
        if (predicate == null) {
            return count();
        }
        return (int) filtered(predicate).count();
    }

    // -----------------------------------------------------------------------
    // WRITE
    // -----------------------------------------------------------------------

    @Override
    public T add(T entity) {
        return context.add(mapping, entity);
    }

    @Override
    public void addRange(Collection<? extends T> entities) {
        if (entities == null) {
            throw new IllegalArgumentException("entities must not be null.");
        }
        for (T entity : entities) {
            if (entity == null) {
                throw new IllegalArgumentException("entities must not contain null.");
            }
        }
        for (T entity : entities) {
            context.add(mapping, entity);
        }
        log.debug("Staged {} inserts into {}.", entities.size(), mapping.getTable());
    }

    @Override
    public T update(T entity) {
        return context.update(mapping, entity);
    }

    @Override
    public void delete(T entity) {
        context.delete(mapping, entity);
    }

    @Override
    public void delete(UUID id) {
        if (id == null) {
            throw new IllegalArgumentException("id must not be null.");
        }
        context.find(mapping, id, false).ifPresent(entity -> context.delete(mapping, entity));
    }

    @Override
    public void softDelete(T entity) {
        context.softDelete(mapping, entity);
    }

    @Override
    public void softDelete(UUID id) {
        if (id == null) {
            throw new IllegalArgumentException("id must not be null.");
        }
        // Bypasses the soft-delete filter so a repeated call still finds the row.
        context.find(mapping, id, true).ifPresent(entity -> context.softDelete(mapping, entity));
    }

    // -----------------------------------------------------------------------
    // HELPERS
    // -----------------------------------------------------------------------

    private Stream<T> filtered(Predicate<? super T> predicate) {
        return getAll().stream().filter(predicate);
    }

    private static <P> P requirePredicate(P predicate) {
        if (predicate == null) {
            throw new IllegalArgumentException("predicate must not be null.");
        }
        return predicate;
    }
}
