package com.nana.educms.repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Accumulates independent filter conditions over one entity and folds them
 * into a single conjunction.
 *
 * <p>Each condition is evaluated against the same entity instance, so any
 * combination of conditions can be active at once:
 * <pre>{@code
 *   Predicate<Student> filter = new PredicateBuilder<Student>()
 *           .andIf(grade != null, s -> s.getGrade().equals(grade))
 *           .andIf(status != null, s -> s.getStatus() == status)
 *           .build();
 * }</pre>
 *
 * @param <T> type the conditions apply to
 */
public final class PredicateBuilder<T> {

    private final List<Predicate<? super T>> conditions = new ArrayList<>();

    /**
     * Adds a condition unconditionally.
     *
     * @param condition condition to add; must not be null
     * @return this builder
     */
    public PredicateBuilder<T> and(Predicate<? super T> condition) {
        conditions.add(Objects.requireNonNull(condition, "condition"));
        return this;
    }

    /**
     * Adds {@code condition} only when {@code applies} is true.
     *
     * @return this builder
     */
    public PredicateBuilder<T> andIf(boolean applies, Predicate<? super T> condition) {
        if (applies) {
            and(condition);
        }
        return this;
    }

    /** @return true when no condition has been added */
    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    /**
     * Folds the collected conditions with logical AND.
     *
     * @return a predicate that holds when every condition holds; with no
     *         conditions it accepts everything
     */
    public Predicate<T> build() {
        List<Predicate<? super T>> snapshot = List.copyOf(conditions);
        return entity -> {
            for (Predicate<? super T> condition : snapshot) {
                if (!condition.test(entity)) {
                    return false;
                }
            }
            return true;
        };
    }
}
