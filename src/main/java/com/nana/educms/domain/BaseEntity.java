package com.nana.educms.domain;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * BaseEntity — Shared Record Shape
 *
 * <p>Every persisted record in EduCMS carries the same five lifecycle fields:
 * <pre>
 *   id         — globally unique identifier, assigned by the repository on add
 *   createdAt  — set once on add, never changed afterwards
 *   updatedAt  — refreshed on every update and soft delete
 *   deleted    — soft-delete marker, false until the record is soft deleted
 *   deletedAt  — moment the record was soft deleted
 * </pre>
 *
 * <p>INVARIANT: {@code deletedAt} is non-null if and only if {@code deleted}
 * is true. The only way to flip the marker is {@link #markDeleted(LocalDateTime)},
 * which stamps both fields together.
 *
 * <p>All timestamps are UTC wall-clock values taken from the {@link java.time.Clock}
 * the persistence layer is configured with. Callers never supply them; any
 * value set before {@code Repository.add} is overwritten.
 */
public abstract class BaseEntity {

    private UUID id;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private boolean deleted;
    private LocalDateTime deletedAt;

    protected BaseEntity() {
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public LocalDateTime getDeletedAt() {
        return deletedAt;
    }

    // -----------------------------------------------------------------------
    // SOFT DELETE
    // -----------------------------------------------------------------------

    /**
     * Marks this record as logically deleted.
     *
     * <p>{@code deletedAt} is stamped only on the first transition to deleted;
     * a repeated call keeps the original deletion moment and only refreshes
     * {@code updatedAt}.
     *
     * @param now the current wall-clock time; must not be null
     */
    public void markDeleted(LocalDateTime now) {
        Objects.requireNonNull(now, "now");
        if (!deleted) {
            deleted = true;
            deletedAt = now;
        }
        updatedAt = now;
    }

    /**
     * Restores the soft-delete pair exactly as it was read from the store.
     * Used by the row mappers only.
     *
     * @param deleted   stored soft-delete marker
     * @param deletedAt stored deletion timestamp
     * @throws IllegalArgumentException if the pair violates the invariant
     */
    public void restoreDeletionState(boolean deleted, LocalDateTime deletedAt) {
        if (deleted != (deletedAt != null)) {
            throw new IllegalArgumentException(
                    "deletedAt must be set if and only if the record is deleted (deleted="
                    + deleted + ", deletedAt=" + deletedAt + ").");
        }
        this.deleted = deleted;
        this.deletedAt = deletedAt;
    }

    // -----------------------------------------------------------------------
    // IDENTITY
    // -----------------------------------------------------------------------

    /**
     * Two entities are equal when they are of the same concrete type and share
     * a non-null id. Unsaved entities (null id) are only equal to themselves.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BaseEntity other = (BaseEntity) o;
        return id != null && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id != null ? id.hashCode() : System.identityHashCode(this);
    }
}
