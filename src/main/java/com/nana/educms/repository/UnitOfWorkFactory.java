package com.nana.educms.repository;

/**
 * Opens a fresh {@link UnitOfWork}: one per request, never shared.
 */
@FunctionalInterface
public interface UnitOfWorkFactory {

    /**
     * @return a new unit with its own persistence context; the caller must close it
     * @throws Repository.RepositoryException if the store cannot be reached
     */
    UnitOfWork create();
}
