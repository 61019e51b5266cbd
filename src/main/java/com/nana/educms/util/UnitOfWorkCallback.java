package com.nana.educms.util;

import com.nana.educms.repository.UnitOfWork;

/**
 * Work done by one request inside its own {@link UnitOfWork}.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface UnitOfWorkCallback<T> {

    /**
     * @param unitOfWork the request's unit; closed by the caller afterwards
     * @return the request's result
     * @throws Exception any failure; it completes the request's future exceptionally
     */
    T doInUnitOfWork(UnitOfWork unitOfWork) throws Exception;
}
