package com.nana.educms.repository;

import java.util.UUID;

/**
 * Source of entity identifiers, assigned by the persistence layer on add.
 */
@FunctionalInterface
public interface IdGenerator {

    UUID next();

    /** @return a generator backed by {@link UUID#randomUUID()} */
    static IdGenerator random() {
        return UUID::randomUUID;
    }
}
