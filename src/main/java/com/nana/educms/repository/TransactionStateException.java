package com.nana.educms.repository;

/**
 * Thrown when explicit transaction calls on a {@link UnitOfWork} arrive in
 * the wrong order: beginning while one is already open, or committing or
 * rolling back while none is.
 *
 * <p>This is a usage error. Retrying without fixing the call order will
 * fail the same way.
 */
public class TransactionStateException extends IllegalStateException {

    /** Which ordering rule was broken. */
    public enum Kind {
        ALREADY_IN_PROGRESS,
        NO_TRANSACTION
    }

    private final Kind kind;

    public TransactionStateException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    static TransactionStateException alreadyInProgress() {
        return new TransactionStateException(Kind.ALREADY_IN_PROGRESS,
                "A transaction is already in progress.");
    }

    static TransactionStateException noTransaction() {
        return new TransactionStateException(Kind.NO_TRANSACTION,
                "No transaction is in progress.");
    }

    public Kind getKind() {
        return kind;
    }
}
