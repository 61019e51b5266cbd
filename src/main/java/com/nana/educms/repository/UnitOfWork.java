package com.nana.educms.repository;

import com.nana.educms.domain.Announcement;
import com.nana.educms.domain.AnnouncementAttachment;
import com.nana.educms.domain.Document;
import com.nana.educms.domain.Student;

/**
 * UnitOfWork — Transactional Boundary over a Set of Repositories
 *
 * <p>All repositories returned by one unit share one persistence context:
 * they see each other's staged changes, and a single {@link #saveChanges()}
 * flushes all of them together. A unit serves exactly one request and is not
 * safe for concurrent use.
 *
 * <p>TRANSACTION STATE MACHINE:
 * <pre>
 *   NONE --beginTransaction--> OPEN --commitTransaction / rollbackTransaction--> NONE
 * </pre>
 * {@code beginTransaction} while OPEN, and {@code commit}/{@code rollback}
 * while NONE, throw {@link TransactionStateException}. Transactions do not nest.
 *
 * <p>Closing the unit rolls back any open transaction and releases the
 * persistence context. {@link #close()} is idempotent.
 */
public interface UnitOfWork extends AutoCloseable {

    Repository<Student> students();

    Repository<Announcement> announcements();

    Repository<Document> documents();

    Repository<AnnouncementAttachment> announcementAttachments();

    /**
     * Flushes every change staged through any repository of this unit.
     * Atomic when no explicit transaction is open; otherwise the writes join
     * the open transaction. Failures are logged and rethrown; nothing is retried.
     *
     * @return number of rows affected
     * @throws Repository.RepositoryException            on store failure
     * @throws java.util.concurrent.CancellationException if the calling thread was interrupted
     */
    int saveChanges();

    /**
     * Opens an explicit transaction.
     *
     * @throws TransactionStateException if one is already open
     */
    void beginTransaction();

    /**
     * Commits the open transaction. If the commit fails the transaction is
     * rolled back before the failure is rethrown; either way the handle is
     * released and the unit returns to the NONE state.
     *
     * @throws TransactionStateException if no transaction is open
     */
    void commitTransaction();

    /**
     * Rolls back the open transaction and releases its handle.
     *
     * @throws TransactionStateException if no transaction is open
     */
    void rollbackTransaction();

    /** @return true between a successful begin and the matching commit or rollback */
    boolean hasActiveTransaction();

    /** Rolls back any open transaction and releases the context. Safe to call repeatedly. */
    @Override
    void close();
}
