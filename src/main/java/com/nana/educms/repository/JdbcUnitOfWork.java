package com.nana.educms.repository;

import com.nana.educms.domain.Announcement;
import com.nana.educms.domain.AnnouncementAttachment;
import com.nana.educms.domain.Document;
import com.nana.educms.domain.Student;
import com.nana.educms.repository.Repository.RepositoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;

/**
 * JdbcUnitOfWork — {@link UnitOfWork} over one {@link PersistenceContext}
 *
 * <p>All four repositories are built in the constructor over the same
 * context. Store failures are logged here once and rethrown unchanged.
 */
public class JdbcUnitOfWork implements UnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(JdbcUnitOfWork.class);

    private final PersistenceContext context;

    private final Repository<Student> students;
    private final Repository<Announcement> announcements;
    private final Repository<Document> documents;
    private final Repository<AnnouncementAttachment> announcementAttachments;

    /** Open explicit transaction, or null in the NONE state. */
    private JdbcTransaction transaction;
    private boolean closed;

    public JdbcUnitOfWork(PersistenceContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null.");
        }
        this.context = context;
        this.students                = new JdbcRepository<>(context, new StudentMapping());
        this.announcements           = new JdbcRepository<>(context, new AnnouncementMapping());
        this.documents               = new JdbcRepository<>(context, new DocumentMapping());
        this.announcementAttachments = new JdbcRepository<>(context, new AnnouncementAttachmentMapping());
    }

    // -----------------------------------------------------------------------
    // REPOSITORIES
    // -----------------------------------------------------------------------

    @Override
    public Repository<Student> students()                 { return students; }

    @Override
    public Repository<Announcement> announcements()       { return announcements; }

    @Override
    public Repository<Document> documents()               { return documents; }

    @Override
    public Repository<AnnouncementAttachment> announcementAttachments() { return announcementAttachments; }

    // -----------------------------------------------------------------------
    // SAVE / TRANSACTIONS
    // -----------------------------------------------------------------------

    @Override
    public int saveChanges() {
        try {
            return context.saveChanges();
        } catch (RepositoryException ex) {
            log.error("saveChanges() failed.", ex);
            throw ex;
        }
    }

    @Override
    public void beginTransaction() {
        if (transaction != null) {
            throw TransactionStateException.alreadyInProgress();
        }
        transaction = context.beginTransaction();
        log.debug("Transaction started.");
    }

    @Override
    public void commitTransaction() {
        if (transaction == null) {
            throw TransactionStateException.noTransaction();
        }
        try {
            context.checkCancelled();
            transaction.commit();
            log.debug("Transaction committed.");
        } catch (SQLException ex) {
            log.error("Commit failed; rolling back.", ex);
            rollbackAfterFailedCommit(ex);
            throw new RepositoryException("Failed to commit transaction.", ex);
        } catch (RuntimeException ex) {
            log.warn("Commit interrupted; rolling back.", ex);
            rollbackAfterFailedCommit(ex);
            throw ex;
        } finally {
            releaseTransaction();
        }
    }

    @Override
    public void rollbackTransaction() {
        if (transaction == null) {
            throw TransactionStateException.noTransaction();
        }
        try {
            transaction.rollback();
            log.debug("Transaction rolled back.");
        } catch (SQLException ex) {
            log.error("Rollback failed.", ex);
            throw new RepositoryException("Failed to roll back transaction.", ex);
        } finally {
            releaseTransaction();
            context.detachAll();
        }
    }

    @Override
    public boolean hasActiveTransaction() {
        return transaction != null;
    }

    // -----------------------------------------------------------------------
    // LIFECYCLE
    // -----------------------------------------------------------------------

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (transaction != null) {
                log.debug("Closing unit of work with an open transaction; rolling back.");
                try {
                    transaction.rollback();
                } catch (SQLException ex) {
                    log.error("Rollback on close failed.", ex);
                } finally {
                    releaseTransaction();
                }
            }
        } finally {
            context.close();
        }
    }

    private void rollbackAfterFailedCommit(Exception cause) {
        try {
            transaction.rollback();
        } catch (SQLException rollbackEx) {
            cause.addSuppressed(rollbackEx);
            log.error("Rollback after failed commit also failed.", rollbackEx);
        } finally {
            context.detachAll();
        }
    }

    /** Closes the handle (restoring auto-commit) and returns to the NONE state. */
    private void releaseTransaction() {
        try {
            transaction.close();
        } catch (SQLException ex) {
            log.error("Failed to release transaction handle.", ex);
        } finally {
            transaction = null;
        }
    }
}
