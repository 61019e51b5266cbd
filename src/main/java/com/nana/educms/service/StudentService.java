package com.nana.educms.service;

import com.nana.educms.domain.Student;
import com.nana.educms.domain.StudentStatus;
import com.nana.educms.repository.PagedResult;

import java.util.Optional;
import java.util.UUID;

/**
 * StudentService — Student Business Operations
 *
 * <p>Callers depend on this interface, never on {@link StudentServiceImpl}.
 * An implementation works against one unit of work for its whole lifetime
 * and holds no persistence state of its own.
 *
 * <p>EXCEPTION CONTRACT:
 * <ul>
 *   <li>Writes that take user data declare the checked
 *       {@link ValidationException}, which lists every violated rule.</li>
 *   <li>A null entity argument fails fast with
 *       {@link IllegalArgumentException}.</li>
 *   <li>Store failures surface as the unchecked
 *       {@link com.nana.educms.repository.Repository.RepositoryException}.</li>
 * </ul>
 *
 * <p>FILTERS:
 * {@link #getStudents} and {@link #exportStudentsToCsv} take the same three
 * optional filters. A null or blank search term matches every student;
 * otherwise it matches, ignoring case, any student whose name, email or
 * student id contains it. A null or blank grade and a null status do not
 * filter. All supplied filters must hold together.
 */
public interface StudentService {

    // -----------------------------------------------------------------------
    // READ OPERATIONS
    // -----------------------------------------------------------------------

    /**
     * Returns one page of students matching the filters, ordered by name
     * (ignoring case) and then by student id.
     *
     * @param pageNumber 1-based page; clamped like {@code Repository.getPaged}
     * @param pageSize   requested size; clamped like {@code Repository.getPaged}
     * @param searchTerm optional free-text filter
     * @param grade      optional exact grade
     * @param status     optional exact status
     * @return the page, never null
     */
    PagedResult<Student> getStudents(int pageNumber, int pageSize,
                                     String searchTerm, String grade, StudentStatus status);

    Optional<Student> getStudentById(UUID id);

    /**
     * Looks up a student by business id. A null or blank id returns empty
     * without touching the store.
     */
    Optional<Student> getStudentByStudentId(String studentId);

    /** Aggregates over every non-deleted student. */
    StudentStatistics getStudentStatistics();

    /**
     * @param studentId candidate business id; blank is never unique
     * @param excludeId id of the record being edited, or null on create
     * @return true when no other non-deleted student uses {@code studentId}
     */
    boolean isStudentIdUnique(String studentId, UUID excludeId);

    /**
     * @param email     candidate email; blank is never unique
     * @param excludeId id of the record being edited, or null on create
     * @return true when no other non-deleted student uses {@code email}
     */
    boolean isEmailUnique(String email, UUID excludeId);

    /**
     * Encodes the matching students, ordered by name, as a UTF-8 CSV
     * document with a header row.
     */
    byte[] exportStudentsToCsv(String searchTerm, String grade, StudentStatus status);

    // -----------------------------------------------------------------------
    // WRITE OPERATIONS
    // -----------------------------------------------------------------------

    /**
     * Validates, adds and saves a new student. The stored identifier and
     * timestamps are assigned here whatever the input carries; a missing
     * enrollment date becomes the creation time.
     *
     * @param student the new student; must not be null
     * @return the saved student
     * @throws ValidationException if any rule fails; nothing is saved
     */
    Student createStudent(Student student) throws ValidationException;

    /**
     * Copies the business fields of {@code student} onto the stored record
     * {@code id} and saves it. The record keeps its id, creation time,
     * enrollment date and avatar.
     *
     * @param id      id of the record to update
     * @param student the new field values; must not be null
     * @return the updated record, or empty if {@code id} does not exist
     * @throws ValidationException if any rule fails; nothing is saved
     */
    Optional<Student> updateStudent(UUID id, Student student) throws ValidationException;

    /**
     * Soft-deletes a student.
     *
     * @return false if no non-deleted student has {@code id}
     */
    boolean deleteStudent(UUID id);

    /**
     * Replaces the avatar URL only.
     *
     * @return false if no non-deleted student has {@code id}
     */
    boolean updateStudentAvatar(UUID id, String avatarUrl);
}
