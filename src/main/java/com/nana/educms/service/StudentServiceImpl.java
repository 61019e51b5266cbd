package com.nana.educms.service;

import com.nana.educms.domain.Student;
import com.nana.educms.domain.StudentStatus;
import com.nana.educms.repository.PagedResult;
import com.nana.educms.repository.PredicateBuilder;
import com.nana.educms.repository.Repository;
import com.nana.educms.repository.UnitOfWork;
import com.nana.educms.util.AppLogger;
import com.nana.educms.util.CsvExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * StudentServiceImpl — Student Business Logic over a Unit of Work
 *
 * <p>RESPONSIBILITIES:
 * <ul>
 *   <li>Field validation (required fields and stored length limits).</li>
 *   <li>Uniqueness of student id and email among non-deleted students.</li>
 *   <li>Filter composition for listing and export.</li>
 *   <li>Statistics and CSV export over the filtered set.</li>
 * </ul>
 *
 * <p>Every write stages its change through the unit's student repository and
 * then calls {@link UnitOfWork#saveChanges()} itself, so one service call is
 * one save. Inside an explicit transaction opened by the caller the save
 * joins that transaction.
 *
 * <p>VALIDATION STRATEGY:
 * All field errors are collected into one {@link LinkedHashMap} before
 * throwing. Uniqueness is only checked for a field that passed its own
 * field rules, so a blank or oversized value is never looked up.
 */
public class StudentServiceImpl implements StudentService {

    private static final Logger log = LoggerFactory.getLogger(StudentServiceImpl.class);

    // -----------------------------------------------------------------------
    // VALIDATION CONSTANTS (match the column limits of the students table)
    // -----------------------------------------------------------------------

    static final int STUDENT_ID_MAX_LENGTH        = 20;
    static final int NAME_MAX_LENGTH              = 200;
    static final int EMAIL_MAX_LENGTH             = 256;
    static final int GRADE_MAX_LENGTH             = 10;
    static final int SECTION_MAX_LENGTH           = 10;
    static final int PHONE_MAX_LENGTH             = 20;
    static final int ADDRESS_MAX_LENGTH           = 500;
    static final int EMERGENCY_CONTACT_MAX_LENGTH = 200;
    static final int NOTES_MAX_LENGTH             = 1000;
    static final int AVATAR_URL_MAX_LENGTH        = 500;

    /** Listing and export order: name ignoring case, then business id. */
    static final Comparator<Student> BY_NAME =
            Comparator.comparing(Student::getName, String.CASE_INSENSITIVE_ORDER)
                      .thenComparing(Student::getStudentId);

    private final UnitOfWork unitOfWork;
    private final Clock clock;
    private final CsvExporter csvExporter = new CsvExporter();

    // -----------------------------------------------------------------------
    // CONSTRUCTORS
    // -----------------------------------------------------------------------

    public StudentServiceImpl(UnitOfWork unitOfWork) {
        this(unitOfWork, Clock.systemUTC());
    }

    /**
     * @param unitOfWork the unit every operation runs against; must not be null
     * @param clock      source of "now" for the statistics month and year
     */
    public StudentServiceImpl(UnitOfWork unitOfWork, Clock clock) {
        if (unitOfWork == null) {
            throw new IllegalArgumentException("unitOfWork must not be null.");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null.");
        }
        this.unitOfWork = unitOfWork;
        this.clock      = clock;
        log.debug("StudentServiceImpl initialised.");
    }

    private Repository<Student> students() {
        return unitOfWork.students();
    }

    // -----------------------------------------------------------------------
    // READ OPERATIONS
    // -----------------------------------------------------------------------

    @Override
    public PagedResult<Student> getStudents(int pageNumber, int pageSize,
                                            String searchTerm, String grade, StudentStatus status) {
        log.debug("getStudents(page={}, size={}, search='{}', grade='{}', status={})",
                pageNumber, pageSize, searchTerm, grade, status);
        return students().getPaged(pageNumber, pageSize,
                buildFilter(searchTerm, grade, status), BY_NAME);
    }

    @Override
    public Optional<Student> getStudentById(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return students().getById(id);
    }

    @Override
    public Optional<Student> getStudentByStudentId(String studentId) {
        if (studentId == null || studentId.isBlank()) {
            return Optional.empty();
        }
        String wanted = studentId.trim();
        return students().findFirst(s -> s.getStudentId().equalsIgnoreCase(wanted));
    }

    /**
     * {@inheritDoc}
     *
     * <p>Month and year boundaries are the first instant of the current
     * month and year in the injected clock's zone, the same zone every stored
     * timestamp is taken in. A student counts as new when enrolled on or
     * after the boundary.
     */
    @Override
    public StudentStatistics getStudentStatistics() {
        List<Student> all = students().getAll();

        LocalDate today = LocalDate.now(clock);
        LocalDateTime monthStart = today.withDayOfMonth(1).atStartOfDay();
        LocalDateTime yearStart  = today.withDayOfYear(1).atStartOfDay();

        StudentStatistics.Builder builder = new StudentStatistics.Builder()
                .totalStudents(all.size());
        int newThisMonth = 0;
        int newThisYear  = 0;

        for (Student student : all) {
            builder.incrementStatus(student.getStatus());
            builder.incrementGrade(student.getGrade());

            LocalDateTime enrolled = student.getEnrollmentDate();
            if (enrolled != null) {
                if (!enrolled.isBefore(monthStart)) newThisMonth++;
                if (!enrolled.isBefore(yearStart))  newThisYear++;
            }
        }

        StudentStatistics stats = builder
                .newStudentsThisMonth(newThisMonth)
                .newStudentsThisYear(newThisYear)
                .build();
        log.debug("Statistics computed: {}", stats);
        return stats;
    }

    @Override
    public boolean isStudentIdUnique(String studentId, UUID excludeId) {
        if (studentId == null || studentId.isBlank()) {
            return false;
        }
        String candidate = studentId.trim();
        return !students().any(s -> s.getStudentId().equalsIgnoreCase(candidate)
                && !s.getId().equals(excludeId));
    }

    @Override
    public boolean isEmailUnique(String email, UUID excludeId) {
        if (email == null || email.isBlank()) {
            return false;
        }
        String candidate = email.trim();
        return !students().any(s -> s.getEmail().equalsIgnoreCase(candidate)
                && !s.getId().equals(excludeId));
    }

    @Override
    public byte[] exportStudentsToCsv(String searchTerm, String grade, StudentStatus status) {
        List<Student> rows = new ArrayList<>(students().getAll(buildFilter(searchTerm, grade, status)));
        rows.sort(BY_NAME);
        byte[] csv = csvExporter.export(rows);
        AppLogger.logEvent("CSV_EXPORT_COMPLETE", "rows=" + rows.size() + ", bytes=" + csv.length);
        return csv;
    }

    // -----------------------------------------------------------------------
    // WRITE OPERATIONS
    // -----------------------------------------------------------------------

    @Override
    public Student createStudent(Student student) throws ValidationException {
        if (student == null) {
            throw new IllegalArgumentException("student must not be null.");
        }
        log.debug("createStudent() called for: {}", student);

        Map<String, String> errors = validateStudent(student, null);
        if (!errors.isEmpty()) {
            log.warn("createStudent() validation failed: {}", errors);
            throw new ValidationException(errors);
        }

        Student created = students().add(student);
        unitOfWork.saveChanges();

        AppLogger.logEvent("STUDENT_CREATED",
                "id=" + created.getId() + ", studentId=" + created.getStudentId());
        return created;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Copied fields: student id, name, email, grade, section, status,
     * phone, address, date of birth, emergency contact and notes. The avatar
     * has its own operation, {@link #updateStudentAvatar(UUID, String)}.
     */
    @Override
    public Optional<Student> updateStudent(UUID id, Student student) throws ValidationException {
        if (id == null) {
            throw new IllegalArgumentException("id must not be null.");
        }
        if (student == null) {
            throw new IllegalArgumentException("student must not be null.");
        }
        log.debug("updateStudent() called for id={}.", id);

        Optional<Student> found = students().getById(id);
        if (found.isEmpty()) {
            log.debug("updateStudent(): no student with id={}.", id);
            return Optional.empty();
        }

        Map<String, String> errors = validateStudent(student, id);
        if (!errors.isEmpty()) {
            log.warn("updateStudent() validation failed for id={}: {}", id, errors);
            throw new ValidationException(errors);
        }

        Student existing = found.get();
        existing.setStudentId(student.getStudentId());
        existing.setName(student.getName());
        existing.setEmail(student.getEmail());
        existing.setGrade(student.getGrade());
        existing.setSection(student.getSection());
        existing.setStatus(student.getStatus());
        existing.setPhoneNumber(student.getPhoneNumber());
        existing.setAddress(student.getAddress());
        existing.setDateOfBirth(student.getDateOfBirth());
        existing.setEmergencyContact(student.getEmergencyContact());
        existing.setNotes(student.getNotes());

        students().update(existing);
        unitOfWork.saveChanges();

        AppLogger.logEvent("STUDENT_UPDATED",
                "id=" + id + ", studentId=" + existing.getStudentId());
        return Optional.of(existing);
    }

    @Override
    public boolean deleteStudent(UUID id) {
        if (id == null) {
            return false;
        }
        Optional<Student> found = students().getById(id);
        if (found.isEmpty()) {
            log.debug("deleteStudent(): no student with id={}.", id);
            return false;
        }

        students().softDelete(found.get());
        unitOfWork.saveChanges();

        AppLogger.logEvent("STUDENT_DELETED",
                "id=" + id + ", studentId=" + found.get().getStudentId());
        return true;
    }

    @Override
    public boolean updateStudentAvatar(UUID id, String avatarUrl) {
        if (id == null) {
            return false;
        }
        if (avatarUrl != null && avatarUrl.length() > AVATAR_URL_MAX_LENGTH) {
            throw new IllegalArgumentException(
                    "Avatar URL must not exceed " + AVATAR_URL_MAX_LENGTH + " characters.");
        }
        Optional<Student> found = students().getById(id);
        if (found.isEmpty()) {
            return false;
        }

        Student student = found.get();
        student.setAvatarUrl(avatarUrl);
        students().update(student);
        unitOfWork.saveChanges();

        AppLogger.logEvent("STUDENT_AVATAR_UPDATED", "id=" + id);
        return true;
    }

    // -----------------------------------------------------------------------
    // FILTERING
    // -----------------------------------------------------------------------

    /**
     * Builds the listing/export filter. Every supplied condition is tested
     * against the same student, so any combination of the three holds
     * together.
     */
    static Predicate<Student> buildFilter(String searchTerm, String grade, StudentStatus status) {
        boolean hasSearch = searchTerm != null && !searchTerm.isBlank();
        boolean hasGrade  = grade != null && !grade.isBlank();

        String term   = hasSearch ? searchTerm.trim().toLowerCase(Locale.ROOT) : "";
        String wanted = hasGrade ? grade.trim() : "";

        return new PredicateBuilder<Student>()
                .andIf(hasSearch, s -> containsIgnoreCase(s.getName(), term)
                        || containsIgnoreCase(s.getEmail(), term)
                        || containsIgnoreCase(s.getStudentId(), term))
                .andIf(hasGrade, s -> s.getGrade().equals(wanted))
                .andIf(status != null, s -> s.getStatus() == status)
                .build();
    }

    private static boolean containsIgnoreCase(String value, String lowerTerm) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(lowerTerm);
    }

    // -----------------------------------------------------------------------
    // VALIDATION
    // -----------------------------------------------------------------------

    /**
     * Runs every rule against {@code student} and returns field → message for
     * each failure; an empty map means valid.
     *
     * @param excludeId the record's own id on update, null on create
     */
    private Map<String, String> validateStudent(Student student, UUID excludeId) {
        Map<String, String> errors = new LinkedHashMap<>();

        // --- required fields ---
        validateRequired(student.getStudentId(), "studentId", "Student ID", STUDENT_ID_MAX_LENGTH, errors);
        validateRequired(student.getName(), "name", "Name", NAME_MAX_LENGTH, errors);
        validateRequired(student.getEmail(), "email", "Email", EMAIL_MAX_LENGTH, errors);
        validateRequired(student.getGrade(), "grade", "Grade", GRADE_MAX_LENGTH, errors);
        validateRequired(student.getSection(), "section", "Section", SECTION_MAX_LENGTH, errors);

        // --- optional fields ---
        validateMaxLength(student.getPhoneNumber(), "phoneNumber", "Phone number", PHONE_MAX_LENGTH, errors);
        validateMaxLength(student.getAddress(), "address", "Address", ADDRESS_MAX_LENGTH, errors);
        validateMaxLength(student.getEmergencyContact(), "emergencyContact", "Emergency contact",
                EMERGENCY_CONTACT_MAX_LENGTH, errors);
        validateMaxLength(student.getNotes(), "notes", "Notes", NOTES_MAX_LENGTH, errors);
        validateMaxLength(student.getAvatarUrl(), "avatarUrl", "Avatar URL", AVATAR_URL_MAX_LENGTH, errors);

        // --- uniqueness, one query per field ---
        if (!errors.containsKey("studentId") && !isStudentIdUnique(student.getStudentId(), excludeId)) {
            errors.put("studentId", "Student ID must be unique.");
        }
        if (!errors.containsKey("email") && !isEmailUnique(student.getEmail(), excludeId)) {
            errors.put("email", "Email must be unique.");
        }
        return errors;
    }

    private static void validateRequired(String value, String fieldKey, String fieldLabel,
                                         int maxLength, Map<String, String> errors) {
        if (value == null || value.isBlank()) {
            errors.put(fieldKey, fieldLabel + " is required.");
            return;
        }
        validateMaxLength(value, fieldKey, fieldLabel, maxLength, errors);
    }

    private static void validateMaxLength(String value, String fieldKey, String fieldLabel,
                                          int maxLength, Map<String, String> errors) {
        if (value != null && value.length() > maxLength) {
            errors.put(fieldKey, fieldLabel + " must not exceed " + maxLength
                    + " characters. Got: " + value.length() + ".");
        }
    }
}
