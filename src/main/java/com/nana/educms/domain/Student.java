package com.nana.educms.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Student — Core Domain Entity
 *
 * <p>The central business record of EduCMS. Plain mutable object: the
 * repository layer populates it from rows, the service layer validates it,
 * and nothing here knows about storage.
 *
 * <p>FIELD OVERVIEW:
 * <pre>
 *   studentId        — business key, unique among non-deleted students (1–20 chars)
 *   name             — full name
 *   email            — contact email, unique among non-deleted students
 *   grade            — grade level (e.g., "10")
 *   section          — class section (e.g., "A")
 *   enrollmentDate   — defaults to the record's creation time when not supplied
 *   status           — enrollment status, never null (ACTIVE by default)
 *   avatarUrl        — optional profile picture URL
 *   phoneNumber      — optional
 *   address          — optional
 *   dateOfBirth      — optional
 *   emergencyContact — optional
 *   notes            — optional free text
 * </pre>
 *
 * <p>Required string fields are normalised to {@code ""} (never null) and
 * trimmed; email is additionally lower-cased so uniqueness is
 * case-insensitive. Optional fields keep {@code null} when absent.
 */
public class Student extends BaseEntity {

    private String studentId = "";
    private String name = "";
    private String email = "";
    private String grade = "";
    private String section = "";
    private LocalDateTime enrollmentDate;
    private StudentStatus status = StudentStatus.ACTIVE;

    private String avatarUrl;
    private String phoneNumber;
    private String address;
    private LocalDate dateOfBirth;
    private String emergencyContact;
    private String notes;

    // -----------------------------------------------------------------------
    // CONSTRUCTORS
    // -----------------------------------------------------------------------

    public Student() {
    }

    /**
     * Convenience constructor for the required business fields.
     *
     * @param studentId business identifier
     * @param name      full name
     * @param email     email address
     * @param grade     grade level
     * @param section   class section
     */
    public Student(String studentId, String name, String email, String grade, String section) {
        setStudentId(studentId);
        setName(name);
        setEmail(email);
        setGrade(grade);
        setSection(section);
    }

    // -----------------------------------------------------------------------
    // GETTERS
    // -----------------------------------------------------------------------

    public String getStudentId()           { return studentId; }

    public String getName()                { return name; }

    public String getEmail()               { return email; }

    public String getGrade()               { return grade; }

    public String getSection()             { return section; }

    public LocalDateTime getEnrollmentDate() { return enrollmentDate; }

    public StudentStatus getStatus()       { return status; }

    public String getAvatarUrl()           { return avatarUrl; }

    public String getPhoneNumber()         { return phoneNumber; }

    public String getAddress()             { return address; }

    public LocalDate getDateOfBirth()      { return dateOfBirth; }

    public String getEmergencyContact()    { return emergencyContact; }

    public String getNotes()               { return notes; }

    // -----------------------------------------------------------------------
    // SETTERS
    // -----------------------------------------------------------------------

    public void setStudentId(String studentId) {
        this.studentId = studentId == null ? "" : studentId.trim();
    }

    public void setName(String name) {
        this.name = name == null ? "" : name.trim();
    }

    public void setEmail(String email) {
        this.email = email == null ? "" : email.trim().toLowerCase();
    }

    public void setGrade(String grade) {
        this.grade = grade == null ? "" : grade.trim();
    }

    public void setSection(String section) {
        this.section = section == null ? "" : section.trim();
    }

    public void setEnrollmentDate(LocalDateTime enrollmentDate) {
        this.enrollmentDate = enrollmentDate;
    }

    /** @param status enrollment status; {@code null} falls back to {@code ACTIVE} */
    public void setStatus(StudentStatus status) {
        this.status = status == null ? StudentStatus.ACTIVE : status;
    }

    public void setAvatarUrl(String avatarUrl)               { this.avatarUrl = avatarUrl; }

    public void setPhoneNumber(String phoneNumber)           { this.phoneNumber = phoneNumber; }

    public void setAddress(String address)                   { this.address = address; }

    public void setDateOfBirth(LocalDate dateOfBirth)        { this.dateOfBirth = dateOfBirth; }

    public void setEmergencyContact(String emergencyContact) { this.emergencyContact = emergencyContact; }

    public void setNotes(String notes)                       { this.notes = notes; }

    @Override
    public String toString() {
        return "Student{id=" + getId()
               + ", studentId='" + studentId + '\''
               + ", name='" + name + '\''
               + ", grade='" + grade + '\''
               + ", section='" + section + '\''
               + ", status=" + status
               + ", deleted=" + isDeleted()
               + '}';
    }
}
