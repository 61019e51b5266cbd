package com.nana.educms.util;

import com.nana.educms.domain.Student;

import java.time.format.DateTimeFormatter;
import java.util.function.Function;

/**
 * CsvColumn — Student Export Column Enumeration
 *
 * <p>Each constant is one column of the student export: it carries its header
 * and knows how to extract its value from a {@link Student}. The exporter
 * just walks {@link #exportColumns()} in order and calls
 * {@link #extract(Student)}; there is no per-column switch anywhere.
 *
 * <p>Extractors return raw values. Quoting is the exporter's job.
 */
public enum CsvColumn {

    STUDENT_ID("Student ID", Student::getStudentId),

    NAME("Name", Student::getName),

    EMAIL("Email", Student::getEmail),

    GRADE("Grade", Student::getGrade),

    SECTION("Section", Student::getSection),

    /** Display name, e.g. "Active", not the stored constant. */
    STATUS("Status", student -> student.getStatus().getDisplayName()),

    /** Calendar date only, {@code yyyy-MM-dd}. */
    ENROLLMENT_DATE("Enrollment Date", student -> student.getEnrollmentDate() == null
            ? ""
            : student.getEnrollmentDate().format(DateTimeFormatter.ISO_LOCAL_DATE)),

    PHONE("Phone", Student::getPhoneNumber),

    ADDRESS("Address", Student::getAddress);

    private final String headerName;
    private final Function<Student, String> extractor;

    CsvColumn(String headerName, Function<Student, String> extractor) {
        this.headerName = headerName;
        this.extractor  = extractor;
    }

    public String getHeaderName() {
        return headerName;
    }

    /**
     * @param student the student to read from
     * @return the raw value; never null (absent optional fields give "")
     */
    public String extract(Student student) {
        if (student == null) return "";
        String value = extractor.apply(student);
        return value == null ? "" : value;
    }

    @Override
    public String toString() {
        return headerName;
    }

    /** @return the fixed column order of the student export */
    public static CsvColumn[] exportColumns() {
        return values();
    }
}
