package com.nana.educms.service;

import com.nana.educms.domain.StudentStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * StudentStatistics — Immutable Aggregate Value Object
 *
 * <p>Headline numbers over all non-deleted students, computed by
 * {@link StudentService#getStudentStatistics()} in one pass.
 *
 * <p>MAPS:
 * <ul>
 *   <li>{@link #getStudentsByGrade()}: grade → count, grades in ascending
 *       order;</li>
 *   <li>{@link #getStudentsByStatus()}: status display name → count, only
 *       statuses that occur, in declaration order of {@link StudentStatus}.</li>
 * </ul>
 *
 * <p>Both maps are unmodifiable. Construct through {@link Builder}.
 */
public final class StudentStatistics {

    private final int totalStudents;
    private final Map<StudentStatus, Integer> statusCounts;
    private final Map<String, Integer> studentsByGrade;
    private final Map<String, Integer> studentsByStatus;
    private final int newStudentsThisMonth;
    private final int newStudentsThisYear;

    private StudentStatistics(Builder builder) {
        this.totalStudents        = builder.totalStudents;
        this.statusCounts         = Collections.unmodifiableMap(new EnumMap<>(builder.statusCounts));
        this.studentsByGrade      = Collections.unmodifiableMap(new LinkedHashMap<>(builder.studentsByGrade));
        this.newStudentsThisMonth = builder.newStudentsThisMonth;
        this.newStudentsThisYear  = builder.newStudentsThisYear;

        Map<String, Integer> byStatus = new LinkedHashMap<>();
        for (StudentStatus status : StudentStatus.values()) {
            Integer count = builder.statusCounts.get(status);
            if (count != null && count > 0) {
                byStatus.put(status.getDisplayName(), count);
            }
        }
        this.studentsByStatus = Collections.unmodifiableMap(byStatus);
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public int getTotalStudents()       { return totalStudents; }

    public int getActiveStudents()      { return countOf(StudentStatus.ACTIVE); }

    public int getInactiveStudents()    { return countOf(StudentStatus.INACTIVE); }

    public int getSuspendedStudents()   { return countOf(StudentStatus.SUSPENDED); }

    public int getGraduatedStudents()   { return countOf(StudentStatus.GRADUATED); }

    public int getTransferredStudents() { return countOf(StudentStatus.TRANSFERRED); }

    public int getWithdrawnStudents()   { return countOf(StudentStatus.WITHDRAWN); }

    /** @return the number of students with {@code status}; 0 when none */
    public int countOf(StudentStatus status) {
        Integer count = statusCounts.get(status);
        return count == null ? 0 : count;
    }

    public Map<String, Integer> getStudentsByGrade()  { return studentsByGrade; }

    public Map<String, Integer> getStudentsByStatus() { return studentsByStatus; }

    /** @return students enrolled on or after the first instant of the current UTC month */
    public int getNewStudentsThisMonth() { return newStudentsThisMonth; }

    /** @return students enrolled on or after the first instant of the current UTC year */
    public int getNewStudentsThisYear()  { return newStudentsThisYear; }

    @Override
    public String toString() {
        return "StudentStatistics{total=" + totalStudents
                + ", byStatus=" + studentsByStatus
                + ", byGrade=" + studentsByGrade
                + ", newThisMonth=" + newStudentsThisMonth
                + ", newThisYear=" + newStudentsThisYear + "}";
    }

    // -----------------------------------------------------------------------
    // BUILDER
    // -----------------------------------------------------------------------

    public static final class Builder {

        private int totalStudents;
        private final Map<StudentStatus, Integer> statusCounts = new EnumMap<>(StudentStatus.class);
        private final Map<String, Integer> studentsByGrade = new TreeMap<>();
        private int newStudentsThisMonth;
        private int newStudentsThisYear;

        public Builder totalStudents(int totalStudents) {
            this.totalStudents = totalStudents;
            return this;
        }

        public Builder incrementStatus(StudentStatus status) {
            statusCounts.merge(status, 1, Integer::sum);
            return this;
        }

        public Builder incrementGrade(String grade) {
            studentsByGrade.merge(grade, 1, Integer::sum);
            return this;
        }

        public Builder newStudentsThisMonth(int count) {
            this.newStudentsThisMonth = count;
            return this;
        }

        public Builder newStudentsThisYear(int count) {
            this.newStudentsThisYear = count;
            return this;
        }

        public StudentStatistics build() {
            return new StudentStatistics(this);
        }
    }
}
