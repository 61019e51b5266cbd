package com.nana.educms.repository;

import com.nana.educms.domain.Student;
import com.nana.educms.domain.StudentStatus;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Maps {@link Student} to the {@code students} table.
 *
 * <p>Status is stored as the enum constant name and read back through
 * {@link StudentStatus#fromString(String)}, which never throws.
 */
public class StudentMapping extends EntityMapping<Student> {

    public StudentMapping() {
        super(Student.class, "students",
                "student_id", "name", "email", "grade", "section",
                "enrollment_date", "status", "avatar_url", "phone_number",
                "address", "date_of_birth", "emergency_contact", "notes");
    }

    @Override
    protected Student newInstance() {
        return new Student();
    }

    /** A student added without an enrollment date is enrolled at its creation time. */
    @Override
    protected void applyDefaults(Student s) {
        if (s.getEnrollmentDate() == null) {
            s.setEnrollmentDate(s.getCreatedAt());
        }
    }

    @Override
    protected int bindColumns(PreparedStatement ps, Student s, int i) throws SQLException {
        ps.setString(i++, s.getStudentId());
        ps.setString(i++, s.getName());
        ps.setString(i++, s.getEmail());
        ps.setString(i++, s.getGrade());
        ps.setString(i++, s.getSection());
        setTimestamp(ps, i++, s.getEnrollmentDate());
        ps.setString(i++, s.getStatus().name());
        ps.setString(i++, s.getAvatarUrl());
        ps.setString(i++, s.getPhoneNumber());
        ps.setString(i++, s.getAddress());
        setDate(ps, i++, s.getDateOfBirth());
        ps.setString(i++, s.getEmergencyContact());
        ps.setString(i++, s.getNotes());
        return i;
    }

    @Override
    protected void readColumns(ResultSet rs, Student s) throws SQLException {
        s.setStudentId(rs.getString("student_id"));
        s.setName(rs.getString("name"));
        s.setEmail(rs.getString("email"));
        s.setGrade(rs.getString("grade"));
        s.setSection(rs.getString("section"));
        s.setEnrollmentDate(readTimestamp(rs, "enrollment_date"));
        s.setStatus(StudentStatus.fromString(rs.getString("status")));
        s.setAvatarUrl(rs.getString("avatar_url"));
        s.setPhoneNumber(rs.getString("phone_number"));
        s.setAddress(rs.getString("address"));
        s.setDateOfBirth(readDate(rs, "date_of_birth"));
        s.setEmergencyContact(rs.getString("emergency_contact"));
        s.setNotes(rs.getString("notes"));
    }
}
