package com.nana.educms.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class StudentTest {

    @Nested
    @DisplayName("Student field normalisation")
    class NormalisationTests {

        @Test
        @DisplayName("Required strings are trimmed and email is lower-cased")
        void constructor_trimsAndLowercases() {
            Student s = new Student("  STU001 ", " John Doe ", " John.Doe@School.EDU ", " 10", "A ");

            assertEquals("STU001", s.getStudentId());
            assertEquals("John Doe", s.getName());
            assertEquals("john.doe@school.edu", s.getEmail());
            assertEquals("10", s.getGrade());
            assertEquals("A", s.getSection());
        }

        @Test
        @DisplayName("Null required strings become empty strings")
        void nullRequiredFields_becomeEmpty() {
            Student s = new Student(null, null, null, null, null);

            assertEquals("", s.getStudentId());
            assertEquals("", s.getName());
            assertEquals("", s.getEmail());
        }

        @Test
        @DisplayName("Status is ACTIVE by default and never null")
        void status_neverNull() {
            Student s = new Student();
            assertEquals(StudentStatus.ACTIVE, s.getStatus());

            s.setStatus(null);
            assertEquals(StudentStatus.ACTIVE, s.getStatus());
        }
    }

    @Nested
    @DisplayName("StudentStatus Enum Tests")
    class StudentStatusTests {

        @ParameterizedTest
        @CsvSource({
                "ACTIVE, ACTIVE",
                "active, ACTIVE",
                "Graduated, GRADUATED",
                "TRANSFERRED, TRANSFERRED",
                "' withdrawn ', WITHDRAWN"
        })
        @DisplayName("fromString accepts names and display names, ignoring case")
        void fromString_knownValues(String input, StudentStatus expected) {
            assertEquals(expected, StudentStatus.fromString(input));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "ENROLLED"})
        @DisplayName("fromString returns safe default ACTIVE for unrecognised value")
        void fromString_unknown_returnsActive(String input) {
            assertEquals(StudentStatus.ACTIVE, StudentStatus.fromString(input));
        }

        @Test
        @DisplayName("fromString returns ACTIVE for null input")
        void fromString_null_returnsActive() {
            assertEquals(StudentStatus.ACTIVE, StudentStatus.fromString(null));
        }

        @Test
        @DisplayName("toString returns enum name (for DB storage)")
        void toString_returnsEnumName() {
            assertEquals("SUSPENDED", StudentStatus.SUSPENDED.toString());
            assertEquals("Suspended", StudentStatus.SUSPENDED.getDisplayName());
        }
    }
}
