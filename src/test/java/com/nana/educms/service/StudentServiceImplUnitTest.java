package com.nana.educms.service;

import com.nana.educms.domain.Student;
import com.nana.educms.domain.StudentStatus;
import com.nana.educms.repository.Repository;
import com.nana.educms.repository.UnitOfWork;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Service guard paths checked against a mocked unit of work, so no store
 * access is possible unless the test allows it.
 */
@ExtendWith(MockitoExtension.class)
class StudentServiceImplUnitTest {

    @Mock
    private UnitOfWork unitOfWork;

    @Mock
    private Repository<Student> repository;

    private StudentServiceImpl service;

    @BeforeEach
    void setUp() {
        lenient().when(unitOfWork.students()).thenReturn(repository);
        service = new StudentServiceImpl(unitOfWork,
                Clock.fixed(Instant.parse("2024-06-15T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Constructing without a unit of work or clock is rejected")
    void constructor_nullArguments_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new StudentServiceImpl(null));
        assertThrows(IllegalArgumentException.class, () -> new StudentServiceImpl(unitOfWork, null));
    }

    @Test
    @DisplayName("A blank student id lookup never reaches the repository")
    void blankLookup_noRepositoryAccess() {
        assertTrue(service.getStudentByStudentId("   ").isEmpty());
        verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("Deleting an unknown id saves nothing")
    void deleteUnknown_noSave() {
        UUID id = UUID.randomUUID();
        when(repository.getById(id)).thenReturn(Optional.empty());

        assertFalse(service.deleteStudent(id));
        verify(repository, never()).softDelete(any(Student.class));
        verify(unitOfWork, never()).saveChanges();
    }

    @Test
    @DisplayName("A failed validation stages nothing and saves nothing")
    @SuppressWarnings("unchecked")
    void createConflict_nothingStaged() {
        when(repository.any(any(Predicate.class))).thenReturn(true);

        Student s = new Student("STU001", "Ama", "ama@school.edu", "10", "A");
        ValidationException ex = assertThrows(ValidationException.class, () -> service.createStudent(s));

        assertEquals("Student ID must be unique.", ex.getError("studentId"));
        assertEquals("Email must be unique.", ex.getError("email"));
        verify(repository, times(2)).any(any(Predicate.class));
        verify(repository, never()).add(any(Student.class));
        verify(unitOfWork, never()).saveChanges();
    }

    @Test
    @DisplayName("A field error skips the uniqueness query for that field")
    @SuppressWarnings("unchecked")
    void createInvalidFields_skipsUniquenessQueries() {
        Student s = new Student("", "Ama", "", "10", "A");

        ValidationException ex = assertThrows(ValidationException.class, () -> service.createStudent(s));

        assertTrue(ex.hasError("studentId"));
        assertTrue(ex.hasError("email"));
        verify(repository, never()).any(any(Predicate.class));
    }

    @Test
    @DisplayName("A valid create stages the student and saves once")
    void createValid_stagesAndSaves() throws ValidationException {
        Student s = new Student("STU001", "Ama", "ama@school.edu", "10", "A");
        when(repository.add(s)).thenReturn(s);

        assertSame(s, service.createStudent(s));

        verify(repository).add(s);
        verify(unitOfWork, times(1)).saveChanges();
    }

    @Test
    @DisplayName("An oversized avatar URL is rejected before any lookup")
    void avatarTooLong_rejectedBeforeLookup() {
        assertThrows(IllegalArgumentException.class,
                () -> service.updateStudentAvatar(UUID.randomUUID(), "x".repeat(501)));
        verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("updateStudent with null arguments is a programming error")
    void updateNullArguments_rejected() {
        Student s = new Student("STU001", "Ama", "ama@school.edu", "10", "A");
        assertThrows(IllegalArgumentException.class, () -> service.updateStudent(null, s));
        assertThrows(IllegalArgumentException.class, () -> service.updateStudent(UUID.randomUUID(), null));
        verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("The filter matches only when every supplied condition holds")
    void buildFilter_combinesConditions() {
        Student s = new Student("STU001", "Ama Owusu", "ama@school.edu", "10", "A");
        s.setStatus(StudentStatus.INACTIVE);

        assertTrue(StudentServiceImpl.buildFilter(null, null, null).test(s));
        assertTrue(StudentServiceImpl.buildFilter("OWUSU", "10", StudentStatus.INACTIVE).test(s));
        assertFalse(StudentServiceImpl.buildFilter("owusu", "10", StudentStatus.ACTIVE).test(s));
        assertFalse(StudentServiceImpl.buildFilter("owusu", "11", null).test(s));
        assertFalse(StudentServiceImpl.buildFilter("kofi", null, null).test(s));
    }
}
