package com.nana.educms.util;

import com.nana.educms.MutableClock;
import com.nana.educms.TestDatabase;
import com.nana.educms.domain.Announcement;
import com.nana.educms.domain.AnnouncementPriority;
import com.nana.educms.domain.Student;
import com.nana.educms.repository.JdbcUnitOfWorkFactory;
import com.nana.educms.repository.UnitOfWork;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SampleDataLoaderTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 15, 10, 0);

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private JdbcUnitOfWorkFactory factory;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-06-15T10:00:00Z");
        factory = TestDatabase.factory(tempDir, clock);
    }

    @Test
    @DisplayName("An empty store receives two students and one announcement")
    void emptyStore_loaded() {
        try (UnitOfWork unitOfWork = factory.create()) {
            assertTrue(SampleDataLoader.loadIfEmpty(unitOfWork, clock));
            assertFalse(unitOfWork.hasActiveTransaction());
        }

        try (UnitOfWork unitOfWork = factory.create()) {
            Student john = unitOfWork.students()
                    .findFirst(s -> s.getStudentId().equals("STU001")).orElseThrow();
            assertEquals("John Doe", john.getName());
            assertEquals("john.doe@school.edu", john.getEmail());
            assertEquals(NOW.minusMonths(6), john.getEnrollmentDate());

            Student jane = unitOfWork.students()
                    .findFirst(s -> s.getStudentId().equals("STU002")).orElseThrow();
            assertEquals("11", jane.getGrade());
            assertEquals("B", jane.getSection());

            List<Announcement> announcements = unitOfWork.announcements().getAll();
            assertEquals(1, announcements.size());
            Announcement welcome = announcements.get(0);
            assertEquals("Welcome to the New Academic Year", welcome.getTitle());
            assertEquals(AnnouncementPriority.HIGH, welcome.getPriority());
            assertTrue(welcome.isPublished());
            assertEquals(NOW.minusDays(7), welcome.getPublishDate());
            assertEquals(2, unitOfWork.students().count());
        }
    }

    @Test
    @DisplayName("A second load finds data and does nothing")
    void secondLoad_skipped() {
        try (UnitOfWork unitOfWork = factory.create()) {
            assertTrue(SampleDataLoader.loadIfEmpty(unitOfWork, clock));
        }
        try (UnitOfWork unitOfWork = factory.create()) {
            assertFalse(SampleDataLoader.loadIfEmpty(unitOfWork, clock));
            assertEquals(2, unitOfWork.students().count());
            assertEquals(1, unitOfWork.announcements().count());
        }
    }

    @Test
    @DisplayName("Any existing student blocks the load")
    void existingStudent_skipped() {
        try (UnitOfWork unitOfWork = factory.create()) {
            unitOfWork.students().add(new Student("STU900", "Existing", "existing@school.edu", "9", "A"));
            unitOfWork.saveChanges();

            assertFalse(SampleDataLoader.loadIfEmpty(unitOfWork, clock));
            assertEquals(1, unitOfWork.students().count());
            assertEquals(0, unitOfWork.announcements().count());
        }
    }

    @Test
    @DisplayName("Soft-deleted records neither block the load nor hold their email")
    void softDeletedOnly_loaded() {
        try (UnitOfWork unitOfWork = factory.create()) {
            Student holder = new Student("STU777", "Holder", "jane.smith@school.edu", "9", "A");
            unitOfWork.students().add(holder);
            unitOfWork.saveChanges();
            unitOfWork.students().softDelete(holder);
            unitOfWork.saveChanges();
        }

        try (UnitOfWork unitOfWork = factory.create()) {
            assertTrue(SampleDataLoader.loadIfEmpty(unitOfWork, clock));
            assertEquals(2, unitOfWork.students().count());
        }
    }
}
