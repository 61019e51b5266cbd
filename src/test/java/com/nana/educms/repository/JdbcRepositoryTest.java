package com.nana.educms.repository;

import com.nana.educms.MutableClock;
import com.nana.educms.TestDatabase;
import com.nana.educms.domain.Announcement;
import com.nana.educms.domain.AnnouncementAttachment;
import com.nana.educms.domain.Student;
import com.nana.educms.repository.Repository.RepositoryException;
import com.nana.educms.util.DatabaseManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Repository behaviour against a real SQLite file.
 */
class JdbcRepositoryTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 6, 15, 10, 0);

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private DatabaseManager databaseManager;
    private JdbcUnitOfWorkFactory factory;
    private UnitOfWork unitOfWork;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-06-15T10:00:00Z");
        databaseManager = TestDatabase.create(tempDir);
        factory = new JdbcUnitOfWorkFactory(databaseManager, clock, IdGenerator.random());
        unitOfWork = factory.create();
    }

    @AfterEach
    void tearDown() {
        unitOfWork.close();
    }

    private static Student student(String studentId, String name, String grade) {
        return new Student(studentId, name, studentId.toLowerCase() + "@school.edu", grade, "A");
    }

    private Student saved(String studentId, String name, String grade) {
        Student s = unitOfWork.students().add(student(studentId, name, grade));
        unitOfWork.saveChanges();
        return s;
    }

    /** Reads the raw soft-delete columns, bypassing every repository filter. */
    private boolean storedDeletedFlag(UUID id) throws SQLException {
        try (Connection c = databaseManager.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT is_deleted FROM students WHERE id = ?")) {
            ps.setString(1, id.toString());
            try (ResultSet rs = ps.executeQuery()) {
                assertTrue(rs.next(), "row should still exist");
                return rs.getInt(1) == 1;
            }
        }
    }

    // ======================================================================
    // ADD / UPDATE
    // ======================================================================

    @Nested
    @DisplayName("Add and update timestamps")
    class AddUpdateTests {

        @Test
        @DisplayName("add assigns a fresh id and createdAt == updatedAt, overwriting caller values")
        void add_assignsIdAndTimestamps() {
            Student s = student("STU001", "John Doe", "10");
            UUID callerId = UUID.randomUUID();
            s.setId(callerId);
            s.setCreatedAt(T0.minusYears(3));
            s.setUpdatedAt(T0.minusYears(3));

            Student added = unitOfWork.students().add(s);

            assertNotNull(added.getId());
            assertNotEquals(callerId, added.getId());
            assertEquals(T0, added.getCreatedAt());
            assertEquals(added.getCreatedAt(), added.getUpdatedAt());
            assertFalse(added.isDeleted());
        }

        @Test
        @DisplayName("update keeps createdAt and moves updatedAt forward, durably")
        void update_refreshesUpdatedAtOnly() {
            Student s = saved("STU001", "John Doe", "10");

            clock.advance(Duration.ofMinutes(5));
            s.setName("John Q. Doe");
            unitOfWork.students().update(s);
            unitOfWork.saveChanges();

            try (UnitOfWork other = factory.create()) {
                Student reloaded = other.students().getById(s.getId()).orElseThrow();
                assertEquals("John Q. Doe", reloaded.getName());
                assertEquals(T0, reloaded.getCreatedAt());
                assertEquals(T0.plusMinutes(5), reloaded.getUpdatedAt());
                assertTrue(reloaded.getUpdatedAt().isAfter(reloaded.getCreatedAt()));
            }
        }

        @Test
        @DisplayName("update with a detached copy keeps the stored createdAt")
        void update_detachedCopy_keepsCreatedAt() {
            Student s = saved("STU001", "John Doe", "10");

            Student copy = student("STU001", "Johnny Doe", "10");
            copy.setId(s.getId());
            copy.setCreatedAt(T0.minusYears(1));
            clock.advance(Duration.ofMinutes(1));
            unitOfWork.students().update(copy);
            unitOfWork.saveChanges();

            try (UnitOfWork other = factory.create()) {
                Student reloaded = other.students().getById(s.getId()).orElseThrow();
                assertEquals("Johnny Doe", reloaded.getName());
                assertEquals(T0, reloaded.getCreatedAt());
            }
        }

        @Test
        @DisplayName("Null entities are rejected by every write")
        void nullEntity_throwsIllegalArgument() {
            Repository<Student> repo = unitOfWork.students();
            assertThrows(IllegalArgumentException.class, () -> repo.add(null));
            assertThrows(IllegalArgumentException.class, () -> repo.update(null));
            assertThrows(IllegalArgumentException.class, () -> repo.delete((Student) null));
            assertThrows(IllegalArgumentException.class, () -> repo.softDelete((Student) null));
            assertThrows(IllegalArgumentException.class, () -> repo.addRange(null));
        }

        @Test
        @DisplayName("update of a never-added entity is rejected")
        void update_unsavedEntity_throws() {
            Student s = student("STU001", "John Doe", "10");
            assertThrows(IllegalArgumentException.class, () -> unitOfWork.students().update(s));
        }

        @Test
        @DisplayName("Adding the same tracked instance twice is rejected")
        void add_sameInstanceTwice_throws() {
            Student s = unitOfWork.students().add(student("STU001", "John Doe", "10"));
            assertThrows(IllegalArgumentException.class, () -> unitOfWork.students().add(s));
        }

        @Test
        @DisplayName("addRange with a null element stages nothing")
        void addRange_withNullElement_stagesNothing() {
            List<Student> batch = Arrays.asList(student("STU001", "John Doe", "10"), null);

            assertThrows(IllegalArgumentException.class, () -> unitOfWork.students().addRange(batch));
            assertEquals(0, unitOfWork.students().count());
        }

        @Test
        @DisplayName("addRange stages every entity for one save")
        void addRange_stagesAll() {
            unitOfWork.students().addRange(List.of(
                    student("STU001", "John Doe", "10"),
                    student("STU002", "Jane Smith", "11")));

            assertEquals(2, unitOfWork.saveChanges());
            try (UnitOfWork other = factory.create()) {
                assertEquals(2, other.students().count());
            }
        }

        @Test
        @DisplayName("Updating a row removed by another unit fails at save")
        void update_rowGoneFromStore_failsAtSave() {
            Student s = saved("STU001", "John Doe", "10");
            try (UnitOfWork other = factory.create()) {
                other.students().delete(s.getId());
                other.saveChanges();
            }

            s.setName("Ghost");
            unitOfWork.students().update(s);
            RepositoryException ex = assertThrows(RepositoryException.class, unitOfWork::saveChanges);
            assertTrue(ex.getMessage().startsWith("Update affected 0 rows"));
        }
    }

    // ======================================================================
    // SOFT DELETE / HARD DELETE
    // ======================================================================

    @Nested
    @DisplayName("Soft and hard delete")
    class DeleteTests {

        @Test
        @DisplayName("softDelete hides the entity from default reads but keeps the row")
        void softDelete_hidesFromReads() throws SQLException {
            Student s = saved("STU001", "John Doe", "10");

            clock.advance(Duration.ofMinutes(1));
            unitOfWork.students().softDelete(s);
            unitOfWork.saveChanges();

            assertTrue(s.isDeleted());
            assertEquals(T0.plusMinutes(1), s.getDeletedAt());
            assertEquals(T0.plusMinutes(1), s.getUpdatedAt());
            assertTrue(unitOfWork.students().getById(s.getId()).isEmpty());
            assertEquals(0, unitOfWork.students().count());

            try (UnitOfWork other = factory.create()) {
                assertTrue(other.students().getById(s.getId()).isEmpty());
                assertTrue(other.students().getAll().isEmpty());
            }
            assertTrue(storedDeletedFlag(s.getId()));
        }

        @Test
        @DisplayName("A filter-bypassing read still returns a soft-deleted entity")
        void softDelete_bypassingReadFindsIt() throws SQLException {
            Student s = saved("STU001", "John Doe", "10");
            unitOfWork.students().softDelete(s.getId());
            unitOfWork.saveChanges();

            StudentMapping mapping = new StudentMapping();
            try (PersistenceContext context = new PersistenceContext(
                    databaseManager.openConnection(), clock, IdGenerator.random())) {
                assertTrue(context.find(mapping, s.getId(), false).isEmpty());
                Optional<Student> bypassed = context.find(mapping, s.getId(), true);
                assertTrue(bypassed.isPresent());
                assertTrue(bypassed.get().isDeleted());
                assertNotNull(bypassed.get().getDeletedAt());
                assertEquals(1, context.query(mapping, true).size());
                assertEquals(0, context.query(mapping, false).size());
            }
        }

        @Test
        @DisplayName("softDelete(id) on an already-deleted row keeps deletedAt and refreshes updatedAt")
        void softDeleteById_repeated_isIdempotent() throws SQLException {
            Student s = saved("STU001", "John Doe", "10");
            unitOfWork.students().softDelete(s.getId());
            unitOfWork.saveChanges();

            clock.advance(Duration.ofHours(1));
            try (UnitOfWork other = factory.create()) {
                other.students().softDelete(s.getId());
                other.saveChanges();
            }

            StudentMapping mapping = new StudentMapping();
            try (UnitOfWork check = factory.create();
                 PersistenceContext context = new PersistenceContext(
                         databaseManager.openConnection(), clock, IdGenerator.random())) {
                Student stored = context.find(mapping, s.getId(), true).orElseThrow();
                assertEquals(T0, stored.getDeletedAt());
                assertEquals(T0.plusHours(1), stored.getUpdatedAt());
                assertTrue(check.students().getById(s.getId()).isEmpty());
            }
        }

        @Test
        @DisplayName("softDelete(id) and delete(id) of an unknown id do nothing")
        void byId_unknown_noOp() {
            unitOfWork.students().softDelete(UUID.randomUUID());
            unitOfWork.students().delete(UUID.randomUUID());
            assertEquals(0, unitOfWork.saveChanges());
        }

        @Test
        @DisplayName("delete(id) removes the row physically")
        void deleteById_removesRow() throws SQLException {
            Student s = saved("STU001", "John Doe", "10");
            unitOfWork.students().delete(s.getId());
            assertEquals(1, unitOfWork.saveChanges());

            try (Connection c = databaseManager.openConnection();
                 PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM students");
                 ResultSet rs = ps.executeQuery()) {
                assertTrue(rs.next());
                assertEquals(0, rs.getInt(1));
            }
        }

        @Test
        @DisplayName("Deleting a staged, unsaved entity simply forgets it")
        void delete_stagedEntity_neverWritten() {
            Student s = unitOfWork.students().add(student("STU001", "John Doe", "10"));
            unitOfWork.students().delete(s);

            assertEquals(0, unitOfWork.saveChanges());
            assertEquals(0, unitOfWork.students().count());
        }

        @Test
        @DisplayName("Hard-deleting an announcement cascades to its attachments")
        void deleteAnnouncement_cascadesToAttachments() {
            Announcement a = new Announcement();
            a.setTitle("Exam timetable");
            a.setContent("See attached.");
            unitOfWork.announcements().add(a);
            unitOfWork.announcementAttachments().add(new AnnouncementAttachment(
                    a.getId(), "timetable.pdf", "/files/timetable.pdf", "application/pdf", 2048));
            unitOfWork.saveChanges();

            try (UnitOfWork other = factory.create()) {
                other.announcements().delete(a.getId());
                other.saveChanges();
                assertEquals(0, other.announcementAttachments().count());
            }
        }
    }

    // ======================================================================
    // PAGING
    // ======================================================================

    @Nested
    @DisplayName("Paging")
    class PagingTests {

        private List<Student> seed(int count) {
            List<Student> added = new ArrayList<>();
            for (int i = 1; i <= count; i++) {
                added.add(unitOfWork.students().add(
                        student(String.format("STU%03d", i), "Student " + i, i % 3 == 0 ? "11" : "10")));
                clock.advance(Duration.ofSeconds(1));
            }
            unitOfWork.saveChanges();
            return added;
        }

        @Test
        @DisplayName("Default order is newest first and pages concatenate to the full set")
        void defaultOrdering_pagesConcatenate() {
            seed(23);

            try (UnitOfWork other = factory.create()) {
                Repository<Student> repo = other.students();
                PagedResult<Student> first = repo.getPaged(1, 5);
                assertEquals(23, first.getTotalCount());
                assertEquals(5, first.getTotalPages());
                assertEquals("STU023", first.getItems().get(0).getStudentId());
                assertFalse(first.hasPreviousPage());
                assertTrue(first.hasNextPage());

                List<UUID> concatenated = new ArrayList<>();
                for (int page = 1; page <= first.getTotalPages(); page++) {
                    PagedResult<Student> result = repo.getPaged(page, 5);
                    assertEquals(23, result.getTotalCount());
                    result.getItems().forEach(s -> concatenated.add(s.getId()));
                }

                List<UUID> expected = repo.getAll().stream()
                        .sorted(Comparator.comparing(Student::getCreatedAt).reversed())
                        .map(Student::getId)
                        .collect(Collectors.toList());
                assertEquals(expected, concatenated);
                assertEquals(3, repo.getPaged(5, 5).getItems().size());
                assertFalse(repo.getPaged(5, 5).hasNextPage());
            }
        }

        @Test
        @DisplayName("Total count is over the filtered set, and filtered pages match find()")
        void filteredOrderedPaging() {
            seed(23);
            Comparator<Student> byStudentId = Comparator.comparing(Student::getStudentId);

            Repository<Student> repo = unitOfWork.students();
            List<Student> expected = repo.find(s -> s.getGrade().equals("10"));
            expected.sort(byStudentId);

            List<Student> concatenated = new ArrayList<>();
            PagedResult<Student> page;
            int pageNumber = 1;
            do {
                page = repo.getPaged(pageNumber++, 4, s -> s.getGrade().equals("10"), byStudentId);
                assertEquals(expected.size(), page.getTotalCount());
                concatenated.addAll(page.getItems());
            } while (page.hasNextPage());

            assertEquals(16, expected.size());
            assertEquals(4, page.getTotalPages());
            assertEquals(expected, concatenated);
        }

        @ParameterizedTest(name = "getPaged({0}, {1}) -> page {2}, size {3}")
        @CsvSource({
                "0,    5,   1, 5",
                "-3,   5,   1, 5",
                "1,    0,   1, 10",
                "1,   -1,   1, 10",
                "1,  500,   1, 100",
                "2,  100,   2, 100"
        })
        @DisplayName("Page number and size are clamped")
        void clamping(int pageNumber, int pageSize, int expectedPage, int expectedSize) {
            seed(3);
            PagedResult<Student> result = unitOfWork.students().getPaged(pageNumber, pageSize);
            assertEquals(expectedPage, result.getPageNumber());
            assertEquals(expectedSize, result.getPageSize());
            assertEquals(3, result.getTotalCount());
        }

        @Test
        @DisplayName("A page beyond the end is empty but keeps the total")
        void pageBeyondEnd_isEmpty() {
            seed(3);
            PagedResult<Student> result = unitOfWork.students().getPaged(9, 10);
            assertTrue(result.getItems().isEmpty());
            assertEquals(3, result.getTotalCount());
        }
    }

    // ======================================================================
    // QUERIES / READ-YOUR-WRITES
    // ======================================================================

    @Nested
    @DisplayName("Queries and read-your-writes")
    class QueryTests {

        @Test
        @DisplayName("Staged adds are visible to reads in the same unit only")
        void stagedAdd_visibleInSameUnit() {
            Student s = unitOfWork.students().add(student("STU001", "John Doe", "10"));

            assertEquals(1, unitOfWork.students().count());
            assertTrue(unitOfWork.students().any(x -> x.getStudentId().equals("STU001")));
            assertSame(s, unitOfWork.students().getById(s.getId()).orElseThrow());

            try (UnitOfWork other = factory.create()) {
                assertEquals(0, other.students().count());
            }
        }

        @Test
        @DisplayName("Staged changes in one repository are seen from another in the same unit")
        void crossRepository_readYourWrites() {
            Announcement a = new Announcement();
            a.setTitle("Sports day");
            a.setContent("Friday.");
            unitOfWork.announcements().add(a);
            unitOfWork.announcementAttachments().add(new AnnouncementAttachment(
                    a.getId(), "map.png", "/files/map.png", "image/png", 512));

            List<AnnouncementAttachment> attachments = unitOfWork.announcementAttachments()
                    .find(att -> att.getAnnouncementId().equals(a.getId()));
            assertEquals(1, attachments.size());
            assertTrue(unitOfWork.announcements().getById(a.getId()).isPresent());

            unitOfWork.saveChanges();
            try (UnitOfWork other = factory.create()) {
                assertEquals(1, other.announcementAttachments()
                        .count(att -> att.getAnnouncementId().equals(a.getId())));
            }
        }

        @Test
        @DisplayName("A staged soft delete is reflected by reads before saving")
        void stagedSoftDelete_hiddenBeforeSave() {
            Student s = saved("STU001", "John Doe", "10");
            unitOfWork.students().softDelete(s);

            assertTrue(unitOfWork.students().getById(s.getId()).isEmpty());
            assertEquals(0, unitOfWork.students().count());
        }

        @Test
        @DisplayName("Reads return the tracked instance so staged edits are visible")
        void identityMap_returnsTrackedInstance() {
            Student s = saved("STU001", "John Doe", "10");
            Student loaded = unitOfWork.students().getById(s.getId()).orElseThrow();
            assertSame(s, loaded);

            loaded.setGrade("12");
            unitOfWork.students().update(loaded);
            assertEquals(1, unitOfWork.students().count(x -> x.getGrade().equals("12")));
        }

        @Test
        @DisplayName("find, findFirst and any reject a null predicate")
        void nullPredicate_rejected() {
            Repository<Student> repo = unitOfWork.students();
            assertThrows(IllegalArgumentException.class, () -> repo.find(null));
            assertThrows(IllegalArgumentException.class, () -> repo.findFirst(null));
            assertThrows(IllegalArgumentException.class, () -> repo.any(null));
        }

        @Test
        @DisplayName("getAll(null) and count(null) mean no filter")
        void nullFilter_meansAll() {
            saved("STU001", "John Doe", "10");
            saved("STU002", "Jane Smith", "11");

            assertEquals(2, unitOfWork.students().getAll(null).size());
            assertEquals(2, unitOfWork.students().count(null));
        }

        @Test
        @DisplayName("findFirst returns empty when nothing matches")
        void findFirst_noMatch_empty() {
            saved("STU001", "John Doe", "10");
            assertTrue(unitOfWork.students().findFirst(s -> s.getGrade().equals("99")).isEmpty());
        }
    }
}
