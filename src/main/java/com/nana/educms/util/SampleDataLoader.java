package com.nana.educms.util;

import com.nana.educms.domain.Announcement;
import com.nana.educms.domain.AnnouncementCategory;
import com.nana.educms.domain.AnnouncementPriority;
import com.nana.educms.domain.Student;
import com.nana.educms.domain.StudentStatus;
import com.nana.educms.repository.UnitOfWork;
import com.nana.educms.service.StudentService;
import com.nana.educms.service.StudentServiceImpl;
import com.nana.educms.service.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * SampleDataLoader - Demo / Development Data Seeder
 *
 * <p>Seeds two students and a welcome announcement into an empty store. The
 * students go through {@link StudentService#createStudent(Student)} so they
 * obey the same rules as any other record. Everything is written in one
 * explicit transaction: either all three records land or none do.
 */
public final class SampleDataLoader {

    private static final Logger log = LoggerFactory.getLogger(SampleDataLoader.class);

    private SampleDataLoader() {
        throw new UnsupportedOperationException("SampleDataLoader is a static utility class.");
    }

    /**
     * Loads the sample records unless any student or announcement exists.
     *
     * @param unitOfWork unit to write through; the caller owns and closes it
     * @param clock      source of "now" for the relative enrollment and
     *                   publish dates
     * @return true if data was loaded, false if the store was not empty
     */
    public static boolean loadIfEmpty(UnitOfWork unitOfWork, Clock clock) {
        if (unitOfWork.students().count() > 0 || unitOfWork.announcements().count() > 0) {
            log.debug("Database not empty - skipping sample data load.");
            return false;
        }
        log.info("Database is empty - loading sample data.");

        LocalDateTime now = LocalDateTime.now(clock);
        StudentService studentService = new StudentServiceImpl(unitOfWork, clock);

        unitOfWork.beginTransaction();
        try {
            studentService.createStudent(sampleStudent("STU001", "John Doe", "john.doe@school.edu",
                    "10", "A", now.minusMonths(6)));
            studentService.createStudent(sampleStudent("STU002", "Jane Smith", "jane.smith@school.edu",
                    "11", "B", now.minusMonths(8)));

            unitOfWork.announcements().add(welcomeAnnouncement(now.minusDays(7)));
            unitOfWork.saveChanges();

            unitOfWork.commitTransaction();
        } catch (ValidationException ex) {
            unitOfWork.rollbackTransaction();
            throw new IllegalStateException("Sample data failed validation: " + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            if (unitOfWork.hasActiveTransaction()) {
                unitOfWork.rollbackTransaction();
            }
            throw ex;
        }

        AppLogger.logEvent("SAMPLE_DATA_LOADED", "students=2, announcements=1");
        return true;
    }

    private static Student sampleStudent(String studentId, String name, String email,
                                         String grade, String section, LocalDateTime enrolledAt) {
        Student student = new Student(studentId, name, email, grade, section);
        student.setStatus(StudentStatus.ACTIVE);
        student.setEnrollmentDate(enrolledAt);
        return student;
    }

    private static Announcement welcomeAnnouncement(LocalDateTime publishedAt) {
        Announcement announcement = new Announcement();
        announcement.setTitle("Welcome to the New Academic Year");
        announcement.setContent("<p>We are excited to welcome all students to the new academic year. "
                + "Please review the updated policies and procedures.</p>");
        announcement.setCategory(AnnouncementCategory.GENERAL);
        announcement.setPriority(AnnouncementPriority.HIGH);
        announcement.setAuthorId("admin");
        announcement.setAuthorName("System Administrator");
        announcement.setPublished(true);
        announcement.setPublishDate(publishedAt);
        return announcement;
    }
}
