package co.fanki.specsync.project.domain;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for Project.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ProjectTest {

    @Test
    void whenCreating_givenNoName_shouldUseDirectoryName() {
        final Project project = Project.create(null, Path.of("/work/billing"));

        assertNotNull(project.id());
        assertEquals("billing", project.name());
        assertEquals("/work/billing", project.rootPath());
        assertEquals(Path.of("/work/billing"), project.root());
        assertNull(project.lastSyncedAt());
    }

    @Test
    void whenCreating_givenName_shouldTrimIt() {
        final Project project = Project.create("  Billing  ",
                Path.of("/work/billing"));

        assertEquals("Billing", project.name());
    }

    @Test
    void whenMarkingSynced_givenNewProject_shouldRecordTime() {
        final Project project = Project.create(null, Path.of("/work/billing"));

        project.markSynced();

        assertNotNull(project.lastSyncedAt());
    }

    @Test
    void whenTouching_givenReconstitutedProject_shouldMoveLastOpened() {
        final Instant longAgo = Instant.parse("2024-01-01T00:00:00Z");
        final Project project = Project.reconstitute("id-1", "billing",
                "/work/billing", longAgo, longAgo, null);

        project.touch();

        assertTrue(project.lastOpenedAt().isAfter(longAgo));
        assertEquals(longAgo, project.createdAt());
    }

    @Test
    void whenRenaming_givenBlankName_shouldThrow() {
        final Project project = Project.create(null, Path.of("/work/billing"));

        assertThrows(IllegalArgumentException.class,
                () -> project.rename(" "));
    }

}
