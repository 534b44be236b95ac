package co.fanki.specsync.project.application;

import co.fanki.specsync.project.application.ProjectService.Registration;
import co.fanki.specsync.project.application.ProjectService.SyncAllResult;
import co.fanki.specsync.project.domain.Project;
import co.fanki.specsync.project.domain.ProjectRepository;
import co.fanki.specsync.shared.DomainException;
import co.fanki.specsync.sync.application.FeatureSyncService;
import co.fanki.specsync.sync.application.SyncResult;
import co.fanki.specsync.watch.domain.ChangeWatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for ProjectService.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ProjectServiceTest {

    @TempDir
    Path tempDir;

    private Path root;
    private ProjectRepository projectRepository;
    private FeatureSyncService featureSyncService;
    private ChangeWatcher changeWatcher;
    private ProjectService service;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(tempDir.resolve("billing"))
                .toAbsolutePath().normalize();
        projectRepository = createMock(ProjectRepository.class);
        featureSyncService = createMock(FeatureSyncService.class);
        changeWatcher = new ChangeWatcher(50);
        service = new ProjectService(projectRepository, featureSyncService,
                changeWatcher);
    }

    @AfterEach
    void tearDown() {
        changeWatcher.close();
    }

    @Test
    void whenRegistering_givenNewRoot_shouldSaveAndSync() {
        final SyncResult synced = new SyncResult(0,
                List.of(FeatureSyncService.SPECS_NOT_FOUND));
        expect(projectRepository.findByRootPath(root.toString()))
                .andReturn(Optional.empty());
        projectRepository.save(anyObject(Project.class));
        expectLastCall();
        expect(featureSyncService.syncProject(anyObject(String.class),
                eq(root))).andReturn(synced);
        projectRepository.update(anyObject(Project.class));
        expectLastCall();
        replay(projectRepository, featureSyncService);

        final Registration registration = service.register(null,
                root.toString());

        verify(projectRepository, featureSyncService);
        assertEquals("billing", registration.project().name());
        assertEquals(root.toString(), registration.project().rootPath());
        assertNotNull(registration.project().lastSyncedAt());
        assertSame(synced, registration.initialSync());
    }

    @Test
    void whenRegistering_givenKnownRoot_shouldReopenExistingProject() {
        final Instant longAgo = Instant.parse("2024-01-01T00:00:00Z");
        final Project existing = Project.reconstitute("project-1", "billing",
                root.toString(), longAgo, longAgo, null);
        expect(projectRepository.findByRootPath(root.toString()))
                .andReturn(Optional.of(existing));
        projectRepository.update(existing);
        expectLastCall().times(2);
        expect(featureSyncService.syncProject("project-1", root))
                .andReturn(new SyncResult(1, List.of()));
        replay(projectRepository, featureSyncService);

        final Registration registration = service.register("Billing API",
                root.resolve("../billing").toString());

        verify(projectRepository, featureSyncService);
        assertSame(existing, registration.project());
        assertEquals("Billing API", existing.name());
        assertTrue(existing.lastOpenedAt().isAfter(longAgo));
    }

    @Test
    void whenRegistering_givenMissingDirectory_shouldThrow() {
        replay(projectRepository, featureSyncService);

        final DomainException e = assertThrows(DomainException.class,
                () -> service.register(null,
                        tempDir.resolve("missing").toString()));

        assertEquals("INVALID_PROJECT_ROOT", e.getErrorCode());
    }

    @Test
    void whenRegistering_givenBlankPath_shouldThrow() {
        replay(projectRepository, featureSyncService);

        final DomainException e = assertThrows(DomainException.class,
                () -> service.register("name", " "));

        assertEquals("INVALID_PROJECT_ROOT", e.getErrorCode());
    }

    @Test
    void whenGettingById_givenUnknownId_shouldThrowNotFound() {
        expect(projectRepository.findById("nope")).andReturn(Optional.empty());
        replay(projectRepository, featureSyncService);

        final DomainException e = assertThrows(DomainException.class,
                () -> service.getById("nope"));

        assertEquals("PROJECT_NOT_FOUND", e.getErrorCode());
    }

    @Test
    void whenSyncingAll_givenOneFailingProject_shouldCountBoth() {
        final Project healthy = Project.create("healthy", root);
        final Project broken = Project.create("broken",
                tempDir.resolve("broken"));
        expect(projectRepository.findAll())
                .andReturn(List.of(healthy, broken));
        expect(featureSyncService.syncProject(healthy.id(), root))
                .andReturn(new SyncResult(2, List.of()));
        expect(featureSyncService.syncProject(broken.id(), broken.root()))
                .andThrow(new IllegalStateException("disk gone"));
        projectRepository.update(healthy);
        expectLastCall();
        replay(projectRepository, featureSyncService);

        final SyncAllResult result = service.syncAll();

        verify(projectRepository, featureSyncService);
        assertEquals(1, result.succeeded());
        assertEquals(1, result.failed());
    }

    @Test
    void whenWatching_givenProjectWithSpecs_shouldWatchExistingRoots()
            throws IOException {
        final Path specs = Files.createDirectories(root.resolve("specs"));
        final Project project = Project.create(null, root);
        expect(projectRepository.findById(project.id()))
                .andReturn(Optional.of(project));
        projectRepository.update(project);
        expectLastCall();
        replay(projectRepository, featureSyncService);

        final List<Path> watched = service.watch(project.id());

        verify(projectRepository, featureSyncService);
        assertEquals(List.of(specs), watched);
    }

    @Test
    void whenDeleting_givenWatchedProject_shouldStopWatching()
            throws IOException {
        Files.createDirectories(root.resolve("specs"));
        final Project project = Project.create(null, root);
        changeWatcher.start(List.of(root.resolve("specs")));
        expect(projectRepository.findById(project.id()))
                .andReturn(Optional.of(project));
        projectRepository.delete(project.id());
        expectLastCall();
        replay(projectRepository, featureSyncService);

        service.deleteProject(project.id());

        verify(projectRepository, featureSyncService);
        assertTrue(changeWatcher.watchedRoots().isEmpty());
    }

}
