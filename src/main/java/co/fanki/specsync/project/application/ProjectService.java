package co.fanki.specsync.project.application;

import co.fanki.specsync.feature.domain.FeatureDirectory;
import co.fanki.specsync.project.domain.Project;
import co.fanki.specsync.project.domain.ProjectRepository;
import co.fanki.specsync.shared.DomainException;
import co.fanki.specsync.sync.application.FeatureSyncService;
import co.fanki.specsync.sync.application.SyncResult;
import co.fanki.specsync.watch.domain.ChangeWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Application service for project operations.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ProjectService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProjectService.class);

    /** Tooling directory watched next to {@code specs}. */
    public static final String SPECIFY_DIR = ".specify";

    private final ProjectRepository projectRepository;
    private final FeatureSyncService featureSyncService;
    private final ChangeWatcher changeWatcher;

    /**
     * Creates a new ProjectService.
     *
     * @param theProjectRepository the project repository
     * @param theFeatureSyncService mirrors the documents of a project
     * @param theChangeWatcher watches the selected project
     */
    public ProjectService(
            final ProjectRepository theProjectRepository,
            final FeatureSyncService theFeatureSyncService,
            final ChangeWatcher theChangeWatcher) {
        this.projectRepository = theProjectRepository;
        this.featureSyncService = theFeatureSyncService;
        this.changeWatcher = theChangeWatcher;
    }

    /**
     * Registers a project root and runs its initial full sync.
     *
     * <p>Registering a root that is already known returns the existing
     * project, marked as opened now, and syncs it again.</p>
     *
     * @param name the project name, defaults to the directory name
     * @param rootPath the project root directory
     * @return the registered project and the initial sync result
     * @throws DomainException with code {@code INVALID_PROJECT_ROOT} if the
     *         path is not an existing directory
     */
    public Registration register(final String name, final String rootPath) {
        final Path root = normalize(rootPath);
        LOG.info("Registering project at {}", root);

        final Optional<Project> existing = projectRepository.findByRootPath(
                root.toString());

        final Project project;
        if (existing.isPresent()) {
            project = existing.get();
            project.touch();
            if (name != null && !name.isBlank()) {
                project.rename(name.trim());
            }
            projectRepository.update(project);
            LOG.info("Project {} already registered, reopening", project.id());
        } else {
            project = Project.create(name, root);
            projectRepository.save(project);
            LOG.info("Project registered with ID: {}", project.id());
        }

        return new Registration(project, sync(project));
    }

    /**
     * Finds a project by ID.
     *
     * @param projectId the project ID
     * @return the project if found
     */
    public Optional<Project> findById(final String projectId) {
        return projectRepository.findById(projectId);
    }

    /**
     * Finds a project by ID, throwing if not found.
     *
     * @param projectId the project ID
     * @return the project
     * @throws DomainException if the project is not found
     */
    public Project getById(final String projectId) {
        return findById(projectId)
                .orElseThrow(() -> new DomainException(
                        "Project not found: " + projectId,
                        "PROJECT_NOT_FOUND"));
    }

    /**
     * Lists all projects, most recently opened first.
     *
     * @return list of all projects
     */
    public List<Project> listProjects() {
        return projectRepository.findAll();
    }

    /**
     * Runs a full sync of a project.
     *
     * @param projectId the project ID
     * @return the sync result
     * @throws DomainException if the project is not found
     */
    public SyncResult sync(final String projectId) {
        return sync(getById(projectId));
    }

    /**
     * Runs a full sync of every registered project.
     *
     * <p>Errors are counted per project so one failure does not block the
     * others. A project whose sync reports feature errors counts as
     * failed.</p>
     *
     * @return the number of projects that succeeded and failed
     */
    public SyncAllResult syncAll() {
        int succeeded = 0;
        int failed = 0;
        for (final Project project : projectRepository.findAll()) {
            try {
                final SyncResult result = sync(project);
                if (result.success()) {
                    succeeded++;
                } else {
                    failed++;
                    LOG.warn("Sync of {} reported errors: {}",
                            project.name(), result.errors());
                }
            } catch (final RuntimeException e) {
                failed++;
                LOG.error("Unexpected error syncing project {}: {}",
                        project.name(), e.getMessage(), e);
            }
        }
        return new SyncAllResult(succeeded, failed);
    }

    /**
     * Starts watching a project's {@code specs} and {@code .specify}
     * directories, replacing the previous watch session.
     *
     * @param projectId the project ID
     * @return the directories now being watched
     * @throws DomainException if the project is not found
     */
    public List<Path> watch(final String projectId) {
        final Project project = getById(projectId);
        project.touch();
        projectRepository.update(project);

        final Path root = project.root();
        changeWatcher.start(List.of(
                root.resolve(FeatureDirectory.SPECS_DIR),
                root.resolve(SPECIFY_DIR)));
        return changeWatcher.watchedRoots();
    }

    /**
     * Deletes a project with all its features.
     *
     * @param projectId the project ID
     * @throws DomainException if the project is not found
     */
    public void deleteProject(final String projectId) {
        final Project project = getById(projectId);
        if (changeWatcher.watchedRoots().stream()
                .anyMatch(path -> path.startsWith(project.root()))) {
            changeWatcher.stop();
        }
        projectRepository.delete(projectId);
        LOG.info("Project {} deleted", projectId);
    }

    private SyncResult sync(final Project project) {
        final SyncResult result = featureSyncService.syncProject(project.id(),
                project.root());
        project.markSynced();
        projectRepository.update(project);
        return result;
    }

    private static Path normalize(final String rootPath) {
        if (rootPath == null || rootPath.isBlank()) {
            throw new DomainException("Project root path is required",
                    "INVALID_PROJECT_ROOT");
        }
        final Path root;
        try {
            root = Path.of(rootPath.trim()).toAbsolutePath().normalize();
        } catch (final InvalidPathException e) {
            throw new DomainException("Invalid project root: " + rootPath,
                    "INVALID_PROJECT_ROOT", e);
        }
        if (!Files.isDirectory(root)) {
            throw new DomainException("Not a directory: " + root,
                    "INVALID_PROJECT_ROOT");
        }
        return root;
    }

    /**
     * Outcome of registering a project.
     *
     * @param project the registered project
     * @param initialSync the result of the sync that followed
     */
    public record Registration(Project project, SyncResult initialSync) {}

    /**
     * Outcome of syncing every project.
     *
     * @param succeeded projects synced without errors
     * @param failed projects that failed or reported feature errors
     */
    public record SyncAllResult(int succeeded, int failed) {}

}
