package co.fanki.specsync.project.application;

import co.fanki.specsync.project.application.ProjectService.Registration;
import co.fanki.specsync.project.domain.Project;
import co.fanki.specsync.shared.DomainException;
import co.fanki.specsync.shared.ErrorResponse;
import co.fanki.specsync.sync.application.SyncResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * REST controller for project registration, sync and watch operations.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/projects")
@Tag(name = "Projects", description = "Register project roots and mirror their specs tree")
public class ProjectController {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProjectController.class);

    private final ProjectService projectService;

    /**
     * Creates a new ProjectController.
     *
     * @param theProjectService the project service
     */
    public ProjectController(final ProjectService theProjectService) {
        this.projectService = theProjectService;
    }

    /**
     * Lists all registered projects.
     *
     * @return the list of projects
     */
    @GetMapping
    public ResponseEntity<ProjectListResponse> listProjects() {
        LOG.debug("Listing all projects");

        final List<ProjectResponse> projects = projectService.listProjects()
                .stream()
                .map(ProjectResponse::of)
                .toList();

        return ResponseEntity.ok(new ProjectListResponse(projects));
    }

    /**
     * Registers a project root and syncs it.
     *
     * @param request the registration request
     * @return the project and its initial sync result
     */
    @Operation(
            summary = "Register a project",
            description = "Registers a directory containing a specs tree and runs the initial full sync. "
                    + "Registering a known directory reopens and re-syncs it."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Project registered",
                    content = @Content(schema = @Schema(implementation = RegisterResponse.class))),
            @ApiResponse(responseCode = "400", description = "Not a directory")
    })
    @PostMapping
    public ResponseEntity<?> registerProject(
            @RequestBody final RegisterRequest request) {

        LOG.info("Received register request for: {}", request.rootPath());

        try {
            final Registration registration = projectService.register(
                    request.name(), request.rootPath());
            return ResponseEntity.ok(new RegisterResponse(
                    ProjectResponse.of(registration.project()),
                    SyncResponse.of(registration.initialSync())));
        } catch (final DomainException e) {
            LOG.error("Registration failed: {}", e.getMessage());
            return ErrorResponse.of(e);
        }
    }

    /**
     * Runs a full sync of a project.
     *
     * @param projectId the project ID
     * @return the number of synced features and the per-feature errors
     */
    @Operation(
            summary = "Sync a project",
            description = "Walks specs/NNN-name directories and mirrors every document into the store."
    )
    @PostMapping("/{id}/sync")
    public ResponseEntity<?> syncProject(
            @PathVariable("id") final String projectId) {

        LOG.info("Received sync request for project: {}", projectId);

        try {
            return ResponseEntity.ok(SyncResponse.of(
                    projectService.sync(projectId)));
        } catch (final DomainException e) {
            LOG.error("Sync failed: {}", e.getMessage());
            return ErrorResponse.of(e);
        }
    }

    /**
     * Starts watching a project, replacing the previous watch session.
     *
     * @param projectId the project ID
     * @return the watched directories
     */
    @Operation(
            summary = "Watch a project",
            description = "Watches the specs and .specify directories and syncs each changed document."
    )
    @PostMapping("/{id}/watch")
    public ResponseEntity<?> watchProject(
            @PathVariable("id") final String projectId) {

        LOG.info("Received watch request for project: {}", projectId);

        try {
            final List<String> roots = projectService.watch(projectId)
                    .stream()
                    .map(Path::toString)
                    .toList();
            return ResponseEntity.ok(new WatchResponse(projectId, roots));
        } catch (final DomainException e) {
            LOG.error("Watch failed: {}", e.getMessage());
            return ErrorResponse.of(e);
        }
    }

    /**
     * Deletes a project and all of its records.
     *
     * @param projectId the project ID
     * @return no content
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteProject(
            @PathVariable("id") final String projectId) {
        try {
            projectService.deleteProject(projectId);
            return ResponseEntity.noContent().build();
        } catch (final DomainException e) {
            LOG.error("Delete failed: {}", e.getMessage());
            return ErrorResponse.of(e);
        }
    }

    /**
     * Request to register a project.
     */
    public record RegisterRequest(
            String name,
            String rootPath
    ) {}

    /**
     * Response for a registration.
     */
    public record RegisterResponse(
            ProjectResponse project,
            SyncResponse sync
    ) {}

    /**
     * Response containing list of projects.
     */
    public record ProjectListResponse(
            List<ProjectResponse> projects
    ) {}

    /**
     * Response for a single project.
     */
    public record ProjectResponse(
            String id,
            String name,
            String rootPath,
            Instant createdAt,
            Instant lastOpenedAt,
            Instant lastSyncedAt
    ) {
        static ProjectResponse of(final Project project) {
            return new ProjectResponse(project.id(), project.name(),
                    project.rootPath(), project.createdAt(),
                    project.lastOpenedAt(), project.lastSyncedAt());
        }
    }

    /**
     * Response for a full sync.
     */
    public record SyncResponse(
            boolean success,
            int synced,
            List<String> errors
    ) {
        static SyncResponse of(final SyncResult result) {
            return new SyncResponse(result.success(), result.synced(),
                    result.errors());
        }
    }

    /**
     * Response for a watch request.
     */
    public record WatchResponse(
            String projectId,
            List<String> watching
    ) {}

}
