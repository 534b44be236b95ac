package co.fanki.specsync.feature.application;

import co.fanki.specsync.feature.application.FeatureQueryService.FeatureDetail;
import co.fanki.specsync.feature.application.FeatureQueryService.ProjectStats;
import co.fanki.specsync.feature.domain.Attribute;
import co.fanki.specsync.feature.domain.DataEntity;
import co.fanki.specsync.feature.domain.Feature;
import co.fanki.specsync.feature.domain.Plan;
import co.fanki.specsync.feature.domain.PlanPhase;
import co.fanki.specsync.feature.domain.Relationship;
import co.fanki.specsync.feature.domain.Requirement;
import co.fanki.specsync.feature.domain.ResearchDecision;
import co.fanki.specsync.feature.domain.Risk;
import co.fanki.specsync.feature.domain.Task;
import co.fanki.specsync.project.application.ProjectService;
import co.fanki.specsync.shared.DomainException;
import co.fanki.specsync.shared.ErrorResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST controller for reading mirrored features.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Features", description = "Read features and their tasks, requirements, entities, plan and research")
public class FeatureController {

    private static final Logger LOG = LoggerFactory.getLogger(
            FeatureController.class);

    private final ProjectService projectService;
    private final FeatureQueryService featureQueryService;

    /**
     * Creates a new FeatureController.
     *
     * @param theProjectService resolves the project of a request
     * @param theFeatureQueryService reads the features
     */
    public FeatureController(
            final ProjectService theProjectService,
            final FeatureQueryService theFeatureQueryService) {
        this.projectService = theProjectService;
        this.featureQueryService = theFeatureQueryService;
    }

    /**
     * Lists the features of a project.
     *
     * @param projectId the project ID
     * @param status optional status filter, e.g. {@code in_progress}
     * @return the features in number order
     */
    @Operation(summary = "List features of a project")
    @GetMapping("/projects/{id}/features")
    public ResponseEntity<?> listFeatures(
            @PathVariable("id") final String projectId,
            @RequestParam(value = "status", required = false)
            final String status) {
        try {
            projectService.getById(projectId);
            final List<FeatureResponse> features = featureQueryService
                    .listFeatures(projectId, status)
                    .stream()
                    .map(FeatureResponse::of)
                    .toList();
            return ResponseEntity.ok(features);
        } catch (final DomainException e) {
            LOG.error("Listing features failed: {}", e.getMessage());
            return ErrorResponse.of(e);
        }
    }

    /**
     * Returns feature and task counts of a project.
     *
     * @param projectId the project ID
     * @return the statistics
     */
    @Operation(summary = "Project statistics")
    @GetMapping("/projects/{id}/stats")
    public ResponseEntity<?> stats(
            @PathVariable("id") final String projectId) {
        try {
            projectService.getById(projectId);
            final ProjectStats stats = featureQueryService.stats(projectId);
            return ResponseEntity.ok(stats);
        } catch (final DomainException e) {
            LOG.error("Stats failed: {}", e.getMessage());
            return ErrorResponse.of(e);
        }
    }

    /**
     * Returns a feature with all of its records.
     *
     * @param featureId the feature ID
     * @return the feature detail
     */
    @Operation(summary = "Get a feature with its records")
    @GetMapping("/features/{id}")
    public ResponseEntity<?> getFeature(
            @PathVariable("id") final String featureId) {
        try {
            return ResponseEntity.ok(FeatureDetailResponse.of(
                    featureQueryService.getFeature(featureId)));
        } catch (final DomainException e) {
            LOG.error("Get feature failed: {}", e.getMessage());
            return ErrorResponse.of(e);
        }
    }

    /**
     * Response for a single feature.
     */
    public record FeatureResponse(
            String id,
            String featureNumber,
            String name,
            String title,
            String status,
            String priority,
            String createdDate,
            String featureBranch,
            String specPath,
            int taskCompletionPct,
            Instant updatedAt
    ) {
        static FeatureResponse of(final Feature feature) {
            return new FeatureResponse(
                    feature.id(),
                    feature.featureNumber(),
                    feature.name(),
                    feature.title(),
                    feature.status().value(),
                    feature.priority(),
                    feature.createdDate(),
                    feature.featureBranch(),
                    feature.specPath(),
                    feature.taskCompletionPct(),
                    feature.updatedAt());
        }
    }

    /**
     * Response for a feature with its records.
     */
    public record FeatureDetailResponse(
            FeatureResponse feature,
            List<TaskResponse> tasks,
            List<RequirementResponse> requirements,
            List<EntityResponse> entities,
            PlanResponse plan,
            List<DecisionResponse> decisions
    ) {
        static FeatureDetailResponse of(final FeatureDetail detail) {
            return new FeatureDetailResponse(
                    FeatureResponse.of(detail.feature()),
                    detail.tasks().stream().map(TaskResponse::of).toList(),
                    detail.requirements().stream()
                            .map(RequirementResponse::of).toList(),
                    detail.entities().stream()
                            .map(EntityResponse::of).toList(),
                    detail.plan().map(PlanResponse::of).orElse(null),
                    detail.decisions().stream()
                            .map(DecisionResponse::of).toList());
        }
    }

    /**
     * Response for a task.
     */
    public record TaskResponse(
            String taskId,
            String description,
            String status,
            String phase,
            int phaseOrder,
            boolean parallel,
            List<String> dependencies,
            String storyLabel,
            String filePath,
            int lineNumber
    ) {
        static TaskResponse of(final Task task) {
            return new TaskResponse(task.taskId(), task.description(),
                    task.status().value(), task.phase(), task.phaseOrder(),
                    task.isParallel(), task.dependencies(), task.storyLabel(),
                    task.filePath(), task.lineNumber());
        }
    }

    /**
     * Response for a requirement.
     */
    public record RequirementResponse(
            String requirementId,
            String description,
            String type,
            String priority,
            List<String> linkedTasks,
            List<String> acceptanceCriteria
    ) {
        static RequirementResponse of(final Requirement requirement) {
            return new RequirementResponse(requirement.requirementId(),
                    requirement.description(), requirement.type().value(),
                    requirement.priority(), requirement.linkedTasks(),
                    requirement.acceptanceCriteria());
        }
    }

    /**
     * Response for a data model entity.
     */
    public record EntityResponse(
            String name,
            String description,
            List<Attribute> attributes,
            List<Relationship> relationships,
            List<String> validationRules
    ) {
        static EntityResponse of(final DataEntity entity) {
            return new EntityResponse(entity.name(), entity.description(),
                    entity.attributes(), entity.relationships(),
                    entity.validationRules());
        }
    }

    /**
     * Response for a plan.
     */
    public record PlanResponse(
            String summary,
            Map<String, String> techStack,
            List<PlanPhase> phases,
            List<String> dependencies,
            List<Risk> risks
    ) {
        static PlanResponse of(final Plan plan) {
            return new PlanResponse(plan.summary(), plan.techStack(),
                    plan.phases(), plan.dependencies(), plan.risks());
        }
    }

    /**
     * Response for a research decision.
     */
    public record DecisionResponse(
            String title,
            String decision,
            String rationale,
            List<String> alternatives,
            String context
    ) {
        static DecisionResponse of(final ResearchDecision decision) {
            return new DecisionResponse(decision.title(), decision.decision(),
                    decision.rationale(), decision.alternatives(),
                    decision.context());
        }
    }

}
