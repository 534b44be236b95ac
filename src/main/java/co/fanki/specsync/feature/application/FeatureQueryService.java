package co.fanki.specsync.feature.application;

import co.fanki.specsync.feature.domain.DataEntity;
import co.fanki.specsync.feature.domain.Feature;
import co.fanki.specsync.feature.domain.FeatureStatus;
import co.fanki.specsync.feature.domain.Plan;
import co.fanki.specsync.feature.domain.Requirement;
import co.fanki.specsync.feature.domain.ResearchDecision;
import co.fanki.specsync.feature.domain.SpecStore;
import co.fanki.specsync.feature.domain.Task;
import co.fanki.specsync.feature.domain.TaskStatus;
import co.fanki.specsync.shared.DomainException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the mirrored feature records.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class FeatureQueryService {

    private final SpecStore store;

    /**
     * Creates a new FeatureQueryService.
     *
     * @param theStore the store to read from
     */
    public FeatureQueryService(final SpecStore theStore) {
        this.store = theStore;
    }

    /**
     * Lists the features of a project in feature number order.
     *
     * @param projectId the project ID
     * @param status only features with this status value, null for all
     * @return the features
     */
    public List<Feature> listFeatures(final String projectId,
            final String status) {
        final List<Feature> features = store.findFeaturesByProject(projectId);
        if (status == null || status.isBlank()) {
            return features;
        }
        return features.stream()
                .filter(feature -> feature.status().value().equals(status))
                .toList();
    }

    /**
     * Loads a feature with all of its records.
     *
     * @param featureId the feature ID
     * @return the feature and its records
     * @throws DomainException if the feature is not found
     */
    public FeatureDetail getFeature(final String featureId) {
        final Feature feature = store.findFeatureById(featureId)
                .orElseThrow(() -> new DomainException(
                        "Feature not found: " + featureId,
                        "FEATURE_NOT_FOUND"));
        return new FeatureDetail(
                feature,
                store.findTasksByFeature(featureId),
                store.findRequirementsByFeature(featureId),
                store.findEntitiesByFeature(featureId),
                store.findPlanByFeature(featureId),
                store.findResearchDecisionsByFeature(featureId));
    }

    /**
     * Aggregates feature and task counts of a project.
     *
     * @param projectId the project ID
     * @return the statistics
     */
    public ProjectStats stats(final String projectId) {
        final List<Feature> features = store.findFeaturesByProject(projectId);

        final Map<String, Long> featuresByStatus = new LinkedHashMap<>();
        for (final FeatureStatus status : FeatureStatus.values()) {
            featuresByStatus.put(status.value(), 0L);
        }
        final Map<String, Long> tasksByStatus = new LinkedHashMap<>();
        for (final TaskStatus status : TaskStatus.values()) {
            tasksByStatus.put(status.value(), 0L);
        }

        final List<Task> tasks = new ArrayList<>();
        long completion = 0;
        for (final Feature feature : features) {
            featuresByStatus.merge(feature.status().value(), 1L, Long::sum);
            completion += feature.taskCompletionPct();
            tasks.addAll(store.findTasksByFeature(feature.id()));
        }
        for (final Task task : tasks) {
            tasksByStatus.merge(task.status().value(), 1L, Long::sum);
        }

        final int averageCompletion = features.isEmpty()
                ? 0
                : Math.round((float) completion / features.size());

        return new ProjectStats(features.size(), featuresByStatus,
                averageCompletion, tasks.size(), tasksByStatus);
    }

    /**
     * A feature with all of its records.
     */
    public record FeatureDetail(
            Feature feature,
            List<Task> tasks,
            List<Requirement> requirements,
            List<DataEntity> entities,
            Optional<Plan> plan,
            List<ResearchDecision> decisions
    ) {}

    /**
     * Feature and task counts of a project.
     *
     * @param totalFeatures number of features
     * @param featuresByStatus feature count per status value
     * @param averageTaskCompletion mean completion percentage, rounded
     * @param totalTasks number of tasks across all features
     * @param tasksByStatus task count per status value
     */
    public record ProjectStats(
            int totalFeatures,
            Map<String, Long> featuresByStatus,
            int averageTaskCompletion,
            int totalTasks,
            Map<String, Long> tasksByStatus
    ) {}

}
