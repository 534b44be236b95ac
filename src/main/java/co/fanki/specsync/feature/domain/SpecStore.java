package co.fanki.specsync.feature.domain;

import java.util.List;
import java.util.Optional;

/**
 * Keyed store for features and the records parsed from their documents.
 *
 * <p>Every upsert matches on the record's natural key and keeps the stored
 * surrogate ID when the key already exists. Child records reference an
 * existing feature; deleting a feature deletes its children.</p>
 *
 * <p>Tasks and requirements are replaced as a set (delete by feature, then
 * upsert each). Entities and research decisions are only upserted. The
 * plan is a singleton per feature.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface SpecStore {

    /**
     * Inserts or updates a feature keyed by project and feature number.
     *
     * @param feature the feature to store
     * @return the stored feature, carrying the persisted ID
     */
    Feature upsertFeature(Feature feature);

    Optional<Feature> findFeatureByNumber(String projectId,
            String featureNumber);

    Optional<Feature> findFeatureById(String featureId);

    /**
     * Lists the features of a project ordered by feature number.
     *
     * @param projectId the project ID
     * @return the features, never null
     */
    List<Feature> findFeaturesByProject(String projectId);

    /**
     * Deletes a feature and, transitively, all of its records.
     *
     * @param featureId the feature ID
     */
    void deleteFeature(String featureId);

    /**
     * Recomputes the feature's task completion percentage from its stored
     * tasks.
     *
     * @param featureId the feature ID
     * @return the new percentage
     */
    int updateTaskCompletion(String featureId);

    // -- tasks: replace pair --

    void deleteTasksByFeature(String featureId);

    void upsertTask(Task task);

    List<Task> findTasksByFeature(String featureId);

    // -- entities: merge pair --

    void upsertEntity(DataEntity entity);

    Optional<DataEntity> findEntityByName(String featureId, String name);

    List<DataEntity> findEntitiesByFeature(String featureId);

    // -- requirements: replace pair --

    void deleteRequirementsByFeature(String featureId);

    void upsertRequirement(Requirement requirement);

    List<Requirement> findRequirementsByFeature(String featureId);

    // -- plan: singleton per feature --

    void upsertPlan(Plan plan);

    Optional<Plan> findPlanByFeature(String featureId);

    // -- research decisions --

    void deleteResearchDecisionsByFeature(String featureId);

    void upsertResearchDecision(ResearchDecision decision);

    List<ResearchDecision> findResearchDecisionsByFeature(String featureId);

}
