package co.fanki.specsync.feature.domain;

import co.fanki.specsync.shared.Preconditions;

import java.util.List;
import java.util.UUID;

/**
 * A functional or non-functional requirement listed in a feature's
 * specification.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Requirement {

    private final String id;
    private final String featureId;
    private final String requirementId;
    private final String description;
    private final RequirementType type;
    private final String priority;
    private final List<String> linkedTasks;
    private final List<String> acceptanceCriteria;

    private Requirement(
            final String theId,
            final String theFeatureId,
            final String theRequirementId,
            final String theDescription,
            final RequirementType theType,
            final String thePriority,
            final List<String> theLinkedTasks,
            final List<String> theAcceptanceCriteria) {
        this.id = Preconditions.requireNonBlank(theId,
                "Requirement ID is required");
        this.featureId = Preconditions.requireNonBlank(theFeatureId,
                "Feature ID is required");
        this.requirementId = Preconditions.requireNonBlank(theRequirementId,
                "Requirement identifier is required");
        this.description = theDescription != null ? theDescription : "";
        this.type = theType != null ? theType
                : RequirementType.fromRequirementId(theRequirementId);
        this.priority = thePriority;
        this.linkedTasks = theLinkedTasks != null
                ? List.copyOf(theLinkedTasks) : List.of();
        this.acceptanceCriteria = theAcceptanceCriteria != null
                ? List.copyOf(theAcceptanceCriteria) : List.of();
    }

    /**
     * Creates a new requirement; the type follows from the identifier
     * prefix.
     *
     * @param featureId the owning feature ID
     * @param requirementId the identifier, e.g. FR-001
     * @param description the requirement text
     * @param priority the priority, may be null
     * @param linkedTasks identifiers of tasks mentioning this requirement
     * @param acceptanceCriteria the acceptance criteria
     * @return a new Requirement instance
     */
    public static Requirement create(
            final String featureId,
            final String requirementId,
            final String description,
            final String priority,
            final List<String> linkedTasks,
            final List<String> acceptanceCriteria) {
        return new Requirement(UUID.randomUUID().toString(), featureId,
                requirementId, description,
                RequirementType.fromRequirementId(requirementId), priority,
                linkedTasks, acceptanceCriteria);
    }

    /**
     * Reconstitutes a requirement from persistence.
     *
     * @return the reconstituted Requirement
     */
    public static Requirement reconstitute(
            final String id,
            final String featureId,
            final String requirementId,
            final String description,
            final RequirementType type,
            final String priority,
            final List<String> linkedTasks,
            final List<String> acceptanceCriteria) {
        return new Requirement(id, featureId, requirementId, description,
                type, priority, linkedTasks, acceptanceCriteria);
    }

    /**
     * Returns a copy of this requirement linked to the given tasks.
     *
     * @param taskIds the identifiers of the linked tasks
     * @return the linked requirement, with the same ID
     */
    public Requirement linkTo(final List<String> taskIds) {
        return new Requirement(id, featureId, requirementId, description,
                type, priority, taskIds, acceptanceCriteria);
    }

    public String id() {
        return id;
    }

    public String featureId() {
        return featureId;
    }

    public String requirementId() {
        return requirementId;
    }

    public String description() {
        return description;
    }

    public RequirementType type() {
        return type;
    }

    public String priority() {
        return priority;
    }

    public List<String> linkedTasks() {
        return linkedTasks;
    }

    public List<String> acceptanceCriteria() {
        return acceptanceCriteria;
    }

}
