package co.fanki.specsync.feature.domain;

import co.fanki.specsync.shared.Preconditions;

import java.time.Instant;
import java.util.UUID;

/**
 * Aggregate root for one feature directory ({@code specs/NNN-name}) of a
 * project.
 *
 * <p>A feature is identified by its project and its zero-padded feature
 * number. Its title, status and metadata come from {@code spec.md}; the task
 * completion percentage is derived from {@code tasks.md}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Feature {

    private final String id;
    private final String projectId;
    private final String featureNumber;
    private String name;
    private String title;
    private FeatureStatus status;
    private String specPath;
    private String priority;
    private String createdDate;
    private String featureBranch;
    private int taskCompletionPct;
    private final Instant createdAt;
    private Instant updatedAt;

    private Feature(
            final String theId,
            final String theProjectId,
            final String theFeatureNumber,
            final String theName,
            final String theSpecPath,
            final Instant theCreatedAt) {
        this.id = Preconditions.requireNonBlank(theId, "Feature ID is required");
        this.projectId = Preconditions.requireNonBlank(theProjectId,
                "Project ID is required");
        this.featureNumber = Preconditions.requireNonBlank(theFeatureNumber,
                "Feature number is required");
        this.name = Preconditions.requireNonBlank(theName,
                "Feature name is required");
        this.specPath = theSpecPath;
        this.title = theName;
        this.status = FeatureStatus.DRAFT;
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
        this.updatedAt = this.createdAt;
    }

    /**
     * Creates a new draft feature titled after its directory.
     *
     * @param projectId the owning project ID
     * @param featureNumber the zero-padded feature number, e.g. "003"
     * @param name the feature name, the directory name without its number
     * @param specPath the path of the feature's spec.md
     * @return a new Feature instance
     */
    public static Feature create(
            final String projectId,
            final String featureNumber,
            final String name,
            final String specPath) {
        return new Feature(
                UUID.randomUUID().toString(),
                projectId,
                featureNumber,
                name,
                specPath,
                Instant.now());
    }

    /**
     * Reconstitutes a feature from persistence.
     *
     * @param id the feature ID
     * @param projectId the project ID
     * @param featureNumber the feature number
     * @param name the feature name
     * @param title the title
     * @param status the status
     * @param specPath the spec.md path
     * @param priority the highest story priority, may be null
     * @param createdDate the created date from the spec, may be null
     * @param featureBranch the feature branch, may be null
     * @param taskCompletionPct the task completion percentage
     * @param createdAt when created
     * @param updatedAt when last updated
     * @return the reconstituted Feature
     */
    public static Feature reconstitute(
            final String id,
            final String projectId,
            final String featureNumber,
            final String name,
            final String title,
            final FeatureStatus status,
            final String specPath,
            final String priority,
            final String createdDate,
            final String featureBranch,
            final int taskCompletionPct,
            final Instant createdAt,
            final Instant updatedAt) {

        final Feature feature = new Feature(id, projectId, featureNumber,
                name, specPath, createdAt);
        feature.title = title != null ? title : name;
        feature.status = status != null ? status : FeatureStatus.DRAFT;
        feature.priority = priority;
        feature.createdDate = createdDate;
        feature.featureBranch = featureBranch;
        feature.taskCompletionPct = taskCompletionPct;
        feature.updatedAt = updatedAt;
        return feature;
    }

    /**
     * Applies the metadata read from the feature's specification.
     *
     * @param theTitle the title, falls back to the feature name when blank
     * @param theStatus the status
     * @param thePriority the highest story priority, may be null
     * @param theCreatedDate the created date, may be null
     * @param theFeatureBranch the feature branch, may be null
     */
    public void describe(
            final String theTitle,
            final FeatureStatus theStatus,
            final String thePriority,
            final String theCreatedDate,
            final String theFeatureBranch) {
        this.title = theTitle == null || theTitle.isBlank() ? name : theTitle;
        this.status = theStatus != null ? theStatus : FeatureStatus.DRAFT;
        this.priority = thePriority;
        this.createdDate = theCreatedDate;
        this.featureBranch = theFeatureBranch;
        this.updatedAt = Instant.now();
    }

    /**
     * Records the share of done tasks.
     *
     * @param percentage the completion percentage, 0 to 100
     */
    public void updateTaskCompletion(final int percentage) {
        Preconditions.require(percentage >= 0 && percentage <= 100,
                "Task completion must be between 0 and 100");
        this.taskCompletionPct = percentage;
        this.updatedAt = Instant.now();
    }

    /**
     * Renames the feature after its directory was renamed.
     *
     * @param newName the new feature name
     */
    public void rename(final String newName) {
        this.name = Preconditions.requireNonBlank(newName,
                "Feature name is required");
    }

    /**
     * Updates the location of the specification document.
     *
     * @param theSpecPath the spec.md path
     */
    public void relocate(final String theSpecPath) {
        this.specPath = theSpecPath;
    }

    /**
     * Returns the directory name of this feature, e.g. {@code 003-login}.
     *
     * @return the directory name
     */
    public String directoryName() {
        return featureNumber + "-" + name;
    }

    public String id() {
        return id;
    }

    public String projectId() {
        return projectId;
    }

    public String featureNumber() {
        return featureNumber;
    }

    public String name() {
        return name;
    }

    public String title() {
        return title;
    }

    public FeatureStatus status() {
        return status;
    }

    public String specPath() {
        return specPath;
    }

    public String priority() {
        return priority;
    }

    public String createdDate() {
        return createdDate;
    }

    public String featureBranch() {
        return featureBranch;
    }

    public int taskCompletionPct() {
        return taskCompletionPct;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

}
