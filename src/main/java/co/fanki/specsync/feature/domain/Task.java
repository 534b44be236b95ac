package co.fanki.specsync.feature.domain;

import co.fanki.specsync.shared.Preconditions;

import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * A checkbox task of a feature's {@code tasks.md}.
 *
 * <p>Identified within its feature by the task identifier
 * ({@code T001}).</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Task {

    private final String id;
    private final String featureId;
    private final String taskId;
    private final String description;
    private final TaskStatus status;
    private final String phase;
    private final int phaseOrder;
    private final boolean parallel;
    private final List<String> dependencies;
    private final String storyLabel;
    private final String filePath;
    private final int lineNumber;

    private Task(
            final String theId,
            final String theFeatureId,
            final String theTaskId,
            final String theDescription,
            final TaskStatus theStatus,
            final String thePhase,
            final int thePhaseOrder,
            final boolean isParallel,
            final List<String> theDependencies,
            final String theStoryLabel,
            final String theFilePath,
            final int theLineNumber) {
        this.id = Preconditions.requireNonBlank(theId, "Task ID is required");
        this.featureId = Preconditions.requireNonBlank(theFeatureId,
                "Feature ID is required");
        this.taskId = Preconditions.requireNonBlank(theTaskId,
                "Task identifier is required");
        this.description = theDescription != null ? theDescription : "";
        this.status = theStatus != null ? theStatus : TaskStatus.NOT_STARTED;
        this.phase = thePhase;
        this.phaseOrder = thePhaseOrder;
        this.parallel = isParallel;
        this.dependencies = theDependencies != null
                ? List.copyOf(theDependencies) : List.of();
        this.storyLabel = theStoryLabel;
        this.filePath = theFilePath;
        this.lineNumber = theLineNumber;
    }

    /**
     * Creates a new task.
     *
     * @param featureId the owning feature ID
     * @param taskId the task identifier, e.g. T001
     * @param description the task description
     * @param status the checkbox status
     * @param phase the phase heading, may be null
     * @param phaseOrder the 1-based phase position, 0 outside any phase
     * @param parallel whether the task may run in parallel
     * @param dependencies identifiers of tasks this one depends on
     * @param storyLabel the user story label, may be null
     * @param filePath the referenced source file, may be null
     * @param lineNumber the line of the task in tasks.md
     * @return a new Task instance
     */
    public static Task create(
            final String featureId,
            final String taskId,
            final String description,
            final TaskStatus status,
            final String phase,
            final int phaseOrder,
            final boolean parallel,
            final List<String> dependencies,
            final String storyLabel,
            final String filePath,
            final int lineNumber) {
        return new Task(UUID.randomUUID().toString(), featureId, taskId,
                description, status, phase, phaseOrder, parallel,
                dependencies, storyLabel, filePath, lineNumber);
    }

    /**
     * Reconstitutes a task from persistence.
     *
     * @return the reconstituted Task
     */
    public static Task reconstitute(
            final String id,
            final String featureId,
            final String taskId,
            final String description,
            final TaskStatus status,
            final String phase,
            final int phaseOrder,
            final boolean parallel,
            final List<String> dependencies,
            final String storyLabel,
            final String filePath,
            final int lineNumber) {
        return new Task(id, featureId, taskId, description, status, phase,
                phaseOrder, parallel, dependencies, storyLabel, filePath,
                lineNumber);
    }

    /**
     * Checks whether the task is done.
     *
     * @return true if the checkbox is ticked
     */
    public boolean isDone() {
        return status == TaskStatus.DONE;
    }

    /**
     * Checks whether the description mentions the given token.
     *
     * @param token the token to look for, e.g. a requirement ID
     * @return true if the description contains the token as a whole word,
     *         ignoring case
     */
    public boolean mentions(final String token) {
        return Pattern.compile("\\b" + Pattern.quote(token) + "\\b",
                Pattern.CASE_INSENSITIVE).matcher(description).find();
    }

    public String id() {
        return id;
    }

    public String featureId() {
        return featureId;
    }

    public String taskId() {
        return taskId;
    }

    public String description() {
        return description;
    }

    public TaskStatus status() {
        return status;
    }

    public String phase() {
        return phase;
    }

    public int phaseOrder() {
        return phaseOrder;
    }

    public boolean isParallel() {
        return parallel;
    }

    public List<String> dependencies() {
        return dependencies;
    }

    public String storyLabel() {
        return storyLabel;
    }

    public String filePath() {
        return filePath;
    }

    public int lineNumber() {
        return lineNumber;
    }

}
