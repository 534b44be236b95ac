package co.fanki.specsync.parsing.domain;

import co.fanki.specsync.feature.domain.TaskStatus;

import java.util.List;

/**
 * The content extracted from a {@code tasks.md} document.
 *
 * @param title the first H1 of the document, may be null
 * @param tasks the tasks in document order
 * @param phaseNames the phase headings in document order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ParsedTasks(
        String title,
        List<ParsedTask> tasks,
        List<String> phaseNames
) {

    /**
     * Copies the collections.
     */
    public ParsedTasks {
        tasks = List.copyOf(tasks);
        phaseNames = List.copyOf(phaseNames);
    }

    /**
     * One checkbox task.
     *
     * @param taskId the upper-cased identifier, e.g. {@code T001}
     * @param description the line without checkbox, id and markers
     * @param status the checkbox status
     * @param phase the enclosing phase heading, null before the first one
     * @param phaseOrder the 1-based phase position, 0 before the first one
     * @param parallel whether the line carries the {@code [P]} marker
     * @param storyLabel the upper-cased story label, e.g. {@code US1}
     * @param filePath the back-ticked file path on the line, may be null
     * @param lineNumber the 1-based line number
     * @param dependencies ids named in a "depends on" phrase
     */
    public record ParsedTask(
            String taskId,
            String description,
            TaskStatus status,
            String phase,
            int phaseOrder,
            boolean parallel,
            String storyLabel,
            String filePath,
            int lineNumber,
            List<String> dependencies
    ) {

        /**
         * Copies the dependencies.
         */
        public ParsedTask {
            dependencies = dependencies == null
                    ? List.of() : List.copyOf(dependencies);
        }
    }

}
