package co.fanki.specsync.parsing.domain;

import co.fanki.specsync.feature.domain.TaskStatus;
import co.fanki.specsync.parsing.domain.ParsedTasks.ParsedTask;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code tasks.md} task lists.
 *
 * <p>Checkbox syntax is anchored to lines, so this parser reads the text
 * line by line instead of going through the block model. A line becomes a
 * task only when it is a checkbox item carrying a {@code T###}
 * identifier.</p>
 *
 * <p>Example line and its outcome:</p>
 * <pre>
 * - [x] T002 [P] [US1] Implement parser in `src/parser.ts`
 *   -&gt; T002, done, parallel, US1, src/parser.ts
 * </pre>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class TasksParser extends DocumentParser<ParsedTasks> {

    private static final Pattern TITLE = Pattern.compile("^#\\s+");

    private static final Pattern PHASE = Pattern.compile(
            "^##\\s+Phase\\s+\\d+", Pattern.CASE_INSENSITIVE);

    private static final Pattern PHASE_MARKER = Pattern.compile("^##\\s+");

    private static final Pattern CHECKBOX = Pattern.compile(
            "^\\s*-\\s*\\[([xX/ ]?)\\]\\s*");

    private static final Pattern TASK_ID = Pattern.compile(
            "\\b(T\\d{3})\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern PARALLEL = Pattern.compile("\\[P\\]");

    private static final Pattern STORY = Pattern.compile(
            "\\[(US\\d+)\\]", Pattern.CASE_INSENSITIVE);

    private static final Pattern FILE = Pattern.compile(
            "`([^`]+\\.[a-zA-Z]+)`");

    private static final Pattern DEPENDS_ON = Pattern.compile(
            "depends\\s+on:?\\s+((?:T\\d{3}(?:\\s*,\\s*|\\s+and\\s+|\\s*)?)+)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public String fileName() {
        return "tasks.md";
    }

    @Override
    public ParsedTasks parseContent(final String content) {
        final String[] lines = content.split("\n", -1);

        String title = null;
        String phase = null;
        int phaseOrder = 0;
        final List<String> phaseNames = new ArrayList<>();
        final List<ParsedTask> tasks = new ArrayList<>();

        for (int i = 0; i < lines.length; i++) {
            final String line = stripCarriageReturn(lines[i]);

            if (title == null && TITLE.matcher(line).find()) {
                title = TITLE.matcher(line).replaceFirst("").trim();
                continue;
            }

            if (PHASE.matcher(line).find()) {
                phase = PHASE_MARKER.matcher(line).replaceFirst("").trim();
                phaseOrder++;
                phaseNames.add(phase);
                continue;
            }

            final ParsedTask task = task(line, i + 1, phase, phaseOrder);
            if (task != null) {
                tasks.add(task);
            }
        }
        return new ParsedTasks(title, tasks, phaseNames);
    }

    /**
     * Parses one line as a task.
     *
     * @return the task, or null when the line is not a checkbox item with a
     *         task identifier
     */
    private static ParsedTask task(final String line, final int lineNumber,
            final String phase, final int phaseOrder) {
        final Matcher checkbox = CHECKBOX.matcher(line);
        if (!checkbox.find()) {
            return null;
        }
        final Matcher taskId = TASK_ID.matcher(line);
        if (!taskId.find()) {
            return null;
        }

        final Matcher story = STORY.matcher(line);
        final Matcher file = FILE.matcher(line);

        return new ParsedTask(
                taskId.group(1).toUpperCase(Locale.ROOT),
                describe(line, checkbox.end()),
                TaskStatus.fromCheckbox(checkbox.group(1)),
                phase,
                phaseOrder,
                PARALLEL.matcher(line).find(),
                story.find() ? story.group(1).toUpperCase(Locale.ROOT) : null,
                file.find() ? file.group(1) : null,
                lineNumber,
                dependencies(line));
    }

    private static String describe(final String line, final int checkboxEnd) {
        String description = line.substring(checkboxEnd);
        description = TASK_ID.matcher(description).replaceFirst("");
        description = PARALLEL.matcher(description).replaceAll("");
        description = STORY.matcher(description).replaceAll("");
        return WHITESPACE.matcher(description).replaceAll(" ").trim();
    }

    private static List<String> dependencies(final String line) {
        final List<String> ids = new ArrayList<>();
        final Matcher phrase = DEPENDS_ON.matcher(line);
        while (phrase.find()) {
            final Matcher id = TASK_ID.matcher(phrase.group(1));
            while (id.find()) {
                final String normalized = id.group(1).toUpperCase(Locale.ROOT);
                if (!ids.contains(normalized)) {
                    ids.add(normalized);
                }
            }
        }
        return ids;
    }

    private static String stripCarriageReturn(final String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1)
                : line;
    }

}
