package co.fanki.specsync.parsing.domain;

import co.fanki.specsync.feature.domain.TaskStatus;
import co.fanki.specsync.parsing.domain.ParsedTasks.ParsedTask;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for TasksParser.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class TasksParserTest {

    private static final String TASKS = """
            # Tasks: User Login

            ## Phase 1: Setup

            - [x] T001 Create project structure
            - [ ] T002 [P] Add dependencies in `pom.xml`

            ## Phase 2: Core

            - [/] T003 [US1] Implement login endpoint, depends on T001, T002
            - [ ] Write documentation without an id
            - [X] t004 lower case id
            - [] T005 Empty checkbox

            # Second title
            """;

    private final TasksParser parser = new TasksParser();

    @Test
    void whenParsing_givenExampleLine_shouldExtractAllFields() {
        final ParsedTasks parsed = parser.parseContent(
                "- [x] T002 Implement parser [P] [US1] `src/parser.ts`\n");

        assertEquals(1, parsed.tasks().size());
        final ParsedTask task = parsed.tasks().get(0);
        assertEquals("T002", task.taskId());
        assertEquals(TaskStatus.DONE, task.status());
        assertTrue(task.parallel());
        assertEquals("US1", task.storyLabel());
        assertEquals("src/parser.ts", task.filePath());
        assertFalse(task.description().contains("[x]"));
        assertFalse(task.description().contains("T002"));
        assertFalse(task.description().contains("[P]"));
        assertFalse(task.description().contains("[US1]"));
        assertTrue(task.description().startsWith("Implement parser"));
    }

    @Test
    void whenParsing_givenDocument_shouldReadTitleAndPhases() {
        final ParsedTasks parsed = parser.parseContent(TASKS);

        assertEquals("Tasks: User Login", parsed.title());
        assertEquals(List.of("Phase 1: Setup", "Phase 2: Core"),
                parsed.phaseNames());
    }

    @Test
    void whenParsing_givenCheckboxWithoutId_shouldSkipIt() {
        final List<ParsedTask> tasks = parser.parseContent(TASKS).tasks();

        assertEquals(List.of("T001", "T002", "T003", "T004", "T005"),
                tasks.stream().map(ParsedTask::taskId).toList());
    }

    @Test
    void whenParsing_givenPhases_shouldTagTasksWithPhase() {
        final List<ParsedTask> tasks = parser.parseContent(TASKS).tasks();

        assertEquals("Phase 1: Setup", tasks.get(0).phase());
        assertEquals(1, tasks.get(0).phaseOrder());
        assertEquals("Phase 2: Core", tasks.get(2).phase());
        assertEquals(2, tasks.get(2).phaseOrder());
    }

    @Test
    void whenParsing_givenCheckboxMarks_shouldMapStatus() {
        final List<ParsedTask> tasks = parser.parseContent(TASKS).tasks();

        assertEquals(TaskStatus.DONE, tasks.get(0).status());
        assertEquals(TaskStatus.NOT_STARTED, tasks.get(1).status());
        assertEquals(TaskStatus.IN_PROGRESS, tasks.get(2).status());
        assertEquals(TaskStatus.DONE, tasks.get(3).status());
        assertEquals(TaskStatus.NOT_STARTED, tasks.get(4).status());
    }

    @Test
    void whenParsing_givenDependsOnPhrase_shouldCollectDependencies() {
        final ParsedTask task = parser.parseContent(TASKS).tasks().get(2);

        assertEquals(List.of("T001", "T002"), task.dependencies());
        assertEquals("US1", task.storyLabel());
        assertFalse(task.parallel());
    }

    @Test
    void whenParsing_givenLines_shouldRecordOneBasedLineNumbers() {
        final List<ParsedTask> tasks = parser.parseContent(TASKS).tasks();

        assertEquals(5, tasks.get(0).lineNumber());
        assertEquals(6, tasks.get(1).lineNumber());
    }

    @Test
    void whenParsing_givenBacktickedFile_shouldKeepPathInDescription() {
        final ParsedTask task = parser.parseContent(TASKS).tasks().get(1);

        assertEquals("pom.xml", task.filePath());
        assertEquals("Add dependencies in `pom.xml`", task.description());
    }

    @Test
    void whenParsing_givenTasksBeforeFirstPhase_shouldLeavePhaseEmpty() {
        final ParsedTask task = parser.parseContent(
                "- [ ] T010 Loose task\n").tasks().get(0);

        assertNull(task.phase());
        assertEquals(0, task.phaseOrder());
        assertNull(task.storyLabel());
        assertNull(task.filePath());
        assertTrue(task.dependencies().isEmpty());
    }

    @Test
    void whenParsing_givenWindowsLineEndings_shouldStripCarriageReturns() {
        final ParsedTasks parsed = parser.parseContent(
                "# Title\r\n## Phase 1: Only\r\n- [x] T001 Done task\r\n");

        assertEquals("Title", parsed.title());
        assertEquals(List.of("Phase 1: Only"), parsed.phaseNames());
        assertEquals("Done task", parsed.tasks().get(0).description());
    }

    @Test
    void whenParsing_givenNonPhaseSubHeading_shouldKeepCurrentPhase() {
        final ParsedTasks parsed = parser.parseContent("""
                ## Phase 1: Setup
                ## Notes
                - [ ] T001 Still in setup
                """);

        assertEquals("Phase 1: Setup", parsed.tasks().get(0).phase());
    }

}
