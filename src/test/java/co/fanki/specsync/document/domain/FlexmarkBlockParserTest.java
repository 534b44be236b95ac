package co.fanki.specsync.document.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for FlexmarkBlockParser.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FlexmarkBlockParserTest {

    private final BlockParser parser = new FlexmarkBlockParser();

    @Test
    void whenParsing_givenMixedDocument_shouldReturnBlocksInOrder() {
        final String text = """
                # Title

                Some *emphasized* text.

                - first
                - second

                | Name | Type |
                |------|------|
                | id   | UUID |

                ```java
                int x = 1;
                ```
                """;

        final List<Block> blocks = parser.parse(text);

        assertEquals(5, blocks.size());
        assertTrue(blocks.get(0).isHeading(1));
        assertEquals("Title", blocks.get(0).text());
        assertTrue(blocks.get(1).is(BlockKind.PARAGRAPH));
        assertTrue(blocks.get(2).is(BlockKind.LIST));
        assertTrue(blocks.get(3).is(BlockKind.TABLE));
        assertTrue(blocks.get(4).is(BlockKind.CODE));
    }

    @Test
    void whenParsing_givenInlineFormatting_shouldFlattenText() {
        final List<Block> blocks = parser.parse(
                "Some *emphasized* and **strong** `code` text.\n");

        assertEquals("Some emphasized and strong code text.",
                blocks.get(0).text());
        assertTrue(blocks.get(0).source().startsWith("Some *emphasized*"));
    }

    @Test
    void whenParsing_givenBoldLabel_shouldKeepMarkupInSource() {
        final Block block = parser.parse("**Status**: Draft\n").get(0);

        assertEquals("Status: Draft", block.text());
        assertTrue(block.source().startsWith("**Status**:"));
    }

    @Test
    void whenParsing_givenNestedList_shouldExposeChildren() {
        final Block list = parser.parse("""
                - parent
                  - child one
                  - child two
                - sibling
                """).get(0);

        assertEquals(2, list.items().size());
        final ListEntry parent = list.items().get(0);
        assertEquals("parent", parent.text());
        assertEquals(List.of("child one", "child two"),
                parent.children().stream().map(ListEntry::text).toList());
        assertEquals("sibling", list.items().get(1).text());
    }

    @Test
    void whenParsing_givenListItemWithMarkup_shouldKeepItemSource() {
        final Block list = parser.parse("- **Language**: `Java 17`\n").get(0);

        final ListEntry item = list.items().get(0);
        assertEquals("Language: Java 17", item.text());
        assertEquals("**Language**: `Java 17`", item.source());
    }

    @Test
    void whenParsing_givenTable_shouldReturnRowsHeaderFirst() {
        final Block table = parser.parse("""
                | Name | Type | Constraint |
                |------|------|------------|
                | id | UUID | primary key |
                | email | string | unique |
                """).get(0);

        assertEquals(List.of(
                List.of("Name", "Type", "Constraint"),
                List.of("id", "UUID", "primary key"),
                List.of("email", "string", "unique")), table.rows());
    }

    @Test
    void whenParsing_givenFencedCode_shouldKeepLanguageAndContent() {
        final Block code = parser.parse("""
                ```sql
                SELECT 1;
                ```
                """).get(0);

        assertEquals("sql", code.language());
        assertEquals("SELECT 1;", code.text());
    }

    @Test
    void whenParsing_givenFrontMatter_shouldDropIt() {
        final List<Block> blocks = parser.parse("""
                ---
                title: ignored
                ---
                # Heading
                """);

        assertEquals(1, blocks.size());
        assertTrue(blocks.get(0).isHeading(1));
    }

    @Test
    void whenParsing_givenHeadingDepths_shouldRecordDepth() {
        final List<Block> blocks = parser.parse("## Two\n\n#### Four\n");

        assertEquals(2, blocks.get(0).depth());
        assertEquals(4, blocks.get(1).depth());
        assertEquals("Four", blocks.get(1).text());
    }

    @Test
    void whenParsing_givenNullOrEmpty_shouldReturnNoBlocks() {
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("").isEmpty());
    }

}
