package co.fanki.specsync.document.domain;

import co.fanki.specsync.shared.Preconditions;

import java.util.List;
import java.util.function.Supplier;

/**
 * One structural unit of a parsed document.
 *
 * <p>Every block exposes two views of its content: {@link #text()}, the
 * concatenation of all leaf text with inline formatting stripped, and
 * {@link #source()}, the raw markup the block was parsed from. Parsers
 * read values from the flattened text and recognize bold-label markers
 * such as {@code **Status**:} on the source.</p>
 *
 * <p>The flattened text is computed on first access and cached.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Block {

    private final BlockKind kind;
    private final int depth;
    private final String source;
    private final String language;
    private final List<ListEntry> items;
    private final List<List<String>> rows;
    private final Supplier<String> textSupplier;
    private String text;

    private Block(
            final BlockKind theKind,
            final int theDepth,
            final String theSource,
            final String theLanguage,
            final List<ListEntry> theItems,
            final List<List<String>> theRows,
            final Supplier<String> theTextSupplier) {
        this.kind = Preconditions.requireNonNull(theKind,
                "Block kind is required");
        this.depth = theDepth;
        this.source = theSource == null ? "" : theSource;
        this.language = theLanguage;
        this.items = theItems == null ? List.of() : List.copyOf(theItems);
        this.rows = theRows == null ? List.of() : theRows.stream()
                .map(List::copyOf)
                .toList();
        this.textSupplier = Preconditions.requireNonNull(theTextSupplier,
                "Text supplier is required");
    }

    /**
     * Creates a heading block.
     *
     * @param depth the heading depth, 1 to 6
     * @param source the raw heading markup
     * @param text supplies the flattened heading text
     * @return the heading block
     */
    public static Block heading(final int depth, final String source,
            final Supplier<String> text) {
        Preconditions.require(depth >= 1 && depth <= 6,
                "Heading depth must be between 1 and 6");
        return new Block(BlockKind.HEADING, depth, source, null, null, null,
                text);
    }

    /**
     * Creates a paragraph block.
     *
     * @param source the raw paragraph markup
     * @param text supplies the flattened paragraph text
     * @return the paragraph block
     */
    public static Block paragraph(final String source,
            final Supplier<String> text) {
        return new Block(BlockKind.PARAGRAPH, 0, source, null, null, null,
                text);
    }

    /**
     * Creates a list block.
     *
     * @param source the raw list markup
     * @param items the top-level items of the list
     * @return the list block
     */
    public static Block list(final String source, final List<ListEntry> items) {
        return new Block(BlockKind.LIST, 0, source, null, items, null,
                () -> String.join("\n", items.stream()
                        .map(ListEntry::text)
                        .toList()));
    }

    /**
     * Creates a table block.
     *
     * @param source the raw table markup
     * @param rows the table rows, header row first, each a list of cells
     * @return the table block
     */
    public static Block table(final String source,
            final List<List<String>> rows) {
        return new Block(BlockKind.TABLE, 0, source, null, null, rows,
                () -> String.join("\n", rows.stream()
                        .map(row -> String.join(" | ", row))
                        .toList()));
    }

    /**
     * Creates a code block.
     *
     * @param source the raw code block markup, fences included
     * @param language the info string of a fenced block, may be null
     * @param content the code content without fences
     * @return the code block
     */
    public static Block code(final String source, final String language,
            final String content) {
        return new Block(BlockKind.CODE, 0, source, language, null, null,
                () -> content);
    }

    /**
     * Creates a block of a kind parsers do not interpret.
     *
     * @param source the raw markup
     * @param text supplies the flattened text
     * @return the block
     */
    public static Block other(final String source,
            final Supplier<String> text) {
        return new Block(BlockKind.OTHER, 0, source, null, null, null, text);
    }

    /**
     * Checks whether this block is a heading of the given depth.
     *
     * @param theDepth the depth to check
     * @return true if this is a heading at exactly that depth
     */
    public boolean isHeading(final int theDepth) {
        return kind == BlockKind.HEADING && depth == theDepth;
    }

    /**
     * Checks whether this block has the given kind.
     *
     * @param theKind the kind to check
     * @return true if the kinds match
     */
    public boolean is(final BlockKind theKind) {
        return kind == theKind;
    }

    /**
     * Returns the flattened text of this block.
     *
     * @return the text, trimmed, never null
     */
    public String text() {
        if (text == null) {
            final String computed = textSupplier.get();
            text = computed == null ? "" : computed.trim();
        }
        return text;
    }

    public BlockKind kind() {
        return kind;
    }

    public int depth() {
        return depth;
    }

    public String source() {
        return source;
    }

    public String language() {
        return language;
    }

    public List<ListEntry> items() {
        return items;
    }

    public List<List<String>> rows() {
        return rows;
    }

    @Override
    public String toString() {
        return kind + (kind == BlockKind.HEADING ? "(" + depth + ")" : "")
                + ": " + source;
    }

}
