package co.fanki.specsync.document.domain;

/**
 * The structural kinds a document block can take.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum BlockKind {

    /** A heading; the block carries its depth (1 for {@code #}). */
    HEADING,

    /** A run of inline text. */
    PARAGRAPH,

    /** A bullet or ordered list; the block carries its items. */
    LIST,

    /** A pipe table; the block carries its rows, header row first. */
    TABLE,

    /** A fenced or indented code block. */
    CODE,

    /** Anything else: quotes, rules, raw HTML. */
    OTHER

}
