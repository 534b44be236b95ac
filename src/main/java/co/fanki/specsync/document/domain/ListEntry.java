package co.fanki.specsync.document.domain;

import java.util.List;

/**
 * One item of a list block.
 *
 * <p>The item's own content excludes nested lists, which are exposed as
 * {@link #children()} instead.</p>
 *
 * @param text the flattened text of the item, inline formatting stripped
 * @param source the raw markup of the item without its bullet marker
 * @param children the items of lists nested under this one, may be empty
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ListEntry(
        String text,
        String source,
        List<ListEntry> children
) {

    /**
     * Creates a list entry, copying the children defensively.
     */
    public ListEntry {
        text = text == null ? "" : text.trim();
        source = source == null ? "" : source.trim();
        children = children == null ? List.of() : List.copyOf(children);
    }

}
