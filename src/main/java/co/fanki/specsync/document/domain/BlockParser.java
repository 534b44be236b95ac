package co.fanki.specsync.document.domain;

import java.util.List;

/**
 * Turns raw document text into an ordered sequence of top-level blocks.
 *
 * <p>This is the only seam through which the format parsers see document
 * structure, so they do not depend on the markup library in use.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface BlockParser {

    /**
     * Parses the given text.
     *
     * @param text the document text, may be empty
     * @return the top-level blocks in document order, never null
     */
    List<Block> parse(String text);

}
