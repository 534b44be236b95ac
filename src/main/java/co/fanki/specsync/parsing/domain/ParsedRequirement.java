package co.fanki.specsync.parsing.domain;

import java.util.List;

/**
 * A requirement found in the requirements section of a specification.
 *
 * @param id the upper-cased identifier, e.g. {@code FR-001}
 * @param description the item text without the identifier
 * @param priority the {@code (Priority: Pn)} marker of the item, may be null
 * @param acceptanceCriteria the items nested under the requirement
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ParsedRequirement(
        String id,
        String description,
        String priority,
        List<String> acceptanceCriteria
) {

    /**
     * Copies the criteria.
     */
    public ParsedRequirement {
        acceptanceCriteria = acceptanceCriteria == null
                ? List.of() : List.copyOf(acceptanceCriteria);
    }

}
