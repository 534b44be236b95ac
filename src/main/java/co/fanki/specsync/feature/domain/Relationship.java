package co.fanki.specsync.feature.domain;

import co.fanki.specsync.shared.Preconditions;

/**
 * A relationship from one data-model entity to another.
 *
 * @param target the name of the related entity
 * @param cardinality the cardinality of the relationship
 * @param description the original line describing it, may be null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Relationship(
        String target,
        Cardinality cardinality,
        String description
) {

    /**
     * Validates the relationship.
     */
    public Relationship {
        Preconditions.requireNonBlank(target, "Relationship target is required");
        cardinality = cardinality == null ? Cardinality.ONE_TO_ONE : cardinality;
    }

}
