package co.fanki.specsync.feature.domain;

import co.fanki.specsync.shared.Preconditions;

/**
 * One attribute of a data-model entity.
 *
 * @param name the attribute name
 * @param type the declared type, {@value #DEFAULT_TYPE} when none was given
 * @param constraint free-text constraints, may be null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Attribute(
        String name,
        String type,
        String constraint
) {

    /** Type assumed for attributes that do not declare one. */
    public static final String DEFAULT_TYPE = "string";

    /**
     * Validates the attribute.
     */
    public Attribute {
        Preconditions.requireNonBlank(name, "Attribute name is required");
        type = type == null || type.isBlank() ? DEFAULT_TYPE : type;
        constraint = constraint == null || constraint.isBlank()
                ? null : constraint;
    }

}
