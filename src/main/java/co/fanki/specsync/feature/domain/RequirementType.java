package co.fanki.specsync.feature.domain;

/**
 * Classification of a requirement.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum RequirementType {

    FUNCTIONAL("functional"),

    NON_FUNCTIONAL("non_functional"),

    CONSTRAINT("constraint");

    private final String value;

    RequirementType(final String theValue) {
        this.value = theValue;
    }

    /**
     * Classifies a requirement by its identifier prefix.
     *
     * @param requirementId the identifier, e.g. {@code NFR-002}
     * @return {@link #NON_FUNCTIONAL} for {@code NFR-} ids, otherwise
     *         {@link #FUNCTIONAL}
     */
    public static RequirementType fromRequirementId(final String requirementId) {
        if (requirementId != null
                && requirementId.regionMatches(true, 0, "NFR", 0, 3)) {
            return NON_FUNCTIONAL;
        }
        return FUNCTIONAL;
    }

    /**
     * Resolves a stored value.
     *
     * @param value the stored value
     * @return the type
     * @throws IllegalArgumentException if the value is unknown
     */
    public static RequirementType fromValue(final String value) {
        for (final RequirementType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException(
                "Unknown requirement type: " + value);
    }

    public String value() {
        return value;
    }

}
