package co.fanki.specsync.feature.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Cardinality of a relationship between two entities.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum Cardinality {

    ONE_TO_ONE("1:1"),

    ONE_TO_MANY("1:N"),

    MANY_TO_ONE("N:1"),

    MANY_TO_MANY("N:N");

    private final String label;

    Cardinality(final String theLabel) {
        this.label = theLabel;
    }

    /**
     * Infers the cardinality mentioned in a line of prose.
     *
     * <p>Looks for the notation ({@code 1:N}) or the spelled-out form
     * ({@code one-to-many}); defaults to {@link #ONE_TO_ONE}.</p>
     *
     * @param text the relationship description
     * @return the inferred cardinality
     */
    public static Cardinality infer(final String text) {
        final String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        if (lower.contains("1:n") || lower.contains("one-to-many")) {
            return ONE_TO_MANY;
        }
        if (lower.contains("n:1") || lower.contains("many-to-one")) {
            return MANY_TO_ONE;
        }
        if (lower.contains("n:n") || lower.contains("many-to-many")) {
            return MANY_TO_MANY;
        }
        return ONE_TO_ONE;
    }

    /**
     * Resolves a label such as {@code 1:N}.
     *
     * @param label the label
     * @return the cardinality
     * @throws IllegalArgumentException if the label is unknown
     */
    @JsonCreator
    public static Cardinality fromLabel(final String label) {
        for (final Cardinality cardinality : values()) {
            if (cardinality.label.equalsIgnoreCase(label)) {
                return cardinality;
            }
        }
        throw new IllegalArgumentException("Unknown cardinality: " + label);
    }

    @JsonValue
    public String label() {
        return label;
    }

}
