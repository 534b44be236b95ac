package co.fanki.specsync.feature.domain;

import java.util.Locale;

/**
 * Lifecycle status of a feature, read from the {@code **Status**:} line of
 * its specification.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum FeatureStatus {

    DRAFT("draft"),

    APPROVED("approved"),

    IN_PROGRESS("in_progress"),

    COMPLETE("complete");

    private final String value;

    FeatureStatus(final String theValue) {
        this.value = theValue;
    }

    /**
     * Resolves a status written by a human.
     *
     * <p>Matching ignores case and treats spaces and dashes as
     * underscores. Anything unrecognized falls back to {@link #DRAFT}.</p>
     *
     * @param text the status text, may be null
     * @return the status, never null
     */
    public static FeatureStatus parse(final String text) {
        if (text == null || text.isBlank()) {
            return DRAFT;
        }
        final String normalized = text.trim().toLowerCase(Locale.ROOT)
                .replace('-', '_')
                .replace(' ', '_');
        for (final FeatureStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        return DRAFT;
    }

    /**
     * Returns the value persisted for this status.
     *
     * @return the lower-case value
     */
    public String value() {
        return value;
    }

}
