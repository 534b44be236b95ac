package co.fanki.specsync.feature.domain;

/**
 * Progress of a task, as marked by its checkbox.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum TaskStatus {

    /** Empty checkbox. */
    NOT_STARTED("not_started"),

    /** Checkbox marked with {@code /}. */
    IN_PROGRESS("in_progress"),

    /** Checkbox marked with {@code x}. */
    DONE("done");

    private final String value;

    TaskStatus(final String theValue) {
        this.value = theValue;
    }

    /**
     * Maps the character inside a checkbox to a status.
     *
     * @param mark the checkbox content, may be null or empty
     * @return the matching status, {@link #NOT_STARTED} for anything unknown
     */
    public static TaskStatus fromCheckbox(final String mark) {
        if (mark == null) {
            return NOT_STARTED;
        }
        if ("x".equalsIgnoreCase(mark)) {
            return DONE;
        }
        if ("/".equals(mark)) {
            return IN_PROGRESS;
        }
        return NOT_STARTED;
    }

    /**
     * Resolves a stored value.
     *
     * @param value the stored value
     * @return the status
     * @throws IllegalArgumentException if the value is unknown
     */
    public static TaskStatus fromValue(final String value) {
        for (final TaskStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }

    /**
     * Returns the value persisted for this status.
     *
     * @return the lower-case value, e.g. {@code not_started}
     */
    public String value() {
        return value;
    }

}
