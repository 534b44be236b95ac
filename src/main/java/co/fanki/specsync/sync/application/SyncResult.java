package co.fanki.specsync.sync.application;

import java.util.List;

/**
 * Outcome of a full project sync.
 *
 * @param synced the number of feature directories synced without error
 * @param errors one message per feature that failed, in walk order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SyncResult(int synced, List<String> errors) {

    /**
     * Copies the errors.
     */
    public SyncResult {
        errors = List.copyOf(errors);
    }

    /**
     * Checks whether every feature synced.
     *
     * @return true if there are no errors
     */
    public boolean success() {
        return errors.isEmpty();
    }

}
