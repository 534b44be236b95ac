package co.fanki.specsync.watch.domain;

/**
 * Receives the debounced change events of a {@link ChangeWatcher}.
 *
 * <p>Callbacks run on the watcher's single debounce thread, one at a
 * time.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface ChangeListener {

    /**
     * Handles one coalesced change.
     *
     * @param event the change, never null
     */
    void onChange(FileChangeEvent event);

}
