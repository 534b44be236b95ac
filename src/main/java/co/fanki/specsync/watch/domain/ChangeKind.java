package co.fanki.specsync.watch.domain;

import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;

/**
 * The kinds of filesystem change the watcher reports.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ChangeKind {

    /** A document appeared. */
    ADD("add"),

    /** A document's content changed. */
    CHANGE("change"),

    /** A document was removed. */
    UNLINK("unlink");

    private final String value;

    ChangeKind(final String theValue) {
        this.value = theValue;
    }

    /**
     * Maps a raw watch service event kind.
     *
     * @param kind the raw kind
     * @return the change kind, null for kinds that carry no path such as
     *         overflow
     */
    public static ChangeKind of(final WatchEvent.Kind<?> kind) {
        if (kind == StandardWatchEventKinds.ENTRY_CREATE) {
            return ADD;
        }
        if (kind == StandardWatchEventKinds.ENTRY_MODIFY) {
            return CHANGE;
        }
        if (kind == StandardWatchEventKinds.ENTRY_DELETE) {
            return UNLINK;
        }
        return null;
    }

    public String value() {
        return value;
    }

}
