package co.fanki.specsync.watch.domain;

import co.fanki.specsync.feature.domain.FeatureDirectory;
import co.fanki.specsync.shared.Preconditions;

import java.nio.file.Path;

/**
 * A debounced change of one document.
 *
 * @param kind the kind of the last raw event seen for the path
 * @param path the absolute, normalized document path
 * @param featureNumber the number of the feature directory the path lives
 *        in, null when the path is outside every {@code specs/NNN-*}
 *        directory
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileChangeEvent(
        ChangeKind kind,
        Path path,
        Integer featureNumber
) {

    /**
     * Validates the event.
     */
    public FileChangeEvent {
        Preconditions.requireNonNull(kind, "Change kind is required");
        Preconditions.requireNonNull(path, "Path is required");
    }

    /**
     * Creates an event, resolving the feature number from the path.
     *
     * @param kind the change kind
     * @param path the changed path
     * @return the event
     */
    public static FileChangeEvent of(final ChangeKind kind, final Path path) {
        final Integer featureNumber = FeatureDirectory.resolve(path)
                .map(FeatureDirectory::number)
                .orElse(null);
        return new FileChangeEvent(kind, path, featureNumber);
    }

    /**
     * Checks whether the path belongs to a feature directory.
     *
     * @return true if a feature number was resolved
     */
    public boolean hasFeature() {
        return featureNumber != null;
    }

}
