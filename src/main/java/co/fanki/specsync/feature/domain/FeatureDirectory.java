package co.fanki.specsync.feature.domain;

import co.fanki.specsync.shared.Preconditions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * A feature directory of the form {@code <root>/specs/<NNN>-<name>}.
 *
 * @param featureNumber the zero-padded three digit number, e.g. "003"
 * @param name the part of the directory name after the number
 * @param path the directory itself
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FeatureDirectory(
        String featureNumber,
        String name,
        Path path
) {

    /** Name of the directory holding the feature directories. */
    public static final String SPECS_DIR = "specs";

    private static final Pattern DIRECTORY_NAME = Pattern.compile(
            "^(\\d{3})-(.+)$");

    /**
     * Validates the directory.
     */
    public FeatureDirectory {
        Preconditions.requireNonBlank(featureNumber,
                "Feature number is required");
        Preconditions.requireNonBlank(name, "Feature name is required");
        Preconditions.requireNonNull(path, "Feature path is required");
    }

    /**
     * Interprets a directory as a feature directory.
     *
     * @param directory the directory
     * @return the feature directory, empty if the name does not follow the
     *         {@code NNN-name} convention
     */
    public static Optional<FeatureDirectory> of(final Path directory) {
        if (directory == null || directory.getFileName() == null) {
            return Optional.empty();
        }
        final Matcher matcher = DIRECTORY_NAME.matcher(
                directory.getFileName().toString());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new FeatureDirectory(matcher.group(1),
                matcher.group(2), directory));
    }

    /**
     * Finds the feature directory a path belongs to, i.e. the closest
     * ancestor named {@code NNN-name} whose parent is {@code specs}.
     *
     * @param file any path, usually a changed document
     * @return the owning feature directory, empty if the path is outside
     *         every {@code specs/NNN-*} directory
     */
    public static Optional<FeatureDirectory> resolve(final Path file) {
        Path current = file;
        while (current != null) {
            final Path parent = current.getParent();
            if (parent != null && parent.getFileName() != null
                    && SPECS_DIR.equals(parent.getFileName().toString())) {
                final Optional<FeatureDirectory> directory = of(current);
                if (directory.isPresent()) {
                    return directory;
                }
            }
            current = parent;
        }
        return Optional.empty();
    }

    /**
     * Lists the feature directories of a specs directory, sorted by name.
     *
     * @param specsDirectory the {@code specs} directory
     * @return the feature directories
     * @throws IOException if the directory cannot be listed
     */
    public static List<FeatureDirectory> list(final Path specsDirectory)
            throws IOException {
        try (Stream<Path> children = Files.list(specsDirectory)) {
            return children
                    .filter(Files::isDirectory)
                    .sorted(Comparator.comparing(Path::getFileName))
                    .map(FeatureDirectory::of)
                    .flatMap(Optional::stream)
                    .toList();
        }
    }

    /**
     * Returns the numeric feature number.
     *
     * @return the number, e.g. 3 for "003"
     */
    public int number() {
        return Integer.parseInt(featureNumber);
    }

    /**
     * Returns the project root, two levels above this directory.
     *
     * @return the project root
     */
    public Path projectRoot() {
        return path.getParent().getParent();
    }

    /**
     * Returns the directory name, e.g. {@code 003-login}.
     *
     * @return the directory name
     */
    public String directoryName() {
        return path.getFileName().toString();
    }

}
