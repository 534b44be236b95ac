package co.fanki.specsync.project.domain;

import co.fanki.specsync.shared.Preconditions;

import java.nio.file.Path;
import java.time.Instant;
import java.util.UUID;

/**
 * Aggregate root representing a project: a directory on disk whose
 * {@code specs} tree is mirrored into the store.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Project {

    private final String id;
    private String name;
    private final String rootPath;
    private final Instant createdAt;
    private Instant lastOpenedAt;
    private Instant lastSyncedAt;

    private Project(
            final String theId,
            final String theName,
            final String theRootPath,
            final Instant theCreatedAt) {
        this.id = Preconditions.requireNonBlank(theId, "Project ID is required");
        this.name = Preconditions.requireNonBlank(theName,
                "Project name is required");
        this.rootPath = Preconditions.requireNonBlank(theRootPath,
                "Project root path is required");
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
        this.lastOpenedAt = this.createdAt;
    }

    /**
     * Creates a new project for a root directory.
     *
     * <p>The name defaults to the directory's base name.</p>
     *
     * @param name the project name, may be null
     * @param root the absolute, normalized root directory
     * @return a new Project instance
     */
    public static Project create(final String name, final Path root) {
        Preconditions.requireNonNull(root, "Project root is required");
        final String effectiveName = name == null || name.isBlank()
                ? baseName(root)
                : name.trim();
        return new Project(
                UUID.randomUUID().toString(),
                effectiveName,
                root.toString(),
                Instant.now());
    }

    /**
     * Reconstitutes a project from persistence.
     *
     * @param id the project ID
     * @param name the project name
     * @param rootPath the root directory
     * @param createdAt when created
     * @param lastOpenedAt when last registered or selected
     * @param lastSyncedAt when the last full sync finished, may be null
     * @return the reconstituted Project
     */
    public static Project reconstitute(
            final String id,
            final String name,
            final String rootPath,
            final Instant createdAt,
            final Instant lastOpenedAt,
            final Instant lastSyncedAt) {
        final Project project = new Project(id, name, rootPath, createdAt);
        project.lastOpenedAt = lastOpenedAt;
        project.lastSyncedAt = lastSyncedAt;
        return project;
    }

    /**
     * Records that the project was opened again.
     */
    public void touch() {
        this.lastOpenedAt = Instant.now();
    }

    /**
     * Records a finished full sync.
     */
    public void markSynced() {
        this.lastSyncedAt = Instant.now();
    }

    /**
     * Updates the project name.
     *
     * @param newName the new name
     */
    public void rename(final String newName) {
        this.name = Preconditions.requireNonBlank(newName,
                "Project name is required");
    }

    /**
     * Returns the root directory as a path.
     *
     * @return the root
     */
    public Path root() {
        return Path.of(rootPath);
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String rootPath() {
        return rootPath;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastOpenedAt() {
        return lastOpenedAt;
    }

    public Instant lastSyncedAt() {
        return lastSyncedAt;
    }

    private static String baseName(final Path root) {
        final Path fileName = root.getFileName();
        return fileName == null ? root.toString() : fileName.toString();
    }

}
