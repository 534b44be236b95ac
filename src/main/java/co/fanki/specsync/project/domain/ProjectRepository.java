package co.fanki.specsync.project.domain;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for persisting and retrieving projects.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class ProjectRepository {

    /** Find project by ID. Uses: PK index. */
    public static final String FIND_BY_ID =
            "SELECT * FROM projects WHERE id = :id";

    /** Find project by root directory. Uses: UNIQUE constraint on root_path. */
    public static final String FIND_BY_ROOT_PATH =
            "SELECT * FROM projects WHERE root_path = :rootPath";

    /** Find all projects, most recently opened first. Uses: seq scan. */
    public static final String FIND_ALL =
            "SELECT * FROM projects ORDER BY last_opened_at DESC";

    private final Jdbi jdbi;

    /**
     * Creates a new ProjectRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public ProjectRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    /**
     * Saves a new project.
     *
     * @param project the project to save
     */
    public void save(final Project project) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO projects (
                    id, name, root_path, created_at, last_opened_at,
                    last_synced_at
                ) VALUES (
                    :id, :name, :rootPath, :createdAt, :lastOpenedAt,
                    :lastSyncedAt
                )
                """)
                .bind("id", project.id())
                .bind("name", project.name())
                .bind("rootPath", project.rootPath())
                .bind("createdAt", toTimestamp(project.createdAt()))
                .bind("lastOpenedAt", toTimestamp(project.lastOpenedAt()))
                .bind("lastSyncedAt", toTimestamp(project.lastSyncedAt()))
                .execute());
    }

    /**
     * Updates an existing project.
     *
     * @param project the project to update
     */
    public void update(final Project project) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                UPDATE projects SET
                    name = :name,
                    last_opened_at = :lastOpenedAt,
                    last_synced_at = :lastSyncedAt
                WHERE id = :id
                """)
                .bind("id", project.id())
                .bind("name", project.name())
                .bind("lastOpenedAt", toTimestamp(project.lastOpenedAt()))
                .bind("lastSyncedAt", toTimestamp(project.lastSyncedAt()))
                .execute());
    }

    /**
     * Finds a project by its ID.
     *
     * @param id the project ID
     * @return the project if found
     */
    public Optional<Project> findById(final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ID)
                .bind("id", id)
                .map(new ProjectRowMapper())
                .findOne());
    }

    /**
     * Finds a project by its root directory.
     *
     * @param rootPath the absolute, normalized root directory
     * @return the project if found
     */
    public Optional<Project> findByRootPath(final String rootPath) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ROOT_PATH)
                .bind("rootPath", rootPath)
                .map(new ProjectRowMapper())
                .findOne());
    }

    /**
     * Finds all projects, most recently opened first.
     *
     * @return list of all projects
     */
    public List<Project> findAll() {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_ALL)
                .map(new ProjectRowMapper())
                .list());
    }

    /**
     * Deletes a project. Its features and their records go with it.
     *
     * @param id the project ID
     */
    public void delete(final String id) {
        jdbi.useHandle(handle -> handle
                .createUpdate("DELETE FROM projects WHERE id = :id")
                .bind("id", id)
                .execute());
    }

    private static Timestamp toTimestamp(final Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(final Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static final class ProjectRowMapper implements RowMapper<Project> {

        @Override
        public Project map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return Project.reconstitute(
                    rs.getString("id"),
                    rs.getString("name"),
                    rs.getString("root_path"),
                    rs.getTimestamp("created_at").toInstant(),
                    rs.getTimestamp("last_opened_at").toInstant(),
                    toInstant(rs.getTimestamp("last_synced_at")));
        }
    }

}
