package co.fanki.specsync.config;

import co.fanki.specsync.watch.domain.ChangeWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check controller providing endpoints for liveness and readiness probes.
 *
 * <p>{@code /ready} checks database connectivity and reports which
 * directories the change watcher is watching.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthCheckController {

    private static final Logger LOG = LoggerFactory.getLogger(
            HealthCheckController.class);

    private final DataSource dataSource;
    private final ChangeWatcher changeWatcher;

    /**
     * Creates a new HealthCheckController.
     *
     * @param theDataSource the data source for database connectivity checks
     * @param theChangeWatcher the watcher whose session is reported
     */
    public HealthCheckController(final DataSource theDataSource,
            final ChangeWatcher theChangeWatcher) {
        this.dataSource = theDataSource;
        this.changeWatcher = theChangeWatcher;
    }

    /**
     * Liveness probe endpoint.
     *
     * @return "ok" string
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("ok");
    }

    /**
     * Readiness probe endpoint.
     *
     * @return status map with component health information
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        final boolean databaseHealthy = checkDatabaseHealth();

        final Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", databaseHealthy ? "ready" : "not_ready");
        status.put("database", databaseHealthy ? "connected" : "disconnected");
        status.put("watching", changeWatcher.watchedRoots().stream()
                .map(Path::toString)
                .toList());
        status.put("pendingChanges", changeWatcher.pendingCount());

        if (databaseHealthy) {
            return ResponseEntity.ok(status);
        }
        return ResponseEntity.status(503).body(status);
    }

    private boolean checkDatabaseHealth() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(5);
        } catch (final SQLException e) {
            LOG.warn("Database is not reachable: {}", e.getMessage());
            return false;
        }
    }

}
