package co.fanki.specsync.project.application;

import co.fanki.specsync.project.application.ProjectService.SyncAllResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled component that periodically re-runs the full sync of every
 * registered project.
 *
 * <p>Catches edits the watcher missed, e.g. changes made while the server
 * was down or while another project was selected.</p>
 *
 * <p>Opt-in via {@code sync.enabled=true}. Disabled by default.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConditionalOnProperty(
        name = "sync.enabled",
        havingValue = "true",
        matchIfMissing = false)
public class ProjectSyncScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProjectSyncScheduler.class);

    private final ProjectService projectService;

    /**
     * Creates a new ProjectSyncScheduler.
     *
     * @param theProjectService the project service
     */
    public ProjectSyncScheduler(final ProjectService theProjectService) {
        this.projectService = theProjectService;
    }

    /**
     * Runs the full sync for all projects.
     */
    @Scheduled(cron = "${sync.cron:0 0 2 * * *}")
    public void syncAllProjects() {
        LOG.info("Starting scheduled project sync");

        final SyncAllResult result = projectService.syncAll();

        LOG.info("Scheduled sync complete. Success: {}, Failed: {}",
                result.succeeded(), result.failed());
    }
}
