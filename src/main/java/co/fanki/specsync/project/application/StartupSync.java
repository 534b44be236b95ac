package co.fanki.specsync.project.application;

import co.fanki.specsync.project.application.ProjectService.SyncAllResult;
import co.fanki.specsync.project.domain.Project;
import co.fanki.specsync.shared.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Cold start: syncs every registered project once the application is up
 * and resumes watching the most recently opened one.
 *
 * <p>{@code specsync.sync.on-startup} and {@code specsync.watcher.enabled}
 * switch the two steps off independently.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class StartupSync {

    private static final Logger LOG = LoggerFactory.getLogger(
            StartupSync.class);

    private final ProjectService projectService;
    private final boolean syncOnStartup;
    private final boolean watcherEnabled;

    /**
     * Creates a new StartupSync.
     *
     * @param theProjectService the project service
     * @param theSyncOnStartup whether to run the full sync
     * @param theWatcherEnabled whether to resume watching
     */
    public StartupSync(
            final ProjectService theProjectService,
            @Value("${specsync.sync.on-startup:true}")
            final boolean theSyncOnStartup,
            @Value("${specsync.watcher.enabled:true}")
            final boolean theWatcherEnabled) {
        this.projectService = theProjectService;
        this.syncOnStartup = theSyncOnStartup;
        this.watcherEnabled = theWatcherEnabled;
    }

    /**
     * Runs the cold start steps.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (syncOnStartup) {
            final SyncAllResult result = projectService.syncAll();
            LOG.info("Startup sync complete. Success: {}, Failed: {}",
                    result.succeeded(), result.failed());
        }

        if (!watcherEnabled) {
            return;
        }
        final List<Project> projects = projectService.listProjects();
        if (projects.isEmpty()) {
            LOG.info("No registered projects to watch");
            return;
        }
        final Project latest = projects.get(0);
        try {
            projectService.watch(latest.id());
        } catch (final DomainException e) {
            LOG.error("Cannot watch project {}: {}", latest.name(),
                    e.getMessage(), e);
        }
    }

}
