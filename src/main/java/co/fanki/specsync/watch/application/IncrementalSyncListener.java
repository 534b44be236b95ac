package co.fanki.specsync.watch.application;

import co.fanki.specsync.feature.domain.FeatureDirectory;
import co.fanki.specsync.project.domain.Project;
import co.fanki.specsync.project.domain.ProjectRepository;
import co.fanki.specsync.shared.DomainException;
import co.fanki.specsync.sync.application.FeatureSyncService;
import co.fanki.specsync.watch.domain.ChangeListener;
import co.fanki.specsync.watch.domain.ChangeWatcher;
import co.fanki.specsync.watch.domain.FileChangeEvent;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Drives an incremental sync for every debounced document change.
 *
 * <p>Changes outside a feature directory are ignored, as are changes under
 * a root no registered project owns.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class IncrementalSyncListener implements ChangeListener {

    private static final Logger LOG = LoggerFactory.getLogger(
            IncrementalSyncListener.class);

    private final ChangeWatcher watcher;
    private final ProjectRepository projectRepository;
    private final FeatureSyncService featureSyncService;

    /**
     * Creates a new IncrementalSyncListener.
     *
     * @param theWatcher the watcher to subscribe to
     * @param theProjectRepository resolves the project owning a path
     * @param theFeatureSyncService applies the change
     */
    public IncrementalSyncListener(
            final ChangeWatcher theWatcher,
            final ProjectRepository theProjectRepository,
            final FeatureSyncService theFeatureSyncService) {
        this.watcher = theWatcher;
        this.projectRepository = theProjectRepository;
        this.featureSyncService = theFeatureSyncService;
    }

    @PostConstruct
    void init() {
        watcher.subscribe(this);
    }

    @Override
    public void onChange(final FileChangeEvent event) {
        if (!event.hasFeature()) {
            LOG.debug("Ignoring {}, not part of a feature", event.path());
            return;
        }

        final Optional<Project> project = FeatureDirectory.resolve(event.path())
                .map(directory -> directory.projectRoot().toString())
                .flatMap(projectRepository::findByRootPath);
        if (project.isEmpty()) {
            LOG.debug("No project owns {}", event.path());
            return;
        }

        try {
            final boolean handled = featureSyncService.syncPath(
                    project.get().id(), event.path());
            LOG.debug("{} {} handled: {}", event.kind().value(),
                    event.path(), handled);
        } catch (final DomainException e) {
            LOG.error("Incremental sync of {} failed: {}", event.path(),
                    e.getMessage(), e);
        }
    }

}
