package co.fanki.specsync.watch.domain;

import co.fanki.specsync.shared.DomainException;
import co.fanki.specsync.shared.Preconditions;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Watches directory trees for document changes and reports each change
 * once the path has been quiet for the debounce interval.
 *
 * <p>Only paths ending in {@value #DOCUMENT_EXTENSION} are considered.
 * Every raw event on a path cancels the timer pending for that path and
 * arms a new one, so a burst of events yields a single
 * {@link FileChangeEvent} carrying the kind of the last raw event.</p>
 *
 * <p>One watch session is active at a time. {@link #start} replaces the
 * running session and drops every pending timer.</p>
 *
 * <p>Listeners are called on the single debounce thread. A listener that
 * throws is logged and does not keep the others from being called.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class ChangeWatcher {

    private static final Logger LOG = LoggerFactory.getLogger(
            ChangeWatcher.class);

    /** Extension of the documents the watcher reports. */
    public static final String DOCUMENT_EXTENSION = ".md";

    private final long debounceMillis;
    private final ScheduledExecutorService scheduler;
    private final List<ChangeListener> listeners =
            new CopyOnWriteArrayList<>();

    /** Pending timers by path. Guarded by itself. */
    private final Map<Path, Timer> pending = new HashMap<>();

    /** Bumped by every stop. Guarded by {@link #pending}. */
    private long generation;

    private Session session;

    /**
     * Creates a new ChangeWatcher.
     *
     * @param theDebounceMillis the quiet interval in milliseconds
     */
    public ChangeWatcher(
            @Value("${specsync.watcher.debounce-ms:500}")
            final long theDebounceMillis) {
        this.debounceMillis = Preconditions.requirePositive(theDebounceMillis,
                "Debounce interval must be positive");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread thread = new Thread(r, "change-watcher-debounce");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Registers a listener for debounced changes.
     *
     * @param listener the listener
     */
    public void subscribe(final ChangeListener listener) {
        listeners.add(Preconditions.requireNonNull(listener,
                "Listener is required"));
    }

    /**
     * Starts a watch session on the given roots, replacing any running one.
     *
     * <p>Roots that do not exist are skipped. Each existing root is
     * watched recursively; directories created later are picked up as
     * they appear.</p>
     *
     * @param roots the directories to watch
     * @throws DomainException with code {@code WATCHER_START_FAILED} if the
     *         watch service cannot be opened
     */
    public synchronized void start(final Collection<Path> roots) {
        Preconditions.requireNonNull(roots, "Roots are required");
        stop();

        final WatchService watchService;
        try {
            watchService = FileSystems.getDefault().newWatchService();
        } catch (final IOException e) {
            throw new DomainException("Cannot open watch service: "
                    + e.getMessage(), "WATCHER_START_FAILED", e);
        }

        final Session next = new Session(watchService, generation());
        for (final Path root : roots) {
            final Path normalized = root.toAbsolutePath().normalize();
            if (!Files.isDirectory(normalized)) {
                LOG.debug("Skipping missing watch root {}", normalized);
                continue;
            }
            next.registerTree(normalized);
            next.roots.add(normalized);
        }
        next.begin();
        session = next;

        LOG.info("Watching {}", next.roots);
    }

    /**
     * Stops the running session, if any, and cancels every pending timer.
     * Events the stopped session is still dispatching are dropped.
     */
    public synchronized void stop() {
        if (session != null) {
            session.close();
            LOG.info("Stopped watching {}", session.roots);
            session = null;
        }
        synchronized (pending) {
            generation++;
            pending.values().forEach(Timer::cancel);
            pending.clear();
        }
    }

    /**
     * Stops watching and releases the debounce thread.
     */
    @PreDestroy
    public void close() {
        stop();
        scheduler.shutdownNow();
    }

    /**
     * Feeds one raw filesystem event into the debouncer.
     *
     * @param kind the raw event kind
     * @param path the affected path
     */
    public void onRawEvent(final ChangeKind kind, final Path path) {
        onRawEvent(kind, path, -1);
    }

    /**
     * Feeds one raw event read by a watch session. Events of a session
     * that has been stopped since are dropped.
     *
     * @param kind the raw event kind
     * @param path the affected path
     * @param sessionGeneration the generation the session started in, or
     *        -1 for events that belong to no session
     */
    void onRawEvent(final ChangeKind kind, final Path path,
            final long sessionGeneration) {
        if (kind == null || path == null || !isDocument(path)) {
            return;
        }
        if (scheduler.isShutdown()) {
            return;
        }
        final Path key = path.toAbsolutePath().normalize();

        synchronized (pending) {
            if (sessionGeneration >= 0 && sessionGeneration != generation) {
                LOG.debug("Dropping event of a stopped session for {}", key);
                return;
            }
            final Timer previous = pending.remove(key);
            if (previous != null) {
                previous.cancel();
            }
            final Timer timer = new Timer(kind);
            timer.future = scheduler.schedule(() -> fire(key, timer),
                    debounceMillis, TimeUnit.MILLISECONDS);
            pending.put(key, timer);
        }
    }

    /**
     * Returns the roots of the running session.
     *
     * @return the watched roots, empty when no session is running
     */
    public synchronized List<Path> watchedRoots() {
        return session == null ? List.of() : List.copyOf(session.roots);
    }

    /**
     * Returns the number of paths waiting for their quiet interval.
     *
     * @return the pending timer count
     */
    public int pendingCount() {
        synchronized (pending) {
            return pending.size();
        }
    }

    /** The current session generation. */
    long generation() {
        synchronized (pending) {
            return generation;
        }
    }

    private void fire(final Path key, final Timer timer) {
        synchronized (pending) {
            if (!pending.remove(key, timer)) {
                return;
            }
        }

        final FileChangeEvent event = FileChangeEvent.of(timer.kind, key);
        LOG.debug("{} {} (feature {})", event.kind().value(), key,
                event.featureNumber());

        for (final ChangeListener listener : listeners) {
            try {
                listener.onChange(event);
            } catch (final RuntimeException e) {
                LOG.error("Change listener failed for {}", key, e);
            }
        }
    }

    private static boolean isDocument(final Path path) {
        final Path fileName = path.getFileName();
        return fileName != null
                && fileName.toString().endsWith(DOCUMENT_EXTENSION);
    }

    // -- session --

    /** A pending debounce timer and the kind it will report. */
    private static final class Timer {

        private final ChangeKind kind;
        private ScheduledFuture<?> future;

        private Timer(final ChangeKind theKind) {
            this.kind = theKind;
        }

        private void cancel() {
            if (future != null) {
                future.cancel(false);
            }
        }
    }

    /** One watch service and the thread draining it. */
    private final class Session {

        private final WatchService watchService;
        private final Map<WatchKey, Path> directories =
                new ConcurrentHashMap<>();
        private final List<Path> roots = new ArrayList<>();
        private final long generation;
        private final Thread thread;

        private Session(final WatchService theWatchService,
                final long theGeneration) {
            this.watchService = theWatchService;
            this.generation = theGeneration;
            this.thread = new Thread(this::run, "change-watcher");
            this.thread.setDaemon(true);
        }

        private void begin() {
            thread.start();
        }

        private void close() {
            try {
                watchService.close();
            } catch (final IOException e) {
                LOG.warn("Failed to close watch service: {}", e.getMessage());
            }
        }

        private void registerTree(final Path root) {
            try {
                Files.walkFileTree(root, new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(final Path dir,
                            final BasicFileAttributes attrs)
                            throws IOException {
                        final WatchKey key = dir.register(watchService,
                                StandardWatchEventKinds.ENTRY_CREATE,
                                StandardWatchEventKinds.ENTRY_MODIFY,
                                StandardWatchEventKinds.ENTRY_DELETE);
                        directories.put(key, dir);
                        return FileVisitResult.CONTINUE;
                    }
                });
            } catch (final IOException | ClosedWatchServiceException e) {
                LOG.warn("Cannot watch {}: {}", root, e.getMessage());
            }
        }

        private void run() {
            while (true) {
                final WatchKey key;
                try {
                    key = watchService.take();
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (final ClosedWatchServiceException e) {
                    return;
                }

                final Path directory = directories.get(key);
                if (directory != null) {
                    for (final WatchEvent<?> event : key.pollEvents()) {
                        dispatch(directory, event);
                    }
                }
                if (!key.reset()) {
                    directories.remove(key);
                }
            }
        }

        private void dispatch(final Path directory,
                final WatchEvent<?> event) {
            if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                LOG.warn("Watch events lost under {}", directory);
                return;
            }
            final ChangeKind kind = ChangeKind.of(event.kind());
            final Path child = directory.resolve((Path) event.context());

            if (kind == ChangeKind.ADD
                    && Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                registerTree(child);
                announceTree(child);
                return;
            }
            onRawEvent(kind, child, generation);
        }

        /** Reports the documents of a directory that appeared whole. */
        private void announceTree(final Path directory) {
            try (Stream<Path> files = Files.walk(directory)) {
                files.filter(Files::isRegularFile)
                        .forEach(file -> onRawEvent(ChangeKind.ADD, file,
                                generation));
            } catch (final IOException e) {
                LOG.warn("Cannot list new directory {}: {}", directory,
                        e.getMessage());
            }
        }
    }

}
