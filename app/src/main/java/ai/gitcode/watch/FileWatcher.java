package ai.gitcode.watch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Watches one repository root and turns bursts of file changes into single {@link CommitCallback} invocations.
 *
 * <p>Raw events pass through the {@link PathFilter} and are buffered in a {@link DebounceBuffer}; once the debounce
 * period elapses with no further qualifying event the buffered change-set is handed to the callback on this
 * watcher's debounce thread. A callback that throws loses its change-set: the failure is logged and nothing is
 * retried.
 *
 * <p>While paused, events are observed and dropped. Pausing discards anything already buffered and resuming does not
 * replay what was missed.
 *
 * <p>{@link #stop()} cancels the pending timer, detaches the OS subscription and clears the buffer; a callback already
 * running when stop is called is allowed to finish. A stopped watcher can be started again. {@link #close()} stops
 * the watcher for good and releases its debounce thread.
 */
public class FileWatcher implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(FileWatcher.class);

    private static final long DEBOUNCE_THREAD_KEEP_ALIVE_SECONDS = 30;

    private final String triggerId;
    private final Path repoPath;
    private final CommitCallback callback;
    private final PathFilter pathFilter;
    private final Duration debounce;
    private final ChangeSubscriptionFactory subscriptionFactory;
    private final ScheduledThreadPoolExecutor debounceExecutor;
    private final DebounceBuffer buffer;

    // guarded by 'lock'
    private final ReentrantLock lock = new ReentrantLock();
    private boolean monitoring = false;
    private boolean paused = false;
    private boolean closed = false;

    @Nullable
    private IChangeSubscription subscription;

    @Nullable
    private Path realRoot;

    public FileWatcher(String triggerId, Path repoPath, CommitCallback callback, PathFilter pathFilter, Duration debounce) {
        this(triggerId, repoPath, callback, pathFilter, debounce, ChangeSubscriptionFactory.nativeFactory());
    }

    public FileWatcher(
            String triggerId,
            Path repoPath,
            CommitCallback callback,
            PathFilter pathFilter,
            Duration debounce,
            ChangeSubscriptionFactory subscriptionFactory) {
        if (debounce.isNegative()) {
            throw new IllegalArgumentException("Debounce must not be negative: " + debounce);
        }
        this.triggerId = triggerId;
        this.repoPath = repoPath.toAbsolutePath().normalize();
        this.callback = callback;
        this.pathFilter = pathFilter;
        this.debounce = debounce;
        this.subscriptionFactory = subscriptionFactory;

        var executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r);
            t.setName("FileWatcherDebouncer-" + triggerId);
            t.setDaemon(true);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setKeepAliveTime(DEBOUNCE_THREAD_KEEP_ALIVE_SECONDS, TimeUnit.SECONDS);
        executor.allowCoreThreadTimeOut(true);
        this.debounceExecutor = executor;

        this.buffer = new DebounceBuffer(triggerId, debounce, debounceExecutor, this::dispatch);
    }

    /**
     * Attach the OS subscription on the repository root.
     *
     * @return false if the root is not an existing directory or the subscription could not be attached; nothing is
     *     retained in that case
     */
    public boolean start() {
        lock.lock();
        try {
            if (closed) {
                logger.warn("[{}] Cannot start a closed watcher for {}", triggerId, repoPath);
                return false;
            }
            if (monitoring) {
                logger.debug("[{}] Already monitoring {}", triggerId, repoPath);
                return true;
            }
            if (!Files.isDirectory(repoPath)) {
                logger.error("[{}] Watch path does not exist or is not a directory: {}", triggerId, repoPath);
                return false;
            }

            IChangeSubscription attached;
            try {
                attached = subscriptionFactory.open(repoPath, new IChangeSubscription.Sink() {
                    @Override
                    public void onRawEvent(Path path, ChangeKind kind) {
                        FileWatcher.this.onRawEvent(path, kind);
                    }

                    @Override
                    public void onOverflow() {
                        logger.warn("[{}] Change notifications overflowed for {}", triggerId, repoPath);
                    }
                });
            } catch (IOException | RuntimeException e) {
                logger.error("[{}] Failed to start monitoring {}", triggerId, repoPath, e);
                return false;
            }

            subscription = attached;
            realRoot = resolveRealRoot(repoPath);
            monitoring = true;
            logger.info("[{}] Monitoring {} (debounce {} ms, ignoring {})", triggerId, repoPath, debounce.toMillis(),
                    pathFilter.patterns());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Entry point for the subscription layer. {@code path} is normally absolute; a relative path is taken as relative
     * to the repository root.
     */
    public void onRawEvent(Path path, ChangeKind kind) {
        var relativePath = relativize(path);
        if (relativePath == null) {
            logger.trace("[{}] Skipping event for path outside {}: {}", triggerId, repoPath, path);
            return;
        }
        if (pathFilter.shouldIgnore(relativePath)) {
            logger.trace("[{}] Ignoring {} on {}", triggerId, kind, relativePath);
            return;
        }

        lock.lock();
        try {
            if (!monitoring) {
                return;
            }
            if (paused) {
                logger.trace("[{}] Paused; dropping {} on {}", triggerId, kind, relativePath);
                return;
            }
            buffer.add(new FileChange(relativePath, kind));
        } finally {
            lock.unlock();
        }
    }

    public void pause() {
        lock.lock();
        try {
            if (paused) {
                return;
            }
            paused = true;
            int discarded = buffer.discard();
            logger.info("[{}] Paused monitoring of {} ({} pending changes discarded)", triggerId, repoPath, discarded);
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            if (!paused) {
                return;
            }
            paused = false;
            logger.info("[{}] Resumed monitoring of {}", triggerId, repoPath);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Dispatch whatever is buffered now instead of waiting for the debounce period.
     *
     * @return false if the watcher is not monitoring or nothing is buffered
     */
    public boolean flush() {
        lock.lock();
        try {
            if (!monitoring) {
                return false;
            }
            return buffer.flushNow();
        } finally {
            lock.unlock();
        }
    }

    /** Idempotent. */
    public boolean stop() {
        IChangeSubscription detached;
        lock.lock();
        try {
            int discarded = buffer.discard();
            detached = subscription;
            subscription = null;
            realRoot = null;
            if (!monitoring) {
                return true;
            }
            monitoring = false;
            logger.info("[{}] Stopped monitoring {} ({} pending changes discarded)", triggerId, repoPath, discarded);
        } finally {
            lock.unlock();
        }

        // closing waits for the event thread, which may be blocked on 'lock'
        if (detached != null) {
            try {
                detached.close();
            } catch (RuntimeException e) {
                logger.error("[{}] Error detaching change subscription for {}", triggerId, repoPath, e);
            }
        }
        return true;
    }

    @Override
    public void close() {
        stop();
        lock.lock();
        try {
            closed = true;
        } finally {
            lock.unlock();
        }
        debounceExecutor.shutdown();
    }

    public WatcherStatus status() {
        lock.lock();
        try {
            return new WatcherStatus(
                    triggerId, repoPath, monitoring, paused, buffer.pendingCount(), debounce, buffer.armedAt());
        } finally {
            lock.unlock();
        }
    }

    public boolean isMonitoring() {
        lock.lock();
        try {
            return monitoring;
        } finally {
            lock.unlock();
        }
    }

    public boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }

    public String triggerId() {
        return triggerId;
    }

    public Path repoPath() {
        return repoPath;
    }

    public Duration debounce() {
        return debounce;
    }

    private void dispatch(ChangeSet changes) {
        logger.info("[{}] Dispatching {} changed paths for {}", triggerId, changes.size(), repoPath);
        try {
            callback.onChangesReady(repoPath, changes);
        } catch (Exception e) {
            logger.error(
                    "[{}] Commit callback failed for {} changed paths in {}; change-set discarded",
                    triggerId,
                    changes.size(),
                    repoPath,
                    e);
        }
    }

    private @Nullable String relativize(Path path) {
        Path relative;
        if (!path.isAbsolute()) {
            relative = path.normalize();
        } else {
            var normalized = path.normalize();
            Path base;
            lock.lock();
            try {
                base = normalized.startsWith(repoPath) ? repoPath : realRoot;
            } finally {
                lock.unlock();
            }
            if (base == null || !normalized.startsWith(base)) {
                return null;
            }
            relative = base.relativize(normalized);
        }
        var unix = relative.toString().replace('\\', '/');
        if (unix.isEmpty() || unix.startsWith("../") || unix.equals("..")) {
            return null;
        }
        return unix;
    }

    private static @Nullable Path resolveRealRoot(Path root) {
        // Events may report the resolved path (symlinked temp dirs on macOS, 8.3 names on Windows)
        try {
            var real = root.toRealPath();
            return real.equals(root) ? null : real;
        } catch (IOException e) {
            logger.debug("Could not resolve real path of {}: {}", root, e.getMessage());
            return null;
        }
    }
}
