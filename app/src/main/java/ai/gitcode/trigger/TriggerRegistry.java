package ai.gitcode.trigger;

import ai.gitcode.watch.ChangeSubscriptionFactory;
import ai.gitcode.watch.CommitCallback;
import ai.gitcode.watch.FileWatcher;
import ai.gitcode.watch.PathFilter;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Owns every trigger of a running instance: file watchers and schedule triggers keyed by a caller-supplied id.
 *
 * <p>All map mutation and iteration happen under one registry-wide lock, so bulk start/stop never interleaves with
 * add/remove. Adding with an id that is already registered replaces the old trigger; the old one is fully torn down
 * before the new one starts.
 *
 * <p>Nothing here throws for bad input or failed subscriptions: operations return false and log the cause. Use
 * {@link #open()} with try-with-resources to get a started registry that is stopped on exit.
 */
public class TriggerRegistry implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(TriggerRegistry.class);

    public static final double DEFAULT_DEBOUNCE_SECONDS = 5.0;

    private final ChangeSubscriptionFactory subscriptionFactory;
    private final Clock clock;
    private final boolean useDefaultIgnores;

    private final Object lock = new Object();

    // guarded by 'lock'
    private final Map<String, TriggerRecord> triggers = new LinkedHashMap<>();
    private boolean running = false;

    public TriggerRegistry() {
        this(ChangeSubscriptionFactory.nativeFactory(), Clock.systemDefaultZone(), true);
    }

    /**
     * @param useDefaultIgnores prepend {@link PathFilter#DEFAULT_PATTERNS} to every file trigger's ignore patterns
     */
    public TriggerRegistry(ChangeSubscriptionFactory subscriptionFactory, Clock clock, boolean useDefaultIgnores) {
        this.subscriptionFactory = subscriptionFactory;
        this.clock = clock;
        this.useDefaultIgnores = useDefaultIgnores;
    }

    /** A started registry with default settings; {@link #close()} stops it. */
    public static TriggerRegistry open() {
        return open(ChangeSubscriptionFactory.nativeFactory(), Clock.systemDefaultZone(), true);
    }

    /** A started registry; {@link #close()} stops it. */
    public static TriggerRegistry open(
            ChangeSubscriptionFactory subscriptionFactory, Clock clock, boolean useDefaultIgnores) {
        var registry = new TriggerRegistry(subscriptionFactory, clock, useDefaultIgnores);
        registry.start();
        return registry;
    }

    public boolean addFileTrigger(String id, Path repoPath, CommitCallback callback) {
        return addFileTrigger(id, repoPath, callback, List.of(), DEFAULT_DEBOUNCE_SECONDS);
    }

    public boolean addFileTrigger(
            String id, Path repoPath, CommitCallback callback, @Nullable List<String> ignorePatterns) {
        return addFileTrigger(id, repoPath, callback, ignorePatterns, DEFAULT_DEBOUNCE_SECONDS);
    }

    public boolean addFileTrigger(
            String id,
            Path repoPath,
            CommitCallback callback,
            @Nullable List<String> ignorePatterns,
            double debounceSeconds) {
        if (!Double.isFinite(debounceSeconds) || debounceSeconds < 0) {
            logger.error("[{}] Invalid debounce of {} seconds for {}", id, debounceSeconds, repoPath);
            return false;
        }
        return addFileTrigger(
                id, repoPath, callback, ignorePatterns, Duration.ofNanos(Math.round(debounceSeconds * 1_000_000_000d)));
    }

    /**
     * Create a watcher for {@code repoPath} and start it. The trigger is registered only if the watcher starts.
     *
     * @param ignorePatterns null is the same as no patterns
     * @return false on an invalid path, a malformed ignore pattern or a subscription that cannot be attached
     */
    public boolean addFileTrigger(
            String id,
            Path repoPath,
            CommitCallback callback,
            @Nullable List<String> ignorePatterns,
            Duration debounce) {
        var patterns = ignorePatterns == null ? List.<String>of() : ignorePatterns;
        synchronized (lock) {
            replaceExisting(id);

            PathFilter filter;
            FileWatcher watcher;
            try {
                filter = useDefaultIgnores ? PathFilter.withDefaults(patterns) : PathFilter.of(patterns);
                watcher = new FileWatcher(id, repoPath, callback, filter, debounce, subscriptionFactory);
            } catch (RuntimeException e) {
                logger.error("[{}] Cannot add file trigger for {}: {}", id, repoPath, e.toString());
                return false;
            }

            if (!watcher.start()) {
                watcher.close();
                logger.error("[{}] Failed to start file monitoring for {}", id, repoPath);
                return false;
            }

            triggers.put(id, TriggerRecord.forWatcher(id, watcher, callback, clock.instant()));
            logger.info("[{}] File trigger added for {}", id, repoPath);
            return true;
        }
    }

    /** Register a time-based trigger and start it. Same replace rules as {@link #addFileTrigger}. */
    public boolean addScheduleTrigger(String id, Path repoPath, CommitCallback callback, Schedule schedule) {
        synchronized (lock) {
            replaceExisting(id);

            ScheduledTrigger scheduledTrigger;
            try {
                scheduledTrigger = new ScheduledTrigger(id, repoPath, callback, schedule, clock);
            } catch (RuntimeException e) {
                logger.error("[{}] Cannot add schedule trigger for {}: {}", id, repoPath, e.toString());
                return false;
            }
            if (!scheduledTrigger.start()) {
                scheduledTrigger.close();
                logger.error("[{}] Failed to start schedule trigger for {}", id, repoPath);
                return false;
            }

            triggers.put(id, TriggerRecord.forSchedule(id, scheduledTrigger, callback, clock.instant()));
            logger.info("[{}] Schedule trigger added for {} ({})", id, repoPath, schedule);
            return true;
        }
    }

    /**
     * Stop and unregister a trigger.
     *
     * @return false if no trigger with that id is registered
     */
    public boolean removeTrigger(String id) {
        synchronized (lock) {
            var record = triggers.remove(id);
            if (record == null) {
                logger.warn("[{}] Trigger does not exist", id);
                return false;
            }
            record.tearDown();
            logger.info("[{}] Trigger removed", id);
            return true;
        }
    }

    /**
     * Start every registered trigger that is not already running. A trigger that fails to start is logged and left
     * stopped; the others still start.
     */
    public boolean start() {
        synchronized (lock) {
            if (running) {
                logger.debug("Trigger registry already running");
                return true;
            }
            int failed = 0;
            for (var record : triggers.values()) {
                var watcher = record.watcher();
                if (watcher != null && !watcher.isMonitoring() && !watcher.start()) {
                    failed++;
                    logger.warn("[{}] Watcher failed to start for {}", record.id(), record.repoPath());
                }
                var scheduledTrigger = record.scheduledTrigger();
                if (scheduledTrigger != null) {
                    scheduledTrigger.start();
                }
            }
            running = true;
            logger.info("Trigger registry started with {} triggers ({} failed to start)", triggers.size(), failed);
            return true;
        }
    }

    /** Stop every trigger, whatever its individual state. Triggers stay registered. */
    public boolean stop() {
        synchronized (lock) {
            for (var record : triggers.values()) {
                var watcher = record.watcher();
                if (watcher != null) {
                    watcher.stop();
                }
                var scheduledTrigger = record.scheduledTrigger();
                if (scheduledTrigger != null) {
                    scheduledTrigger.stop();
                }
            }
            if (running) {
                logger.info("Trigger registry stopped");
            }
            running = false;
            return true;
        }
    }

    public boolean pauseTrigger(String id) {
        synchronized (lock) {
            var watcher = fileWatcher(id, "pause");
            if (watcher == null) {
                return false;
            }
            watcher.pause();
            return true;
        }
    }

    public boolean resumeTrigger(String id) {
        synchronized (lock) {
            var watcher = fileWatcher(id, "resume");
            if (watcher == null) {
                return false;
            }
            watcher.resume();
            return true;
        }
    }

    /**
     * Dispatch a file trigger's buffered changes now, or fire a schedule trigger now.
     *
     * @return false if the trigger does not exist or there was nothing to dispatch
     */
    public boolean flushTrigger(String id) {
        synchronized (lock) {
            var record = triggers.get(id);
            if (record == null) {
                logger.warn("[{}] Trigger does not exist; cannot flush", id);
                return false;
            }
            var watcher = record.watcher();
            if (watcher != null) {
                return watcher.flush();
            }
            var scheduledTrigger = record.scheduledTrigger();
            return scheduledTrigger != null && scheduledTrigger.fireNow();
        }
    }

    /** One entry per trigger. No ordering is guaranteed. */
    public List<TriggerInfo> listTriggers() {
        synchronized (lock) {
            var infos = new ArrayList<TriggerInfo>(triggers.size());
            for (var record : triggers.values()) {
                infos.add(record.toInfo());
            }
            return infos;
        }
    }

    public Optional<TriggerInfo> getTrigger(String id) {
        synchronized (lock) {
            return Optional.ofNullable(triggers.get(id)).map(TriggerRecord::toInfo);
        }
    }

    public RegistryStatus getStatus() {
        synchronized (lock) {
            int fileTriggers = 0;
            int scheduleTriggers = 0;
            int activeWatchers = 0;
            for (var record : triggers.values()) {
                switch (record.kind()) {
                    case FILE_CHANGE -> {
                        fileTriggers++;
                        var watcher = record.watcher();
                        if (watcher != null && watcher.isMonitoring()) {
                            activeWatchers++;
                        }
                    }
                    case SCHEDULE -> scheduleTriggers++;
                }
            }
            return new RegistryStatus(running, triggers.size(), fileTriggers, scheduleTriggers, activeWatchers);
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }

    /** Stop and remove every trigger. */
    public void clearAll() {
        synchronized (lock) {
            for (var record : triggers.values()) {
                try {
                    record.tearDown();
                } catch (RuntimeException e) {
                    logger.error("[{}] Error tearing down trigger", record.id(), e);
                }
            }
            int cleared = triggers.size();
            triggers.clear();
            logger.info("Cleared {} triggers", cleared);
        }
    }

    @Override
    public void close() {
        stop();
    }

    private void replaceExisting(String id) {
        assert Thread.holdsLock(lock);
        var existing = triggers.remove(id);
        if (existing != null) {
            logger.warn("[{}] Trigger already exists and will be replaced", id);
            existing.tearDown();
        }
    }

    private @Nullable FileWatcher fileWatcher(String id, String operation) {
        var record = triggers.get(id);
        if (record == null) {
            logger.warn("[{}] Trigger does not exist; cannot {}", id, operation);
            return null;
        }
        if (record.kind() != TriggerKind.FILE_CHANGE) {
            logger.warn("[{}] Only file triggers support {}", id, operation);
            return null;
        }
        return record.watcher();
    }
}
