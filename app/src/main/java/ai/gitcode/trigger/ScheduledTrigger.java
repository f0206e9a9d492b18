package ai.gitcode.trigger;

import ai.gitcode.watch.ChangeSet;
import ai.gitcode.watch.CommitCallback;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Time-based trigger: invokes the same {@link CommitCallback} as a file watcher, once per firing time, with an empty
 * change-set. The Git layer decides what to commit.
 *
 * <p>Firings are one-shot tasks re-armed after each run, so a slow callback pushes the following firing back rather
 * than stacking runs. A callback that throws is logged and the next firing is still scheduled.
 */
public class ScheduledTrigger implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ScheduledTrigger.class);

    private final String triggerId;
    private final Path repoPath;
    private final CommitCallback callback;
    private final Schedule schedule;
    private final Clock clock;
    private final Object lock = new Object();

    // all guarded by 'lock'
    private @Nullable ScheduledExecutorService scheduler;
    private @Nullable ScheduledFuture<?> nextRun;
    private @Nullable Instant nextFireAt;
    private @Nullable Instant lastFiredAt;
    private long generation = 0;
    private long fireCount = 0;
    private boolean active = false;

    public ScheduledTrigger(String triggerId, Path repoPath, CommitCallback callback, Schedule schedule, Clock clock) {
        this.triggerId = triggerId;
        this.repoPath = repoPath.toAbsolutePath().normalize();
        this.callback = callback;
        this.schedule = schedule;
        this.clock = clock;
    }

    /** Idempotent. */
    public boolean start() {
        synchronized (lock) {
            if (active) {
                return true;
            }
            if (scheduler == null || scheduler.isShutdown()) {
                scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                    var t = new Thread(r, "ScheduledTrigger-" + triggerId);
                    t.setDaemon(true);
                    return t;
                });
            }
            active = true;
            scheduleNext();
            logger.info("[{}] Schedule trigger started for {} ({}), next firing at {}", triggerId, repoPath, schedule,
                    nextFireAt);
            return true;
        }
    }

    /** Idempotent. A firing already in progress completes. */
    public boolean stop() {
        synchronized (lock) {
            generation++;
            if (nextRun != null) {
                nextRun.cancel(false);
                nextRun = null;
            }
            nextFireAt = null;
            if (scheduler != null) {
                scheduler.shutdown();
                scheduler = null;
            }
            if (active) {
                active = false;
                logger.info("[{}] Schedule trigger stopped for {}", triggerId, repoPath);
            }
            return true;
        }
    }

    /**
     * Run the callback now, on the trigger's thread, without disturbing the regular schedule.
     *
     * @return false if the trigger is not active
     */
    public boolean fireNow() {
        synchronized (lock) {
            if (!active || scheduler == null) {
                return false;
            }
            scheduler.execute(this::fire);
            return true;
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isActive() {
        synchronized (lock) {
            return active;
        }
    }

    public ScheduleStatus status() {
        synchronized (lock) {
            return new ScheduleStatus(active, schedule, nextFireAt, lastFiredAt, fireCount);
        }
    }

    public String triggerId() {
        return triggerId;
    }

    public Path repoPath() {
        return repoPath;
    }

    public Schedule schedule() {
        return schedule;
    }

    private void scheduleNext() {
        assert Thread.holdsLock(lock);
        var sched = scheduler;
        if (sched == null) {
            return;
        }
        var now = clock.instant();
        var fireAt = schedule.nextFireTime(now, clock.getZone());
        long delayMillis = Math.max(0, Duration.between(now, fireAt).toMillis());
        long scheduledGeneration = ++generation;
        nextFireAt = fireAt;
        nextRun = sched.schedule(() -> onTimer(scheduledGeneration), delayMillis, TimeUnit.MILLISECONDS);
    }

    private void onTimer(long scheduledGeneration) {
        synchronized (lock) {
            if (!active || scheduledGeneration != generation) {
                return;
            }
            nextRun = null;
        }
        fire();
        synchronized (lock) {
            if (active && scheduledGeneration == generation) {
                scheduleNext();
            }
        }
    }

    private void fire() {
        synchronized (lock) {
            fireCount++;
            lastFiredAt = clock.instant();
        }
        logger.info("[{}] Scheduled firing for {}", triggerId, repoPath);
        try {
            callback.onChangesReady(repoPath, ChangeSet.empty());
        } catch (Exception e) {
            logger.error("[{}] Commit callback failed for scheduled firing in {}", triggerId, repoPath, e);
        }
    }
}
