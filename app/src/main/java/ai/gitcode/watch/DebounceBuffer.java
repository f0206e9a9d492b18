package ai.gitcode.watch;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Accumulates changes for one watched root and settles them once a quiet period elapses with no new changes.
 *
 * <p>Every {@link #add} cancels the outstanding flush and schedules a new one; at most one is outstanding. Each
 * scheduled flush captures the generation current at scheduling time and only proceeds if that generation is still
 * current when it runs, so a flush that was cancelled too late to be unscheduled becomes a no-op.
 *
 * <p>The settle handler runs on the scheduler's thread, outside the buffer lock. With a single-threaded scheduler this
 * gives at most one settle in flight per buffer.
 */
public final class DebounceBuffer {
    private static final Logger logger = LogManager.getLogger(DebounceBuffer.class);

    private final String name;
    private final Duration quietPeriod;
    private final ScheduledExecutorService scheduler;
    private final Consumer<ChangeSet> onSettled;
    private final Clock clock;

    // all guarded by 'lock'
    private final ReentrantLock lock = new ReentrantLock();
    private final ChangeSet.Builder pending = new ChangeSet.Builder();
    private long generation = 0;

    @Nullable
    private ScheduledFuture<?> pendingFlush;

    @Nullable
    private Instant armedAt;

    public DebounceBuffer(
            String name, Duration quietPeriod, ScheduledExecutorService scheduler, Consumer<ChangeSet> onSettled) {
        this(name, quietPeriod, scheduler, onSettled, Clock.systemUTC());
    }

    DebounceBuffer(
            String name,
            Duration quietPeriod,
            ScheduledExecutorService scheduler,
            Consumer<ChangeSet> onSettled,
            Clock clock) {
        if (quietPeriod.isNegative()) {
            throw new IllegalArgumentException("Quiet period must not be negative: " + quietPeriod);
        }
        this.name = name;
        this.quietPeriod = quietPeriod;
        this.scheduler = scheduler;
        this.onSettled = onSettled;
        this.clock = clock;
    }

    /** Add a change and (re)arm the quiet-period timer. */
    public void add(FileChange change) {
        lock.lock();
        try {
            pending.add(change);
            rearm(quietPeriod.toNanos());
            logger.trace("[{}] buffered {}; {} pending", name, change, pending.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Settle whatever is pending right away, on the scheduler thread.
     *
     * @return false if nothing was pending
     */
    public boolean flushNow() {
        lock.lock();
        try {
            if (pending.isEmpty()) {
                return false;
            }
            rearm(0);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancel the outstanding flush and drop everything pending.
     *
     * @return the number of changes discarded
     */
    public int discard() {
        lock.lock();
        try {
            int discarded = pending.size();
            cancelPendingFlush();
            generation++;
            pending.clear();
            return discarded;
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    /** Copy of the changes accumulated so far. */
    public ChangeSet snapshot() {
        lock.lock();
        try {
            return pending.build();
        } finally {
            lock.unlock();
        }
    }

    public boolean isArmed() {
        lock.lock();
        try {
            return pendingFlush != null;
        } finally {
            lock.unlock();
        }
    }

    public @Nullable Instant armedAt() {
        lock.lock();
        try {
            return armedAt;
        } finally {
            lock.unlock();
        }
    }

    public Duration quietPeriod() {
        return quietPeriod;
    }

    private void rearm(long delayNanos) {
        assert lock.isHeldByCurrentThread();
        cancelPendingFlush();
        long scheduledGeneration = ++generation;
        pendingFlush = scheduler.schedule(() -> flush(scheduledGeneration), delayNanos, TimeUnit.NANOSECONDS);
        armedAt = clock.instant();
    }

    private void cancelPendingFlush() {
        if (pendingFlush != null) {
            pendingFlush.cancel(false);
            pendingFlush = null;
        }
        armedAt = null;
    }

    private void flush(long scheduledGeneration) {
        ChangeSet settled;
        lock.lock();
        try {
            if (scheduledGeneration != generation) {
                logger.trace("[{}] stale flush for generation {} skipped", name, scheduledGeneration);
                return;
            }
            pendingFlush = null;
            armedAt = null;
            if (pending.isEmpty()) {
                return;
            }
            settled = pending.build();
            pending.clear();
        } finally {
            lock.unlock();
        }

        logger.debug("[{}] quiet period elapsed, settling {} changes", name, settled.size());
        onSettled.accept(settled);
    }
}
