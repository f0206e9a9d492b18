package ai.gitcode.trigger;

import ai.gitcode.watch.CommitCallback;
import ai.gitcode.watch.FileWatcher;
import java.nio.file.Path;
import java.time.Instant;
import org.jetbrains.annotations.Nullable;

/** Registry entry. {@code watcher} is set iff kind is FILE_CHANGE, {@code scheduledTrigger} iff kind is SCHEDULE. */
record TriggerRecord(
        String id,
        TriggerKind kind,
        Path repoPath,
        CommitCallback callback,
        @Nullable FileWatcher watcher,
        @Nullable ScheduledTrigger scheduledTrigger,
        Instant createdAt) {

    static TriggerRecord forWatcher(String id, FileWatcher watcher, CommitCallback callback, Instant createdAt) {
        return new TriggerRecord(
                id, TriggerKind.FILE_CHANGE, watcher.repoPath(), callback, watcher, null, createdAt);
    }

    static TriggerRecord forSchedule(
            String id, ScheduledTrigger scheduledTrigger, CommitCallback callback, Instant createdAt) {
        return new TriggerRecord(
                id, TriggerKind.SCHEDULE, scheduledTrigger.repoPath(), callback, null, scheduledTrigger, createdAt);
    }

    TriggerInfo toInfo() {
        return new TriggerInfo(
                id,
                kind,
                repoPath,
                createdAt,
                watcher == null ? null : watcher.status(),
                scheduledTrigger == null ? null : scheduledTrigger.status());
    }

    /** Stop and release whatever this record owns. */
    void tearDown() {
        if (watcher != null) {
            watcher.close();
        }
        if (scheduledTrigger != null) {
            scheduledTrigger.close();
        }
    }
}
