package ai.gitcode.trigger;

import ai.gitcode.watch.WatcherStatus;
import java.nio.file.Path;
import java.time.Instant;
import org.jetbrains.annotations.Nullable;

/**
 * Snapshot of one registered trigger, as shown by the CLI.
 *
 * @param watcher live watcher status for FILE_CHANGE triggers, otherwise null
 * @param schedule schedule status for SCHEDULE triggers, otherwise null
 */
public record TriggerInfo(
        String id,
        TriggerKind kind,
        Path repoPath,
        Instant createdAt,
        @Nullable WatcherStatus watcher,
        @Nullable ScheduleStatus schedule) {

    public boolean isMonitoring() {
        return watcher != null && watcher.isMonitoring();
    }

    public boolean isPaused() {
        return watcher != null && watcher.isPaused();
    }

    public int pendingChanges() {
        return watcher == null ? 0 : watcher.pendingChanges();
    }
}
