package ai.gitcode.watch;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import org.jetbrains.annotations.Nullable;

/**
 * Point-in-time view of a {@link FileWatcher}.
 *
 * @param pendingChanges number of distinct paths buffered and not yet dispatched
 * @param armedAt when the current quiet-period timer was armed, or null if none is armed
 */
public record WatcherStatus(
        String triggerId,
        Path repoPath,
        boolean isMonitoring,
        boolean isPaused,
        int pendingChanges,
        Duration debounce,
        @Nullable Instant armedAt) {}
