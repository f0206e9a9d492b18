package ai.gitcode.trigger;

import java.time.Instant;
import org.jetbrains.annotations.Nullable;

public record ScheduleStatus(
        boolean isActive,
        Schedule schedule,
        @Nullable Instant nextFireAt,
        @Nullable Instant lastFiredAt,
        long fireCount) {}
