package ai.gitcode.config;

import ai.gitcode.trigger.Schedule;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import org.jetbrains.annotations.Nullable;

/**
 * Exactly one form must be given: {@code every} (ISO-8601 duration), {@code dailyAt} (HH:mm), or {@code weeklyOn}
 * together with {@code at}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScheduleSettings(
        @Nullable Duration every,
        @Nullable LocalTime dailyAt,
        @Nullable DayOfWeek weeklyOn,
        @Nullable LocalTime at) {

    public Schedule toSchedule() throws SettingsException {
        int forms = (every != null ? 1 : 0) + (dailyAt != null ? 1 : 0) + (weeklyOn != null ? 1 : 0);
        if (forms != 1) {
            throw new SettingsException("schedule needs exactly one of 'every', 'dailyAt' or 'weeklyOn'");
        }
        if (every != null) {
            if (every.isZero() || every.isNegative()) {
                throw new SettingsException("schedule 'every' must be positive: " + every);
            }
            return Schedule.every(every);
        }
        if (dailyAt != null) {
            return Schedule.dailyAt(dailyAt);
        }
        if (at == null) {
            throw new SettingsException("schedule 'weeklyOn' requires 'at'");
        }
        return Schedule.weeklyAt(weeklyOn, at);
    }
}
