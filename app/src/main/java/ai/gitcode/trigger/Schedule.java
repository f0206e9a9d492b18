package ai.gitcode.trigger;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;

/**
 * When a {@link ScheduledTrigger} fires. Only fixed forms are supported: a fixed interval, a daily wall-clock time,
 * or a weekly day and wall-clock time.
 */
public sealed interface Schedule {

    /** The first firing time strictly after {@code now}, interpreting wall-clock times in {@code zone}. */
    Instant nextFireTime(Instant now, ZoneId zone);

    static Schedule every(Duration interval) {
        return new Every(interval);
    }

    static Schedule dailyAt(LocalTime at) {
        return new Daily(at);
    }

    static Schedule weeklyAt(DayOfWeek day, LocalTime at) {
        return new Weekly(day, at);
    }

    record Every(Duration interval) implements Schedule {
        public Every {
            if (interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException("Schedule interval must be positive: " + interval);
            }
        }

        @Override
        public Instant nextFireTime(Instant now, ZoneId zone) {
            return now.plus(interval);
        }

        @Override
        public String toString() {
            return "every " + interval;
        }
    }

    record Daily(LocalTime at) implements Schedule {
        @Override
        public Instant nextFireTime(Instant now, ZoneId zone) {
            var current = ZonedDateTime.ofInstant(now, zone);
            var candidate = current.with(at);
            if (!candidate.isAfter(current)) {
                candidate = current.plusDays(1).with(at);
            }
            return candidate.toInstant();
        }

        @Override
        public String toString() {
            return "daily at " + at;
        }
    }

    record Weekly(DayOfWeek day, LocalTime at) implements Schedule {
        @Override
        public Instant nextFireTime(Instant now, ZoneId zone) {
            var current = ZonedDateTime.ofInstant(now, zone);
            var candidate = current.with(TemporalAdjusters.nextOrSame(day)).with(at);
            if (!candidate.isAfter(current)) {
                candidate = current.plusWeeks(1).with(TemporalAdjusters.nextOrSame(day)).with(at);
            }
            return candidate.toInstant();
        }

        @Override
        public String toString() {
            return "weekly on " + day + " at " + at;
        }
    }
}
