package ai.gitcode.config;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.nio.file.Path;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** One watched repository. Missing optional values fall back to {@link DefaultsSettings}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RepositorySettings(
        @Nullable String name,
        @Nullable String path,
        @Nullable Boolean enabled,
        @Nullable List<String> ignorePatterns,
        @Nullable Double debounceSeconds,
        @Nullable ScheduleSettings schedule) {

    public boolean enabledOrDefault() {
        return enabled == null || enabled;
    }

    public List<String> ignorePatternsOrEmpty() {
        return ignorePatterns == null ? List.of() : ignorePatterns;
    }

    /** Absolute form of {@code path}, with a leading {@code ~} expanded. Only valid after validation. */
    public Path resolvedPath() {
        var raw = requireNonNull(path).trim();
        if (raw.equals("~") || raw.startsWith("~/")) {
            raw = System.getProperty("user.home") + raw.substring(1);
        }
        return Path.of(raw).toAbsolutePath().normalize();
    }

    public String fileTriggerId() {
        return requireNonNull(name);
    }

    public String scheduleTriggerId() {
        return fileTriggerId() + ":schedule";
    }
}
