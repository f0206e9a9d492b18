package ai.gitcode.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jetbrains.annotations.Nullable;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DefaultsSettings(@Nullable Double debounceSeconds, @Nullable Boolean useDefaultIgnores) {
    public static final double FALLBACK_DEBOUNCE_SECONDS = 5.0;

    public static DefaultsSettings none() {
        return new DefaultsSettings(null, null);
    }

    public boolean useDefaultIgnoresOrTrue() {
        return useDefaultIgnores == null || useDefaultIgnores;
    }
}
