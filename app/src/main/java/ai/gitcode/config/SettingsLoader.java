package ai.gitcode.config;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Reads and validates {@code settings.yaml}.
 *
 * <p>The default debounce can be overridden for a single run with {@code -Dgitcode.debounce.seconds=N}; a value set
 * on a repository still wins.
 */
public final class SettingsLoader {
    private static final Logger logger = LogManager.getLogger(SettingsLoader.class);

    public static final String DEBOUNCE_PROPERTY = "gitcode.debounce.seconds";

    private static final ObjectMapper MAPPER = YAMLMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private SettingsLoader() {}

    public static GitcodeSettings load(Path file) throws SettingsException {
        if (!Files.isRegularFile(file)) {
            throw new SettingsException("Settings file not found: " + file);
        }
        String yaml;
        try {
            yaml = Files.readString(file);
        } catch (IOException e) {
            throw new SettingsException("Cannot read settings file " + file, e);
        }
        var settings = parse(yaml);
        logger.info("Loaded {} repositories from {}", settings.repositoriesOrEmpty().size(), file);
        return settings;
    }

    public static GitcodeSettings parse(String yaml) throws SettingsException {
        if (yaml.isBlank()) {
            return new GitcodeSettings(null, null);
        }
        GitcodeSettings settings;
        try {
            var tree = MAPPER.readTree(yaml);
            // a document holding only comments or "---"
            if (tree == null || tree.isMissingNode() || tree.isNull()) {
                return new GitcodeSettings(null, null);
            }
            settings = MAPPER.treeToValue(tree, GitcodeSettings.class);
        } catch (JacksonException e) {
            throw new SettingsException("Malformed settings: " + e.getOriginalMessage(), e);
        }
        validate(settings);
        return settings;
    }

    /** Debounce for {@code repository}: its own value, else the system property, else the file default, else 5s. */
    public static double effectiveDebounceSeconds(GitcodeSettings settings, RepositorySettings repository) {
        if (repository.debounceSeconds() != null) {
            return repository.debounceSeconds();
        }
        var override = debounceOverride();
        if (override != null) {
            return override;
        }
        var defaults = settings.defaultsOrNone();
        return defaults.debounceSeconds() != null
                ? defaults.debounceSeconds()
                : DefaultsSettings.FALLBACK_DEBOUNCE_SECONDS;
    }

    private static @Nullable Double debounceOverride() {
        var value = System.getProperty(DEBOUNCE_PROPERTY);
        if (value == null || value.isBlank()) {
            return null;
        }
        double parsed;
        try {
            parsed = Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric -D{}={}", DEBOUNCE_PROPERTY, value);
            return null;
        }
        if (!Double.isFinite(parsed) || parsed < 0) {
            logger.warn("Ignoring invalid -D{}={}", DEBOUNCE_PROPERTY, value);
            return null;
        }
        return parsed;
    }

    private static void validate(GitcodeSettings settings) throws SettingsException {
        var defaults = settings.defaultsOrNone();
        if (defaults.debounceSeconds() != null) {
            checkDebounce("defaults", defaults.debounceSeconds());
        }

        var names = new HashSet<String>();
        int index = 0;
        for (var repository : settings.repositoriesOrEmpty()) {
            var where = "repositories[" + index++ + "]";
            if (repository == null) {
                throw new SettingsException(where + " is empty");
            }
            if (repository.name() == null || repository.name().isBlank()) {
                throw new SettingsException(where + " is missing 'name'");
            }
            where = "repository '" + repository.name() + "'";
            if (!names.add(repository.name())) {
                throw new SettingsException("Duplicate " + where);
            }
            if (repository.path() == null || repository.path().isBlank()) {
                throw new SettingsException(where + " is missing 'path'");
            }
            if (repository.debounceSeconds() != null) {
                checkDebounce(where, repository.debounceSeconds());
            }
            for (var pattern : repository.ignorePatternsOrEmpty()) {
                if (pattern == null || pattern.isBlank()) {
                    throw new SettingsException(where + " has a blank ignore pattern");
                }
            }
            if (repository.schedule() != null) {
                try {
                    repository.schedule().toSchedule();
                } catch (SettingsException e) {
                    throw new SettingsException(where + ": " + e.getMessage(), e);
                }
            }
        }
    }

    private static void checkDebounce(String where, double seconds) throws SettingsException {
        if (!Double.isFinite(seconds) || seconds < 0) {
            throw new SettingsException(where + " has an invalid debounceSeconds: " + seconds);
        }
    }
}
