package ai.gitcode.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Root of {@code settings.yaml}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitcodeSettings(@Nullable DefaultsSettings defaults, @Nullable List<RepositorySettings> repositories) {

    public DefaultsSettings defaultsOrNone() {
        return defaults == null ? DefaultsSettings.none() : defaults;
    }

    public List<RepositorySettings> repositoriesOrEmpty() {
        return repositories == null ? List.of() : repositories;
    }

    public List<RepositorySettings> enabledRepositories() {
        return repositoriesOrEmpty().stream().filter(RepositorySettings::enabledOrDefault).toList();
    }
}
