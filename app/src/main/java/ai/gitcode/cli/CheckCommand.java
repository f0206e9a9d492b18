package ai.gitcode.cli;

import ai.gitcode.config.GitcodeSettings;
import ai.gitcode.config.SettingsException;
import ai.gitcode.config.SettingsLoader;
import ai.gitcode.git.GitRepos;
import ai.gitcode.watch.PathFilter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@SuppressWarnings("NullAway.Init") // fields are injected by picocli before call()
@CommandLine.Command(
        name = "check",
        mixinStandardHelpOptions = true,
        description = "Validate the settings file and print the triggers it would register.")
final class CheckCommand implements Callable<Integer> {

    @CommandLine.Option(
            names = {"-c", "--config"},
            defaultValue = "config/settings.yaml",
            description = "Settings file (default: ${DEFAULT-VALUE}).")
    private Path configFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        GitcodeSettings settings;
        try {
            settings = SettingsLoader.load(configFile);
        } catch (SettingsException e) {
            err.println("Invalid settings: " + e.getMessage());
            return 2;
        }

        boolean useDefaults = settings.defaultsOrNone().useDefaultIgnoresOrTrue();
        int problems = 0;
        for (var repository : settings.repositoriesOrEmpty()) {
            var path = repository.resolvedPath();
            out.printf("%s%n", repository.fileTriggerId());
            out.printf("  path:      %s%n", path);
            out.printf("  enabled:   %s%n", repository.enabledOrDefault());
            out.printf("  debounce:  %ss%n", SettingsLoader.effectiveDebounceSeconds(settings, repository));

            var patterns = new ArrayList<String>();
            if (useDefaults) {
                patterns.addAll(PathFilter.DEFAULT_PATTERNS);
            }
            patterns.addAll(repository.ignorePatternsOrEmpty());
            out.printf("  ignore:    %s%n", patterns);

            if (repository.schedule() != null) {
                try {
                    out.printf("  schedule:  %s (%s)%n", repository.schedule().toSchedule(),
                            repository.scheduleTriggerId());
                } catch (SettingsException e) {
                    out.printf("  schedule:  invalid (%s)%n", e.getMessage());
                    problems++;
                }
            }

            if (!repository.enabledOrDefault()) {
                continue;
            }
            if (!Files.isDirectory(path)) {
                out.printf("  problem:   path does not exist or is not a directory%n");
                problems++;
            } else if (!GitRepos.hasGitRepo(path)) {
                out.printf("  warning:   not a Git repository%n");
            }
        }

        if (problems > 0) {
            err.println(problems + " problem(s) found in " + configFile);
            return 1;
        }
        out.printf("%d repositories, %d enabled%n", settings.repositoriesOrEmpty().size(),
                settings.enabledRepositories().size());
        return 0;
    }
}
