package ai.gitcode.cli;

import ai.gitcode.config.GitcodeSettings;
import ai.gitcode.config.SettingsApplier;
import ai.gitcode.config.SettingsException;
import ai.gitcode.config.SettingsLoader;
import ai.gitcode.git.GitRepos;
import ai.gitcode.trigger.TriggerRegistry;
import ai.gitcode.watch.ChangeSubscriptionFactory;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import picocli.CommandLine;

@SuppressWarnings("NullAway.Init") // fields are injected by picocli before call()
@CommandLine.Command(
        name = "watch",
        mixinStandardHelpOptions = true,
        description = "Watch every enabled repository until interrupted.")
final class WatchCommand implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(WatchCommand.class);

    @CommandLine.Option(
            names = {"-c", "--config"},
            defaultValue = "config/settings.yaml",
            description = "Settings file (default: ${DEFAULT-VALUE}).")
    private Path configFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    @Blocking
    public Integer call() throws InterruptedException {
        var err = spec.commandLine().getErr();

        GitcodeSettings settings;
        try {
            settings = SettingsLoader.load(configFile);
        } catch (SettingsException e) {
            logger.error("Cannot load settings from {}", configFile, e);
            err.println("Invalid settings: " + e.getMessage());
            return 2;
        }
        if (settings.enabledRepositories().isEmpty()) {
            err.println("No enabled repositories in " + configFile);
            return 1;
        }
        for (var repository : settings.enabledRepositories()) {
            if (!GitRepos.hasGitRepo(repository.resolvedPath())) {
                logger.warn("[{}] {} is not a Git repository", repository.name(), repository.resolvedPath());
            }
        }

        var registry = TriggerRegistry.open(
                ChangeSubscriptionFactory.nativeFactory(),
                Clock.systemDefaultZone(),
                settings.defaultsOrNone().useDefaultIgnoresOrTrue());
        int failures = SettingsApplier.apply(
                settings, registry, repository -> new LoggingCommitCallback(repository.fileTriggerId()));
        if (registry.getStatus().totalTriggers() == 0) {
            registry.close();
            err.println("No trigger could be started; see the log for details");
            return 1;
        }
        if (failures > 0) {
            err.println(failures + " trigger(s) failed to start; see the log for details");
        }

        var stopped = new CountDownLatch(1);
        Runtime.getRuntime()
                .addShutdownHook(new Thread(
                        () -> {
                            try {
                                registry.close();
                            } catch (RuntimeException e) {
                                logger.warn("Error during trigger registry shutdown", e);
                            } finally {
                                stopped.countDown();
                            }
                        },
                        "gitcode-shutdown"));

        try (registry) {
            var status = registry.getStatus();
            spec.commandLine()
                    .getOut()
                    .printf(
                            "Watching %d repositories (%d schedule triggers). Press Ctrl+C to stop.%n",
                            status.activeWatchers(),
                            status.scheduleTriggers());
            stopped.await();
        }
        return 0;
    }
}
