package ai.gitcode.config;

import ai.gitcode.trigger.TriggerRegistry;
import ai.gitcode.watch.CommitCallback;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Registers the triggers described by validated settings: a file trigger per enabled repository and, when the
 * repository has a schedule, a schedule trigger sharing the same callback.
 */
public final class SettingsApplier {
    private static final Logger logger = LogManager.getLogger(SettingsApplier.class);

    private SettingsApplier() {}

    /** @return number of triggers that failed to register */
    public static int apply(
            GitcodeSettings settings,
            TriggerRegistry registry,
            Function<RepositorySettings, CommitCallback> callbackFactory) {
        int failures = 0;
        for (var repository : settings.enabledRepositories()) {
            var callback = callbackFactory.apply(repository);
            var path = repository.resolvedPath();
            double debounceSeconds = SettingsLoader.effectiveDebounceSeconds(settings, repository);

            if (!registry.addFileTrigger(
                    repository.fileTriggerId(), path, callback, repository.ignorePatternsOrEmpty(), debounceSeconds)) {
                failures++;
            }

            var scheduleSettings = repository.schedule();
            if (scheduleSettings != null) {
                try {
                    if (!registry.addScheduleTrigger(
                            repository.scheduleTriggerId(), path, callback, scheduleSettings.toSchedule())) {
                        failures++;
                    }
                } catch (SettingsException e) {
                    // validated on load, so only reachable with hand-built settings
                    logger.error("[{}] Invalid schedule: {}", repository.scheduleTriggerId(), e.getMessage());
                    failures++;
                }
            }
        }
        logger.info(
                "Registered triggers for {} enabled repositories ({} failures)",
                settings.enabledRepositories().size(),
                failures);
        return failures;
    }
}
