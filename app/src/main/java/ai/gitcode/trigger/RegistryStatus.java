package ai.gitcode.trigger;

/** @param activeWatchers file watchers monitoring at the time of the call */
public record RegistryStatus(
        boolean isRunning, int totalTriggers, int fileTriggers, int scheduleTriggers, int activeWatchers) {}
