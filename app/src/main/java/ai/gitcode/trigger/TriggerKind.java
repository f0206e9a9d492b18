package ai.gitcode.trigger;

public enum TriggerKind {
    FILE_CHANGE,
    SCHEDULE
}
