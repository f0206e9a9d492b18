package ai.gitcode.watch;

/** Kind of change observed for a single path under a watched root. */
public enum ChangeKind {
    CREATED,
    MODIFIED,
    DELETED
}
