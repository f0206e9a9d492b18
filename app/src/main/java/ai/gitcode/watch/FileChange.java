package ai.gitcode.watch;

/**
 * A single changed path, relative to the watched root and always using {@code /} as separator.
 */
public record FileChange(String relativePath, ChangeKind kind) {
    public FileChange {
        if (relativePath.isEmpty()) {
            throw new IllegalArgumentException("relativePath must not be empty");
        }
    }

    @Override
    public String toString() {
        return kind + " " + relativePath;
    }
}
