package ai.gitcode.watch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable, deduplicated collection of changes accumulated during one debounce burst.
 * Entries keep first-seen order; when a path is touched more than once the latest kind wins.
 */
public final class ChangeSet implements Iterable<FileChange> {
    private static final ChangeSet EMPTY = new ChangeSet(Map.of());

    private final Map<String, ChangeKind> changes;

    private ChangeSet(Map<String, ChangeKind> changes) {
        this.changes = changes;
    }

    public static ChangeSet empty() {
        return EMPTY;
    }

    public static ChangeSet of(FileChange... changes) {
        var builder = new Builder();
        for (var change : changes) {
            builder.add(change);
        }
        return builder.build();
    }

    public int size() {
        return changes.size();
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public boolean contains(String relativePath) {
        return changes.containsKey(relativePath);
    }

    public @Nullable ChangeKind kindOf(String relativePath) {
        return changes.get(relativePath);
    }

    /** Relative paths in first-seen order. */
    public Set<String> paths() {
        return Collections.unmodifiableSet(changes.keySet());
    }

    public List<FileChange> asList() {
        var list = new ArrayList<FileChange>(changes.size());
        changes.forEach((path, kind) -> list.add(new FileChange(path, kind)));
        return List.copyOf(list);
    }

    @Override
    public Iterator<FileChange> iterator() {
        return asList().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChangeSet other)) return false;
        return changes.equals(other.changes);
    }

    @Override
    public int hashCode() {
        return changes.hashCode();
    }

    @Override
    public String toString() {
        return "ChangeSet" + changes;
    }

    /** Mutable accumulator; not thread-safe, callers guard it. */
    public static final class Builder {
        private final LinkedHashMap<String, ChangeKind> pending = new LinkedHashMap<>();

        public Builder add(FileChange change) {
            // put() on an existing key keeps its original position
            pending.put(change.relativePath(), change.kind());
            return this;
        }

        public int size() {
            return pending.size();
        }

        public boolean isEmpty() {
            return pending.isEmpty();
        }

        public void clear() {
            pending.clear();
        }

        public ChangeSet build() {
            if (pending.isEmpty()) {
                return EMPTY;
            }
            return new ChangeSet(Collections.unmodifiableMap(new LinkedHashMap<>(pending)));
        }
    }
}
