package ai.gitcode.watch;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class ChangeSetTest {

    @Test
    void latestKindWinsAndFirstSeenOrderIsKept() {
        var builder = new ChangeSet.Builder();
        builder.add(new FileChange("a.txt", ChangeKind.CREATED));
        builder.add(new FileChange("b.txt", ChangeKind.CREATED));
        builder.add(new FileChange("a.txt", ChangeKind.MODIFIED));
        builder.add(new FileChange("b.txt", ChangeKind.DELETED));

        var changes = builder.build();

        assertEquals(2, changes.size());
        assertEquals(List.of("a.txt", "b.txt"), List.copyOf(changes.paths()));
        assertEquals(ChangeKind.MODIFIED, changes.kindOf("a.txt"));
        assertEquals(ChangeKind.DELETED, changes.kindOf("b.txt"));
    }

    @Test
    void builtSetIsUnaffectedByLaterBuilderChanges() {
        var builder = new ChangeSet.Builder();
        builder.add(new FileChange("a.txt", ChangeKind.CREATED));
        var first = builder.build();

        builder.clear();
        builder.add(new FileChange("z.txt", ChangeKind.CREATED));

        assertTrue(first.contains("a.txt"));
        assertFalse(first.contains("z.txt"));
    }

    @Test
    void emptySetHasNoEntries() {
        assertTrue(ChangeSet.empty().isEmpty());
        assertEquals(ChangeSet.empty(), new ChangeSet.Builder().build());
    }

    @Test
    void fileChangeRejectsEmptyPath() {
        assertThrows(IllegalArgumentException.class, () -> new FileChange("", ChangeKind.CREATED));
    }
}
