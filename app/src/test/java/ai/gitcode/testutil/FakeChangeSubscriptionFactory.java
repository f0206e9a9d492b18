package ai.gitcode.testutil;

import ai.gitcode.watch.ChangeKind;
import ai.gitcode.watch.ChangeSubscriptionFactory;
import ai.gitcode.watch.IChangeSubscription;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Subscription factory that never touches the OS. Tests push events through {@link FakeSubscription#emit}, which
 * calls the sink synchronously on the test thread.
 */
public final class FakeChangeSubscriptionFactory implements ChangeSubscriptionFactory {
    private final List<FakeSubscription> opened = new CopyOnWriteArrayList<>();
    private final Set<Path> failingRoots = ConcurrentHashMap.newKeySet();

    @Override
    public IChangeSubscription open(Path root, IChangeSubscription.Sink sink) throws IOException {
        if (failingRoots.contains(root)) {
            throw new IOException("simulated attach failure for " + root);
        }
        var subscription = new FakeSubscription(root, sink);
        opened.add(subscription);
        return subscription;
    }

    public void failFor(Path root) {
        failingRoots.add(root.toAbsolutePath().normalize());
    }

    public List<FakeSubscription> opened() {
        return List.copyOf(opened);
    }

    public List<FakeSubscription> openedFor(Path root) {
        var normalized = root.toAbsolutePath().normalize();
        return opened.stream().filter(s -> s.root().equals(normalized)).toList();
    }

    /** Most recent subscription opened for {@code root}. */
    public FakeSubscription latest(Path root) {
        var forRoot = openedFor(root);
        if (forRoot.isEmpty()) {
            throw new AssertionError("No subscription was opened for " + root);
        }
        return forRoot.get(forRoot.size() - 1);
    }

    public static final class FakeSubscription implements IChangeSubscription {
        private final Path root;
        private final Sink sink;
        private final AtomicInteger closeCount = new AtomicInteger();

        FakeSubscription(Path root, Sink sink) {
            this.root = root;
            this.sink = sink;
        }

        /** Deliver an event for {@code relativePath} the way the OS layer would, unless closed. */
        public void emit(String relativePath, ChangeKind kind) {
            if (isClosed()) {
                return;
            }
            sink.onRawEvent(root.resolve(relativePath), kind);
        }

        /** Deliver regardless of close state, simulating an event already in flight. */
        public void emitEvenIfClosed(String relativePath, ChangeKind kind) {
            sink.onRawEvent(root.resolve(relativePath), kind);
        }

        public Path root() {
            return root;
        }

        public boolean isClosed() {
            return closeCount.get() > 0;
        }

        public int closeCount() {
            return closeCount.get();
        }

        @Override
        public void close() {
            closeCount.incrementAndGet();
        }
    }
}
