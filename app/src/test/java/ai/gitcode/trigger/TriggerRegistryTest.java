package ai.gitcode.trigger;

import static org.junit.jupiter.api.Assertions.*;

import ai.gitcode.testutil.FakeChangeSubscriptionFactory;
import ai.gitcode.testutil.RecordingCallback;
import ai.gitcode.watch.ChangeKind;
import ai.gitcode.watch.ChangeSet;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TriggerRegistryTest {
    private static final Duration DEBOUNCE = Duration.ofMillis(200);
    private static final Duration WAIT = Duration.ofSeconds(5);

    @TempDir
    Path tempDir;

    private Path repoA;
    private Path repoB;
    private FakeChangeSubscriptionFactory factory;
    private RecordingCallback callback;
    private TriggerRegistry registry;

    @BeforeEach
    void setUp() throws IOException {
        repoA = Files.createDirectory(tempDir.resolve("a"));
        repoB = Files.createDirectory(tempDir.resolve("b"));
        factory = new FakeChangeSubscriptionFactory();
        callback = new RecordingCallback();
        registry = new TriggerRegistry(factory, Clock.systemUTC(), true);
    }

    @AfterEach
    void tearDown() {
        registry.clearAll();
        registry.close();
    }

    @Test
    void addedFileTriggerDeliversChanges() throws Exception {
        assertTrue(registry.addFileTrigger("a", repoA, callback, List.of("*.bak"), DEBOUNCE));

        var subscription = factory.latest(repoA);
        subscription.emit("notes.md", ChangeKind.CREATED);
        subscription.emit("notes.md.bak", ChangeKind.CREATED);
        subscription.emit(".git/index", ChangeKind.MODIFIED);

        var invocation = callback.expectNext(WAIT);
        assertEquals(Set.of("notes.md"), invocation.changes().paths());
    }

    @Test
    void defaultIgnoresCanBeDisabled() throws Exception {
        var plain = new TriggerRegistry(factory, Clock.systemUTC(), false);
        try (plain) {
            assertTrue(plain.addFileTrigger("a", repoA, callback, List.of(), DEBOUNCE));
            factory.latest(repoA).emit("debug.log", ChangeKind.CREATED);
            assertTrue(callback.expectNext(WAIT).changes().contains("debug.log"));
        } finally {
            plain.clearAll();
        }
    }

    @Test
    void statusCountsTriggersByKind() {
        assertTrue(registry.addFileTrigger("a", repoA, callback, List.of(), DEBOUNCE));
        assertTrue(registry.addFileTrigger("b", repoB, callback, List.of(), DEBOUNCE));
        assertTrue(registry.addScheduleTrigger("a:schedule", repoA, callback, Schedule.every(Duration.ofHours(1))));

        var status = registry.getStatus();
        assertFalse(status.isRunning());
        assertEquals(3, status.totalTriggers());
        assertEquals(2, status.fileTriggers());
        assertEquals(1, status.scheduleTriggers());
        assertEquals(2, status.activeWatchers());
    }

    @Test
    void invalidInputIsRejectedWithoutRegistering() {
        assertFalse(registry.addFileTrigger("missing", tempDir.resolve("nope"), callback));
        assertFalse(registry.addFileTrigger("blank", repoA, callback, List.of(" ")));
        assertFalse(registry.addFileTrigger("negative", repoA, callback, List.of(), -1.0));
        assertFalse(registry.addFileTrigger("nan", repoA, callback, List.of(), Double.NaN));

        factory.failFor(repoB);
        assertFalse(registry.addFileTrigger("unattachable", repoB, callback));

        assertEquals(0, registry.getStatus().totalTriggers());
        assertTrue(registry.listTriggers().isEmpty());
    }

    @Test
    void nullIgnorePatternsMeanNoExtraPatterns() throws Exception {
        assertTrue(registry.addFileTrigger("a", repoA, callback, null, DEBOUNCE));

        factory.latest(repoA).emit("notes.md", ChangeKind.CREATED);
        assertTrue(callback.expectNext(WAIT).changes().contains("notes.md"));
    }

    @Test
    void faultsDuringConstructionReturnFalse() {
        assertFalse(registry.addFileTrigger("nullPath", null, callback, List.of(), DEBOUNCE));
        assertFalse(registry.addFileTrigger("nullPattern", repoA, callback, Arrays.asList("*.log", null)));
        assertFalse(registry.addScheduleTrigger("nullSchedulePath", null, callback, Schedule.every(Duration.ofHours(1))));

        assertEquals(0, registry.getStatus().totalTriggers());
        assertTrue(factory.opened().isEmpty());
    }

    @Test
    void fractionalSecondsAreAccepted() {
        assertTrue(registry.addFileTrigger("a", repoA, callback, List.of(), 0.25));

        var info = registry.getTrigger("a").orElseThrow();
        assertNotNull(info.watcher());
        assertEquals(Duration.ofMillis(250), info.watcher().debounce());
    }

    @Test
    void replacingAnIdStopsTheOldWatcherExactlyOnce() throws Exception {
        assertTrue(registry.addFileTrigger("repo", repoA, callback, List.of(), DEBOUNCE));
        var old = factory.latest(repoA);

        assertTrue(registry.addFileTrigger("repo", repoB, callback, List.of(), DEBOUNCE));

        assertEquals(1, old.closeCount());
        assertEquals(1, registry.getStatus().totalTriggers());
        assertEquals(1, registry.getStatus().activeWatchers());
        assertEquals(repoB.toAbsolutePath().normalize(), registry.getTrigger("repo").orElseThrow().repoPath());

        old.emitEvenIfClosed("stale.txt", ChangeKind.CREATED);
        factory.latest(repoB).emit("fresh.txt", ChangeKind.CREATED);
        var invocation = callback.expectNext(WAIT);
        assertEquals(Set.of("fresh.txt"), invocation.changes().paths());
        assertNull(callback.next(DEBOUNCE.multipliedBy(3)));
    }

    @Test
    void removeTriggerStopsAndUnregisters() {
        assertTrue(registry.addFileTrigger("a", repoA, callback, List.of(), DEBOUNCE));
        var subscription = factory.latest(repoA);

        assertTrue(registry.removeTrigger("a"));
        assertTrue(subscription.isClosed());
        assertFalse(registry.removeTrigger("a"));
        assertFalse(registry.removeTrigger("never-added"));
        assertEquals(0, registry.getStatus().totalTriggers());
    }

    @Test
    void stopAndStartCycleWatchers() throws Exception {
        assertTrue(registry.addFileTrigger("a", repoA, callback, List.of(), DEBOUNCE));
        assertTrue(registry.addFileTrigger("b", repoB, callback, List.of(), DEBOUNCE));
        assertTrue(registry.start());
        assertTrue(registry.start());
        assertEquals(2, factory.opened().size(), "start must not reattach running watchers");

        assertTrue(registry.stop());
        assertFalse(registry.isRunning());
        assertEquals(0, registry.getStatus().activeWatchers());
        assertEquals(2, registry.getStatus().totalTriggers());
        assertTrue(factory.opened().stream().allMatch(FakeChangeSubscriptionFactory.FakeSubscription::isClosed));

        assertTrue(registry.start());
        assertTrue(registry.isRunning());
        assertEquals(2, registry.getStatus().activeWatchers());

        factory.latest(repoA).emit("again.txt", ChangeKind.MODIFIED);
        assertTrue(callback.expectNext(WAIT).changes().contains("again.txt"));
    }

    @Test
    void startToleratesWatchersThatFailToRestart() throws IOException {
        assertTrue(registry.addFileTrigger("a", repoA, callback, List.of(), DEBOUNCE));
        assertTrue(registry.addFileTrigger("b", repoB, callback, List.of(), DEBOUNCE));
        registry.stop();

        Files.delete(repoB);
        assertTrue(registry.start());

        assertEquals(1, registry.getStatus().activeWatchers());
        assertFalse(registry.getTrigger("b").orElseThrow().isMonitoring());
        assertTrue(registry.getTrigger("a").orElseThrow().isMonitoring());
    }

    @Test
    void pausedTriggerDropsEventsUntilResumed() throws Exception {
        assertTrue(registry.addFileTrigger("a", repoA, callback, List.of(), DEBOUNCE));
        var subscription = factory.latest(repoA);

        assertTrue(registry.pauseTrigger("a"));
        assertTrue(registry.getTrigger("a").orElseThrow().isPaused());
        subscription.emit("dropped.txt", ChangeKind.CREATED);
        assertNull(callback.next(DEBOUNCE.multipliedBy(3)));

        assertTrue(registry.resumeTrigger("a"));
        subscription.emit("kept.txt", ChangeKind.CREATED);
        assertEquals(Set.of("kept.txt"), callback.expectNext(WAIT).changes().paths());
    }

    @Test
    void pauseAndResumeRequireAFileTrigger() {
        assertTrue(registry.addScheduleTrigger("nightly", repoA, callback, Schedule.every(Duration.ofHours(1))));

        assertFalse(registry.pauseTrigger("unknown"));
        assertFalse(registry.resumeTrigger("unknown"));
        assertFalse(registry.pauseTrigger("nightly"));
        assertFalse(registry.resumeTrigger("nightly"));
    }

    @Test
    void flushTriggerDispatchesPendingChanges() throws Exception {
        assertTrue(registry.addFileTrigger("a", repoA, callback, List.of(), Duration.ofMinutes(10)));
        assertFalse(registry.flushTrigger("a"), "nothing buffered yet");

        factory.latest(repoA).emit("now.txt", ChangeKind.CREATED);
        assertEquals(1, registry.getTrigger("a").orElseThrow().pendingChanges());
        assertTrue(registry.flushTrigger("a"));

        assertTrue(callback.expectNext(WAIT).changes().contains("now.txt"));
        assertFalse(registry.flushTrigger("unknown"));
    }

    @Test
    void scheduleTriggerFiresThroughRegistry() throws Exception {
        assertTrue(registry.addScheduleTrigger("tick", repoA, callback, Schedule.every(Duration.ofMillis(100))));

        var invocation = callback.expectNext(WAIT);
        assertEquals(ChangeSet.empty(), invocation.changes());

        var info = registry.getTrigger("tick").orElseThrow();
        assertEquals(TriggerKind.SCHEDULE, info.kind());
        assertNotNull(info.schedule());
        assertNull(info.watcher());
    }

    @Test
    void listTriggersReturnsEveryTrigger() {
        assertTrue(registry.addFileTrigger("a", repoA, callback, List.of(), DEBOUNCE));
        assertTrue(registry.addScheduleTrigger("a:schedule", repoA, callback, Schedule.every(Duration.ofHours(1))));

        var ids = registry.listTriggers().stream().map(TriggerInfo::id).collect(Collectors.toSet());
        assertEquals(Set.of("a", "a:schedule"), ids);
        assertTrue(registry.getTrigger("missing").isEmpty());
    }

    @Test
    void clearAllTearsDownEveryTrigger() {
        assertTrue(registry.addFileTrigger("a", repoA, callback, List.of(), DEBOUNCE));
        assertTrue(registry.addFileTrigger("b", repoB, callback, List.of(), DEBOUNCE));

        registry.clearAll();

        assertEquals(0, registry.getStatus().totalTriggers());
        assertTrue(factory.opened().stream().allMatch(FakeChangeSubscriptionFactory.FakeSubscription::isClosed));
    }

    @Test
    void failingCallbackIsContained() throws Exception {
        var failing = new RecordingCallback() {
            @Override
            public void onChangesReady(Path repoPath, ChangeSet changes) throws Exception {
                super.onChangesReady(repoPath, changes);
                throw new IOException("git commit failed");
            }
        };
        assertTrue(registry.addFileTrigger("a", repoA, failing, List.of(), DEBOUNCE));
        assertTrue(registry.addFileTrigger("b", repoB, callback, List.of(), DEBOUNCE));

        factory.latest(repoA).emit("x.txt", ChangeKind.CREATED);
        failing.expectNext(WAIT);
        factory.latest(repoB).emit("y.txt", ChangeKind.CREATED);
        assertTrue(callback.expectNext(WAIT).changes().contains("y.txt"));
        assertEquals(2, registry.getStatus().activeWatchers());
    }

    @Test
    void openedRegistryIsRunningAndStoppedOnExit() {
        var scoped = TriggerRegistry.open(factory, Clock.systemUTC(), true);
        try (scoped) {
            assertTrue(scoped.isRunning());
            assertTrue(scoped.addFileTrigger("a", repoA, callback, List.of(), DEBOUNCE));
            assertFalse(factory.latest(repoA).isClosed());
        }

        assertFalse(scoped.isRunning());
        assertEquals(0, scoped.getStatus().activeWatchers());
        assertTrue(factory.latest(repoA).isClosed());
        scoped.clearAll();
    }
}
