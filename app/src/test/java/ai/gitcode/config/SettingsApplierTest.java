package ai.gitcode.config;

import static org.junit.jupiter.api.Assertions.*;

import ai.gitcode.testutil.FakeChangeSubscriptionFactory;
import ai.gitcode.testutil.RecordingCallback;
import ai.gitcode.trigger.TriggerKind;
import ai.gitcode.trigger.TriggerRegistry;
import ai.gitcode.watch.ChangeKind;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SettingsApplierTest {

    @TempDir
    Path tempDir;

    private FakeChangeSubscriptionFactory factory;
    private TriggerRegistry registry;

    @BeforeEach
    void setUp() {
        factory = new FakeChangeSubscriptionFactory();
        registry = new TriggerRegistry(factory, Clock.systemUTC(), true);
    }

    @AfterEach
    void tearDown() {
        registry.clearAll();
    }

    @Test
    void registersFileAndScheduleTriggersForEnabledRepositories() throws Exception {
        var notes = Files.createDirectory(tempDir.resolve("notes"));
        var site = Files.createDirectory(tempDir.resolve("site"));
        var settings = SettingsLoader.parse(
                """
                repositories:
                  - name: notes
                    path: %s
                    ignorePatterns: ["*.swp"]
                    debounceSeconds: 0.2
                    schedule:
                      every: PT1H
                  - name: site
                    path: %s
                    enabled: false
                """
                        .formatted(notes, site));
        var callback = new RecordingCallback();
        var requested = new ArrayList<String>();

        int failures = SettingsApplier.apply(settings, registry, repository -> {
            requested.add(repository.name());
            return callback;
        });

        assertEquals(0, failures);
        assertEquals(List.of("notes"), requested);
        assertEquals(TriggerKind.FILE_CHANGE, registry.getTrigger("notes").orElseThrow().kind());
        assertEquals(TriggerKind.SCHEDULE, registry.getTrigger("notes:schedule").orElseThrow().kind());
        assertTrue(registry.getTrigger("site").isEmpty());

        var subscription = factory.latest(notes);
        subscription.emit("todo.md", ChangeKind.MODIFIED);
        subscription.emit("todo.md.swp", ChangeKind.MODIFIED);
        var invocation = callback.expectNext(Duration.ofSeconds(5));
        assertEquals(List.of("todo.md"), List.copyOf(invocation.changes().paths()));
    }

    @Test
    void countsRepositoriesThatCannotBeWatched() throws Exception {
        var settings = SettingsLoader.parse(
                """
                repositories:
                  - name: gone
                    path: %s
                """
                        .formatted(tempDir.resolve("gone")));

        int failures = SettingsApplier.apply(settings, registry, repository -> new RecordingCallback());

        assertEquals(1, failures);
        assertEquals(0, registry.getStatus().totalTriggers());
    }
}
