package ai.gitcode.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CheckCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        var cmd = new CommandLine(new GitcodeCli());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private Path writeSettings(String yaml) throws Exception {
        var file = tempDir.resolve("settings.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Test
    void validSettingsPrintEachRepository() throws Exception {
        var repo = Files.createDirectory(tempDir.resolve("repo"));
        var settings = writeSettings(
                """
                repositories:
                  - name: repo
                    path: %s
                    ignorePatterns: ["*.bak"]
                    schedule:
                      dailyAt: "18:00"
                """
                        .formatted(repo));

        int exitCode = run("check", "-c", settings.toString());

        assertEquals(0, exitCode, err.toString());
        var output = out.toString();
        assertTrue(output.contains("repo"));
        assertTrue(output.contains("*.bak"));
        assertTrue(output.contains(".git/"), "default ignores are listed");
        assertTrue(output.contains("daily at 18:00 (repo:schedule)"));
        assertTrue(output.contains("not a Git repository"));
        assertTrue(output.contains("1 repositories, 1 enabled"));
    }

    @Test
    void missingDirectoryIsAProblem() throws Exception {
        var settings = writeSettings(
                """
                repositories:
                  - name: gone
                    path: %s
                """
                        .formatted(tempDir.resolve("gone")));

        assertEquals(1, run("check", "-c", settings.toString()));
        assertTrue(out.toString().contains("path does not exist"));
    }

    @Test
    void disabledRepositoryIsNotChecked() throws Exception {
        var settings = writeSettings(
                """
                repositories:
                  - name: gone
                    path: %s
                    enabled: false
                """
                        .formatted(tempDir.resolve("gone")));

        assertEquals(0, run("check", "-c", settings.toString()));
        assertTrue(out.toString().contains("1 repositories, 0 enabled"));
    }

    @Test
    void invalidSettingsExitWithTwo() throws Exception {
        var settings = writeSettings("repositories:\n  - path: /nowhere\n");

        assertEquals(2, run("check", "-c", settings.toString()));
        assertTrue(err.toString().contains("missing 'name'"));
    }

    @Test
    void missingSettingsFileExitsWithTwo() {
        assertEquals(2, run("check", "-c", tempDir.resolve("absent.yaml").toString()));
    }

    @Test
    void watchRefusesSettingsWithoutEnabledRepositories() throws Exception {
        var settings = writeSettings("repositories: []\n");

        assertEquals(1, run("watch", "-c", settings.toString()));
        assertTrue(err.toString().contains("No enabled repositories"));
    }

    @Test
    void watchFailsWhenNoRepositoryCanBeWatched() throws Exception {
        var settings = writeSettings(
                """
                repositories:
                  - name: gone
                    path: %s
                """
                        .formatted(tempDir.resolve("gone")));

        assertEquals(1, run("watch", "-c", settings.toString()));
        assertTrue(err.toString().contains("No trigger could be started"));
    }

    @Test
    void topLevelCommandPrintsUsage() {
        assertEquals(0, run());
        assertTrue(out.toString().contains("check"));
        assertTrue(out.toString().contains("watch"));
    }
}
