package ai.gitcode.git;

import java.io.IOException;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;

/** Read-only Git checks used when registering watched repositories. */
public final class GitRepos {
    private static final Logger logger = LogManager.getLogger(GitRepos.class);

    private GitRepos() {}

    /** Returns true if {@code dir} is inside a readable Git repository. */
    public static boolean hasGitRepo(Path dir) {
        try {
            var builder = new FileRepositoryBuilder().findGitDir(dir.toFile());
            if (builder.getGitDir() == null) {
                return false;
            }
            try (var repo = builder.build()) {
                return repo.getObjectDatabase().exists();
            }
        } catch (IOException e) {
            // Corrupted or unreadable repo -> treat as non-git
            logger.warn("Could not read git repo at {}: {}", dir, e.getMessage());
            return false;
        }
    }
}
