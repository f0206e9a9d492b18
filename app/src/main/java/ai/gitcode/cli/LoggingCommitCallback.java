package ai.gitcode.cli;

import ai.gitcode.watch.ChangeSet;
import ai.gitcode.watch.CommitCallback;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Commit callback used by the CLI when no Git layer is attached: reports what would be committed.
 */
final class LoggingCommitCallback implements CommitCallback {
    private static final Logger logger = LogManager.getLogger(LoggingCommitCallback.class);
    private static final int MAX_LISTED_PATHS = 20;

    private final String repositoryName;

    LoggingCommitCallback(String repositoryName) {
        this.repositoryName = repositoryName;
    }

    @Override
    public void onChangesReady(Path repoPath, ChangeSet changes) {
        if (changes.isEmpty()) {
            logger.info("[{}] Scheduled commit point for {}", repositoryName, repoPath);
            return;
        }
        var listed = changes.asList().stream().limit(MAX_LISTED_PATHS).toList();
        logger.info(
                "[{}] {} changed paths ready to commit in {}: {}{}",
                repositoryName,
                changes.size(),
                repoPath,
                listed,
                changes.size() > MAX_LISTED_PATHS ? " ..." : "");
    }
}
