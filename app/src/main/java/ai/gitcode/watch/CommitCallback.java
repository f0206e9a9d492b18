package ai.gitcode.watch;

import java.nio.file.Path;

/**
 * Invoked when a settled burst of changes (or a scheduled firing) is ready to be committed.
 *
 * <p>Implementations are the boundary to the Git layer. Anything they throw is caught and logged by the caller
 * that dispatched the callback; the change-set is then dropped, never retried.
 */
@FunctionalInterface
public interface CommitCallback {
    /**
     * @param repoPath root of the watched repository
     * @param changes deduplicated changes since the last settled burst; empty for scheduled firings
     */
    void onChangesReady(Path repoPath, ChangeSet changes) throws Exception;
}
