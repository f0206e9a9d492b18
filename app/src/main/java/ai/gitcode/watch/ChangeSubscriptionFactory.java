package ai.gitcode.watch;

import java.io.IOException;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Attaches change subscriptions. The native implementation is used unless a caller (usually a test) supplies its own.
 *
 * <p>Content hashing, which suppresses MODIFY events that leave a file byte-identical, is off by default because it
 * reads every file under the root at attach time. Enable it with {@code -Dgitcode.watch.fileHashing=true}.
 */
@FunctionalInterface
public interface ChangeSubscriptionFactory {
    String FILE_HASHING_PROPERTY = "gitcode.watch.fileHashing";

    /**
     * @throws IOException if the subscription cannot be attached
     */
    IChangeSubscription open(Path root, IChangeSubscription.Sink sink) throws IOException;

    static ChangeSubscriptionFactory nativeFactory() {
        boolean fileHashing = Boolean.getBoolean(FILE_HASHING_PROPERTY);
        Logger logger = LogManager.getLogger(ChangeSubscriptionFactory.class);
        logger.debug("Using native change subscriptions (fileHashing={})", fileHashing);
        return (root, sink) -> NativeChangeSubscription.open(root, sink, fileHashing);
    }
}
