package ai.gitcode.watch;

import java.nio.file.Path;

/**
 * An attached OS-level change subscription on one directory tree. Events are delivered to a {@link Sink} on a thread
 * owned by the subscription.
 */
public interface IChangeSubscription extends AutoCloseable {

    /** Detach from the OS. Idempotent; no events are delivered once this returns. */
    @Override
    void close();

    interface Sink {
        /**
         * @param path absolute path of the changed file
         */
        void onRawEvent(Path path, ChangeKind kind);

        /** The OS dropped events; some changes may never be reported. */
        default void onOverflow() {}
    }
}
