package ai.gitcode.watch;

import io.methvin.watcher.DirectoryChangeEvent;
import io.methvin.watcher.DirectoryWatcher;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Change subscription backed by the io.methvin:directory-watcher library, which uses platform-native recursive
 * watching:
 * - macOS: FSEvents
 * - Linux: inotify
 * - Windows: WatchService with FILE_TREE
 *
 * <p>Directory events are not forwarded; only file changes are of interest to the commit layer.
 */
public final class NativeChangeSubscription implements IChangeSubscription {
    private static final Logger logger = LogManager.getLogger(NativeChangeSubscription.class);

    private final Path root;
    private final Sink sink;
    private volatile boolean closed = false;

    @Nullable
    private DirectoryWatcher watcher;

    @Nullable
    private ExecutorService eventLoop;

    @Nullable
    private CompletableFuture<Void> watching;

    private NativeChangeSubscription(Path root, Sink sink) {
        this.root = root;
        this.sink = sink;
    }

    /**
     * Register the whole tree under {@code root} and start delivering events. Registration happens before this
     * returns, so changes made afterwards are observed.
     */
    public static NativeChangeSubscription open(Path root, Sink sink, boolean fileHashing) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Not a directory: " + root);
        }
        var subscription = new NativeChangeSubscription(root, sink);
        subscription.attach(fileHashing);
        logger.info("Started native directory watcher for: {}", root);
        return subscription;
    }

    private void attach(boolean fileHashing) throws IOException {
        var directoryWatcher = DirectoryWatcher.builder()
                .path(root)
                .fileHashing(fileHashing)
                .listener(this::handleEvent)
                .build();

        ExecutorService loop = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("NativeChangeSubscription@" + root.getFileName());
            t.setDaemon(true);
            return t;
        });

        // watchAsync registers paths synchronously and reports registration failures through the future
        CompletableFuture<Void> future = directoryWatcher.watchAsync(loop);
        if (future.isCompletedExceptionally()) {
            loop.shutdownNow();
            closeQuietly(directoryWatcher, root);
            throw new IOException("Failed to register native watcher for " + root, causeOf(future));
        }
        future.whenComplete((ignored, t) -> {
            if (t != null && !closed) {
                logger.error("Native watcher for {} terminated unexpectedly", root, t);
            }
        });

        this.watcher = directoryWatcher;
        this.eventLoop = loop;
        this.watching = future;
    }

    private void handleEvent(DirectoryChangeEvent event) {
        if (closed) {
            return;
        }
        var eventType = event.eventType();
        logger.trace("File event: {} on {}", eventType, event.path());

        if (eventType == DirectoryChangeEvent.EventType.OVERFLOW) {
            logger.warn("Event overflow reported for {}; some changes may be missed", root);
            sink.onOverflow();
            return;
        }
        if (event.isDirectory()) {
            return;
        }
        var kind =
                switch (eventType) {
                    case CREATE -> ChangeKind.CREATED;
                    case MODIFY -> ChangeKind.MODIFIED;
                    case DELETE -> ChangeKind.DELETED;
                    default -> null;
                };
        if (kind != null) {
            sink.onRawEvent(event.path(), kind);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.info("Closing native directory watcher for: {}", root);
        if (watcher != null) {
            closeQuietly(watcher, root);
        }

        if (eventLoop != null) {
            eventLoop.shutdown();
            try {
                if (!eventLoop.awaitTermination(1, TimeUnit.SECONDS)) {
                    eventLoop.shutdownNow();
                }
            } catch (InterruptedException e) {
                eventLoop.shutdownNow();
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for watcher thread to stop");
            }
        }
        if (watching != null) {
            watching.cancel(false);
        }
    }

    private static void closeQuietly(DirectoryWatcher watcher, Path root) {
        try {
            watcher.close();
        } catch (IOException e) {
            logger.error("Error closing native directory watcher for {}", root, e);
        }
    }

    private static Throwable causeOf(CompletableFuture<Void> failed) {
        try {
            failed.get();
            return new IllegalStateException("future was not failed");
        } catch (ExecutionException e) {
            return e.getCause() != null ? e.getCause() : e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return e;
        }
    }
}
