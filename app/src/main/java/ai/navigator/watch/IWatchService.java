package ai.navigator.watch;

import ai.navigator.analyzer.ProjectFile;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

public interface IWatchService extends AutoCloseable {
    default void start(CompletableFuture<?> delayNotificationsUntilCompleted) {}

    /**
     * Dynamically add a listener to receive file system events.
     * @param listener The listener to add
     */
    default void addListener(Listener listener) {}

    /**
     * Remove a previously added listener.
     * @param listener The listener to remove
     */
    default void removeListener(Listener listener) {}

    @Override
    default void close() {}

    interface Listener {
        void onFilesChanged(EventBatch batch);

        default void onNoFilesChangedDuringPollInterval() {}

        /** The watched root itself disappeared; no further events will arrive. */
        default void onRootLost() {}
    }

    /** mutable since we will collect events until they stop arriving */
    class EventBatch {
        boolean isOverflowed;
        final Set<ProjectFile> files = new HashSet<>();

        public EventBatch() {}

        public EventBatch(Set<ProjectFile> files, boolean isOverflowed) {
            this.files.addAll(files);
            this.isOverflowed = isOverflowed;
        }

        public boolean isOverflowed() {
            return isOverflowed;
        }

        public Set<ProjectFile> files() {
            return files;
        }

        @Override
        public String toString() {
            return "EventBatch{" + "isOverflowed=" + isOverflowed + ", files=" + files + '}';
        }
    }
}
