package ai.navigator.watch;

import static org.junit.jupiter.api.Assertions.*;

import ai.navigator.index.IgnoreRules;
import ai.navigator.watch.IWatchService.EventBatch;
import ai.navigator.watch.IWatchService.Listener;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProjectWatchServiceTest {

    @TempDir
    Path tempDir;

    private ProjectWatchService watchService;

    @AfterEach
    void tearDown() {
        if (watchService != null) {
            watchService.close();
        }
    }

    private ProjectWatchService startWatching(Path root, List<Listener> listeners) throws Exception {
        watchService = new ProjectWatchService(root, IgnoreRules.defaults(), 100, listeners);
        watchService.start(CompletableFuture.completedFuture(null));
        watchService.registered().get(5, TimeUnit.SECONDS);
        return watchService;
    }

    @Test
    void testMultipleListenersReceiveEvents() throws Exception {
        var listener1 = new TestListener("Listener1");
        var listener2 = new TestListener("Listener2");
        startWatching(tempDir, List.of(listener1, listener2));

        Files.writeString(tempDir.resolve("test.py"), "x = 1\n");

        assertTrue(listener1.filesChangedLatch.await(5, TimeUnit.SECONDS), "Listener1 should receive event");
        assertTrue(listener2.filesChangedLatch.await(5, TimeUnit.SECONDS), "Listener2 should receive event");
        assertTrue(listener1.seen.contains("test.py"), "Batch should contain test.py");
        assertTrue(listener2.seen.contains("test.py"), "Batch should contain test.py");
    }

    @Test
    void testListenerExceptionIsolation() throws Exception {
        var throwing = new TestListener("ThrowingListener", true);
        var healthy = new TestListener("Listener");
        startWatching(tempDir, List.of(throwing, healthy));

        Files.writeString(tempDir.resolve("test.txt"), "content");

        assertTrue(healthy.filesChangedLatch.await(5, TimeUnit.SECONDS), "Healthy listener should receive event");
        assertTrue(throwing.exceptionThrown.get() > 0, "ThrowingListener should have thrown exception");
    }

    @Test
    void testIgnoredDirectoriesAreNotReported() throws Exception {
        Path nodeModules = Files.createDirectories(tempDir.resolve("node_modules/lib"));
        var listener = new TestListener("Listener");
        startWatching(tempDir, List.of(listener));

        Files.writeString(nodeModules.resolve("index.js"), "module.exports = 1;\n");
        Files.createDirectories(tempDir.resolve("__pycache__"));
        Files.writeString(tempDir.resolve("visible.py"), "y = 2\n");

        assertTrue(listener.filesChangedLatch.await(5, TimeUnit.SECONDS));
        // let any trailing batch arrive
        Thread.sleep(400);
        assertTrue(listener.seen.contains("visible.py"));
        assertTrue(
                listener.seen.stream().noneMatch(p -> p.startsWith("node_modules") || p.startsWith("__pycache__")),
                "Ignored paths leaked into batches: " + listener.seen);
    }

    @Test
    void testNewSubdirectoryIsWatched() throws Exception {
        var listener = new TestListener("Listener");
        startWatching(tempDir, List.of(listener));

        Path pkg = Files.createDirectories(tempDir.resolve("pkg"));
        assertTrue(listener.filesChangedLatch.await(5, TimeUnit.SECONDS));
        // give the watcher a moment to register the new directory
        Thread.sleep(400);

        Files.writeString(pkg.resolve("mod.py"), "def f():\n    pass\n");

        long deadline = System.currentTimeMillis() + 5000;
        while (!listener.seen.contains("pkg/mod.py") && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertTrue(listener.seen.contains("pkg/mod.py"), "Saw: " + listener.seen);
    }

    @Test
    void testRootLossIsReported() throws Exception {
        Path root = Files.createDirectories(tempDir.resolve("project"));
        Files.writeString(root.resolve("a.py"), "a = 1\n");
        var listener = new TestListener("Listener");
        startWatching(root, List.of(listener));

        Files.delete(root.resolve("a.py"));
        Files.delete(root);

        assertTrue(listener.rootLostLatch.await(5, TimeUnit.SECONDS), "Root loss should be reported");
    }

    @Test
    void testDebounceWindowIsCapped() {
        assertEquals(1_100, ProjectWatchService.nextDeadline(1_000, 100, 1_400));
        assertEquals(1_400, ProjectWatchService.nextDeadline(1_350, 100, 1_400));
    }

    @Test
    void testContinuousChurnStillDeliversBatches() throws Exception {
        var listener = new TestListener("Listener");
        startWatching(tempDir, List.of(listener));

        // keep writing faster than the 100 ms quiet period for well past the 400 ms cap
        boolean delivered = false;
        for (int i = 0; i < 60 && !delivered; i++) {
            Files.writeString(tempDir.resolve("churn.txt"), "revision " + i);
            Thread.sleep(40);
            delivered = listener.filesChangedLatch.getCount() == 0;
        }

        assertTrue(delivered, "A batch must be delivered while events keep arriving");
    }

    @Test
    void testAddAndRemoveListener() throws Exception {
        var initial = new TestListener("Initial");
        startWatching(tempDir, new ArrayList<>(List.of(initial)));

        var dynamic = new TestListener("Dynamic");
        watchService.addListener(dynamic);
        watchService.removeListener(initial);

        Files.writeString(tempDir.resolve("later.txt"), "later");

        assertTrue(dynamic.filesChangedLatch.await(5, TimeUnit.SECONDS), "Added listener should receive event");
        assertEquals(0, initial.filesChangedCount.get(), "Removed listener should not receive events");
    }

    private static class TestListener implements Listener {
        private final String name;
        private final boolean shouldThrow;
        private final AtomicInteger filesChangedCount = new AtomicInteger(0);
        private final AtomicInteger exceptionThrown = new AtomicInteger(0);
        private final CountDownLatch filesChangedLatch = new CountDownLatch(1);
        private final CountDownLatch rootLostLatch = new CountDownLatch(1);
        private final Set<String> seen = ConcurrentHashMap.newKeySet();

        TestListener(String name) {
            this(name, false);
        }

        TestListener(String name, boolean shouldThrow) {
            this.name = name;
            this.shouldThrow = shouldThrow;
        }

        @Override
        public void onFilesChanged(EventBatch batch) {
            if (shouldThrow) {
                exceptionThrown.incrementAndGet();
                throw new RuntimeException("Test exception from " + name);
            }
            batch.files.forEach(f -> seen.add(f.toString()));
            filesChangedCount.incrementAndGet();
            filesChangedLatch.countDown();
        }

        @Override
        public void onRootLost() {
            rootLostLatch.countDown();
        }
    }
}
