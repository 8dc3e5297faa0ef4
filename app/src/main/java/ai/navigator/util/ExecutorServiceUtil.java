package ai.navigator.util;

import ai.navigator.exception.GlobalExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public final class ExecutorServiceUtil {

    private ExecutorServiceUtil() {}

    public static ExecutorService newFixedThreadExecutor(int parallelism, String threadPrefix) {
        assert parallelism >= 1 : "parallelism must be >= 1";
        return Executors.newFixedThreadPool(parallelism, createNamedThreadFactory(threadPrefix));
    }

    /** Single worker that runs submitted tasks strictly one at a time, in submission order. */
    public static ExecutorService newSerialExecutor(String threadPrefix) {
        return Executors.newSingleThreadExecutor(createNamedThreadFactory(threadPrefix));
    }

    public static ScheduledExecutorService newScheduledExecutor(String threadPrefix) {
        return Executors.newSingleThreadScheduledExecutor(createNamedThreadFactory(threadPrefix));
    }

    public static ThreadFactory createNamedThreadFactory(String prefix) {
        var counter = new AtomicInteger(0);
        return r -> {
            var thread = new Thread(r);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler(GlobalExceptionHandler::handle);
            return thread;
        };
    }
}
