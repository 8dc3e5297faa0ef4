package ai.navigator;

import ai.navigator.util.ExecutorServiceUtil;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Fires {@code onIdle} once when no connection has arrived for the configured timeout. */
public final class IdleWatchdog implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(IdleWatchdog.class);

    private final ScheduledExecutorService scheduler = ExecutorServiceUtil.newScheduledExecutor("idle-watchdog");
    private final long timeoutMs;
    private final LongSupplier lastActivity;
    private final Runnable onIdle;
    private volatile boolean fired;

    public IdleWatchdog(long timeoutMs, LongSupplier lastActivity, Runnable onIdle) {
        this.timeoutMs = timeoutMs;
        this.lastActivity = lastActivity;
        this.onIdle = onIdle;
    }

    public void start() {
        long period = Math.max(50, Math.min(1000, timeoutMs / 4));
        scheduler.scheduleAtFixedRate(this::check, period, period, TimeUnit.MILLISECONDS);
    }

    private void check() {
        if (fired) {
            return;
        }
        long idle = System.currentTimeMillis() - lastActivity.getAsLong();
        if (idle >= timeoutMs) {
            fired = true;
            logger.info("No connections for {} ms; shutting down", idle);
            scheduler.shutdown();
            onIdle.run();
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
