package ai.navigator;

import ai.navigator.server.QueryServer;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * A running daemon: the shared context, the query server, the idle watchdog and the port file.
 * {@link #stop()} is idempotent and may be called from the watchdog, a shutdown hook or a test.
 */
public final class Daemon implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(Daemon.class);

    private final DaemonContext context;
    private final QueryServer server;
    private final PortFile portFile;
    private final @Nullable IdleWatchdog watchdog;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final CountDownLatch stoppedLatch = new CountDownLatch(1);

    private Daemon(DaemonContext context, QueryServer server, PortFile portFile) {
        this.context = context;
        this.server = server;
        this.portFile = portFile;
        int idleTimeout = context.config().idleTimeoutSeconds();
        // stop() joins the watchdog's scheduler, so it must not run on the watchdog thread
        this.watchdog = idleTimeout > 0
                ? new IdleWatchdog(TimeUnit.SECONDS.toMillis(idleTimeout), context::lastActivity, this::stopInBackground)
                : null;
    }

    /**
     * Builds the context, binds the server, waits for the watcher to cover the tree and publishes the
     * port file.
     *
     * @throws IOException if no port can be bound or the port file cannot be written
     */
    public static Daemon start(DaemonConfig config) throws IOException {
        logger.info("Starting daemon for {}", config.root());
        var context = new DaemonContext(config);
        QueryServer server;
        try {
            server = new QueryServer(context);
        } catch (IOException e) {
            context.close();
            throw e;
        }
        context.startWatcher().join();
        server.start();

        var portFile = new PortFile(config.rlmDir());
        var daemon = new Daemon(context, server, portFile);
        try {
            portFile.write(server.getPort());
        } catch (IOException e) {
            daemon.stop();
            throw e;
        }
        if (daemon.watchdog != null) {
            daemon.watchdog.start();
        }
        logger.info("Daemon ready on 127.0.0.1:{}", server.getPort());
        return daemon;
    }

    public int getPort() {
        return server.getPort();
    }

    public DaemonContext context() {
        return context;
    }

    /** Blocks until {@link #stop()} has completed. */
    public void awaitStopped() throws InterruptedException {
        stoppedLatch.await();
    }

    private void stopInBackground() {
        var thread = new Thread(this::stop, "daemon-shutdown");
        thread.setDaemon(false);
        thread.start();
    }

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        logger.info("Stopping daemon for {}", context.root());
        try {
            if (watchdog != null) {
                watchdog.close();
            }
            server.close();
            context.close();
            try {
                context.stats().appendSessionLog(context.config().rlmDir(), context.root().toString());
            } catch (IOException e) {
                logger.warn("Could not append session log", e);
            }
            portFile.delete();
        } finally {
            stoppedLatch.countDown();
        }
        logger.info("Daemon stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
