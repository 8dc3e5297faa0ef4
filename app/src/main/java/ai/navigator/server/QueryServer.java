package ai.navigator.server;

import ai.navigator.DaemonConfig;
import ai.navigator.DaemonContext;
import ai.navigator.exception.ProtocolException;
import ai.navigator.util.ExecutorServiceUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonEOFException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.BindException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Loopback TCP server speaking one JSON request and one JSON response per connection.
 *
 * <p>A request ends when the client half-closes or as soon as the bytes received so far parse as a
 * complete JSON value, so clients that keep their side open are served too. A connection that delivers
 * no bytes at all is answered with {@code ALIVE}.
 */
public final class QueryServer implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(QueryServer.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final int MAX_REQUEST_BYTES = 4 * 1024 * 1024;
    static final byte[] ALIVE = "ALIVE".getBytes(StandardCharsets.UTF_8);

    private final DaemonContext context;
    private final RequestDispatcher dispatcher;
    private final ServerSocket serverSocket;
    private final ExecutorService workers;
    private final int ioTimeoutMs;
    private volatile boolean running;
    private @Nullable Thread acceptThread;

    /**
     * Binds to {@code 127.0.0.1}, trying {@code config.port()} and the following ports.
     *
     * @throws IOException if no port in the range can be bound
     */
    public QueryServer(DaemonContext context) throws IOException {
        this.context = context;
        this.dispatcher = new RequestDispatcher(context);
        var config = context.config();
        this.ioTimeoutMs = config.ioTimeoutMs();
        this.serverSocket = bind(config.port());
        this.workers = ExecutorServiceUtil.newFixedThreadExecutor(config.workers(), "query-worker");
        logger.info("QueryServer bound to 127.0.0.1:{} with {} worker threads", getPort(), config.workers());
    }

    private static ServerSocket bind(int port) throws IOException {
        var loopback = InetAddress.getLoopbackAddress();
        if (port == 0) {
            return new ServerSocket(0, 50, loopback);
        }
        IOException last = null;
        for (int candidate = port; candidate < port + DaemonConfig.PORT_ATTEMPTS && candidate <= 65535; candidate++) {
            var socket = new ServerSocket();
            try {
                socket.setReuseAddress(true);
                socket.bind(new InetSocketAddress(loopback, candidate), 50);
                return socket;
            } catch (BindException e) {
                socket.close();
                logger.debug("Port {} unavailable: {}", candidate, e.getMessage());
                last = e;
            }
        }
        throw new BindException("No free port in %d-%d%s".formatted(
                port, port + DaemonConfig.PORT_ATTEMPTS - 1, last == null ? "" : ": " + last.getMessage()));
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        var thread = new Thread(this::acceptLoop, "query-accept");
        thread.setDaemon(true);
        thread.start();
        acceptThread = thread;
        logger.info("QueryServer started");
    }

    public int getPort() {
        return serverSocket.getLocalPort();
    }

    private void acceptLoop() {
        while (running) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (SocketException e) {
                if (running) {
                    logger.error("Accept failed", e);
                }
                break;
            } catch (IOException e) {
                logger.warn("Accept failed: {}", e.getMessage());
                continue;
            }
            context.touch();
            try {
                workers.execute(() -> serve(socket));
            } catch (RejectedExecutionException e) {
                logger.debug("Worker pool shut down; dropping connection");
                closeQuietly(socket);
            }
        }
        logger.debug("Accept loop exited");
    }

    private void serve(Socket socket) {
        try (socket) {
            socket.setSoTimeout(ioTimeoutMs);
            byte[] response = respond(socket.getInputStream());
            OutputStream out = socket.getOutputStream();
            out.write(response);
            out.flush();
        } catch (IOException e) {
            logger.debug("Connection error: {}", e.getMessage());
        } finally {
            context.touch();
        }
    }

    private byte[] respond(InputStream in) throws IOException {
        var buffer = new ByteArrayOutputStream();
        var chunk = new byte[8192];
        boolean sawContent = false;
        while (true) {
            int n;
            try {
                n = in.read(chunk);
            } catch (SocketTimeoutException e) {
                if (!sawContent) {
                    return ALIVE;
                }
                return dispatcher.reject(new ProtocolException("Timed out waiting for a complete request"));
            }
            if (n < 0) {
                if (!sawContent) {
                    return ALIVE;
                }
                try {
                    return dispatcher.dispatch(objectMapper.readTree(buffer.toByteArray()));
                } catch (JsonProcessingException e) {
                    return dispatcher.reject(new ProtocolException("Invalid JSON: " + e.getOriginalMessage(), e));
                }
            }
            buffer.write(chunk, 0, n);
            if (buffer.size() > MAX_REQUEST_BYTES) {
                return dispatcher.reject(new ProtocolException(
                        "Request exceeds %d bytes".formatted(MAX_REQUEST_BYTES)));
            }
            int last = lastNonWhitespace(chunk, n);
            if (last < 0) {
                continue;
            }
            sawContent = true;
            // only a closing bracket can complete an object or array
            if (chunk[last] != '}' && chunk[last] != ']') {
                continue;
            }
            try {
                var request = parseComplete(buffer.toByteArray());
                if (request != null) {
                    return dispatcher.dispatch(request);
                }
            } catch (JsonProcessingException e) {
                return dispatcher.reject(new ProtocolException("Invalid JSON: " + e.getOriginalMessage(), e));
            }
        }
    }

    /** Returns the parsed value, or null when the bytes are a valid but unfinished JSON prefix. */
    private static @Nullable JsonNode parseComplete(byte[] bytes) throws JsonProcessingException {
        try {
            var node = objectMapper.readTree(bytes);
            return node == null || node.isMissingNode() ? null : node;
        } catch (JsonEOFException e) {
            return null;
        } catch (JsonProcessingException e) {
            throw e;
        } catch (IOException e) {
            throw new IllegalStateException("I/O error reading an in-memory buffer", e);
        }
    }

    private static int lastNonWhitespace(byte[] bytes, int length) {
        for (int i = length - 1; i >= 0; i--) {
            byte b = bytes[i];
            if (b != ' ' && b != '\n' && b != '\r' && b != '\t') {
                return i;
            }
        }
        return -1;
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing socket: {}", e.getMessage());
        }
    }

    @Override
    public synchronized void close() {
        if (!running && serverSocket.isClosed()) {
            return;
        }
        running = false;
        try {
            serverSocket.close();
        } catch (IOException e) {
            logger.warn("Error closing server socket", e);
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(2, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        if (acceptThread != null) {
            try {
                acceptThread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        logger.info("QueryServer stopped");
    }
}
