package org.minihttp.server;

import org.minihttp.config.ServerConfig;
import org.minihttp.interfaces.ByteStreamHandler;
import org.minihttp.interfaces.ByteStreamHandlerFactory;
import org.minihttp.interfaces.ConnectionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Listening TCP endpoint that feeds each connection's bytes to its own
 * {@link ByteStreamHandler}.
 * <p>
 * For every chunk read (at most {@link ServerConfig#getReceiveBufferSize()}
 * bytes) the handler's reply is written back before the next read. A
 * connection ends when a read reports end of stream. By default connections
 * are served one after another on the accepting thread; with
 * {@link ServerConfig#isConcurrent()} each one gets a worker thread.
 * </p>
 */
public final class SocketServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SocketServer.class);

    private final ServerConfig config;
    private final ConnectionListener listener;
    private final AtomicLong connectionIds = new AtomicLong();
    private final AtomicLong workerIds = new AtomicLong();
    private final ExecutorService workers;

    private volatile ServerSocket serverSocket;
    private volatile boolean running;

    public SocketServer(ServerConfig config, ConnectionListener listener) {
        this.config = Objects.requireNonNull(config, "config");
        this.listener = listener == null ? ConnectionListener.NONE : listener;
        this.workers = config.isConcurrent()
                ? Executors.newCachedThreadPool(r -> {
                    Thread t = new Thread(r, "minihttp-worker-" + workerIds.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                })
                : null;
    }

    /**
     * Opens the listening socket. Calling it again once bound does nothing.
     *
     * @return the bound port, useful when the configured port is 0
     * @throws ServerStartupException if the address cannot be bound
     */
    public synchronized int bind() {
        if (serverSocket == null) {
            try {
                InetAddress address = InetAddress.getByName(config.getBindAddress());
                serverSocket = new ServerSocket(config.getPort(), config.getBacklog(), address);
            } catch (IOException e) {
                throw new ServerStartupException("cannot listen on " + config.getBindAddress()
                        + ":" + config.getPort() + ": " + e.getMessage(), e);
            }
            running = true;
            log.info("Listening on {}:{}", config.getBindAddress(), serverSocket.getLocalPort());
        }
        return serverSocket.getLocalPort();
    }

    /** Binds and accepts connections until {@link #close()} is called. */
    public void start(ByteStreamHandlerFactory factory) {
        Objects.requireNonNull(factory, "factory");
        bind();

        while (running) {
            Socket client;
            try {
                client = serverSocket.accept();
            } catch (IOException e) {
                if (!running) break;
                log.warn("Accept failed: {}", e.getMessage());
                continue;
            }

            long id = connectionIds.incrementAndGet();
            if (workers != null) {
                workers.execute(() -> converse(client, id, factory));
            } else {
                converse(client, id, factory);
            }
        }
        log.info("Stopped accepting connections");
    }

    public int localPort() {
        ServerSocket ss = serverSocket;
        return ss == null ? -1 : ss.getLocalPort();
    }

    private void converse(Socket client, long id, ByteStreamHandlerFactory factory) {
        ByteStreamHandler handler = factory.newConnection(id);
        listener.onConnect(id);

        try (client; InputStream in = client.getInputStream(); OutputStream out = client.getOutputStream()) {
            byte[] buffer = new byte[config.getReceiveBufferSize()];
            int n;
            while ((n = in.read(buffer)) > 0) {
                byte[] reply = handler.onData(Arrays.copyOf(buffer, n));
                if (reply.length > 0) {
                    out.write(reply);
                    out.flush();
                }
            }
        } catch (SocketException se) {
            String msg = String.valueOf(se.getMessage()).toLowerCase(Locale.ROOT);
            if (msg.contains("connection reset") || msg.contains("broken pipe")
                    || msg.contains("socket closed") || msg.contains("software caused connection abort")) {
                log.debug("[conn {}] peer went away: {}", id, se.getMessage());
            } else {
                log.warn("[conn {}] socket error: {}", id, se.getMessage());
            }
        } catch (IOException e) {
            log.warn("[conn {}] I/O error: {}", id, e.getMessage());
        } catch (RuntimeException | StackOverflowError e) {
            log.error("[conn {}] connection aborted", id, e);
        } finally {
            listener.onClose(id);
        }
    }

    @Override
    public void close() {
        running = false;
        ServerSocket ss = serverSocket;
        if (ss != null) {
            try {
                ss.close();
            } catch (IOException e) {
                log.warn("Error closing listening socket: {}", e.getMessage());
            }
        }
        if (workers != null) {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(2, TimeUnit.SECONDS)) workers.shutdownNow();
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
