package org.minihttp.server;

import api.impl.Router;
import api.interfaces.IHttpServer;
import org.minihttp.config.ServerConfig;
import org.minihttp.http.DefaultHttpCodec;
import org.minihttp.interfaces.ConnectionListener;
import org.minihttp.interfaces.HttpCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * HttpServer wires the socket loop to a fresh {@link ConnectionDriver} per
 * connection. The router is frozen on bind, so the route table is the only
 * state connections share.
 */
public final class HttpServer implements IHttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final Router router;
    private final HttpCodec codec;
    private final SocketServer socket;

    public HttpServer(ServerConfig config, Router router) {
        this(config, router, new DefaultHttpCodec());
    }

    public HttpServer(ServerConfig config, Router router, HttpCodec codec) {
        this.router = Objects.requireNonNull(router, "router");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.socket = new SocketServer(config, new ConnectionListener() {
            @Override
            public void onConnect(long connectionId) {
                log.debug("Client connected {}", connectionId);
            }

            @Override
            public void onClose(long connectionId) {
                log.debug("Client closed {}", connectionId);
            }
        });
    }

    /**
     * Freezes the routes and opens the listening socket.
     *
     * @return the bound port
     */
    public int bind() {
        router.freeze();
        return socket.bind();
    }

    @Override
    public void start() {
        bind();
        socket.start(id -> new ConnectionDriver(router, codec, id));
    }

    public int localPort() { return socket.localPort(); }

    @Override
    public void close() {
        socket.close();
    }
}
