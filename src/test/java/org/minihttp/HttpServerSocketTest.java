package org.minihttp;

import api.impl.Router;
import app.MiniHttpServer;
import org.minihttp.config.ServerConfig;
import org.minihttp.server.HttpServer;
import org.minihttp.server.ServerStartupException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HttpServerSocketTest {

    private HttpServer server;
    private Thread loop;

    private int startServer(ServerConfig config) {
        return startServer(config, MiniHttpServer.routes(config));
    }

    private int startServer(ServerConfig config, Router router) {
        server = new HttpServer(config, router);
        int port = server.bind();
        loop = new Thread(server::start, "test-server");
        loop.setDaemon(true);
        loop.start();
        return port;
    }

    private int startServer() {
        return startServer(localConfig());
    }

    private static ServerConfig localConfig() {
        return new ServerConfig().port(0).bindAddress("127.0.0.1").serverId("test-node");
    }

    private static Socket connect(int port) throws IOException {
        Socket s = new Socket();
        s.connect(new InetSocketAddress("127.0.0.1", port), 2000);
        s.setSoTimeout(5000);
        return s;
    }

    private static void send(OutputStream out, String text) throws IOException {
        out.write(text.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) server.close();
        if (loop != null) loop.join(3000);
    }

    @Test
    void routeParamsComeBackAsJson() throws Exception {
        int port = startServer();
        try (Socket s = connect(port)) {
            send(s.getOutputStream(), "GET /schools/1/2/classes/3 HTTP/1.1\r\nHost: localhost\r\n\r\n");
            String res = NetTestUtils.readResponse(s.getInputStream());

            assertEquals("HTTP/1.1 200 OK\nContent-Type: application/json\nContent-Length: 34\n\n"
                    + "{\"id\":\"1\",\"score\":\"2\",\"disco\":\"3\"}", res);
        }
    }

    @Test
    void expectContinueThenBodyInSecondWrite() throws Exception {
        int port = startServer();
        try (Socket s = connect(port)) {
            OutputStream out = s.getOutputStream();
            InputStream in = s.getInputStream();

            send(out, "POST /echo HTTP/1.1\r\nContent-Length: 15\r\nExpect: 100-continue\r\n\r\n");
            assertEquals("HTTP/1.1 100 Continue\nContent-Type: text/html\nContent-Length: 0\n\n",
                    NetTestUtils.readResponse(in));

            send(out, "{\"k\":[1,2.5 3]}");
            String res = NetTestUtils.readResponse(in);
            assertTrue(res.startsWith("HTTP/1.1 200 OK\nContent-Type: application/json\n"), res);
            assertTrue(res.endsWith("\n\n{\"k\":[1,2.5,3]}"), res);
        }
    }

    @Test
    void severalRequestsShareOneConnection() throws Exception {
        int port = startServer();
        try (Socket s = connect(port)) {
            OutputStream out = s.getOutputStream();
            InputStream in = s.getInputStream();

            send(out, "GET /health HTTP/1.1\r\n\r\n");
            String health = NetTestUtils.readResponse(in);
            assertTrue(health.endsWith("{\"status\":\"ok\",\"serverId\":\"test-node\"}"), health);

            send(out, "GET /nowhere HTTP/1.1\r\n\r\n");
            String missing = NetTestUtils.readResponse(in);
            assertTrue(missing.startsWith("HTTP/1.1 404 Not Found\n"), missing);

            send(out, "POST /echo HTTP/1.1\r\n\r\n{oops}");
            String bad = NetTestUtils.readResponse(in);
            assertTrue(bad.startsWith("HTTP/1.1 400 Bad Request\n"), bad);
        }
    }

    @Test
    void deeplyNestedBodyLeavesServerRunning() throws Exception {
        int port = startServer();
        try (Socket s = connect(port)) {
            send(s.getOutputStream(), "POST /echo HTTP/1.1\r\n\r\n" + "[".repeat(30000));
            String res = NetTestUtils.readResponse(s.getInputStream());
            assertTrue(res.startsWith("HTTP/1.1 400 Bad Request\n"), res);
        }
        assertTrue(loop.isAlive());

        try (Socket s = connect(port)) {
            send(s.getOutputStream(), "GET /health HTTP/1.1\r\n\r\n");
            String res = NetTestUtils.readResponse(s.getInputStream());
            assertTrue(res.startsWith("HTTP/1.1 200 OK\n"), res);
        }
    }

    @Test
    void clientCanReconnectAfterClosing() throws Exception {
        int port = startServer();
        for (int i = 0; i < 3; i++) {
            try (Socket s = connect(port)) {
                send(s.getOutputStream(), "GET /sample HTTP/1.1\r\n\r\n");
                assertTrue(NetTestUtils.readResponse(s.getInputStream()).endsWith("\n\n{}"));
            }
        }
    }

    @Test
    void occupiedPortFailsStartup() {
        int port = startServer();
        ServerConfig clash = localConfig().port(port);
        try (HttpServer second = new HttpServer(clash, MiniHttpServer.routes(clash))) {
            assertThrows(ServerStartupException.class, second::bind);
        }
    }

    @Test
    void workerThreadsAreNumberedIndependentlyOfConnections() throws Exception {
        Router router = new Router();
        router.get("/thread", (req, params, res) -> res.body(Thread.currentThread().getName()));
        int port = startServer(localConfig().concurrent(true), router);

        try (Socket s = connect(port)) {
            send(s.getOutputStream(), "GET /thread HTTP/1.1\r\n\r\n");
            assertTrue(NetTestUtils.readResponse(s.getInputStream()).endsWith("\n\nminihttp-worker-1"));
        }
    }

    @Test
    void concurrentModeServesSecondClientWhileFirstIsIdle() throws Exception {
        int port = startServer(localConfig().concurrent(true));
        try (Socket idle = connect(port); Socket active = connect(port)) {
            send(active.getOutputStream(), "GET /health HTTP/1.1\r\n\r\n");
            String res = NetTestUtils.readResponse(active.getInputStream());
            assertTrue(res.startsWith("HTTP/1.1 200 OK\n"), res);

            send(idle.getOutputStream(), "GET /schools/9/classes HTTP/1.1\r\n\r\n");
            assertTrue(NetTestUtils.readResponse(idle.getInputStream()).endsWith("{\"id\":\"9\"}"));
        }
    }
}
