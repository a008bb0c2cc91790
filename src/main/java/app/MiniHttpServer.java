package app;

import api.impl.Router;
import api.impl.handlers.EchoJsonHandler;
import api.impl.handlers.HealthHandler;
import api.impl.handlers.ParamsHandler;
import org.minihttp.config.ConfigLoader;
import org.minihttp.config.ServerConfig;
import org.minihttp.server.HttpServer;
import org.minihttp.server.ServerStartupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MiniHttpServer {
    private static final Logger log = LoggerFactory.getLogger(MiniHttpServer.class);

    public static void main(String[] args) {
        ServerConfig config;
        try {
            config = ConfigLoader.load(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }
        log.info("Starting with {}", config);

        Router router = routes(config);
        try (HttpServer server = new HttpServer(config, router)) {
            Runtime.getRuntime().addShutdownHook(new Thread(server::close, "minihttp-shutdown"));
            server.start();
        } catch (ServerStartupException e) {
            log.error("Server failed to start: {}", e.getMessage());
            System.exit(1);
        }
    }

    /** Sample route table. */
    public static Router routes(ServerConfig config) {
        Router router = new Router(config.isEnforceMethods());
        ParamsHandler params = new ParamsHandler();

        router.get("/", params);
        router.get("/sample", params);
        router.get("/schools/:id/classes", params);
        router.get("/schools/:id/:score/classes/:disco", params);
        router.get("/health", new HealthHandler(config.getServerId()));
        router.post("/echo", new EchoJsonHandler());
        return router;
    }
}
