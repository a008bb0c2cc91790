package api.impl;

import api.impl.handlers.NotFoundHandler;
import api.interfaces.IHttpHandler;
import api.interfaces.IRouter;
import api.interfaces.http.HttpRequest;
import org.minihttp.interfaces.HttpCodec;
import org.minihttp.json.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Linear router: the first registered route whose segments fit the requested
 * path wins.
 * <p>
 * Routes are added during startup; {@link #freeze()} makes the table read-only
 * so it can be shared by every connection. With {@code enforceMethods == false}
 * the registered method is recorded but not compared, so a GET route also
 * answers POST to the same path.
 * </p>
 */
public class Router implements IRouter {
    private static final Logger log = LoggerFactory.getLogger(Router.class);

    private record Route(String method, RoutePattern pattern, IHttpHandler handler) {}

    private final boolean enforceMethods;
    private final IHttpHandler fallback;
    private volatile List<Route> routes = new ArrayList<>();
    private volatile boolean frozen;

    public Router() {
        this(false);
    }

    public Router(boolean enforceMethods) {
        this(enforceMethods, new NotFoundHandler());
    }

    public Router(boolean enforceMethods, IHttpHandler fallback) {
        this.enforceMethods = enforceMethods;
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    @Override
    public synchronized void register(String method, String pattern, IHttpHandler handler) {
        if (frozen) {
            throw new IllegalStateException("routes are frozen; cannot register " + method + " " + pattern);
        }
        String m = Objects.requireNonNull(method, "method").toUpperCase(Locale.ROOT);
        routes.add(new Route(m, new RoutePattern(pattern), Objects.requireNonNull(handler, "handler")));
        log.debug("Registered route {} {}", m, pattern);
    }

    /** Makes the route table read-only. Idempotent. */
    public synchronized void freeze() {
        if (!frozen) {
            routes = List.copyOf(routes);
            frozen = true;
        }
    }

    public boolean isFrozen() { return frozen; }

    public int size() { return routes.size(); }

    @Override
    public HttpResponseImpl handle(HttpRequest req) {
        List<String> requested = RoutePattern.splitPath(req.path());
        boolean pathMatchedOtherMethod = false;

        for (Route route : routes) {
            Optional<Map<String, String>> params = route.pattern().match(requested);
            if (params.isEmpty()) continue;
            if (enforceMethods && !route.method().equalsIgnoreCase(req.method())) {
                pathMatchedOtherMethod = true;
                continue;
            }
            return run(route.handler(), req, params.get());
        }

        if (pathMatchedOtherMethod) {
            HttpResponseImpl res = new HttpResponseImpl();
            res.status(HttpCodec.METHOD_NOT_ALLOWED);
            res.contentType("application/json");
            res.body(Json.stringify(Map.of("error", ("method " + req.method() + " not allowed for " + req.path()).replace("\"", "'"))));
            return res;
        }
        return run(fallback, req, Map.of());
    }

    private HttpResponseImpl run(IHttpHandler handler, HttpRequest req, Map<String, String> params) {
        HttpResponseImpl res = new HttpResponseImpl();
        try {
            handler.handle(req, params, res);
        } catch (Exception e) {
            log.error("Handler failed for {} {}", req.method(), req.path(), e);
            res = new HttpResponseImpl();
            res.status(HttpCodec.INTERNAL_SERVER_ERROR);
            res.contentType("application/json");
            res.body(Json.stringify(Map.of("error", String.valueOf(e.getMessage()).replace("\"", "'"))));
        }
        return res;
    }
}
