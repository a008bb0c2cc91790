package api.interfaces;

import api.impl.HttpResponseImpl;
import api.interfaces.http.HttpRequest;

/** Pattern table mapping request paths to handlers. */
public interface IRouter {
    void register(String method, String pattern, IHttpHandler handler);

    /** Finds the handler for {@code req}, runs it and returns its response. Never null. */
    HttpResponseImpl handle(HttpRequest req);

    default void get(String pattern, IHttpHandler handler) { register("GET", pattern, handler); }
    default void post(String pattern, IHttpHandler handler) { register("POST", pattern, handler); }
    default void put(String pattern, IHttpHandler handler) { register("PUT", pattern, handler); }
    default void delete(String pattern, IHttpHandler handler) { register("DELETE", pattern, handler); }
}
