package api.interfaces;

import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

import java.util.Map;

public interface IHttpHandler {
    /**
     * @param params values bound by the route's {@code :name} segments
     */
    void handle(HttpRequest req, Map<String, String> params, HttpResponse res) throws Exception;
}
