package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import org.minihttp.json.Json;

import java.util.LinkedHashMap;
import java.util.Map;

public class HealthHandler implements IHttpHandler {
    private final String serverId;

    public HealthHandler(String serverId) { this.serverId = serverId; }

    @Override
    public void handle(HttpRequest req, Map<String, String> params, HttpResponse res) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("serverId", serverId);
        res.contentType("application/json");
        res.body(Json.stringify(body));
    }
}
