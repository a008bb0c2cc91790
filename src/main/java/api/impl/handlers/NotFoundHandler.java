package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import org.minihttp.interfaces.HttpCodec;
import org.minihttp.json.Json;

import java.util.Map;

public class NotFoundHandler implements IHttpHandler {
    @Override
    public void handle(HttpRequest req, Map<String, String> params, HttpResponse res) {
        res.status(HttpCodec.NOT_FOUND);
        res.contentType("application/json");
        res.body(Json.stringify(Map.of("error", ("no route for " + req.method() + " " + req.path()).replace("\"", "'"))));
    }
}
