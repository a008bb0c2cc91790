package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import org.minihttp.interfaces.HttpCodec;
import org.minihttp.json.Json;
import org.minihttp.json.JsonSyntaxException;
import org.minihttp.json.JsonValue;

import java.util.Map;

/**
 * Reads the request body as JSON and writes it back in compact form.
 * Malformed bodies get a 400 with the parser's message.
 */
public class EchoJsonHandler implements IHttpHandler {
    @Override
    public void handle(HttpRequest req, Map<String, String> params, HttpResponse res) {
        res.contentType("application/json");
        String payload = req.bodyText().trim();

        if (payload.isEmpty()) {
            res.status(HttpCodec.BAD_REQUEST);
            res.body(Json.stringify(Map.of("error", "empty body")));
            return;
        }

        try {
            JsonValue value = Json.parse(payload);
            res.body(Json.format(value));
        } catch (JsonSyntaxException e) {
            res.status(HttpCodec.BAD_REQUEST);
            res.body(Json.stringify(Map.of("error", "invalid json: " + e.getMessage().replace("\"", "'"))));
        }
    }
}
