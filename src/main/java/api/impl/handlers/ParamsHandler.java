package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import org.minihttp.json.Json;

import java.util.Map;

/** Answers with the bound route parameters as a JSON object. */
public class ParamsHandler implements IHttpHandler {
    @Override
    public void handle(HttpRequest req, Map<String, String> params, HttpResponse res) {
        res.contentType("application/json");
        res.body(Json.stringify(params));
    }
}
