package api.interfaces.http;

/** Minimal response contract, filled in once by a handler */
public interface HttpResponse {
    void status(int code);
    void contentType(String type);
    void header(String name, String value);
    void body(String text);
}
