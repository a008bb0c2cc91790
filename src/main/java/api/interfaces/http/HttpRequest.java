package api.interfaces.http;

import api.impl.RequestHeader;

/** Minimal request contract: an immutable header plus the raw body. */
public interface HttpRequest {
    RequestHeader requestHeader();

    default String method() { return requestHeader().method(); }
    default String path() { return requestHeader().path(); }
    default String version() { return requestHeader().version(); }

    /** Header field value by case-insensitive name, or {@code null}. */
    default String header(String name) { return requestHeader().field(name); }

    byte[] body();

    /** Body decoded as UTF-8. */
    String bodyText();
}
