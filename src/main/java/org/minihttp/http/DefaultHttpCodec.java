package org.minihttp.http;

import api.impl.HttpResponseImpl;
import org.minihttp.interfaces.HttpCodec;

/**
 * DefaultHttpCodec binds {@link HttpRequestParser} and {@link HttpResponseWriter}
 * behind the {@link HttpCodec} seam used by the connection driver.
 */
public class DefaultHttpCodec implements HttpCodec {

    /**
     * @throws IncompleteRequestDataException if the bytes are not a readable request
     */
    @Override
    public ParsedRequest parse(byte[] raw) {
        return HttpRequestParser.parse(raw);
    }

    @Override
    public byte[] render(HttpResponseImpl response) {
        return HttpResponseWriter.render(response);
    }

    @Override
    public String reason(int code) {
        return HttpResponseWriter.reason(code);
    }
}
