package org.minihttp.server;

import api.impl.HttpResponseImpl;
import api.impl.MinimalHttpRequest;
import api.impl.RequestHeader;
import api.interfaces.IRouter;
import api.interfaces.http.HttpRequest;
import org.minihttp.http.IncompleteRequestDataException;
import org.minihttp.http.ParsedRequest;
import org.minihttp.interfaces.ByteStreamHandler;
import org.minihttp.interfaces.HttpCodec;
import org.minihttp.util.ByteData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs the request cycle for a single connection: parse, dispatch to the
 * router, render.
 * <p>
 * A request carrying {@code Expect: 100-continue} is not dispatched right away.
 * The driver answers {@code 100 Continue}, remembers the header and treats the
 * next chunk, unparsed, as that request's body. Instances are confined to one
 * connection and are not thread-safe.
 * </p>
 */
public final class ConnectionDriver implements ByteStreamHandler {
    private static final Logger log = LoggerFactory.getLogger(ConnectionDriver.class);

    private static final byte[] NO_REPLY = new byte[0];

    private final IRouter router;
    private final HttpCodec codec;
    private final long connectionId;
    private ConnectionState state = ConnectionState.IDLE;

    public ConnectionDriver(IRouter router, HttpCodec codec, long connectionId) {
        this.router = Objects.requireNonNull(router, "router");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.connectionId = connectionId;
    }

    @Override
    public byte[] onData(byte[] chunk) {
        if (state instanceof ConnectionState.PendingContinuation pending) {
            state = ConnectionState.IDLE;
            log.debug("[conn {}] continuation body of {} bytes", connectionId, chunk.length);
            return dispatch(new MinimalHttpRequest(pending.header(), chunk));
        }

        ParsedRequest parsed;
        try {
            parsed = codec.parse(chunk);
        } catch (IncompleteRequestDataException e) {
            log.warn("[conn {}] dropping unreadable request: {}", connectionId, e.getMessage());
            if (log.isDebugEnabled()) {
                log.debug("[conn {}] unreadable chunk:\n{}", connectionId, new ByteData(chunk).describe());
            }
            return NO_REPLY;
        }

        if (expectsContinue(parsed.header())) {
            state = new ConnectionState.PendingContinuation(parsed.header());
            log.debug("[conn {}] {} {} expects 100-continue", connectionId,
                    parsed.header().method(), parsed.header().path());
            HttpResponseImpl interim = new HttpResponseImpl();
            interim.status(HttpCodec.CONTINUE);
            return codec.render(interim);
        }

        return dispatch(parsed.toRequest());
    }

    public ConnectionState state() { return state; }

    private byte[] dispatch(HttpRequest req) {
        HttpResponseImpl res = router.handle(req);
        log.info("[conn {}] {} {} -> {}", connectionId, req.method(), req.path(), res.status());
        return codec.render(res);
    }

    private static boolean expectsContinue(RequestHeader header) {
        String expect = header.field("Expect");
        return expect != null && expect.trim().equalsIgnoreCase("100-continue");
    }
}
