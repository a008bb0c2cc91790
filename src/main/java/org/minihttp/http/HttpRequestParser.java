package org.minihttp.http;

import api.impl.RequestHeader;
import org.minihttp.util.ByteData;

import java.nio.charset.CharacterCodingException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Splits raw request bytes into a {@link RequestHeader} and a body in one pass.
 * <p>
 * The header section ends at the first CR LF CR LF found by a byte-wise scan;
 * blank CR LF lines right after it are skipped and the rest is the body.
 * Without a terminator the whole buffer is header and the body is empty.
 * </p>
 */
public final class HttpRequestParser {

    private static final byte CR = 0x0d;
    private static final byte LF = 0x0a;

    private HttpRequestParser() {}

    /**
     * @throws IncompleteRequestDataException if there is nothing to parse or the
     *         header section is not valid UTF-8
     */
    public static ParsedRequest parse(byte[] raw) {
        if (raw == null || raw.length == 0) {
            throw new IncompleteRequestDataException("no request data");
        }
        ByteData data = new ByteData(raw);

        int terminator = findTerminator(data);
        int headerEnd = terminator < 0 ? data.length() : terminator;
        byte[] body = new byte[0];
        if (terminator >= 0) {
            int bodyStart = terminator + 4;
            // blank lines between header and body are dropped, so a body cannot start with CR LF
            while (bodyStart + 1 < data.length()
                    && data.byteAt(bodyStart) == CR && data.byteAt(bodyStart + 1) == LF) {
                bodyStart += 2;
            }
            body = data.tail(bodyStart);
        }

        String headerText;
        try {
            headerText = new ByteData(raw, 0, headerEnd).stringValue();
        } catch (CharacterCodingException e) {
            throw new IncompleteRequestDataException("request header is not valid UTF-8", e);
        }
        return new ParsedRequest(parseHeader(headerText), body);
    }

    /** Index of the first CR LF CR LF, or -1. */
    static int findTerminator(ByteData data) {
        for (int i = 0; i + 3 < data.length(); i++) {
            if (data.byteAt(i) == CR && data.byteAt(i + 1) == LF
                    && data.byteAt(i + 2) == CR && data.byteAt(i + 3) == LF) {
                return i;
            }
        }
        return -1;
    }

    private static RequestHeader parseHeader(String text) {
        String[] lines = text.split("\r?\n");

        // request line: first three whitespace-separated tokens
        String[] info = {"", "", ""};
        int lineIndex = 0;
        while (lineIndex < lines.length && lines[lineIndex].isBlank()) lineIndex++;
        if (lineIndex < lines.length) {
            String[] tokens = lines[lineIndex].strip().split("\\s+");
            for (int i = 0; i < info.length && i < tokens.length; i++) {
                info[i] = tokens[i];
            }
            lineIndex++;
        }

        Map<String, String> fields = new LinkedHashMap<>();
        for (; lineIndex < lines.length; lineIndex++) {
            String line = lines[lineIndex];
            if (line.isBlank()) continue;
            int colon = line.indexOf(':');
            if (colon <= 0) continue;
            String key = line.substring(0, colon).strip();
            String value = line.substring(colon + 1).strip();
            if (!key.isEmpty()) fields.put(key, value);
        }
        return new RequestHeader(info[0], info[1], info[2], fields);
    }
}
