package api.impl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Request line and header fields of one request. Later duplicate field names
 * overwrite earlier ones; the blank terminator line is never stored.
 */
public final class RequestHeader {
    private final String method;
    private final String path;
    private final String version;
    private final Map<String, String> fields;

    public RequestHeader(String method, String path, String version, Map<String, String> fields) {
        this.method = Objects.requireNonNull(method, "method");
        this.path = Objects.requireNonNull(path, "path");
        this.version = Objects.requireNonNull(version, "version");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String method() { return method; }
    public String path() { return path; }
    public String version() { return version; }

    /** Fields exactly as received, in arrival order. */
    public Map<String, String> fields() { return fields; }

    /** Exact-name match first, then case-insensitive. */
    public String field(String name) {
        if (name == null) return null;
        String exact = fields.get(name);
        if (exact != null) return exact;
        for (Map.Entry<String, String> e : fields.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RequestHeader)) return false;
        RequestHeader that = (RequestHeader) o;
        return method.equals(that.method) && path.equals(that.path)
                && version.equals(that.version) && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, path, version, fields);
    }

    @Override
    public String toString() {
        return version + " [" + method + "]: " + path + " " + fields;
    }
}
