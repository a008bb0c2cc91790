package api.impl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A path pattern such as {@code /schools/:id/classes}. A segment starting with
 * ':' matches any single requested segment and binds it under the name that
 * follows the colon; every other segment must match literally.
 */
public final class RoutePattern {
    private final String pattern;
    private final List<String> segments;

    public RoutePattern(String pattern) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.segments = splitPath(pattern);
    }

    /** Non-empty '/'-separated segments of {@code path}. */
    public static List<String> splitPath(String path) {
        List<String> out = new ArrayList<>();
        StringBuilder temp = new StringBuilder();
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '/') {
                if (temp.length() > 0) {
                    out.add(temp.toString());
                    temp.setLength(0);
                }
            } else {
                temp.append(c);
            }
        }
        if (temp.length() > 0) out.add(temp.toString());
        return Collections.unmodifiableList(out);
    }

    public Optional<Map<String, String>> match(String path) {
        return match(splitPath(path));
    }

    /** Bound parameters if {@code requested} fits this pattern, else empty. */
    public Optional<Map<String, String>> match(List<String> requested) {
        if (requested.size() != segments.size()) return Optional.empty();

        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i < segments.size(); i++) {
            String piece = segments.get(i);
            if (piece.startsWith(":")) {
                params.put(piece.substring(1), requested.get(i));
            } else if (!piece.equals(requested.get(i))) {
                return Optional.empty();
            }
        }
        return Optional.of(Collections.unmodifiableMap(params));
    }

    @Override
    public String toString() { return pattern; }
}
