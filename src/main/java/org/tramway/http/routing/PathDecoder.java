package org.tramway.http.routing;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

final class PathDecoder {

    private PathDecoder() {
    }

    /**
     * Splits a raw path on {@code /} without decoding. The leading slash is dropped, so
     * {@code "/"} yields no segments and {@code "/users/"} yields {@code ["users", ""]}.
     */
    static List<String> split(String path) {
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        if (trimmed.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(List.of(trimmed.split("/", -1)));
    }

    /**
     * Percent-decodes one path segment. {@code +} is not a space in a path.
     */
    static String decodeSegment(String segment) {
        if (segment.indexOf('%') < 0) {
            return segment;
        }
        try {
            return URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new MalformedPathException("Malformed percent-encoding in path segment '" + segment + "'", e);
        }
    }

}
