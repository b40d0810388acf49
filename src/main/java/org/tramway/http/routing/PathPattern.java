package org.tramway.http.routing;

import org.tramway.exception.RouteConflictException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A route template split into segments.
 * <p>
 * Supported segment forms: literal text, {@code :name} or {@code {name}} for a named
 * parameter, and {@code *name} (or a bare {@code *}) for a wildcard that swallows the
 * rest of the path. Parameters always span a whole segment.
 */
public final class PathPattern {

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_]+");

    private final List<Segment> segments;
    private final List<String> paramNames;

    private PathPattern(List<Segment> segments) {
        this.segments = List.copyOf(segments);
        this.paramNames = segments.stream()
                .filter(segment -> !segment.isLiteral())
                .map(Segment::value)
                .toList();
    }

    public static PathPattern parse(String template) {
        Objects.requireNonNull(template, "template");
        List<String> parts = PathDecoder.split(template);
        List<Segment> segments = new ArrayList<>(parts.size());
        for (int i = 0; i < parts.size(); i++) {
            Segment segment = parseSegment(parts.get(i), template);
            if (segment.isWildcard() && i != parts.size() - 1) {
                throw new IllegalArgumentException("Wildcard must be the last segment in '" + template + "'");
            }
            segments.add(segment);
        }
        requireUniqueNames(segments, template);
        return new PathPattern(segments);
    }

    private static Segment parseSegment(String part, String template) {
        if (part.startsWith(":")) {
            return Segment.param(requireName(part.substring(1), template));
        }
        if (part.startsWith("{") && part.endsWith("}") && part.length() > 2) {
            return Segment.param(requireName(part.substring(1, part.length() - 1), template));
        }
        if (part.equals("*")) {
            return Segment.wildcard("*");
        }
        if (part.startsWith("*")) {
            return Segment.wildcard(requireName(part.substring(1), template));
        }
        return Segment.literal(part);
    }

    private static String requireName(String name, String template) {
        if (!NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid parameter name '" + name + "' in '" + template + "'");
        }
        return name;
    }

    private static void requireUniqueNames(List<Segment> segments, String template) {
        Set<String> seen = new HashSet<>();
        for (Segment segment : segments) {
            if (!segment.isLiteral() && !seen.add(segment.value())) {
                throw new RouteConflictException("Duplicate parameter name '" + segment.value() + "' in '" + template + "'");
            }
        }
    }

    /**
     * Returns {@code prefix} followed by this pattern. A trailing slash on the prefix is
     * dropped; a prefix that ends in a wildcard cannot be extended.
     */
    public PathPattern prefixedWith(PathPattern prefix) {
        List<Segment> combined = new ArrayList<>(prefix.withoutTrailingSlash().segments);
        if (!combined.isEmpty() && combined.get(combined.size() - 1).isWildcard()) {
            throw new IllegalArgumentException("Cannot mount under wildcard prefix '" + prefix + "'");
        }
        combined.addAll(segments);
        String template = toString(combined);
        requireUniqueNames(combined, template);
        return new PathPattern(combined);
    }

    PathPattern withoutTrailingSlash() {
        if (hasTrailingSlash()) {
            return new PathPattern(segments.subList(0, segments.size() - 1));
        }
        return this;
    }

    public boolean hasTrailingSlash() {
        if (segments.isEmpty()) {
            return false;
        }
        Segment last = segments.get(segments.size() - 1);
        return last.isLiteral() && last.value().isEmpty();
    }

    public boolean hasWildcard() {
        return !segments.isEmpty() && segments.get(segments.size() - 1).isWildcard();
    }

    public List<Segment> getSegments() {
        return segments;
    }

    public List<String> getParamNames() {
        return paramNames;
    }

    private static String toString(List<Segment> segments) {
        return "/" + segments.stream().map(Segment::toString).collect(Collectors.joining("/"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof PathPattern other && segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return toString(segments);
    }

}
