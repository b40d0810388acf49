package org.tramway.http.routing;

import org.tramway.exception.RouteConflictException;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One level of the per-method segment trie. Children are keyed by literal text; a node has
 * at most one parameter child and at most one wildcard route, so two patterns that differ
 * only in parameter names land on the same node and conflict.
 */
final class RouteNode {

    private final Map<String, RouteNode> literalChildren = new HashMap<>();
    private RouteNode paramChild;
    private RouteDefinition wildcardRoute;
    private RouteDefinition route;

    void insert(PathPattern pattern, RouteDefinition definition, boolean caseSensitive) {
        RouteNode node = this;
        for (Segment segment : pattern.getSegments()) {
            switch (segment.type()) {
                case LITERAL -> node = node.literalChildren.computeIfAbsent(key(segment.value(), caseSensitive), k -> new RouteNode());
                case PARAM -> {
                    if (node.paramChild == null) {
                        node.paramChild = new RouteNode();
                    }
                    node = node.paramChild;
                }
                case WILDCARD -> {
                    if (node.wildcardRoute != null) {
                        throw conflict(definition, node.wildcardRoute);
                    }
                    node.wildcardRoute = definition;
                    return;
                }
            }
        }
        if (node.route != null) {
            throw conflict(definition, node.route);
        }
        node.route = definition;
    }

    /**
     * Depth-first lookup: literal child, then parameter child, then wildcard. A wildcard needs
     * at least one segment besides a trailing slash. Values of the parameters on the
     * successful path are appended to {@code captured}.
     */
    RouteDefinition find(List<String> segments, int index, List<String> captured, boolean caseSensitive) {
        if (index == segments.size()) {
            return route;
        }
        String segment = segments.get(index);

        RouteNode literal = literalChildren.get(key(segment, caseSensitive));
        if (literal != null) {
            RouteDefinition found = literal.find(segments, index + 1, captured, caseSensitive);
            if (found != null) {
                return found;
            }
        }

        if (paramChild != null && !segment.isEmpty()) {
            captured.add(segment);
            RouteDefinition found = paramChild.find(segments, index + 1, captured, caseSensitive);
            if (found != null) {
                return found;
            }
            captured.remove(captured.size() - 1);
        }

        boolean onlyTrailingSlashLeft = index == segments.size() - 1 && segment.isEmpty();
        if (wildcardRoute != null && !onlyTrailingSlashLeft) {
            captured.add(String.join("/", segments.subList(index, segments.size())));
            return wildcardRoute;
        }
        return null;
    }

    private static String key(String literal, boolean caseSensitive) {
        return caseSensitive ? literal : literal.toLowerCase(Locale.ROOT);
    }

    private static RouteConflictException conflict(RouteDefinition added, RouteDefinition existing) {
        return new RouteConflictException("Route " + added.method() + " " + added.pattern()
                + " conflicts with already registered " + existing.method() + " " + existing.pattern());
    }

}
