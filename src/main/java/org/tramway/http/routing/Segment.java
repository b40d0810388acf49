package org.tramway.http.routing;

public record Segment(Type type, String value) {

    public enum Type {
        LITERAL, PARAM, WILDCARD
    }

    public static Segment literal(String value) {
        return new Segment(Type.LITERAL, value);
    }

    public static Segment param(String name) {
        return new Segment(Type.PARAM, name);
    }

    public static Segment wildcard(String name) {
        return new Segment(Type.WILDCARD, name);
    }

    public boolean isLiteral() {
        return type == Type.LITERAL;
    }

    public boolean isParam() {
        return type == Type.PARAM;
    }

    public boolean isWildcard() {
        return type == Type.WILDCARD;
    }

    @Override
    public String toString() {
        return switch (type) {
            case LITERAL -> value;
            case PARAM -> ":" + value;
            case WILDCARD -> "*".equals(value) ? "*" : "*" + value;
        };
    }

}
