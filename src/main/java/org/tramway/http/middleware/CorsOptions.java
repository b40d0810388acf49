package org.tramway.http.middleware;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class CorsOptions {

    @Builder.Default
    private final String origin = "*";

    @Builder.Default
    private final List<String> methods = List.of("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS");

    @Builder.Default
    private final List<String> allowedHeaders = List.of("Content-Type", "Authorization");

    @Builder.Default
    private final List<String> exposedHeaders = List.of();

    private final boolean credentials;

    @Builder.Default
    private final int maxAge = 86400;

    public static CorsOptions defaults() {
        return CorsOptions.builder().build();
    }

}
