package org.tramway.http.staticfiles;

import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;

@Getter
@Builder
public class StaticConfig {

    @Builder.Default
    private final Path root = Path.of("public");

    @Builder.Default
    private final String index = "index.html";

    /**
     * {@code Cache-Control} max-age in seconds; zero disables the header.
     */
    @Builder.Default
    private final int maxAge = 3600;

    public static StaticConfig of(Path root) {
        return StaticConfig.builder().root(root).build();
    }

}
