package org.tramway.app;

import lombok.Builder;
import lombok.Getter;
import org.tramway.configuration.ConfigurationManager;

@Getter
@Builder
public class AppSettings {

    @Builder.Default
    private final String env = "development";

    private final boolean caseSensitiveRouting;
    private final boolean strictRouting;

    public static AppSettings defaults() {
        return AppSettings.builder().build();
    }

    public static AppSettings initialize(ConfigurationManager config) {
        return AppSettings.builder()
                .env(config.getProperty("app.env", "development"))
                .caseSensitiveRouting(config.getBooleanProperty("app.routing.case.sensitive", false))
                .strictRouting(config.getBooleanProperty("app.routing.strict", false))
                .build();
    }

    public boolean isDevelopment() {
        return "development".equalsIgnoreCase(env);
    }

}
