package org.tramway.http.endpoint.controller;

import lombok.RequiredArgsConstructor;
import org.tramway.app.AppSettings;
import org.tramway.http.annotation.HttpRoute;
import org.tramway.http.common.HttpMethod;
import org.tramway.http.endpoint.dto.HealthResponse;

@RequiredArgsConstructor
public class HealthController {

    private final AppSettings settings;

    @HttpRoute(path = "/health", method = HttpMethod.GET)
    public HealthResponse health() {
        return new HealthResponse("ok", settings.getEnv());
    }

}
