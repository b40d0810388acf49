package org.tramway.http.endpoint.dto;

public record HealthResponse(String status, String env) {
}
