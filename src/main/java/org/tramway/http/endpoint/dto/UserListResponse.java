package org.tramway.http.endpoint.dto;

import java.util.List;

public record UserListResponse(List<UserResponse> data, int total) {
}
