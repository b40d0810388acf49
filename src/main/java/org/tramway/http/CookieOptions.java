package org.tramway.http;

import io.netty.handler.codec.http.cookie.CookieHeaderNames;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class CookieOptions {

    @Builder.Default
    private final long maxAge = Long.MIN_VALUE;

    @Builder.Default
    private final String path = "/";

    private final String domain;
    private final boolean secure;

    @Builder.Default
    private final boolean httpOnly = true;

    @Builder.Default
    private final CookieHeaderNames.SameSite sameSite = CookieHeaderNames.SameSite.Lax;

    public static CookieOptions defaults() {
        return CookieOptions.builder().build();
    }

}
