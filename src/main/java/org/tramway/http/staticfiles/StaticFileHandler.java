package org.tramway.http.staticfiles;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.extern.slf4j.Slf4j;
import org.tramway.http.Handler;
import org.tramway.http.Request;
import org.tramway.http.Response;
import org.tramway.http.dto.ErrorResponse;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Serves files from a root directory. Mount it on a wildcard route; the wildcard value is
 * the file path relative to the root.
 */
@Slf4j
public class StaticFileHandler implements Handler {

    private static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    private static final Map<String, String> MIME_TYPES = Map.ofEntries(
            Map.entry("html", "text/html; charset=utf-8"),
            Map.entry("htm", "text/html; charset=utf-8"),
            Map.entry("css", "text/css; charset=utf-8"),
            Map.entry("js", "application/javascript; charset=utf-8"),
            Map.entry("mjs", "application/javascript; charset=utf-8"),
            Map.entry("json", "application/json; charset=utf-8"),
            Map.entry("xml", "application/xml; charset=utf-8"),
            Map.entry("txt", "text/plain; charset=utf-8"),
            Map.entry("md", "text/markdown; charset=utf-8"),
            Map.entry("csv", "text/csv; charset=utf-8"),
            Map.entry("png", "image/png"),
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("gif", "image/gif"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("ico", "image/x-icon"),
            Map.entry("webp", "image/webp"),
            Map.entry("avif", "image/avif"),
            Map.entry("woff", "font/woff"),
            Map.entry("woff2", "font/woff2"),
            Map.entry("ttf", "font/ttf"),
            Map.entry("otf", "font/otf"),
            Map.entry("pdf", "application/pdf"),
            Map.entry("zip", "application/zip"),
            Map.entry("gz", "application/gzip"),
            Map.entry("mp3", "audio/mpeg"),
            Map.entry("wav", "audio/wav"),
            Map.entry("mp4", "video/mp4"),
            Map.entry("webm", "video/webm"),
            Map.entry("wasm", "application/wasm")
    );

    private final StaticConfig config;
    private final Path root;
    private final String paramName;

    public StaticFileHandler(StaticConfig config, String paramName) {
        this.config = config;
        this.root = config.getRoot().toAbsolutePath().normalize();
        this.paramName = paramName;
    }

    @Override
    public Response handle(Request request, Response response) throws IOException {
        String relative = request.param(paramName);
        if (relative == null) {
            relative = "";
        }

        Path target;
        try {
            target = root.resolve(relative).normalize();
        } catch (InvalidPathException e) {
            return response.status(HttpResponseStatus.BAD_REQUEST).json(ErrorResponse.of("Bad Request"));
        }
        if (!target.startsWith(root)) {
            log.warn("Blocked static file request outside of {}: {}", root, relative);
            return response.status(HttpResponseStatus.FORBIDDEN)
                    .json(ErrorResponse.builder().error("Forbidden").message("Access denied").build());
        }

        if (Files.isDirectory(target)) {
            target = target.resolve(config.getIndex());
        }
        if (!Files.isRegularFile(target)) {
            return response.status(HttpResponseStatus.NOT_FOUND)
                    .json(ErrorResponse.builder().error("Not Found").message("File not found").build());
        }

        response.status(HttpResponseStatus.OK)
                .contentType(mimeType(target))
                .sendBytes(Files.readAllBytes(target));
        if (config.getMaxAge() > 0) {
            response.header(HttpHeaderNames.CACHE_CONTROL, "max-age=" + config.getMaxAge());
        }
        return response;
    }

    static String mimeType(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return DEFAULT_MIME_TYPE;
        }
        return MIME_TYPES.getOrDefault(name.substring(dot + 1).toLowerCase(Locale.ROOT), DEFAULT_MIME_TYPE);
    }

}
