package org.tramway;

import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.tramway.app.AppSettings;
import org.tramway.app.Application;
import org.tramway.configuration.ConfigurationManager;
import org.tramway.http.endpoint.controller.HealthController;
import org.tramway.http.endpoint.controller.UserController;
import org.tramway.http.middleware.CorsMiddleware;
import org.tramway.http.middleware.HelmetMiddleware;
import org.tramway.http.middleware.LoggerMiddleware;
import org.tramway.http.middleware.RateLimitMiddleware;
import org.tramway.http.middleware.RateLimiterConfig;
import org.tramway.http.middleware.RequestIdMiddleware;
import org.tramway.http.middleware.ResponseTimeMiddleware;
import org.tramway.http.middleware.TimeoutMiddleware;
import org.tramway.http.routing.Router;
import org.tramway.http.staticfiles.StaticConfig;
import org.tramway.server.dto.ServerProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;

@Slf4j
public class ServerRunner {

    @SneakyThrows
    public static void main(String[] args) {
        if (args.length > 1) {
            System.err.println("Usage: java -jar tramway.jar [path-to-properties]");
            System.exit(1);
        }

        ConfigurationManager config = ConfigurationManager.load(args.length == 1 ? args[0] : null);
        AppSettings settings = AppSettings.initialize(config);
        ServerProperties serverProperties = ServerProperties.initialize(config);

        TimeoutMiddleware timeout = new TimeoutMiddleware(
                Duration.ofMillis(config.getIntProperty("app.request.timeout.ms", 30_000)));

        Application app = new Application(settings)
                .use(new RequestIdMiddleware())
                .use(new LoggerMiddleware())
                .use(new ResponseTimeMiddleware())
                .use(new HelmetMiddleware())
                .use(new CorsMiddleware())
                .use(new RateLimitMiddleware(RateLimiterConfig.builder()
                        .maxRequests(config.getIntProperty("app.ratelimit.max.requests", 100))
                        .window(Duration.ofSeconds(config.getIntProperty("app.ratelimit.window.seconds", 60)))
                        .skipPaths(Set.of("/health"))
                        .build()))
                .use(timeout)
                .registerController(new HealthController(settings));

        Router api = new Router();
        api.registerController(new UserController());
        app.use("/api", api);

        String staticRoot = config.getProperty("app.static.root", "");
        if (!staticRoot.isEmpty()) {
            app.serveStatic("/static", StaticConfig.of(Path.of(staticRoot)));
        }

        Runtime.getRuntime().addShutdownHook(new Thread(timeout::close));
        log.info("Starting tramway in {} mode", settings.getEnv());
        app.listen(serverProperties);
    }

}
