package org.tramway.server.dto;

import lombok.Builder;
import lombok.Data;
import org.tramway.configuration.ConfigurationManager;

@Data
@Builder
public class ServerProperties {

    private String host;
    private int port;
    private int bossThreads;
    private int workerThreads;
    private int handlerThreads;
    private int maxContentLength;

    public static ServerProperties initialize(ConfigurationManager config) {
        return ServerProperties.builder()
                .host(config.getProperty("server.host", "0.0.0.0"))
                .port(config.getIntProperty("server.port", 3000))
                .bossThreads(config.getIntProperty("server.boss.threads", 1))
                .workerThreads(config.getIntProperty("server.worker.threads", 0))
                .handlerThreads(config.getIntProperty("server.handler.threads", 16))
                .maxContentLength(config.getIntProperty("server.max.content.length", 1024 * 1024))
                .build();
    }

}
