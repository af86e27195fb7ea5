package com.deepansh.mcpendpoint.config;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Strongly-typed configuration for the relay.
 * Bound from application.yml (and the optional data/.mcp-endpoint-server.yml) under the "endpoint" prefix.
 */
@ConfigurationProperties(prefix = "endpoint")
@Validated
@Data
public class EndpointProperties {

    /** Key required by the health endpoint. Empty means every request gets key_error. */
    private String key = "";

    private String version = "1.0.0";

    private Routing routing = new Routing();
    private Registry registry = new Registry();
    private Bootstrap bootstrap = new Bootstrap();
    private WebSocket websocket = new WebSocket();
    private Security security = new Security();
    private Auth auth = new Auth();

    @Data
    public static class Routing {
        @NotNull
        private Duration callTimeout = Duration.ofSeconds(30);
        @NotNull
        private Duration aggregationTimeout = Duration.ofSeconds(10);
        /** Client methods fanned out to every provider of the agent, besides "broadcast" itself */
        private List<String> fanOutMethods = new ArrayList<>(List.of("resources/list", "prompts/list"));
    }

    @Data
    public static class Registry {
        @NotNull
        private DuplicatePolicy duplicatePolicy = DuplicatePolicy.SUPERSEDE;
        /** Connections silent for longer than this are closed. Zero disables the sweep. */
        @NotNull
        private Duration idleTimeout = Duration.ZERO;
        @NotNull
        private Duration idleSweepInterval = Duration.ofSeconds(60);
    }

    public enum DuplicatePolicy {
        SUPERSEDE, REJECT
    }

    @Data
    public static class Bootstrap {
        private boolean enabled = true;
        private String protocolVersion = "2024-11-05";
        private String clientName = "mcp-endpoint-server";
    }

    @Data
    public static class WebSocket {
        private int maxTextMessageSize = 1024 * 1024;
        private int sendTimeLimitMs = 10_000;
        private int sendBufferSizeLimit = 4 * 1024 * 1024;
    }

    @Data
    public static class Security {
        private boolean enableCors = true;
        private String allowedOrigins = "*";

        public List<String> getAllowedOriginList() {
            if (allowedOrigins == null || allowedOrigins.isBlank()) return List.of("*");
            return Arrays.stream(allowedOrigins.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isBlank())
                    .toList();
        }
    }

    @Data
    public static class Auth {
        /** Accept a token that is not JSON as the agent id itself */
        private boolean plainTokenAsAgentId = false;
    }
}
