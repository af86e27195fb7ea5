package com.deepansh.mcpendpoint.config;

import com.deepansh.mcpendpoint.auth.TokenResolver;
import com.deepansh.mcpendpoint.transport.ClientWebSocketHandler;
import com.deepansh.mcpendpoint.transport.EndpointHandshakeInterceptor;
import com.deepansh.mcpendpoint.transport.ProviderWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * WebSocket endpoints:
 *
 * /mcp_endpoint/mcp/?token=...&server_id=...   MCP servers (providers)
 * /mcp_endpoint/call/?token=...                tool callers (clients)
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String PROVIDER_PATH = "/mcp_endpoint/mcp";
    public static final String CLIENT_PATH = "/mcp_endpoint/call";

    private final ProviderWebSocketHandler providerHandler;
    private final ClientWebSocketHandler clientHandler;
    private final TokenResolver tokenResolver;
    private final EndpointProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        String[] origins = properties.getSecurity().getAllowedOriginList().toArray(String[]::new);

        registry.addHandler(providerHandler, PROVIDER_PATH, PROVIDER_PATH + "/")
                .addInterceptors(new EndpointHandshakeInterceptor(tokenResolver, true))
                .setAllowedOriginPatterns(origins);

        registry.addHandler(clientHandler, CLIENT_PATH, CLIENT_PATH + "/")
                .addInterceptors(new EndpointHandshakeInterceptor(tokenResolver, false))
                .setAllowedOriginPatterns(origins);
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(properties.getWebsocket().getMaxTextMessageSize());
        return container;
    }
}
