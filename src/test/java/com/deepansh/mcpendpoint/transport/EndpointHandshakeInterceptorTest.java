package com.deepansh.mcpendpoint.transport;

import com.deepansh.mcpendpoint.auth.TokenResolver;
import com.deepansh.mcpendpoint.exception.TokenResolutionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EndpointHandshakeInterceptorTest {

    @Mock TokenResolver tokenResolver;
    @Mock WebSocketHandler handler;

    @Test
    void validTokenAndServerId_populateSessionAttributes() {
        when(tokenResolver.resolveAgentId("abc")).thenReturn("agent");
        EndpointHandshakeInterceptor interceptor = new EndpointHandshakeInterceptor(tokenResolver, true);
        MockHttpServletResponse servletResponse = new MockHttpServletResponse();
        Map<String, Object> attributes = new HashMap<>();

        boolean accepted = interceptor.beforeHandshake(
                request("/mcp_endpoint/mcp/", "token=abc&server_id=calc%20v2"),
                new ServletServerHttpResponse(servletResponse), handler, attributes);

        assertThat(accepted).isTrue();
        assertThat(attributes)
                .containsEntry(EndpointHandshakeInterceptor.ATTR_AGENT_ID, "agent")
                .containsEntry(EndpointHandshakeInterceptor.ATTR_SERVER_ID, "calc v2");
    }

    @Test
    void invalidToken_isRefusedWith401() {
        when(tokenResolver.resolveAgentId(any())).thenThrow(new TokenResolutionException("bad token"));
        EndpointHandshakeInterceptor interceptor = new EndpointHandshakeInterceptor(tokenResolver, false);
        MockHttpServletResponse servletResponse = new MockHttpServletResponse();

        boolean accepted = interceptor.beforeHandshake(
                request("/mcp_endpoint/call/", "token=nope"),
                new ServletServerHttpResponse(servletResponse), handler, new HashMap<>());

        assertThat(accepted).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(401);
    }

    @Test
    void providerWithoutServerId_isRefusedWith400() {
        when(tokenResolver.resolveAgentId("abc")).thenReturn("agent");
        EndpointHandshakeInterceptor interceptor = new EndpointHandshakeInterceptor(tokenResolver, true);
        MockHttpServletResponse servletResponse = new MockHttpServletResponse();

        boolean accepted = interceptor.beforeHandshake(
                request("/mcp_endpoint/mcp/", "token=abc"),
                new ServletServerHttpResponse(servletResponse), handler, new HashMap<>());

        assertThat(accepted).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(400);
    }

    @Test
    void clientEndpoint_doesNotNeedServerId() {
        when(tokenResolver.resolveAgentId("abc")).thenReturn("agent");
        EndpointHandshakeInterceptor interceptor = new EndpointHandshakeInterceptor(tokenResolver, false);
        Map<String, Object> attributes = new HashMap<>();

        boolean accepted = interceptor.beforeHandshake(
                request("/mcp_endpoint/call/", "token=abc"),
                new ServletServerHttpResponse(new MockHttpServletResponse()), handler, attributes);

        assertThat(accepted).isTrue();
        assertThat(attributes).doesNotContainKey(EndpointHandshakeInterceptor.ATTR_SERVER_ID);
    }

    private static ServletServerHttpRequest request(String path, String query) {
        MockHttpServletRequest servletRequest = new MockHttpServletRequest("GET", path);
        servletRequest.setQueryString(query);
        return new ServletServerHttpRequest(servletRequest);
    }
}
