package com.deepansh.mcpendpoint.routing;

import com.deepansh.mcpendpoint.registry.ClientConnection;
import com.deepansh.mcpendpoint.registry.ProviderConnection;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * A client request forwarded to exactly one provider, awaiting its reply or the deadline.
 */
@Getter
@Builder
public class PendingCall {

    private final String forwardedId;
    private final JsonNode originalId;
    private final ClientConnection client;
    private final ProviderConnection provider;
    private final String method;
    private final Instant createdAt;
    private final Instant deadline;

    @Setter
    private volatile ScheduledFuture<?> timeout;

    public String getServerId() {
        return provider.getServerId();
    }

    void cancelTimeout() {
        ScheduledFuture<?> handle = timeout;
        if (handle != null) {
            handle.cancel(false);
        }
    }
}
