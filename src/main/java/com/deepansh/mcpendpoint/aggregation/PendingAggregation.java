package com.deepansh.mcpendpoint.aggregation;

import com.deepansh.mcpendpoint.registry.ClientConnection;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

/**
 * A client request fanned out to every live provider of an agent.
 *
 * {@code expected} is fixed at fan-out time and can only shrink, when a provider that
 * has not replied yet goes away. {@code received} keeps arrival order and only ever holds
 * expected server ids; the first reply per server wins.
 *
 * Guarded by the agent's lock.
 */
@Getter
public class PendingAggregation {

    private final String forwardedId;
    private final JsonNode originalId;
    private final ClientConnection client;
    private final String method;
    private final Instant createdAt;
    private final Instant deadline;

    private final Set<String> expected;
    private final Map<String, ObjectNode> received = new LinkedHashMap<>();
    private int forwardFailures;

    @Setter
    private volatile ScheduledFuture<?> timeout;

    public PendingAggregation(String forwardedId,
                              JsonNode originalId,
                              ClientConnection client,
                              String method,
                              Collection<String> expected,
                              Instant createdAt,
                              Instant deadline) {
        this.forwardedId = forwardedId;
        this.originalId = originalId;
        this.client = client;
        this.method = method;
        this.expected = new LinkedHashSet<>(expected);
        this.createdAt = createdAt;
        this.deadline = deadline;
    }

    public String getAgentId() {
        return client.getAgentId();
    }

    public boolean isExpected(String serverId) {
        return expected.contains(serverId);
    }

    /**
     * @return false if the server is not expected or already answered
     */
    public boolean record(String serverId, ObjectNode payload) {
        if (!expected.contains(serverId) || received.containsKey(serverId)) {
            return false;
        }
        received.put(serverId, payload);
        return true;
    }

    public boolean recordForwardFailure(String serverId, ObjectNode payload) {
        if (record(serverId, payload)) {
            forwardFailures++;
            return true;
        }
        return false;
    }

    /**
     * Stops waiting for a provider that has not replied.
     *
     * @return true if the server was outstanding and has been dropped
     */
    public boolean dropExpected(String serverId) {
        if (received.containsKey(serverId)) {
            return false;
        }
        return expected.remove(serverId);
    }

    public boolean isComplete() {
        return received.keySet().containsAll(expected);
    }

    /** Every slot was resolved by a failed write; nothing reached a provider. */
    public boolean allForwardsFailed() {
        return forwardFailures > 0 && forwardFailures == received.size() && received.size() == expected.size();
    }

    public List<ObjectNode> responsesInArrivalOrder() {
        return new ArrayList<>(received.values());
    }

    public int totalServers() {
        return expected.size();
    }

    public int respondedServers() {
        return received.size();
    }

    void cancelTimeout() {
        ScheduledFuture<?> handle = timeout;
        if (handle != null) {
            handle.cancel(false);
        }
    }
}
