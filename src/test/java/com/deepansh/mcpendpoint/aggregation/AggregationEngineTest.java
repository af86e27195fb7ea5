package com.deepansh.mcpendpoint.aggregation;

import com.deepansh.mcpendpoint.registry.ClientConnection;
import com.deepansh.mcpendpoint.registry.ProviderConnection;
import com.deepansh.mcpendpoint.routing.MessageRouter;
import com.deepansh.mcpendpoint.support.BrokerFixture;
import com.deepansh.mcpendpoint.support.FakeChannel;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AggregationEngineTest {

    private static final String BROADCAST =
            "{\"jsonrpc\":\"2.0\",\"id\":42,\"method\":\"broadcast\",\"params\":{\"method\":\"resources/list\",\"params\":{\"scope\":\"all\"}}}";

    private BrokerFixture fx;
    private MessageRouter router;
    private AggregationEngine engine;
    private FakeChannel clientChannel;
    private ClientConnection client;

    @BeforeEach
    void setUp() {
        fx = new BrokerFixture();
        router = fx.router;
        engine = fx.aggregation;
        clientChannel = new FakeChannel();
        client = fx.client("agent", clientChannel);
    }

    @Test
    void allServersReply_resultListsThemInArrivalOrder() {
        List<Provider> providers = providers("a", "b", "c");
        router.onClientMessage(client, BROADCAST);

        reply(providers.get(1), "{\"resources\":[\"b1\"]}");
        reply(providers.get(0), "{\"resources\":[\"a1\"]}");
        assertThat(clientChannel.getSent()).isEmpty();
        reply(providers.get(2), "{\"resources\":[]}");

        JsonNode reply = clientChannel.last();
        assertThat(reply.get("id").asInt()).isEqualTo(42);
        JsonNode result = reply.get("result");
        assertThat(result.get("total_servers").asInt()).isEqualTo(3);
        assertThat(result.get("responded_servers").asInt()).isEqualTo(3);
        assertThat(serverIds(result)).containsExactly("b", "a", "c");
        assertThat(result.get("responses").get(0).get("result").get("resources").get(0).asText()).isEqualTo("b1");
        assertThat(engine.pendingCount()).isZero();
    }

    @Test
    void fanOut_unwrapsInnerMethodAndParams() {
        List<Provider> providers = providers("a");
        router.onClientMessage(client, BROADCAST);

        JsonNode forwarded = providers.get(0).channel.last();
        assertThat(forwarded.get("method").asText()).isEqualTo("resources/list");
        assertThat(forwarded.get("params").get("scope").asText()).isEqualTo("all");
        assertThat(forwarded.get("id").asText()).startsWith("mcpe-");
    }

    @Test
    void deadlineWithPartialReplies_reportsRespondedSubset() {
        List<Provider> providers = providers("a", "b", "c");
        router.onClientMessage(client, BROADCAST);

        reply(providers.get(2), "{}");
        reply(providers.get(0), "{}");
        fx.runScheduledTasks();

        JsonNode result = clientChannel.last().get("result");
        assertThat(result.get("total_servers").asInt()).isEqualTo(3);
        assertThat(result.get("responded_servers").asInt()).isEqualTo(2);
        assertThat(serverIds(result)).containsExactly("c", "a");
    }

    @Test
    void duplicateReply_isIgnored() {
        List<Provider> providers = providers("a", "b");
        router.onClientMessage(client, BROADCAST);

        reply(providers.get(0), "{\"n\":1}");
        reply(providers.get(0), "{\"n\":2}");
        assertThat(clientChannel.getSent()).isEmpty();
        reply(providers.get(1), "{\"n\":3}");

        JsonNode result = clientChannel.last().get("result");
        assertThat(result.get("responded_servers").asInt()).isEqualTo(2);
        assertThat(result.get("responses").get(0).get("result").get("n").asInt()).isEqualTo(1);
    }

    @Test
    void providerErrorReply_isReportedPerServer() {
        List<Provider> providers = providers("a");
        router.onClientMessage(client, BROADCAST);

        router.onProviderMessage(providers.get(0).connection, "{\"jsonrpc\":\"2.0\",\"id\":\""
                + providers.get(0).forwardedId() + "\",\"error\":{\"code\":-32601,\"message\":\"nope\"}}");

        JsonNode entry = clientChannel.last().get("result").get("responses").get(0);
        assertThat(entry.get("server_id").asText()).isEqualTo("a");
        assertThat(entry.get("error").get("code").asInt()).isEqualTo(-32601);
        assertThat(entry.has("result")).isFalse();
    }

    @Test
    void serverLeavesMidAggregation_totalShrinks() {
        List<Provider> providers = providers("a", "b");
        router.onClientMessage(client, BROADCAST);

        reply(providers.get(0), "{}");
        fx.registry.unregisterProvider("agent", "b", providers.get(1).channel);

        JsonNode result = clientChannel.last().get("result");
        assertThat(result.get("total_servers").asInt()).isEqualTo(1);
        assertThat(result.get("responded_servers").asInt()).isEqualTo(1);
        assertThat(serverIds(result)).containsExactly("a");
    }

    @Test
    void noServers_repliesImmediatelyWithEmptyResult() {
        router.onClientMessage(client, BROADCAST);

        JsonNode result = clientChannel.last().get("result");
        assertThat(result.get("total_servers").asInt()).isZero();
        assertThat(result.get("responded_servers").asInt()).isZero();
        assertThat(result.get("responses")).isEmpty();
        assertThat(engine.pendingCount()).isZero();
        assertThat(fx.scheduledTasks).isEmpty();
    }

    @Test
    void afterFinalization_lateRepliesAndDeadlineChangeNothing() {
        List<Provider> providers = providers("a", "b");
        router.onClientMessage(client, BROADCAST);
        reply(providers.get(0), "{}");
        fx.runScheduledTasks();
        assertThat(clientChannel.getSent()).hasSize(1);

        reply(providers.get(1), "{}");
        fx.runScheduledTasks();
        fx.registry.unregisterProvider("agent", "a", providers.get(0).channel);

        assertThat(clientChannel.getSent()).hasSize(1);
        assertThat(clientChannel.last().get("result").get("responded_servers").asInt()).isEqualTo(1);
    }

    @Test
    void everyForwardFails_returnsForwardFailed() {
        List<Provider> providers = providers("a", "b");
        providers.forEach(p -> p.channel.setFailSends(true));

        router.onClientMessage(client, BROADCAST);

        JsonNode reply = clientChannel.last();
        assertThat(reply.get("id").asInt()).isEqualTo(42);
        assertThat(reply.get("error").get("code").asInt()).isEqualTo(-32002);
        assertThat(engine.pendingCount()).isZero();
    }

    @Test
    void someForwardsFail_failuresAreListedAsErrors() {
        List<Provider> providers = providers("a", "b");
        providers.get(1).channel.setFailSends(true);

        router.onClientMessage(client, BROADCAST);
        reply(providers.get(0), "{}");

        JsonNode result = clientChannel.last().get("result");
        assertThat(result.get("total_servers").asInt()).isEqualTo(2);
        assertThat(result.get("responded_servers").asInt()).isEqualTo(2);
        assertThat(result.get("responses").get(0).get("error").get("code").asInt()).isEqualTo(-32002);
        assertThat(result.get("responses").get(0).get("server_id").asText()).isEqualTo("b");
    }

    @Test
    void broadcastWithoutInnerMethod_returnsInvalidParams() {
        providers("a");

        router.onClientMessage(client, "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"broadcast\",\"params\":{}}");

        assertThat(clientChannel.last().get("error").get("code").asInt()).isEqualTo(-32602);
        assertThat(engine.pendingCount()).isZero();
    }

    @Test
    void configuredFanOutMethod_isAggregatedWithoutEnvelope() {
        List<Provider> providers = providers("a", "b");

        router.onClientMessage(client, "{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"prompts/list\"}");
        assertThat(providers.get(0).channel.last().get("method").asText()).isEqualTo("prompts/list");
        reply(providers.get(0), "{\"prompts\":[]}");
        reply(providers.get(1), "{\"prompts\":[]}");

        JsonNode result = clientChannel.last().get("result");
        assertThat(result.get("total_servers").asInt()).isEqualTo(2);
    }

    @Test
    void broadcastNotification_reachesEveryServerWithoutReply() {
        List<Provider> providers = providers("a", "b");

        router.onClientMessage(client,
                "{\"jsonrpc\":\"2.0\",\"method\":\"broadcast\",\"params\":{\"method\":\"notifications/roots/list_changed\"}}");

        assertThat(providers.get(0).channel.last().get("method").asText()).isEqualTo("notifications/roots/list_changed");
        assertThat(providers.get(1).channel.last().has("id")).isFalse();
        assertThat(clientChannel.getSent()).isEmpty();
        assertThat(engine.pendingCount()).isZero();
    }

    @Test
    void clientLeaves_aggregationIsDiscarded() {
        List<Provider> providers = providers("a");
        router.onClientMessage(client, BROADCAST);

        fx.registry.unregisterClient("agent", clientChannel);
        reply(providers.get(0), "{}");

        assertThat(engine.pendingCount()).isZero();
        assertThat(clientChannel.getSent()).isEmpty();
    }

    private List<Provider> providers(String... serverIds) {
        List<Provider> providers = new ArrayList<>();
        for (String serverId : serverIds) {
            FakeChannel channel = new FakeChannel();
            providers.add(new Provider(fx.provider("agent", serverId, channel), channel));
        }
        return providers;
    }

    private void reply(Provider provider, String result) {
        router.onProviderMessage(provider.connection,
                "{\"jsonrpc\":\"2.0\",\"id\":\"" + provider.forwardedId() + "\",\"result\":" + result + "}");
    }

    private static List<String> serverIds(JsonNode result) {
        List<String> ids = new ArrayList<>();
        result.get("responses").forEach(entry -> ids.add(entry.get("server_id").asText()));
        return ids;
    }

    private record Provider(ProviderConnection connection, FakeChannel channel) {
        String forwardedId() {
            return channel.last().get("id").asText();
        }
    }
}
