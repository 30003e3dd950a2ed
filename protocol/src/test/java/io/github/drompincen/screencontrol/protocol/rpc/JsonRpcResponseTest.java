package io.github.drompincen.screencontrol.protocol.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonRpcResponseTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void parseErrorKeepsNullId() throws Exception {
        String json = mapper.writeValueAsString(JsonRpcResponse.error(null, JsonRpcError.parseError()));
        JsonNode node = mapper.readTree(json);

        assertThat(node.has("id")).isTrue();
        assertThat(node.get("id").isNull()).isTrue();
        assertThat(node.get("error").get("code").asInt()).isEqualTo(-32700);
        assertThat(node.has("result")).isFalse();
    }

    @Test
    void resultOmitsError() throws Exception {
        var result = mapper.createObjectNode().put("ok", true);
        JsonNode node = mapper.readTree(mapper.writeValueAsString(JsonRpcResponse.result(new IntNode(7), result)));

        assertThat(node.get("jsonrpc").asText()).isEqualTo("2.0");
        assertThat(node.get("id").asInt()).isEqualTo(7);
        assertThat(node.get("result").get("ok").asBoolean()).isTrue();
        assertThat(node.has("error")).isFalse();
    }

    @Test
    void notificationHasNoIdOrParams() throws Exception {
        JsonNode node = mapper.readTree(mapper.writeValueAsString(
                JsonRpcNotification.of(JsonRpcNotification.TOOLS_LIST_CHANGED)));

        assertThat(node.get("method").asText()).isEqualTo("notifications/tools/list_changed");
        assertThat(node.has("id")).isFalse();
        assertThat(node.has("params")).isFalse();
    }

    @Test
    void requestWithoutIdIsNotification() throws Exception {
        var request = JsonRpcRequest.from(mapper.readTree("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}"));

        assertThat(request).isPresent();
        assertThat(request.get().isNotification()).isTrue();
        assertThat(request.get().params().isMissingNode()).isTrue();
    }

    @Test
    void explicitNullIdIsNotANotification() throws Exception {
        var request = JsonRpcRequest.from(mapper.readTree("{\"jsonrpc\":\"2.0\",\"id\":null,\"method\":\"ping\"}"));

        assertThat(request).isPresent();
        assertThat(request.get().isNotification()).isFalse();
        JsonNode node = mapper.readTree(mapper.writeValueAsString(
                JsonRpcResponse.result(request.get().id(), mapper.createObjectNode())));
        assertThat(node.has("id")).isTrue();
        assertThat(node.get("id").isNull()).isTrue();
    }

    @Test
    void valueWithoutMethodIsNotARequest() throws Exception {
        assertThat(JsonRpcRequest.from(mapper.readTree("{\"id\":1}"))).isEmpty();
        assertThat(JsonRpcRequest.from(mapper.readTree("[1,2]"))).isEmpty();
    }
}
