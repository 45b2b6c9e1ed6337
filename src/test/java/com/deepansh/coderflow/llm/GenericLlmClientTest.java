package com.deepansh.coderflow.llm;

import com.deepansh.coderflow.exception.AgentException;
import com.deepansh.coderflow.model.Message;
import com.deepansh.coderflow.model.RawToolPayload;
import com.deepansh.coderflow.model.ToolCall;
import com.deepansh.coderflow.tool.ToolDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GenericLlmClientTest {

    private static final String URL = "http://llm.test/chat/completions";

    private MockRestServiceServer server;
    private GenericLlmClient client;

    @BeforeEach
    void setUp() {
        LlmProviderProperties props = new LlmProviderProperties();
        props.setApiKey("test-key");
        props.setBaseUrl("http://llm.test");
        props.setModel("test-model");
        props.setMaxTokens(256);
        props.setTemperature(0.1);

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new GenericLlmClient(props, new ObjectMapper(), "groq", builder);
    }

    private static String completion(String messageJson) {
        return """
                {"choices":[{"message":%s,"finish_reason":"stop"}],
                 "usage":{"prompt_tokens":10,"completion_tokens":5}}
                """.formatted(messageJson);
    }

    @Test
    void request_replaysHistoryInChatCompletionsFormat() {
        ToolCall call = ToolCall.builder().id("call_1").toolName("write_file")
                .arguments(Map.of("path", "a.py")).build();
        List<Message> history = List.of(
                Message.user("create a.py"),
                Message.builder().role(Message.Role.agent).author("coder").toolCall(call).build(),
                Message.builder().role(Message.Role.tool).author("write_file").toolCallId("call_1").text("ok").build());
        ToolDefinition definition = ToolDefinition.builder()
                .name("write_file").description("Write a file")
                .inputSchema(Map.of("type", "object", "properties", Map.of()))
                .build();

        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer test-key"))
                .andExpect(jsonPath("$.model").value("test-model"))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[0].content").value("You are the coder."))
                .andExpect(jsonPath("$.messages[1].role").value("user"))
                .andExpect(jsonPath("$.messages[2].role").value("assistant"))
                .andExpect(jsonPath("$.messages[2].name").value("coder"))
                .andExpect(jsonPath("$.messages[2].tool_calls[0].id").value("call_1"))
                .andExpect(jsonPath("$.messages[2].tool_calls[0].function.arguments").value("{\"path\":\"a.py\"}"))
                .andExpect(jsonPath("$.messages[3].role").value("tool"))
                .andExpect(jsonPath("$.messages[3].tool_call_id").value("call_1"))
                .andExpect(jsonPath("$.tools[0].function.name").value("write_file"))
                .andExpect(jsonPath("$.tool_choice").value("auto"))
                .andRespond(withSuccess(completion("{\"role\":\"assistant\",\"content\":\"done\"}"),
                        MediaType.APPLICATION_JSON));

        Message reply = client.chat("You are the coder.", history, List.of(definition));

        server.verify();
        assertThat(reply.getRole()).isEqualTo(Message.Role.agent);
        assertThat(reply.getText()).isEqualTo("done");
        assertThat(reply.getRawToolCalls()).isEmpty();
    }

    @Test
    void toolCalls_areAttachedAsMetadataPayload() {
        server.expect(requestTo(URL)).andRespond(withSuccess(completion("""
                {"role":"assistant","content":null,"tool_calls":[
                  {"id":"call_9","type":"function",
                   "function":{"name":"read_file","arguments":"{\\"path\\":\\"README.md\\"}"}}]}
                """), MediaType.APPLICATION_JSON));

        Message reply = client.chat("sys", List.of(Message.user("hi")), List.of());

        assertThat(reply.getText()).isNull();
        assertThat(reply.getRawToolCalls()).singleElement().isInstanceOf(RawToolPayload.MetadataCalls.class);
        RawToolPayload.MetadataCalls metadata = (RawToolPayload.MetadataCalls) reply.getRawToolCalls().get(0);
        assertThat((List<?>) metadata.metadata().get("tool_calls")).hasSize(1);
    }

    @Test
    void listContent_isAttachedAsContentBlocks() {
        server.expect(requestTo(URL)).andRespond(withSuccess(completion("""
                {"role":"assistant","content":[
                  {"type":"text","text":"Reading."},
                  {"type":"tool_use","id":"tu_1","name":"read_file","input":{"path":"a.md"}}]}
                """), MediaType.APPLICATION_JSON));

        Message reply = client.chat("sys", List.of(Message.user("hi")), List.of());

        assertThat(reply.getRawToolCalls()).singleElement().isInstanceOf(RawToolPayload.ContentBlocks.class);
        assertThat(((RawToolPayload.ContentBlocks) reply.getRawToolCalls().get(0)).blocks()).hasSize(2);
    }

    @Test
    void groqToolUseFailed_isRecoveredAsDirectCall() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body("""
                        {"error":{"message":"Failed to call a function","code":"tool_use_failed",
                          "failed_generation":"<function=write_file{\\"path\\": \\"a.py\\"}></function>"}}
                        """));

        Message reply = client.chat("sys", List.of(Message.user("hi")), List.of());

        assertThat(reply.getRawToolCalls()).singleElement().isInstanceOf(RawToolPayload.DirectCalls.class);
        Map<String, Object> recovered = ((RawToolPayload.DirectCalls) reply.getRawToolCalls().get(0)).calls().get(0);
        assertThat(recovered).containsEntry("name", "write_file").containsEntry("args", "{\"path\": \"a.py\"}");
        assertThat(recovered.get("id").toString()).startsWith("groq-recovered-");
    }

    @Test
    void invalidApiKey_isAgentException() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                .body("{\"error\":{\"code\":\"invalid_api_key\"}}"));

        assertThatThrownBy(() -> client.chat("sys", List.of(Message.user("hi")), List.of()))
                .isInstanceOf(AgentException.class)
                .hasMessageContaining("API key is invalid");
    }

    @Test
    void rateLimit_isRetryableRuntimeException() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).body("slow down"));

        assertThatThrownBy(() -> client.chat("sys", List.of(Message.user("hi")), List.of()))
                .isNotInstanceOf(AgentException.class)
                .hasMessageContaining("rate limit");
    }

    @Test
    void serverError_isRetryableRuntimeException() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE).body("overloaded"));

        assertThatThrownBy(() -> client.chat("sys", List.of(Message.user("hi")), List.of()))
                .isInstanceOf(RuntimeException.class)
                .isNotInstanceOf(AgentException.class)
                .hasMessageContaining("server error");
    }

    @Test
    void noChoices_isAgentException() {
        server.expect(requestTo(URL)).andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.chat("sys", List.of(Message.user("hi")), List.of()))
                .isInstanceOf(AgentException.class)
                .hasMessageContaining("no choices");
    }
}
