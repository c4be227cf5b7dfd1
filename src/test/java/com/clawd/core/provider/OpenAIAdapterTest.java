package com.clawd.core.provider;

import com.clawd.core.config.ClawdProperties;
import com.clawd.core.exception.TransientIOException;
import com.clawd.core.exception.UnsupportedCapabilityException;
import com.clawd.core.model.CompletionRequest;
import com.clawd.core.model.CompletionResponse;
import com.clawd.core.model.Message;
import com.clawd.core.model.MessageRole;
import com.clawd.core.model.ToolCall;
import com.clawd.core.model.ToolDefinition;
import com.clawd.core.support.TestFixtures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OpenAIAdapter.
 */
class OpenAIAdapterTest {

    private ObjectMapper objectMapper;
    private ClawdProperties properties;
    private OpenAIAdapter adapter;

    @BeforeEach
    void setUp() {
        objectMapper = TestFixtures.objectMapper();
        properties = TestFixtures.properties();
        ClawdProperties.ProviderConfig config = new ClawdProperties.ProviderConfig();
        config.setApiKey("sk-test");
        config.setBaseUrl("http://openai.test/v1");
        properties.getProviders().put("openai", config);
        adapter = new OpenAIAdapter(WebClient.create(), objectMapper, properties);
    }

    @Test
    void testBuildRequestWithTools() {
        CompletionRequest request = CompletionRequest.builder()
                .messages(List.of(Message.system("You are Clawd."), Message.user("Weather in Oslo?")))
                .tools(List.of(ToolDefinition.builder()
                        .name("get_weather")
                        .description("Current weather for a city")
                        .build()))
                .maxTokens(100)
                .build();

        JsonNode body = adapter.buildRequest(request, "gpt-4o-mini");

        assertEquals("gpt-4o-mini", body.get("model").asText());
        assertEquals(100, body.get("max_tokens").asInt());
        assertEquals("system", body.get("messages").get(0).get("role").asText());
        assertEquals("user", body.get("messages").get(1).get("role").asText());

        JsonNode tool = body.get("tools").get(0);
        assertEquals("function", tool.get("type").asText());
        assertEquals("get_weather", tool.get("function").get("name").asText());
        // a tool without a schema gets an empty object schema
        assertEquals("object", tool.get("function").get("parameters").get("type").asText());
        assertFalse(body.has("response_format"));
    }

    @Test
    void testAssistantToolCallsAndResults() {
        ToolCall call = ToolCall.builder()
                .id("call_1")
                .name("get_weather")
                .arguments(objectMapper.createObjectNode().put("city", "Oslo"))
                .build();
        CompletionRequest request = CompletionRequest.builder()
                .messages(List.of(
                        Message.user("Weather in Oslo?"),
                        Message.builder().role(MessageRole.ASSISTANT).toolCalls(List.of(call)).build(),
                        Message.toolResult("call_1", "-3C")))
                .build();

        JsonNode messages = adapter.buildRequest(request, "gpt-4o").get("messages");

        JsonNode assistant = messages.get(1);
        assertTrue(assistant.get("content").isNull());
        JsonNode function = assistant.get("tool_calls").get(0).get("function");
        assertEquals("get_weather", function.get("name").asText());
        assertTrue(function.get("arguments").isTextual());
        assertEquals("{\"city\":\"Oslo\"}", function.get("arguments").asText());

        JsonNode result = messages.get(2);
        assertEquals("tool", result.get("role").asText());
        assertEquals("call_1", result.get("tool_call_id").asText());
        assertEquals("-3C", result.get("content").asText());
    }

    @Test
    void testJsonMode() {
        CompletionRequest request = CompletionRequest.builder()
                .messages(List.of(
                        Message.user("Give me JSON"),
                        Message.assistant("{\"ok\":true}"),
                        Message.user("Again, with a name field")))
                .jsonMode(true)
                .build();

        JsonNode body = adapter.buildRequest(request, "gpt-4o");

        assertEquals("json_object", body.get("response_format").get("type").asText());
        assertEquals("assistant", body.get("messages").get(1).get("role").asText());
        assertFalse(body.get("messages").get(1).has("tool_calls"));
    }

    @Test
    void testToolResultNeedsCallId() {
        CompletionRequest request = CompletionRequest.builder()
                .messages(List.of(Message.builder().role(MessageRole.TOOL).content("orphan").build()))
                .build();

        assertThrows(UnsupportedCapabilityException.class, () -> adapter.buildRequest(request, "gpt-4o"));
    }

    @Test
    void testParseResponseWithToolCalls() throws Exception {
        JsonNode response = objectMapper.readTree("""
                {
                  "id": "chatcmpl-1",
                  "model": "gpt-4o-2024-08-06",
                  "choices": [{
                    "index": 0,
                    "finish_reason": "tool_calls",
                    "message": {
                      "role": "assistant",
                      "content": null,
                      "tool_calls": [{
                        "id": "call_9",
                        "type": "function",
                        "function": {"name": "get_weather", "arguments": "{\\"city\\":\\"Paris\\"}"}
                      }]
                    }
                  }],
                  "usage": {"prompt_tokens": 50, "completion_tokens": 10, "total_tokens": 60}
                }
                """);

        CompletionResponse parsed = adapter.parseResponse(response, "gpt-4o");

        assertEquals("openai", parsed.getProvider());
        assertEquals("gpt-4o-2024-08-06", parsed.getModel());
        assertNull(parsed.getContent());
        assertEquals("tool_calls", parsed.getFinishReason());
        assertEquals("Paris", parsed.getToolCalls().get(0).getArguments().get("city").asText());
        assertEquals(60, parsed.getUsage().getTotalTokens());
    }

    @Test
    void testUnparsableToolArgumentsAreTransient() throws Exception {
        JsonNode response = objectMapper.readTree(
                "{\"choices\":[{\"message\":{\"tool_calls\":[{\"id\":\"c\",\"function\":"
                        + "{\"name\":\"f\",\"arguments\":\"{\\\"city\\\": \"}}]}}]}");

        assertThrows(TransientIOException.class, () -> adapter.parseResponse(response, "gpt-4o"));
    }

    @Test
    void testMissingChoicesAreTransient() throws Exception {
        assertThrows(TransientIOException.class,
                () -> adapter.parseResponse(objectMapper.readTree("{\"choices\":[]}"), "gpt-4o"));
    }

    @Test
    void testSendUsesBearerToken() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    captured.set(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body("{\"choices\":[{\"message\":{\"content\":\"hi\"},\"finish_reason\":\"stop\"}]}")
                            .build());
                })
                .build();
        OpenAIAdapter stubbed = new OpenAIAdapter(webClient, objectMapper, properties);
        CompletionRequest request = CompletionRequest.builder().messages(List.of(Message.user("hi"))).build();

        StepVerifier.create(stubbed.complete(request, "gpt-4o-mini"))
                .assertNext(response -> {
                    assertEquals("hi", response.getContent());
                    assertEquals("stop", response.getFinishReason());
                })
                .verifyComplete();

        assertEquals("http://openai.test/v1/chat/completions", captured.get().url().toString());
        assertEquals("Bearer sk-test", captured.get().headers().getFirst(HttpHeaders.AUTHORIZATION));
    }
}
