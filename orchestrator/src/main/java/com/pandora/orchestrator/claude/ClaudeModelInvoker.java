package com.pandora.orchestrator.claude;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pandora.orchestrator.skill.ModelStepDescriptor.Capability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ModelInvoker} over the Anthropic Messages API.
 *
 * Single-turn only: one user message, optional system prompt. The step
 * executor owns the timeout, so the HTTP timeout here is only a backstop.
 */
@Component
public class ClaudeModelInvoker implements ModelInvoker {

    private static final Logger log = LoggerFactory.getLogger(ClaudeModelInvoker.class);

    // -------------------------------------------------------------------------
    // Wire records
    // -------------------------------------------------------------------------

    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content, Usage usage) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Usage(@JsonProperty("input_tokens") long inputTokens,
                            @JsonProperty("output_tokens") long outputTokens) {}

        public String firstText() {
            if (content == null) {
                throw new IllegalStateException("No content in response");
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No text block in response"));
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_VER = "2023-06-01";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       model;
    private final URI          apiUrl;

    public ClaudeModelInvoker(@Value("${anthropic.api-key:}") String apiKey,
                              @Value("${anthropic.model:claude-sonnet-4-5}") String model,
                              @Value("${anthropic.api-url:https://api.anthropic.com/v1/messages}") String apiUrl,
                              ObjectMapper objectMapper) {
        this.apiKey = apiKey;
        this.model  = model;
        this.apiUrl = URI.create(apiUrl);
        this.json   = objectMapper;
        this.http   = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // ModelInvoker
    // -------------------------------------------------------------------------

    @Override
    public ModelResponse invoke(ModelRequest request) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ModelInvocationException("anthropic.api-key is not configured", null);
        }
        try {
            String body = json.writeValueAsString(requestBody(request));

            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(apiUrl)
                    .timeout(Duration.ofMinutes(5))
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            HttpResponse<String> response = http.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new ModelInvocationException(response.statusCode(), response.body());
            }

            MessagesResponse parsed = json.readValue(response.body(), MessagesResponse.class);
            long in  = parsed.usage() == null ? 0 : parsed.usage().inputTokens();
            long out = parsed.usage() == null ? 0 : parsed.usage().outputTokens();
            log.debug("Model call for step '{}' of skill '{}' used {} input / {} output tokens",
                    request.stepId(), request.skillId(), in, out);
            return new ModelResponse(parsed.firstText(), in, out);

        } catch (ModelInvocationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelInvocationException("Model call interrupted", e);
        } catch (IOException | RuntimeException e) {
            throw new ModelInvocationException("Model call failed: " + e.getMessage(), e);
        }
    }

    Map<String, Object> requestBody(ModelRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model",       model);
        body.put("max_tokens",  request.maxTokens());
        body.put("temperature", temperatureFor(request.capability()));
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            body.put("system", request.systemPrompt());
        }
        body.put("messages", List.of(new Message("user", request.prompt())));
        return body;
    }

    static double temperatureFor(Capability capability) {
        return switch (capability) {
            case CLASSIFY, EXTRACT -> 0.0;
            case REASON            -> 0.2;
            case GENERATE          -> 0.7;
        };
    }
}
