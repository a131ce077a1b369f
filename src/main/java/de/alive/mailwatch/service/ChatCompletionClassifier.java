package de.alive.mailwatch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.alive.mailwatch.domain.ClassificationResult;
import de.alive.mailwatch.exception.ClassificationException;
import de.alive.mailwatch.service.config.ClassifierSettings;
import de.alive.mailwatch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Classifies a message through an OpenAI-compatible chat-completions endpoint.
 * The model is instructed by the {@code system-prompt.txt} resource to answer with a JSON object.
 */
@Slf4j
public class ChatCompletionClassifier implements Classifier {

    static final String SYSTEM_PROMPT_RESOURCE = "/system-prompt.txt";

    private final ClassifierSettings settings;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final String systemPrompt;

    public ChatCompletionClassifier(@NotNull ClassifierSettings settings,
                                    @NotNull WebClient webClient,
                                    @NotNull ObjectMapper objectMapper,
                                    @NotNull Duration timeout) {
        this.settings = settings;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
        this.systemPrompt = loadSystemPrompt();
    }

    @NotNull
    @Override
    public ClassificationResult classify(@NotNull String formattedText) throws ClassificationException {
        Map<String, Object> body = Map.of(
                "model", settings.model(),
                "messages", List.of(
                        Map.of("role", "system", "content", systemPrompt),
                        Map.of("role", "user", "content", formattedText)
                ),
                "temperature", 0.0,
                "top_p", 1.0
        );

        JsonNode response;
        try {
            response = webClient.post()
                    .uri(settings.endpoint() + "/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.token())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            throw new ClassificationException("Classifier returned " + e.getStatusCode() + ": "
                    + LogUtils.truncate(e.getResponseBodyAsString(), 200), e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            throw new ClassificationException("Classifier request failed: " + cause.getMessage(), cause);
        }

        String content = response == null ? "" : response.path("choices").path(0)
                .path("message").path("content").asText("").trim();
        if (content.isEmpty()) {
            throw new ClassificationException("Classifier response carried no message content");
        }
        return parseResult(content);
    }

    ClassificationResult parseResult(String content) throws ClassificationException {
        String json = stripCodeFence(content);
        try {
            ClassificationResult result = objectMapper.readValue(json, ClassificationResult.class);
            if (result.classification().isEmpty()) {
                throw new ClassificationException("Classifier answer has no classification: "
                        + LogUtils.truncate(content, 200));
            }
            return result;
        } catch (JsonProcessingException e) {
            throw new ClassificationException("Invalid JSON from classifier: "
                    + LogUtils.truncate(content, 200), e);
        }
    }

    // Some models wrap the object in a markdown code block despite the instructions.
    private static String stripCodeFence(String content) {
        if (!content.startsWith("```")) {
            return content;
        }
        int start = content.indexOf('\n');
        int end = content.lastIndexOf("```");
        if (start < 0 || end <= start) {
            return content;
        }
        return content.substring(start + 1, end).trim();
    }

    private static String loadSystemPrompt() {
        try (InputStream in = ChatCompletionClassifier.class.getResourceAsStream(SYSTEM_PROMPT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SYSTEM_PROMPT_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + SYSTEM_PROMPT_RESOURCE, e);
        }
    }
}
