package de.alive.mailwatch.service;

import de.alive.mailwatch.domain.ClassificationResult;
import de.alive.mailwatch.service.config.NotificationSettings;
import de.alive.mailwatch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Publishes classification reports to an ntfy topic.
 */
@Slf4j
public class NtfyNotifier implements Notifier {

    private static final String DANGER_MARK = "🔴";
    private static final String SAFE_MARK = "🟢";

    private final NotificationSettings settings;
    private final WebClient webClient;
    private final Duration timeout;

    public NtfyNotifier(@NotNull NotificationSettings settings, @NotNull WebClient webClient, @NotNull Duration timeout) {
        this.settings = settings;
        this.webClient = webClient;
        this.timeout = timeout;
    }

    @Override
    public void notify(@NotNull String sender, @NotNull String subject, @NotNull ClassificationResult result) {
        if (!settings.isEnabled()) {
            return;
        }
        String classification = result.classification();
        if (!settings.notifyOn().contains(classification)) {
            log.info("{} Skipping notification for classification '{}'", LogUtils.INFO_EMOJI, classification);
            return;
        }

        String message = buildMessage(sender, subject, result);
        try {
            webClient.post()
                    .uri(settings.topicUrl())
                    .header("Title", settings.title())
                    .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                    .bodyValue(message.getBytes(StandardCharsets.UTF_8))
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(timeout)
                    .block();
            log.info("{} Sent ntfy notification for '{}' to topic '{}'",
                    LogUtils.SUCCESS_EMOJI, LogUtils.truncate(sanitize(subject), 80), settings.topic());
        } catch (RuntimeException e) {
            log.error("{} Failed to send ntfy notification: {}", LogUtils.ERROR_EMOJI, Exceptions.unwrap(e).getMessage());
        }
    }

    String buildMessage(String sender, String subject, ClassificationResult result) {
        boolean dangerous = result.classification().contains("phish");
        List<String> parts = new ArrayList<>();
        parts.add("SENDER: \"" + sender + "\"");
        parts.add("SUBJECT: \"" + sanitize(subject) + "\"");
        parts.add("CLASSIFICATION: " + (dangerous ? DANGER_MARK : SAFE_MARK) + " " + result.classification());
        parts.add("REASON: " + result.reason());
        if (dangerous && !result.advice().isBlank()) {
            parts.add("ADVICE: " + result.advice());
        }
        return String.join("\n\n", parts);
    }

    static String sanitize(String subject) {
        return subject.replace('\r', ' ').replace('\n', ' ').trim();
    }
}
