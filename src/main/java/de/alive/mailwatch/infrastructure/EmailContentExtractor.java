package de.alive.mailwatch.infrastructure;

import de.alive.mailwatch.domain.ParsedEmail;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import javax.mail.BodyPart;
import javax.mail.Message;
import javax.mail.MessagingException;
import javax.mail.Multipart;
import javax.mail.Part;
import javax.mail.Session;
import javax.mail.internet.MimeMessage;
import javax.mail.internet.MimeUtility;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
public class EmailContentExtractor implements EmailParser {

    private static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s\"'<>]+");
    private static final int MAX_CONTENT_LENGTH = 500_000; // 500KB limit
    private static final int MAX_DEPTH = 10;

    private final Session session = Session.getInstance(new Properties());

    @NotNull
    @Override
    public ParsedEmail parse(@NotNull byte[] raw) {
        MimeMessage message;
        try {
            message = new MimeMessage(session, new ByteArrayInputStream(raw));
        } catch (MessagingException e) {
            log.debug("Unparseable message ({} bytes): {}", raw.length, e.getMessage());
            return ParsedEmail.EMPTY;
        }

        String body = extractBody(message);
        return new ParsedEmail(
                header(message, "From"),
                header(message, "To"),
                header(message, "Date"),
                header(message, "Subject"),
                body,
                extractUrls(body)
        );
    }

    @NotNull
    @Override
    public String format(@NotNull ParsedEmail email) {
        StringBuilder text = new StringBuilder();
        text.append("From: ").append(email.sender()).append('\n');
        text.append("To: ").append(email.recipient()).append('\n');
        text.append("Date: ").append(email.date()).append('\n');
        text.append("Subject: ").append(email.subject()).append('\n');
        if (!email.urls().isEmpty()) {
            text.append("URLs: ").append(String.join(", ", email.urls())).append('\n');
        }
        text.append('\n');
        text.append("Body:\n").append(email.body());
        return text.toString();
    }

    private String header(MimeMessage message, String name) {
        try {
            String value = message.getHeader(name, ", ");
            if (value == null) {
                return "";
            }
            return MimeUtility.decodeText(MimeUtility.unfold(value)).trim();
        } catch (MessagingException | UnsupportedEncodingException e) {
            log.debug("Failed to decode header {}: {}", name, e.getMessage());
            return rawHeader(message, name);
        }
    }

    private String rawHeader(MimeMessage message, String name) {
        try {
            String value = message.getHeader(name, ", ");
            return value == null ? "" : value.trim();
        } catch (MessagingException e) {
            return "";
        }
    }

    private String extractBody(MimeMessage message) {
        List<String> parts = new ArrayList<>();
        try {
            collectPlainText(message, parts, 0);
        } catch (MessagingException | IOException e) {
            log.debug("Body extraction stopped early: {}", e.getMessage());
        }

        String body = String.join("\n", parts).trim();
        if (body.length() > MAX_CONTENT_LENGTH) {
            body = body.substring(0, MAX_CONTENT_LENGTH) + "... [TRUNCATED]";
        }
        return body;
    }

    private void collectPlainText(Part part, List<String> parts, int depth) throws MessagingException, IOException {
        if (depth > MAX_DEPTH) {
            return;
        }
        if (Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition())) {
            return;
        }

        if (part.isMimeType("text/plain")) {
            Object content = part.getContent();
            if (content instanceof String) {
                parts.add((String) content);
            }
        } else if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart bodyPart = multipart.getBodyPart(i);
                try {
                    collectPlainText(bodyPart, parts, depth + 1);
                } catch (MessagingException | IOException e) {
                    log.debug("Skipping unreadable body part {}: {}", i, e.getMessage());
                }
            }
        } else if (part.isMimeType("message/rfc822")) {
            Object content = part.getContent();
            if (content instanceof Message) {
                collectPlainText((Message) content, parts, depth + 1);
            }
        }
    }

    private List<String> extractUrls(String body) {
        Set<String> urls = new LinkedHashSet<>();
        Matcher matcher = URL_PATTERN.matcher(body);
        while (matcher.find()) {
            urls.add(trimTrailingPunctuation(matcher.group()));
        }
        return new ArrayList<>(urls);
    }

    private static String trimTrailingPunctuation(String url) {
        int end = url.length();
        while (end > 0 && ".,;:)]".indexOf(url.charAt(end - 1)) >= 0) {
            end--;
        }
        return url.substring(0, end);
    }
}
