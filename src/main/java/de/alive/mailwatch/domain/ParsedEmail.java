package de.alive.mailwatch.domain;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Decoded headers, plain-text body and links of one message.
 */
public record ParsedEmail(
        @NotNull String sender,
        @NotNull String recipient,
        @NotNull String date,
        @NotNull String subject,
        @NotNull String body,
        @NotNull List<String> urls
) {

    public static final ParsedEmail EMPTY = new ParsedEmail("", "", "", "", "", List.of());

    public ParsedEmail {
        sender = sender == null ? "" : sender;
        recipient = recipient == null ? "" : recipient;
        date = date == null ? "" : date;
        subject = subject == null ? "" : subject;
        body = body == null ? "" : body;
        urls = urls == null ? List.of() : List.copyOf(urls);
    }
}
