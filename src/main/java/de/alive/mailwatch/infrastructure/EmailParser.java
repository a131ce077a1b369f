package de.alive.mailwatch.infrastructure;

import de.alive.mailwatch.domain.ParsedEmail;
import org.jetbrains.annotations.NotNull;

/**
 * Turns raw RFC 822 bytes into decoded headers, text body and links.
 * Implementations never throw on malformed input; unreadable parts come back as empty strings.
 */
public interface EmailParser {

    @NotNull ParsedEmail parse(@NotNull byte[] raw);

    /**
     * Renders the parsed message as the plain-text input handed to the classifier.
     */
    @NotNull String format(@NotNull ParsedEmail email);
}
