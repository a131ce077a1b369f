package de.alive.mailwatch.infrastructure;

import org.jetbrains.annotations.NotNull;

public interface ConnectionManager {

    /**
     * @return a fresh, unconnected transport; transports are never reused after a failure
     */
    @NotNull MailTransport createTransport();
}
