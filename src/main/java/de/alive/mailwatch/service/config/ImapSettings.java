package de.alive.mailwatch.service.config;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

public record ImapSettings(
        @NotNull String host,
        int port,
        @NotNull EncryptionMethod encryption,
        @NotNull String username,
        @Nullable String password,
        @NotNull String mailbox,
        @Nullable String moveToFolder
) {

    public ImapSettings {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("IMAP host cannot be null or empty");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("IMAP port out of range: " + port);
        }
        if (encryption == null) {
            throw new IllegalArgumentException("Encryption method cannot be null");
        }
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("IMAP user cannot be null or empty");
        }
        if (mailbox == null || mailbox.isBlank()) {
            throw new IllegalArgumentException("Mailbox cannot be null or empty");
        }
        if (moveToFolder != null && moveToFolder.isBlank()) {
            moveToFolder = null;
        }
    }

    public Optional<String> moveDestination() {
        return Optional.ofNullable(moveToFolder);
    }
}
