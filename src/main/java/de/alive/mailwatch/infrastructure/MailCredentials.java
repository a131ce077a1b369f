package de.alive.mailwatch.infrastructure;

import org.jetbrains.annotations.NotNull;

/**
 * Login material for one connection: a password, or an OAuth2 bearer token for XOAUTH2.
 */
public record MailCredentials(@NotNull String username, @NotNull String secret, boolean oauth) {

    public static MailCredentials password(String username, String password) {
        return new MailCredentials(username, password, false);
    }

    public static MailCredentials bearer(String username, String accessToken) {
        return new MailCredentials(username, accessToken, true);
    }

    @Override
    public String toString() {
        return "MailCredentials{username=" + username + ", oauth=" + oauth + "}";
    }
}
