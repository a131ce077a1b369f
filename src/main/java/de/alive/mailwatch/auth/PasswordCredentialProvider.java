package de.alive.mailwatch.auth;

import de.alive.mailwatch.infrastructure.MailCredentials;
import org.jetbrains.annotations.NotNull;

public class PasswordCredentialProvider implements CredentialProvider {

    private final MailCredentials credentials;

    public PasswordCredentialProvider(@NotNull String username, @NotNull String password) {
        this.credentials = MailCredentials.password(username, password);
    }

    @NotNull
    @Override
    public MailCredentials obtain() {
        return credentials;
    }

    @Override
    public boolean invalidate() {
        return false;
    }
}
