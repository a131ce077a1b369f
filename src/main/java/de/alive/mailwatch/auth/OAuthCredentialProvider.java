package de.alive.mailwatch.auth;

import de.alive.mailwatch.exception.AuthenticationException;
import de.alive.mailwatch.infrastructure.MailCredentials;
import de.alive.mailwatch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.util.Optional;

/**
 * XOAUTH2 credentials backed by the {@link TokenManager}. Without interactive fallback every failure
 * to produce a token is reported as a rejected credential, which ends the process.
 */
@Slf4j
public class OAuthCredentialProvider implements CredentialProvider {

    private final String username;
    private final TokenManager tokenManager;
    private final boolean interactive;

    public OAuthCredentialProvider(@NotNull String username, @NotNull TokenManager tokenManager, boolean interactive) {
        this.username = username;
        this.tokenManager = tokenManager;
        this.interactive = interactive;
    }

    @NotNull
    @Override
    public MailCredentials obtain() throws AuthenticationException {
        Optional<String> accessToken;
        try {
            accessToken = tokenManager.getValidAccessToken();
        } catch (AuthenticationException e) {
            if (!interactive) {
                throw new AuthenticationException("Token refresh failed and interactive authentication is disabled: "
                        + e.getMessage(), false, e);
            }
            log.warn("{} Token refresh failed: {}", LogUtils.WARNING_EMOJI, e.getMessage());
            accessToken = Optional.empty();
        }

        if (accessToken.isPresent()) {
            return MailCredentials.bearer(username, accessToken.get());
        }
        if (!interactive) {
            throw new AuthenticationException("No valid OAuth token and interactive authentication is disabled", false);
        }
        if (!tokenManager.authenticateInteractive()) {
            throw new AuthenticationException("Interactive OAuth authentication failed", false);
        }
        return MailCredentials.bearer(username, tokenManager.getValidAccessToken()
                .orElseThrow(() -> new AuthenticationException("No access token after interactive authentication", false)));
    }

    @Override
    public boolean invalidate() {
        return tokenManager.invalidateAccessToken() || interactive;
    }
}
