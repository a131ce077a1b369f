package de.alive.mailwatch.auth;

import de.alive.mailwatch.exception.AuthenticationException;
import de.alive.mailwatch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;

/**
 * Owns the OAuth2 credential: loads it from disk, refreshes it before it runs out,
 * and runs the browser-based authorization-code flow when no usable credential exists.
 */
@Slf4j
public class TokenManager {

    public static final Duration SAFETY_MARGIN = Duration.ofSeconds(60);

    private final TokenStore tokenStore;
    private final TokenEndpointClient endpointClient;
    private final AuthorizationCallbackServer callbackServer;
    private final int callbackPort;
    private final Duration authorizationTimeout;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    private StoredToken token;

    public TokenManager(@NotNull TokenStore tokenStore,
                        @NotNull TokenEndpointClient endpointClient,
                        @NotNull AuthorizationCallbackServer callbackServer,
                        int callbackPort,
                        @NotNull Duration authorizationTimeout,
                        @NotNull Clock clock) {
        this.tokenStore = tokenStore;
        this.endpointClient = endpointClient;
        this.callbackServer = callbackServer;
        this.callbackPort = callbackPort;
        this.authorizationTimeout = authorizationTimeout;
        this.clock = clock;
        this.token = tokenStore.load().orElse(null);
    }

    /**
     * Returns an access token with at least {@link #SAFETY_MARGIN} of lifetime left, refreshing first if needed.
     *
     * @return the token, or empty if no usable credential exists or the refresh grant was refused
     * @throws AuthenticationException if the token endpoint could not be reached
     */
    public Optional<String> getValidAccessToken() throws AuthenticationException {
        if (token == null) {
            log.info("{} No tokens found, authentication required", LogUtils.KEY_EMOJI);
            return Optional.empty();
        }
        if (!token.expiresWithin(SAFETY_MARGIN, clock.instant())) {
            return Optional.of(token.accessToken());
        }
        if (!token.hasRefreshToken()) {
            log.warn("{} Access token expired and no refresh token available", LogUtils.WARNING_EMOJI);
            return Optional.empty();
        }

        log.info("{} Access token expires at {}, refreshing...", LogUtils.KEY_EMOJI, token.expiresAt());
        try {
            TokenResponse response = endpointClient.refresh(token.refreshToken());
            update(response.toStoredToken(clock.instant(), token.refreshToken()));
            log.info("{} Access token refreshed, valid until {}", LogUtils.SUCCESS_EMOJI, token.expiresAt());
            return Optional.of(token.accessToken());
        } catch (AuthenticationException e) {
            if (e.isNetworkFailure()) {
                throw e;
            }
            log.error("{} Refresh grant refused: {} - interactive authentication required",
                    LogUtils.ERROR_EMOJI, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Runs the authorization-code flow: prints the authorization URL, waits for the redirect
     * on the local callback listener, and exchanges the code for a token pair.
     */
    public boolean authenticateInteractive() {
        try {
            if (getValidAccessToken().isPresent()) {
                log.info("{} Already authenticated with valid tokens", LogUtils.SUCCESS_EMOJI);
                return true;
            }
        } catch (AuthenticationException e) {
            log.warn("{} Token refresh failed ({}), falling back to interactive authentication",
                    LogUtils.WARNING_EMOJI, e.getMessage());
        }

        String state = newState();
        log.info("{} Starting interactive OAuth authentication", LogUtils.KEY_EMOJI);
        log.info("Please visit the following URL in your browser:");
        log.info("{}", endpointClient.buildAuthorizationUrl(state));

        Optional<AuthorizationCallbackServer.CallbackResult> callback;
        try {
            callback = callbackServer.awaitCallback(callbackPort, authorizationTimeout);
        } catch (RuntimeException e) {
            log.error("{} Failed to run the callback listener on port {}: {}",
                    LogUtils.ERROR_EMOJI, callbackPort, e.getMessage());
            return false;
        }
        if (callback.isEmpty()) {
            return false;
        }

        AuthorizationCallbackServer.CallbackResult result = callback.get();
        if (!result.isSuccess()) {
            log.error("{} Authorization failed: {}", LogUtils.ERROR_EMOJI, result.error());
            return false;
        }
        if (!state.equals(result.state())) {
            log.error("{} Authorization callback carried an unexpected state parameter", LogUtils.ERROR_EMOJI);
            return false;
        }

        try {
            TokenResponse response = endpointClient.exchangeCode(result.code());
            update(response.toStoredToken(clock.instant(), null));
            log.info("{} OAuth authentication successful", LogUtils.SUCCESS_EMOJI);
            return true;
        } catch (AuthenticationException e) {
            log.error("{} OAuth authentication failed: {}", LogUtils.ERROR_EMOJI, e.getMessage());
            return false;
        }
    }

    /**
     * Marks the current access token as expired so the next {@link #getValidAccessToken()} refreshes it.
     * Used when the mail server rejects a token that still looked valid locally.
     *
     * @return true if a refresh is possible
     */
    public boolean invalidateAccessToken() {
        if (token == null) {
            return false;
        }
        token = token.expired(clock.instant());
        return token.hasRefreshToken();
    }

    public void revokeTokens() {
        token = null;
        try {
            tokenStore.delete();
        } catch (IOException e) {
            log.error("{} Error deleting token file: {}", LogUtils.ERROR_EMOJI, e.getMessage());
        }
    }

    Optional<StoredToken> currentToken() {
        return Optional.ofNullable(token);
    }

    private void update(StoredToken newToken) {
        token = newToken;
        try {
            tokenStore.save(newToken);
        } catch (IOException e) {
            log.error("{} Failed to save tokens to {}: {}", LogUtils.ERROR_EMOJI, tokenStore.getFile(), e.getMessage());
        }
    }

    private String newState() {
        byte[] bytes = new byte[24];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
