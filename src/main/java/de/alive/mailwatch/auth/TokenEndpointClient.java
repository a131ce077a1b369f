package de.alive.mailwatch.auth;

import de.alive.mailwatch.exception.AuthenticationException;
import de.alive.mailwatch.service.config.OAuthSettings;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Exceptions;

import java.time.Duration;

/**
 * Talks to the authorization server's token endpoint (authorization-code and refresh-token grants).
 */
@Slf4j
public class TokenEndpointClient {

    private final OAuthSettings settings;
    private final WebClient webClient;
    private final Duration timeout;

    public TokenEndpointClient(@NotNull OAuthSettings settings, @NotNull WebClient webClient, @NotNull Duration timeout) {
        this.settings = settings;
        this.webClient = webClient;
        this.timeout = timeout;
    }

    public String buildAuthorizationUrl(String state) {
        return UriComponentsBuilder.fromUriString(settings.authorizationUrl())
                .queryParam("response_type", "code")
                .queryParam("client_id", settings.clientId())
                .queryParam("redirect_uri", settings.redirectUri())
                .queryParam("scope", String.join(" ", settings.scopes()))
                .queryParam("state", state)
                .queryParam("access_type", "offline")
                .queryParam("prompt", "consent")
                .encode()
                .build()
                .toUriString();
    }

    public TokenResponse exchangeCode(String authorizationCode) throws AuthenticationException {
        MultiValueMap<String, String> formData = new LinkedMultiValueMap<>();
        formData.add("client_id", settings.clientId());
        formData.add("client_secret", settings.clientSecret());
        formData.add("code", authorizationCode);
        formData.add("grant_type", "authorization_code");
        formData.add("redirect_uri", settings.redirectUri());
        return post(formData, "exchange authorization code");
    }

    public TokenResponse refresh(String refreshToken) throws AuthenticationException {
        MultiValueMap<String, String> formData = new LinkedMultiValueMap<>();
        formData.add("client_id", settings.clientId());
        formData.add("client_secret", settings.clientSecret());
        formData.add("refresh_token", refreshToken);
        formData.add("grant_type", "refresh_token");
        return post(formData, "refresh access token");
    }

    private TokenResponse post(MultiValueMap<String, String> formData, String action) throws AuthenticationException {
        TokenResponse response;
        try {
            response = webClient.post()
                    .uri(settings.tokenUrl())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(BodyInserters.fromFormData(formData))
                    .retrieve()
                    .bodyToMono(TokenResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            log.error("Token endpoint refused to {}: {} - {}", action, e.getStatusCode(), e.getResponseBodyAsString());
            throw new AuthenticationException("Failed to " + action + ": " + e.getStatusCode(),
                    e.getStatusCode().is5xxServerError(), e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            log.error("Token endpoint unreachable while trying to {}: {}", action, cause.toString());
            throw new AuthenticationException("Failed to " + action + ": " + cause.getMessage(), true, cause);
        }

        if (response == null || response.getAccessToken() == null || response.getAccessToken().isBlank()) {
            throw new AuthenticationException("Token endpoint returned no access token", false);
        }
        return response;
    }
}
