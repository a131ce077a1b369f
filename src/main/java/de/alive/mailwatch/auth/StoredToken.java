package de.alive.mailwatch.auth;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * The persisted OAuth2 credential: access token, optional refresh token and absolute expiry.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoredToken(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") @Nullable String refreshToken,
        @JsonProperty("expires_at") @Nullable Instant expiresAt,
        @JsonProperty("token_type") @Nullable String tokenType,
        @JsonProperty("scope") @Nullable String scope
) {

    @JsonIgnore
    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    /**
     * @return true if the token has less than {@code margin} left at {@code now}; tokens without expiry never expire
     */
    public boolean expiresWithin(Duration margin, Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt.minus(margin));
    }

    public StoredToken expired(Instant now) {
        return new StoredToken(accessToken, refreshToken, now, tokenType, scope);
    }

    @Override
    public String toString() {
        return "StoredToken{expiresAt=" + expiresAt + ", refreshable=" + hasRefreshToken() + "}";
    }
}
