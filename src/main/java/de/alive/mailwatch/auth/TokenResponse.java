package de.alive.mailwatch.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.Instant;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TokenResponse {
    @JsonProperty("access_token")
    private String accessToken;

    @JsonProperty("refresh_token")
    private String refreshToken;

    @JsonProperty("expires_in")
    private Long expiresIn;

    @JsonProperty("token_type")
    private String tokenType;

    private String scope;

    /**
     * Builds the stored credential, keeping {@code previousRefreshToken} when the server did not rotate it.
     */
    public StoredToken toStoredToken(Instant now, String previousRefreshToken) {
        String refresh = refreshToken != null && !refreshToken.isBlank() ? refreshToken : previousRefreshToken;
        Instant expiresAt = expiresIn != null ? now.plusSeconds(expiresIn) : null;
        return new StoredToken(accessToken, refresh, expiresAt, tokenType, scope);
    }
}
