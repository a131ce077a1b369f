package de.alive.mailwatch.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.alive.mailwatch.util.AtomicFiles;
import de.alive.mailwatch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Owner-only JSON file holding the current {@link StoredToken}.
 */
@Slf4j
public class TokenStore {

    public static final String FILE_NAME = "oauth_tokens.json";

    private final Path file;
    private final ObjectMapper objectMapper;

    public TokenStore(@NotNull Path dataDirectory, @NotNull ObjectMapper objectMapper) {
        this.file = dataDirectory.resolve(FILE_NAME);
        this.objectMapper = objectMapper;
    }

    public Optional<StoredToken> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            StoredToken token = objectMapper.readValue(file.toFile(), StoredToken.class);
            if (token == null || token.accessToken() == null || token.accessToken().isBlank()) {
                log.warn("{} Token file {} holds no access token - re-authentication required",
                        LogUtils.WARNING_EMOJI, file);
                return Optional.empty();
            }
            log.info("{} Tokens loaded from {}", LogUtils.KEY_EMOJI, file);
            return Optional.of(token);
        } catch (IOException | RuntimeException e) {
            log.warn("{} Could not read token file {}: {} - re-authentication required",
                    LogUtils.WARNING_EMOJI, file, e.getMessage());
            return Optional.empty();
        }
    }

    public void save(@NotNull StoredToken token) throws IOException {
        AtomicFiles.writeOwnerOnly(file, objectMapper.writeValueAsBytes(token));
        log.info("{} Tokens saved to {}", LogUtils.KEY_EMOJI, file);
    }

    public void delete() throws IOException {
        if (Files.deleteIfExists(file)) {
            log.info("{} Token file {} deleted", LogUtils.KEY_EMOJI, file);
        }
    }

    public Path getFile() {
        return file;
    }
}
