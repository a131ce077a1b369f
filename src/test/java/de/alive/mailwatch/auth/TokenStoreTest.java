package de.alive.mailwatch.auth;

import de.alive.mailwatch.util.JsonMapperFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TokenStoreTest {

    @TempDir
    Path dataDirectory;

    @Test
    @DisplayName("Saved token is read back with its absolute expiry")
    void testSaveAndLoad() throws Exception {
        TokenStore store = new TokenStore(dataDirectory, JsonMapperFactory.create());
        Instant expiry = Instant.parse("2026-01-05T11:00:00Z");

        store.save(new StoredToken("access", "refresh", expiry, "Bearer", "mail"));

        StoredToken loaded = new TokenStore(dataDirectory, JsonMapperFactory.create()).load().orElseThrow();
        assertThat(loaded.accessToken()).isEqualTo("access");
        assertThat(loaded.refreshToken()).isEqualTo("refresh");
        assertThat(loaded.expiresAt()).isEqualTo(expiry);
        assertThat(Files.readString(store.getFile())).contains("\"expires_at\"").contains("\"access_token\"");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("Token file is readable by the owner only")
    void testOwnerOnlyPermissions() throws Exception {
        TokenStore store = new TokenStore(dataDirectory, JsonMapperFactory.create());
        store.save(new StoredToken("access", null, null, null, null));

        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(store.getFile())))
                .isEqualTo("rw-------");
    }

    @Test
    @DisplayName("Corrupt token file means re-authentication, not a crash")
    void testCorruptFile() throws Exception {
        Files.write(dataDirectory.resolve(TokenStore.FILE_NAME), "not json".getBytes(StandardCharsets.UTF_8));

        assertThat(new TokenStore(dataDirectory, JsonMapperFactory.create()).load()).isEmpty();
    }
}
