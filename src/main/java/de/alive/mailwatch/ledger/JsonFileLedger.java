package de.alive.mailwatch.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.alive.mailwatch.util.AtomicFiles;
import de.alive.mailwatch.util.LogUtils;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ledger kept as a JSON document on local disk. Every change rewrites the whole file atomically.
 */
@Slf4j
public class JsonFileLedger implements ProcessedMessageLedger {

    public static final String FILE_NAME = "processed_uids.json";

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Set<Long> processedUids = new HashSet<>();
    private String folder;
    private Long uidValidity;

    public JsonFileLedger(@NotNull Path dataDirectory, @NotNull ObjectMapper objectMapper) {
        this.file = dataDirectory.resolve(FILE_NAME);
        this.objectMapper = objectMapper;
        load();
    }

    @Override
    public boolean isProcessed(long uid) {
        return processedUids.contains(uid);
    }

    @Override
    public void markProcessed(long uid) {
        if (processedUids.add(uid)) {
            save();
        }
    }

    @Override
    public int prune(Set<Long> currentUnseen) {
        Set<Long> stale = new HashSet<>(processedUids);
        stale.removeAll(currentUnseen);
        if (stale.isEmpty()) {
            return 0;
        }
        log.info("{} Removing {} stale UIDs from processed list", LogUtils.PROCESS_EMOJI, stale.size());
        processedUids.removeAll(stale);
        save();
        return stale.size();
    }

    @Override
    public void bindTo(String folder, long uidValidity) {
        if (Objects.equals(this.folder, folder) && Objects.equals(this.uidValidity, uidValidity)) {
            return;
        }
        if (this.folder != null && !processedUids.isEmpty()) {
            log.warn("{} Ledger was built for folder '{}' (UIDVALIDITY {}), now '{}' ({}) - discarding {} entries",
                    LogUtils.WARNING_EMOJI, this.folder, this.uidValidity, folder, uidValidity, processedUids.size());
            processedUids.clear();
        }
        this.folder = folder;
        this.uidValidity = uidValidity;
        save();
    }

    @Override
    public int size() {
        return processedUids.size();
    }

    private void load() {
        if (!Files.exists(file)) {
            log.debug("No ledger file at {}, starting empty", file);
            return;
        }
        try {
            LedgerDocument document = objectMapper.readValue(file.toFile(), LedgerDocument.class);
            if (document == null) {
                throw new IOException("empty document");
            }
            if (document.getProcessedUids() != null) {
                processedUids.addAll(document.getProcessedUids());
            }
            folder = document.getFolder();
            uidValidity = document.getUidValidity();
            log.info("{} Loaded {} processed UIDs from {}", LogUtils.SUCCESS_EMOJI, processedUids.size(), file);
        } catch (IOException | RuntimeException e) {
            log.warn("{} Could not load processed UIDs file {}: {} - starting empty",
                    LogUtils.WARNING_EMOJI, file, e.getMessage());
            processedUids.clear();
            folder = null;
            uidValidity = null;
        }
    }

    private void save() {
        LedgerDocument document = new LedgerDocument();
        document.setFolder(folder);
        document.setUidValidity(uidValidity);
        document.setProcessedUids(new TreeSet<>(processedUids));
        try {
            AtomicFiles.write(file, objectMapper.writeValueAsBytes(document));
            log.debug("Saved {} processed UIDs to {}", processedUids.size(), file);
        } catch (IOException e) {
            log.error("{} Could not save processed UIDs file {}: {}", LogUtils.ERROR_EMOJI, file, e.getMessage());
        }
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LedgerDocument {
        @JsonProperty("folder")
        private String folder;

        @JsonProperty("uid_validity")
        private Long uidValidity;

        @JsonProperty("processed_uids")
        private Set<Long> processedUids;
    }
}
