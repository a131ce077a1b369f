package de.alive.mailwatch.reputation;

import de.alive.mailwatch.service.config.ReputationSettings;
import de.alive.mailwatch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Deterministic pre-classification from the static dangerous and safe sender lists.
 * <p>
 * When both lists match, an exact-address match beats a domain match regardless of
 * the list it came from; equally specific matches resolve to dangerous.
 */
@Slf4j
public class SenderReputationFilter {

    private final Map<String, ReputationEntry> dangerousAddresses = new HashMap<>();
    private final Map<String, ReputationEntry> dangerousDomains = new HashMap<>();
    private final Map<String, ReputationEntry> safeAddresses = new HashMap<>();
    private final Map<String, ReputationEntry> safeDomains = new HashMap<>();

    public SenderReputationFilter(@NotNull ReputationSettings settings) {
        register(settings.dangerousSenders(), ReputationTag.DANGEROUS, dangerousAddresses, dangerousDomains);
        register(settings.safeSenders(), ReputationTag.SAFE, safeAddresses, safeDomains);
        log.info("{} Sender lists loaded: {} dangerous, {} safe",
                LogUtils.INFO_EMOJI,
                dangerousAddresses.size() + dangerousDomains.size(),
                safeAddresses.size() + safeDomains.size());
    }

    public Optional<ReputationVerdict> classify(String senderField) {
        String address = extractAddress(senderField);
        if (address.isEmpty()) {
            return Optional.empty();
        }
        String domain = extractDomain(address);

        Optional<ReputationEntry> dangerous = lookup(address, domain, dangerousAddresses, dangerousDomains);
        Optional<ReputationEntry> safe = lookup(address, domain, safeAddresses, safeDomains);

        if (dangerous.isPresent() && safe.isPresent()) {
            return Optional.of(resolveConflict(address, dangerous.get(), safe.get()));
        }
        return dangerous.or(() -> safe).map(this::verdictFor);
    }

    static String extractAddress(String senderField) {
        if (senderField == null) {
            return "";
        }
        String address = senderField;
        int open = senderField.lastIndexOf('<');
        int close = senderField.lastIndexOf('>');
        if (open >= 0 && close > open) {
            address = senderField.substring(open + 1, close);
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }

    static String extractDomain(String address) {
        int at = address.lastIndexOf('@');
        return at >= 0 ? address.substring(at + 1) : "";
    }

    private ReputationVerdict resolveConflict(String address, ReputationEntry dangerous, ReputationEntry safe) {
        ReputationEntry winner;
        if (dangerous.kind() == safe.kind()) {
            winner = dangerous;
        } else {
            winner = dangerous.kind() == ReputationEntry.MatchKind.EXACT_ADDRESS ? dangerous : safe;
        }
        log.warn("{} Sender {} is on both lists (dangerous: {}, safe: {}) - using {}",
                LogUtils.WARNING_EMOJI, address, dangerous.display(), safe.display(), winner.tag().listName());
        return verdictFor(winner);
    }

    private ReputationVerdict verdictFor(ReputationEntry entry) {
        String subject = entry.kind() == ReputationEntry.MatchKind.DOMAIN
                ? "Sender domain " + entry.display()
                : "Sender " + entry.display();
        return new ReputationVerdict(entry.tag(),
                subject + " is on the " + entry.tag().listName() + " senders list");
    }

    private static Optional<ReputationEntry> lookup(String address, String domain,
                                                    Map<String, ReputationEntry> addresses,
                                                    Map<String, ReputationEntry> domains) {
        ReputationEntry exact = addresses.get(address);
        if (exact != null) {
            return Optional.of(exact);
        }
        return domain.isEmpty() ? Optional.empty() : Optional.ofNullable(domains.get(domain));
    }

    private static void register(Collection<String> rawEntries, ReputationTag tag,
                                 Map<String, ReputationEntry> addresses,
                                 Map<String, ReputationEntry> domains) {
        for (String raw : rawEntries) {
            ReputationEntry entry = ReputationEntry.parse(raw, tag);
            if (entry.kind() == ReputationEntry.MatchKind.DOMAIN) {
                domains.put(entry.value(), entry);
            } else {
                addresses.put(entry.value(), entry);
            }
        }
    }
}
