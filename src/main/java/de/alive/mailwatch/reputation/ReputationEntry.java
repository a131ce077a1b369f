package de.alive.mailwatch.reputation;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * One configured sender: an exact address or an {@code @domain} wildcard.
 */
public record ReputationEntry(@NotNull String value, @NotNull MatchKind kind, @NotNull ReputationTag tag) {

    public enum MatchKind {
        EXACT_ADDRESS,
        DOMAIN
    }

    public static ReputationEntry parse(String raw, ReputationTag tag) {
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty() || normalized.equals("@")) {
            throw new IllegalArgumentException("Empty " + tag.listName() + " sender entry");
        }
        int at = normalized.indexOf('@');
        if (at < 0 || at != normalized.lastIndexOf('@') || at == normalized.length() - 1) {
            throw new IllegalArgumentException("Invalid " + tag.listName() + " sender entry '" + raw.trim()
                    + "': expected name@domain or @domain");
        }
        if (at == 0) {
            return new ReputationEntry(normalized.substring(1), MatchKind.DOMAIN, tag);
        }
        return new ReputationEntry(normalized, MatchKind.EXACT_ADDRESS, tag);
    }

    public String display() {
        return kind == MatchKind.DOMAIN ? "@" + value : value;
    }
}
