package de.alive.mailwatch.reputation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReputationEntryTest {

    @Test
    @DisplayName("Leading @ marks a domain entry")
    void testParseDomain() {
        ReputationEntry entry = ReputationEntry.parse(" @Evil.Example ", ReputationTag.DANGEROUS);

        assertThat(entry.kind()).isEqualTo(ReputationEntry.MatchKind.DOMAIN);
        assertThat(entry.value()).isEqualTo("evil.example");
        assertThat(entry.display()).isEqualTo("@evil.example");
    }

    @Test
    @DisplayName("Anything else is an exact address")
    void testParseAddress() {
        ReputationEntry entry = ReputationEntry.parse("Friend@Good.Example", ReputationTag.SAFE);

        assertThat(entry.kind()).isEqualTo(ReputationEntry.MatchKind.EXACT_ADDRESS);
        assertThat(entry.value()).isEqualTo("friend@good.example");
    }

    @Test
    @DisplayName("Empty entries are rejected")
    void testParseEmpty() {
        assertThatThrownBy(() -> ReputationEntry.parse("@", ReputationTag.SAFE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReputationEntry.parse("  ", ReputationTag.DANGEROUS))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Entries missing the name or the domain part are rejected")
    void testParseIncomplete() {
        assertThatThrownBy(() -> ReputationEntry.parse("foo@", ReputationTag.DANGEROUS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("foo@");
        assertThatThrownBy(() -> ReputationEntry.parse("example.com", ReputationTag.SAFE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReputationEntry.parse("@a@b.example", ReputationTag.SAFE))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
