package de.alive.mailwatch.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffTest {

    @Test
    @DisplayName("Delay doubles up to the cap and resets to the initial value")
    void testDoublingCapAndReset() {
        Backoff backoff = new Backoff(Duration.ofSeconds(5), Duration.ofSeconds(300));

        assertThat(backoff.current()).isEqualTo(Duration.ofSeconds(5));
        assertThat(backoff.escalate()).isEqualTo(Duration.ofSeconds(10));
        assertThat(backoff.escalate()).isEqualTo(Duration.ofSeconds(20));
        assertThat(backoff.escalate()).isEqualTo(Duration.ofSeconds(40));
        assertThat(backoff.escalate()).isEqualTo(Duration.ofSeconds(80));
        assertThat(backoff.escalate()).isEqualTo(Duration.ofSeconds(160));
        assertThat(backoff.escalate()).isEqualTo(Duration.ofSeconds(300));
        assertThat(backoff.escalate()).isEqualTo(Duration.ofSeconds(300));

        backoff.reset();
        assertThat(backoff.current()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Cap below the initial delay is rejected")
    void testInvalidBounds() {
        assertThatThrownBy(() -> new Backoff(Duration.ofSeconds(10), Duration.ofSeconds(5)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
