package de.alive.mailwatch.session;

import de.alive.mailwatch.infrastructure.MailTransport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SessionStateTest {

    @Test
    @DisplayName("Happy path: connect, authenticate, watch, idle and back")
    void testHappyPath() {
        assertThat(SessionState.DISCONNECTED.canTransitionTo(SessionState.CONNECTING)).isTrue();
        assertThat(SessionState.CONNECTING.canTransitionTo(SessionState.AUTHENTICATED)).isTrue();
        assertThat(SessionState.AUTHENTICATED.canTransitionTo(SessionState.WATCHING)).isTrue();
        assertThat(SessionState.WATCHING.canTransitionTo(SessionState.IDLING)).isTrue();
        assertThat(SessionState.IDLING.canTransitionTo(SessionState.WATCHING)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = SessionState.class, names = {"CONNECTING", "AUTHENTICATED", "WATCHING", "IDLING"})
    @DisplayName("Every live state can fail and be torn down")
    void testErrorAndTeardown(SessionState state) {
        assertThat(state.canTransitionTo(SessionState.ERROR)).isTrue();
        assertThat(state.canTransitionTo(SessionState.DISCONNECTED)).isTrue();
    }

    @Test
    @DisplayName("Shortcuts are illegal")
    void testIllegalTransitions() {
        assertThat(SessionState.DISCONNECTED.canTransitionTo(SessionState.WATCHING)).isFalse();
        assertThat(SessionState.DISCONNECTED.canTransitionTo(SessionState.ERROR)).isFalse();
        assertThat(SessionState.CONNECTING.canTransitionTo(SessionState.IDLING)).isFalse();
        assertThat(SessionState.AUTHENTICATED.canTransitionTo(SessionState.IDLING)).isFalse();
        assertThat(SessionState.IDLING.canTransitionTo(SessionState.IDLING)).isFalse();
        assertThat(SessionState.ERROR.canTransitionTo(SessionState.CONNECTING)).isFalse();
        assertThat(SessionState.ERROR.canTransitionTo(SessionState.DISCONNECTED)).isTrue();
    }

    @Test
    @DisplayName("Session rejects illegal transitions and closes its transport")
    void testSessionTransitions() {
        MailTransport transport = mock(MailTransport.class);
        Session session = new Session(1, transport);

        assertThatThrownBy(() -> session.transitionTo(SessionState.IDLING))
                .isInstanceOf(IllegalStateException.class);

        session.transitionTo(SessionState.CONNECTING);
        session.transitionTo(SessionState.ERROR);
        session.close();

        assertThat(session.getState()).isEqualTo(SessionState.DISCONNECTED);
        verify(transport).close();
    }
}
