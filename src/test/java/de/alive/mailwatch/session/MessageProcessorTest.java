package de.alive.mailwatch.session;

import de.alive.mailwatch.domain.ClassificationResult;
import de.alive.mailwatch.exception.ClassificationException;
import de.alive.mailwatch.exception.MailConnectionException;
import de.alive.mailwatch.exception.MailConnectionException.ConnectionStage;
import de.alive.mailwatch.infrastructure.EmailContentExtractor;
import de.alive.mailwatch.infrastructure.MailTransport;
import de.alive.mailwatch.ledger.ProcessedMessageLedger;
import de.alive.mailwatch.reputation.SenderReputationFilter;
import de.alive.mailwatch.service.Classifier;
import de.alive.mailwatch.service.Notifier;
import de.alive.mailwatch.service.config.ReputationSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MessageProcessorTest {

    private static final byte[] PHISH = FakeMailTransport.message(
            "Bank <security@bank-login.example>", "Account locked", "Unlock at https://bank-login.example/unlock");

    @Mock
    private MailTransport transport;

    @Mock
    private Classifier classifier;

    @Mock
    private Notifier notifier;

    @Mock
    private ProcessedMessageLedger ledger;

    private MessageProcessor processor(String moveDestination) {
        return new MessageProcessor(new EmailContentExtractor(),
                new SenderReputationFilter(new ReputationSettings(List.of("@evil.example"), List.of())),
                classifier, notifier, ledger, "INBOX", moveDestination);
    }

    @Test
    @DisplayName("Classifier text carries the headers and links of the message")
    void testClassifierInput() throws Exception {
        when(transport.fetchRaw(1)).thenReturn(Optional.of(PHISH));
        when(classifier.classify(anyString())).thenReturn(new ClassificationResult("phishing", "fake bank", "Delete it"));

        Optional<ClassificationResult> result = processor(null).process(transport, 1);

        assertThat(result).map(ClassificationResult::isPhishing).contains(true);
        verify(classifier).classify(contains("Subject: Account locked"));
        verify(classifier).classify(contains("URLs: https://bank-login.example/unlock"));
        verify(notifier).notify("Bank <security@bank-login.example>", "Account locked", result.get());
        verify(ledger).markProcessed(1);
        verify(transport, never()).move(anyLong(), anyString());
    }

    @Test
    @DisplayName("Message without usable content is marked processed and skipped")
    void testMissingContent() throws Exception {
        when(transport.fetchRaw(2)).thenReturn(Optional.empty());

        assertThat(processor(null).process(transport, 2)).isEmpty();

        verify(ledger).markProcessed(2);
        verifyNoInteractions(classifier, notifier);
    }

    @Test
    @DisplayName("Unparseable bytes are marked processed without classification")
    void testMalformedMessage() throws Exception {
        when(transport.fetchRaw(3)).thenReturn(Optional.of(new byte[]{'\r', '\n'}));

        assertThat(processor(null).process(transport, 3)).isEmpty();

        verify(ledger).markProcessed(3);
        verifyNoInteractions(classifier, notifier);
    }

    @Test
    @DisplayName("Classifier failure still marks the message processed and sends nothing")
    void testClassifierFailure() throws Exception {
        when(transport.fetchRaw(4)).thenReturn(Optional.of(PHISH));
        when(classifier.classify(anyString())).thenThrow(new ClassificationException("timeout"));

        assertThat(processor("Junk").process(transport, 4)).isEmpty();

        verify(ledger).markProcessed(4);
        verifyNoInteractions(notifier);
        verify(transport, never()).move(anyLong(), anyString());
    }

    @Test
    @DisplayName("Unexpected notifier error does not escape and the message is still recorded")
    void testNotifierFailure() throws Exception {
        when(transport.fetchRaw(5)).thenReturn(Optional.of(PHISH));
        when(classifier.classify(anyString())).thenReturn(new ClassificationResult("legitimate", "ok", ""));
        doThrow(new IllegalStateException("broken")).when(notifier).notify(anyString(), anyString(), any());

        processor(null).process(transport, 5);

        verify(ledger).markProcessed(5);
    }

    @Test
    @DisplayName("Phishing is moved when a destination folder is configured")
    void testMovePhishing() throws Exception {
        when(transport.fetchRaw(6)).thenReturn(Optional.of(PHISH));
        when(classifier.classify(anyString())).thenReturn(new ClassificationResult("Phishing", "fake", "Delete"));

        processor("Junk").process(transport, 6);

        verify(ledger).markProcessed(6);
        verify(transport).move(6, "Junk");
    }

    @Test
    @DisplayName("Legitimate mail is never moved")
    void testNoMoveForLegitimate() throws Exception {
        when(transport.fetchRaw(7)).thenReturn(Optional.of(PHISH));
        when(classifier.classify(anyString())).thenReturn(new ClassificationResult("legitimate", "ok", ""));

        processor("Junk").process(transport, 7);

        verify(transport, never()).move(anyLong(), anyString());
    }

    @Test
    @DisplayName("Move failure is logged only")
    void testMoveFailure() throws Exception {
        byte[] raw = FakeMailTransport.message("x@evil.example", "Prize", "You won");
        when(transport.fetchRaw(8)).thenReturn(Optional.of(raw));
        doThrow(new MailConnectionException("no such folder", ConnectionStage.CONFIGURATION_ERROR))
                .when(transport).move(8, "Junk");

        Optional<ClassificationResult> result = processor("Junk").process(transport, 8);

        assertThat(result).map(ClassificationResult::isPhishing).contains(true);
        verify(ledger).markProcessed(8);
        verifyNoInteractions(classifier);
    }

    @Test
    @DisplayName("Unexpected move error is logged and does not end the session")
    void testMoveRuntimeFailure() throws Exception {
        byte[] raw = FakeMailTransport.message("y@evil.example", "Invoice", "Pay now");
        when(transport.fetchRaw(10)).thenReturn(Optional.of(raw));
        doThrow(new IllegalStateException("folder closed")).when(transport).move(10, "Junk");

        Optional<ClassificationResult> result = processor("Junk").process(transport, 10);

        assertThat(result).map(ClassificationResult::isPhishing).contains(true);
        verify(ledger).markProcessed(10);
    }

    @Test
    @DisplayName("Lost connection during fetch propagates and leaves the message unrecorded")
    void testFetchConnectionLoss() throws Exception {
        when(transport.fetchRaw(9)).thenThrow(new MailConnectionException("reset", ConnectionStage.CONNECTION_LOST));

        assertThatThrownBy(() -> processor(null).process(transport, 9))
                .isInstanceOf(MailConnectionException.class);
        verify(ledger, never()).markProcessed(anyLong());
    }
}
