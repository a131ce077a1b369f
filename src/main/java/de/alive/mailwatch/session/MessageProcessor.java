package de.alive.mailwatch.session;

import de.alive.mailwatch.domain.ClassificationResult;
import de.alive.mailwatch.domain.ParsedEmail;
import de.alive.mailwatch.exception.ClassificationException;
import de.alive.mailwatch.exception.EmailProcessingException;
import de.alive.mailwatch.exception.EmailProcessingException.ProcessingStage;
import de.alive.mailwatch.exception.MailConnectionException;
import de.alive.mailwatch.infrastructure.EmailParser;
import de.alive.mailwatch.infrastructure.MailTransport;
import de.alive.mailwatch.ledger.ProcessedMessageLedger;
import de.alive.mailwatch.reputation.ReputationVerdict;
import de.alive.mailwatch.reputation.SenderReputationFilter;
import de.alive.mailwatch.service.Classifier;
import de.alive.mailwatch.service.Notifier;
import de.alive.mailwatch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Runs one message through fetch, parse, sender reputation or classifier, notification and ledger update.
 * <p>
 * A message is recorded as processed however the downstream steps end, so a broken message or an
 * unavailable classifier never causes the same message to be retried. The only failure that escapes
 * is a lost connection during the fetch; the message then stays unprocessed for the next session.
 */
@Slf4j
public class MessageProcessor {

    private final EmailParser parser;
    private final SenderReputationFilter reputationFilter;
    private final Classifier classifier;
    private final Notifier notifier;
    private final ProcessedMessageLedger ledger;
    private final String folder;
    @Nullable
    private final String moveDestination;

    public MessageProcessor(@NotNull EmailParser parser,
                            @NotNull SenderReputationFilter reputationFilter,
                            @NotNull Classifier classifier,
                            @NotNull Notifier notifier,
                            @NotNull ProcessedMessageLedger ledger,
                            @NotNull String folder,
                            @Nullable String moveDestination) {
        this.parser = parser;
        this.reputationFilter = reputationFilter;
        this.classifier = classifier;
        this.notifier = notifier;
        this.ledger = ledger;
        this.folder = folder;
        this.moveDestination = moveDestination;
    }

    /**
     * @return the verdict, or empty if the message was skipped or could not be classified
     * @throws MailConnectionException if the connection dropped while fetching
     */
    public Optional<ClassificationResult> process(@NotNull MailTransport transport, long uid)
            throws MailConnectionException {
        Optional<byte[]> raw = transport.fetchRaw(uid);
        if (raw.isEmpty()) {
            log.warn("{} UID {} has no usable content, marking processed", LogUtils.WARNING_EMOJI, uid);
            ledger.markProcessed(uid);
            return Optional.empty();
        }

        ClassificationResult result = null;
        try {
            ParsedEmail email = parser.parse(raw.get());
            if (ParsedEmail.EMPTY.equals(email)) {
                log.warn("{} UID {} is malformed, marking processed", LogUtils.WARNING_EMOJI, uid);
                return Optional.empty();
            }

            log.info("{} UID {} from {}: '{}'", LogUtils.EMAIL_EMOJI, uid,
                    email.sender(), LogUtils.truncate(email.subject(), 80));

            result = classify(uid, email);
            log.info("{} UID {} classified as {}: {}",
                    result.isPhishing() ? LogUtils.PHISH_EMOJI : LogUtils.SUCCESS_EMOJI,
                    uid, result.classification(), result.reason());

            notifier.notify(email.sender(), email.subject(), result);
        } catch (EmailProcessingException e) {
            logFailure(e);
        } catch (RuntimeException e) {
            log.error("{} UID {} failed unexpectedly: {}", LogUtils.ERROR_EMOJI, uid, e.getMessage(), e);
        } finally {
            ledger.markProcessed(uid);
        }

        if (result != null && result.isPhishing()) {
            try {
                moveIfConfigured(transport, uid);
            } catch (EmailProcessingException e) {
                logFailure(e);
            }
        }
        return Optional.ofNullable(result);
    }

    private ClassificationResult classify(long uid, ParsedEmail email) throws EmailProcessingException {
        Optional<ReputationVerdict> verdict = reputationFilter.classify(email.sender());
        if (verdict.isPresent()) {
            log.info("{} UID {}: {}", LogUtils.SEARCH_EMOJI, uid, verdict.get().reason());
            return verdict.get().toClassificationResult();
        }

        try {
            return classifier.classify(parser.format(email));
        } catch (ClassificationException e) {
            throw new EmailProcessingException("Classification failed: " + e.getMessage(),
                    uid, ProcessingStage.CLASSIFICATION, e);
        }
    }

    private void moveIfConfigured(MailTransport transport, long uid) throws EmailProcessingException {
        if (moveDestination == null) {
            return;
        }
        try {
            transport.move(uid, moveDestination);
            log.info("{} UID {} moved to '{}'", LogUtils.FOLDER_EMOJI, uid, moveDestination);
        } catch (MailConnectionException | RuntimeException e) {
            throw new EmailProcessingException("Move to '" + moveDestination + "' failed: " + e.getMessage(),
                    uid, ProcessingStage.MESSAGE_MOVE, e);
        }
    }

    private void logFailure(EmailProcessingException e) {
        log.error("{} UID {} in '{}' failed at {}: {}", LogUtils.ERROR_EMOJI,
                e.getUid(), folder, e.getStage(), e.getMessage());
    }
}
