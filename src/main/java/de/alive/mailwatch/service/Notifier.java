package de.alive.mailwatch.service;

import de.alive.mailwatch.domain.ClassificationResult;
import org.jetbrains.annotations.NotNull;

/**
 * Fire-and-forget delivery of a classification report. Implementations log failures and never throw.
 */
public interface Notifier {

    void notify(@NotNull String sender, @NotNull String subject, @NotNull ClassificationResult result);
}
