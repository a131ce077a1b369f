package de.alive.mailwatch.service;

import de.alive.mailwatch.domain.ClassificationResult;
import de.alive.mailwatch.exception.ClassificationException;
import org.jetbrains.annotations.NotNull;

public interface Classifier {

    /**
     * @param formattedText headers, links and body as rendered by the parser
     * @throws ClassificationException if the service is unreachable or its answer is not usable
     */
    @NotNull ClassificationResult classify(@NotNull String formattedText) throws ClassificationException;
}
