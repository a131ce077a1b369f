package de.alive.mailwatch.reputation;

import de.alive.mailwatch.domain.ClassificationResult;

public record ReputationVerdict(ReputationTag tag, String reason) {

    public String label() {
        return tag.label();
    }

    public ClassificationResult toClassificationResult() {
        return new ClassificationResult(tag.label(), reason, "");
    }
}
