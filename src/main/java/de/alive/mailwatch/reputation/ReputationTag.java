package de.alive.mailwatch.reputation;

import de.alive.mailwatch.domain.ClassificationResult;

public enum ReputationTag {
    DANGEROUS(ClassificationResult.PHISHING, "dangerous"),
    SAFE(ClassificationResult.LEGITIMATE, "safe");

    private final String label;
    private final String listName;

    ReputationTag(String label, String listName) {
        this.label = label;
        this.listName = listName;
    }

    /**
     * @return the classification label a match on this list stands for
     */
    public String label() {
        return label;
    }

    public String listName() {
        return listName;
    }
}
