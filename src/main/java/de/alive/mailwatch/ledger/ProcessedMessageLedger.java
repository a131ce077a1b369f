package de.alive.mailwatch.ledger;

import java.util.Set;

/**
 * Durable record of the message UIDs that have already been handed to the pipeline.
 */
public interface ProcessedMessageLedger {

    boolean isProcessed(long uid);

    /**
     * Records {@code uid} as processed. Idempotent; the entry is persisted before this returns.
     */
    void markProcessed(long uid);

    /**
     * Drops every entry that is no longer in the live unseen set.
     *
     * @return number of entries removed
     */
    int prune(Set<Long> currentUnseen);

    /**
     * Ties the ledger to a folder and its UIDVALIDITY. Entries recorded against a different
     * folder or validity value are discarded, since their UIDs no longer name the same messages.
     */
    void bindTo(String folder, long uidValidity);

    int size();
}
