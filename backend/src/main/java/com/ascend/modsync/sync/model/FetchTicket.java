package com.ascend.modsync.sync.model;

import java.util.concurrent.CompletableFuture;

/**
 * Result of asking the scheduler for a fetch. {@code completion} resolves with the
 * cache record once the attempt this ticket refers to has finished; for outcomes that
 * never reach upstream it is already complete.
 */
public record FetchTicket(
    String key,
    FetchOutcome outcome,
    CompletableFuture<ModRecord> completion
) {
    public boolean admitted() {
        return outcome == FetchOutcome.SUBMITTED;
    }
}
