package io.buildunion.factcore.projectload;

import io.buildunion.factcore.citation.CitationLedger;
import java.time.Instant;
import java.util.UUID;

/** State held for one member's open view of a project between an explicit load and expiry. */
public record ProjectSession(
    UUID sessionId,
    UUID projectId,
    UUID memberId,
    boolean owner,
    CitationLedger ledger,
    TaskMirror tasks,
    PendingChangeMirror pendingChanges,
    Instant openedAt) {}
