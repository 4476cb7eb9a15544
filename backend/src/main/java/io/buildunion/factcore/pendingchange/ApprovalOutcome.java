package io.buildunion.factcore.pendingchange;

import java.math.BigDecimal;

/**
 * Result of an approval. The coordinator does not modify the underlying item; the caller applies
 * {@code newQuantity} to it as a separate step.
 */
public record ApprovalOutcome(PendingChangeView change, BigDecimal newQuantity) {}
