package io.buildunion.factcore.integration.email;

/** Outcome of sending one email. */
public record SendResult(boolean success, String providerMessageId, String errorMessage) {}
