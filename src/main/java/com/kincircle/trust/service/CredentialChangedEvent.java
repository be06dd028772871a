package com.kincircle.trust.service;

/**
 * Published after a credential is created, replaced, migrated or deleted.
 */
public record CredentialChangedEvent(String principalId, boolean enrolled) {
}
