package com.sparky.suppress.model;

/**
 * Deduplication key. The same recipient with a different (or missing) type is a different entry.
 */
public record IdentityKey(String recipient, SuppressionType type) {}
