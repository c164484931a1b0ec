package com.navcaddy.core.normalizer;

/**
 * A single rewrite applied while normalizing input.
 */
public record Modification(
    ModificationType type,
    String original,
    String replacement
) {}
