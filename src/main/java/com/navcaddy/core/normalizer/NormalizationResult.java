package com.navcaddy.core.normalizer;

import java.util.List;

/**
 * @param originalInput   text as received
 * @param normalizedInput canonical text sent to classification
 * @param modifications   rewrites in the order they were applied
 */
public record NormalizationResult(
    String originalInput,
    String normalizedInput,
    List<Modification> modifications
) {

    public NormalizationResult {
        modifications = List.copyOf(modifications);
    }

    public static NormalizationResult unchanged(String input) {
        return new NormalizationResult(input, input, List.of());
    }

    public boolean wasModified() {
        return !modifications.isEmpty() || !normalizedInput.equals(originalInput);
    }
}
