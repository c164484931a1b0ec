package com.navcaddy.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * One candidate intent offered to the user during clarification.
 *
 * @param intentType  the intent this suggestion selects
 * @param label       short button label, e.g. "Adjust Club"
 * @param description one-line explanation of what the suggestion does
 */
public record IntentSuggestion(
    IntentType intentType,
    String label,
    String description
) implements Serializable {

    public IntentSuggestion {
        Objects.requireNonNull(intentType, "intentType");
    }
}
