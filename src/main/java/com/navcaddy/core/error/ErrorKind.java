package com.navcaddy.core.error;

/**
 * Failure categories surfaced by the conversation pipeline.
 */
public enum ErrorKind {
    /** Blank input; no model call was made. */
    INPUT_EMPTY(false, RecoveryAction.REPHRASE),
    CLASSIFICATION_TIMEOUT(true, RecoveryAction.RETRY),
    CLASSIFICATION_NETWORK_FAILURE(true, RecoveryAction.RETRY),
    /** The model reply could not be read as a classification. */
    INVALID_MODEL_RESPONSE(true, RecoveryAction.RETRY),
    /** Out-of-range data; recovered locally wherever possible. */
    VALIDATION_ERROR(true, RecoveryAction.REPHRASE),
    /** A routed action needed an active round. */
    NO_ACTIVE_SESSION(true, RecoveryAction.START_ROUND),
    UNKNOWN(true, RecoveryAction.RETRY);

    private final boolean retryable;
    private final RecoveryAction defaultRecovery;

    ErrorKind(boolean retryable, RecoveryAction defaultRecovery) {
        this.retryable = retryable;
        this.defaultRecovery = defaultRecovery;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public RecoveryAction defaultRecovery() {
        return defaultRecovery;
    }
}
