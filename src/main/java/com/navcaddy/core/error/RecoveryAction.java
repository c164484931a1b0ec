package com.navcaddy.core.error;

/**
 * What the UI should offer the user after a failure.
 */
public enum RecoveryAction {
    RETRY,
    REPHRASE,
    START_ROUND,
    NONE
}
