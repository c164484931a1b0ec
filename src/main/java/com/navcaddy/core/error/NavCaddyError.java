package com.navcaddy.core.error;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import com.navcaddy.core.llm.LlmEmptyResponseException;
import com.navcaddy.core.llm.LlmParseException;

/**
 * A categorised pipeline failure with the recovery the user should be offered.
 *
 * @param kind        failure category
 * @param message     internal description, for logs only
 * @param recoverable whether a retry or follow-up action can succeed
 * @param recovery    action to offer
 * @param cause       underlying exception (nullable)
 */
public record NavCaddyError(
    ErrorKind kind,
    String message,
    boolean recoverable,
    RecoveryAction recovery,
    Throwable cause
) {

    public static NavCaddyError of(ErrorKind kind, String message) {
        return new NavCaddyError(kind, message, kind.isRetryable() || kind == ErrorKind.INPUT_EMPTY,
                kind.defaultRecovery(), null);
    }

    /**
     * Categorises an exception raised while talking to the language model.
     * Wrapper exceptions from futures are unwrapped first.
     */
    public static NavCaddyError fromThrowable(Throwable throwable) {
        Throwable t = unwrap(throwable);
        ErrorKind kind;
        if (t instanceof SocketTimeoutException || t instanceof TimeoutException) {
            kind = ErrorKind.CLASSIFICATION_TIMEOUT;
        } else if (t instanceof UnknownHostException || t instanceof ConnectException
                || t instanceof NoRouteToHostException) {
            kind = ErrorKind.CLASSIFICATION_NETWORK_FAILURE;
        } else if (t instanceof LlmParseException || t instanceof LlmEmptyResponseException) {
            kind = ErrorKind.INVALID_MODEL_RESPONSE;
        } else if (hasNetworkCause(t)) {
            kind = ErrorKind.CLASSIFICATION_NETWORK_FAILURE;
        } else {
            kind = ErrorKind.UNKNOWN;
        }
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        return new NavCaddyError(kind, message, kind.isRetryable(), kind.defaultRecovery(), t);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    // HTTP clients tend to wrap socket failures in their own runtime exceptions
    private static boolean hasNetworkCause(Throwable t) {
        Throwable cause = t.getCause();
        int depth = 0;
        while (cause != null && depth++ < 5) {
            if (cause instanceof UnknownHostException || cause instanceof ConnectException
                    || cause instanceof NoRouteToHostException || cause instanceof SocketTimeoutException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
