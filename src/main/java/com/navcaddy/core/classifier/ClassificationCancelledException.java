package com.navcaddy.core.classifier;

import java.util.concurrent.CancellationException;

/**
 * Thrown when a classification is abandoned because a newer utterance superseded it.
 * No result is produced and no session state may be touched after this is raised.
 */
public class ClassificationCancelledException extends CancellationException {

    public ClassificationCancelledException(String message) {
        super(message);
    }
}
