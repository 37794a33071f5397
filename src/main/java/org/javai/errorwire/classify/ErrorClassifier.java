package org.javai.errorwire.classify;

import org.javai.errorwire.ClassifiedError;

/**
 * Classifies arbitrary errors into their public wire shape.
 * Implementations must be total: every non-null error classifies to something.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * Classifies an error into a ClassifiedError.
     *
     * @param error The error raised by a handler
     * @return The classified error, never null
     */
    ClassifiedError classify(Throwable error);
}
