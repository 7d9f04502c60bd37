package com.ryuqq.quantum.core.future;

/**
 * Thrown when waiting on a job whose reducer or action raised an exception.
 *
 * @author Quantum Team
 * @since 1.0.0
 */
public class CycleFailedException extends RuntimeException {

    public CycleFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
