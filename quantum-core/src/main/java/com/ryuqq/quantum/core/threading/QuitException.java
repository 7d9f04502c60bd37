package com.ryuqq.quantum.core.threading;

/**
 * Reports that an exclusively owned execution resource could not be released on quit.
 *
 * @author Quantum Team
 * @since 1.0.0
 */
public class QuitException extends RuntimeException {

    public QuitException(String message, Throwable cause) {
        super(message, cause);
    }
}
