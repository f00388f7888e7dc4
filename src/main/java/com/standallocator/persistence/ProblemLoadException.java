package com.standallocator.persistence;

/**
 * A problem document could not be read or does not describe a valid problem.
 */
public class ProblemLoadException extends Exception {

    public ProblemLoadException(String message) {
        super(message);
    }

    public ProblemLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
