package com.standallocator.domain;

/**
 * Raised when caller-supplied input cannot describe a valid allocation problem:
 * a shadow window that ends before it starts, a feasibility matrix of the wrong
 * size, an adjacency rule naming an unknown stand, and the like.
 *
 * Always thrown before the solver is invoked.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
