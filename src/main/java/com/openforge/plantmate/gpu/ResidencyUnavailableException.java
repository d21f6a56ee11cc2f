package com.openforge.plantmate.gpu;

/**
 * A residency could not be granted: the slot stayed busy past the caller's
 * budget, the caller was interrupted, or loading the model failed.
 */
public class ResidencyUnavailableException extends RuntimeException {

    public ResidencyUnavailableException(String message) {
        super(message);
    }

    public ResidencyUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
