package org.streamingml.statespace;

// Raised for invalid model orders or malformed coefficient vectors.
// This is a configuration error: it aborts the run and is never retried.
public class ConstructionException extends IllegalArgumentException {

    public ConstructionException(String message) {
        super(message);
    }

    public ConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
