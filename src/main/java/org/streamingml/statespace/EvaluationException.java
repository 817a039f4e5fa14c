package org.streamingml.statespace;

/**
 * Failure of a single likelihood evaluation. These are local to the evaluation that raised
 * them: the optimizer sees them as an infeasible candidate and moves on.
 */
public abstract class EvaluationException extends RuntimeException {

    protected EvaluationException(String message) {
        super(message);
    }
}
