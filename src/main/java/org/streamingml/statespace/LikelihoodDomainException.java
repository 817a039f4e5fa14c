package org.streamingml.statespace;

// The concentrated likelihood is undefined: the logarithm would be taken of a non-positive value.
public class LikelihoodDomainException extends EvaluationException {

    public LikelihoodDomainException(String message) {
        super(message);
    }
}
