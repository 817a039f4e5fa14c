package org.streamingml.statespace;

public enum FitStatus {
    // The optimizer met its stopping criterion
    CONVERGED,
    // The evaluation or iteration budget ran out first, the reported point is the best one seen
    UNCONVERGED
}
