package org.streamingml.statespace;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LikelihoodEvaluatorTest {

    private final LikelihoodEvaluator evaluator = new LikelihoodEvaluator();

    @Test
    void profilesTheNoiseVarianceOutOfTheLikelihood() {
        InnovationSequence innovations = InnovationSequence.of(new double[]{1.0, 2.0}, new double[]{1.0, 2.0});

        double sigma2 = evaluator.profiledVariance(innovations);
        double nll = evaluator.negativeLogLikelihood(innovations);

        assertEquals(1.5, sigma2, 1e-15);
        double expected = 0.5 * (2 * Math.log(2 * Math.PI) + 2 * Math.log(1.5) + Math.log(2.0) + 2);
        assertEquals(expected, nll, 1e-12);
    }

    @Test
    void scalingInnovationsOnlyShiftsTheLikelihood() {
        double[] e = {0.3, -1.2, 0.7, 0.1};
        double[] r = {2.0, 1.1, 1.0, 1.0};
        double[] scaled = new double[e.length];
        for (int t = 0; t < e.length; t++) {
            scaled[t] = 10.0 * e[t];
        }

        double base = evaluator.negativeLogLikelihood(InnovationSequence.of(e, r));
        double shifted = evaluator.negativeLogLikelihood(InnovationSequence.of(scaled, r));

        assertEquals(e.length * Math.log(10.0), shifted - base, 1e-9);
    }

    @Test
    void zeroResidualsAreOutsideTheDomain() {
        InnovationSequence perfect = InnovationSequence.of(new double[]{0.0, 0.0, 0.0}, new double[]{1.0, 1.0, 1.0});

        assertThrows(LikelihoodDomainException.class, () -> evaluator.negativeLogLikelihood(perfect));
    }

    @Test
    void nonPositiveVarianceIsOutsideTheDomain() {
        InnovationSequence broken = InnovationSequence.of(new double[]{1.0, 1.0}, new double[]{1.0, 0.0});
        InnovationSequence negative = InnovationSequence.of(new double[]{1.0, 1.0}, new double[]{-1.0, 1.0});

        assertThrows(LikelihoodDomainException.class, () -> evaluator.negativeLogLikelihood(broken));
        assertThrows(LikelihoodDomainException.class, () -> evaluator.profiledVariance(negative));
    }

    @Test
    void emptySequenceIsOutsideTheDomain() {
        InnovationSequence empty = InnovationSequence.of(new double[0], new double[0]);

        assertThrows(LikelihoodDomainException.class, () -> evaluator.negativeLogLikelihood(empty));
    }

    @Test
    void overflowingResidualsAreOutsideTheDomain() {
        InnovationSequence huge = InnovationSequence.of(new double[]{1e200, 1e200}, new double[]{1.0, 1.0});

        assertThrows(LikelihoodDomainException.class, () -> evaluator.negativeLogLikelihood(huge));
    }
}
