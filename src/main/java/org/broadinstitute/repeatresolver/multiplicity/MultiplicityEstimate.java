package org.broadinstitute.repeatresolver.multiplicity;

import org.broadinstitute.repeatresolver.utils.param.ParamUtils;

/**
 * Expected copy number of an edge, the number of supporting reads a traversal of it needs before it is accepted,
 * and how confident the estimator is that the edge is real.
 */
public final class MultiplicityEstimate {
    private final int copyNumber;
    private final int supportThreshold;
    private final double confidence;

    public MultiplicityEstimate( final int copyNumber, final int supportThreshold, final double confidence ) {
        this.copyNumber = ParamUtils.isPositive(copyNumber, "copy number must be positive");
        this.supportThreshold = ParamUtils.isPositive(supportThreshold, "support threshold must be positive");
        this.confidence = ParamUtils.inRange(confidence, 0.0, 1.0, "confidence must lie in [0, 1]");
    }

    public int getCopyNumber() { return copyNumber; }
    public int getSupportThreshold() { return supportThreshold; }
    public double getConfidence() { return confidence; }

    @Override public String toString() {
        return "x" + copyNumber + " (threshold " + supportThreshold + ", confidence " + confidence + ")";
    }
}
