package feols.stats;

import org.apache.commons.math3.linear.RealMatrix;

/** K x K covariance matrix of one regression under one {@link VcovSpec}. */
public final class VcovResult {

    private final int regressionIndex;
    private final VcovSpec spec;
    private final RealMatrix vcov;
    private final double correction;
    private final int clusters;

    VcovResult(int regressionIndex, VcovSpec spec, RealMatrix vcov, double correction, int clusters) {
        this.regressionIndex = regressionIndex;
        this.spec = spec;
        this.vcov = vcov.copy();
        this.correction = correction;
        this.clusters = clusters;
    }

    public int getRegressionIndex() { return regressionIndex; }
    public VcovSpec getSpec() { return spec; }
    public RealMatrix getVcov() { return vcov.copy(); }

    /** Small-sample correction applied to the matrix (1 where none applies). */
    public double getCorrection() { return correction; }

    /** Number of clusters G, 0 for unclustered types. */
    public int getClusters() { return clusters; }
}
