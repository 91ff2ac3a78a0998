package feols.stats;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * se = √diag(V), t = β̂ / se, p = 2·(1 − Φ(|t|)).
 * <p>
 * p-values and confidence bounds use the standard normal distribution, not Student's t.
 */
public class InferenceReporter {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0, 1);

    private final double level;

    public InferenceReporter() {
        this(0.95);
    }

    /** @param level confidence level of the reported intervals, in (0, 1) */
    public InferenceReporter(double level) {
        if (!(level > 0 && level < 1)) throw new IllegalArgumentException("level must be in (0, 1): " + level);
        this.level = level;
    }

    public InferenceResult infer(Regression regression, VcovResult vcov) {
        if (regression.getIndex() != vcov.getRegressionIndex()) {
            throw new IllegalArgumentException("vcov belongs to regression " + vcov.getRegressionIndex()
                + ", not " + regression.getIndex());
        }
        RealVector beta = regression.getBetaHat();
        RealMatrix V = vcov.getVcov();
        int k = beta.getDimension();
        double z = STANDARD_NORMAL.inverseCumulativeProbability(1 - (1 - level) / 2);

        double[] se = new double[k];
        double[] tstat = new double[k];
        double[] pvalue = new double[k];
        double[] lower = new double[k];
        double[] upper = new double[k];
        for (int j = 0; j < k; j++) {
            se[j] = Math.sqrt(V.getEntry(j, j));
            tstat[j] = beta.getEntry(j) / se[j];
            pvalue[j] = 2 * (1 - STANDARD_NORMAL.cumulativeProbability(Math.abs(tstat[j])));
            lower[j] = beta.getEntry(j) - z * se[j];
            upper[j] = beta.getEntry(j) + z * se[j];
        }
        return new InferenceResult(se, tstat, pvalue, lower, upper, level);
    }

    public double getLevel() { return level; }
}
