package feols.stats;

import org.apache.commons.math3.linear.RealMatrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything derived for one regression under one covariance specification.
 */
public final class RegressionReport {

    private final Regression regression;
    private final List<String> coefnames;
    private final VcovResult vcov;
    private final InferenceResult inference;
    private final PerformanceResult performance;
    private final int n;
    private final int k;

    RegressionReport(Regression regression, List<String> coefnames, VcovResult vcov,
                     InferenceResult inference, PerformanceResult performance, int n, int k) {
        this.regression = regression;
        this.coefnames = coefnames;
        this.vcov = vcov;
        this.inference = inference;
        this.performance = performance;
        this.n = n;
        this.k = k;
    }

    public int getIndex() { return regression.getIndex(); }
    public String getDepvar() { return regression.getDepvar(); }
    public List<String> getCoefnames() { return coefnames; }
    public int getN() { return n; }
    public int getK() { return k; }

    public Regression getRegression() { return regression; }
    public double[] getBetaHat() { return regression.getBetaHat().toArray(); }
    public double[] getFitted() { return regression.getFitted().toArray(); }
    public double[] getResidual() { return regression.getResidual().toArray(); }

    public VcovResult getVcovResult() { return vcov; }
    public RealMatrix getVcov() { return vcov.getVcov(); }
    public String getVcovLabel() { return vcov.getSpec().describe(); }

    public double[] getSe() { return inference.getSe(); }
    public double[] getTstat() { return inference.getTstat(); }
    public double[] getPvalue() { return inference.getPvalue(); }
    public double[] getConfLower() { return inference.getConfLower(); }
    public double[] getConfUpper() { return inference.getConfUpper(); }

    public double getRSquared() { return performance.getRSquared(); }
    public double getAdjustedRSquared() { return performance.getAdjustedRSquared(); }

    /** Estimate of the named coefficient. */
    public double coef(String name) {
        int j = coefnames.indexOf(name);
        if (j < 0) throw new IllegalArgumentException("No coefficient '" + name + "' in " + coefnames);
        return regression.getBetaHat().getEntry(j);
    }

    /** Coefficient table in regressor order. */
    public List<CoefficientRow> tidy() {
        double[] beta = getBetaHat();
        double[] se = inference.getSe();
        double[] t = inference.getTstat();
        double[] p = inference.getPvalue();
        double[] lo = inference.getConfLower();
        double[] hi = inference.getConfUpper();
        List<CoefficientRow> rows = new ArrayList<>(beta.length);
        for (int j = 0; j < beta.length; j++) {
            rows.add(new CoefficientRow(coefnames.get(j), beta[j], se[j], t[j], p[j], lo[j], hi[j]));
        }
        return Collections.unmodifiableList(rows);
    }
}
