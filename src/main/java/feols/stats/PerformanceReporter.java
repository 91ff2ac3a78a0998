package feols.stats;

/**
 * R² = 1 − SS_res / SS_tot on the outcome that was actually fitted, and
 * adjusted R² = 1 − (1 − R²)(n − 1)/(n − k).
 */
public class PerformanceReporter {

    public PerformanceResult summarize(Regression regression, int k) {
        double[] y = regression.getY().toArray();
        double[] u = regression.getResidual().toArray();
        int n = y.length;

        double meanY = 0;
        for (double v : y) meanY += v;
        meanY /= n;
        double ssTot = 0, ssRes = 0;
        for (int i = 0; i < n; i++) {
            ssTot += (y[i] - meanY) * (y[i] - meanY);
            ssRes += u[i] * u[i];
        }
        double rSquared = 1.0 - ssRes / ssTot;
        double adjustedRSquared = 1.0 - (1.0 - rSquared) * (n - 1) / (n - k);
        return new PerformanceResult(rSquared, adjustedRSquared);
    }

    public PerformanceResult summarize(FitResult fit, int regressionIndex) {
        return summarize(fit.getRegression(regressionIndex), fit.k());
    }
}
