package feols.stats;

/** Fit quality of one regression. */
public final class PerformanceResult {

    private final double rSquared;
    private final double adjustedRSquared;

    PerformanceResult(double rSquared, double adjustedRSquared) {
        this.rSquared = rSquared;
        this.adjustedRSquared = adjustedRSquared;
    }

    /** R² of the fitted outcome; a within R² when the model has fixed effects. */
    public double getRSquared() { return rSquared; }
    public double getAdjustedRSquared() { return adjustedRSquared; }
}
