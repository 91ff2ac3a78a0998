package feols.stats;

/** Standard errors, t statistics, p-values and confidence bounds, one entry per coefficient. */
public final class InferenceResult {

    private final double[] se;
    private final double[] tstat;
    private final double[] pvalue;
    private final double[] confLower;
    private final double[] confUpper;
    private final double level;

    InferenceResult(double[] se, double[] tstat, double[] pvalue, double[] confLower, double[] confUpper, double level) {
        this.se = se;
        this.tstat = tstat;
        this.pvalue = pvalue;
        this.confLower = confLower;
        this.confUpper = confUpper;
        this.level = level;
    }

    public double[] getSe() { return se.clone(); }
    public double[] getTstat() { return tstat.clone(); }
    public double[] getPvalue() { return pvalue.clone(); }
    public double[] getConfLower() { return confLower.clone(); }
    public double[] getConfUpper() { return confUpper.clone(); }

    /** Confidence level of the bounds, e.g. 0.95. */
    public double getLevel() { return level; }
}
