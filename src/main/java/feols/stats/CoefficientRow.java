package feols.stats;

/** One row of a coefficient table: estimate, std. error, t value, Pr(>|t|) and bounds. */
public final class CoefficientRow {

    private final String name;
    private final double estimate;
    private final double stdError;
    private final double tValue;
    private final double pValue;
    private final double lower;
    private final double upper;

    CoefficientRow(String name, double estimate, double stdError, double tValue, double pValue, double lower, double upper) {
        this.name = name;
        this.estimate = estimate;
        this.stdError = stdError;
        this.tValue = tValue;
        this.pValue = pValue;
        this.lower = lower;
        this.upper = upper;
    }

    public String getName() { return name; }
    public double getEstimate() { return estimate; }
    public double getStdError() { return stdError; }
    public double getTValue() { return tValue; }
    public double getPValue() { return pValue; }
    public double getLower() { return lower; }
    public double getUpper() { return upper; }
}
