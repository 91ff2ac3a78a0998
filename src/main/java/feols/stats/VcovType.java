package feols.stats;

/** Covariance estimators. */
public enum VcovType {
    IID(false),
    HC1(false),
    HC2(false),
    HC3(false),
    CRV1(true),
    CRV3(true);

    private final boolean clustered;

    VcovType(boolean clustered) {
        this.clustered = clustered;
    }

    public boolean isClustered() { return clustered; }
}
