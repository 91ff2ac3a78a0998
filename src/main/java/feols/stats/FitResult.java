package feols.stats;

import org.apache.commons.math3.linear.RealMatrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Output of {@link MultiRegressionFitter}: the regressor matrix, the shared
 * {@code (X'X)⁻¹} and one {@link Regression} per dependent variable, in column order.
 */
public final class FitResult {

    private final RealMatrix x;
    private final RealMatrix tXXinv;
    private final List<String> coefnames;
    private final List<Regression> regressions;
    private final boolean hasFixef;

    FitResult(RealMatrix x, RealMatrix tXXinv, List<String> coefnames, List<Regression> regressions, boolean hasFixef) {
        this.x = x.copy();
        this.tXXinv = tXXinv.copy();
        this.coefnames = Collections.unmodifiableList(new ArrayList<>(coefnames));
        this.regressions = Collections.unmodifiableList(new ArrayList<>(regressions));
        this.hasFixef = hasFixef;
    }

    /** Number of observations N. */
    public int n() { return x.getRowDimension(); }

    /** Number of regressors K. */
    public int k() { return x.getColumnDimension(); }

    public RealMatrix getX() { return x.copy(); }
    public RealMatrix getTXXinv() { return tXXinv.copy(); }
    public List<String> getCoefnames() { return coefnames; }
    public List<Regression> getRegressions() { return regressions; }
    public Regression getRegression(int index) { return regressions.get(index); }
    public boolean hasFixef() { return hasFixef; }

    // package-private views without copying, for the estimators in this package
    RealMatrix x() { return x; }
    RealMatrix tXXinv() { return tXXinv; }
}
