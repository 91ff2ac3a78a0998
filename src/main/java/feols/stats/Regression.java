package feols.stats;

import org.apache.commons.math3.linear.RealVector;

/**
 * One OLS solution, for the dependent-variable column {@code index}.
 * Vectors are copied on the way in and out; instances never change.
 */
public final class Regression {

    private final int index;
    private final String depvar;
    private final RealVector y;
    private final RealVector betaHat;
    private final RealVector fitted;
    private final RealVector residual;

    Regression(int index, String depvar, RealVector y, RealVector betaHat, RealVector fitted, RealVector residual) {
        this.index = index;
        this.depvar = depvar;
        this.y = y.copy();
        this.betaHat = betaHat.copy();
        this.fitted = fitted.copy();
        this.residual = residual.copy();
    }

    public int getIndex() { return index; }
    public String getDepvar() { return depvar; }

    /** The outcome that was fitted (demeaned when the model has fixed effects). */
    public RealVector getY() { return y.copy(); }
    public RealVector getBetaHat() { return betaHat.copy(); }
    public RealVector getFitted() { return fitted.copy(); }
    public RealVector getResidual() { return residual.copy(); }
}
