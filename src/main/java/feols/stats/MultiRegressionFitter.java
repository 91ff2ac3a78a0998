package feols.stats;

import feols.formula.NamedMatrix;
import org.apache.commons.math3.linear.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordinary Least Squares for several dependent variables sharing one regressor matrix.
 * <p>
 * Closed-form solution (normal equation): β̂ₘ = (X'X)⁻¹X'yₘ
 * <p>
 * {@code (X'X)⁻¹} is computed once and reused for every column of Y.
 */
public class MultiRegressionFitter {

    private static final Logger LOG = LoggerFactory.getLogger(MultiRegressionFitter.class);

    /**
     * @param x        N x K regressors (full column rank)
     * @param y        N x M outcomes
     * @param hasFixef whether x and y are fixed-effect demeaned
     * @throws PreconditionViolationException if X'X is singular
     */
    public FitResult fit(NamedMatrix x, NamedMatrix y, boolean hasFixef) {
        if (x == null || y == null || x.rows() != y.rows() || x.rows() == 0) {
            throw new IllegalArgumentException("X and Y must be non-null, same length, and non-empty");
        }
        RealMatrix Xm = x.toRealMatrix();
        RealMatrix Ym = y.toRealMatrix();

        RealMatrix Xt = Xm.transpose();
        RealMatrix XtX = Xt.multiply(Xm);
        DecompositionSolver solver = new LUDecomposition(XtX).getSolver();
        if (!solver.isNonSingular()) {
            throw new PreconditionViolationException(
                "Regressor matrix is rank deficient; X'X is singular for columns " + x.getNames());
        }
        RealMatrix tXXinv = solver.getInverse();

        List<Regression> regressions = new ArrayList<>(y.columns());
        for (int m = 0; m < y.columns(); m++) {
            RealVector ym = Ym.getColumnVector(m);
            RealVector beta = tXXinv.operate(Xt.operate(ym));
            RealVector fitted = Xm.operate(beta);
            RealVector residual = ym.subtract(fitted);
            regressions.add(new Regression(m, y.getNames().get(m), ym, beta, fitted, residual));
        }
        LOG.debug("Fitted {} regression(s) on N={}, K={}", regressions.size(), x.rows(), x.columns());
        return new FitResult(Xm, tXXinv, x.getNames(), regressions, hasFixef);
    }
}
