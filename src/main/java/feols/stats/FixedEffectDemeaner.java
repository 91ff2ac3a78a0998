package feols.stats;

import feols.formula.DesignMatrices;
import feols.formula.NamedMatrix;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs Y and X through a {@link FixedEffectSolver} in one N x (M+K) block and splits the
 * result back into demeaned outcome and regressor matrices.
 */
public class FixedEffectDemeaner {

    private static final Logger LOG = LoggerFactory.getLogger(FixedEffectDemeaner.class);

    private final FixedEffectSolver solver;

    public FixedEffectDemeaner(FixedEffectSolver solver) {
        if (solver == null) throw new IllegalArgumentException("solver required");
        this.solver = solver;
    }

    /** Returns {@code design} unchanged when it has no fixed effects. */
    public DesignMatrices demean(DesignMatrices design) {
        if (!design.hasFixef()) return design;

        NamedMatrix y = design.getY();
        NamedMatrix x = design.getX();
        int n = design.rowCount();
        int m = y.columns();
        int k = x.columns();

        double[][] yx = new double[n][m + k];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < m; j++) yx[i][j] = y.get(i, j);
            for (int j = 0; j < k; j++) yx[i][m + j] = x.get(i, j);
        }
        LOG.debug("Demeaning {} x {} block on fixed effects {}", n, m + k, design.getFixefNames());
        RealMatrix demeaned = solver.demean(design.getFixef(), new Array2DRowRealMatrix(yx, false));
        if (demeaned.getRowDimension() != n || demeaned.getColumnDimension() != m + k) {
            throw new IllegalStateException("Fixed-effect solver returned a "
                + demeaned.getRowDimension() + " x " + demeaned.getColumnDimension()
                + " matrix, expected " + n + " x " + (m + k));
        }

        NamedMatrix yDemeaned = new NamedMatrix(demeaned.getSubMatrix(0, n - 1, 0, m - 1).getData(), y.getNames());
        NamedMatrix xDemeaned = new NamedMatrix(demeaned.getSubMatrix(0, n - 1, m, m + k - 1).getData(), x.getNames());
        return design.withOutcomeAndRegressors(yDemeaned, xDemeaned);
    }
}
