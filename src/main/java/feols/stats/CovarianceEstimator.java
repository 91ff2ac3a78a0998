package feols.stats;

import feols.formula.DataTable;
import org.apache.commons.math3.linear.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Covariance matrices of the coefficient estimates of a {@link FitResult}.
 * <p>
 * With u the residuals, hᵢ = xᵢ'(X'X)⁻¹xᵢ the leverage and (n, k) the dimensions of X:
 * <ul>
 *   <li>iid: mean(u²)·(X'X)⁻¹</li>
 *   <li>HC1: n/(n−k) · (X'X)⁻¹ X'diag(uᵢ²)X (X'X)⁻¹</li>
 *   <li>HC2: weights uᵢ²/(1−hᵢ), no correction</li>
 *   <li>HC3: weights uᵢ²/(1−hᵢ)², no correction</li>
 *   <li>CRV1: G/(G−1)·(n−1)/(n−k) · (X'X)⁻¹ (Σ_g s_g s_g') (X'X)⁻¹ with s_g = X_g'u_g</li>
 *   <li>CRV3: (G−1)/G · Σ_g (β̂₍₋g₎ − β̂)(β̂₍₋g₎ − β̂)', the leave-one-cluster-out jackknife</li>
 * </ul>
 * Degenerate inputs (hᵢ = 1, a single cluster) are not guarded and give non-finite values.
 */
public class CovarianceEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(CovarianceEstimator.class);

    private final FitResult fit;
    private final DataTable data;

    /**
     * @param fit  fitted regressions
     * @param data table aligned with the rows of the fit; only read for cluster columns
     *             and may be null when no clustered type is requested
     */
    public CovarianceEstimator(FitResult fit, DataTable data) {
        if (fit == null) throw new IllegalArgumentException("fit required");
        if (data != null && data.rowCount() != fit.n()) {
            throw new IllegalArgumentException("data has " + data.rowCount() + " rows, fit has " + fit.n());
        }
        this.fit = fit;
        this.data = data;
    }

    /** Covariance of every regression under {@code spec}, in regression order. */
    public List<VcovResult> estimateAll(VcovSpec spec) {
        int[] clusters = prepare(spec);
        List<VcovResult> out = new ArrayList<>(fit.getRegressions().size());
        for (Regression regression : fit.getRegressions()) {
            out.add(compute(regression, spec, clusters));
        }
        return out;
    }

    public VcovResult estimate(int regressionIndex, VcovSpec spec) {
        int[] clusters = prepare(spec);
        return compute(fit.getRegression(regressionIndex), spec, clusters);
    }

    /** Checks the request and resolves cluster ids; nothing is computed before this passes. */
    private int[] prepare(VcovSpec spec) {
        if (spec == null) throw new PreconditionViolationException("vcov specification required");
        if (spec.getType() == VcovType.CRV3 && fit.hasFixef()) {
            throw new PreconditionViolationException("CRV3 inference is not supported with fixed effects");
        }
        if (!spec.isClustered()) return null;

        String column = spec.getClusterColumn();
        if (data == null || !data.hasColumn(column)) {
            throw new PreconditionViolationException("Cluster column '" + column + "' not found in the data");
        }
        int[] codes = data.groupCodes(column);
        for (int code : codes) {
            if (code < 0) {
                throw new PreconditionViolationException("Cluster column '" + column + "' contains missing values");
            }
        }
        return codes;
    }

    private VcovResult compute(Regression regression, VcovSpec spec, int[] clusters) {
        RealMatrix X = fit.x();
        RealMatrix tXXinv = fit.tXXinv();
        double[] u = regression.getResidual().toArray();
        int n = fit.n();
        int k = fit.k();

        switch (spec.getType()) {
            case IID: {
                double sigma2 = 0;
                for (double v : u) sigma2 += v * v;
                sigma2 /= n;
                return new VcovResult(regression.getIndex(), spec, tXXinv.scalarMultiply(sigma2), 1.0, 0);
            }
            case HC1:
            case HC2:
            case HC3: {
                double[] weights = new double[n];
                double[] leverage = spec.getType() == VcovType.HC1 ? null : leverage(X, tXXinv);
                for (int i = 0; i < n; i++) {
                    double u2 = u[i] * u[i];
                    if (spec.getType() == VcovType.HC1) {
                        weights[i] = u2;
                    } else if (spec.getType() == VcovType.HC2) {
                        weights[i] = u2 / (1 - leverage[i]);
                    } else {
                        weights[i] = u2 / ((1 - leverage[i]) * (1 - leverage[i]));
                    }
                }
                double cc = spec.getType() == VcovType.HC1 ? (double) n / (n - k) : 1.0;
                RealMatrix meat = weightedCrossProduct(X, weights);
                return new VcovResult(regression.getIndex(), spec, sandwich(tXXinv, meat).scalarMultiply(cc), cc, 0);
            }
            case CRV1: {
                int groups = groupCount(clusters);
                double[][] scores = new double[groups][k];
                for (int i = 0; i < n; i++) {
                    double[] s = scores[clusters[i]];
                    for (int j = 0; j < k; j++) s[j] += X.getEntry(i, j) * u[i];
                }
                RealMatrix S = MatrixUtils.createRealMatrix(scores);
                RealMatrix meat = S.transpose().multiply(S);
                double cc = ((double) groups / (groups - 1)) * ((double) (n - 1) / (n - k));
                LOG.debug("CRV1 on {} clusters for '{}', correction {}", groups, regression.getDepvar(), cc);
                return new VcovResult(regression.getIndex(), spec, sandwich(tXXinv, meat).scalarMultiply(cc), cc, groups);
            }
            case CRV3: {
                int groups = groupCount(clusters);
                double cc = (double) (groups - 1) / groups;
                RealMatrix vcov = jackknife(X, regression, clusters, groups).scalarMultiply(cc);
                LOG.debug("CRV3 on {} clusters for '{}'", groups, regression.getDepvar());
                return new VcovResult(regression.getIndex(), spec, vcov, cc, groups);
            }
            default:
                throw new PreconditionViolationException("Unsupported vcov type " + spec.getType());
        }
    }

    /** Σ_g (β̂₍₋g₎ − β̂)(β̂₍₋g₎ − β̂)' with β̂₍₋g₎ = (X'X − X_g'X_g)⁺ (X'y − X_g'y_g). */
    private static RealMatrix jackknife(RealMatrix X, Regression regression, int[] clusters, int groups) {
        int n = X.getRowDimension();
        int k = X.getColumnDimension();
        double[] y = regression.getY().toArray();

        RealMatrix[] tXgXg = new RealMatrix[groups];
        RealVector[] tXgyg = new RealVector[groups];
        for (int g = 0; g < groups; g++) {
            tXgXg[g] = MatrixUtils.createRealMatrix(k, k);
            tXgyg[g] = new ArrayRealVector(k);
        }
        for (int i = 0; i < n; i++) {
            RealVector xi = X.getRowVector(i);
            int g = clusters[i];
            tXgXg[g] = tXgXg[g].add(xi.outerProduct(xi));
            tXgyg[g] = tXgyg[g].add(xi.mapMultiply(y[i]));
        }
        RealMatrix tXX = X.transpose().multiply(X);
        RealVector tXy = X.transpose().operate(new ArrayRealVector(y, false));
        RealVector beta = regression.getBetaHat();

        RealMatrix sum = MatrixUtils.createRealMatrix(k, k);
        for (int g = 0; g < groups; g++) {
            RealMatrix pinv = new SingularValueDecomposition(tXX.subtract(tXgXg[g])).getSolver().getInverse();
            RealVector deviation = pinv.operate(tXy.subtract(tXgyg[g])).subtract(beta);
            sum = sum.add(deviation.outerProduct(deviation));
        }
        return sum;
    }

    /** Diagonal of X(X'X)⁻¹X'. */
    static double[] leverage(RealMatrix X, RealMatrix tXXinv) {
        int n = X.getRowDimension();
        double[] h = new double[n];
        for (int i = 0; i < n; i++) {
            RealVector xi = X.getRowVector(i);
            h[i] = xi.dotProduct(tXXinv.operate(xi));
        }
        return h;
    }

    /** X' diag(w) X. */
    private static RealMatrix weightedCrossProduct(RealMatrix X, double[] w) {
        int n = X.getRowDimension();
        int k = X.getColumnDimension();
        double[][] wx = new double[n][k];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < k; j++) wx[i][j] = w[i] * X.getEntry(i, j);
        }
        return X.transpose().multiply(MatrixUtils.createRealMatrix(wx));
    }

    private static RealMatrix sandwich(RealMatrix bread, RealMatrix meat) {
        return bread.multiply(meat).multiply(bread);
    }

    private static int groupCount(int[] clusters) {
        int max = -1;
        for (int c : clusters) max = Math.max(max, c);
        return max + 1;
    }
}
