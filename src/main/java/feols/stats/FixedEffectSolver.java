package feols.stats;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Multi-way fixed-effect residualization, e.g. by alternating projections.
 */
public interface FixedEffectSolver {

    /**
     * Replace every column of {@code values} by its residual after projection onto the
     * subspace spanned by the fixed effects.
     *
     * @param groupIds N x F integer group ids, one column per fixed effect
     * @param values   N x C numeric matrix
     * @return N x C demeaned matrix; {@code values} is left untouched
     */
    RealMatrix demean(int[][] groupIds, RealMatrix values);
}
