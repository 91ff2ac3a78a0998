package feols.stats;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Test fixture: removes group means one fixed effect at a time, sweeping until nothing
 * changes. A single sweep is exact for one fixed effect.
 */
class GroupMeanSolver implements FixedEffectSolver {

    private static final double TOLERANCE = 1e-12;
    private static final int MAX_SWEEPS = 10_000;

    int calls;

    @Override
    public RealMatrix demean(int[][] groupIds, RealMatrix values) {
        calls++;
        RealMatrix out = values.copy();
        int n = out.getRowDimension();
        int f = groupIds[0].length;
        for (int sweep = 0; sweep < MAX_SWEEPS; sweep++) {
            double change = 0;
            for (int j = 0; j < f; j++) {
                int groups = 0;
                for (int[] row : groupIds) groups = Math.max(groups, row[j] + 1);
                for (int c = 0; c < out.getColumnDimension(); c++) {
                    double[] sum = new double[groups];
                    int[] count = new int[groups];
                    for (int i = 0; i < n; i++) {
                        sum[groupIds[i][j]] += out.getEntry(i, c);
                        count[groupIds[i][j]]++;
                    }
                    for (int i = 0; i < n; i++) {
                        double mean = sum[groupIds[i][j]] / count[groupIds[i][j]];
                        change = Math.max(change, Math.abs(mean));
                        out.setEntry(i, c, out.getEntry(i, c) - mean);
                    }
                }
            }
            if (change < TOLERANCE) break;
        }
        return out;
    }
}
