package feols.formula;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Dense numeric matrix with ordered column names. */
public final class NamedMatrix {

    private final double[][] values;
    private final List<String> names;

    public NamedMatrix(double[][] values, List<String> names) {
        if (values == null || names == null) throw new IllegalArgumentException("values and names required");
        for (double[] row : values) {
            if (row.length != names.size()) {
                throw new IllegalArgumentException(
                    "Row width " + row.length + " does not match " + names.size() + " column names");
            }
        }
        this.values = values;
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
    }

    public int rows() { return values.length; }
    public int columns() { return names.size(); }
    public List<String> getNames() { return names; }

    public double get(int row, int column) { return values[row][column]; }

    /** Copy of the values. */
    public double[][] toArray() {
        double[][] out = new double[values.length][];
        for (int i = 0; i < values.length; i++) out[i] = values[i].clone();
        return out;
    }

    /** Copy as a commons-math matrix; needs at least one row and one column. */
    public RealMatrix toRealMatrix() {
        return MatrixUtils.createRealMatrix(toArray());
    }

    /** Sorted indices of rows holding at least one non-finite value. */
    public int[] nonFiniteRows() {
        List<Integer> rows = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            for (double v : values[i]) {
                if (!Double.isFinite(v)) {
                    rows.add(i);
                    break;
                }
            }
        }
        return rows.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * New matrix without the given rows.
     *
     * @param dropped sorted, distinct row indices
     */
    public NamedMatrix dropRows(int[] dropped) {
        boolean[] drop = new boolean[values.length];
        for (int i : dropped) drop[i] = true;
        double[][] kept = new double[values.length - dropped.length][];
        int j = 0;
        for (int i = 0; i < values.length; i++) {
            if (!drop[i]) kept[j++] = values[i].clone();
        }
        return new NamedMatrix(kept, names);
    }
}
