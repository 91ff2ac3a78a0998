package feols.formula;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column-oriented source table: named numeric columns (NaN = missing) and named
 * categorical columns (null = missing), all of the same length.
 */
public class DataTable {

    private final Map<String, double[]> numeric = new LinkedHashMap<>();
    private final Map<String, String[]> categorical = new LinkedHashMap<>();
    private int rows = -1;

    public DataTable addNumeric(String name, double[] values) {
        checkNew(name, values == null ? -1 : values.length);
        numeric.put(name, values.clone());
        return this;
    }

    public DataTable addCategorical(String name, String[] values) {
        checkNew(name, values == null ? -1 : values.length);
        categorical.put(name, values.clone());
        return this;
    }

    private void checkNew(String name, int length) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("column name required");
        if (length < 0) throw new IllegalArgumentException("values required for column " + name);
        if (hasColumn(name)) throw new IllegalArgumentException("Duplicate column: " + name);
        if (rows >= 0 && rows != length) {
            throw new IllegalArgumentException(
                "Column " + name + " has " + length + " rows, table has " + rows);
        }
        rows = length;
    }

    public int rowCount() { return Math.max(rows, 0); }

    public boolean hasColumn(String name) {
        return numeric.containsKey(name) || categorical.containsKey(name);
    }

    public boolean isCategorical(String name) {
        return categorical.containsKey(name);
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(numeric.keySet());
        names.addAll(categorical.keySet());
        return Collections.unmodifiableList(names);
    }

    /** Numeric column values; a copy. */
    public double[] numeric(String name) {
        double[] values = numeric.get(name);
        if (values == null) throw new IllegalArgumentException("No numeric column: " + name);
        return values.clone();
    }

    /**
     * Integer group codes for a column, in order of first appearance; -1 marks a missing
     * value (NaN or infinite for numeric columns, null for categorical ones).
     */
    public int[] groupCodes(String name) {
        int[] codes = new int[rowCount()];
        if (numeric.containsKey(name)) {
            double[] values = numeric.get(name);
            Map<Double, Integer> seen = new HashMap<>();
            for (int i = 0; i < values.length; i++) {
                if (!Double.isFinite(values[i])) {
                    codes[i] = -1;
                    continue;
                }
                double level = level(values[i]);
                Integer code = seen.get(level);
                if (code == null) {
                    code = seen.size();
                    seen.put(level, code);
                }
                codes[i] = code;
            }
        } else if (categorical.containsKey(name)) {
            String[] values = categorical.get(name);
            Map<String, Integer> seen = new HashMap<>();
            for (int i = 0; i < values.length; i++) {
                if (values[i] == null) {
                    codes[i] = -1;
                    continue;
                }
                Integer code = seen.get(values[i]);
                if (code == null) {
                    code = seen.size();
                    seen.put(values[i], code);
                }
                codes[i] = code;
            }
        } else {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        return codes;
    }

    /**
     * New table without the given rows.
     *
     * @param dropped sorted, distinct row indices to remove
     */
    public DataTable dropRows(int[] dropped) {
        boolean[] drop = new boolean[rowCount()];
        for (int i : dropped) drop[i] = true;
        DataTable out = new DataTable();
        for (Map.Entry<String, double[]> e : numeric.entrySet()) {
            double[] src = e.getValue();
            double[] kept = new double[src.length - dropped.length];
            int j = 0;
            for (int i = 0; i < src.length; i++) if (!drop[i]) kept[j++] = src[i];
            out.addNumeric(e.getKey(), kept);
        }
        for (Map.Entry<String, String[]> e : categorical.entrySet()) {
            String[] src = e.getValue();
            String[] kept = new String[src.length - dropped.length];
            int j = 0;
            for (int i = 0; i < src.length; i++) if (!drop[i]) kept[j++] = src[i];
            out.addCategorical(e.getKey(), kept);
        }
        if (numeric.isEmpty() && categorical.isEmpty()) out.rows = rowCount() - dropped.length;
        return out;
    }

    @Override
    public String toString() {
        return "DataTable" + Arrays.toString(columnNames().toArray()) + " rows=" + rowCount();
    }

    /** Group key for a numeric level; -0.0 and 0.0 are the same level. */
    static double level(double value) {
        return value == 0.0 ? 0.0 : value;
    }
}
