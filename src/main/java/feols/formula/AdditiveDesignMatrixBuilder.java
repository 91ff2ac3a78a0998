package feols.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link DesignMatrixBuilder} for purely additive term lists.
 * <p>
 * Terms are column names joined with {@code +}; {@code 1} requests the intercept,
 * {@code 0} or {@code -1} removes it. The intercept is on by default and is always the
 * first column, named {@value #INTERCEPT}. Categorical columns enter as integer group
 * codes (first-appearance order), which is what fixed-effect group ids need; there is no
 * dummy expansion, interaction or transform support.
 */
public class AdditiveDesignMatrixBuilder implements DesignMatrixBuilder {

    public static final String INTERCEPT = "Intercept";

    @Override
    public NamedMatrix build(String terms, DataTable table, MissingPolicy policy) {
        if (terms == null || terms.isBlank()) throw new IllegalArgumentException("terms required");
        if (table == null) throw new IllegalArgumentException("table required");

        boolean intercept = true;
        List<String> columns = new ArrayList<>();
        for (String token : terms.replaceAll("\\s+", "").split("(?=[+-])")) {
            if (token.isEmpty()) continue;
            boolean negated = token.charAt(0) == '-';
            String term = (token.charAt(0) == '+' || negated) ? token.substring(1) : token;
            if (term.isEmpty()) throw new IllegalArgumentException("Empty term in '" + terms + "'");
            if (term.equals("1")) {
                intercept = !negated;
            } else if (term.equals("0")) {
                intercept = false;
            } else if (negated) {
                throw new IllegalArgumentException("Only the intercept can be removed, got '-" + term + "'");
            } else if (!table.hasColumn(term)) {
                throw new IllegalArgumentException("Unknown column '" + term + "' in '" + terms + "'");
            } else if (!columns.contains(term)) {
                columns.add(term);
            }
        }

        int n = table.rowCount();
        int width = columns.size() + (intercept ? 1 : 0);
        double[][] values = new double[n][width];
        List<String> names = new ArrayList<>(width);
        int c = 0;
        if (intercept) {
            for (int i = 0; i < n; i++) values[i][0] = 1.0;
            names.add(INTERCEPT);
            c++;
        }
        for (String column : columns) {
            double[] col;
            if (table.isCategorical(column)) {
                int[] codes = table.groupCodes(column);
                col = new double[n];
                for (int i = 0; i < n; i++) col[i] = codes[i] < 0 ? Double.NaN : codes[i];
            } else {
                col = table.numeric(column);
            }
            for (int i = 0; i < n; i++) values[i][c] = col[i];
            names.add(column);
            c++;
        }

        NamedMatrix matrix = new NamedMatrix(values, names);
        return policy == MissingPolicy.DROP ? matrix.dropRows(matrix.nonFiniteRows()) : matrix;
    }
}
