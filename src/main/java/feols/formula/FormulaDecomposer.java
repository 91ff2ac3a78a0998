package feols.formula;

import feols.stats.PreconditionViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Splits a formula into outcome, regressor and fixed-effect parts and builds the aligned
 * numeric matrices for them.
 * <p>
 * Rows with a non-finite value in Y, in X or in the fixed effects are collected per matrix;
 * the union of the three sets is removed from every matrix, so all of them keep the same
 * row count N.
 */
public class FormulaDecomposer {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaDecomposer.class);

    private final DesignMatrixBuilder builder;

    public FormulaDecomposer(DesignMatrixBuilder builder) {
        if (builder == null) throw new IllegalArgumentException("builder required");
        this.builder = builder;
    }

    public DesignMatrices decompose(String formula, DataTable data) {
        return decompose(Formula.parse(formula), data);
    }

    public DesignMatrices decompose(Formula formula, DataTable data) {
        if (data == null || data.rowCount() == 0) throw new IllegalArgumentException("data must be non-empty");

        NamedMatrix y = builder.build(formula.outcomeTerms(), data, MissingPolicy.KEEP);
        NamedMatrix x = builder.build(formula.regressorTerms(), data, MissingPolicy.KEEP);
        NamedMatrix fe = formula.hasFixef()
            ? builder.build(formula.fixefTerms(), data, MissingPolicy.KEEP)
            : null;
        rejectCategorical(y, data, formula);
        rejectCategorical(x, data, formula);
        if (x.columns() == 0) {
            throw new PreconditionViolationException("No regressors left in '" + formula + "'");
        }

        TreeSet<Integer> dropped = new TreeSet<>();
        for (int i : y.nonFiniteRows()) dropped.add(i);
        for (int i : x.nonFiniteRows()) dropped.add(i);
        if (fe != null) {
            for (int i : fe.nonFiniteRows()) dropped.add(i);
        }
        int[] naIndex = dropped.stream().mapToInt(Integer::intValue).toArray();
        if (naIndex.length == data.rowCount()) {
            throw new IllegalArgumentException("Every row of the data has a missing value for '" + formula + "'");
        }
        if (naIndex.length > 0) {
            LOG.debug("Dropping {} of {} rows with missing values for '{}'", naIndex.length, data.rowCount(), formula);
        }

        int[][] fixef = null;
        List<String> fixefNames = formula.getFixefNames();
        if (fe != null) {
            NamedMatrix kept = fe.dropRows(naIndex);
            fixef = new int[kept.rows()][kept.columns()];
            for (int j = 0; j < kept.columns(); j++) {
                // dense 0..G-1 codes whatever values the builder produced
                Map<Double, Integer> codes = new HashMap<>();
                for (int i = 0; i < kept.rows(); i++) {
                    double level = DataTable.level(kept.get(i, j));
                    Integer code = codes.get(level);
                    if (code == null) {
                        code = codes.size();
                        codes.put(level, code);
                    }
                    fixef[i][j] = code;
                }
            }
            fixefNames = kept.getNames();
        }

        DesignMatrices out = new DesignMatrices(formula, y.dropRows(naIndex), x.dropRows(naIndex),
            fixef, fixefNames, naIndex, data.dropRows(naIndex));
        LOG.debug("Decomposed '{}': N={}, M={}, K={}, fixed effects={}", formula, out.rowCount(),
            out.getY().columns(), out.getX().columns(), fixefNames);
        return out;
    }

    // group codes carry no magnitude; they are only usable as fixed-effect ids
    private static void rejectCategorical(NamedMatrix matrix, DataTable data, Formula formula) {
        for (String name : matrix.getNames()) {
            if (data.hasColumn(name) && data.isCategorical(name)) {
                throw new IllegalArgumentException("Categorical column '" + name
                    + "' can only be used as a fixed effect in '" + formula + "'");
            }
        }
    }
}
