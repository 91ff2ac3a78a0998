package feols.formula;

import java.util.Collections;
import java.util.List;

/**
 * Aligned outcome, regressor and fixed-effect matrices of one formula, after the union of
 * their missing rows has been removed from all of them.
 */
public final class DesignMatrices {

    private final Formula formula;
    private final NamedMatrix y;
    private final NamedMatrix x;
    private final int[][] fixef;    // N x F, null without fixed effects
    private final List<String> fixefNames;
    private final int[] naIndex;
    private final DataTable data;

    public DesignMatrices(Formula formula, NamedMatrix y, NamedMatrix x, int[][] fixef,
                          List<String> fixefNames, int[] naIndex, DataTable data) {
        if (y.rows() != x.rows() || (fixef != null && fixef.length != y.rows())
                || data.rowCount() != y.rows()) {
            throw new IllegalArgumentException("Design matrices must share one row count");
        }
        this.formula = formula;
        this.y = y;
        this.x = x;
        this.fixef = fixef;
        this.fixefNames = fixefNames == null ? Collections.<String>emptyList() : fixefNames;
        this.naIndex = naIndex.clone();
        this.data = data;
    }

    /** Same fixed effects, bookkeeping and data; new outcome and regressor values. */
    public DesignMatrices withOutcomeAndRegressors(NamedMatrix newY, NamedMatrix newX) {
        return new DesignMatrices(formula, newY, newX, fixef, fixefNames, naIndex, data);
    }

    public Formula getFormula() { return formula; }
    public NamedMatrix getY() { return y; }
    public NamedMatrix getX() { return x; }
    public boolean hasFixef() { return fixef != null; }
    public List<String> getFixefNames() { return fixefNames; }
    public int rowCount() { return y.rows(); }

    /** Group ids, one column per fixed effect; a copy, or null without fixed effects. */
    public int[][] getFixef() {
        if (fixef == null) return null;
        int[][] out = new int[fixef.length][];
        for (int i = 0; i < fixef.length; i++) out[i] = fixef[i].clone();
        return out;
    }

    /** Sorted row indices of the source table excluded for missing values. */
    public int[] getNaIndex() { return naIndex.clone(); }

    /** Source table restricted to the rows that were kept. */
    public DataTable getData() { return data; }
}
