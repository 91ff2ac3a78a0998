package feols.formula;

import feols.stats.PreconditionViolationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FormulaDecomposerTest {

    private final FormulaDecomposer decomposer = new FormulaDecomposer(new AdditiveDesignMatrixBuilder());

    private static DataTable table() {
        double nan = Double.NaN;
        return new DataTable()
                .addNumeric("Y", new double[] {1, 2, 3, nan, 5, 6, 7, 8})
                .addNumeric("Y2", new double[] {2, 4, 6, 8, 10, 12, 14, 16})
                .addNumeric("X1", new double[] {1, 1, 2, 2, 3, nan, 4, 4})
                .addNumeric("X2", new double[] {0, 1, 0, 1, 0, 1, 0, 1})
                .addCategorical("f1", new String[] {"a", "a", "b", "b", "c", "c", null, "d"})
                .addNumeric("g", new double[] {1, 1, 1, 1, 2, 2, 2, 2});
    }

    @Test
    void decompose_removesTheUnionOfMissingRowsFromYAndX() {
        DesignMatrices design = decomposer.decompose("Y ~ X1 + X2", table());

        assertThat(design.getNaIndex()).containsExactly(3, 5);
        assertThat(design.rowCount()).isEqualTo(8 - 2);
        assertThat(design.getY().rows()).isEqualTo(6);
        assertThat(design.getX().rows()).isEqualTo(6);
        assertThat(design.getData().rowCount()).isEqualTo(6);
        assertThat(design.getY().toArray()).isDeepEqualTo(new double[][] {{1}, {2}, {3}, {5}, {7}, {8}});
    }

    @Test
    void decompose_withoutFixedEffects_keepsIntercept() {
        DesignMatrices design = decomposer.decompose("Y ~ X1 + X2", table());

        assertThat(design.hasFixef()).isFalse();
        assertThat(design.getFixef()).isNull();
        assertThat(design.getFixefNames()).isEmpty();
        assertThat(design.getX().getNames()).containsExactly("Intercept", "X1", "X2");
    }

    @Test
    void decompose_withFixedEffects_dropsInterceptAndAddsFixefMissingness() {
        DesignMatrices design = decomposer.decompose("Y ~ X1 + X2 | f1", table());

        assertThat(design.hasFixef()).isTrue();
        assertThat(design.getX().getNames()).containsExactly("X1", "X2");
        assertThat(design.getFixefNames()).containsExactly("f1");
        assertThat(design.getNaIndex()).containsExactly(3, 5, 6);
        assertThat(design.getFixef()).isDeepEqualTo(new int[][] {{0}, {0}, {1}, {2}, {3}});
        assertThat(design.rowCount()).isEqualTo(5);
    }

    @Test
    void decompose_multipleDepvars_shareRowsAndKeepOrder() {
        DesignMatrices design = decomposer.decompose("Y2 + Y ~ X2", table());

        assertThat(design.getY().getNames()).containsExactly("Y2", "Y");
        assertThat(design.getNaIndex()).containsExactly(3);
        assertThat(design.getY().columns()).isEqualTo(2);
    }

    @Test
    void decompose_keepsTheFilteredTableForClusterLookups() {
        DesignMatrices design = decomposer.decompose("Y ~ X1", table());

        assertThat(design.getData().numeric("g")).containsExactly(1, 1, 1, 2, 2, 2);
    }

    @Test
    void decompose_rejectsFormulaWithNoRegressorsLeft() {
        assertThatThrownBy(() -> decomposer.decompose("Y ~ 1 | f1", table()))
                .isInstanceOf(PreconditionViolationException.class)
                .hasMessageContaining("No regressors");
    }

    @Test
    void decompose_rejectsCategoricalRegressor() {
        assertThatThrownBy(() -> decomposer.decompose("Y ~ X1 + f1", table()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Categorical column 'f1'");
    }

    @Test
    void decompose_rejectsCategoricalOutcome() {
        assertThatThrownBy(() -> decomposer.decompose("f1 ~ X1", table()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Categorical column 'f1'");
    }

    @Test
    void decompose_fixedEffectCodesIgnoreTheSignOfZero() {
        DataTable data = new DataTable()
                .addNumeric("Y", new double[] {1, 2, 3, 4})
                .addNumeric("X", new double[] {1, 3, 2, 5})
                .addNumeric("f", new double[] {0.0, -0.0, 2, 2});

        DesignMatrices design = decomposer.decompose("Y ~ X | f", data);

        assertThat(design.getFixef()).isDeepEqualTo(new int[][] {{0}, {0}, {1}, {1}});
    }

    @Test
    void decompose_rejectsAllRowsMissing() {
        DataTable data = new DataTable()
                .addNumeric("Y", new double[] {Double.NaN, 1})
                .addNumeric("X", new double[] {1, Double.NaN});

        assertThatThrownBy(() -> decomposer.decompose("Y ~ X", data))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Every row");
    }
}
