package feols.stats;

import feols.formula.AdditiveDesignMatrixBuilder;
import feols.formula.DataTable;
import feols.formula.DesignMatrices;
import feols.formula.FormulaDecomposer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FixedEffectDemeanerTest {

    private static final double TOL = 1e-12;

    private final FormulaDecomposer decomposer = new FormulaDecomposer(new AdditiveDesignMatrixBuilder());

    private static DataTable data() {
        return new DataTable()
                .addNumeric("y1", new double[] {1, 3, 10, 14})
                .addNumeric("y2", new double[] {0, 2, 4, 4})
                .addNumeric("x", new double[] {2, 4, 6, 10})
                .addCategorical("f", new String[] {"a", "a", "b", "b"});
    }

    @Test
    void demean_splitsTheSolvedBlockBackIntoOutcomesAndRegressors() {
        DesignMatrices design = decomposer.decompose("y1 + y2 ~ x | f", data());

        DesignMatrices demeaned = new FixedEffectDemeaner(new GroupMeanSolver()).demean(design);

        assertThat(demeaned.getY().getNames()).containsExactly("y1", "y2");
        assertThat(demeaned.getX().getNames()).containsExactly("x");
        double[][] y = demeaned.getY().toArray();
        assertThat(y[0]).containsExactly(new double[] {-1, -1}, within(TOL));
        assertThat(y[1]).containsExactly(new double[] {1, 1}, within(TOL));
        assertThat(y[2]).containsExactly(new double[] {-2, 0}, within(TOL));
        assertThat(y[3]).containsExactly(new double[] {2, 0}, within(TOL));
        double[][] x = demeaned.getX().toArray();
        assertThat(new double[] {x[0][0], x[1][0], x[2][0], x[3][0]})
                .containsExactly(new double[] {-1, 1, -2, 2}, within(TOL));
    }

    @Test
    void demean_keepsBookkeepingAndLeavesTheInputAlone() {
        DesignMatrices design = decomposer.decompose("y1 ~ x | f", data());

        DesignMatrices demeaned = new FixedEffectDemeaner(new GroupMeanSolver()).demean(design);

        assertThat(demeaned.getFixefNames()).containsExactly("f");
        assertThat(demeaned.getData()).isSameAs(design.getData());
        assertThat(design.getY().get(0, 0)).isEqualTo(1.0);
    }

    @Test
    void demean_withoutFixedEffects_isAPassThrough() {
        GroupMeanSolver solver = new GroupMeanSolver();
        DesignMatrices design = decomposer.decompose("y1 ~ x", data());

        assertThat(new FixedEffectDemeaner(solver).demean(design)).isSameAs(design);
        assertThat(solver.calls).isZero();
    }

    @Test
    void demean_rejectsAMisshapenSolverResult() {
        DesignMatrices design = decomposer.decompose("y1 ~ x | f", data());
        FixedEffectSolver broken = (ids, values) -> values.getSubMatrix(0, 1, 0, 1);

        assertThatThrownBy(() -> new FixedEffectDemeaner(broken).demean(design))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("expected 4 x 2");
    }
}
