package feols.formula;

import feols.stats.PreconditionViolationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FormulaTest {

    @Test
    void parse_splitsDepvarsRegressorsAndFixedEffects() {
        Formula formula = Formula.parse("Y1 + Y2 ~ X1 + X2 | f1 + f2");

        assertThat(formula.getDepvars()).containsExactly("Y1", "Y2");
        assertThat(formula.getRegressors()).isEqualTo("X1+X2");
        assertThat(formula.hasFixef()).isTrue();
        assertThat(formula.getFixefNames()).containsExactly("f1", "f2");
    }

    @Test
    void parse_withoutFixedEffectSegment_hasNoFixef() {
        Formula formula = Formula.parse("Y ~ X1");

        assertThat(formula.hasFixef()).isFalse();
        assertThat(formula.getFixef()).isNull();
        assertThat(formula.getFixefNames()).isEmpty();
        assertThat(formula.fixefTerms()).isNull();
    }

    @Test
    void regressorTerms_dropInterceptOnlyWithFixedEffects() {
        assertThat(Formula.parse("Y ~ X1 + X2").regressorTerms()).isEqualTo("X1+X2");
        assertThat(Formula.parse("Y ~ X1 + X2 | f").regressorTerms()).isEqualTo("X1+X2-1");
    }

    @Test
    void outcomeAndFixefTerms_neverCarryAnIntercept() {
        Formula formula = Formula.parse("Y1+Y2~X|f1+f2");

        assertThat(formula.outcomeTerms()).isEqualTo("Y1+Y2-1");
        assertThat(formula.fixefTerms()).isEqualTo("f1+f2-1");
    }

    @Test
    void parse_rejectsMissingTilde() {
        assertThatThrownBy(() -> Formula.parse("Y + X"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("y ~ x");
    }

    @Test
    void parse_rejectsEmptySides() {
        assertThatThrownBy(() -> Formula.parse("~ X")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Formula.parse("Y ~ ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Formula.parse("Y ~ X |")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Formula.parse("Y + ~ X")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parse_rejectsInstrumentalVariableFormulas() {
        assertThatThrownBy(() -> Formula.parse("Y ~ 1 | f1 | X1 ~ Z1"))
                .isInstanceOf(PreconditionViolationException.class)
                .hasMessageContaining("Instrumental-variable");
    }

    @Test
    void parse_rejectsBlank() {
        assertThatThrownBy(() -> Formula.parse("  ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Formula.parse(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
