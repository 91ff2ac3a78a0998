package feols.stats;

import feols.formula.AdditiveDesignMatrixBuilder;
import feols.formula.DataTable;
import feols.formula.DesignMatrices;
import feols.formula.DesignMatrixBuilder;
import feols.formula.Formula;
import feols.formula.FormulaDecomposer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Formula → design matrices → [fixed-effect demeaning] → OLS fit.
 */
public class FeolsEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(FeolsEstimator.class);

    private final FormulaDecomposer decomposer;
    private final FixedEffectDemeaner demeaner; // null without a solver
    private final MultiRegressionFitter fitter = new MultiRegressionFitter();

    /** Additive formulas, no fixed-effect support. */
    public FeolsEstimator() {
        this(new AdditiveDesignMatrixBuilder(), null);
    }

    /**
     * @param builder design-matrix builder for the formula terms
     * @param solver  fixed-effect solver, or null to reject formulas with fixed effects
     */
    public FeolsEstimator(DesignMatrixBuilder builder, FixedEffectSolver solver) {
        this.decomposer = new FormulaDecomposer(builder);
        this.demeaner = solver == null ? null : new FixedEffectDemeaner(solver);
    }

    public FeolsModel fit(String formula, DataTable data) {
        Formula parsed = Formula.parse(formula);
        if (parsed.hasFixef() && demeaner == null) {
            throw new PreconditionViolationException(
                "Formula '" + formula + "' has fixed effects but no fixed-effect solver is configured");
        }
        DesignMatrices design = decomposer.decompose(parsed, data);
        if (design.hasFixef()) {
            design = demeaner.demean(design);
        }
        FitResult fit = fitter.fit(design.getX(), design.getY(), design.hasFixef());
        LOG.debug("Estimated '{}' on {} observations ({} dropped)", formula, fit.n(), design.getNaIndex().length);
        return new FeolsModel(design, fit);
    }
}
