package feols.stats;

import feols.formula.DesignMatrices;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A fitted formula: the (demeaned) design matrices and their OLS fits. Covariance,
 * inference and fit statistics are derived on request and never stored, so any number of
 * specifications can be evaluated on the same model in any order.
 */
public final class FeolsModel {

    private final DesignMatrices design;
    private final FitResult fit;

    FeolsModel(DesignMatrices design, FitResult fit) {
        this.design = design;
        this.fit = fit;
    }

    public DesignMatrices getDesign() { return design; }
    public FitResult getFit() { return fit; }
    public boolean hasFixef() { return fit.hasFixef(); }
    public int getN() { return fit.n(); }
    public List<String> getCoefnames() { return fit.getCoefnames(); }

    /** Covariance of every regression; all or nothing. */
    public List<VcovResult> vcov(VcovSpec spec) {
        return new CovarianceEstimator(fit, design.getData()).estimateAll(spec);
    }

    public List<RegressionReport> report(VcovSpec spec) {
        return report(spec, 0.95);
    }

    /** One report per dependent variable, in formula order. */
    public List<RegressionReport> report(VcovSpec spec, double level) {
        List<VcovResult> vcovs = vcov(spec);
        InferenceReporter inference = new InferenceReporter(level);
        PerformanceReporter performance = new PerformanceReporter();
        List<RegressionReport> reports = new ArrayList<>(vcovs.size());
        for (VcovResult v : vcovs) {
            Regression regression = fit.getRegression(v.getRegressionIndex());
            reports.add(new RegressionReport(regression, fit.getCoefnames(), v,
                inference.infer(regression, v), performance.summarize(regression, fit.k()), fit.n(), fit.k()));
        }
        return Collections.unmodifiableList(reports);
    }

    /**
     * Covariance used when the caller does not pick one: clustered by the first fixed
     * effect when there are fixed effects, iid otherwise.
     */
    public VcovSpec defaultVcov() {
        return hasFixef() ? VcovSpec.crv1(design.getFixefNames().get(0)) : VcovSpec.iid();
    }
}
