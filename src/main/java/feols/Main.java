package feols;

import feols.formula.DataTable;
import feols.stats.CoefficientRow;
import feols.stats.FeolsEstimator;
import feols.stats.FeolsModel;
import feols.stats.RegressionReport;
import feols.stats.VcovSpec;
import feols.stats.VcovType;

/**
 * Demo: one OLS fit of a wage equation reported under every covariance estimator.
 */
public class Main {

    public static void main(String[] args) {
        DataTable data = sampleData();
        String formula = args.length > 0 && !args[0].isBlank() ? args[0].trim() : "wage + hours ~ educ + exper";

        FeolsModel model = new FeolsEstimator().fit(formula, data);
        System.out.println("=== " + formula + " (N = " + model.getN() + ") ===");

        VcovSpec[] specs = {
            VcovSpec.iid(),
            VcovSpec.hetero(),
            VcovSpec.hetero(VcovType.HC2),
            VcovSpec.hetero(VcovType.HC3),
            VcovSpec.crv1("firm"),
            VcovSpec.crv3("firm")
        };
        for (VcovSpec spec : specs) {
            for (RegressionReport report : model.report(spec)) {
                System.out.printf("%n%s, vcov: %s%n", report.getDepvar(), report.getVcovLabel());
                System.out.printf("%-10s %10s %10s %8s %8s%n", "", "Estimate", "Std.Err", "t", "Pr(>|t|)");
                for (CoefficientRow row : report.tidy()) {
                    System.out.printf("%-10s %10.4f %10.4f %8.3f %8.4f%n",
                        row.getName(), row.getEstimate(), row.getStdError(), row.getTValue(), row.getPValue());
                }
                System.out.printf("R² = %.4f, Adjusted R² = %.4f%n", report.getRSquared(), report.getAdjustedRSquared());
            }
        }
    }

    /** Synthetic wages and hours for 16 workers in 4 firms; one row has a missing wage. */
    static DataTable sampleData() {
        return new DataTable()
            .addNumeric("wage", new double[] {
                11.2, 13.9, 15.1, 18.4, 9.8, 12.5, Double.NaN, 17.0,
                14.3, 16.2, 19.8, 22.1, 10.4, 12.9, 15.7, 18.8 })
            .addNumeric("hours", new double[] {
                38, 40, 41, 45, 35, 39, 40, 44,
                40, 42, 46, 48, 36, 38, 41, 43 })
            .addNumeric("educ", new double[] {
                10, 12, 12, 16, 9, 11, 12, 15,
                12, 13, 16, 18, 10, 11, 13, 16 })
            .addNumeric("exper", new double[] {
                3, 5, 8, 10, 2, 6, 7, 9,
                4, 7, 9, 12, 1, 4, 6, 8 })
            .addCategorical("firm", new String[] {
                "a", "a", "a", "a", "b", "b", "b", "b",
                "c", "c", "c", "c", "d", "d", "d", "d" });
    }
}
