package feols;

import com.google.gson.Gson;
import com.google.gson.JsonSyntaxException;
import com.google.gson.reflect.TypeToken;
import feols.formula.DataTable;
import feols.stats.CoefficientRow;
import feols.stats.FeolsEstimator;
import feols.stats.FeolsModel;
import feols.stats.RegressionReport;
import feols.stats.VcovSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps an estimation request body to its JSON-ready answer.
 * <p>
 * Request: {@code {"formula": "y ~ x", "data": {"y": [..], "x": [..]}, "vcov": "HC1"}};
 * {@code vcov} is optional. Failures come back as {@code {"error": message}}.
 */
public class EstimateHandler {

    private static final Logger LOG = LoggerFactory.getLogger(EstimateHandler.class);
    private static final Gson GSON = new Gson();
    private static final Type REQUEST_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    private final FeolsEstimator estimator;

    public EstimateHandler(FeolsEstimator estimator) {
        this.estimator = estimator;
    }

    public Map<String, Object> handle(String body) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (body == null || body.isBlank()) {
            out.put("error", "Missing request body");
            return out;
        }
        Map<String, Object> req;
        try {
            req = GSON.fromJson(body, REQUEST_TYPE);
        } catch (JsonSyntaxException e) {
            out.put("error", "Invalid JSON");
            return out;
        }
        if (req == null) {
            out.put("error", "Invalid JSON");
            return out;
        }
        Object formula = req.get("formula");
        if (!(formula instanceof String) || ((String) formula).isBlank()) {
            out.put("error", "Missing or invalid 'formula'");
            return out;
        }
        Object dataObj = req.get("data");
        if (!(dataObj instanceof Map<?, ?>) || ((Map<?, ?>) dataObj).isEmpty()) {
            out.put("error", "Missing or invalid 'data' object");
            return out;
        }

        try {
            estimate((String) formula, (Map<?, ?>) dataObj, req.get("vcov"), out);
        } catch (RuntimeException e) {
            LOG.warn("Rejected estimation request for '{}': {}", formula, e.getMessage());
            out.clear();
            String msg = e.getMessage();
            out.put("error", msg != null && !msg.isEmpty() ? msg : e.getClass().getSimpleName());
        }
        return out;
    }

    private void estimate(String formula, Map<?, ?> data, Object vcov, Map<String, Object> out) {
        FeolsModel model = estimator.fit(formula, toTable(data));
        VcovSpec spec = vcov != null ? VcovSpec.parse(vcov) : model.defaultVcov();

        List<Map<String, Object>> regressions = new ArrayList<>();
        for (RegressionReport report : model.report(spec)) {
            Map<String, Object> r = new LinkedHashMap<>();
            r.put("depvar", report.getDepvar());
            r.put("vcovType", report.getVcovLabel());
            r.put("rSquared", report.getRSquared());
            r.put("adjRSquared", report.getAdjustedRSquared());
            List<Map<String, Object>> coefficients = new ArrayList<>();
            for (CoefficientRow row : report.tidy()) {
                Map<String, Object> c = new LinkedHashMap<>();
                c.put("name", row.getName());
                c.put("estimate", row.getEstimate());
                c.put("stdError", row.getStdError());
                c.put("tValue", row.getTValue());
                c.put("pValue", row.getPValue());
                c.put("lower", row.getLower());
                c.put("upper", row.getUpper());
                coefficients.add(c);
            }
            r.put("coefficients", coefficients);
            regressions.add(r);
        }
        List<Integer> dropped = new ArrayList<>();
        for (int i : model.getDesign().getNaIndex()) dropped.add(i);
        out.put("nobs", model.getN());
        out.put("dropped", dropped);
        out.put("regressions", regressions);
    }

    /** Columns holding only numbers and nulls are numeric (null → NaN), anything else categorical. */
    static DataTable toTable(Map<?, ?> data) {
        DataTable table = new DataTable();
        for (Map.Entry<?, ?> e : data.entrySet()) {
            String name = String.valueOf(e.getKey());
            if (!(e.getValue() instanceof List<?>)) {
                throw new IllegalArgumentException("Column '" + name + "' must be an array");
            }
            List<?> values = (List<?>) e.getValue();
            boolean numeric = true;
            for (Object v : values) {
                if (v != null && !(v instanceof Number)) {
                    numeric = false;
                    break;
                }
            }
            if (numeric) {
                double[] col = new double[values.size()];
                for (int i = 0; i < col.length; i++) {
                    Object v = values.get(i);
                    col[i] = v == null ? Double.NaN : ((Number) v).doubleValue();
                }
                table.addNumeric(name, col);
            } else {
                String[] col = new String[values.size()];
                for (int i = 0; i < col.length; i++) {
                    Object v = values.get(i);
                    col[i] = v == null ? null : formatLevel(v);
                }
                table.addCategorical(name, col);
            }
        }
        return table;
    }

    // Gson reads every JSON number as a double; 3.0 and "3" must be the same level
    private static String formatLevel(Object v) {
        if (v instanceof Number) {
            double d = ((Number) v).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) return String.valueOf((long) d);
        }
        return String.valueOf(v);
    }
}
