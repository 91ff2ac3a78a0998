package feols;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import feols.formula.DataTable;
import feols.stats.FeolsEstimator;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP front end for the estimator.
 * Run with: mvn exec:java -Dexec.mainClass="feols.WebApp"
 * <p>
 * POST /api/estimate, GET /api/sample, GET /api/health on port $PORT (default 7000).
 */
public class WebApp {

    private static final Logger LOG = LoggerFactory.getLogger(WebApp.class);

    // estimates can legitimately be NaN or infinite (degenerate leverage, single cluster)
    private static final Gson GSON = new GsonBuilder().serializeSpecialFloatingPointValues().create();

    static int getPort() {
        String env = System.getenv("PORT");
        if (env != null && !env.isBlank()) {
            try {
                return Integer.parseInt(env.trim());
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring invalid PORT '{}', using 7000", env);
            }
        }
        return 7000;
    }

    public static void main(String[] args) {
        int port = getPort();
        EstimateHandler handler = new EstimateHandler(new FeolsEstimator());
        Javalin app = Javalin.create().start("0.0.0.0", port);

        app.post("/api/estimate", ctx -> sendJson(ctx, 200, handler.handle(ctx.body())));

        app.get("/api/sample", ctx -> sendJson(ctx, 200, sampleRequest()));

        app.get("/api/health", ctx -> {
            Map<String, Object> h = new LinkedHashMap<>();
            h.put("status", "ok");
            h.put("port", port);
            sendJson(ctx, 200, h);
        });

        LOG.info("feols web app: http://localhost:{}", port);
    }

    private static void sendJson(Context ctx, int status, Object body) {
        ctx.status(status).contentType("application/json").result(GSON.toJson(body));
    }

    /** A ready-to-post request body built on the demo data. */
    static Map<String, Object> sampleRequest() {
        DataTable data = Main.sampleData();
        Map<String, Object> columns = new LinkedHashMap<>();
        for (String name : data.columnNames()) {
            List<Object> values = new ArrayList<>();
            if (data.isCategorical(name)) {
                int[] codes = data.groupCodes(name);
                for (int code : codes) values.add(code < 0 ? null : "g" + code);
            } else {
                for (double v : data.numeric(name)) values.add(Double.isFinite(v) ? v : null);
            }
            columns.put(name, values);
        }
        Map<String, Object> req = new LinkedHashMap<>();
        req.put("formula", "wage ~ educ + exper");
        req.put("data", columns);
        Map<String, Object> vcov = new LinkedHashMap<>();
        vcov.put("CRV1", "firm");
        req.put("vcov", vcov);
        return req;
    }
}
