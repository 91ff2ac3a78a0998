package feols.stats;

/**
 * A fatal input condition the estimation cannot recover from: rank-deficient regressors,
 * an unknown covariance type, CRV3 with fixed effects, an unusable cluster column.
 * The whole batch of regressions is aborted; no partial results are returned.
 */
public class PreconditionViolationException extends RuntimeException {

    public PreconditionViolationException(String message) {
        super(message);
    }

    public PreconditionViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
