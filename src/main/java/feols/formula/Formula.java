package feols.formula;

import feols.stats.PreconditionViolationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable decomposition of a formula string.
 * <p>
 * Syntax: {@code Y1 + Y2 ~ X1 + X2 | f1 + f2}
 * <p>
 * - left of {@code ~}: one or more dependent variables joined with {@code +}
 * - right of {@code ~}: the regressor terms, handed as-is to a {@link DesignMatrixBuilder}
 * - after {@code |}: optional fixed effects joined with {@code +}
 */
public final class Formula {

    /** Term that removes the intercept from a regressor specification. */
    public static final String NO_INTERCEPT = "-1";

    private final String source;
    private final List<String> depvars;
    private final String regressors;
    private final String fixef; // null when there is no fixed-effect segment

    private Formula(String source, List<String> depvars, String regressors, String fixef) {
        this.source = source;
        this.depvars = depvars;
        this.regressors = regressors;
        this.fixef = fixef;
    }

    public static Formula parse(String formula) {
        if (formula == null || formula.isBlank()) {
            throw new IllegalArgumentException("formula must be non-empty");
        }
        String compact = formula.replaceAll("\\s+", "");

        // fixed effects first: everything after '|'
        String[] segments = compact.split("\\|", -1);
        if (segments.length > 2) {
            throw new PreconditionViolationException(
                "Instrumental-variable formulas are not supported: " + formula);
        }
        String fixef = null;
        if (segments.length == 2) {
            if (segments[1].isEmpty()) {
                throw new IllegalArgumentException("Empty fixed-effect segment in formula: " + formula);
            }
            fixef = segments[1];
        }

        String[] sides = segments[0].split("~", -1);
        if (sides.length != 2 || sides[0].isEmpty() || sides[1].isEmpty()) {
            throw new IllegalArgumentException("Formula must have the form 'y ~ x [| fe]': " + formula);
        }
        List<String> depvars = splitTerms(sides[0]);
        if (fixef != null) splitTerms(fixef); // validates empty terms
        return new Formula(formula, depvars, sides[1], fixef);
    }

    static List<String> splitTerms(String joined) {
        List<String> out = new ArrayList<>();
        for (String term : joined.split("\\+", -1)) {
            if (term.isEmpty()) {
                throw new IllegalArgumentException("Empty term in '" + joined + "'");
            }
            out.add(term);
        }
        return Collections.unmodifiableList(out);
    }

    public List<String> getDepvars() { return depvars; }
    public String getRegressors() { return regressors; }
    public boolean hasFixef() { return fixef != null; }

    /** Fixed-effect specification, e.g. {@code f1+f2}, or null. */
    public String getFixef() { return fixef; }

    public List<String> getFixefNames() {
        return fixef == null ? Collections.<String>emptyList() : splitTerms(fixef);
    }

    /** Outcome terms as a builder specification (never with an intercept). */
    public String outcomeTerms() {
        return String.join("+", depvars) + NO_INTERCEPT;
    }

    /**
     * Regressor terms as a builder specification. The intercept is dropped when fixed
     * effects are present since it lies in the fixed-effect subspace.
     */
    public String regressorTerms() {
        return fixef == null ? regressors : regressors + NO_INTERCEPT;
    }

    /** Fixed-effect terms as a builder specification, or null. */
    public String fixefTerms() {
        return fixef == null ? null : fixef + NO_INTERCEPT;
    }

    @Override
    public String toString() { return source; }
}
