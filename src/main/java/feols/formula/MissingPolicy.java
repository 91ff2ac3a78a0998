package feols.formula;

/** What a {@link DesignMatrixBuilder} does with rows holding a non-finite value. */
public enum MissingPolicy {
    /** Leave them in place; the caller decides. */
    KEEP,
    /** Remove every row with at least one non-finite entry. */
    DROP
}
