package feols.formula;

/**
 * Turns a one-sided term specification such as {@code X1+X2} or {@code f1+f2-1} into a
 * numeric matrix over the rows of a {@link DataTable}.
 */
public interface DesignMatrixBuilder {

    /**
     * @param terms  term specification, {@code +}-joined
     * @param table  source table
     * @param policy handling of rows with non-finite values
     * @return matrix with one column per generated term, in term order
     */
    NamedMatrix build(String terms, DataTable table, MissingPolicy policy);
}
