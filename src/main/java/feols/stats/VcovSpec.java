package feols.stats;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Requested covariance estimator: {@code iid}, one of the heteroskedasticity-robust
 * {@code HC1}/{@code HC2}/{@code HC3} (with {@code hetero} as an alias of HC1), or a
 * cluster-robust {@code CRV1}/{@code CRV3} with the name of its cluster column.
 */
public final class VcovSpec {

    private final VcovType type;
    private final String label;
    private final String clusterColumn; // null unless clustered

    private VcovSpec(VcovType type, String label, String clusterColumn) {
        this.type = type;
        this.label = label;
        this.clusterColumn = clusterColumn;
    }

    public static VcovSpec iid() {
        return new VcovSpec(VcovType.IID, "iid", null);
    }

    /** {@code hetero}: HC1 under its own label. */
    public static VcovSpec hetero() {
        return new VcovSpec(VcovType.HC1, "hetero", null);
    }

    public static VcovSpec hetero(VcovType type) {
        if (type != VcovType.HC1 && type != VcovType.HC2 && type != VcovType.HC3) {
            throw new IllegalArgumentException("Not a heteroskedasticity-robust type: " + type);
        }
        return new VcovSpec(type, type.name(), null);
    }

    public static VcovSpec crv1(String clusterColumn) {
        return cluster(VcovType.CRV1, clusterColumn);
    }

    public static VcovSpec crv3(String clusterColumn) {
        return cluster(VcovType.CRV3, clusterColumn);
    }

    private static VcovSpec cluster(VcovType type, String clusterColumn) {
        if (clusterColumn == null || clusterColumn.isBlank()) {
            throw new PreconditionViolationException(type + " needs a cluster column name");
        }
        return new VcovSpec(type, type.name(), clusterColumn.trim());
    }

    /**
     * Accepts the loose encodings: a type name ({@code "iid"}, {@code "hetero"},
     * {@code "HC1"}, {@code "HC2"}, {@code "HC3"}), a one-entry map
     * {@code {"CRV1": "cluster"}} / {@code {"CRV3": "cluster"}}, or a one-element list
     * holding such a map.
     *
     * @throws PreconditionViolationException for anything else
     */
    public static VcovSpec parse(Object spec) {
        if (spec instanceof VcovSpec) return (VcovSpec) spec;
        if (spec instanceof String) {
            String name = ((String) spec).trim();
            switch (name) {
                case "iid": return iid();
                case "hetero": return hetero();
                case "HC1": return hetero(VcovType.HC1);
                case "HC2": return hetero(VcovType.HC2);
                case "HC3": return hetero(VcovType.HC3);
                default:
                    throw new PreconditionViolationException(
                        "Unknown vcov type '" + name + "'; expected iid, hetero, HC1, HC2, HC3 or a CRV1/CRV3 mapping");
            }
        }
        if (spec instanceof List<?>) {
            List<?> list = (List<?>) spec;
            if (list.size() != 1 || !(list.get(0) instanceof Map<?, ?>)) {
                throw new PreconditionViolationException("A vcov list must hold exactly one {CRV1|CRV3: cluster} mapping");
            }
            return parse(list.get(0));
        }
        if (spec instanceof Map<?, ?>) {
            Map<?, ?> map = (Map<?, ?>) spec;
            if (map.size() != 1) {
                throw new PreconditionViolationException("A vcov mapping must have exactly one entry, got " + map.size());
            }
            Map.Entry<?, ?> entry = map.entrySet().iterator().next();
            Object key = entry.getKey();
            if (!(entry.getValue() instanceof String)) {
                throw new PreconditionViolationException("Cluster column for " + key + " must be a column name");
            }
            String column = (String) entry.getValue();
            if ("CRV1".equals(key)) return crv1(column);
            if ("CRV3".equals(key)) return crv3(column);
            throw new PreconditionViolationException("Unknown cluster vcov type '" + key + "'; expected CRV1 or CRV3");
        }
        throw new PreconditionViolationException("Unsupported vcov specification: " + spec);
    }

    public VcovType getType() { return type; }
    public boolean isClustered() { return type.isClustered(); }

    /** Cluster column, or null for unclustered types. */
    public String getClusterColumn() { return clusterColumn; }

    /** Display name: {@code iid}, {@code hetero}, {@code HC2}, {@code CRV1}, ... */
    public String getLabel() { return label; }

    /** Label plus the cluster column for clustered types, e.g. {@code CRV1 by: state}. */
    public String describe() {
        return clusterColumn == null ? label : label + " by: " + clusterColumn;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VcovSpec)) return false;
        VcovSpec other = (VcovSpec) o;
        return type == other.type && label.equals(other.label) && Objects.equals(clusterColumn, other.clusterColumn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, label, clusterColumn);
    }

    @Override
    public String toString() { return describe(); }
}
