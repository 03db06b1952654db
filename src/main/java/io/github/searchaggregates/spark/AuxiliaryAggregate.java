package io.github.searchaggregates.spark;

import org.apache.spark.sql.Column;

import java.util.Objects;

/**
 * An extra aggregate computed alongside {@code sum(count)} at the (dimensions, type) granularity.
 *
 * <p>After the pivot it appears once per search type as {@code <type label>_<name>}, e.g.
 * {@code tagged-sap_client_count} for {@code AuxiliaryAggregate.of("client_count",
 * countDistinct("client_id"))}.</p>
 */
public final class AuxiliaryAggregate {

    private final String name;
    private final Column expression;

    private AuxiliaryAggregate(String name, Column expression) {
        this.name = name;
        this.expression = expression;
    }

    public static AuxiliaryAggregate of(String name, Column expression) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Auxiliary aggregate name cannot be null or empty");
        }
        Objects.requireNonNull(expression, "expression");
        return new AuxiliaryAggregate(name, expression);
    }

    public String getName() {
        return name;
    }

    /**
     * The aggregate bound to its name, ready for {@code agg(...)}.
     */
    Column named() {
        return expression.as(name);
    }

    String pivotedName(String typeLabel) {
        return typeLabel + "_" + name;
    }

    @Override
    public String toString() {
        return name + "=" + expression;
    }
}
