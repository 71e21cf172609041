package com.perfsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Output of the Generalized ESD outlier test.
 *
 * <p>
 * {@code order} lists candidate indexes in the order they were peeled off
 * (most extreme first). {@code statistics[i]} and {@code criticalValues[i]}
 * are the test statistic and the critical value of iteration {@code i}.
 * The first {@code confirmedCount} entries of {@code order} are confirmed
 * outliers; the remaining entries are suspicious candidates kept for
 * inspection only.
 * </p>
 *
 * <h3>Invariant</h3>
 * <p>
 * {@code 0 <= confirmedCount <= order.size()}, and the three lists have the
 * same length. The constructor rejects anything else.
 * </p>
 *
 * @since 1.0.0
 */
public final class OutlierResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final OutlierResult EMPTY = new OutlierResult(List.of(), 0, List.of(), List.of());

    private final List<Integer> order;
    private final int confirmedCount;
    private final List<Double> statistics;
    private final List<Double> criticalValues;

    @JsonCreator
    public OutlierResult(@JsonProperty("order") List<Integer> order,
            @JsonProperty("confirmedCount") int confirmedCount,
            @JsonProperty("statistics") List<Double> statistics,
            @JsonProperty("criticalValues") List<Double> criticalValues) {
        Objects.requireNonNull(order, "order must not be null");
        Objects.requireNonNull(statistics, "statistics must not be null");
        Objects.requireNonNull(criticalValues, "criticalValues must not be null");

        if (statistics.size() != order.size() || criticalValues.size() != order.size()) {
            throw new IllegalArgumentException(
                    "order, statistics and criticalValues must have the same length, got: "
                            + order.size() + ", " + statistics.size() + ", " + criticalValues.size());
        }
        if (confirmedCount < 0 || confirmedCount > order.size()) {
            throw new IllegalArgumentException(
                    "confirmedCount must be in [0, " + order.size() + "], got: " + confirmedCount);
        }

        this.order = Collections.unmodifiableList(new ArrayList<>(order));
        this.confirmedCount = confirmedCount;
        this.statistics = Collections.unmodifiableList(new ArrayList<>(statistics));
        this.criticalValues = Collections.unmodifiableList(new ArrayList<>(criticalValues));
    }

    /**
     * @return a result with no candidates and no confirmed outliers
     */
    public static OutlierResult empty() {
        return EMPTY;
    }

    public List<Integer> getOrder() {
        return order;
    }

    public int getConfirmedCount() {
        return confirmedCount;
    }

    public List<Double> getStatistics() {
        return statistics;
    }

    public List<Double> getCriticalValues() {
        return criticalValues;
    }

    /**
     * @return indexes of the confirmed outliers, most extreme first
     */
    @JsonIgnore
    public List<Integer> getConfirmedIndexes() {
        return order.subList(0, confirmedCount);
    }

    /**
     * @return indexes of candidates that were scored but not confirmed
     */
    @JsonIgnore
    public List<Integer> getSuspiciousIndexes() {
        return order.subList(confirmedCount, order.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof OutlierResult that))
            return false;
        return confirmedCount == that.confirmedCount
                && order.equals(that.order)
                && statistics.equals(that.statistics)
                && criticalValues.equals(that.criticalValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(order, confirmedCount, statistics, criticalValues);
    }

    @Override
    public String toString() {
        return "OutlierResult{" +
                "order=" + order +
                ", confirmedCount=" + confirmedCount +
                ", statistics=" + statistics +
                ", criticalValues=" + criticalValues +
                '}';
    }
}
