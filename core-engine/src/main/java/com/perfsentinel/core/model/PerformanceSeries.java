package com.perfsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * An ordered series of results for one {@link SeriesIdentifier}, together
 * with the revision each value was measured on.
 *
 * <p>
 * The values are kept in the order given at construction. Detection never
 * reorders them; only {@link #fromPoints(SeriesIdentifier, Collection)}
 * establishes that order from the points' {@code order} field.
 * </p>
 *
 * @since 1.0.0
 */
public final class PerformanceSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final SeriesIdentifier identifier;
    private final double[] values;
    private final List<String> revisions;

    /**
     * @param identifier the series identifier; must not be {@code null}
     * @param values     the ordered values; copied
     * @param revisions  revision per value, or {@code null} when unknown
     * @throws IllegalArgumentException if {@code revisions} does not match
     *                                  {@code values} in length
     */
    public PerformanceSeries(SeriesIdentifier identifier, double[] values, List<String> revisions) {
        this.identifier = Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (revisions != null && revisions.size() != values.length) {
            throw new IllegalArgumentException("Expected " + values.length
                    + " revisions for series '" + identifier + "', got: " + revisions.size());
        }
        this.values = values.clone();
        this.revisions = revisions != null
                ? Collections.unmodifiableList(new ArrayList<>(revisions))
                : Collections.emptyList();
    }

    /**
     * Assemble a series from raw points.
     *
     * <p>
     * Points are ordered by {@link PerformancePoint#getOrder()}. When several
     * points share an order (a re-run of the same revision) the last one in
     * iteration order wins.
     * </p>
     *
     * @param identifier the series the points belong to
     * @param points     the raw points; must all belong to {@code identifier}
     * @return the assembled series
     * @throws IllegalArgumentException if a point belongs to another series
     */
    public static PerformanceSeries fromPoints(SeriesIdentifier identifier,
            Collection<PerformancePoint> points) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(points, "points must not be null");

        Map<Long, PerformancePoint> byOrder = new TreeMap<>();
        for (PerformancePoint point : points) {
            Objects.requireNonNull(point, "point must not be null");
            if (!identifier.equals(point.getIdentifier())) {
                throw new IllegalArgumentException("Point " + point
                        + " does not belong to series '" + identifier + "'");
            }
            byOrder.put(point.getOrder(), point);
        }

        double[] values = new double[byOrder.size()];
        List<String> revisions = new ArrayList<>(byOrder.size());
        int i = 0;
        for (PerformancePoint point : byOrder.values()) {
            values[i++] = point.getValue();
            revisions.add(point.getRevision());
        }
        return new PerformanceSeries(identifier, values, revisions);
    }

    public SeriesIdentifier getIdentifier() {
        return identifier;
    }

    /**
     * @return a copy of the ordered values
     */
    public double[] getValues() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    /**
     * @return revisions aligned with the values, empty when unknown
     */
    public List<String> getRevisions() {
        return revisions;
    }

    /**
     * @param index position in the series
     * @return the revision at {@code index}, or {@code null} when unknown
     */
    public String revisionAt(int index) {
        return revisions.isEmpty() ? null : revisions.get(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PerformanceSeries that))
            return false;
        return identifier.equals(that.identifier)
                && Arrays.equals(values, that.values)
                && revisions.equals(that.revisions);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(identifier, revisions) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "PerformanceSeries{" +
                "identifier=" + identifier +
                ", size=" + values.length +
                '}';
    }
}
