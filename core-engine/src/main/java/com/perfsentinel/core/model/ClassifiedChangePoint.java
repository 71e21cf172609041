package com.perfsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * A {@link ChangePoint} enriched with the window that brackets the shift,
 * the statistics of the regimes on either side of that window, its
 * magnitude and its category.
 *
 * @since 1.0.0
 */
public final class ClassifiedChangePoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ChangePoint changePoint;
    private final ChangeWindow window;

    /** Revision at the change point index, {@code null} when unknown. */
    private final String revision;

    /** Last revision on the old level, {@code null} when unknown. */
    private final String stableRevision;

    /** First revision on the new level, {@code null} when unknown. */
    private final String suspectRevision;

    /** Regime ending at the window start; {@code null} when empty. */
    private final RegimeStatistics previous;

    /** Regime starting at the window end; {@code null} when empty. */
    private final RegimeStatistics next;

    private final double magnitude;
    private final ChangeCategory category;

    @JsonCreator
    public ClassifiedChangePoint(@JsonProperty("changePoint") ChangePoint changePoint,
            @JsonProperty("window") ChangeWindow window,
            @JsonProperty("revision") String revision,
            @JsonProperty("stableRevision") String stableRevision,
            @JsonProperty("suspectRevision") String suspectRevision,
            @JsonProperty("previous") RegimeStatistics previous,
            @JsonProperty("next") RegimeStatistics next,
            @JsonProperty("magnitude") double magnitude,
            @JsonProperty("category") ChangeCategory category) {
        this.changePoint = Objects.requireNonNull(changePoint, "changePoint must not be null");
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.revision = revision;
        this.stableRevision = stableRevision;
        this.suspectRevision = suspectRevision;
        this.previous = previous;
        this.next = next;
        this.magnitude = magnitude;
        this.category = Objects.requireNonNull(category, "category must not be null");
    }

    public ChangePoint getChangePoint() {
        return changePoint;
    }

    public ChangeWindow getWindow() {
        return window;
    }

    public String getRevision() {
        return revision;
    }

    public String getStableRevision() {
        return stableRevision;
    }

    public String getSuspectRevision() {
        return suspectRevision;
    }

    public RegimeStatistics getPrevious() {
        return previous;
    }

    public RegimeStatistics getNext() {
        return next;
    }

    public double getMagnitude() {
        return magnitude;
    }

    public ChangeCategory getCategory() {
        return category;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ClassifiedChangePoint that))
            return false;
        return changePoint.equals(that.changePoint)
                && window.equals(that.window)
                && Objects.equals(revision, that.revision)
                && category == that.category;
    }

    @Override
    public int hashCode() {
        return Objects.hash(changePoint, window, revision, category);
    }

    @Override
    public String toString() {
        return "ClassifiedChangePoint{" +
                "index=" + changePoint.getIndex() +
                ", window=(" + window.getStart() + ", " + window.getEnd() + ")" +
                ", suspectRevision='" + suspectRevision + '\'' +
                ", magnitude=" + magnitude +
                ", category=" + category +
                '}';
    }
}
