package com.perfsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of analysing one performance series: its change points and its
 * outliers.
 *
 * <p>
 * Serialized to JSON and published to the configured Kafka analysis topic.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder} to construct instances. The builder enforces that
 * {@code identifier} and {@code analyzedAt} are present; omitting either will
 * throw a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public class SeriesAnalysis implements Serializable {

    private static final long serialVersionUID = 1L;

    private SeriesIdentifier identifier;

    /** Number of values that were analysed. */
    private int seriesLength;

    /** Change points ordered by index. */
    private List<ClassifiedChangePoint> changePoints = new ArrayList<>();

    private OutlierResult outliers = OutlierResult.empty();

    /** Revisions of the confirmed outliers, most extreme first. */
    private List<String> outlierRevisions = new ArrayList<>();

    private Instant analyzedAt;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public SeriesAnalysis() {
    }

    private SeriesAnalysis(Builder builder) {
        this.identifier = Objects.requireNonNull(builder.identifier, "identifier must not be null");
        this.analyzedAt = Objects.requireNonNull(builder.analyzedAt, "analyzedAt must not be null");
        this.seriesLength = builder.seriesLength;
        this.changePoints = new ArrayList<>(builder.changePoints);
        this.outliers = builder.outliers != null ? builder.outliers : OutlierResult.empty();
        this.outlierRevisions = new ArrayList<>(builder.outlierRevisions);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link SeriesAnalysis} instances.
     *
     * <p>
     * {@code identifier} and {@code analyzedAt} are <strong>required</strong>.
     * </p>
     */
    public static class Builder {
        private SeriesIdentifier identifier;
        private int seriesLength;
        private List<ClassifiedChangePoint> changePoints = List.of();
        private OutlierResult outliers;
        private List<String> outlierRevisions = List.of();
        private Instant analyzedAt;

        public Builder identifier(SeriesIdentifier identifier) {
            this.identifier = identifier;
            return this;
        }

        public Builder seriesLength(int seriesLength) {
            this.seriesLength = seriesLength;
            return this;
        }

        public Builder changePoints(List<ClassifiedChangePoint> changePoints) {
            this.changePoints = Objects.requireNonNull(changePoints, "changePoints must not be null");
            return this;
        }

        public Builder outliers(OutlierResult outliers) {
            this.outliers = outliers;
            return this;
        }

        public Builder outlierRevisions(List<String> outlierRevisions) {
            this.outlierRevisions = Objects.requireNonNull(outlierRevisions,
                    "outlierRevisions must not be null");
            return this;
        }

        public Builder analyzedAt(Instant analyzedAt) {
            this.analyzedAt = analyzedAt;
            return this;
        }

        /**
         * Build the analysis.
         *
         * @return a new {@link SeriesAnalysis}
         * @throws NullPointerException if {@code identifier} or {@code analyzedAt}
         *                              is {@code null}
         */
        public SeriesAnalysis build() {
            return new SeriesAnalysis(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public SeriesIdentifier getIdentifier() {
        return identifier;
    }

    public void setIdentifier(SeriesIdentifier identifier) {
        this.identifier = identifier;
    }

    public int getSeriesLength() {
        return seriesLength;
    }

    public void setSeriesLength(int seriesLength) {
        this.seriesLength = seriesLength;
    }

    /**
     * @return unmodifiable view of the change points, ordered by index
     */
    public List<ClassifiedChangePoint> getChangePoints() {
        return Collections.unmodifiableList(changePoints);
    }

    public void setChangePoints(List<ClassifiedChangePoint> changePoints) {
        this.changePoints = changePoints != null ? new ArrayList<>(changePoints) : new ArrayList<>();
    }

    public OutlierResult getOutliers() {
        return outliers;
    }

    public void setOutliers(OutlierResult outliers) {
        this.outliers = outliers != null ? outliers : OutlierResult.empty();
    }

    public List<String> getOutlierRevisions() {
        return Collections.unmodifiableList(outlierRevisions);
    }

    public void setOutlierRevisions(List<String> outlierRevisions) {
        this.outlierRevisions = outlierRevisions != null
                ? new ArrayList<>(outlierRevisions)
                : new ArrayList<>();
    }

    public Instant getAnalyzedAt() {
        return analyzedAt;
    }

    public void setAnalyzedAt(Instant analyzedAt) {
        this.analyzedAt = analyzedAt;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesAnalysis that))
            return false;
        return seriesLength == that.seriesLength
                && Objects.equals(identifier, that.identifier)
                && Objects.equals(changePoints, that.changePoints)
                && Objects.equals(outliers, that.outliers)
                && Objects.equals(analyzedAt, that.analyzedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, seriesLength, changePoints, outliers, analyzedAt);
    }

    @Override
    public String toString() {
        return "SeriesAnalysis{" +
                "identifier=" + identifier +
                ", seriesLength=" + seriesLength +
                ", changePoints=" + changePoints.size() +
                ", confirmedOutliers=" + outliers.getConfirmedCount() +
                ", analyzedAt=" + analyzedAt +
                '}';
    }
}
