package com.perfsentinel.core.analysis;

import com.perfsentinel.core.model.SeriesAnalysis;
import com.perfsentinel.core.model.SeriesIdentifier;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of analysing one series in a batch: either a complete
 * {@link SeriesAnalysis} or the reason it failed, never both.
 *
 * @since 1.0.0
 */
public final class SeriesOutcome {

    private final SeriesIdentifier identifier;
    private final SeriesAnalysis analysis;
    private final String failure;
    private final long durationMillis;

    private SeriesOutcome(SeriesIdentifier identifier, SeriesAnalysis analysis, String failure,
            long durationMillis) {
        this.identifier = Objects.requireNonNull(identifier, "identifier must not be null");
        this.analysis = analysis;
        this.failure = failure;
        this.durationMillis = durationMillis;
    }

    public static SeriesOutcome success(SeriesIdentifier identifier, SeriesAnalysis analysis,
            long durationMillis) {
        return new SeriesOutcome(identifier,
                Objects.requireNonNull(analysis, "analysis must not be null"), null, durationMillis);
    }

    public static SeriesOutcome failure(SeriesIdentifier identifier, String failure, long durationMillis) {
        return new SeriesOutcome(identifier, null,
                Objects.requireNonNull(failure, "failure must not be null"), durationMillis);
    }

    public SeriesIdentifier getIdentifier() {
        return identifier;
    }

    public boolean isSuccess() {
        return analysis != null;
    }

    public Optional<SeriesAnalysis> getAnalysis() {
        return Optional.ofNullable(analysis);
    }

    /**
     * @return the failure message, empty for a successful outcome
     */
    public Optional<String> getFailure() {
        return Optional.ofNullable(failure);
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    @Override
    public String toString() {
        return "SeriesOutcome{identifier=" + identifier
                + (isSuccess() ? ", changePoints=" + analysis.getChangePoints().size() : ", failure='" + failure + '\'')
                + ", durationMillis=" + durationMillis + '}';
    }
}
