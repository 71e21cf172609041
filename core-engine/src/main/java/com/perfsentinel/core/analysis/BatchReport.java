package com.perfsentinel.core.analysis;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcomes of a batch, in submission order.
 *
 * @since 1.0.0
 */
public final class BatchReport {

    private final List<SeriesOutcome> outcomes;

    public BatchReport(List<SeriesOutcome> outcomes) {
        this.outcomes = List.copyOf(Objects.requireNonNull(outcomes, "outcomes must not be null"));
    }

    public List<SeriesOutcome> getOutcomes() {
        return outcomes;
    }

    public List<SeriesOutcome> getSuccesses() {
        return outcomes.stream().filter(SeriesOutcome::isSuccess).collect(Collectors.toList());
    }

    public List<SeriesOutcome> getFailures() {
        return outcomes.stream().filter(o -> !o.isSuccess()).collect(Collectors.toList());
    }

    public int size() {
        return outcomes.size();
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(o -> !o.isSuccess());
    }

    @Override
    public String toString() {
        return "BatchReport{series=" + outcomes.size()
                + ", failures=" + getFailures().size() + '}';
    }
}
