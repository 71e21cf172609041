package com.perfsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Objects;

/**
 * A series position accepted as a regime boundary by the E-Divisive
 * segmenter.
 *
 * <p>
 * {@code index} is expressed in the coordinates of the series handed to the
 * segmenter, {@code statistic} is the Q value of the winning split and
 * {@code probability} the permutation-test p-value that justified the
 * acceptance. Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class ChangePoint implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Orders change points by position in the series. */
    public static final Comparator<ChangePoint> BY_INDEX = Comparator.comparingInt(ChangePoint::getIndex);

    private final int index;
    private final double statistic;
    private final double probability;

    @JsonCreator
    public ChangePoint(@JsonProperty("index") int index,
            @JsonProperty("statistic") double statistic,
            @JsonProperty("probability") double probability) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got: " + index);
        }
        this.index = index;
        this.statistic = statistic;
        this.probability = probability;
    }

    public int getIndex() {
        return index;
    }

    public double getStatistic() {
        return statistic;
    }

    public double getProbability() {
        return probability;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ChangePoint that))
            return false;
        return index == that.index
                && Double.compare(statistic, that.statistic) == 0
                && Double.compare(probability, that.probability) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, statistic, probability);
    }

    @Override
    public String toString() {
        return "ChangePoint{" +
                "index=" + index +
                ", statistic=" + statistic +
                ", probability=" + probability +
                '}';
    }
}
