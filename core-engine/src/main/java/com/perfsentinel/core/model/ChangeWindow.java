package com.perfsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * The pair of neighbouring positions that brackets a change point.
 *
 * <p>
 * {@code start} is the last position still measuring the old level (the
 * stable revision), {@code end} the first measuring the new one (the
 * suspect revision). When the window cannot be narrowed both are equal to
 * the reported index. Either bound may fall outside the series for change
 * points at its very edge.
 * </p>
 *
 * @since 1.0.0
 */
public final class ChangeWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Index reported by the segmenter. */
    private final int index;
    private final int start;
    private final int end;
    private final ChangeLocation location;

    @JsonCreator
    public ChangeWindow(@JsonProperty("index") int index,
            @JsonProperty("start") int start,
            @JsonProperty("end") int end,
            @JsonProperty("location") ChangeLocation location) {
        this.index = index;
        this.start = start;
        this.end = end;
        this.location = Objects.requireNonNull(location, "location must not be null");
    }

    public int getIndex() {
        return index;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public ChangeLocation getLocation() {
        return location;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ChangeWindow that))
            return false;
        return index == that.index
                && start == that.start
                && end == that.end
                && location == that.location;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, start, end, location);
    }

    @Override
    public String toString() {
        return "ChangeWindow{index=" + index + ", start=" + start + ", end=" + end
                + ", location=" + location + '}';
    }
}
