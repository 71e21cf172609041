package com.perfsentinel.core.detection;

import com.perfsentinel.core.model.ChangePoint;

import java.util.ArrayList;
import java.util.List;

/**
 * A series with some positions removed, and the way back to the original
 * coordinates.
 *
 * @since 1.0.0
 */
public final class MaskedSeries {

    private final double[] values;
    private final int[] positions;

    MaskedSeries(double[] values, int[] positions) {
        this.values = values;
        this.positions = positions;
    }

    /**
     * @return a copy of the surviving values, in their original order
     */
    public double[] getValues() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    /**
     * @param maskedIndex position in the masked series
     * @return the corresponding position in the original series
     */
    public int toOriginalIndex(int maskedIndex) {
        return positions[maskedIndex];
    }

    /**
     * Translate change points found on the masked values back to the
     * original series.
     *
     * @param changePoints change points in masked coordinates
     * @return change points in original coordinates, same order
     */
    public List<ChangePoint> toOriginal(List<ChangePoint> changePoints) {
        List<ChangePoint> translated = new ArrayList<>(changePoints.size());
        for (ChangePoint point : changePoints) {
            translated.add(new ChangePoint(toOriginalIndex(point.getIndex()),
                    point.getStatistic(), point.getProbability()));
        }
        return translated;
    }
}
