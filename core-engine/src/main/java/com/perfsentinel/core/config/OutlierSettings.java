package com.perfsentinel.core.config;

import com.perfsentinel.core.detection.GesdOutlierDetector;

import java.io.Serializable;
import java.util.List;

/**
 * GESD parameters.
 *
 * @since 1.0.0
 */
public class OutlierSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private boolean enabled = true;

    private double significance = 0.05;

    /**
     * Share of the series tested, see
     * {@link GesdOutlierDetector#maxOutliersFor(int, double)}.
     */
    private double maxOutliersPercentage = 0.0;

    /** Median/MAD instead of mean/standard deviation. */
    private boolean useMad = false;

    /** Remove confirmed outliers before change-point detection. */
    private boolean maskOutliers = true;

    void collectErrors(List<String> errors) {
        if (!(significance > 0 && significance < 1)) {
            errors.add("outliers.significance must be in (0, 1), got: " + significance);
        }
        if (!(maxOutliersPercentage >= 0 && maxOutliersPercentage <= 1)) {
            errors.add("outliers.maxOutliersPercentage must be in [0, 1], got: " + maxOutliersPercentage);
        }
        if (maskOutliers && !enabled) {
            errors.add("outliers.maskOutliers requires outliers.enabled");
        }
    }

    /**
     * @return a detector using these settings
     */
    public GesdOutlierDetector newDetector() {
        return new GesdOutlierDetector(significance, useMad);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double getSignificance() {
        return significance;
    }

    public void setSignificance(double significance) {
        this.significance = significance;
    }

    public double getMaxOutliersPercentage() {
        return maxOutliersPercentage;
    }

    public void setMaxOutliersPercentage(double maxOutliersPercentage) {
        this.maxOutliersPercentage = maxOutliersPercentage;
    }

    public boolean isUseMad() {
        return useMad;
    }

    public void setUseMad(boolean useMad) {
        this.useMad = useMad;
    }

    public boolean isMaskOutliers() {
        return maskOutliers;
    }

    public void setMaskOutliers(boolean maskOutliers) {
        this.maskOutliers = maskOutliers;
    }

    @Override
    public String toString() {
        return "OutlierSettings{enabled=" + enabled
                + ", significance=" + significance
                + ", maxOutliersPercentage=" + maxOutliersPercentage
                + ", useMad=" + useMad
                + ", maskOutliers=" + maskOutliers + '}';
    }
}
