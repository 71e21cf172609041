package com.perfsentinel.core.model;

/**
 * Human-oriented bucket for the magnitude of a change point.
 *
 * <p>
 * Magnitudes are natural logarithms of the ratio between the means of the
 * regimes after and before the change, so the thresholds below correspond
 * to roughly 39% and 18% shifts.
 * </p>
 *
 * @since 1.0.0
 */
public enum ChangeCategory {

    MAJOR_REGRESSION("Major Regression"),
    MODERATE_REGRESSION("Moderate Regression"),
    MINOR_REGRESSION("Minor Regression"),
    MINOR_IMPROVEMENT("Minor Improvement"),
    MODERATE_IMPROVEMENT("Moderate Improvement"),
    MAJOR_IMPROVEMENT("Major Improvement"),
    UNCATEGORIZED("Uncategorized");

    static final double MAJOR_REGRESSION_MAGNITUDE = -0.5;
    static final double MODERATE_REGRESSION_MAGNITUDE = -0.2;
    static final double MINOR_REGRESSION_MAGNITUDE = 0.0;
    static final double MODERATE_IMPROVEMENT_MAGNITUDE = 0.2;
    static final double MAJOR_IMPROVEMENT_MAGNITUDE = 0.5;

    private final String label;

    ChangeCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Bucket a magnitude. {@code NaN} is {@link #UNCATEGORIZED}.
     *
     * @param magnitude log ratio of the regime means
     * @return the category
     */
    public static ChangeCategory fromMagnitude(double magnitude) {
        if (Double.isNaN(magnitude)) {
            return UNCATEGORIZED;
        }
        if (magnitude < MAJOR_REGRESSION_MAGNITUDE) {
            return MAJOR_REGRESSION;
        }
        if (magnitude < MODERATE_REGRESSION_MAGNITUDE) {
            return MODERATE_REGRESSION;
        }
        if (magnitude < MINOR_REGRESSION_MAGNITUDE) {
            return MINOR_REGRESSION;
        }
        if (magnitude > MAJOR_IMPROVEMENT_MAGNITUDE) {
            return MAJOR_IMPROVEMENT;
        }
        if (magnitude > MODERATE_IMPROVEMENT_MAGNITUDE) {
            return MODERATE_IMPROVEMENT;
        }
        return MINOR_IMPROVEMENT;
    }
}
