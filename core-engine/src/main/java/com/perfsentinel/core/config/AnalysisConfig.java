package com.perfsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the analysis YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * poolSize: 0
 * changePoints:
 *   significance: 0.05
 *   permutations: 100
 *   seed: 1234
 * outliers:
 *   enabled: true
 *   significance: 0.05
 *   maxOutliersPercentage: 0.0
 *   useMad: false
 *   maskOutliers: true
 * </pre>
 *
 * <p>
 * Missing sections keep their defaults. Call {@link #validate()} after
 * loading.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Worker threads for batch analysis; {@code 0} means cores minus one. */
    private int poolSize = 0;

    private ChangePointSettings changePoints = new ChangePointSettings();

    private OutlierSettings outliers = new OutlierSettings();

    /**
     * Validate every section, collecting all problems.
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (poolSize < 0) {
            errors.add("poolSize must be >= 0, got: " + poolSize);
        }
        changePoints.collectErrors(errors);
        outliers.collectErrors(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Analysis configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * @return configured pool size, or {@code max(1, cores - 1)} when unset
     */
    public int effectivePoolSize() {
        return poolSize > 0
                ? poolSize
                : Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public ChangePointSettings getChangePoints() {
        return changePoints;
    }

    /**
     * Set the change-point section (used by SnakeYAML); {@code null} keeps the
     * defaults.
     */
    public void setChangePoints(ChangePointSettings changePoints) {
        this.changePoints = changePoints != null ? changePoints : new ChangePointSettings();
    }

    public OutlierSettings getOutliers() {
        return outliers;
    }

    /**
     * Set the outlier section (used by SnakeYAML); {@code null} keeps the
     * defaults.
     */
    public void setOutliers(OutlierSettings outliers) {
        this.outliers = outliers != null ? outliers : new OutlierSettings();
    }

    @Override
    public String toString() {
        return "AnalysisConfig{poolSize=" + poolSize
                + ", changePoints=" + changePoints
                + ", outliers=" + outliers + '}';
    }
}
