package com.perfsentinel.core.analysis;

import com.perfsentinel.core.config.AnalysisConfig;
import com.perfsentinel.core.config.OutlierSettings;
import com.perfsentinel.core.detection.ChangePointClassifier;
import com.perfsentinel.core.detection.GesdOutlierDetector;
import com.perfsentinel.core.detection.MaskedSeries;
import com.perfsentinel.core.detection.NumericSeries;
import com.perfsentinel.core.model.ChangePoint;
import com.perfsentinel.core.model.ClassifiedChangePoint;
import com.perfsentinel.core.model.OutlierResult;
import com.perfsentinel.core.model.PerformanceSeries;
import com.perfsentinel.core.model.SeriesAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs outlier and change-point detection over one series.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>GESD over the whole series, when outlier detection is enabled</li>
 * <li>confirmed outliers removed from the input of the segmenter, when
 * masking is enabled</li>
 * <li>E-Divisive segmentation; indexes translated back to the full
 * series</li>
 * <li>windowing and classification of the change points against the full
 * series</li>
 * </ol>
 *
 * <p>
 * Every call builds its own segmenter and permutation source, so one
 * analyzer can be shared by concurrent workers and a configured seed gives
 * the same result for a series regardless of which worker runs it.
 * </p>
 *
 * @since 1.0.0
 */
public class SeriesAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesAnalyzer.class);

    private final AnalysisConfig config;
    private final Clock clock;

    /**
     * @param config validated analysis configuration
     */
    public SeriesAnalyzer(AnalysisConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * @param config validated analysis configuration
     * @param clock  source of the {@code analyzedAt} timestamp
     */
    public SeriesAnalyzer(AnalysisConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Analyse {@code series}.
     *
     * @param series the series; must hold at least one finite value
     * @return the complete analysis
     * @throws com.perfsentinel.core.detection.InvalidInputException if the
     *                                                               series is
     *                                                               empty or
     *                                                               not finite
     */
    public SeriesAnalysis analyze(PerformanceSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        double[] values = series.getValues();
        NumericSeries.requireUsable(values);

        OutlierResult outliers = detectOutliers(values);
        List<Integer> confirmed = outliers.getConfirmedIndexes();

        List<ChangePoint> changePoints;
        if (config.getOutliers().isMaskOutliers() && !confirmed.isEmpty()) {
            MaskedSeries masked = NumericSeries.withoutIndexes(values, confirmed);
            changePoints = masked.toOriginal(config.getChangePoints().newSegmenter().detect(masked.getValues()));
        } else {
            changePoints = config.getChangePoints().newSegmenter().detect(values);
        }

        List<ClassifiedChangePoint> classified = ChangePointClassifier.classify(values, changePoints,
                series.getRevisions(), config.getChangePoints().getWeighting());

        List<String> outlierRevisions = new ArrayList<>();
        if (!series.getRevisions().isEmpty()) {
            for (int index : confirmed) {
                outlierRevisions.add(series.revisionAt(index));
            }
        }

        LOG.debug("Series [{}]: {} values, {} change point(s), {} confirmed outlier(s)",
                series.getIdentifier(), values.length, classified.size(), confirmed.size());

        return SeriesAnalysis.builder()
                .identifier(series.getIdentifier())
                .seriesLength(values.length)
                .changePoints(classified)
                .outliers(outliers)
                .outlierRevisions(outlierRevisions)
                .analyzedAt(clock.instant())
                .build();
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    private OutlierResult detectOutliers(double[] values) {
        OutlierSettings settings = config.getOutliers();
        if (!settings.isEnabled()) {
            return OutlierResult.empty();
        }
        int maxOutliers = GesdOutlierDetector.maxOutliersFor(values.length, settings.getMaxOutliersPercentage());
        return settings.newDetector().detect(values, maxOutliers);
    }
}
