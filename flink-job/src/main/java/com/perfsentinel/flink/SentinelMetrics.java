package com.perfsentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metrics of the analysis operator.
 * <p>
 * Reported through the reporters configured in {@code flink-conf.yaml}.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code points_received_total} – points added to series state</li>
 *   <li>{@code series_analyzed_total} – completed series analyses</li>
 *   <li>{@code change_points_detected_total} – change points emitted</li>
 *   <li>{@code outliers_confirmed_total} – confirmed outliers emitted</li>
 *   <li>{@code analysis_failures_total} – series whose analysis failed</li>
 *   <li>{@code analysis_latency_ms} – histogram of per-series analysis time</li>
 * </ul>
 */
public class SentinelMetrics {

    private final Counter pointsReceived;
    private final Counter seriesAnalyzed;
    private final Counter changePointsDetected;
    private final Counter outliersConfirmed;
    private final Counter analysisFailures;
    private final Histogram analysisLatency;

    public SentinelMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("perf_sentinel");

        this.pointsReceived = group.counter("points_received_total");
        this.seriesAnalyzed = group.counter("series_analyzed_total");
        this.changePointsDetected = group.counter("change_points_detected_total");
        this.outliersConfirmed = group.counter("outliers_confirmed_total");
        this.analysisFailures = group.counter("analysis_failures_total");
        this.analysisLatency = group
                .histogram("analysis_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementPointsReceived() {
        pointsReceived.inc();
    }

    public void recordAnalysis(int changePoints, int confirmedOutliers, long milliseconds) {
        seriesAnalyzed.inc();
        changePointsDetected.inc(changePoints);
        outliersConfirmed.inc(confirmedOutliers);
        analysisLatency.update(milliseconds);
    }

    public void incrementAnalysisFailures() {
        analysisFailures.inc();
    }
}
