package com.perfsentinel.flink;

import com.perfsentinel.core.analysis.SeriesAnalyzer;
import com.perfsentinel.core.config.AnalysisConfig;
import com.perfsentinel.core.model.PerformancePoint;
import com.perfsentinel.core.model.PerformanceSeries;
import com.perfsentinel.core.model.SeriesAnalysis;
import com.perfsentinel.core.model.SeriesIdentifier;
import org.apache.flink.api.common.state.MapState;
import org.apache.flink.api.common.state.MapStateDescriptor;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Keyed process function that collects the points of one series and
 * re-analyses the whole series once new points stop arriving.
 *
 * <h3>State Management</h3>
 * <p>
 * A {@code MapState<Long, PerformancePoint>} keyed by commit order holds the
 * series, so a re-run of a revision replaces the earlier result. A
 * {@code ValueState<Long>} remembers the pending processing-time timer.
 * </p>
 *
 * <h3>Debounce</h3>
 * <p>
 * The first point after an analysis registers a timer {@code debounceMs}
 * ahead; further points before it fires are absorbed. When it fires, the
 * series is analysed and one {@link SeriesAnalysis} is emitted.
 * </p>
 *
 * <h3>Retention</h3>
 * <p>
 * Only the {@code maxPoints} newest points by commit order are kept; older
 * ones are evicted from state before each analysis, which bounds both the
 * state and the quadratic cost of segmentation.
 * </p>
 *
 * <p>
 * A failing series is logged and counted and produces no output; the keyed
 * state is kept so that the next point retries it.
 * </p>
 *
 * @since 1.0.0
 */
public class SeriesAnalysisFunction
        extends KeyedProcessFunction<String, PerformancePoint, SeriesAnalysis> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SeriesAnalysisFunction.class);

    private final AnalysisConfig analysisConfig;
    private final long debounceMs;
    private final int maxPoints;

    private transient MapState<Long, PerformancePoint> pointsState;
    private transient ValueState<Long> timerState;
    private transient SeriesAnalyzer analyzer;
    private transient SentinelMetrics metrics;

    /**
     * @param analysisConfig validated analysis configuration
     * @param debounceMs     quiet period before a series is analysed, &gt;= 0
     * @param maxPoints      newest points kept per series, &gt;= 1
     */
    public SeriesAnalysisFunction(AnalysisConfig analysisConfig, long debounceMs, int maxPoints) {
        this.analysisConfig = Objects.requireNonNull(analysisConfig, "analysisConfig must not be null");
        if (debounceMs < 0) {
            throw new IllegalArgumentException("debounceMs must be >= 0, got: " + debounceMs);
        }
        if (maxPoints < 1) {
            throw new IllegalArgumentException("maxPoints must be >= 1, got: " + maxPoints);
        }
        this.debounceMs = debounceMs;
        this.maxPoints = maxPoints;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        pointsState = getRuntimeContext().getMapState(new MapStateDescriptor<>(
                "series-points", Types.LONG, TypeInformation.of(PerformancePoint.class)));
        timerState = getRuntimeContext().getState(new ValueStateDescriptor<>(
                "pending-analysis-timer", Types.LONG));

        analyzer = new SeriesAnalyzer(analysisConfig);
        metrics = new SentinelMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("SeriesAnalysisFunction opened with {}", analysisConfig);
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(PerformancePoint point,
            KeyedProcessFunction<String, PerformancePoint, SeriesAnalysis>.Context ctx,
            Collector<SeriesAnalysis> out) throws Exception {
        pointsState.put(point.getOrder(), point);
        metrics.incrementPointsReceived();

        if (timerState.value() == null) {
            long fireAt = ctx.timerService().currentProcessingTime() + debounceMs;
            ctx.timerService().registerProcessingTimeTimer(fireAt);
            timerState.update(fireAt);
            LOG.debug("Series [{}]: analysis scheduled at {}", ctx.getCurrentKey(), fireAt);
        }
    }

    @Override
    public void onTimer(long timestamp,
            KeyedProcessFunction<String, PerformancePoint, SeriesAnalysis>.OnTimerContext ctx,
            Collector<SeriesAnalysis> out) throws Exception {
        timerState.clear();

        List<Long> orders = new ArrayList<>();
        for (Long order : pointsState.keys()) {
            orders.add(order);
        }
        List<Long> evicted = oldestBeyond(orders, maxPoints);
        for (Long order : evicted) {
            pointsState.remove(order);
        }
        if (!evicted.isEmpty()) {
            LOG.debug("Series [{}]: evicted {} point(s) beyond the newest {}",
                    ctx.getCurrentKey(), evicted.size(), maxPoints);
        }

        List<PerformancePoint> points = new ArrayList<>();
        for (PerformancePoint point : pointsState.values()) {
            points.add(point);
        }
        if (points.isEmpty()) {
            return;
        }

        long startNanos = System.nanoTime();
        try {
            SeriesIdentifier identifier = points.get(0).getIdentifier();
            SeriesAnalysis analysis = analyzer.analyze(PerformanceSeries.fromPoints(identifier, points));
            long durationMs = (System.nanoTime() - startNanos) / 1_000_000;

            out.collect(analysis);
            metrics.recordAnalysis(analysis.getChangePoints().size(),
                    analysis.getOutliers().getConfirmedCount(), durationMs);
            LOG.info("Series [{}] analysed: {} point(s), {} change point(s), {} confirmed outlier(s) in {} ms",
                    ctx.getCurrentKey(), analysis.getSeriesLength(), analysis.getChangePoints().size(),
                    analysis.getOutliers().getConfirmedCount(), durationMs);
        } catch (RuntimeException e) {
            metrics.incrementAnalysisFailures();
            LOG.error("Series [{}] analysis failed, keeping state for the next point",
                    ctx.getCurrentKey(), e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * @return the smallest orders that exceed {@code limit}, oldest first
     */
    static List<Long> oldestBeyond(Collection<Long> orders, int limit) {
        if (orders.size() <= limit) {
            return List.of();
        }
        List<Long> sorted = new ArrayList<>(orders);
        Collections.sort(sorted);
        return List.copyOf(sorted.subList(0, sorted.size() - limit));
    }
}
