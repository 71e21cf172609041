package com.perfsentinel.core.analysis;

import com.perfsentinel.core.config.AnalysisConfig;
import com.perfsentinel.core.model.PerformanceSeries;
import com.perfsentinel.core.model.SeriesAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Analyses many independent series on a fixed worker pool.
 *
 * <p>
 * One task per series; each task runs its own segmentation and permutation
 * loop. A series that fails is reported in the {@link BatchReport} and
 * does not affect the others.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * The pool is created by the constructor and released by {@link #close()}.
 * Workers are daemon threads named {@code series-analyzer-N}.
 * </p>
 *
 * @since 1.0.0
 */
public class SeriesBatchAnalyzer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesBatchAnalyzer.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final SeriesAnalyzer analyzer;
    private final ExecutorService pool;
    private final int poolSize;

    /**
     * @param config validated configuration; its pool size sizes the pool
     */
    public SeriesBatchAnalyzer(AnalysisConfig config) {
        this(new SeriesAnalyzer(config), config.effectivePoolSize());
    }

    /**
     * @param analyzer per-series analyzer
     * @param poolSize worker threads, positive
     */
    public SeriesBatchAnalyzer(SeriesAnalyzer analyzer, int poolSize) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be > 0, got: " + poolSize);
        }
        this.poolSize = poolSize;

        AtomicInteger counter = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "series-analyzer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        LOG.info("Series analyzer pool started with {} worker(s)", poolSize);
    }

    /**
     * Analyse every series and wait for all of them.
     *
     * @param series the series to analyse
     * @return one outcome per series, in iteration order
     * @throws IllegalStateException if the calling thread is interrupted while
     *                               waiting; pending tasks are cancelled
     */
    public BatchReport analyzeAll(Collection<PerformanceSeries> series) {
        Objects.requireNonNull(series, "series must not be null");

        List<PerformanceSeries> submitted = new ArrayList<>(series);
        List<Future<SeriesOutcome>> futures = new ArrayList<>(submitted.size());
        for (PerformanceSeries s : submitted) {
            Objects.requireNonNull(s, "series must not contain null");
            futures.add(pool.submit(() -> analyzeOne(s)));
        }

        List<SeriesOutcome> outcomes = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                outcomes.add(futures.get(i).get());
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for series analysis", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                LOG.error("Series [{}] analysis aborted: {}", submitted.get(i).getIdentifier(),
                        cause.getMessage(), cause);
                outcomes.add(SeriesOutcome.failure(submitted.get(i).getIdentifier(), String.valueOf(cause), 0));
            }
        }

        BatchReport report = new BatchReport(outcomes);
        LOG.info("Analysed {} series: {}", report.size(), report);
        return report;
    }

    public int getPoolSize() {
        return poolSize;
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Series analyzer pool did not terminate within {}s, forcing shutdown",
                        SHUTDOWN_TIMEOUT_SECONDS);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Series analyzer pool stopped");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private SeriesOutcome analyzeOne(PerformanceSeries series) {
        long start = System.nanoTime();
        try {
            SeriesAnalysis analysis = analyzer.analyze(series);
            return SeriesOutcome.success(series.getIdentifier(), analysis, elapsedMillis(start));
        } catch (RuntimeException e) {
            LOG.error("Series [{}] analysis failed: {}", series.getIdentifier(), e.getMessage(), e);
            return SeriesOutcome.failure(series.getIdentifier(), e.getMessage() != null
                    ? e.getMessage()
                    : e.getClass().getSimpleName(), elapsedMillis(start));
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
