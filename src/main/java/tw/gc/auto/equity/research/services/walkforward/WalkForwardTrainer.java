package tw.gc.auto.equity.research.services.walkforward;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.equity.research.config.WalkForwardProperties;
import tw.gc.auto.equity.research.dataset.DatasetRow;
import tw.gc.auto.equity.research.dataset.FeatureDataset;
import tw.gc.auto.equity.research.exceptions.ConfigurationException;
import tw.gc.auto.equity.research.exceptions.DataException;
import tw.gc.auto.equity.research.exceptions.InferenceException;
import tw.gc.auto.equity.research.exceptions.ModelResearchException;
import tw.gc.auto.equity.research.exceptions.TrainingException;
import tw.gc.auto.equity.research.exceptions.WindowTimeoutException;
import tw.gc.auto.equity.research.metrics.MetricFunction;
import tw.gc.auto.equity.research.metrics.MetricStatistics;
import tw.gc.auto.equity.research.models.AdapterConfig;
import tw.gc.auto.equity.research.models.ModelAdapter;
import tw.gc.auto.equity.research.registry.ArtifactDescriptor;
import tw.gc.auto.equity.research.registry.ArtifactRegistry;
import tw.gc.auto.equity.research.registry.ContentHashes;
import tw.gc.auto.equity.research.registry.TrainingWindowBounds;

/**
 * Walk-forward training service.
 *
 * <p>For every window produced by the {@link WindowScheduler}:
 * <ol>
 *   <li>slice training rows {@code [trainStart, trainEnd)} and validation rows {@code [valStart, valEnd)}</li>
 *   <li>create a fresh adapter, fit it, score the validation slice</li>
 *   <li>compute the metrics, store the serialized adapter in the {@link ArtifactRegistry}</li>
 *   <li>record one {@link TrainingRun}</li>
 * </ol>
 *
 * <p>Data, training, inference and timeout failures fail only their window; the run carries on.
 * Invalid configuration fails before the first window. Registry errors propagate to the caller.
 *
 * <p>With {@code walkforward.parallelism > 1} windows are fitted concurrently, but artifacts are
 * committed to the registry in window order, so versions match a sequential run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WalkForwardTrainer {

    private final ArtifactRegistry artifactRegistry;
    private final DegradationDetector degradationDetector;
    private final WalkForwardProperties properties;
    private final Clock clock;

    /** Successful fit + predict of one window, waiting to be committed. */
    private record WindowEvaluation(
        ModelAdapter adapter,
        byte[] payload,
        Map<String, Double> metrics,
        List<ScoredPrediction> predictions,
        int trainRows,
        int valRows
    ) {
    }

    /** Either an evaluation or a failure, plus when work on the window began. */
    private record WindowOutcome(WalkForwardWindow window, Instant startedAt,
            WindowEvaluation evaluation, WindowFailure failure) {
    }

    /** Validated, defaults-resolved view of a request. */
    private record RunPlan(
        FeatureDataset dataset,
        WindowSchedulerConfig schedulerConfig,
        AdapterConfig adapterConfig,
        String targetColumn,
        List<MetricFunction> metrics,
        WalkForwardRequest request
    ) {
    }

    /**
     * Runs walk-forward training over every window of the dataset.
     *
     * @throws ConfigurationException if the request or its configuration is invalid
     */
    public WalkForwardSummary run(WalkForwardRequest request) {
        RunPlan plan = plan(request);
        FeatureDataset dataset = plan.dataset();
        WindowSchedulerConfig config = plan.schedulerConfig();

        log.info("🚀 Starting walk-forward training for '{}'", request.artifactFamily());
        log.info("   Dataset: schema {} | {} time points | {} rows", dataset.getSchemaVersion(),
            dataset.timeIndexLength(), dataset.getRows().size());
        log.info("   Windows: train={} val={} step={} embargo={} mode={}", config.trainSize(), config.valSize(),
            config.stepSize(), config.embargo(), config.mode());

        long started = System.currentTimeMillis();
        WindowScheduler scheduler = new WindowScheduler(config, dataset.timeIndexLength());
        int parallelism = Math.max(1, properties.getParallelism());

        List<TrainingRun> runs;
        ExecutorService attempts = Executors.newCachedThreadPool(daemonThreads("wf-window-"));
        try {
            runs = parallelism == 1
                ? runSequential(plan, scheduler, attempts)
                : runParallel(plan, scheduler, attempts, parallelism);
        } finally {
            attempts.shutdownNow();
        }

        WalkForwardSummary summary = summarize(plan, runs, System.currentTimeMillis() - started);
        log.info("✅ Walk-forward training complete: {} windows, {} succeeded, {} failed",
            summary.totalWindows(), summary.succeededWindows(), summary.failedWindows());
        if (!summary.warnings().isEmpty()) {
            log.warn("⚠️ Walk-forward warnings: {}", summary.warningMessages());
        }
        return summary;
    }

    private List<TrainingRun> runSequential(RunPlan plan, WindowScheduler scheduler, ExecutorService attempts) {
        List<TrainingRun> runs = new ArrayList<>();
        for (WalkForwardWindow window : scheduler) {
            log.info("📊 Processing {}", window.describe());
            runs.add(commit(plan, evaluateWithTimeout(plan, window, attempts)));
        }
        return runs;
    }

    private List<TrainingRun> runParallel(RunPlan plan, WindowScheduler scheduler, ExecutorService attempts,
            int parallelism) {
        ExecutorService workers = Executors.newFixedThreadPool(parallelism, daemonThreads("wf-worker-"));
        try {
            // At most `parallelism` windows in flight; the oldest is committed before the next is pulled.
            Deque<Future<WindowOutcome>> inFlight = new ArrayDeque<>(parallelism);
            List<TrainingRun> runs = new ArrayList<>();
            for (WalkForwardWindow window : scheduler) {
                if (inFlight.size() == parallelism) {
                    runs.add(commit(plan, await(inFlight.removeFirst())));
                }
                log.info("📊 Scheduling {}", window.describe());
                inFlight.addLast(workers.submit(() -> evaluateWithTimeout(plan, window, attempts)));
            }
            while (!inFlight.isEmpty()) {
                runs.add(commit(plan, await(inFlight.removeFirst())));
            }
            return runs;
        } finally {
            workers.shutdownNow();
        }
    }

    private static WindowOutcome await(Future<WindowOutcome> outcome) {
        try {
            return outcome.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for window results", e);
        } catch (ExecutionException e) {
            // evaluateWithTimeout converts every window error into an outcome
            throw new IllegalStateException("Window worker failed", e.getCause());
        }
    }

    /**
     * Fits and scores one window on its own thread, bounded by the window timeout. Never throws
     * for window-level problems; they come back as a failed outcome.
     */
    private WindowOutcome evaluateWithTimeout(RunPlan plan, WalkForwardWindow window, ExecutorService attempts) {
        Instant startedAt = clock.instant();
        Duration timeout = properties.getWindowTimeout();
        Future<WindowEvaluation> attempt = attempts.submit(() -> evaluate(plan, window));
        try {
            WindowEvaluation evaluation = timeout == null || timeout.isZero() || timeout.isNegative()
                ? attempt.get()
                : attempt.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return new WindowOutcome(window, startedAt, evaluation, null);
        } catch (TimeoutException e) {
            attempt.cancel(true);
            return failedOutcome(window, startedAt, new WindowTimeoutException(window.windowIndex(), timeout));
        } catch (ExecutionException e) {
            return failedOutcome(window, startedAt, e.getCause());
        } catch (CancellationException e) {
            return failedOutcome(window, startedAt, e);
        } catch (InterruptedException e) {
            attempt.cancel(true);
            Thread.currentThread().interrupt();
            return failedOutcome(window, startedAt, e);
        }
    }

    private WindowOutcome failedOutcome(WalkForwardWindow window, Instant startedAt, Throwable error) {
        WindowFailure failure = WindowFailure.from(error);
        log.warn("   ❌ Window {} failed: {}", window.windowIndex(), failure);
        log.debug("   Window {} failure detail", window.windowIndex(), error);
        return new WindowOutcome(window, startedAt, null, failure);
    }

    private WindowEvaluation evaluate(RunPlan plan, WalkForwardWindow window) {
        FeatureDataset dataset = plan.dataset();
        String target = plan.targetColumn();

        List<DatasetRow> trainSlice = dataset.slice(window.trainStart(), window.trainEnd());
        if (trainSlice.isEmpty()) {
            throw new DataException("Training slice of window %d is empty".formatted(window.windowIndex()));
        }
        List<DatasetRow> trainRows = trainSlice.stream().filter(r -> r.hasFinite(target)).toList();
        if (trainRows.isEmpty()) {
            throw new DataException("Training slice of window %d has no rows with target '%s'"
                .formatted(window.windowIndex(), target));
        }
        if (trainRows.size() < trainSlice.size()) {
            log.debug("   Window {}: dropped {} training rows without target", window.windowIndex(),
                trainSlice.size() - trainRows.size());
        }
        List<DatasetRow> valRows = dataset.slice(window.valStart(), window.valEnd());
        if (valRows.isEmpty()) {
            throw new DataException("Validation slice of window %d is empty".formatted(window.windowIndex()));
        }

        ModelAdapter adapter = plan.request().adapterFactory().create();
        if (adapter == null) {
            throw new TrainingException("Adapter factory returned null");
        }

        try {
            adapter.fit(trainRows, target, plan.adapterConfig());
        } catch (ModelResearchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TrainingException("Fit failed: " + e.getMessage(), e);
        }

        double[] scores;
        try {
            scores = adapter.predict(valRows);
        } catch (ModelResearchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InferenceException("Predict failed: " + e.getMessage(), e);
        }
        if (scores == null || scores.length != valRows.size()) {
            throw new InferenceException("Adapter returned %d scores for %d validation rows"
                .formatted(scores == null ? 0 : scores.length, valRows.size()));
        }

        List<ScoredPrediction> predictions = new ArrayList<>(valRows.size());
        List<Integer> labeled = new ArrayList<>();
        for (int i = 0; i < valRows.size(); i++) {
            DatasetRow row = valRows.get(i);
            predictions.add(new ScoredPrediction(row.date(), row.entity(), scores[i], window.windowIndex()));
            if (row.hasFinite(target)) {
                labeled.add(i);
            }
        }
        double[] actual = new double[labeled.size()];
        double[] predicted = new double[labeled.size()];
        for (int k = 0; k < labeled.size(); k++) {
            actual[k] = valRows.get(labeled.get(k)).value(target);
            predicted[k] = scores[labeled.get(k)];
        }
        Map<String, Double> metrics = new LinkedHashMap<>();
        for (MetricFunction metric : plan.metrics()) {
            metrics.put(metric.metricName(), metric.compute(actual, predicted));
        }

        return new WindowEvaluation(adapter, adapter.serialize(), metrics, predictions, trainRows.size(), valRows.size());
    }

    /**
     * Stores a successful window's artifact and records its run. Called in window order.
     */
    private TrainingRun commit(RunPlan plan, WindowOutcome outcome) {
        WalkForwardWindow window = outcome.window();
        if (outcome.failure() != null) {
            return TrainingRun.failed(window, outcome.failure(), outcome.startedAt(), clock.instant());
        }
        WindowEvaluation evaluation = outcome.evaluation();
        FeatureDataset dataset = plan.dataset();
        ModelAdapter adapter = evaluation.adapter();

        ArtifactDescriptor descriptor = ArtifactDescriptor.builder()
            .schemaVersion(dataset.getSchemaVersion())
            .trainingWindow(new TrainingWindowBounds(
                window.windowIndex(),
                window.trainStart(), window.trainEnd(), window.valStart(), window.valEnd(),
                dataset.dateAt(window.trainStart()), dataset.dateAt(window.trainEnd() - 1),
                dataset.dateAt(window.valStart()), dataset.dateAt(window.valEnd() - 1)))
            .metricsSnapshot(evaluation.metrics())
            .modelFamily(adapter.family().registryName())
            .featureColumns(adapter.featureSchema().columns())
            .targetColumn(plan.targetColumn())
            .hyperparameters(plan.adapterConfig().hyperparameters())
            .seed(plan.adapterConfig().seed())
            .build();

        String family = plan.request().artifactFamily();
        int version = artifactRegistry.put(family, evaluation.payload(), descriptor);
        ArtifactRef ref = new ArtifactRef(family, version, ContentHashes.sha256(evaluation.payload()));

        TrainingRun run = TrainingRun.succeeded(window, evaluation.metrics(), ref, outcome.startedAt(), clock.instant(),
            evaluation.trainRows(), evaluation.valRows(), evaluation.predictions());
        log.info("   {}", run.summarize());
        return run;
    }

    private WalkForwardSummary summarize(RunPlan plan, List<TrainingRun> runs, long durationMs) {
        Set<SummaryWarning> warnings = EnumSet.noneOf(SummaryWarning.class);
        List<String> messages = new ArrayList<>();
        WindowSchedulerConfig config = plan.schedulerConfig();

        if (runs.isEmpty()) {
            warnings.add(SummaryWarning.NO_WINDOWS);
            messages.add("Dataset has %d time points, %d needed for one window"
                .formatted(plan.dataset().timeIndexLength(), config.minimumLength()));
        } else if (runs.stream().noneMatch(TrainingRun::isSucceeded)) {
            warnings.add(SummaryWarning.NO_SUCCESSFUL_WINDOWS);
            messages.add("All %d windows failed".formatted(runs.size()));
        }
        if (config.hasOverlappingValidation() && runs.size() > 1) {
            warnings.add(SummaryWarning.VALIDATION_OVERLAP);
            messages.add("Validation ranges overlap (stepSize %d < valSize %d); windows are not independent"
                .formatted(config.stepSize(), config.valSize()));
        }

        Map<String, MetricStatistics> statistics = new LinkedHashMap<>();
        List<TrainingRun> succeeded = runs.stream().filter(TrainingRun::isSucceeded).toList();
        for (MetricFunction metric : plan.metrics()) {
            double[] values = new double[succeeded.size()];
            int[] indices = new int[succeeded.size()];
            for (int i = 0; i < succeeded.size(); i++) {
                values[i] = succeeded.get(i).metric(metric.metricName());
                indices[i] = succeeded.get(i).window().windowIndex();
            }
            statistics.put(metric.metricName(), MetricStatistics.of(metric, values, indices));
        }

        DegradationDetector.DegradationAnalysis degradation =
            degradationDetector.analyze(runs, plan.metrics(), properties.getDegradationMinWindows());
        if (degradation.isDegrading()) {
            warnings.add(SummaryWarning.MONOTONIC_DEGRADATION);
            messages.addAll(degradation.warnings());
        }

        return new WalkForwardSummary(
            plan.request().artifactFamily(),
            plan.dataset().getSchemaVersion(),
            plan.targetColumn(),
            config,
            runs,
            statistics,
            warnings,
            messages,
            degradation.degradingMetrics(),
            durationMs);
    }

    private RunPlan plan(WalkForwardRequest request) {
        if (request == null) {
            throw new ConfigurationException("Walk-forward request must be non-null");
        }
        if (request.dataset() == null) {
            throw new ConfigurationException("Dataset must be non-null");
        }
        if (request.adapterFactory() == null) {
            throw new ConfigurationException("Adapter factory must be non-null");
        }
        if (request.targetResolver() == null) {
            throw new ConfigurationException("Target resolver must be non-null");
        }
        if (request.metrics().isEmpty()) {
            throw new ConfigurationException("At least one metric function is required");
        }
        if (request.artifactFamily() == null || request.artifactFamily().isBlank()) {
            throw new ConfigurationException("Artifact family must be non-blank");
        }
        if (properties.getParallelism() < 1) {
            throw new ConfigurationException("parallelism must be >= 1, got: " + properties.getParallelism());
        }
        long distinct = request.metrics().stream().map(MetricFunction::metricName).distinct().count();
        if (distinct != request.metrics().size()) {
            throw new ConfigurationException("Metric names must be unique");
        }

        WindowSchedulerConfig schedulerConfig = request.schedulerConfig() != null
            ? request.schedulerConfig()
            : properties.toSchedulerConfig();
        AdapterConfig adapterConfig = request.adapterConfig() != null
            ? request.adapterConfig()
            : new AdapterConfig(properties.getSeed(), properties.getFeaturePrefix(), Map.of());

        String target = request.targetResolver().resolve(request.dataset());
        if (target == null || target.isBlank()) {
            throw new ConfigurationException("Target resolver returned no column");
        }
        if (target.startsWith(adapterConfig.featurePrefix())) {
            throw new ConfigurationException("Target column '%s' uses the feature prefix '%s'"
                .formatted(target, adapterConfig.featurePrefix()));
        }

        return new RunPlan(request.dataset(), schedulerConfig, adapterConfig, target, request.metrics(), request);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
