package org.carball.gantry.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.FailureKind;
import org.carball.gantry.PipelineException;
import org.carball.gantry.ai.FieldGroupPromptBuilder;
import org.carball.gantry.ai.OracleResponseValidator;
import org.carball.gantry.ai.TextGenerationOracle;
import org.carball.gantry.config.SynthesisSettings;
import org.carball.gantry.curation.AuxiliaryVerifier;
import org.carball.gantry.curation.LabelEnhancer;
import org.carball.gantry.curation.QualityTier;
import org.carball.gantry.curation.Reweighter;
import org.carball.gantry.curation.RuleBasedAuxiliaryVerifier;
import org.carball.gantry.curation.SampleFilter;
import org.carball.gantry.evaluation.BenchmarkEvaluator;
import org.carball.gantry.evaluation.DirectEvaluator;
import org.carball.gantry.evaluation.IndirectEvaluator;
import org.carball.gantry.generation.DatasetWiseScheduler;
import org.carball.gantry.generation.DemonstrationSelector;
import org.carball.gantry.generation.Demonstrations;
import org.carball.gantry.generation.RuleBasedGroupGenerator;
import org.carball.gantry.generation.SampleWiseDecomposer;
import org.carball.gantry.generation.SectionDateMapper;
import org.carball.gantry.loader.ReferencePoolLoader;
import org.carball.gantry.model.condition.GenerationCondition;
import org.carball.gantry.model.evaluation.DirectEvaluation;
import org.carball.gantry.model.evaluation.EvaluationResult;
import org.carball.gantry.model.evaluation.IndirectEvaluation;
import org.carball.gantry.model.output.GenerationBundle;
import org.carball.gantry.model.output.QualityTiers;
import org.carball.gantry.model.output.RunStatistics;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.FieldGroupSchema;
import org.carball.gantry.model.stats.LearnedStatistics;
import org.carball.gantry.model.stats.TargetDistribution;
import org.carball.gantry.reference.FeeCalculator;
import org.carball.gantry.reference.ReferenceTables;
import org.carball.gantry.reference.StatisticsLearner;
import org.carball.gantry.reference.VehicleClassifier;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs the three stages end to end: generation, curation and evaluation.
 *
 * <p>The scheduler and demonstration selector are only touched by the calling thread. Records are
 * decomposed on a fixed worker pool, each with a {@link Random} seeded from the run seed and its
 * sequence number, so output does not depend on thread interleaving.
 */
@Slf4j
public class GantrySynthesisPipeline implements AutoCloseable {

    private static final int TOP_ISSUES = 10;

    private final SynthesisSettings settings;
    private final FieldGroupSchema schema;
    private final ReferenceTables tables;
    private final ReferencePoolLoader trainingLoader;
    private final ReferencePoolLoader benchmarkLoader;
    private final TextGenerationOracle oracle;
    private final AuxiliaryVerifier customVerifier;

    private final VehicleClassifier classifier;
    private final FeeCalculator feeCalculator;
    private final ExecutorService workers;
    private final ExecutorService oracleExecutor;

    private volatile boolean cancelled;

    // Built by initialize()
    private boolean initialized;
    private LearnedStatistics statistics;
    private SectionDateMapper dateMapper;
    private DemonstrationSelector selector;
    private SampleWiseDecomposer decomposer;
    private SampleFilter filter;
    private LabelEnhancer enhancer;
    private Reweighter reweighter;
    private BenchmarkEvaluator benchmarkEvaluator;
    private IndirectEvaluator indirectEvaluator;
    private AuxiliaryVerifier verifier;

    public GantrySynthesisPipeline(SynthesisSettings settings,
                                   ReferencePoolLoader trainingLoader,
                                   ReferencePoolLoader benchmarkLoader,
                                   TextGenerationOracle oracle) {
        this(settings, FieldGroupSchema.gantryDefault(), ReferenceTables.loadDefault(),
                trainingLoader, benchmarkLoader, oracle, null);
    }

    /**
     * @param oracle         may be null; every field group is then generated by rules
     * @param customVerifier used instead of the rule-based verifier when auxiliary verification is on
     */
    public GantrySynthesisPipeline(SynthesisSettings settings,
                                   FieldGroupSchema schema,
                                   ReferenceTables tables,
                                   ReferencePoolLoader trainingLoader,
                                   ReferencePoolLoader benchmarkLoader,
                                   TextGenerationOracle oracle,
                                   AuxiliaryVerifier customVerifier) {
        settings.validate();
        this.settings = settings;
        this.schema = schema;
        this.tables = tables;
        this.trainingLoader = trainingLoader;
        this.benchmarkLoader = benchmarkLoader;
        this.oracle = oracle;
        this.customVerifier = customVerifier;
        this.classifier = new VehicleClassifier(tables);
        this.feeCalculator = new FeeCalculator(tables);
        this.workers = Executors.newFixedThreadPool(settings.getParallelism());
        this.oracleExecutor = Executors.newFixedThreadPool(settings.getParallelism());

        log.info("Created pipeline: {} | oracle: {}", settings.getConfigurationSummary(),
                oracle == null ? "none (rule-based)" : oracle.name());
    }

    /**
     * Loads both reference pools and builds every stage component.
     *
     * @param trainingLimit  records to load from the training pool; zero or negative loads all
     * @param benchmarkLimit records to load from the benchmark pool; zero or negative loads all
     * @param useAuxiliary   whether curated records go through the auxiliary verifier
     */
    public void initialize(int trainingLimit, int benchmarkLimit, boolean useAuxiliary) throws IOException {
        log.info("Initializing pipeline (training limit {}, benchmark limit {}, auxiliary {})",
                trainingLimit, benchmarkLimit, useAuxiliary);

        List<TransactionRecord> trainingPool = trainingLoader.load(trainingLimit);
        if (trainingPool.isEmpty()) {
            throw PipelineException.configuration("Training pool is empty; at least one reference record is required");
        }
        List<TransactionRecord> benchmarkPool = benchmarkLoader == null ? List.of() : benchmarkLoader.load(benchmarkLimit);
        if (benchmarkPool.isEmpty()) {
            log.warn("Benchmark pool is empty; benchmark similarity will be unavailable");
        }

        statistics = new StatisticsLearner(classifier).learn(trainingPool);
        dateMapper = new SectionDateMapper(tables);
        dateMapper.learnFromSamples(trainingPool);

        selector = new DemonstrationSelector(trainingPool, classifier, settings.getFeedbackPoolSize());
        RuleBasedGroupGenerator ruleGenerator = new RuleBasedGroupGenerator(tables, feeCalculator, dateMapper, statistics);
        decomposer = new SampleWiseDecomposer(schema, oracle,
                new FieldGroupPromptBuilder(schema, tables, feeCalculator),
                new OracleResponseValidator(schema),
                ruleGenerator, dateMapper, oracleExecutor, settings.oracleTimeout());

        filter = new SampleFilter(schema, classifier, feeCalculator, statistics,
                settings.getAcceptanceThreshold(), settings.maxTravel());
        enhancer = new LabelEnhancer(classifier, tables, settings.minTravel(), settings.maxTravel());
        reweighter = new Reweighter(classifier);
        verifier = !useAuxiliary ? null
                : customVerifier != null ? customVerifier : new RuleBasedAuxiliaryVerifier(classifier, feeCalculator);

        benchmarkEvaluator = new BenchmarkEvaluator(benchmarkPool, classifier);
        indirectEvaluator = new IndirectEvaluator(benchmarkEvaluator, classifier, feeCalculator, settings.maxTravel());

        initialized = true;
        log.info("Pipeline initialized: {} training records, {} benchmark records, {} sections with dates",
                trainingPool.size(), benchmarkPool.size(), dateMapper.snapshot().size());
    }

    public GenerationBundle generate(int count) {
        return generate(count, null);
    }

    /**
     * Generates up to {@code count} curated records.
     *
     * @param target desired category mix; null uses {@link TargetDistribution#defaults()}
     * @return fewer than {@code count} samples when the attempt bounds, the timeout or
     *         {@link #cancel()} stop generation early
     */
    public GenerationBundle generate(int count, TargetDistribution target) {
        if (count <= 0) {
            throw PipelineException.configuration("Requested count must be positive, got " + count);
        }
        if (!initialized) {
            throw new PipelineException(FailureKind.NOT_INITIALIZED,
                    "Pipeline is not initialized; call initialize() before generate()");
        }
        cancelled = false;
        long started = System.currentTimeMillis();
        TargetDistribution distribution = target == null ? TargetDistribution.defaults() : target;
        DatasetWiseScheduler scheduler = new DatasetWiseScheduler(distribution, classifier, dateMapper, settings.getSeed());

        log.info("Generating {} records", count);
        GenerationRun run = runGeneration(count, scheduler, started);

        List<TransactionRecord> samples = new ArrayList<>(enhancer.enhanceAll(run.accepted));
        int recovered = 0;
        if (settings.isRecoveryEnabled() && samples.size() < count) {
            recovered = recover(run.rejected, samples, count, scheduler);
        }

        if (samples.isEmpty()) {
            if (run.cancelled || run.timedOut) {
                log.info("Run {} before any record was accepted", run.cancelled ? "cancelled" : "timed out");
                return emptyBundle(run, scheduler, started, count);
            }
            throw new PipelineException(FailureKind.GENERATION, String.format(
                    "No record passed curation after %d attempts; top issues: %s",
                    run.attempts, topIssues(run.rejected)));
        }
        if (samples.size() < count) {
            log.warn("Generated {} of {} requested records", samples.size(), count);
        }

        if (verifier != null) {
            samples = new ArrayList<>(enhancer.relabelAll(verifier.verify(samples)));
        }

        List<Double> weights = reweighter.weight(samples, statistics);
        List<TransactionRecord> weighted = reweighter.rank(samples, weights);
        Map<QualityTier, List<TransactionRecord>> tiers = reweighter.tiers(weighted);

        EvaluationResult evaluation = evaluate(samples, distribution);

        RunStatistics stats = statistics(run, scheduler, started, count)
                .accepted(samples.size())
                .recovered(recovered)
                .build();
        log.info("Generation finished: {} accepted, {} rejected, {} recovered in {} ms",
                stats.getAccepted(), stats.getRejected(), recovered, stats.getElapsedMillis());

        return new GenerationBundle(List.copyOf(samples), List.copyOf(weighted), QualityTiers.from(tiers),
                evaluation, stats);
    }

    /**
     * Requests that a running {@link #generate} stop after its current batch.
     */
    public void cancel() {
        log.info("Cancellation requested");
        cancelled = true;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public LearnedStatistics getStatistics() {
        return statistics;
    }

    @Override
    public void close() {
        workers.shutdownNow();
        oracleExecutor.shutdownNow();
    }

    private GenerationRun runGeneration(int count, DatasetWiseScheduler scheduler, long started) {
        GenerationRun run = new GenerationRun();
        int maxAttempts = count * settings.getAttemptMultiplier();
        long deadline = settings.getGlobalTimeoutSeconds() > 0
                ? started + TimeUnit.SECONDS.toMillis(settings.getGlobalTimeoutSeconds())
                : Long.MAX_VALUE;
        Set<String> exhausted = new HashSet<>();
        long sequence = 0;

        while (run.accepted.size() < count && run.attempts < maxAttempts) {
            if (cancelled) {
                run.cancelled = true;
                break;
            }
            if (System.currentTimeMillis() >= deadline) {
                run.timedOut = true;
                break;
            }

            int batchSize = Math.min(settings.getParallelism(),
                    Math.min(count - run.accepted.size(), maxAttempts - run.attempts));
            List<Future<TransactionRecord>> batch = new ArrayList<>(batchSize);
            for (int i = 0; i < batchSize; i++) {
                GenerationCondition condition = scheduler.nextCondition(exhausted);
                long recordSequence = sequence++;
                Random random = new Random(settings.getSeed() + recordSequence);
                Demonstrations demonstrations = demonstrationsFor(condition, random);
                batch.add(workers.submit(() -> decomposer.decompose(condition, demonstrations, recordSequence, random)));
            }
            run.attempts += batchSize;

            for (Future<TransactionRecord> future : batch) {
                TransactionRecord record = await(future, deadline, run);
                if (record == null) {
                    continue;
                }
                run.raw++;
                record.getMetadata().getFallbackGroups().forEach(group -> run.fallbacks.merge(group, 1, Integer::sum));

                boolean passed = filter.apply(record);
                scheduler.update(record, passed);
                if (passed) {
                    run.accepted.add(record);
                    Double score = record.getMetadata().getQualityScore();
                    if (score != null && score >= settings.getFeedbackThreshold()) {
                        selector.addFeedback(record);
                    }
                } else {
                    run.rejected.add(record);
                    GenerationCondition condition = record.getMetadata().getCondition();
                    if (condition != null && scheduler.rejectedCount(condition) >= settings.getMaxAttemptsPerCondition()
                            && exhausted.add(condition.key())) {
                        log.info("Condition {} rejected {} times; drawing other conditions",
                                condition.key(), scheduler.rejectedCount(condition));
                    }
                    log.debug("Rejected record #{}: {}", record.getMetadata().getSequence(),
                            record.getMetadata().getValidationIssues());
                }
            }
            log.debug("Progress: {}/{} accepted after {} attempts", run.accepted.size(), count, run.attempts);
        }

        if (run.attempts >= maxAttempts && run.accepted.size() < count) {
            log.warn("Attempt bound of {} reached with {} of {} records accepted", maxAttempts, run.accepted.size(), count);
        }
        if (run.timedOut) {
            log.warn("Global timeout of {}s reached with {} of {} records accepted",
                    settings.getGlobalTimeoutSeconds(), run.accepted.size(), count);
        }
        return run;
    }

    private Demonstrations demonstrationsFor(GenerationCondition condition, Random random) {
        if (settings.getDemonstrationCount() < 1) {
            return Demonstrations.none();
        }
        if (settings.getCandidateSets() > 1) {
            return selector.selectCandidates(condition, settings.getDemonstrationCount(), settings.getCandidateSets(), random);
        }
        return Demonstrations.single(selector.select(condition, settings.getDemonstrationCount()));
    }

    private TransactionRecord await(Future<TransactionRecord> future, long deadline, GenerationRun run) {
        try {
            if (deadline == Long.MAX_VALUE) {
                return future.get();
            }
            long remaining = Math.max(0, deadline - System.currentTimeMillis());
            return future.get(remaining, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            run.timedOut = true;
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Record decomposition failed: {}", cause.getMessage(), cause);
            return null;
        } catch (CancellationException e) {
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            run.cancelled = true;
            return null;
        }
    }

    /**
     * Enhances rejected records and accepts those that now pass, until {@code count} is reached.
     */
    private int recover(List<TransactionRecord> rejected, List<TransactionRecord> samples, int count,
                        DatasetWiseScheduler scheduler) {
        int recovered = 0;
        for (TransactionRecord record : rejected) {
            if (samples.size() >= count) {
                break;
            }
            Double before = record.getMetadata().getQualityScore();
            TransactionRecord enhanced = enhancer.enhance(record);
            if (filter.apply(enhanced)) {
                enhanced.getMetadata().setRecovered(true);
                enhanced.logCorrection("quality_score", before, enhanced.getMetadata().getQualityScore(),
                        "recovered: passes curation after enhancement");
                scheduler.recordRecovery(enhanced);
                samples.add(enhanced);
                recovered++;
            }
        }
        if (recovered > 0) {
            log.info("Recovered {} of {} rejected records after enhancement", recovered, rejected.size());
        }
        return recovered;
    }

    private EvaluationResult evaluate(List<TransactionRecord> samples, TargetDistribution distribution) {
        DirectEvaluator directEvaluator = new DirectEvaluator(schema, filter, dateMapper, benchmarkEvaluator,
                classifier, distribution, settings.getFaithfulnessWeight(), settings.getDiversityPairSample(),
                settings.getSeed());
        DirectEvaluation direct = directEvaluator.evaluate(samples);
        IndirectEvaluation indirect = indirectEvaluator.evaluate(samples);
        return new EvaluationResult(direct, indirect);
    }

    private GenerationBundle emptyBundle(GenerationRun run, DatasetWiseScheduler scheduler, long started, int count) {
        RunStatistics stats = statistics(run, scheduler, started, count).accepted(0).recovered(0).build();
        return new GenerationBundle(List.of(), List.of(), QualityTiers.empty(),
                new EvaluationResult(DirectEvaluation.emptyResult(), IndirectEvaluation.emptyResult()), stats);
    }

    private RunStatistics.RunStatisticsBuilder statistics(GenerationRun run, DatasetWiseScheduler scheduler,
                                                          long started, int count) {
        return RunStatistics.builder()
                .requested(count)
                .attempts(run.attempts)
                .raw(run.raw)
                .rejected(run.rejected.size())
                .fallbackCounts(new LinkedHashMap<>(run.fallbacks))
                .topRejectionIssues(topIssues(run.rejected))
                .scheduler(scheduler.snapshot())
                .cancelled(run.cancelled)
                .timedOut(run.timedOut)
                .elapsedMillis(System.currentTimeMillis() - started)
                .oracle(oracle == null ? "none" : oracle.name());
    }

    private static Map<String, Integer> topIssues(List<TransactionRecord> rejected) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (TransactionRecord record : rejected) {
            for (String issue : record.getMetadata().getValidationIssues()) {
                counts.merge(issue, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(TOP_ISSUES)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }

    private static final class GenerationRun {
        private final List<TransactionRecord> accepted = new ArrayList<>();
        private final List<TransactionRecord> rejected = new ArrayList<>();
        private final Map<String, Integer> fallbacks = new LinkedHashMap<>();
        private int attempts;
        private int raw;
        private boolean cancelled;
        private boolean timedOut;
    }
}
