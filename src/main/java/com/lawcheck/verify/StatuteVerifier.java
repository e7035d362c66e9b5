package com.lawcheck.verify;

import com.lawcheck.conflict.ConflictContext;
import com.lawcheck.conflict.ConflictDetector;
import com.lawcheck.conflict.ConflictRule;
import com.lawcheck.conflict.StatuteConflict;
import com.lawcheck.constraint.ConstraintBackend;
import com.lawcheck.constraint.Simplification;
import com.lawcheck.constraint.Verdict;
import com.lawcheck.graph.DependencyGraph;
import com.lawcheck.graph.DependencyGraphBuilder;
import com.lawcheck.graph.GraphAnalyzer;
import com.lawcheck.graph.GraphMetrics;
import com.lawcheck.model.Condition;
import com.lawcheck.model.ConditionShape;
import com.lawcheck.model.Statute;
import com.lawcheck.model.StatuteValidator;
import com.lawcheck.principle.Principle;
import com.lawcheck.principle.Principles;
import com.lawcheck.verify.check.AmbiguityCheck;
import com.lawcheck.verify.check.CheckContext;
import com.lawcheck.verify.check.ComplexityCheck;
import com.lawcheck.verify.check.ConflictCheck;
import com.lawcheck.verify.check.ContradictionCheck;
import com.lawcheck.verify.check.DeadStatuteCheck;
import com.lawcheck.verify.check.DiscretionCheck;
import com.lawcheck.verify.check.PairCheck;
import com.lawcheck.verify.check.PrincipleCheck;
import com.lawcheck.verify.check.RedundancyCheck;
import com.lawcheck.verify.check.StatuteCheck;
import com.lawcheck.verify.check.UnreachableBranchCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs every check over a statute collection: Build, Run checks, Aggregate.
 *
 * <ol>
 *   <li>input validation (throws {@link com.lawcheck.model.InvalidStatuteException})</li>
 *   <li>reference graph: circular references and dangling references</li>
 *   <li>per statute: principles, discretion, dead statute, redundancy,
 *       unreachable branches, complexity</li>
 *   <li>per unordered pair: contradiction, ambiguity, conflict rules</li>
 * </ol>
 *
 * Per-statute and per-pair work may run on a worker pool; results are always
 * merged in input order, so the outcome does not depend on scheduling.
 * Checks whose outcome depends only on content are served from the
 * {@link VerificationCache} when one is supplied.
 */
public class StatuteVerifier implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StatuteVerifier.class);

    static final String REDUCED_PRECISION_WARNING =
        "Reduced precision: the constraint solver was unavailable or could not settle some queries;"
            + " affected checks used structural analysis";

    private final ConstraintBackend backend;
    private final VerifierSettings settings;
    private final VerificationCache cache;
    private final List<Principle> defaultPrinciples;
    private final List<ConflictRule> conflictRules;
    private final List<StatuteCheck> statuteChecks;
    private final List<PairCheck> pairChecks;
    private final StatuteValidator validator = new StatuteValidator();
    private final DependencyGraphBuilder graphBuilder;
    private final ExecutorService executor;

    public StatuteVerifier(ConstraintBackend backend) {
        this(backend, VerifierSettings.DEFAULTS, null, Principles.defaults(), ConflictDetector.defaultRules());
    }

    /**
     * @param cache may be {@code null} to disable caching
     */
    public StatuteVerifier(ConstraintBackend backend,
                           VerifierSettings settings,
                           VerificationCache cache,
                           List<Principle> defaultPrinciples,
                           List<ConflictRule> conflictRules) {
        this.backend = backend;
        this.settings = settings;
        this.cache = cache;
        this.defaultPrinciples = List.copyOf(defaultPrinciples);
        this.conflictRules = List.copyOf(conflictRules);
        this.statuteChecks = List.of(
            new DiscretionCheck(),
            new DeadStatuteCheck(),
            new RedundancyCheck(),
            new UnreachableBranchCheck(),
            new ComplexityCheck());
        this.pairChecks = List.of(
            new ContradictionCheck(),
            new AmbiguityCheck(),
            new ConflictCheck(this.conflictRules));
        this.graphBuilder = new DependencyGraphBuilder(settings.legacyCustomReferences());
        this.executor = settings.parallel()
            ? Executors.newFixedThreadPool(settings.effectiveWorkerThreads(), workerThreadFactory())
            : null;
    }

    public ConstraintBackend backend() {
        return backend;
    }

    public VerifierSettings settings() {
        return settings;
    }

    public List<Principle> defaultPrinciples() {
        return defaultPrinciples;
    }

    public VerificationResult verify(List<Statute> statutes) {
        return verify(statutes, defaultPrinciples);
    }

    public VerificationResult verify(List<Statute> statutes, List<Principle> principles) {
        validator.validateAll(statutes);
        long started = System.nanoTime();
        long deadline = settings.budget().limitsDuration()
            ? started + settings.budget().maxDuration().toNanos()
            : Long.MAX_VALUE;

        VerificationResult result = VerificationResult.pass();
        result.merge(checkGraph(graphBuilder.build(statutes)));

        List<StatuteCheck> perStatute = new ArrayList<>();
        perStatute.add(new PrincipleCheck(principles));
        perStatute.addAll(statuteChecks);

        List<Callable<UnitOutcome>> units = new ArrayList<>();
        for (Statute statute : statutes) {
            units.add(() -> runStatute(statute, perStatute, deadline));
        }
        for (int i = 0; i < statutes.size(); i++) {
            for (int j = i + 1; j < statutes.size(); j++) {
                Statute a = statutes.get(i);
                Statute b = statutes.get(j);
                units.add(() -> runPair(a, b, deadline));
            }
        }

        int total = units.size();
        if (settings.budget().limitsChecks() && total > settings.budget().maxChecks()) {
            units = units.subList(0, (int) settings.budget().maxChecks());
        }

        boolean degraded = false;
        int skipped = total - units.size();
        for (UnitOutcome outcome : execute(units)) {
            if (outcome.skipped()) {
                skipped++;
                continue;
            }
            result.merge(outcome.result());
            degraded |= outcome.degraded();
        }

        if (degraded) {
            result.addWarning(REDUCED_PRECISION_WARNING);
        }
        if (skipped > 0) {
            result.addWarning(String.format(
                "Verification budget exceeded: %d of %d checks skipped; results are partial", skipped, total));
        }

        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
        log.info("Verified {} statutes with {} backend in {} ms: passed={}, findings={}, warnings={}",
            statutes.size(), backend.name(), elapsedMs, result.isPassed(),
            result.getErrors().size(), result.getWarnings().size());
        return result;
    }

    private VerificationResult checkGraph(DependencyGraph graph) {
        VerificationResult result = VerificationResult.pass();
        for (List<String> cycle : new GraphAnalyzer(graph).detectCycles()) {
            result.addError(new VerificationError.CircularReference(cycle));
        }
        graph.danglingReferences().forEach((id, missing) ->
            result.addWarning("Statute '" + id + "' references unknown statutes " + missing));
        return result;
    }

    private UnitOutcome runStatute(Statute statute, List<StatuteCheck> checks, long deadline) {
        if (System.nanoTime() > deadline) {
            return UnitOutcome.SKIPPED;
        }
        VerificationResult result = VerificationResult.pass();
        boolean degraded = false;
        boolean withinLimits = withinLimits(statute);
        if (!withinLimits) {
            log.debug("Statute {} exceeds analysis limits", statute.id());
            result.addWarning("Statute '" + statute.id()
                + "' exceeds the analysis limits; solver-based checks were skipped");
        }
        String fingerprint = cache == null ? null : StatuteFingerprint.of(statute);
        for (StatuteCheck check : checks) {
            if (check.usesSolver() && !withinLimits) {
                continue;
            }
            Supplier<CheckOutcome> run = () -> {
                DegradationTrackingBackend tracking = new DegradationTrackingBackend(backend);
                VerificationResult checked = check.check(statute, new CheckContext(tracking, settings));
                return new CheckOutcome(checked, tracking.degraded());
            };
            CheckOutcome outcome = cache != null && check.cacheable()
                ? cache.get(cacheKey(check.checkId(), fingerprint), run)
                : run.get();
            result.merge(outcome.result());
            degraded |= outcome.degraded();
        }
        return new UnitOutcome(result, degraded, false);
    }

    private UnitOutcome runPair(Statute a, Statute b, long deadline) {
        if (System.nanoTime() > deadline) {
            return UnitOutcome.SKIPPED;
        }
        Statute first = ConflictDetector.CANONICAL_ORDER.compare(a, b) <= 0 ? a : b;
        Statute second = first == a ? b : a;
        String pairFingerprint = cache == null
            ? null
            : StatuteFingerprint.of(first) + ":" + StatuteFingerprint.of(second);

        VerificationResult result = VerificationResult.pass();
        boolean degraded = false;
        for (PairCheck check : pairChecks) {
            Supplier<CheckOutcome> run = () -> {
                DegradationTrackingBackend tracking = new DegradationTrackingBackend(backend);
                VerificationResult checked = check.check(first, second, new CheckContext(tracking, settings));
                return new CheckOutcome(checked, tracking.degraded());
            };
            CheckOutcome outcome = cache != null
                ? cache.get(cacheKey(check.checkId(), pairFingerprint), run)
                : run.get();
            result.merge(outcome.result());
            degraded |= outcome.degraded();
        }
        return new UnitOutcome(result, degraded, false);
    }

    private String cacheKey(String checkId, String contentFingerprint) {
        return checkId + "|" + backend.name() + "|" + settings.fingerprint() + "|" + contentFingerprint;
    }

    private boolean withinLimits(Statute statute) {
        int nodes = 0;
        for (Condition precondition : statute.preconditions()) {
            ConditionShape shape = ConditionShape.of(precondition);
            if (shape.depth() > settings.limits().maxDepth()) {
                return false;
            }
            nodes += shape.nodeCount();
        }
        return nodes <= settings.limits().maxNodes();
    }

    private List<UnitOutcome> execute(List<Callable<UnitOutcome>> units) {
        List<UnitOutcome> outcomes = new ArrayList<>(units.size());
        if (executor == null || units.size() < 2) {
            for (Callable<UnitOutcome> unit : units) {
                outcomes.add(callDirectly(unit));
            }
            return outcomes;
        }
        List<Future<UnitOutcome>> futures = new ArrayList<>(units.size());
        for (Callable<UnitOutcome> unit : units) {
            futures.add(executor.submit(unit));
        }
        try {
            for (Future<UnitOutcome> future : futures) {
                outcomes.add(await(future));
            }
        } finally {
            futures.forEach(f -> f.cancel(true));
        }
        return outcomes;
    }

    private static UnitOutcome callDirectly(Callable<UnitOutcome> unit) {
        try {
            return unit.call();
        } catch (RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new IllegalStateException("verification check failed", ex);
        }
    }

    private static UnitOutcome await(Future<UnitOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("verification interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("verification check failed", cause);
        }
    }

    public ComplexityMetrics analyzeComplexity(Statute statute) {
        return ComplexityAnalyzer.analyze(statute);
    }

    public List<ComplexityMetrics> analyzeComplexity(List<Statute> statutes) {
        validator.validateAll(statutes);
        return statutes.stream().map(ComplexityAnalyzer::analyze).toList();
    }

    public String complexityReport(List<Statute> statutes) {
        validator.validateAll(statutes);
        return ComplexityAnalyzer.report(statutes);
    }

    public List<StatuteConflict> detectStatuteConflicts(List<Statute> statutes) {
        validator.validateAll(statutes);
        ConflictDetector detector = new ConflictDetector(conflictRules,
            new ConflictContext(backend, settings.similarityThreshold()));
        return detector.detect(statutes);
    }

    public GraphMetrics analyzeGraphMetrics(List<Statute> statutes) {
        validator.validateAll(statutes);
        return new GraphAnalyzer(graphBuilder.build(statutes)).metrics();
    }

    public Simplification simplify(Condition condition) {
        return backend.simplify(condition);
    }

    /** Classifies every precondition as satisfiable, unsatisfiable or undecided. */
    public CoverageReport analyzeCoverage(List<Statute> statutes) {
        validator.validateAll(statutes);
        int total = 0;
        int satisfiable = 0;
        int unsatisfiable = 0;
        int undecided = 0;
        Map<String, List<Integer>> covered = new LinkedHashMap<>();
        Map<String, List<Integer>> uncovered = new LinkedHashMap<>();
        for (Statute statute : statutes) {
            List<Integer> coveredIndices = new ArrayList<>();
            List<Integer> uncoveredIndices = new ArrayList<>();
            for (int i = 0; i < statute.preconditions().size(); i++) {
                total++;
                Verdict verdict = backend.isSatisfiable(statute.preconditions().get(i));
                if (verdict.isTrue()) {
                    satisfiable++;
                    coveredIndices.add(i);
                } else {
                    uncoveredIndices.add(i);
                    if (verdict.isFalse()) {
                        unsatisfiable++;
                    } else {
                        undecided++;
                    }
                }
            }
            if (!coveredIndices.isEmpty()) {
                covered.put(statute.id(), List.copyOf(coveredIndices));
            }
            if (!uncoveredIndices.isEmpty()) {
                uncovered.put(statute.id(), List.copyOf(uncoveredIndices));
            }
        }
        return new CoverageReport(total, satisfiable, unsatisfiable, undecided, covered, uncovered);
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "lawcheck-verifier-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record UnitOutcome(VerificationResult result, boolean degraded, boolean skipped) {
        static final UnitOutcome SKIPPED = new UnitOutcome(VerificationResult.pass(), false, true);
    }
}
