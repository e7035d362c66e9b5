package com.lawcheck.config;

import com.lawcheck.constraint.AnalysisLimits;
import com.lawcheck.constraint.SolverMode;
import com.lawcheck.principle.NoDiscriminationPrinciple;
import com.lawcheck.principle.Principles;
import com.lawcheck.verify.Severity;
import com.lawcheck.verify.VerificationBudget;
import com.lawcheck.verify.VerificationCache;
import com.lawcheck.verify.VerifierSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Verifier settings bound from {@code lawcheck.verifier.*}.
 */
@ConfigurationProperties(prefix = "lawcheck.verifier")
public class VerifierProperties {

    /** Constraint backend: auto (Z3 when loadable), z3 or heuristic. */
    private SolverMode solver = SolverMode.AUTO;

    /** Per-query solver timeout; an expired query falls back to structural analysis. */
    private Duration solverTimeout = Duration.ofSeconds(2);

    /** Run per-statute and per-pair checks on a worker pool. */
    private boolean parallel = true;

    /** Worker pool size; 0 means one per available processor. */
    private int workerThreads = 0;

    /** Severity of logical contradictions: warning or error. */
    private Severity contradictionSeverity = Severity.ERROR;

    /** Title Jaccard similarity at which two statutes count as similar. */
    private double similarityThreshold = 0.5;

    /** Also read Custom conditions of the form "statute:<id>" as references. */
    private boolean legacyCustomReferences = false;

    private List<String> protectedAttributes =
        new ArrayList<>(new TreeSet<>(NoDiscriminationPrinciple.DEFAULT_PROTECTED_ATTRIBUTES));

    /** Built-in principles enabled by default, by id. */
    private List<String> principles = new ArrayList<>(Principles.DEFAULT_IDS);

    private final Cache cache = new Cache();
    private final Budget budget = new Budget();
    private final Guard guard = new Guard();

    public VerifierSettings toSettings() {
        return new VerifierSettings(
            contradictionSeverity,
            similarityThreshold,
            new AnalysisLimits(guard.maxConditionDepth, guard.maxConditionNodes, guard.maxDnfTerms),
            legacyCustomReferences,
            parallel,
            workerThreads,
            new VerificationBudget(budget.maxChecks, budget.maxDuration));
    }

    public SolverMode getSolver() {
        return solver;
    }

    public void setSolver(SolverMode solver) {
        this.solver = solver;
    }

    public Duration getSolverTimeout() {
        return solverTimeout;
    }

    public void setSolverTimeout(Duration solverTimeout) {
        this.solverTimeout = solverTimeout;
    }

    public boolean isParallel() {
        return parallel;
    }

    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public Severity getContradictionSeverity() {
        return contradictionSeverity;
    }

    public void setContradictionSeverity(Severity contradictionSeverity) {
        this.contradictionSeverity = contradictionSeverity;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public boolean isLegacyCustomReferences() {
        return legacyCustomReferences;
    }

    public void setLegacyCustomReferences(boolean legacyCustomReferences) {
        this.legacyCustomReferences = legacyCustomReferences;
    }

    public List<String> getProtectedAttributes() {
        return protectedAttributes;
    }

    public void setProtectedAttributes(List<String> protectedAttributes) {
        this.protectedAttributes = protectedAttributes;
    }

    public List<String> getPrinciples() {
        return principles;
    }

    public void setPrinciples(List<String> principles) {
        this.principles = principles;
    }

    public Cache getCache() {
        return cache;
    }

    public Budget getBudget() {
        return budget;
    }

    public Guard getGuard() {
        return guard;
    }

    public static class Cache {
        private boolean enabled = true;
        private long maximumSize = VerificationCache.DEFAULT_MAXIMUM_SIZE;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getMaximumSize() {
            return maximumSize;
        }

        public void setMaximumSize(long maximumSize) {
            this.maximumSize = maximumSize;
        }
    }

    /** Zero disables either bound. */
    public static class Budget {
        private long maxChecks = 0;
        private Duration maxDuration = Duration.ZERO;

        public long getMaxChecks() {
            return maxChecks;
        }

        public void setMaxChecks(long maxChecks) {
            this.maxChecks = maxChecks;
        }

        public Duration getMaxDuration() {
            return maxDuration;
        }

        public void setMaxDuration(Duration maxDuration) {
            this.maxDuration = maxDuration;
        }
    }

    public static class Guard {
        private int maxConditionDepth = 256;
        private int maxConditionNodes = 10_000;
        private int maxDnfTerms = 256;

        public int getMaxConditionDepth() {
            return maxConditionDepth;
        }

        public void setMaxConditionDepth(int maxConditionDepth) {
            this.maxConditionDepth = maxConditionDepth;
        }

        public int getMaxConditionNodes() {
            return maxConditionNodes;
        }

        public void setMaxConditionNodes(int maxConditionNodes) {
            this.maxConditionNodes = maxConditionNodes;
        }

        public int getMaxDnfTerms() {
            return maxDnfTerms;
        }

        public void setMaxDnfTerms(int maxDnfTerms) {
            this.maxDnfTerms = maxDnfTerms;
        }
    }
}
