package com.lawcheck.api;

import com.lawcheck.conflict.StatuteConflict;
import com.lawcheck.constraint.Simplification;
import com.lawcheck.graph.GraphMetrics;
import com.lawcheck.model.Condition;
import com.lawcheck.model.Statute;
import com.lawcheck.verify.ComplexityMetrics;
import com.lawcheck.verify.CoverageReport;
import com.lawcheck.verify.StatuteVerifier;
import com.lawcheck.verify.VerificationCache;
import com.lawcheck.verify.VerificationResult;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1")
public class VerificationController {

    private final StatuteVerifier verifier;
    private final VerificationCache cache;

    public VerificationController(StatuteVerifier verifier, VerificationCache cache) {
        this.verifier = verifier;
        this.cache = cache;
    }

    @PostMapping("/verify")
    public VerificationResult verify(@RequestBody List<Statute> statutes) {
        return verifier.verify(statutes);
    }

    @PostMapping("/complexity")
    public Map<String, Object> complexity(@RequestBody List<Statute> statutes) {
        List<ComplexityMetrics> metrics = verifier.analyzeComplexity(statutes);
        return Map.of(
            "metrics", metrics,
            "report", verifier.complexityReport(statutes)
        );
    }

    @PostMapping("/conflicts")
    public List<StatuteConflict> conflicts(@RequestBody List<Statute> statutes) {
        return verifier.detectStatuteConflicts(statutes);
    }

    @PostMapping("/graph-metrics")
    public GraphMetrics graphMetrics(@RequestBody List<Statute> statutes) {
        return verifier.analyzeGraphMetrics(statutes);
    }

    @PostMapping("/coverage")
    public CoverageReport coverage(@RequestBody List<Statute> statutes) {
        return verifier.analyzeCoverage(statutes);
    }

    @PostMapping("/simplify")
    public Map<String, Object> simplify(@RequestBody Condition condition) {
        Simplification simplification = verifier.simplify(condition);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("condition", simplification.condition());
        body.put("changed", simplification.changed());
        return body;
    }

    @GetMapping("/cache")
    public Map<String, Object> cacheStats() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", cache.size());
        body.put("hit_count", cache.stats().hitCount());
        body.put("miss_count", cache.stats().missCount());
        body.put("backend", verifier.backend().name());
        return body;
    }

    @DeleteMapping("/cache")
    public Map<String, Object> clearCache() {
        cache.invalidateAll();
        return Map.of("status", "cleared");
    }
}
