package com.lawcheck.conflict;

import com.lawcheck.model.Statute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Runs every registered {@link ConflictRule} over each unordered statute
 * pair, first rule first. Each pair is visited once and presented to the
 * rules in canonical order, so {@code (A, B)} and {@code (B, A)} yield the
 * same single finding.
 */
public class ConflictDetector {

    private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

    public static final Comparator<Statute> CANONICAL_ORDER = Comparator
        .comparing(Statute::id)
        .thenComparingInt(Statute::version)
        .thenComparing(Statute::title);

    private final List<ConflictRule> rules;
    private final ConflictContext context;

    public ConflictDetector(List<ConflictRule> rules, ConflictContext context) {
        this.rules = List.copyOf(rules);
        this.context = context;
    }

    public static List<ConflictRule> defaultRules() {
        return List.of(
            new IdCollisionRule(),
            new JurisdictionalOverlapRule(),
            new TemporalConflictRule(),
            new HierarchyViolationRule());
    }

    public List<ConflictRule> rules() {
        return rules;
    }

    public List<StatuteConflict> detect(List<Statute> statutes) {
        List<StatuteConflict> conflicts = new ArrayList<>();
        for (int i = 0; i < statutes.size(); i++) {
            for (int j = i + 1; j < statutes.size(); j++) {
                conflicts.addAll(detectPair(statutes.get(i), statutes.get(j)));
            }
        }
        log.debug("Conflict scan over {} statutes found {} conflicts", statutes.size(), conflicts.size());
        return conflicts;
    }

    /** All conflicts between two statutes, independent of argument order. */
    public List<StatuteConflict> detectPair(Statute a, Statute b) {
        Statute first = CANONICAL_ORDER.compare(a, b) <= 0 ? a : b;
        Statute second = first == a ? b : a;
        List<StatuteConflict> found = new ArrayList<>();
        for (ConflictRule rule : rules) {
            Optional<StatuteConflict> conflict = rule.detect(first, second, context);
            conflict.ifPresent(found::add);
        }
        return found;
    }
}
