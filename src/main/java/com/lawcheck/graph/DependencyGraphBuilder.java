package com.lawcheck.graph;

import com.lawcheck.model.Condition;
import com.lawcheck.model.Statute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the reference graph for a statute collection.
 *
 * Edges come from {@link Statute#references()}. With legacy references
 * enabled, {@code Custom} conditions whose description reads
 * {@code statute:<id>} are treated as references too. References to ids not
 * present in the collection do not become edges; they are kept as dangling
 * references. Duplicate ids collapse into one node.
 */
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    public static final String LEGACY_REFERENCE_PREFIX = "statute:";

    private final boolean legacyCustomReferences;

    public DependencyGraphBuilder() {
        this(false);
    }

    public DependencyGraphBuilder(boolean legacyCustomReferences) {
        this.legacyCustomReferences = legacyCustomReferences;
    }

    public DependencyGraph build(List<Statute> statutes) {
        Map<String, Set<String>> declared = new LinkedHashMap<>();
        for (Statute statute : statutes) {
            Set<String> refs = declared.computeIfAbsent(statute.id(), k -> new LinkedHashSet<>());
            refs.addAll(statute.references());
            if (legacyCustomReferences) {
                for (Condition precondition : statute.preconditions()) {
                    collectLegacyReferences(precondition, refs);
                }
            }
        }

        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        Map<String, Set<String>> dangling = new LinkedHashMap<>();
        declared.forEach((id, refs) -> {
            Set<String> targets = new LinkedHashSet<>();
            for (String ref : refs) {
                if (declared.containsKey(ref)) {
                    targets.add(ref);
                } else {
                    dangling.computeIfAbsent(id, k -> new LinkedHashSet<>()).add(ref);
                }
            }
            adjacency.put(id, targets);
        });

        DependencyGraph graph = new DependencyGraph(adjacency, dangling);
        log.debug("Built dependency graph: {} nodes, {} edges, {} statutes with dangling references",
            graph.size(), graph.edgeCount(), dangling.size());
        return graph;
    }

    private void collectLegacyReferences(Condition root, Set<String> refs) {
        Deque<Condition> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Condition current = stack.pop();
            if (current instanceof Condition.And and) {
                stack.push(and.right());
                stack.push(and.left());
            } else if (current instanceof Condition.Or or) {
                stack.push(or.right());
                stack.push(or.left());
            } else if (current instanceof Condition.Not not) {
                stack.push(not.inner());
            } else if (current instanceof Condition.Custom custom) {
                String description = custom.description().trim();
                if (description.startsWith(LEGACY_REFERENCE_PREFIX)) {
                    String target = description.substring(LEGACY_REFERENCE_PREFIX.length()).trim();
                    if (!target.isEmpty()) {
                        refs.add(target);
                    }
                }
            }
        }
    }
}
