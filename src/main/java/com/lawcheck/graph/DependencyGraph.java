package com.lawcheck.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable directed graph over statute ids. An edge {@code a -> b} means
 * statute {@code a} references statute {@code b}.
 *
 * Nodes keep insertion order, and so do each node's successors, which makes
 * every algorithm over the graph deterministic.
 */
public final class DependencyGraph {

    private final List<String> nodes;
    private final Map<String, Integer> index;
    private final List<List<Integer>> successors;
    private final List<List<Integer>> predecessors;
    private final Map<String, Set<String>> danglingReferences;
    private final int edgeCount;

    DependencyGraph(Map<String, Set<String>> adjacency, Map<String, Set<String>> dangling) {
        this.nodes = List.copyOf(adjacency.keySet());
        this.index = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            index.put(nodes.get(i), i);
        }
        List<List<Integer>> out = new ArrayList<>(nodes.size());
        List<List<Integer>> in = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            out.add(new ArrayList<>());
            in.add(new ArrayList<>());
        }
        int edges = 0;
        for (Map.Entry<String, Set<String>> entry : adjacency.entrySet()) {
            int from = index.get(entry.getKey());
            for (String target : entry.getValue()) {
                int to = index.get(target);
                out.get(from).add(to);
                in.get(to).add(from);
                edges++;
            }
        }
        this.successors = freeze(out);
        this.predecessors = freeze(in);
        this.edgeCount = edges;
        Map<String, Set<String>> danglingCopy = new LinkedHashMap<>();
        dangling.forEach((id, refs) ->
            danglingCopy.put(id, Collections.unmodifiableSet(new LinkedHashSet<>(refs))));
        this.danglingReferences = Collections.unmodifiableMap(danglingCopy);
    }

    private static List<List<Integer>> freeze(List<List<Integer>> lists) {
        List<List<Integer>> frozen = new ArrayList<>(lists.size());
        for (List<Integer> list : lists) {
            frozen.add(List.copyOf(list));
        }
        return List.copyOf(frozen);
    }

    public List<String> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean contains(String id) {
        return index.containsKey(id);
    }

    public List<String> references(String id) {
        Integer i = index.get(id);
        if (i == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (int to : successors.get(i)) {
            result.add(nodes.get(to));
        }
        return result;
    }

    public List<String> referencedBy(String id) {
        Integer i = index.get(id);
        if (i == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (int from : predecessors.get(i)) {
            result.add(nodes.get(from));
        }
        return result;
    }

    /** References to ids that are not part of the graph, keyed by the referencing statute. */
    public Map<String, Set<String>> danglingReferences() {
        return danglingReferences;
    }

    int indexOf(String id) {
        return index.get(id);
    }

    String nodeAt(int i) {
        return nodes.get(i);
    }

    List<Integer> successorsOf(int i) {
        return successors.get(i);
    }

    List<Integer> predecessorsOf(int i) {
        return predecessors.get(i);
    }
}
