package com.lawcheck.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Algorithms over a {@link DependencyGraph} snapshot. All traversals are
 * iterative so deep reference chains cannot exhaust the call stack.
 */
public class GraphAnalyzer {

    public static final double DEFAULT_DAMPING = 0.85;
    public static final int DEFAULT_PAGERANK_ITERATIONS = 100;
    public static final double DEFAULT_PAGERANK_EPSILON = 1e-9;
    public static final int MOST_REFERENCED_LIMIT = 5;

    private static final int WHITE = 0;
    private static final int GREY = 1;
    private static final int BLACK = 2;

    private final DependencyGraph graph;

    public GraphAnalyzer(DependencyGraph graph) {
        this.graph = graph;
    }

    /**
     * Reports one cycle per back edge found by a white/grey/black depth-first
     * search. Each cycle starts at its earliest node in graph order; a
     * self-reference is a cycle of length one.
     */
    public List<List<String>> detectCycles() {
        int n = graph.size();
        int[] color = new int[n];
        int[] pathPosition = new int[n];
        Arrays.fill(pathPosition, -1);
        List<Integer> path = new ArrayList<>();
        Set<List<String>> cycles = new LinkedHashSet<>();

        for (int start = 0; start < n; start++) {
            if (color[start] != WHITE) {
                continue;
            }
            Deque<int[]> stack = new ArrayDeque<>();
            enter(start, color, pathPosition, path, stack);
            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                int node = frame[0];
                List<Integer> successors = graph.successorsOf(node);
                if (frame[1] < successors.size()) {
                    int next = successors.get(frame[1]++);
                    if (color[next] == GREY) {
                        cycles.add(canonicalCycle(path.subList(pathPosition[next], path.size())));
                    } else if (color[next] == WHITE) {
                        enter(next, color, pathPosition, path, stack);
                    }
                } else {
                    color[node] = BLACK;
                    pathPosition[node] = -1;
                    path.remove(path.size() - 1);
                    stack.pop();
                }
            }
        }
        return List.copyOf(cycles);
    }

    private static void enter(int node, int[] color, int[] pathPosition, List<Integer> path, Deque<int[]> stack) {
        color[node] = GREY;
        pathPosition[node] = path.size();
        path.add(node);
        stack.push(new int[] {node, 0});
    }

    private List<String> canonicalCycle(List<Integer> cycle) {
        int pivot = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i) < cycle.get(pivot)) {
                pivot = i;
            }
        }
        List<String> ids = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            ids.add(graph.nodeAt(cycle.get((pivot + i) % cycle.size())));
        }
        return List.copyOf(ids);
    }

    public boolean hasCycles() {
        return !detectCycles().isEmpty();
    }

    /** Strongly connected components by Tarjan's algorithm, members in graph order. */
    public List<List<String>> stronglyConnectedComponents() {
        int n = graph.size();
        int[] order = new int[n];
        int[] low = new int[n];
        Arrays.fill(order, -1);
        boolean[] onStack = new boolean[n];
        Deque<Integer> members = new ArrayDeque<>();
        List<List<String>> components = new ArrayList<>();
        int counter = 0;

        for (int start = 0; start < n; start++) {
            if (order[start] != -1) {
                continue;
            }
            Deque<int[]> calls = new ArrayDeque<>();
            order[start] = low[start] = counter++;
            members.push(start);
            onStack[start] = true;
            calls.push(new int[] {start, 0});

            while (!calls.isEmpty()) {
                int[] frame = calls.peek();
                int v = frame[0];
                List<Integer> successors = graph.successorsOf(v);
                if (frame[1] < successors.size()) {
                    int w = successors.get(frame[1]++);
                    if (order[w] == -1) {
                        order[w] = low[w] = counter++;
                        members.push(w);
                        onStack[w] = true;
                        calls.push(new int[] {w, 0});
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], order[w]);
                    }
                    continue;
                }
                calls.pop();
                if (!calls.isEmpty()) {
                    int parent = calls.peek()[0];
                    low[parent] = Math.min(low[parent], low[v]);
                }
                if (low[v] == order[v]) {
                    List<Integer> component = new ArrayList<>();
                    int w;
                    do {
                        w = members.pop();
                        onStack[w] = false;
                        component.add(w);
                    } while (w != v);
                    component.sort(Comparator.naturalOrder());
                    List<String> ids = new ArrayList<>(component.size());
                    for (int member : component) {
                        ids.add(graph.nodeAt(member));
                    }
                    components.add(List.copyOf(ids));
                }
            }
        }
        return List.copyOf(components);
    }

    public int sccCount() {
        return stronglyConnectedComponents().size();
    }

    /** Whole-graph diameter; empty when the graph is empty or not weakly connected. */
    public OptionalInt diameter() {
        return diameter(true);
    }

    /**
     * Longest directed shortest path between any two nodes, via BFS from every
     * node. Unreachable pairs are ignored; with {@code wholeGraph} set, a graph
     * that is not weakly connected has no diameter.
     */
    public OptionalInt diameter(boolean wholeGraph) {
        int n = graph.size();
        if (n == 0 || (wholeGraph && !isWeaklyConnected())) {
            return OptionalInt.empty();
        }
        int longest = 0;
        for (int source = 0; source < n; source++) {
            int[] distance = bfs(source);
            for (int d : distance) {
                longest = Math.max(longest, d);
            }
        }
        return OptionalInt.of(longest);
    }

    private int[] bfs(int source) {
        int[] distance = new int[graph.size()];
        Arrays.fill(distance, -1);
        distance[source] = 0;
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(source);
        while (!queue.isEmpty()) {
            int v = queue.poll();
            for (int w : graph.successorsOf(v)) {
                if (distance[w] == -1) {
                    distance[w] = distance[v] + 1;
                    queue.add(w);
                }
            }
        }
        return distance;
    }

    public boolean isWeaklyConnected() {
        int n = graph.size();
        if (n == 0) {
            return true;
        }
        boolean[] seen = new boolean[n];
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(0);
        seen[0] = true;
        int reached = 1;
        while (!queue.isEmpty()) {
            int v = queue.poll();
            List<Integer> neighbours = new ArrayList<>(graph.successorsOf(v));
            neighbours.addAll(graph.predecessorsOf(v));
            for (int w : neighbours) {
                if (!seen[w]) {
                    seen[w] = true;
                    reached++;
                    queue.add(w);
                }
            }
        }
        return reached == n;
    }

    public Map<String, Double> pageRank() {
        return pageRank(DEFAULT_DAMPING, DEFAULT_PAGERANK_ITERATIONS, DEFAULT_PAGERANK_EPSILON);
    }

    /**
     * Power-iteration PageRank along reference edges, so referenced statutes
     * accumulate rank. Rank held by statutes without references is spread
     * uniformly. Stops after {@code maxIterations} or once the L1 change of a
     * round drops below {@code epsilon}.
     */
    public Map<String, Double> pageRank(double damping, int maxIterations, double epsilon) {
        if (damping < 0.0 || damping > 1.0) {
            throw new IllegalArgumentException("damping must be within [0, 1]");
        }
        int n = graph.size();
        Map<String, Double> result = new LinkedHashMap<>();
        if (n == 0) {
            return result;
        }
        double[] rank = new double[n];
        Arrays.fill(rank, 1.0 / n);
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            double danglingMass = 0.0;
            for (int v = 0; v < n; v++) {
                if (graph.successorsOf(v).isEmpty()) {
                    danglingMass += rank[v];
                }
            }
            double base = (1.0 - damping) / n + damping * danglingMass / n;
            double[] next = new double[n];
            Arrays.fill(next, base);
            for (int v = 0; v < n; v++) {
                List<Integer> successors = graph.successorsOf(v);
                if (successors.isEmpty()) {
                    continue;
                }
                double share = damping * rank[v] / successors.size();
                for (int w : successors) {
                    next[w] += share;
                }
            }
            double change = 0.0;
            for (int v = 0; v < n; v++) {
                change += Math.abs(next[v] - rank[v]);
            }
            rank = next;
            if (change < epsilon) {
                break;
            }
        }
        for (int v = 0; v < n; v++) {
            result.put(graph.nodeAt(v), rank[v]);
        }
        return result;
    }

    /**
     * Betweenness centrality by Brandes' algorithm on the directed,
     * unweighted graph. Pairs joined by several shortest paths give each
     * intermediate node its fractional share. Values are not normalized.
     */
    public Map<String, Double> betweenness() {
        int n = graph.size();
        double[] centrality = new double[n];
        for (int s = 0; s < n; s++) {
            Deque<Integer> visitOrder = new ArrayDeque<>();
            List<List<Integer>> parents = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                parents.add(new ArrayList<>());
            }
            double[] paths = new double[n];
            int[] distance = new int[n];
            Arrays.fill(distance, -1);
            paths[s] = 1;
            distance[s] = 0;

            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(s);
            while (!queue.isEmpty()) {
                int v = queue.poll();
                visitOrder.push(v);
                for (int w : graph.successorsOf(v)) {
                    if (distance[w] < 0) {
                        distance[w] = distance[v] + 1;
                        queue.add(w);
                    }
                    if (distance[w] == distance[v] + 1) {
                        paths[w] += paths[v];
                        parents.get(w).add(v);
                    }
                }
            }

            double[] dependency = new double[n];
            while (!visitOrder.isEmpty()) {
                int w = visitOrder.pop();
                for (int v : parents.get(w)) {
                    dependency[v] += (paths[v] / paths[w]) * (1.0 + dependency[w]);
                }
                if (w != s) {
                    centrality[w] += dependency[w];
                }
            }
        }
        Map<String, Double> result = new LinkedHashMap<>();
        for (int v = 0; v < n; v++) {
            result.put(graph.nodeAt(v), centrality[v]);
        }
        return result;
    }

    public GraphMetrics metrics() {
        int n = graph.size();
        int maxIn = 0;
        int maxOut = 0;
        List<String> isolated = new ArrayList<>();
        for (int v = 0; v < n; v++) {
            int in = graph.predecessorsOf(v).size();
            int out = graph.successorsOf(v).size();
            maxIn = Math.max(maxIn, in);
            maxOut = Math.max(maxOut, out);
            if (in == 0 && out == 0) {
                isolated.add(graph.nodeAt(v));
            }
        }
        double density = n < 2 ? 0.0 : (double) graph.edgeCount() / ((double) n * (n - 1));
        OptionalInt diameter = diameter();

        return new GraphMetrics(
            n,
            graph.edgeCount(),
            density,
            sccCount(),
            detectCycles(),
            diameter.isPresent() ? diameter.getAsInt() : null,
            pageRank(),
            betweenness(),
            mostReferenced(),
            isolated,
            maxIn,
            maxOut,
            graph.danglingReferences()
        );
    }

    private List<String> mostReferenced() {
        List<Integer> candidates = new ArrayList<>();
        for (int v = 0; v < graph.size(); v++) {
            if (!graph.predecessorsOf(v).isEmpty()) {
                candidates.add(v);
            }
        }
        candidates.sort(Comparator
            .comparingInt((Integer v) -> graph.predecessorsOf(v).size()).reversed()
            .thenComparingInt(v -> v));
        List<String> ids = new ArrayList<>();
        for (int v : candidates.subList(0, Math.min(MOST_REFERENCED_LIMIT, candidates.size()))) {
            ids.add(graph.nodeAt(v));
        }
        return ids;
    }
}
