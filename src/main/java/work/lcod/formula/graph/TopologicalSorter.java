package work.lcod.formula.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.formula.runtime.ErrorCode;
import work.lcod.formula.runtime.FormulaException;

/**
 * Kahn's algorithm over a {@link DependencyGraph}: dependencies come before the cells that read them.
 *
 * <p>The queue is FIFO in discovery order. A cyclic graph is rejected with
 * {@link ErrorCode#GRAPH_CYCLE}; no partial order is ever returned. Edges pointing at targets
 * without a row (undefined cells) are discharged up front, as those cells read as blank.
 * The caller's in-degree map is copied, never modified.
 */
public final class TopologicalSorter {
    private static final Logger LOG = LoggerFactory.getLogger(TopologicalSorter.class);

    private TopologicalSorter() {}

    public static List<String> sort(Map<String, ? extends List<String>> graph, Map<String, Integer> inDegree) {
        var safeGraph = graph == null ? Map.<String, List<String>>of() : graph;
        return sort(safeGraph, inDegree == null ? Map.of() : inDegree, DependencyGraph.reverse(safeGraph));
    }

    public static List<String> sort(DependencyGraph graph) {
        return sort(graph.edges(), graph.inDegree(), graph.dependents());
    }

    private static List<String> sort(
        Map<String, ? extends List<String>> graph,
        Map<String, Integer> inDegree,
        Map<String, List<String>> dependents
    ) {
        CycleDetector.findCycle(graph).ifPresent(cycle -> {
            throw new FormulaException(
                ErrorCode.GRAPH_CYCLE,
                "Circular reference detected: " + String.join(" -> ", cycle),
                cycle
            );
        });

        Set<String> nodes = new LinkedHashSet<>(inDegree.keySet());
        nodes.addAll(graph.keySet());
        Map<String, Integer> remaining = new LinkedHashMap<>();
        for (String node : nodes) {
            Integer degree = inDegree.get(node);
            List<String> deps = graph.get(node);
            remaining.put(node, degree != null ? degree : deps == null ? 0 : deps.size());
        }
        int dangling = 0;
        for (var entry : graph.entrySet()) {
            for (String dep : entry.getValue()) {
                if (!nodes.contains(dep)) {
                    remaining.merge(entry.getKey(), -1, Integer::sum);
                    dangling++;
                }
            }
        }

        Deque<String> ready = new ArrayDeque<>();
        for (var entry : remaining.entrySet()) {
            if (entry.getValue() <= 0) {
                ready.add(entry.getKey());
            }
        }

        List<String> order = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            String node = ready.removeFirst();
            order.add(node);
            for (String dependent : dependents.getOrDefault(node, List.of())) {
                Integer left = remaining.computeIfPresent(dependent, (ignored, count) -> count - 1);
                if (left != null && left == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() != nodes.size()) {
            List<String> unresolved = new ArrayList<>();
            for (String node : nodes) {
                if (remaining.get(node) > 0) {
                    unresolved.add(node);
                }
            }
            throw new FormulaException(
                ErrorCode.GRAPH_CYCLE,
                "Dependency graph cannot be ordered; unresolved nodes: " + unresolved,
                unresolved
            );
        }
        if (dangling > 0 && LOG.isDebugEnabled()) {
            LOG.debug("Ordered {} nodes; {} edges point at undefined cells", order.size(), dangling);
        }
        return order;
    }
}
