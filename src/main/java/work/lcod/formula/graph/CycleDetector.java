package work.lcod.formula.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Depth-first cycle detection with three-state colouring. Nodes referenced but absent from the
 * graph are treated as leaves. The walk keeps an explicit stack, so long dependency chains do not
 * consume the call stack.
 */
public final class CycleDetector {
    private enum Color { WHITE, GREY, BLACK }

    private CycleDetector() {}

    public static boolean hasCycle(Map<String, ? extends List<String>> graph) {
        return findCycle(graph).isPresent();
    }

    public static boolean hasCycle(DependencyGraph graph) {
        return hasCycle(graph.edges());
    }

    /**
     * Returns the members of the first cycle found, closed by repeating its first node
     * ({@code [A, B, A]}), or empty when the graph is acyclic.
     */
    public static Optional<List<String>> findCycle(Map<String, ? extends List<String>> graph) {
        if (graph == null || graph.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Color> colors = new HashMap<>();
        for (String start : graph.keySet()) {
            if (colors.getOrDefault(start, Color.WHITE) != Color.WHITE) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            colors.put(start, Color.GREY);
            path.add(start);
            stack.push(new Frame(start, dependencies(graph, start)));
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (!frame.pending().hasNext()) {
                    stack.pop();
                    colors.put(frame.node(), Color.BLACK);
                    path.remove(path.size() - 1);
                    continue;
                }
                String dep = frame.pending().next();
                Color color = colors.getOrDefault(dep, Color.WHITE);
                if (color == Color.GREY) {
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dep), path.size()));
                    cycle.add(dep);
                    return Optional.of(List.copyOf(cycle));
                }
                if (color == Color.WHITE) {
                    colors.put(dep, Color.GREY);
                    path.add(dep);
                    stack.push(new Frame(dep, dependencies(graph, dep)));
                }
            }
        }
        return Optional.empty();
    }

    private static Iterator<String> dependencies(Map<String, ? extends List<String>> graph, String node) {
        List<String> deps = graph.get(node);
        return deps == null ? List.<String>of().iterator() : deps.iterator();
    }

    private record Frame(String node, Iterator<String> pending) {}
}
