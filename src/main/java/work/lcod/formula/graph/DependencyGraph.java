package work.lcod.formula.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cell dependency graph. An edge {@code node -> dep} means the formula of {@code node} reads
 * {@code dep}. Dependency lists keep duplicates, and the in-degree of a node counts edge
 * occurrences rather than distinct dependencies. Targets without a row of their own are allowed.
 */
public final class DependencyGraph {
    private final Map<String, List<String>> edges;
    private final Map<String, Integer> inDegree;
    private final Map<String, List<String>> dependents;

    private DependencyGraph(Map<String, List<String>> edges, Map<String, Integer> inDegree) {
        var frozenEdges = new LinkedHashMap<String, List<String>>();
        edges.forEach((node, deps) -> frozenEdges.put(node, List.copyOf(deps)));
        this.edges = Collections.unmodifiableMap(frozenEdges);
        this.inDegree = Collections.unmodifiableMap(new LinkedHashMap<>(inDegree));
        this.dependents = Collections.unmodifiableMap(reverse(frozenEdges));
    }

    public static DependencyGraph of(Map<String, ? extends List<String>> edges, Map<String, Integer> inDegree) {
        var edgeCopy = new LinkedHashMap<String, List<String>>();
        if (edges != null) {
            edges.forEach((node, deps) -> edgeCopy.put(node, deps == null ? List.of() : deps));
        }
        var degrees = new LinkedHashMap<String, Integer>();
        if (inDegree != null) {
            degrees.putAll(inDegree);
        }
        edgeCopy.forEach((node, deps) -> degrees.putIfAbsent(node, deps.size()));
        return new DependencyGraph(edgeCopy, degrees);
    }

    /** Graph whose in-degrees are the sizes of the dependency lists. */
    public static DependencyGraph of(Map<String, ? extends List<String>> edges) {
        return of(edges, null);
    }

    /**
     * Reverse adjacency: for every target, the nodes depending on it, once per edge occurrence.
     */
    static Map<String, List<String>> reverse(Map<String, ? extends List<String>> edges) {
        var reverse = new LinkedHashMap<String, List<String>>();
        edges.forEach((node, deps) -> {
            for (String dep : deps) {
                reverse.computeIfAbsent(dep, ignored -> new ArrayList<>()).add(node);
            }
        });
        var frozen = new LinkedHashMap<String, List<String>>();
        reverse.forEach((dep, nodes) -> frozen.put(dep, List.copyOf(nodes)));
        return frozen;
    }

    public Map<String, List<String>> edges() {
        return edges;
    }

    public Map<String, Integer> inDegree() {
        return inDegree;
    }

    public Map<String, List<String>> dependents() {
        return dependents;
    }

    public List<String> dependenciesOf(String node) {
        return edges.getOrDefault(node, List.of());
    }

    public List<String> dependentsOf(String node) {
        return dependents.getOrDefault(node, List.of());
    }

    public Set<String> nodes() {
        return edges.keySet();
    }

    public int edgeCount() {
        return edges.values().stream().mapToInt(List::size).sum();
    }

    @Override
    public String toString() {
        return "DependencyGraph" + edges;
    }
}
