package work.lcod.formula.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.formula.runtime.ErrorCode;
import work.lcod.formula.runtime.FormulaException;

class TopologicalSorterTest {
    private static void assertDependenciesFirst(Map<String, ? extends List<String>> graph, List<String> order) {
        for (var entry : graph.entrySet()) {
            for (String dep : entry.getValue()) {
                if (order.contains(dep)) {
                    assertTrue(
                        order.indexOf(dep) < order.indexOf(entry.getKey()),
                        dep + " must precede " + entry.getKey() + " in " + order
                    );
                }
            }
        }
    }

    private static Map<String, List<String>> diamond() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        graph.put("D", List.of("B", "C"));
        graph.put("B", List.of("A"));
        graph.put("C", List.of("A"));
        graph.put("A", List.of());
        return graph;
    }

    @Test
    void dependenciesComeFirst() {
        Map<String, List<String>> graph = diamond();
        Map<String, Integer> inDegree = Map.of("D", 2, "B", 1, "C", 1, "A", 0);
        List<String> order = TopologicalSorter.sort(graph, inDegree);
        assertEquals(Set.of("A", "B", "C", "D"), Set.copyOf(order));
        assertDependenciesFirst(graph, order);
        assertTrue(Set.of(List.of("A", "B", "C", "D"), List.of("A", "C", "B", "D")).contains(order));
    }

    @Test
    void emptyAndSingleNodeGraphs() {
        assertEquals(List.of(), TopologicalSorter.sort(Map.of(), Map.of()));
        assertEquals(List.of("A"), TopologicalSorter.sort(Map.of("A", List.of()), Map.of("A", 0)));
    }

    @Test
    void cyclesAreRejectedWithThePath() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        graph.put("A", List.of("B"));
        graph.put("B", List.of("A"));
        graph.put("C", List.of());
        FormulaException ex = assertThrows(
            FormulaException.class,
            () -> TopologicalSorter.sort(graph, Map.of("A", 1, "B", 1, "C", 0))
        );
        assertEquals(ErrorCode.GRAPH_CYCLE, ex.code());
        assertEquals(List.of("A", "B", "A"), ex.data());
    }

    @Test
    void duplicateEdgesAreCountedPerOccurrence() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        graph.put("C", List.of("A", "A", "B"));
        graph.put("A", List.of());
        graph.put("B", List.of());
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        inDegree.put("C", 3);
        inDegree.put("A", 0);
        inDegree.put("B", 0);
        assertEquals(List.of("A", "B", "C"), TopologicalSorter.sort(graph, inDegree));
    }

    @Test
    void danglingTargetsAreDischarged() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        graph.put("B", List.of("A", "Z9"));
        graph.put("A", List.of());
        assertEquals(List.of("A", "B"), TopologicalSorter.sort(graph, Map.of("B", 2, "A", 0)));
    }

    @Test
    void unsatisfiableInDegreeIsReportedAsACycle() {
        FormulaException ex = assertThrows(
            FormulaException.class,
            () -> TopologicalSorter.sort(Map.of("A", List.of()), Map.of("A", 1))
        );
        assertEquals(ErrorCode.GRAPH_CYCLE, ex.code());
        assertEquals(List.of("A"), ex.data());
    }

    @Test
    void missingInDegreesFallBackToEdgeCounts() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        graph.put("B", List.of("A"));
        graph.put("A", List.of());
        assertEquals(List.of("A", "B"), TopologicalSorter.sort(graph, null));
    }

    @Test
    void inputIsNotModified() {
        Map<String, List<String>> graph = diamond();
        Map<String, Integer> inDegree = new HashMap<>(Map.of("D", 2, "B", 1, "C", 1, "A", 0));
        Map<String, Integer> before = new HashMap<>(inDegree);
        TopologicalSorter.sort(graph, inDegree);
        assertEquals(before, inDegree);
        assertEquals(diamond(), graph);
    }

    @Test
    void sortsDependencyGraphs() {
        DependencyGraph graph = DependencyGraph.of(diamond());
        List<String> order = TopologicalSorter.sort(graph);
        assertDependenciesFirst(graph.edges(), order);
        assertEquals(List.of("D"), graph.dependentsOf("B"));
        assertEquals(List.of("B", "C"), graph.dependentsOf("A"));
    }
}
