package work.lcod.formula.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.formula.model.Sheet;
import work.lcod.formula.model.SheetCatalog;
import work.lcod.formula.parse.ReferenceExtractor;

/**
 * Builds the dependency graph of a sheet catalog. Every defined cell gets a row
 * ({@code Sheet!Addr}, in-degree 0); every reference of a formula adds one edge and one unit of
 * in-degree, sheet-local references being qualified with the owning sheet.
 */
public final class DependencyGraphBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private final ReferenceSource references;

    public DependencyGraphBuilder() {
        this(textSource(new ReferenceExtractor()));
    }

    public DependencyGraphBuilder(ReferenceSource references) {
        this.references = Objects.requireNonNull(references, "references");
    }

    /**
     * Builds the graph, parsing every formula of the catalog.
     *
     * @throws work.lcod.formula.runtime.FormulaException {@code SYNTAX_ERROR} for a malformed formula
     */
    public static DependencyGraph build(SheetCatalog catalog) {
        return new DependencyGraphBuilder().buildGraph(catalog);
    }

    public DependencyGraph buildGraph(SheetCatalog catalog) {
        Objects.requireNonNull(catalog, "catalog");
        Map<String, List<String>> graph = new LinkedHashMap<>();
        Map<String, Integer> inDegree = new LinkedHashMap<>();

        for (var sheetEntry : catalog.sheets().entrySet()) {
            for (String address : sheetEntry.getValue().data().keySet()) {
                String node = qualify(sheetEntry.getKey(), address);
                graph.computeIfAbsent(node, ignored -> new ArrayList<>());
                inDegree.putIfAbsent(node, 0);
            }
        }

        for (var sheetEntry : catalog.sheets().entrySet()) {
            String sheetName = sheetEntry.getKey();
            Sheet sheet = sheetEntry.getValue();
            for (var formula : sheet.formulas().entrySet()) {
                String node = qualify(sheetName, formula.getKey());
                List<String> deps = graph.computeIfAbsent(node, ignored -> new ArrayList<>());
                for (String reference : references.references(sheetName, formula.getKey(), formula.getValue(), catalog)) {
                    String dep = reference.indexOf('!') >= 0 ? reference : qualify(sheetName, reference);
                    deps.add(dep);
                    inDegree.merge(node, 1, Integer::sum);
                }
            }
        }

        var result = DependencyGraph.of(graph, inDegree);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Built dependency graph: {} nodes, {} edges", result.nodes().size(), result.edgeCount());
        }
        return result;
    }

    public static String qualify(String sheet, String address) {
        return sheet + "!" + address;
    }

    /** Source of the references read by a formula cell. */
    @FunctionalInterface
    public interface ReferenceSource {
        List<String> references(String sheet, String address, String formulaText, SheetCatalog catalog);
    }

    public static ReferenceSource textSource(ReferenceExtractor extractor) {
        Objects.requireNonNull(extractor, "extractor");
        return (sheet, address, formulaText, catalog) -> extractor.collect(formulaText, catalog);
    }
}
