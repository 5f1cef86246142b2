package work.lcod.formula.api;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.formula.api.CalculationResult.CellFailure;
import work.lcod.formula.ast.FormulaNode;
import work.lcod.formula.graph.DependencyGraph;
import work.lcod.formula.graph.DependencyGraphBuilder;
import work.lcod.formula.graph.TopologicalSorter;
import work.lcod.formula.model.Sheet;
import work.lcod.formula.model.SheetCatalog;
import work.lcod.formula.parse.FormulaParser;
import work.lcod.formula.parse.ReferenceExtractor;
import work.lcod.formula.runtime.Blank;
import work.lcod.formula.runtime.EvaluationContext;
import work.lcod.formula.runtime.FormulaEvaluator;
import work.lcod.formula.runtime.FormulaException;
import work.lcod.formula.runtime.FunctionRegistry;
import work.lcod.formula.runtime.Values;

/**
 * Recomputes every formula of a catalog: parses each formula once, orders the cells with the
 * dependency graph, then evaluates them in that order against one growing context.
 */
public final class WorkbookCalculator {
    private static final Logger LOG = LoggerFactory.getLogger(WorkbookCalculator.class);

    private final CalculatorConfiguration configuration;
    private final FormulaParser parser;
    private final ReferenceExtractor extractor;
    private final FormulaEvaluator evaluator;

    public WorkbookCalculator() {
        this(CalculatorConfiguration.defaults());
    }

    public WorkbookCalculator(CalculatorConfiguration configuration) {
        this(configuration, FunctionRegistry.standard());
    }

    public WorkbookCalculator(CalculatorConfiguration configuration, FunctionRegistry registry) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.parser = new FormulaParser(configuration.maxDepth());
        this.extractor = new ReferenceExtractor(parser, configuration.maxDepth());
        this.evaluator = new FormulaEvaluator(registry, configuration.maxDepth());
    }

    public CalculatorConfiguration configuration() {
        return configuration;
    }

    /**
     * Like {@link #calculate(SheetCatalog)} but reports formula failures (syntax errors, cycles,
     * evaluation errors in fail-fast mode) as a {@link CalculationResult.Status#FAILURE} result.
     */
    public CalculationResult run(SheetCatalog catalog) {
        var started = Instant.now();
        try {
            return calculate(catalog);
        } catch (FormulaException ex) {
            LOG.error("Calculation failed: {}", ex.getMessage());
            return CalculationResult.failed(ex, started);
        }
    }

    /**
     * Topological evaluation order of the catalog's cells, dependencies first.
     */
    public List<String> order(SheetCatalog catalog) {
        var parsed = new LinkedHashMap<String, FormulaNode>();
        parseAll(catalog, parsed, new LinkedHashMap<>());
        return TopologicalSorter.sort(buildGraph(catalog, parsed));
    }

    public CalculationResult calculate(SheetCatalog catalog) {
        Objects.requireNonNull(catalog, "catalog");
        var started = Instant.now();
        var parsed = new LinkedHashMap<String, FormulaNode>();
        var failures = new LinkedHashMap<String, CellFailure>();
        parseAll(catalog, parsed, failures);

        List<String> order = TopologicalSorter.sort(buildGraph(catalog, parsed));
        LOG.debug("Evaluation order has {} cells", order.size());

        var context = new EvaluationContext();
        var values = new LinkedHashMap<String, Object>();
        for (String node : order) {
            int bang = node.lastIndexOf('!');
            String sheetName = node.substring(0, bang);
            String address = node.substring(bang + 1);
            Sheet sheet = catalog.sheet(sheetName).orElseThrow();
            if (!sheet.isFormula(address)) {
                Object constant = Values.normalize(sheet.constants().get(address));
                context.put(node, constant);
                if (configuration.includeConstants()) {
                    values.put(node, constant);
                }
                continue;
            }
            FormulaNode ast = parsed.get(node);
            if (ast == null) {
                context.put(node, Blank.INSTANCE);
                continue;
            }
            try {
                Object value = evaluator.evaluate(ast, context.withDefaultSheet(sheetName));
                context.put(node, value);
                values.put(node, value);
            } catch (FormulaException ex) {
                if (!configuration.keepGoing()) {
                    throw new FormulaException(ex.code(), node + ": " + ex.getMessage(), ex.data(), ex);
                }
                LOG.warn("Cell {} failed: {}", node, ex.getMessage());
                failures.put(node, CellFailure.of(ex));
                context.put(node, Blank.INSTANCE);
            }
        }

        var result = CalculationResult.completed(order, values, failures, started);
        LOG.info(
            "Calculated {} cells ({} failed) in {} ms",
            order.size(),
            failures.size(),
            Duration.between(started, result.finishedAt()).toMillis()
        );
        return result;
    }

    private void parseAll(SheetCatalog catalog, Map<String, FormulaNode> parsed, Map<String, CellFailure> failures) {
        for (var sheetEntry : catalog.sheets().entrySet()) {
            for (var formula : sheetEntry.getValue().formulas().entrySet()) {
                String node = DependencyGraphBuilder.qualify(sheetEntry.getKey(), formula.getKey());
                try {
                    parsed.put(node, extractor.resolveSheets(parser.parse(formula.getValue()), catalog));
                } catch (FormulaException ex) {
                    if (!configuration.keepGoing()) {
                        throw new FormulaException(ex.code(), node + ": " + ex.getMessage(), ex.data(), ex);
                    }
                    LOG.warn("Cell {} has an invalid formula: {}", node, ex.getMessage());
                    failures.put(node, CellFailure.of(ex));
                }
            }
        }
    }

    // formulas that failed to parse contribute no edges
    private DependencyGraph buildGraph(SheetCatalog catalog, Map<String, FormulaNode> parsed) {
        var builder = new DependencyGraphBuilder((sheet, address, text, cat) -> {
            FormulaNode ast = parsed.get(DependencyGraphBuilder.qualify(sheet, address));
            return ast == null ? List.of() : extractor.collect(ast, cat);
        });
        return builder.buildGraph(catalog);
    }
}
