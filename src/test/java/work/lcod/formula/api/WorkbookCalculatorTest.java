package work.lcod.formula.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.formula.model.Sheet;
import work.lcod.formula.model.SheetCatalog;
import work.lcod.formula.runtime.Blank;
import work.lcod.formula.runtime.ErrorCode;
import work.lcod.formula.runtime.FormulaException;
import work.lcod.formula.runtime.FunctionRegistry;
import work.lcod.formula.runtime.Values;

class WorkbookCalculatorTest {
    private static Map<String, String> formulas(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return map;
    }

    private static SheetCatalog crossSheetCatalog() {
        return SheetCatalog.builder()
            .sheet("Sheet1", Sheet.of(Map.of("A1", 3.0, "B1", 4.0), formulas("C1", "=A1+B1")))
            .sheet("Sheet2", Sheet.of(Map.of(), formulas("A1", "=sheet1!C1*2", "A2", "=IF(A1>10, \"big\", \"small\")")))
            .build();
    }

    private static SheetCatalog faultyCatalog() {
        return SheetCatalog.builder()
            .sheet("Sheet1", Sheet.of(Map.of(), formulas("A1", "=1/0", "B1", "=A1+1", "C1", "=2*3")))
            .build();
    }

    @Test
    void evaluatesAcrossSheetsInDependencyOrder() {
        CalculationResult result = new WorkbookCalculator().calculate(crossSheetCatalog());
        assertEquals(CalculationResult.Status.SUCCESS, result.status());
        assertEquals(7.0, result.value("Sheet1!C1"));
        assertEquals(14.0, result.value("Sheet2!A1"));
        assertEquals("big", result.value("Sheet2!A2"));
        assertFalse(result.values().containsKey("Sheet1!A1"));

        List<String> order = result.order();
        assertTrue(order.indexOf("Sheet1!A1") < order.indexOf("Sheet1!C1"));
        assertTrue(order.indexOf("Sheet1!C1") < order.indexOf("Sheet2!A1"));
        assertTrue(order.indexOf("Sheet2!A1") < order.indexOf("Sheet2!A2"));
    }

    @Test
    void constantsCanBeListed() {
        var config = CalculatorConfiguration.builder().includeConstants(true).build();
        CalculationResult result = new WorkbookCalculator(config).calculate(crossSheetCatalog());
        assertEquals(3.0, result.value("Sheet1!A1"));
        assertEquals(7.0, result.value("Sheet1!C1"));
    }

    @Test
    void failFastStopsAtTheFirstFailingCell() {
        var calculator = new WorkbookCalculator();
        FormulaException ex = assertThrows(FormulaException.class, () -> calculator.calculate(faultyCatalog()));
        assertEquals(ErrorCode.DIVISION_BY_ZERO, ex.code());
        assertTrue(ex.getMessage().startsWith("Sheet1!A1: "));

        CalculationResult result = calculator.run(faultyCatalog());
        assertEquals(CalculationResult.Status.FAILURE, result.status());
        assertEquals(ErrorCode.DIVISION_BY_ZERO, result.error().code());
        assertEquals(1, result.status().exitCode());
    }

    @Test
    void keepGoingRecordsFailuresAndBlanksTheCell() {
        var config = CalculatorConfiguration.builder().keepGoing(true).build();
        CalculationResult result = new WorkbookCalculator(config).calculate(faultyCatalog());
        assertEquals(CalculationResult.Status.PARTIAL, result.status());
        assertEquals(ErrorCode.DIVISION_BY_ZERO, result.failures().get("Sheet1!A1").code());
        assertEquals(1.0, result.value("Sheet1!B1"));
        assertEquals(6.0, result.value("Sheet1!C1"));
        assertNull(result.value("Sheet1!A1"));
    }

    @Test
    void keepGoingSurvivesSyntaxErrors() {
        var catalog = SheetCatalog.builder()
            .sheet("Sheet1", Sheet.of(Map.of(), formulas("A1", "=1+", "B1", "=A1*1+5")))
            .build();
        var config = CalculatorConfiguration.builder().keepGoing(true).build();
        CalculationResult result = new WorkbookCalculator(config).calculate(catalog);
        assertEquals(ErrorCode.SYNTAX_ERROR, result.failures().get("Sheet1!A1").code());
        assertEquals(ErrorCode.TYPE_MISMATCH, result.failures().get("Sheet1!B1").code());
        assertEquals(2, result.status().exitCode());
    }

    @Test
    void cyclesFailTheWholeRun() {
        var catalog = SheetCatalog.builder()
            .sheet("Sheet1", Sheet.of(Map.of(), formulas("A1", "=B1+1", "B1", "=A1+1")))
            .build();
        CalculationResult result = new WorkbookCalculator().run(catalog);
        assertEquals(CalculationResult.Status.FAILURE, result.status());
        assertEquals(ErrorCode.GRAPH_CYCLE, result.error().code());
        assertTrue(result.order().isEmpty());
        assertThrows(FormulaException.class, () -> new WorkbookCalculator().order(catalog));
    }

    @Test
    void undefinedCellsReadAsBlank() {
        var catalog = SheetCatalog.builder()
            .sheet("Sheet1", Sheet.of(Map.of(), formulas("A1", "=Z9+2", "A2", "=Z9")))
            .build();
        CalculationResult result = new WorkbookCalculator().calculate(catalog);
        assertEquals(2.0, result.value("Sheet1!A1"));
        assertSame(Blank.INSTANCE, result.value("Sheet1!A2"));
        assertEquals(List.of("Sheet1!A1", "Sheet1!A2"), result.order());
    }

    @Test
    void customFunctionsReachTheEvaluator() {
        FunctionRegistry registry = FunctionRegistry.standard().toBuilder()
            .register("TWICE", arguments -> Values.toNumber(arguments.get(0)) * 2)
            .build();
        var catalog = SheetCatalog.builder()
            .sheet("Sheet1", Sheet.of(Map.of("A1", 21), formulas("B1", "=TWICE(A1)")))
            .build();
        CalculationResult result = new WorkbookCalculator(CalculatorConfiguration.defaults(), registry).calculate(catalog);
        assertEquals(42.0, result.value("Sheet1!B1"));
    }

    @Test
    void serializesToPlainMaps() {
        var config = CalculatorConfiguration.builder().keepGoing(true).build();
        Map<String, Object> map = new WorkbookCalculator(config).calculate(faultyCatalog()).toSerializableMap();
        assertEquals("partial", map.get("status"));
        Map<?, ?> values = (Map<?, ?>) map.get("values");
        assertEquals(6.0, values.get("Sheet1!C1"));
        Map<?, ?> failures = (Map<?, ?>) map.get("failures");
        assertEquals("division_by_zero", ((Map<?, ?>) failures.get("Sheet1!A1")).get("code"));
    }

    @Test
    void lowerCaseAndAbsoluteCatalogAddressesAreFound() {
        Map<String, Object> constants = new LinkedHashMap<>();
        constants.put("a1", 3.0);
        constants.put("$B$2", 10.0);
        var catalog = SheetCatalog.builder()
            .sheet("S", Sheet.of(constants, formulas("B1", "=A1+1", "c1", "=b1+1", "D1", "=$b2*C1")))
            .build();
        CalculationResult result = new WorkbookCalculator().calculate(catalog);
        assertEquals(4.0, result.value("S!B1"));
        assertEquals(5.0, result.value("S!C1"));
        assertEquals(50.0, result.value("S!D1"));
    }

    @Test
    void longOperatorChainsEndInDepthExceeded() {
        var catalog = SheetCatalog.builder()
            .sheet("S", Sheet.of(Map.of(), formulas("A1", "=1" + "+1".repeat(20_000), "A2", "=A1+2")))
            .build();

        FormulaException ex = assertThrows(FormulaException.class, () -> new WorkbookCalculator().calculate(catalog));
        assertEquals(ErrorCode.DEPTH_EXCEEDED, ex.code());

        var keepGoing = CalculatorConfiguration.builder().keepGoing(true).build();
        CalculationResult result = new WorkbookCalculator(keepGoing).calculate(catalog);
        assertEquals(CalculationResult.Status.PARTIAL, result.status());
        assertEquals(ErrorCode.DEPTH_EXCEEDED, result.failures().get("S!A1").code());
        assertEquals(2.0, result.value("S!A2"));
    }

    @Test
    void chainsWithinTheDepthLimitAreSummed() {
        var catalog = SheetCatalog.builder()
            .sheet("S", Sheet.of(Map.of(), formulas("A1", "=1" + "+1".repeat(500))))
            .build();
        assertEquals(501.0, new WorkbookCalculator().calculate(catalog).value("S!A1"));
    }
}
