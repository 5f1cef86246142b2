package work.lcod.formula.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.formula.ast.CellRef;
import work.lcod.formula.model.Sheet;
import work.lcod.formula.model.SheetCatalog;
import work.lcod.formula.runtime.ErrorCode;
import work.lcod.formula.runtime.FormulaException;

class ReferenceExtractorTest {
    private static final SheetCatalog CATALOG = SheetCatalog.builder()
        .sheet("Sheet1", Sheet.of(Map.of("A1", 1.0), Map.of()))
        .sheet("Totals", Sheet.empty())
        .build();

    @Test
    void distinctReferencesInFirstOccurrenceOrder() {
        Set<String> refs = ReferenceExtractor.extractReferences("=SUM(A1,B2)+A1", null);
        assertEquals(List.of("A1", "B2"), List.copyOf(refs));
    }

    @Test
    void occurrencesKeepDuplicates() {
        assertEquals(List.of("A1", "B2", "A1"), ReferenceExtractor.collectReferences("=SUM(A1,B2)+A1", null));
    }

    @Test
    void functionNamesAreNotReferences() {
        assertEquals(List.of("A1"), ReferenceExtractor.collectReferences("=LOG10(A1)", null));
        assertEquals(List.of(), ReferenceExtractor.collectReferences("=SUM(1, 2) * MAX(3)", null));
    }

    @Test
    void sheetPrefixesFollowTheCatalogSpelling() {
        assertEquals(
            List.of("Sheet1!A1", "Totals!B2", "Other!C3"),
            ReferenceExtractor.collectReferences("=sheet1!A1 + TOTALS!b2 + Other!C3", CATALOG)
        );
    }

    @Test
    void rangesAreSingleReferences() {
        assertEquals(List.of("A1:B3"), ReferenceExtractor.collectReferences("=SUM(A1:B3)", null));
    }

    @Test
    void resolveSheetsRewritesTheTree() {
        var extractor = new ReferenceExtractor();
        var resolved = extractor.resolveSheets(FormulaParser.parseFormula("=sheet1!A1"), CATALOG);
        assertEquals(new CellRef("Sheet1!A1"), resolved);
    }

    @Test
    void syntaxErrorsPropagate() {
        FormulaException ex = assertThrows(
            FormulaException.class,
            () -> ReferenceExtractor.extractReferences("=A1+", CATALOG)
        );
        assertEquals(ErrorCode.SYNTAX_ERROR, ex.code());
    }

    @Test
    void resolvingTooDeepATreeFailsWithDepthExceeded() {
        var extractor = new ReferenceExtractor(new FormulaParser(), 100);
        var deep = FormulaParser.parseFormula("=1" + "+1".repeat(5_000));
        FormulaException ex = assertThrows(FormulaException.class, () -> extractor.resolveSheets(deep, CATALOG));
        assertEquals(ErrorCode.DEPTH_EXCEEDED, ex.code());
        var shallow = FormulaParser.parseFormula("=1" + "+sheet1!A1".repeat(50));
        assertEquals(50, extractor.collect(extractor.resolveSheets(shallow, CATALOG), CATALOG).stream()
            .filter("Sheet1!A1"::equals)
            .count());
    }
}
