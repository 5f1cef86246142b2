package work.lcod.formula.functions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.formula.runtime.Blank;
import work.lcod.formula.runtime.ErrorCode;
import work.lcod.formula.runtime.FormulaException;
import work.lcod.formula.runtime.FunctionRegistry;

class StandardFunctionsTest {
    private static final FunctionRegistry REGISTRY = StandardFunctions.register(FunctionRegistry.builder()).build();

    private static Object call(String name, Object... arguments) {
        return REGISTRY.find(name).orElseThrow().invoke(Arrays.asList(arguments));
    }

    private static ErrorCode failure(String name, Object... arguments) {
        return assertThrows(FormulaException.class, () -> call(name, arguments)).code();
    }

    @Test
    void sumAndAverage() {
        assertEquals(6.0, call("SUM", 1.0, 2.0, 3.0));
        assertEquals(0.0, call("SUM"));
        assertEquals(3.0, call("AVERAGE", 2.0, 4.0));
        assertEquals(0.0, call("AVERAGE"));
    }

    @Test
    void minAndMax() {
        assertEquals(-2.0, call("MIN", 3.0, -2.0, 7.0));
        assertEquals(7.0, call("MAX", 3.0, -2.0, 7.0));
        assertEquals(ErrorCode.EMPTY_AGGREGATE, failure("MIN"));
        assertEquals(ErrorCode.EMPTY_AGGREGATE, failure("MAX"));
    }

    @Test
    void blanksAreSkipped() {
        assertEquals(3.0, call("AVERAGE", 2.0, Blank.INSTANCE, 4.0));
        assertEquals(ErrorCode.EMPTY_AGGREGATE, failure("MAX", Blank.INSTANCE));
    }

    @Test
    void singleListArgumentIsFlattened() {
        assertEquals(10.0, call("SUM", List.of(1.0, 2.0, 3.0, 4.0)));
        assertEquals(1.0, call("MIN", List.of(4.0, 1.0)));
    }

    @Test
    void textThatIsNotANumberFails() {
        assertEquals(ErrorCode.TYPE_MISMATCH, failure("SUM", "abc"));
        assertEquals(5.0, call("SUM", "2", 3.0));
    }

    @Test
    void ifSelectsABranch() {
        assertEquals("yes", call("IF", true, "yes", "no"));
        assertEquals("no", call("IF", 0.0, "yes", "no"));
        assertEquals(Boolean.FALSE, call("IF", false, "yes"));
        assertEquals(ErrorCode.INVALID_ARGUMENTS, failure("IF", true));
        assertEquals(ErrorCode.INVALID_ARGUMENTS, failure("IF", true, 1.0, 2.0, 3.0));
    }
}
