package work.lcod.formula.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class FunctionRegistryTest {
    @Test
    void standardRegistryHoldsBuiltIns() {
        var registry = FunctionRegistry.standard();
        for (String name : List.of("SUM", "AVERAGE", "MIN", "MAX", "IF")) {
            assertTrue(registry.contains(name), name);
        }
        assertTrue(registry.contains("sum"));
        assertFalse(registry.contains("VLOOKUP"));
        assertFalse(registry.contains(null));
    }

    @Test
    void derivedRegistriesLeaveTheOriginalUntouched() {
        var extended = FunctionRegistry.standard().toBuilder()
            .register(" one ", arguments -> 1.0)
            .build();
        assertEquals(1.0, extended.find("ONE").orElseThrow().invoke(List.of()));
        assertFalse(FunctionRegistry.standard().contains("ONE"));
        assertThrows(UnsupportedOperationException.class, () -> extended.entries().clear());
    }

    @Test
    void blankNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> FunctionRegistry.builder().register("  ", arguments -> 0.0));
    }
}
