package work.lcod.formula.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class EvaluationContextTest {
    @Test
    void missingKeysAreBlank() {
        var context = new EvaluationContext();
        assertSame(Blank.INSTANCE, context.lookup("A1"));
        assertSame(Blank.INSTANCE, context.lookup(null));
        assertFalse(context.contains("A1"));
    }

    @Test
    void nullValuesAreStoredAsBlank() {
        var context = new EvaluationContext().put("A1", null);
        assertTrue(context.contains("A1"));
        assertSame(Blank.INSTANCE, context.lookup("A1"));
    }

    @Test
    void scopedLookupFallsBackToBareKey() {
        var context = new EvaluationContext().put("A1", 1.0).put("Main!A1", 2.0);
        assertEquals(2.0, context.withDefaultSheet("Main").lookup("A1"));
        assertEquals(1.0, context.withDefaultSheet("Other").lookup("A1"));
        assertEquals(1.0, context.lookup("A1"));
    }

    @Test
    void snapshotIsReadOnly() {
        var context = new EvaluationContext().put("A1", 1.0);
        var snapshot = context.snapshot();
        context.put("B1", 2.0);
        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("C1", 3.0));
    }

    @Test
    void addressesMatchRegardlessOfSpelling() {
        var context = new EvaluationContext().put("main!b$2", 7.0).put("a1", 1.0);
        assertEquals(7.0, context.lookup("main!B2"));
        assertEquals(7.0, context.withDefaultSheet("main").lookup("$b2"));
        assertEquals(1.0, context.lookup("$A$1"));
        assertTrue(context.contains("A1"));
        assertSame(Blank.INSTANCE, context.lookup("Main!B2"));
    }
}
