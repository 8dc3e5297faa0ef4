package ai.navigator.index;

import static org.junit.jupiter.api.Assertions.*;

import ai.navigator.analyzer.Symbol;
import ai.navigator.analyzer.SymbolKind;
import ai.navigator.exception.NotFoundException;
import java.util.List;
import org.junit.jupiter.api.Test;

class SymbolLookupTest {

    private static FileRecord record(Symbol... symbols) {
        return new FileRecord("src/calc.py", "hash", 1L, 100L, "python", "", List.of(symbols), 40, 1L);
    }

    @Test
    void testShallowestDeclarationWins() {
        var nested = new Symbol("run", SymbolKind.METHOD, 3, 5, 1);
        var topLevel = new Symbol("run", SymbolKind.FUNCTION, 20, 25, 0);
        var outer = new Symbol("Job", SymbolKind.CLASS, 1, 10, 0);

        var match = SymbolLookup.find(record(outer, nested, topLevel), "run");

        assertEquals(topLevel, match.symbol());
        assertFalse(match.ambiguous());
    }

    @Test
    void testFirstOccurrenceWinsAndAmbiguityIsReported() {
        var first = new Symbol("parse", SymbolKind.FUNCTION, 5, 9, 0);
        var second = new Symbol("parse", SymbolKind.FUNCTION, 30, 33, 0);

        var match = SymbolLookup.find(record(second, first), "parse");

        assertEquals(first, match.symbol());
        assertTrue(match.ambiguous());
        assertEquals(List.of(first, second), match.candidates());
    }

    @Test
    void testDottedNameResolvesWithinEnclosingSymbol() {
        var calculator = new Symbol("Calculator", SymbolKind.CLASS, 1, 10, 0);
        var add = new Symbol("add", SymbolKind.METHOD, 2, 4, 1);
        var other = new Symbol("Other", SymbolKind.CLASS, 12, 20, 0);
        var otherAdd = new Symbol("add", SymbolKind.METHOD, 13, 15, 1);

        var match = SymbolLookup.find(record(calculator, add, other, otherAdd), "Other.add");

        assertEquals(otherAdd, match.symbol());
    }

    @Test
    void testUnknownSymbolIsNotFound() {
        var rec = record(new Symbol("a", SymbolKind.FUNCTION, 1, 2, 0));

        var e = assertThrows(NotFoundException.class, () -> SymbolLookup.find(rec, "missing"));
        assertEquals("NOT_FOUND", e.code());
        assertTrue(e.getMessage().contains("missing"));
        assertThrows(NotFoundException.class, () -> SymbolLookup.find(rec, "a.missing"));
    }
}
