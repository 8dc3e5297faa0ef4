package ai.navigator.index;

import ai.navigator.analyzer.Symbol;
import ai.navigator.exception.NotFoundException;
import com.google.common.base.Splitter;
import java.util.Comparator;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Resolves a symbol name to its line span within one file. */
public final class SymbolLookup {
    private static final Splitter DOT = Splitter.on('.').omitEmptyStrings().trimResults();

    private SymbolLookup() {}

    /**
     * Result of a lookup.
     *
     * @param symbol the winning declaration
     * @param candidates every declaration that tied with the winner (same name, same depth); size 1 when
     *     unambiguous
     */
    public record Match(Symbol symbol, List<Symbol> candidates) {
        public boolean ambiguous() {
            return candidates.size() > 1;
        }
    }

    /**
     * Finds {@code name} among the record's symbols. The shallowest declaration wins; among equally deep
     * ones the first in file order. A dotted name such as {@code Calculator.add} is resolved one segment
     * at a time, each inside the span of the previous one.
     *
     * @throws NotFoundException when nothing matches
     */
    public static Match find(FileRecord record, String name) {
        var symbols = record.symbols();
        var direct = resolve(symbols, name, null);
        if (direct != null) {
            return direct;
        }

        var parts = DOT.splitToList(name);
        if (parts.size() > 1) {
            Match current = null;
            for (String part : parts) {
                current = resolve(symbols, part, current == null ? null : current.symbol());
                if (current == null) {
                    break;
                }
            }
            if (current != null) {
                return current;
            }
        }
        throw NotFoundException.symbol(name, record.path());
    }

    private static @Nullable Match resolve(List<Symbol> symbols, String name, @Nullable Symbol within) {
        var named = symbols.stream()
                .filter(s -> s.name().equals(name))
                .filter(s -> within == null || within.encloses(s))
                .toList();
        if (named.isEmpty()) {
            return null;
        }
        int depth = named.stream().mapToInt(Symbol::scopeDepth).min().orElseThrow();
        var tied = named.stream()
                .filter(s -> s.scopeDepth() == depth)
                .sorted(Comparator.comparingInt(Symbol::startLine))
                .toList();
        return new Match(tied.get(0), tied);
    }
}
