package ai.navigator.analyzer;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named declaration and its line span.
 *
 * @param name simple name as written in the source
 * @param kind declaration kind
 * @param startLine first line, 1-based
 * @param endLine last line, 1-based and inclusive
 * @param scopeDepth number of enclosing declarations (0 for top level)
 */
public record Symbol(
        String name,
        SymbolKind kind,
        @JsonProperty("start_line") int startLine,
        @JsonProperty("end_line") int endLine,
        @JsonProperty("scope_depth") int scopeDepth) {

    public Symbol {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException(
                    "Invalid span %d-%d for symbol %s".formatted(startLine, endLine, name));
        }
        if (scopeDepth < 0) {
            throw new IllegalArgumentException("Negative scope depth for symbol " + name);
        }
    }

    public boolean encloses(Symbol other) {
        return other.scopeDepth > scopeDepth && other.startLine >= startLine && other.endLine <= endLine;
    }
}
