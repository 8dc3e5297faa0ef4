package ai.navigator.analyzer;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum SymbolKind {
    FUNCTION,
    CLASS,
    METHOD,
    OTHER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
