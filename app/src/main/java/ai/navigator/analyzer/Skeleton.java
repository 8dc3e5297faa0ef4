package ai.navigator.analyzer;

import java.util.List;

/**
 * Result of extracting one file.
 *
 * @param language language the content was extracted as; {@link Languages#UNSUPPORTED} or {@link Languages#ERROR}
 *     for raw-snippet fallbacks
 * @param text rendered skeleton
 * @param symbols declarations in file order
 * @param totalLines number of lines in the content
 */
public record Skeleton(String language, String text, List<Symbol> symbols, int totalLines) {

    public Skeleton {
        symbols = List.copyOf(symbols);
    }

    public boolean isFallback() {
        return Languages.UNSUPPORTED.equals(language) || Languages.ERROR.equals(language);
    }
}
