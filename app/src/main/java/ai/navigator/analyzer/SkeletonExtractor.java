package ai.navigator.analyzer;

import ai.navigator.util.FileUtil;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Turns file content into a {@link Skeleton}. Dispatch is a flat language to strategy table;
 * anything not in the table, and anything a strategy fails on, gets a raw-snippet fallback.
 */
public final class SkeletonExtractor {
    private static final Logger logger = LogManager.getLogger(SkeletonExtractor.class);

    private final Map<String, SkeletonStrategy> strategies;
    private final SkeletonStrategy unsupported = FallbackSkeletonStrategy.unsupported();
    private final SkeletonStrategy afterError = FallbackSkeletonStrategy.afterError();

    public SkeletonExtractor(Map<String, SkeletonStrategy> strategies) {
        this.strategies = Map.copyOf(strategies);
    }

    /** Extractor with tree-sitter strategies for every language {@link Languages} detects. */
    public static SkeletonExtractor withDefaultLanguages() {
        return new SkeletonExtractor(Map.of(
                Languages.PYTHON, new TreeSitterSkeletonStrategy(LanguageSyntaxProfile.python()),
                Languages.JAVASCRIPT, new TreeSitterSkeletonStrategy(LanguageSyntaxProfile.javascript()),
                Languages.TYPESCRIPT,
                        new TreeSitterSkeletonStrategy(LanguageSyntaxProfile.typescript(Languages.TYPESCRIPT)),
                Languages.TSX, new TreeSitterSkeletonStrategy(LanguageSyntaxProfile.typescript(Languages.TSX)),
                Languages.GO, new TreeSitterSkeletonStrategy(LanguageSyntaxProfile.go()),
                Languages.RUST, new TreeSitterSkeletonStrategy(LanguageSyntaxProfile.rust()),
                Languages.JAVA, new TreeSitterSkeletonStrategy(LanguageSyntaxProfile.java()),
                Languages.C, new TreeSitterSkeletonStrategy(LanguageSyntaxProfile.cpp(Languages.C)),
                Languages.CPP, new TreeSitterSkeletonStrategy(LanguageSyntaxProfile.cpp(Languages.CPP))));
    }

    public boolean supports(@Nullable String language) {
        return language != null && strategies.containsKey(language);
    }

    public List<String> supportedLanguages() {
        return strategies.keySet().stream().sorted().toList();
    }

    /**
     * Extracts a skeleton. Never throws for bad content: failures are logged and yield a fallback
     * skeleton with language {@link Languages#ERROR}.
     */
    public Skeleton extract(String fileName, byte[] content, @Nullable String language) {
        var strategy = language == null ? null : strategies.get(language);
        if (strategy == null) {
            return unsupported.extract(fileName, content);
        }
        if (content.length > 0 && !FileUtil.isLikelyText(content, FileUtil.TEXT_SNIFF_BYTES)) {
            return unsupported.extract(fileName, content);
        }
        try {
            return strategy.extract(fileName, content);
        } catch (RuntimeException | LinkageError e) {
            logger.warn("Extraction failed for {} as {}: {}", fileName, language, e.toString());
            logger.debug("Extraction failure detail", e);
            return afterError.extract(fileName, content);
        }
    }
}
