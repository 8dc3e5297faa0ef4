package ai.navigator.analyzer;

import ai.navigator.util.FileUtil;
import java.util.List;

/** Raw-snippet rendering used for every language without a registered strategy. */
public final class FallbackSkeletonStrategy implements SkeletonStrategy {
    public static final int PREVIEW_LINES = 20;

    private final String language;
    private final String label;

    private FallbackSkeletonStrategy(String language, String label) {
        this.language = language;
        this.label = label;
    }

    public static FallbackSkeletonStrategy unsupported() {
        return new FallbackSkeletonStrategy(Languages.UNSUPPORTED, "unsupported language");
    }

    /** Fallback used after a registered strategy failed on the content. */
    public static FallbackSkeletonStrategy afterError() {
        return new FallbackSkeletonStrategy(Languages.ERROR, "could not be parsed");
    }

    @Override
    public Skeleton extract(String fileName, byte[] content) {
        int total = FileUtil.countLines(content);
        if (!FileUtil.isLikelyText(content, FileUtil.TEXT_SNIFF_BYTES)) {
            var text = "# %s: binary file (%d bytes)".formatted(fileName, content.length);
            return new Skeleton(language, text, List.of(), total);
        }

        var lines = FileUtil.splitLinesKeepEnds(FileUtil.decodeLenient(content));
        var sb = new StringBuilder();
        sb.append("# %s: %s (%d lines)\n".formatted(fileName, label, total));
        int shown = Math.min(PREVIEW_LINES, lines.size());
        for (int i = 0; i < shown; i++) {
            sb.append(FileUtil.stripLineEnding(lines.get(i))).append('\n');
        }
        if (total > shown) {
            sb.append("... (%d more lines)\n".formatted(total - shown));
        }
        return new Skeleton(language, sb.toString(), List.of(), total);
    }
}
