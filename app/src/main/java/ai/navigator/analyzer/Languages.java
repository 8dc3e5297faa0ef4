package ai.navigator.analyzer;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/** Language identifiers and extension-based detection. */
public final class Languages {
    public static final String PYTHON = "python";
    public static final String JAVASCRIPT = "javascript";
    public static final String TYPESCRIPT = "typescript";
    public static final String TSX = "tsx";
    public static final String GO = "go";
    public static final String RUST = "rust";
    public static final String JAVA = "java";
    public static final String C = "c";
    public static final String CPP = "cpp";

    /** Marker language of fallback records for files nobody can parse. */
    public static final String UNSUPPORTED = "unsupported";

    /** Marker language of fallback records produced after an extraction failure. */
    public static final String ERROR = "error";

    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
            Map.entry(".py", PYTHON),
            Map.entry(".js", JAVASCRIPT),
            Map.entry(".jsx", JAVASCRIPT),
            Map.entry(".mjs", JAVASCRIPT),
            Map.entry(".cjs", JAVASCRIPT),
            Map.entry(".ts", TYPESCRIPT),
            Map.entry(".tsx", TSX),
            Map.entry(".go", GO),
            Map.entry(".rs", RUST),
            Map.entry(".java", JAVA),
            Map.entry(".c", C),
            Map.entry(".h", C),
            Map.entry(".cpp", CPP),
            Map.entry(".cc", CPP),
            Map.entry(".cxx", CPP),
            Map.entry(".hpp", CPP),
            Map.entry(".hh", CPP));

    private Languages() {}

    /** Language for the file's extension, or null when it is not a known source language. */
    public static @Nullable String detect(Path path) {
        var name = path.getFileName();
        if (name == null) {
            return null;
        }
        var fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return null;
        }
        return EXTENSIONS.get(fileName.substring(dot).toLowerCase(Locale.ROOT));
    }

    public static @Nullable String detect(ProjectFile file) {
        return EXTENSIONS.get(file.extension());
    }
}
