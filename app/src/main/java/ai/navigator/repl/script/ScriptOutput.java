package ai.navigator.repl.script;

/** Captured {@code print} output. Keeps at most {@code limit} characters but counts everything written. */
public final class ScriptOutput {
    private final StringBuilder text = new StringBuilder();
    private final int limit;
    private long totalLength;

    public ScriptOutput(int limit) {
        this.limit = limit;
    }

    public void write(String s) {
        totalLength += s.length();
        int room = limit - text.length();
        if (room > 0) {
            text.append(s, 0, Math.min(room, s.length()));
        }
    }

    public String text() {
        return text.toString();
    }

    public long totalLength() {
        return totalLength;
    }

    public boolean isTruncated() {
        return totalLength > text.length();
    }
}
