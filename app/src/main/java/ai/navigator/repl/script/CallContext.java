package ai.navigator.repl.script;

import ai.navigator.repl.Dependency;
import java.util.Collection;
import java.util.Set;

/** What a function sees of the statement calling it: the source line, dependency tracking and output. */
public final class CallContext {
    private final int line;
    private final Set<Dependency> tracked;
    private final ScriptOutput output;

    CallContext(int line, Set<Dependency> tracked, ScriptOutput output) {
        this.line = line;
        this.tracked = tracked;
        this.output = output;
    }

    public int line() {
        return line;
    }

    /** Records that the statement being evaluated read this file. */
    public void track(Dependency dependency) {
        tracked.add(dependency);
    }

    /** Dependencies collected so far by the current statement. */
    public Set<Dependency> tracked() {
        return Set.copyOf(tracked);
    }

    public void trackAll(Collection<Dependency> dependencies) {
        tracked.addAll(dependencies);
    }

    public void print(String text) {
        output.write(text);
    }
}
