package ai.navigator.repl.script;

import org.jetbrains.annotations.Nullable;

/** A callable exposed to scripts by name. */
@FunctionalInterface
public interface ScriptFunction {
    @Nullable
    Object call(CallContext context, Arguments arguments);
}
