package ai.navigator.repl.script;

import static org.junit.jupiter.api.Assertions.*;

import ai.navigator.repl.Dependency;
import ai.navigator.repl.ReplState;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InterpreterTest {

    private static final Dependency A_PY = new Dependency("a.py", 1000L);
    private static final Dependency B_PY = new Dependency("b.py", 2000L);

    private ReplState state;
    private ScriptOutput output;
    private Interpreter interpreter;

    @BeforeEach
    void setUp() {
        state = new ReplState();
        output = new ScriptOutput(10_000);
        var functions = new HashMap<>(Builtins.all());
        // stand-in for a file helper: returns the file name and records the dependency
        functions.put("load", (ctx, args) -> {
            var name = args.bind(1, "path").string(0, "path", null);
            ctx.track(name.equals("a.py") ? A_PY : B_PY);
            return "contents of " + name;
        });
        interpreter = new Interpreter(state, functions, output);
    }

    private Object value(String name) {
        var variable = state.variable(name);
        assertNotNull(variable, "variable " + name + " should exist");
        return variable.value();
    }

    private Set<Dependency> deps(String name) {
        return state.variable(name).dependencies();
    }

    @Test
    void testArithmetic() {
        interpreter.run("""
                a = 7 / 2
                b = 7 // 2
                c = -7 // 2
                d = -7 % 3
                e = 2 * (3 + 4)
                f = 1.5 + 1
                """);

        assertEquals(3.5, value("a"));
        assertEquals(3L, value("b"));
        assertEquals(-4L, value("c"));
        assertEquals(2L, value("d"));
        assertEquals(14L, value("e"));
        assertEquals(2.5, value("f"));
    }

    @Test
    void testPrintFormatsLikePython() {
        interpreter.run("""
                print(1, 'two', [3, 'four'], {'k': None}, True, 2.0)
                print('a', 'b', sep='-', end='!')
                """);

        assertEquals("1 two [3, 'four'] {'k': None} True 2.0\na-b!", output.text());
    }

    @Test
    void testControlFlow() {
        interpreter.run("""
                total = 0
                evens = []
                for i in range(10):
                    if i % 2 == 0:
                        evens.append(i)
                    elif i == 5:
                        pass
                    else:
                        total += i
                """);

        assertEquals(List.of(0L, 2L, 4L, 6L, 8L), value("evens"));
        assertEquals(20L, value("total"));
    }

    @Test
    void testTupleUnpackingAndEnumerate() {
        interpreter.run("""
                pairs = []
                for i, word in enumerate(['x', 'y'], 1):
                    pairs.append(word * i)
                a, b = 1, 2
                a, b = b, a
                """);

        assertEquals(List.of("x", "yy"), value("pairs"));
        assertEquals(2L, value("a"));
        assertEquals(1L, value("b"));
    }

    @Test
    void testStringAndListOperations() {
        interpreter.run("""
                words = 'alpha beta  gamma'.split()
                joined = ','.join(words)
                upper = joined.upper()
                first = words[0]
                last = words[-1]
                middle = 'abcdef'[1:4]
                backwards = [1, 2, 3][::-1]
                n = len(words)
                has = 'beta' in words
                """);

        assertEquals(List.of("alpha", "beta", "gamma"), value("words"));
        assertEquals("alpha,beta,gamma", value("joined"));
        assertEquals("ALPHA,BETA,GAMMA", value("upper"));
        assertEquals("alpha", value("first"));
        assertEquals("gamma", value("last"));
        assertEquals("bcd", value("middle"));
        assertEquals(List.of(3L, 2L, 1L), value("backwards"));
        assertEquals(3L, value("n"));
        assertEquals(true, value("has"));
    }

    @Test
    void testDictOperations() {
        interpreter.run("""
                counts = {}
                for w in ['a', 'b', 'a']:
                    counts[w] = counts.get(w, 0) + 1
                keys = sorted(counts.keys())
                del counts['b']
                """);

        assertEquals(Map.of("a", 2L), value("counts"));
        assertEquals(List.of("a", "b"), value("keys"));
    }

    @Test
    void testAssignmentTakesDependenciesOfEverythingRead() {
        interpreter.run("""
                x = load('a.py')
                y = load('b.py')
                z = x + y
                w = 'constant'
                """);

        assertEquals(Set.of(A_PY), deps("x"));
        assertEquals(Set.of(B_PY), deps("y"));
        assertEquals(Set.of(A_PY, B_PY), deps("z"));
        assertEquals(Set.of(), deps("w"));
    }

    @Test
    void testRebindingReplacesDependencies() {
        interpreter.run("""
                x = load('a.py')
                x = 'fresh'
                """);

        assertEquals(Set.of(), deps("x"));
    }

    @Test
    void testInPlaceMutationMergesDependencies() {
        interpreter.run("""
                acc = []
                acc.append(load('a.py'))
                acc += [load('b.py')]
                """);

        assertEquals(Set.of(A_PY, B_PY), deps("acc"));
        assertEquals(2, ((List<?>) value("acc")).size());
    }

    @Test
    void testLoopVariableInheritsIterableDependencies() {
        interpreter.run("""
                lines = load('a.py').split()
                out = []
                for line in lines:
                    out.append(line)
                """);

        assertEquals(Set.of(A_PY), deps("line"));
        assertEquals(Set.of(A_PY), deps("out"));
    }

    @Test
    void testErrorKeepsEarlierEffects() {
        var e = assertThrows(ScriptException.class, () -> interpreter.run("""
                a = 1
                b = undefined_name
                c = 3
                """));

        assertEquals("NameError: name 'undefined_name' is not defined", e.getMessage());
        assertEquals(2, e.line());
        assertEquals(1L, value("a"));
        assertFalse(state.hasVariable("c"));
    }

    @Test
    void testSyntaxErrorRunsNothing() {
        var e = assertThrows(ScriptException.class, () -> interpreter.run("a = 1\nb = (\n"));

        assertTrue(e.getMessage().startsWith("SyntaxError"));
        assertFalse(state.hasVariable("a"));
    }

    @Test
    void testUnsupportedStatements() {
        var e = assertThrows(ScriptException.class, () -> interpreter.run("def f():\n    pass\n"));
        assertTrue(e.getMessage().contains("'def' is not supported"));

        var imp = assertThrows(ScriptException.class, () -> interpreter.run("import os\n"));
        assertTrue(imp.getMessage().startsWith("SyntaxError"));
    }

    @Test
    void testRuntimeErrors() {
        assertMessage("ZeroDivisionError", "x = 1 / 0");
        assertMessage("IndexError", "x = [1][5]");
        assertMessage("KeyError", "x = {'a': 1}['b']");
        assertMessage("TypeError", "x = 1 + 'a'");
        assertMessage("OverflowError", "x = 9223372036854775807 + 1");
        assertMessage("AttributeError", "x = 'abc'.nope()");
        assertMessage("AttributeError", "x = 'abc'.upper");
        assertMessage("TypeError", "f = print");
    }

    @Test
    void testRunawayLoopIsStopped() {
        var e = assertThrows(
                ScriptException.class,
                () -> interpreter.run("n = 0\nfor i in [0] * 1000001:\n    n += 1\n"));

        assertTrue(e.getMessage().startsWith("RuntimeError"), e.getMessage());
        assertEquals(1_000_000L, value("n"));
    }

    @Test
    void testOversizedRangeIsRejected() {
        var e = assertThrows(ScriptException.class, () -> interpreter.run("r = range(2000000)"));

        assertTrue(e.getMessage().startsWith("ValueError"), e.getMessage());
    }

    @Test
    void testOversizedSequenceIsRejected() {
        var e = assertThrows(ScriptException.class, () -> interpreter.run("x = 'ab' * 100000000"));

        assertTrue(e.getMessage().startsWith("MemoryError"), e.getMessage());
    }

    private void assertMessage(String prefix, String source) {
        var e = assertThrows(ScriptException.class, () -> interpreter.run(source));
        assertTrue(e.getMessage().startsWith(prefix + ":"), "expected " + prefix + " but got " + e.getMessage());
    }
}
