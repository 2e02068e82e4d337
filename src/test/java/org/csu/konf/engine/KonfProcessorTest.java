package org.csu.konf.engine;

import org.csu.konf.common.exception.ErrorKind;
import org.csu.konf.common.exception.KonfException;
import org.csu.konf.common.model.NumberValue;
import org.csu.konf.compiler.parser.ast.Program;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 流水线的集成测试：源文本到 JSON 的完整过程。
 */
public class KonfProcessorTest {

    private final KonfProcessor processor = new KonfProcessor();

    @Test
    void testNestedRecordScenario() {
        System.out.println("--- Running test: testNestedRecordScenario ---");
        String source = "5\n"
                + "set a = 5\n"
                + "{ A -> 10. B -> { Z -> 10. a -> 20. e -> $[a]. }. C -> 5. }\n";

        String json = processor.execute(source);
        System.out.println("JSON: " + json);

        // e 取的是全局常量 a，而不是同一记录里的键 a
        assertEquals("[5.0,[\"a\",5.0],{\"A\":10.0,\"B\":{\"Z\":10.0,\"a\":20.0,\"e\":5.0},\"C\":5.0}]", json);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testCommentedMultiLineProgram() {
        System.out.println("--- Running test: testCommentedMultiLineProgram ---");
        String source = " #Это однострочный комментарий\n"
                + "5\n"
                + "50\n"
                + "set a = 5\n"
                + "{\n"
                + "    A -> 10.\n"
                + "    B -> { Z -> 10. a -> 20. r-> 30. e->$[a].}.\n"
                + "    C -> 5.\n"
                + " }\n"
                + "set qq = 465\n"
                + "set tt = 555\n";

        String json = processor.execute(source);
        System.out.println("JSON: " + json);

        assertEquals("[5.0,50.0,[\"a\",5.0],{\"A\":10.0,\"B\":{\"Z\":10.0,\"a\":20.0,\"r\":30.0,\"e\":5.0},\"C\":5.0},"
                + "[\"qq\",465.0],[\"tt\",555.0]]", json);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testNumericOnlyProgramIsIdentity() {
        assertEquals("[1.0,-2.0,0.25,1500.0]", processor.execute("1 -2 .25 1.5e3"));
    }

    @Test
    void testDuplicateKeyCollapses() {
        assertEquals("[{\"A\":2.0}]", processor.execute("{A -> 1. A -> 2.}"));
    }

    @Test
    void testEachPhaseReportsItsErrorKind() {
        System.out.println("--- Running test: testEachPhaseReportsItsErrorKind ---");
        assertKind(ErrorKind.LEX, "5 @");
        assertKind(ErrorKind.SYNTAX, "{}");
        assertKind(ErrorKind.NUMBER_FORMAT, "5e");
        assertKind(ErrorKind.UNBOUND_NAME, "$[x] set x = 1");
        System.out.println("Result: Test PASSED.\n");
    }

    private void assertKind(ErrorKind expected, String source) {
        KonfException e = assertThrows(KonfException.class, () -> processor.execute(source));
        System.out.println("Caught expected exception: " + e.getMessage());
        assertEquals(expected, e.getKind(), "Wrong error kind for: " + source);
        assertTrue(e.hasPosition());
    }

    @Test
    void testEvaluationsDoNotShareEnvironments() {
        System.out.println("--- Running test: testEvaluationsDoNotShareEnvironments ---");
        EvaluationResult first = processor.evaluate("set a = 1");
        assertTrue(first.environment().isDefined("a"));

        assertThrows(KonfException.class, () -> processor.evaluate("$[a]"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testCallerOwnedEnvironmentCarriesBindings() {
        Environment environment = new Environment();
        processor.evaluate("set base = 1", environment);

        EvaluationResult result = processor.evaluate("$[base]", environment);

        assertEquals(new NumberValue(1.0), result.values().get(0));
        assertSame(environment, result.environment());
    }

    @Test
    void testCompileDoesNotEvaluate() {
        Program program = processor.compile("$[undeclared]");
        assertEquals(1, program.values().size());
    }

    @Test
    void testTraceWritesEveryPhase() {
        System.out.println("--- Running test: testTraceWritesEveryPhase ---");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        KonfProcessor tracing = new KonfProcessor(KonfOptions.builder()
                .trace(true)
                .traceOut(new PrintStream(buffer, true, StandardCharsets.UTF_8))
                .build());

        tracing.execute("set a = 5");
        String trace = buffer.toString(StandardCharsets.UTF_8);
        System.out.println(trace);

        assertTrue(trace.contains("[TRACE] Tokens:"));
        assertTrue(trace.contains("[TRACE] Parse tree:"));
        assertTrue(trace.contains("[TRACE] AST:"));
        assertTrue(trace.contains("[TRACE] Environment:"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testOptionsControlDepthAndFormatting() {
        KonfProcessor shallow = new KonfProcessor(KonfOptions.builder().maxNestingDepth(2).build());
        KonfException e = assertThrows(KonfException.class, () -> shallow.execute("{A -> {B -> 1.}.}"));
        assertEquals(ErrorKind.SYNTAX, e.getKind());

        KonfProcessor pretty = new KonfProcessor(KonfOptions.builder().prettyPrint(true).build());
        assertTrue(pretty.execute("{A -> 1.}").contains("\n"));
        assertFalse(KonfOptions.defaults().isPrettyPrint());
        assertEquals(256, KonfOptions.defaults().getMaxNestingDepth());
    }
}
