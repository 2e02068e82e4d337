package org.csu.konf.compiler;

import org.csu.konf.common.exception.ErrorKind;
import org.csu.konf.common.exception.MalformedNumberException;
import org.csu.konf.compiler.lexer.Lexer;
import org.csu.konf.compiler.normalizer.AstNormalizer;
import org.csu.konf.compiler.parser.Parser;
import org.csu.konf.compiler.parser.ast.ConstDeclNode;
import org.csu.konf.compiler.parser.ast.NumberNode;
import org.csu.konf.compiler.parser.ast.Program;
import org.csu.konf.compiler.parser.ast.RecordEntry;
import org.csu.konf.compiler.parser.ast.RecordNode;
import org.csu.konf.compiler.parser.ast.ReferenceNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstNormalizerTest {

    private final AstNormalizer normalizer = new AstNormalizer();

    private Program normalize(String source) {
        Program program = normalizer.normalize(new Parser(new Lexer(source).tokenize()).parse());
        System.out.println("Generated AST: " + program);
        return program;
    }

    @Test
    void testNormalizeStripsSyntaxNoise() {
        System.out.println("--- Running test: testNormalizeStripsSyntaxNoise ---");
        Program program = normalize("5 set a = 5 {A -> $[a]. A -> 2.}");

        assertEquals(3, program.values().size());
        assertEquals(new NumberNode(5.0), program.values().get(0));
        assertEquals(new ConstDeclNode("a", new NumberNode(5.0), 1, 3), program.values().get(1));

        // 重复的键在这一阶段不合并
        RecordNode expectedRecord = new RecordNode(List.of(
                new RecordEntry("A", new ReferenceNode("a", 1, 19)),
                new RecordEntry("A", new NumberNode(2.0))));
        assertEquals(expectedRecord, program.values().get(2));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testNestedDeclarationInsideRecord() {
        System.out.println("--- Running test: testNestedDeclarationInsideRecord ---");
        Program program = normalize("{ B -> set x = { C -> -0.5. }. }");

        RecordNode outer = (RecordNode) program.values().get(0);
        ConstDeclNode decl = (ConstDeclNode) outer.entries().get(0).value();
        assertEquals("x", decl.name());
        RecordNode inner = (RecordNode) decl.value();
        assertEquals(new NumberNode(-0.5), inner.entries().get(0).value());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testMalformedExponentIsRejected() {
        System.out.println("--- Running test: testMalformedExponentIsRejected ---");
        MalformedNumberException e = assertThrows(MalformedNumberException.class, () -> normalize("1 5e"));

        assertEquals(ErrorKind.NUMBER_FORMAT, e.getKind());
        assertEquals(3, e.getColumn());
        assertInstanceOf(NumberFormatException.class, e.getCause());
        assertThrows(MalformedNumberException.class, () -> normalize("1e+"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testOverflowingNumberIsRejected() {
        System.out.println("--- Running test: testOverflowingNumberIsRejected ---");
        MalformedNumberException e = assertThrows(MalformedNumberException.class, () -> normalize("1e999"));
        assertTrue(e.getMessage().contains("out of range"), e.getMessage());
        System.out.println("Result: Test PASSED.\n");
    }
}
