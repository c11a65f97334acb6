package com.wrenparser;

import com.wrenparser.ast.*;
import com.wrenparser.ast.Module;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestDefinitions {

    private static Module parseClean(String source) {
        ParseResult result = Parser.parse("test.wren", source);
        assertFalse(result.hasProblems(), () -> "unexpected problems: " + result.problems());
        return result.module();
    }

    @Test
    void testClassWithSingleLineReturn() {
        Module module = parseClean("class Foo {\n  bar() { return 1 }\n}");

        assertEquals(1, module.statements().size());
        ClassStmt foo = assertInstanceOf(ClassStmt.class, module.statements().get(0));
        assertEquals("Foo", foo.name().text());
        assertNull(foo.superclass());
        assertNull(foo.foreignKeyword());
        assertEquals(1, foo.methods().size());

        Method bar = foo.methods().get(0);
        assertEquals("bar", bar.name().text());
        assertEquals(List.of(), bar.parameters());
        ExpressionBody body = assertInstanceOf(ExpressionBody.class, bar.body());
        ReturnStmt ret = assertInstanceOf(ReturnStmt.class, body.expression());
        NumExpr value = assertInstanceOf(NumExpr.class, ret.value());
        assertEquals("1", value.value().text());

        assertEquals("(module (class Foo (method bar () (return 1))))", AstPrinter.print(module));
    }

    @Test
    void testVariables() {
        Module module = parseClean("var a = 1\nvar b = 2");

        assertEquals(2, module.statements().size());
        VarStmt a = assertInstanceOf(VarStmt.class, module.statements().get(0));
        VarStmt b = assertInstanceOf(VarStmt.class, module.statements().get(1));
        assertEquals("a", a.name().text());
        assertEquals("b", b.name().text());
        assertEquals("(var b 2)", AstPrinter.print(b));

        VarStmt empty = assertInstanceOf(VarStmt.class, parseClean("var c").statements().get(0));
        assertNull(empty.initializer());
    }

    @Test
    void testImports() {
        Module module = parseClean("import \"math\" for Vector, Matrix\nimport \"io\"");

        ImportStmt math = assertInstanceOf(ImportStmt.class, module.statements().get(0));
        assertEquals("\"math\"", math.path().text());
        assertEquals(2, math.variables().size());
        assertEquals("(import \"math\" (Vector Matrix))", AstPrinter.print(math));

        ImportStmt io = assertInstanceOf(ImportStmt.class, module.statements().get(1));
        assertNull(io.variables());
        assertEquals("(import \"io\")", AstPrinter.print(io));
    }

    @Test
    void testMethodForms() {
        String source = String.join("\n",
            "foreign class File is Stream {",
            "  construct open(path) {}",
            "  foreign static exists(path)",
            "  +(other) { add(other) }",
            "  [index] { _items[index] }",
            "  ! { negate }",
            "  - { 0 }",
            "  count { _count }",
            "}");
        Module module = parseClean(source);

        ClassStmt file = assertInstanceOf(ClassStmt.class, module.statements().get(0));
        assertNotNull(file.foreignKeyword());
        assertEquals("Stream", file.superclass().text());
        assertEquals(7, file.methods().size());

        Method open = file.methods().get(0);
        assertTrue(open.isConstructor());
        assertFalse(open.isStatic());
        assertInstanceOf(StatementBody.class, open.body());

        Method exists = file.methods().get(1);
        assertTrue(exists.isForeign());
        assertTrue(exists.isStatic());
        assertNull(exists.body());

        Method negate = file.methods().get(3);
        assertEquals("!", negate.name().text());
        assertNull(negate.parameters());

        Method count = file.methods().get(6);
        assertNull(count.parameters());

        assertEquals(
            "(class foreign File is Stream"
                + " (method construct open (path) (block))"
                + " (method foreign static exists (path))"
                + " (method + (other) (call add (other)))"
                + " (method [ (index) (subscript _items index))"
                + " (method ! negate)"
                + " (method - 0)"
                + " (method count _count))",
            AstPrinter.print(file));
    }

    @Test
    void testMultiLineMethodBody() {
        String source = String.join("\n",
            "class Runner {",
            "  run(n) {",
            "    var i = 0",
            "    while (i < n) i = i + 1",
            "    if (i == n) return i else return 0",
            "    for (x in [1, 2]) {",
            "      System.print(x)",
            "      break",
            "    }",
            "    return",
            "  }",
            "}");
        Module module = parseClean(source);

        ClassStmt runner = assertInstanceOf(ClassStmt.class, module.statements().get(0));
        StatementBody body = assertInstanceOf(StatementBody.class, runner.methods().get(0).body());
        assertEquals(5, body.statements().size());
        assertEquals(1, body.parameters().size());
        assertNull(assertInstanceOf(ReturnStmt.class, body.statements().get(4)).value());

        assertEquals(
            "(class Runner (method run (n) (block"
                + " (var i 0)"
                + " (while (< i n) (= i (+ i 1)))"
                + " (if (== i n) (return i) (return 0))"
                + " (for x (list 1 2) (block (call System print (x)) (break)))"
                + " (return))))",
            AstPrinter.print(runner));
    }

    @Test
    void testBlankLinesAndComments() {
        Module module = parseClean("\n\n// header\nvar a = 1\n\n\n/* between */\nvar b = 2\n\n");
        assertEquals(2, module.statements().size());
    }

    @Test
    void testSuperCallsInSubclass() {
        String source = String.join("\n",
            "class B is A {",
            "  construct new() {",
            "    super()",
            "    super.init(1)",
            "  }",
            "}");
        Module module = parseClean(source);

        assertEquals(
            "(module (class B is A (method construct new () (block (super ()) (super init (1))))))",
            AstPrinter.print(module));
    }

    @Test
    void testBareReturnInSingleLineBody() {
        Module module = parseClean("class A {\n  f { return }\n}");

        Method f = ((ClassStmt) module.statements().get(0)).methods().get(0);
        ExpressionBody body = assertInstanceOf(ExpressionBody.class, f.body());
        ReturnStmt ret = assertInstanceOf(ReturnStmt.class, body.expression());
        assertNull(ret.value());
    }

    @Test
    void testTopLevelControlFlow() {
        Module module = parseClean("if (a) {\n  b\n} else c\nwhile (true) {}");

        IfStmt ifStmt = assertInstanceOf(IfStmt.class, module.statements().get(0));
        assertInstanceOf(BlockStmt.class, ifStmt.thenBranch());
        assertEquals("else", ifStmt.elseKeyword().text());
        assertEquals("(if a (block b) c)", AstPrinter.print(ifStmt));
        assertEquals("(while true (block))", AstPrinter.print(module.statements().get(1)));
    }

    @Test
    void testParsingIsRepeatable() {
        SourceBuffer source = new SourceBuffer("test.wren", "class A {\n  f(x) { x * 2 }\n}\nvar y = A.new().f(3)");

        ParseResult first = Parser.parse(source);
        ParseResult second = Parser.parse(source);

        assertFalse(first.hasProblems());
        assertEquals(AstPrinter.print(first.module()), AstPrinter.print(second.module()));
        assertEquals(first.module(), second.module());
    }
}
