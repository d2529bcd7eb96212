package com.lumenlang.compiler.parser;

import com.lumenlang.compiler.ast.AstPrinter;
import com.lumenlang.compiler.ast.Operator;
import com.lumenlang.compiler.ast.decl.Function;
import com.lumenlang.compiler.ast.expr.*;
import com.lumenlang.compiler.ast.type.LumenType;
import com.lumenlang.compiler.lexer.Lexer;
import com.lumenlang.compiler.lexer.ListTokenSource;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private BlockExpr parse(String source) {
        return new Parser(new Lexer(source, "<test>")).parse();
    }

    /** 解析单条语句并打印为 S 表达式 */
    private String sexpr(String source) {
        BlockExpr program = parse(source);
        assertEquals(1, program.getStatements().size(), "Expected a single statement: " + source);
        return AstPrinter.print(program.getStatements().get(0));
    }

    private ParseException parseError(String source) {
        return assertThrows(ParseException.class, () -> parse(source));
    }

    // ============ 表达式优先级 ============

    @Nested
    @DisplayName("表达式优先级")
    class PrecedenceTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testMulOverAdd() {
            assertEquals("(+ 1 (* 2 3))", sexpr("1 + 2 * 3"));
            assertEquals("(+ (* 1 2) 3)", sexpr("1 * 2 + 3"));
        }

        @Test
        @DisplayName("括号改变优先级")
        void testParentheses() {
            assertEquals("(* (+ 1 2) 3)", sexpr("(1 + 2) * 3"));
        }

        @Test
        @DisplayName("全括号表达式与显式括号一致")
        void testFullyParenthesized() {
            assertEquals("(- (- 1 2) 3)", sexpr("((1 - 2) - 3)"));
            assertEquals("(&& (< a b) (== c d))", sexpr("((a < b) && (c == d))"));
        }

        @Test
        @DisplayName("同层链式运算右倾")
        void testSameTierRightLeaning() {
            assertEquals("(- 1 (- 2 3))", sexpr("1 - 2 - 3"));
            assertEquals("(/ 8 (/ 4 2))", sexpr("8 / 4 / 2"));
            assertEquals("(+ 1 (- 2 3))", sexpr("1 + 2 - 3"));
        }

        @Test
        @DisplayName("比较、相等、逻辑运算的层级")
        void testComparisonTiers() {
            assertEquals("(|| (&& (< a 1) (!= b 2)) c)", sexpr("a < 1 && b != 2 || c"));
            assertEquals("(== (< a b) true)", sexpr("a < b == true"));
        }

        @Test
        @DisplayName("赋值最松")
        void testAssignmentLoosest() {
            assertEquals("(= x (+ y 1))", sexpr("x = y + 1"));
            assertEquals("(+= i (* 2 k))", sexpr("i += 2 * k"));
            assertEquals("(-= i 1)", sexpr("i -= 1"));
        }

        @Test
        @DisplayName("一元运算符")
        void testUnary() {
            assertEquals("(- x)", sexpr("-x"));
            assertEquals("(! (! done))", sexpr("!!done"));
            assertEquals("(+ (- 1) 2)", sexpr("-1 + 2"));
        }

        @Test
        @DisplayName("二元运算符右侧的一元运算符")
        void testUnaryAfterBinary() {
            assertEquals("(* 1 (- 2))", sexpr("1 * -2"));
            assertEquals("(- 1 (- 2))", sexpr("1 - -2"));
            assertEquals("(&& a (! b))", sexpr("a && !b"));
        }

        @Test
        @DisplayName("函数调用")
        void testCall() {
            assertEquals("(call f 1 (+ 2 3))", sexpr("f(1, 2 + 3)"));
            assertEquals("(call g)", sexpr("g()"));
            assertEquals("(+ (call f x) 1)", sexpr("f(x) + 1"));
            assertEquals("(call h a b)", sexpr("h(a, b,)"));
        }

        @Test
        @DisplayName("调用节点的字段")
        void testCallNode() {
            BlockExpr program = parse("max(1, 2)");
            CallExpr call = (CallExpr) program.getStatements().get(0);
            assertEquals("max", call.getCallee());
            assertEquals(2, call.getArgs().size());
            assertTrue(call.getArgs().get(0) instanceof Literal);
        }

        @Test
        @DisplayName("二元节点位于运算符处")
        void testBinaryLocation() {
            BinaryExpr bin = (BinaryExpr) parse("10 + 20").getStatements().get(0);
            assertEquals(Operator.PLUS, bin.getOperator());
            assertEquals(1, bin.getLocation().getLine());
            assertEquals(4, bin.getLocation().getColumn());
            assertEquals(1, bin.getLocation().getLength());
            assertEquals(3, bin.getLocation().getOffset());
        }
    }

    // ============ 语句 ============

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("let 与分号分隔")
        void testLet() {
            BlockExpr program = parse("let x = 1; let y = x * 2;");
            assertEquals(2, program.getStatements().size());
            assertEquals("(block (let x 1) (let y (* x 2)))", AstPrinter.print(program));
        }

        @Test
        @DisplayName("代码块语句后分号可以省略")
        void testOptionalSemicolon() {
            assertEquals(2, parse("while (c) {} let b = 2").getStatements().size());
        }

        @Test
        @DisplayName("if / else")
        void testIfElse() {
            assertEquals("(if c 1 2)", sexpr("if (c) 1 else 2"));
            assertEquals("(if c (block (let x 1)))", sexpr("if (c) { let x = 1 }"));
            IfExpr ifExpr = (IfExpr) parse("if (c) 1").getStatements().get(0);
            assertFalse(ifExpr.hasElse());
            assertNull(ifExpr.getElseBranch());
        }

        @Test
        @DisplayName("if 作为表达式的项")
        void testIfAsTerm() {
            assertEquals("(let y (if (> x 0) x (- x)))", sexpr("let y = if (x > 0) x else -x"));
        }

        @Test
        @DisplayName("else if 链")
        void testElseIf() {
            assertEquals("(if a 1 (if b 2 3))", sexpr("if (a) 1 else if (b) 2 else 3"));
        }

        @Test
        @DisplayName("while")
        void testWhile() {
            assertEquals("(while (< i 10) (block (+= i 1)))", sexpr("while (i < 10) { i += 1 }"));
        }

        @Test
        @DisplayName("嵌套代码块")
        void testNestedBlocks() {
            assertEquals("(block (block) (let x 1))", sexpr("{ {} let x = 1 }"));
        }

        @Test
        @DisplayName("空程序")
        void testEmptyProgram() {
            BlockExpr program = parse("");
            assertTrue(program.isEmpty());
            assertTrue(program.getFunctions().isEmpty());
        }

        @Test
        @DisplayName("字面量种类")
        void testLiterals() {
            assertEquals("(block 1 2.5 true 'c' \"s\")", AstPrinter.print(parse("1; 2.5; true; 'c'; \"s\"")));
        }

        @Test
        @DisplayName("打印字面量时还原转义")
        void testEscapedLiterals() {
            assertEquals("(block \"a\\\"b\\n\" '\\'' '\\\\')",
                    AstPrinter.print(parse("\"a\\\"b\\n\"; '\\''; '\\\\'")));
        }
    }

    // ============ for 脱糖 ============

    @Nested
    @DisplayName("for 脱糖")
    class ForDesugarTests {

        @Test
        @DisplayName("递增索引循环")
        void testAscending() {
            assertEquals("(for (let i 0) (< i 5) (+= i 1) (block))", sexpr("for (i, 0, 5) {}"));
        }

        @Test
        @DisplayName("递减索引循环")
        void testDescending() {
            assertEquals("(for (let i 5) (> i 0) (+= i -1) (block))", sexpr("for (i, 5, 0) {}"));
        }

        @Test
        @DisplayName("显式步长")
        void testStep() {
            assertEquals("(for (let i 0) (< i 10) (+= i 2) x)", sexpr("for (i, 0, 10, 2) x"));
            assertEquals("(for (let i 10) (> i 0) (+= i (- 2)) x)", sexpr("for (i, 10, 0, 2) x"));
        }

        @Test
        @DisplayName("浮点索引循环的默认步长")
        void testFloatStep() {
            assertEquals("(for (let t 0.0) (< t 1.5) (+= t 1.0) x)", sexpr("for (t, 0.0, 1.5) x"));
        }

        @Test
        @DisplayName("计数循环使用隐藏计数器")
        void testCounting() {
            assertEquals("(for (let .for 0) (< .for 3) (+= .for 1) (block))", sexpr("for (3) {}"));
            assertEquals("(for (let .for 0) (< .for n) (+= .for 1) x)", sexpr("for (n) x"));
        }

        @Test
        @DisplayName("计数上限可以是表达式")
        void testCountingExpression() {
            assertEquals("(for (let .for 0) (< .for (* n 2)) (+= .for 1) x)", sexpr("for (n * 2) x"));
        }

        @Test
        @DisplayName("from 必须是数值字面量")
        void testFromMustBeNumeric() {
            ParseException e = parseError("for (i, true, 5) x");
            assertEquals("From in for must be int or float, got true", e.getRawMessage());
            assertEquals(9, e.getLocation().getColumn());
        }

        @Test
        @DisplayName("to 必须是数值字面量")
        void testToMustBeNumeric() {
            ParseException e = parseError("for (i, 0, 'z') x");
            assertEquals("To in for must be int or float, got 'z'", e.getRawMessage());
        }

        @Test
        @DisplayName("from 不能是变量")
        void testFromNotVariable() {
            ParseException e = parseError("for (i, n, 5) x");
            assertEquals("Expected a literal", e.getRawMessage());
        }
    }

    // ============ 函数声明 ============

    @Nested
    @DisplayName("函数声明")
    class FunctionDeclarationTests {

        @Test
        @DisplayName("带类型标注的函数")
        void testAnnotatedFunction() {
            BlockExpr program = parse("fun add(a: int, b: int): int = a + b");
            assertEquals(1, program.getFunctions().size());
            Function fun = program.getFunctions().get(0);
            assertEquals("add", fun.getName());
            assertEquals(2, fun.getArity());
            assertEquals(LumenType.INT, fun.getParamTypes().get(1));
            assertEquals(LumenType.INT, fun.getReturnType());
            assertEquals("(fun add (a:int b:int) int (+ a b))", AstPrinter.print(fun));
        }

        @Test
        @DisplayName("未标注返回类型时为 any")
        void testUnannotatedReturn() {
            Function fun = parse("fun f() = 1").getFunctions().get(0);
            assertEquals(0, fun.getArity());
            assertEquals(LumenType.ANY, fun.getReturnType());
            assertFalse(fun.hasInferredReturnType());
        }

        @Test
        @DisplayName("函数声明在语句中留下占位")
        void testPlaceholder() {
            BlockExpr program = parse("let x = 1; fun f(): int = x; f()");
            assertEquals("(block (let x 1) (fun f () int x) (call f))", AstPrinter.print(program));
            assertTrue(program.getStatements().get(1) instanceof FunDeclExpr);
        }

        @Test
        @DisplayName("打印时占位展开为完整函数")
        void testPrintedFunctionBody() {
            String printed = AstPrinter.print(parse("fun inc(n: int): int = n + 1; inc(41)"));
            assertEquals("(block (fun inc (n:int) int (+ n 1)) (call inc 41))", printed);
        }

        @Test
        @DisplayName("同名函数按声明顺序展开，嵌套代码块中的函数也展开")
        void testPrintedNestedFunctions() {
            String printed = AstPrinter.print(parse("fun f() = 1; { fun f(): bool = true; f() }"));
            assertEquals("(block (fun f () any 1) (block (fun f () bool true) (call f)))", printed);
        }

        @Test
        @DisplayName("函数表保持声明顺序")
        void testFunctionOrder() {
            BlockExpr program = parse("fun b() = 1; fun a() = 2; fun c() = 3");
            assertEquals("b", program.getFunctions().get(0).getName());
            assertEquals("a", program.getFunctions().get(1).getName());
            assertEquals("c", program.getFunctions().get(2).getName());
        }

        @Test
        @DisplayName("代码块函数体")
        void testBlockBody() {
            Function fun = parse("fun f(n: float): float = { let m = n * 2.0; m }").getFunctions().get(0);
            assertTrue(fun.getBody() instanceof BlockExpr);
        }

        @Test
        @DisplayName("嵌套函数属于内层代码块")
        void testNestedFunction() {
            BlockExpr program = parse("{ fun inner() = 1 }");
            assertTrue(program.getFunctions().isEmpty());
            BlockExpr inner = (BlockExpr) program.getStatements().get(0);
            assertEquals(1, inner.getFunctions().size());
        }

        @Test
        @DisplayName("缺少 = 报错")
        void testMissingAssign() {
            ParseException e = parseError("fun f() 1");
            assertEquals("Expected '='", e.getRawMessage());
        }

        @Test
        @DisplayName("参数缺少类型报错")
        void testMissingParamType() {
            ParseException e = parseError("fun f(a) = a");
            assertEquals("Expected ':'", e.getRawMessage());
        }

        @Test
        @DisplayName("未知类型名报错")
        void testBadType() {
            ParseException e = parseError("fun f(a: number) = a");
            assertEquals("Expected a type", e.getRawMessage());
        }
    }

    // ============ 语法错误 ============

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @Test
        @DisplayName("两个操作数相邻")
        void testAdjacentOperands() {
            ParseException e = parseError("1 2");
            assertEquals("Expected operator or ';'", e.getRawMessage());
            assertEquals(3, e.getLocation().getColumn());
        }

        @Test
        @DisplayName("末尾的运算符")
        void testTrailingOperator() {
            ParseException e = parseError("1 +;");
            assertEquals("Unexpected operator '+'", e.getRawMessage());
            assertEquals(3, e.getLocation().getColumn());
        }

        @Test
        @DisplayName("不是一元运算符")
        void testNotUnary() {
            ParseException e = parseError("* 2");
            assertEquals("Not a unary operator '*'", e.getRawMessage());
        }

        @Test
        @DisplayName("不是二元运算符")
        void testNotBinary() {
            ParseException e = parseError("a ! b");
            assertEquals("Not a binary operator '!'", e.getRawMessage());
        }

        @Test
        @DisplayName("输入意外结束")
        void testUnexpectedEnd() {
            ParseException e = parseError("let x =");
            assertTrue(e.getRawMessage().startsWith("Unexpected end of input"));
            assertEquals("expression", e.getExpected());
        }

        @Test
        @DisplayName("缺少右括号")
        void testMissingParen() {
            ParseException e = parseError("(1 + 2");
            assertEquals("Unexpected end of input, expected ')'", e.getRawMessage());
        }

        @Test
        @DisplayName("缺少右花括号")
        void testMissingBrace() {
            ParseException e = parseError("{ let x = 1");
            assertEquals("'}'", e.getExpected());
        }

        @Test
        @DisplayName("顶层多余的终结符")
        void testStrayTerminator() {
            ParseException e = parseError("1; }");
            assertEquals("Unexpected '}'", e.getRawMessage());
            assertEquals(4, e.getLocation().getColumn());
        }

        @Test
        @DisplayName("空括号")
        void testEmptyParens() {
            ParseException e = parseError("()");
            assertEquals("Expected an expression", e.getRawMessage());
        }

        @Test
        @DisplayName("词法错误报告为语法错误")
        void testLexicalError() {
            ParseException e = parseError("let s = \"open");
            assertEquals("Unterminated string", e.getRawMessage());
            assertEquals(9, e.getLocation().getColumn());
        }

        @Test
        @DisplayName("错误消息带位置")
        void testMessageWithLocation() {
            ParseException e = parseError("let = 1");
            assertEquals("Expected an identifier at <test>:1:5", e.getMessage());
        }

        @Test
        @DisplayName("解析器只能使用一次")
        void testSingleUse() {
            Parser parser = new Parser(new Lexer("1"));
            parser.parse();
            assertThrows(IllegalStateException.class, parser::parse);
        }
    }

    @Test
    @DisplayName("从 token 列表解析")
    void testFromTokenList() {
        Parser parser = new Parser(new ListTokenSource(new Lexer("a + b").scanTokens()), "<list>");
        BlockExpr program = parser.parse();
        assertEquals("(block (+ a b))", AstPrinter.print(program));
        assertEquals("<list>", program.getStatements().get(0).getLocation().getFile());
    }
}
