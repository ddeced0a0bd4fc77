package exm.ceva.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ceva.common.Logging;
import exm.ceva.common.exceptions.UserException;
import exm.ceva.common.lang.Operators.BinaryOp;
import exm.ceva.common.lang.SourceSpan;
import exm.ceva.common.lang.Types;

public class SExpressionParserTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("SExpressionParserTest.ceva.log", true);
  }

  private static Scope scope() {
    Scope s = new Scope();
    s.defineVar("n", Types.I32);
    s.defineVar("x", Types.I64);
    s.defineVar("arr", Types.arrayOf(Types.I32));
    s.defineVar(VarRef.RESULT, Types.I32);
    return s;
  }

  @Test
  public void testBinaryTyped() throws Exception {
    Expression e = SExpressionParser.parse("(>= result 0)", scope(),
                                           SourceSpan.line(3));
    assertEquals(Expression.ExprKind.BINARY, e.kind());
    BinaryExpr b = (BinaryExpr)e;
    assertEquals(BinaryOp.GTE, b.op());
    assertEquals(Types.BOOL, b.type());
    assertEquals("Literal adopts type of other side", Types.I32,
                 b.right().type());
    assertEquals(3, e.span().getLine());
  }

  @Test
  public void testLiteralTakesWideType() throws Exception {
    BinaryExpr b = (BinaryExpr)SExpressionParser.parse("(< x 5)", scope(),
                                                       SourceSpan.NONE);
    assertEquals(Types.I64, b.right().type());
    assertEquals("Printed with suffix", "(< x 5i64)", SExpressions.print(b));
  }

  @Test
  public void testArrayAccess() throws Exception {
    Expression e = SExpressionParser.parse(
        "(&& (< n (len arr)) (> (at arr n) 0))", scope(), SourceSpan.NONE);
    assertEquals(Types.BOOL, e.type());
    Expression idx = ((BinaryExpr)((BinaryExpr)e).right()).left();
    assertEquals(Expression.ExprKind.INDEX, idx.kind());
    assertEquals(Types.I32, idx.type());
  }

  @Test
  public void testPrintParsesBack() throws Exception {
    String text = "(-> (> n 0) (== (abs (- n)) n))";
    Expression e = SExpressionParser.parse(text, scope(), SourceSpan.NONE);
    Expression again = SExpressionParser.parse(SExpressions.print(e),
                                               scope(), SourceSpan.NONE);
    assertEquals(SExpressions.print(e), SExpressions.print(again));
  }

  @Test
  public void testUndefinedVariable() {
    try {
      SExpressionParser.parse("(> y 0)", scope(), SourceSpan.NONE);
      fail("Expected exception");
    } catch (UserException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("Undefined variable y"));
    }
  }

  @Test
  public void testMalformed() {
    for (String bad: new String[] {"(> n", "(> n 0))", "()", ""}) {
      try {
        SExpressionParser.parse(bad, scope(), SourceSpan.NONE);
        fail("Expected exception for: " + bad);
      } catch (UserException e) {
        // Expected
      }
    }
  }

  @Test
  public void testBodySpans() throws Exception {
    Scope s = scope();
    List<Statement> body = SExpressionParser.parseBody(
        "(bind y i32 (/ n 2))\n  (if (> y 0) {(assign y 0)})\n(return y)",
        s, SourceSpan.at("m.cv", 10, 1));
    assertEquals(3, body.size());
    assertEquals(10, body.get(0).span().getLine());
    assertEquals(11, body.get(1).span().getLine());
    assertEquals(3, body.get(1).span().getColumn());
    assertEquals(12, body.get(2).span().getLine());
    assertEquals("m.cv", body.get(2).span().getFile());
    assertEquals("bind adds local to scope", Types.I32, s.lookupVar("y"));
    IfStatement ifStmt = (IfStatement)body.get(1);
    assertTrue(ifStmt.elseBody().isEmpty());
  }

  @Test
  public void testBodyBlockRoundTrip() throws Exception {
    String text = "{(bind i i32 0) (while (< i n) {(assign i (+ i 1))})" +
                  " (for j i32 0 9 1 {(do (print j))}) (return i)}";
    Scope s = scope();
    s.defineFunction("print", Types.VOID);
    List<Statement> body = SExpressionParser.parseBody(text, s,
                                                       SourceSpan.NONE);
    assertEquals(text, SExpressions.print(body));
  }

  @Test
  public void testSyntaxErrorHasPosition() {
    try {
      SExpressionParser.parse("(&& (> n 0)\n    (< n 9)", scope(),
                              SourceSpan.NONE);
      fail("Expected exception");
    } catch (UserException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("Syntax error"));
      assertTrue(e.getMessage(), e.getMessage().contains("line 2:"));
    }
  }

  @Test
  public void testStringKeepsDelimiters() throws Exception {
    Scope s = scope();
    List<Statement> body = SExpressionParser.parseBody(
        "(unknown \"native call (x) {y}\") (return 0)", s, SourceSpan.NONE);
    assertEquals(2, body.size());
    UnknownStatement u = (UnknownStatement)body.get(0);
    assertEquals("native call (x) {y}", u.description());
  }

  @Test
  public void testNestedStatementSpans() throws Exception {
    List<Statement> body = SExpressionParser.parseBody(
        "{(while (> n 0)\n   {(assign n (- n 1))})}", scope(),
        SourceSpan.at("w.cv", 5, 1));
    WhileStatement loop = (WhileStatement)body.get(0);
    assertEquals(5, loop.span().getLine());
    assertEquals(2, loop.span().getColumn());
    Statement inner = loop.body().get(0);
    assertEquals(6, inner.span().getLine());
    assertEquals(5, inner.span().getColumn());
  }

  @Test
  public void testEmptyBody() throws Exception {
    assertTrue(SExpressionParser.parseBody("", scope(),
                                           SourceSpan.NONE).isEmpty());
    assertTrue(SExpressionParser.parseBody("{ }", scope(),
                                           SourceSpan.NONE).isEmpty());
  }

  @Test
  public void testBadStatements() {
    String[] bad = {
      "n",                          // not a list
      "(bind k i33 0)",             // bad integer width
      "(frobnicate n)",             // unknown statement
      "(if (> n 0) (assign n 0))",  // then branch must be a block
      "(return n n)",               // trailing input
      "{(return n)",                // unterminated block
    };
    for (String text: bad) {
      try {
        SExpressionParser.parseBody(text, scope(), SourceSpan.NONE);
        fail("Expected exception for: " + text);
      } catch (UserException e) {
        // Expected
      }
    }
  }
}
