package exm.ceva.analysis.bugpattern;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Collections;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ceva.ast.Function;
import exm.ceva.ast.FunctionBuilder;
import exm.ceva.cfg.ControlFlowBuilder;
import exm.ceva.common.Logging;
import exm.ceva.diagnostics.Category;
import exm.ceva.diagnostics.Diagnostic;
import exm.ceva.diagnostics.DiagnosticCode;
import exm.ceva.diagnostics.Severity;

public class BugPatternDetectorTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("BugPatternDetectorTest.ceva.log", true);
  }

  private static List<Diagnostic> detect(Function f) {
    BugPatternDetector detector = new BugPatternDetector(
                          BugPatternDetector.allCheckers(), 1000);
    return detector.analyze(ControlFlowBuilder.build(f));
  }

  private static FunctionBuilder safeDivide() {
    return new FunctionBuilder("SafeDivide").at("div.cv", 1)
        .param("a", "i32").param("b", "i32").returns("i32")
        .body("(return (/ a b))");
  }

  @Test
  public void testPreconditionRulesOutZero() throws Exception {
    Function f = safeDivide().requires("(!= b 0)").build();
    assertTrue(detect(f).isEmpty());
  }

  @Test
  public void testDivisorMayBeZero() throws Exception {
    Function f = safeDivide().build();
    List<Diagnostic> diags = detect(f);
    assertEquals(1, diags.size());
    Diagnostic d = diags.get(0);
    assertEquals(DiagnosticCode.DIVISION_BY_ZERO, d.code());
    assertEquals(Severity.WARNING, d.severity());
    assertEquals(Category.BUG_PATTERN, d.category());
    assertEquals("At division site", 2, d.span().getLine());
  }

  @Test
  public void testLiteralZeroDivisor() throws Exception {
    Function f = new FunctionBuilder("f").param("a", "i32").returns("i32")
        .body("(return (% a 0))").build();
    List<Diagnostic> diags = detect(f);
    assertEquals(1, diags.size());
    assertEquals(Severity.ERROR, diags.get(0).severity());
  }

  @Test
  public void testBranchGuardsDivision() throws Exception {
    Function f = new FunctionBuilder("f").param("a", "i32")
        .param("b", "i32").returns("i32")
        .body("(if (== b 0) {(return 0)}) (return (/ a b))").build();
    assertTrue(detect(f).isEmpty());
  }

  @Test
  public void testPositiveRangeDivisor() throws Exception {
    Function f = new FunctionBuilder("f").param("a", "i32")
        .param("b", "i32").requires("(> b 0)").returns("i32")
        .body("(bind c i32 (+ b 1)) (return (/ a c))").build();
    assertTrue(detect(f).isEmpty());
  }

  @Test
  public void testNullDereference() throws Exception {
    Function f = new FunctionBuilder("Count").param("s", "[i32]?")
        .returns("i32").body("(return (len s))").build();
    List<Diagnostic> diags = detect(f);
    assertEquals(1, diags.size());
    assertEquals(DiagnosticCode.NULL_DEREFERENCE, diags.get(0).code());
    assertEquals(Severity.WARNING, diags.get(0).severity());
  }

  @Test
  public void testNullChecked() throws Exception {
    Function f = new FunctionBuilder("Count").param("s", "[i32]?")
        .returns("i32")
        .body("(if (!= s null) {(return (len s))}) (return 0)").build();
    assertTrue(detect(f).isEmpty());

    Function g = new FunctionBuilder("NonEmpty").param("s", "[i32]?")
        .returns("bool")
        .body("(return (&& (!= s null) (> (len s) 0)))").build();
    assertTrue("Short-circuit guard", detect(g).isEmpty());
  }

  @Test
  public void testDefinitelyNull() throws Exception {
    Function f = new FunctionBuilder("f").returns("i32")
        .body("(bind s [i32]? null) (return (at s 0))").build();
    List<Diagnostic> diags = detect(f);
    assertEquals(1, diags.size());
    assertEquals(Severity.ERROR, diags.get(0).severity());
  }

  @Test
  public void testConstantOverflow() throws Exception {
    Function f = new FunctionBuilder("f").param("a", "i32").returns("i32")
        .body("(bind x i32 2147483647) (return (+ x 1))").build();
    List<Diagnostic> diags = detect(f);
    assertEquals(1, diags.size());
    assertEquals(DiagnosticCode.INTEGER_OVERFLOW, diags.get(0).code());
  }

  @Test
  public void testNoOverflowOnUnknownOperands() throws Exception {
    Function f = new FunctionBuilder("f").param("a", "i32").returns("i32")
        .body("(return (* (+ a 1) 2))").build();
    assertTrue(detect(f).isEmpty());
  }

  @Test
  public void testLoopPastEnd() throws Exception {
    Function f = new FunctionBuilder("Sum").param("a", "[i32]")
        .requires("(== (len a) 5)").returns("i32")
        .body("(bind s i32 0) (for i i32 0 5 {(assign s (+ s (at a i)))})" +
              " (return s)").build();
    List<Diagnostic> diags = detect(f);
    assertEquals(1, diags.size());
    assertEquals(DiagnosticCode.INDEX_OUT_OF_BOUNDS, diags.get(0).code());
    assertEquals(Severity.WARNING, diags.get(0).severity());
  }

  @Test
  public void testLoopWithinBounds() throws Exception {
    Function f = new FunctionBuilder("Sum").param("a", "[i32]")
        .requires("(== (len a) 5)").returns("i32")
        .body("(bind s i32 0) (for i i32 0 4 {(assign s (+ s (at a i)))})" +
              " (return s)").build();
    assertTrue(detect(f).isEmpty());
  }

  @Test
  public void testConstantIndexOutOfBounds() throws Exception {
    Function f = new FunctionBuilder("f").param("a", "[i32]")
        .requires("(>= (len a) 1)", "(<= (len a) 3)").returns("i32")
        .body("(store a -1 0) (return (at a 3))").build();
    List<Diagnostic> diags = detect(f);
    assertEquals(2, diags.size());
    for (Diagnostic d: diags) {
      assertEquals(DiagnosticCode.INDEX_OUT_OF_BOUNDS, d.code());
      assertEquals(Severity.ERROR, d.severity());
    }
  }

  @Test
  public void testDisabledCheckers() throws Exception {
    BugPatternDetector none = new BugPatternDetector(
        Collections.<BugPatternChecker>emptyList(), 1000);
    Function f = safeDivide().build();
    assertTrue(none.analyze(ControlFlowBuilder.build(f)).isEmpty());
  }
}
