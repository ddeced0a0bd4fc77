package exm.ceva.analysis.bugpattern;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Assume;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.ceva.ast.Function;
import exm.ceva.ast.FunctionBuilder;
import exm.ceva.cfg.ControlFlowBuilder;
import exm.ceva.common.Logging;
import exm.ceva.common.lang.IntegerMode;
import exm.ceva.diagnostics.Diagnostic;
import exm.ceva.diagnostics.DiagnosticCode;
import exm.ceva.diagnostics.Severity;
import exm.ceva.verify.FixedSolverBackend;
import exm.ceva.verify.SolverBackend;
import exm.ceva.verify.SolverResult;
import exm.ceva.verify.z3.Z3Backend;

public class BugPatternConfirmerTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("BugPatternConfirmerTest.ceva.log", true);
  }

  private static BugPatternConfirmer z3() {
    Z3Backend backend = new Z3Backend();
    Assume.assumeTrue(backend.isAvailable());
    return new BugPatternConfirmer(backend, IntegerMode.TRAP, 10000);
  }

  private static List<Diagnostic> detect(Function f,
                                         BugPatternConfirmer confirmer) {
    BugPatternDetector detector = new BugPatternDetector(
                BugPatternDetector.allCheckers(), 1000, confirmer);
    return detector.analyze(ControlFlowBuilder.build(f));
  }

  /** The range analysis can't see through (+ b 1) */
  private static FunctionBuilder offsetDivide(String pre) {
    return new FunctionBuilder("OffsetDivide")
        .param("a", "i32").param("b", "i32").returns("i32")
        .requires(pre);
  }

  @Test
  public void testWarningWithoutConfirmer() throws Exception {
    Function f = offsetDivide("(!= (+ b 1) 1)")
        .body("(return (/ a b))").build();
    List<Diagnostic> diags = detect(f, null);
    assertEquals(1, diags.size());
    assertEquals(DiagnosticCode.DIVISION_BY_ZERO, diags.get(0).code());
    assertEquals(Severity.WARNING, diags.get(0).severity());
  }

  @Test
  public void testImpossibleDivisionDropped() throws Exception {
    BugPatternConfirmer confirmer = z3();
    Function f = offsetDivide("(!= (+ b 1) 1)")
        .body("(return (/ a b))").build();
    assertTrue(detect(f, confirmer).isEmpty());
    assertEquals(1, confirmer.refuted());
  }

  @Test
  public void testPossibleDivisionKept() throws Exception {
    BugPatternConfirmer confirmer = z3();
    Function f = offsetDivide("(!= (+ b 1) 2)")
        .body("(return (/ a b))").build();
    List<Diagnostic> diags = detect(f, confirmer);
    assertEquals(1, diags.size());
    assertEquals(DiagnosticCode.DIVISION_BY_ZERO, diags.get(0).code());
    assertEquals(0, confirmer.refuted());
  }

  @Test
  public void testLocalDivisorNotChecked() throws Exception {
    FixedSolverBackend backend = new FixedSolverBackend(true,
                                          SolverResult.unsat());
    BugPatternConfirmer confirmer = new BugPatternConfirmer(backend,
                                          IntegerMode.TRAP, 1000);
    Function f = offsetDivide("(!= (+ b 1) 1)")
        .body("(bind c i32 b) (return (/ a c))").build();
    assertEquals(1, detect(f, confirmer).size());
    assertEquals(0, backend.checks());
  }

  @Test
  public void testUnknownKeepsWarning() throws Exception {
    SolverBackend backend = new FixedSolverBackend(true,
                                  SolverResult.unknown("timeout"));
    BugPatternConfirmer confirmer = new BugPatternConfirmer(backend,
                                          IntegerMode.TRAP, 1000);
    Function f = offsetDivide("(!= (+ b 1) 1)")
        .body("(return (/ a b))").build();
    assertEquals(1, detect(f, confirmer).size());
  }

  @Test
  public void testErrorsNeverChecked() throws Exception {
    FixedSolverBackend backend = new FixedSolverBackend(true,
                                          SolverResult.unsat());
    BugPatternConfirmer confirmer = new BugPatternConfirmer(backend,
                                          IntegerMode.TRAP, 1000);
    Function f = new FunctionBuilder("f").param("a", "i32").returns("i32")
        .body("(return (% a 0))").build();
    List<Diagnostic> diags = detect(f, confirmer);
    assertEquals(1, diags.size());
    assertEquals(Severity.ERROR, diags.get(0).severity());
    assertEquals("No session for definite errors", 0,
                 backend.sessionsOpened());
  }
}
