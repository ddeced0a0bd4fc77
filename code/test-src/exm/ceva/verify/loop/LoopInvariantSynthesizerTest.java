package exm.ceva.verify.loop;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Assume;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.ceva.ast.Function;
import exm.ceva.ast.FunctionBuilder;
import exm.ceva.ast.SExpressions;
import exm.ceva.common.Logging;
import exm.ceva.common.lang.IntegerMode;
import exm.ceva.diagnostics.Diagnostic;
import exm.ceva.diagnostics.DiagnosticCode;
import exm.ceva.verify.FixedSolverBackend;
import exm.ceva.verify.FunctionVerificationResult;
import exm.ceva.verify.SolverOrchestrator;
import exm.ceva.verify.VerificationDiagnostics;
import exm.ceva.verify.VerificationOutcome;
import exm.ceva.verify.VerificationOutcome.Status;
import exm.ceva.verify.VerificationRunner;
import exm.ceva.verify.z3.Z3Backend;

public class LoopInvariantSynthesizerTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("LoopInvariantSynthesizerTest.ceva.log", true);
  }

  private static Z3Backend z3() {
    Z3Backend backend = new Z3Backend();
    Assume.assumeTrue(backend.isAvailable());
    return backend;
  }

  private static LoopInvariantSynthesizer synthesizer() {
    return new LoopInvariantSynthesizer(z3(), IntegerMode.TRAP, 3, 10000);
  }

  private static Function counter() throws Exception {
    return new FunctionBuilder("Count").param("n", "i32").returns("i32")
        .ensures("(>= result 0)")
        .body("(bind i i32 0) (while (< i n) {(assign i (+ i 1))}) " +
              "(return i)").build();
  }

  @Test
  public void testForLoopLowerBound() throws Exception {
    Function f = new FunctionBuilder("Sum").param("n", "i32")
        .returns("i32")
        .body("(bind s i32 0) (for i i32 0 n {(assign s i)}) (return s)")
        .build();
    List<LoopInvariant> invs = synthesizer().synthesize(f);
    assertEquals(1, invs.size());
    LoopInvariant inv = invs.get(0);
    assertTrue(inv.toString(), inv.isProven());
    assertEquals("i", inv.variable());
    assertEquals(1, inv.k());
    assertEquals("(>= i 0)", SExpressions.print(inv.invariant()));
  }

  @Test
  public void testWhileLoopBounded() throws Exception {
    List<LoopInvariant> invs = synthesizer().synthesize(counter());
    assertEquals(1, invs.size());
    LoopInvariant inv = invs.get(0);
    assertTrue(inv.toString(), inv.isProven());
    assertEquals("i", inv.variable());
    String printed = SExpressions.print(inv.invariant());
    assertTrue(printed, printed.contains("(>= i 0)"));
    assertTrue(printed, printed.contains("(<= i n)"));
  }

  @Test
  public void testDescendingLoop() throws Exception {
    Function f = new FunctionBuilder("Down").param("n", "i32")
        .returns("i32")
        .body("(bind i i32 100) (while (> i n) {(assign i (- i 1))}) " +
              "(return i)").build();
    List<LoopInvariant> invs = synthesizer().synthesize(f);
    assertEquals(1, invs.size());
    String printed = SExpressions.print(invs.get(0).invariant());
    assertTrue(printed, printed.contains("(<= i 100)"));
  }

  @Test
  public void testUnsupportedLoopsSkipped() throws Exception {
    Function unknown = new FunctionBuilder("f").param("n", "i32")
        .returns("i32")
        .body("(bind i i32 0) " +
              "(while (< i n) {(unknown \"x = 7\") (assign i (+ i 1))}) " +
              "(return i)").build();
    assertTrue(synthesizer().synthesize(unknown).isEmpty());

    Function cont = new FunctionBuilder("g").param("n", "i32")
        .returns("i32")
        .body("(bind i i32 0) " +
              "(while (< i n) {(assign i (+ i 1)) (continue)}) " +
              "(return i)").build();
    assertTrue(synthesizer().synthesize(cont).isEmpty());

    Function noEntry = new FunctionBuilder("h").param("i", "i32")
        .param("n", "i32").returns("i32")
        .body("(while (< i n) {(assign i (+ i 1))}) (return i)").build();
    assertTrue("Entry value not constant",
               synthesizer().synthesize(noEntry).isEmpty());
  }

  @Test
  public void testUnavailableSolver() throws Exception {
    LoopInvariantSynthesizer s = new LoopInvariantSynthesizer(
        FixedSolverBackend.unavailable(), IntegerMode.TRAP, 3, 1000);
    assertTrue(s.synthesize(counter()).isEmpty());
  }

  @Test
  public void testPostconditionNeedsInvariant() throws Exception {
    Z3Backend backend = z3();
    SolverOrchestrator orchestrator = new SolverOrchestrator(backend,
        IntegerMode.TRAP, 10000, 16, 64);

    VerificationRunner plain = new VerificationRunner(orchestrator, null);
    FunctionVerificationResult without = plain.verify(counter(), null);
    VerificationOutcome o = without.postconditions().get(0);
    assertEquals(o.toString(), Status.UNPROVEN, o.status());
    assertTrue(without.loopInvariants().isEmpty());

    VerificationRunner induction = new VerificationRunner(orchestrator,
        null, new LoopInvariantSynthesizer(backend, IntegerMode.TRAP, 3,
                                           10000));
    FunctionVerificationResult with = induction.verify(counter(), null);
    o = with.postconditions().get(0);
    assertEquals(o.toString(), Status.PROVEN, o.status());
    assertEquals(1, with.loopInvariants().size());

    List<Diagnostic> diags = VerificationDiagnostics.forResult(with, false);
    boolean reported = false;
    for (Diagnostic d: diags) {
      if (d.code().equals(DiagnosticCode.LOOP_INVARIANT_PROVEN)) {
        reported = true;
        assertTrue(d.message(), d.message().contains("Count"));
      }
    }
    assertTrue(diags.toString(), reported);
  }

  @Test
  public void testCandidates() throws Exception {
    Function f = counter();
    List<InductionLoop> loops = new ArrayList<InductionLoop>();
    LoopInvariantSynthesizer.findLoops(f.body(), loops);
    assertEquals(1, loops.size());
    InductionLoop loop = loops.get(0);
    assertTrue(loop.ascending());
    assertEquals(2, LoopInvariantSynthesizer.candidates(loop).size());
  }
}
