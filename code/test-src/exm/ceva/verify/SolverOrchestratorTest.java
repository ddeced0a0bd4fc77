package exm.ceva.verify;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;

import org.junit.Assume;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.ceva.ast.Function;
import exm.ceva.ast.FunctionBuilder;
import exm.ceva.common.Logging;
import exm.ceva.common.lang.IntegerMode;
import exm.ceva.verify.VerificationOutcome.Status;
import exm.ceva.verify.z3.Z3Backend;

public class SolverOrchestratorTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("SolverOrchestratorTest.ceva.log", true);
  }

  private static SolverOrchestrator z3(IntegerMode mode) {
    return z3(mode, 10000);
  }

  private static SolverOrchestrator z3(IntegerMode mode, long timeoutMs) {
    Z3Backend backend = new Z3Backend();
    Assume.assumeTrue(backend.isAvailable());
    return new SolverOrchestrator(backend, mode, timeoutMs, 16, 64);
  }

  private static Function abs() throws Exception {
    return new FunctionBuilder("Abs").param("n", "i32").returns("i32")
        .ensures("(>= result 0)")
        .body("(if (< n 0) {(return (- n))} {(return n)})").build();
  }

  private static Function positive() throws Exception {
    return new FunctionBuilder("positive").param("n", "i32").returns("i32")
        .requires("(> n 0)").ensures("(> result 0)")
        .body("(return n)").build();
  }

  @Test
  public void testAbsProvenWhenOverflowTraps() throws Exception {
    SolverOrchestrator so = z3(IntegerMode.TRAP);
    FunctionVerificationResult r = so.verify(abs(), null);
    assertEquals(1, r.postconditions().size());
    assertEquals(r.toString(), Status.PROVEN,
                 r.postconditions().get(0).status());
  }

  @Test
  public void testAbsDisprovenWhenOverflowWraps() throws Exception {
    SolverOrchestrator so = z3(IntegerMode.WRAP);
    VerificationOutcome o = so.verify(abs(), null).postconditions().get(0);
    assertEquals(o.toString(), Status.DISPROVEN, o.status());
    Counterexample cex = o.counterexample();
    assertNotNull(cex);
    assertEquals(BigInteger.valueOf(Integer.MIN_VALUE),
                 cex.get("n").getIntLit());
  }

  @Test
  public void testSafeDivideProven() throws Exception {
    Function f = new FunctionBuilder("SafeDivide")
        .param("a", "i32").param("b", "i32").returns("i32")
        .requires("(!= b 0)", "(!= b -1)")
        .ensures("(== result (/ a b))")
        .body("(return (/ a b))").build();
    FunctionVerificationResult r = z3(IntegerMode.TRAP).verify(f, null);
    assertEquals(r.toString(), 3, r.count(Status.PROVEN));
  }

  @Test
  public void testMissingBranchDisproven() throws Exception {
    Function f = new FunctionBuilder("Clamp")
        .param("value", "i32").param("min", "i32").param("max", "i32")
        .returns("i32")
        .requires("(<= min max)")
        .ensures("(>= result min)", "(<= result max)")
        .body("(if (< value min) {(return min)}) (return value)").build();
    FunctionVerificationResult r = z3(IntegerMode.TRAP).verify(f, null);
    assertEquals(Status.PROVEN, r.preconditions().get(0).status());
    assertEquals(Status.PROVEN, r.postconditions().get(0).status());
    VerificationOutcome upper = r.postconditions().get(1);
    assertEquals(upper.toString(), Status.DISPROVEN, upper.status());
    BigInteger value = upper.counterexample().get("value").getIntLit();
    BigInteger max = upper.counterexample().get("max").getIntLit();
    assertTrue(value + " > " + max, value.compareTo(max) > 0);
  }

  @Test
  public void testTautologyProven() throws Exception {
    Function f = new FunctionBuilder("anything").param("n", "i32")
        .returns("i32")
        .ensures("(|| (>= result 0) (< result 0))")
        .body("(unknown \"opaque\") (return n)").build();
    FunctionVerificationResult r = z3(IntegerMode.TRAP).verify(f, null);
    assertEquals(Status.PROVEN, r.postconditions().get(0).status());
  }

  @Test
  public void testSelfEqualityProvenAtMinimumTimeout() throws Exception {
    Function f = new FunctionBuilder("spin").param("n", "i32")
        .returns("i32")
        .ensures("(== result result)")
        .body("(bind s i32 0) (while (< s n) {(assign s (+ s 1))}) " +
              "(return s)").build();
    SolverOrchestrator so = z3(IntegerMode.TRAP,
                               SolverOrchestrator.MIN_TIMEOUT_MS);
    assertEquals(SolverOrchestrator.MIN_TIMEOUT_MS, so.timeoutMs());
    VerificationOutcome o = so.verify(f, null).postconditions().get(0);
    assertEquals(o.toString(), Status.PROVEN, o.status());
  }

  @Test
  public void testTimeoutRaisedToFloor() throws Exception {
    SolverOrchestrator so = new SolverOrchestrator(
        new FixedSolverBackend(true, SolverResult.unsat()), IntegerMode.TRAP,
        1, 16, 64);
    assertEquals(SolverOrchestrator.MIN_TIMEOUT_MS, so.timeoutMs());
  }

  @Test
  public void testReturnInsideLoopNotProven() throws Exception {
    Function f = new FunctionBuilder("f").param("n", "i32").returns("i32")
        .ensures("(>= result 0)")
        .body("(while (> n 0) {(return -1)}) (return 0)").build();
    VerificationOutcome o = z3(IntegerMode.TRAP).verify(f, null)
                                .postconditions().get(0);
    assertEquals(o.toString(), Status.UNPROVEN, o.status());

    Function g = new FunctionBuilder("g").param("n", "i32").returns("i32")
        .ensures("(>= result 0)")
        .body("(for i i32 0 n {(return -1)}) (return 0)").build();
    o = z3(IntegerMode.TRAP).verify(g, null).postconditions().get(0);
    assertEquals(o.toString(), Status.UNPROVEN, o.status());
  }

  @Test
  public void testUnknownInsideLoopNotProven() throws Exception {
    Function h = new FunctionBuilder("h").param("n", "i32").returns("i32")
        .ensures("(== result 0)")
        .body("(bind x i32 0) (bind i i32 0) " +
              "(while (< i n) {(unknown \"x = 7\") (assign i (+ i 1))}) " +
              "(return x)").build();
    VerificationOutcome o = z3(IntegerMode.TRAP).verify(h, null)
                                .postconditions().get(0);
    assertEquals(o.toString(), Status.UNPROVEN, o.status());
  }

  @Test
  public void testWidenedLoopStillProvesUnchangedVariable() throws Exception {
    Function f = new FunctionBuilder("keep").param("n", "i32")
        .returns("i32")
        .ensures("(== result 3)")
        .body("(bind x i32 3) (bind i i32 0) " +
              "(while (< i n) {(assign i (+ i 1))}) (return x)").build();
    VerificationOutcome o = z3(IntegerMode.TRAP).verify(f, null)
                                .postconditions().get(0);
    assertEquals(o.toString(), Status.PROVEN, o.status());
  }

  @Test
  public void testNoContractsNoChecks() throws Exception {
    FixedSolverBackend backend =
        new FixedSolverBackend(true, SolverResult.unsat());
    SolverOrchestrator so = new SolverOrchestrator(backend, IntegerMode.TRAP,
                                                   1000, 16, 64);
    Function f = new FunctionBuilder("plain").param("n", "i32")
        .returns("i32").body("(return n)").build();
    FunctionVerificationResult r = so.verify(f, null);
    assertTrue(r.outcomes().isEmpty());
    assertEquals(0, so.getSolverInvocations());
    assertEquals(0, backend.sessionsOpened());
  }

  @Test
  public void testUnavailableSolverSkipsAll() throws Exception {
    FixedSolverBackend backend = FixedSolverBackend.unavailable();
    SolverOrchestrator so = new SolverOrchestrator(backend, IntegerMode.TRAP,
                                                   1000, 16, 64);
    FunctionVerificationResult r = so.verify(positive(), null);
    assertEquals(2, r.count(Status.SKIPPED));
    for (VerificationOutcome o: r.outcomes()) {
      assertEquals(SolverOrchestrator.SOLVER_UNAVAILABLE, o.reason());
    }
    assertEquals(0, backend.checks());
  }

  @Test
  public void testUnknownIsTransient() throws Exception {
    FixedSolverBackend backend = new FixedSolverBackend(true,
                                  SolverResult.unknown("timeout"));
    SolverOrchestrator so = new SolverOrchestrator(backend, IntegerMode.TRAP,
                                                   1000, 16, 64);
    FunctionVerificationResult r = so.verify(positive(), null);
    assertEquals(2, r.count(Status.UNPROVEN));
    assertTrue(r.hasTransientOutcome());
    assertTrue(r.outcomes().get(0).reason().contains("timeout"));
    assertEquals(2, so.getSolverInvocations());
    assertEquals(1, backend.sessionsClosed());
  }

  @Test
  public void testInvocationsCounted() throws Exception {
    FixedSolverBackend backend =
        new FixedSolverBackend(true, SolverResult.unsat());
    SolverOrchestrator so = new SolverOrchestrator(backend, IntegerMode.TRAP,
                                                   1000, 16, 64);
    FunctionVerificationResult r = so.verify(positive(), null);
    assertEquals(2, r.count(Status.PROVEN));
    assertFalse(r.hasTransientOutcome());
    // Precondition: negation, consistency, then the precondition alone
    assertEquals(4, so.getSolverInvocations());
    assertEquals(backend.checks(), so.getSolverInvocations());
    assertEquals(1, backend.sessionsOpened());
    assertEquals(1, backend.sessionsClosed());
  }
}
