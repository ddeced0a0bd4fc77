package exm.ceva.analysis;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.ceva.analysis.dataflow.DataflowAnalyzer;
import exm.ceva.ast.ExternalFunction;
import exm.ceva.ast.Function;
import exm.ceva.ast.FunctionBuilder;
import exm.ceva.ast.Module;
import exm.ceva.cfg.ControlFlowGraph;
import exm.ceva.common.Logging;
import exm.ceva.common.lang.Effects.EffectSet;
import exm.ceva.diagnostics.Category;
import exm.ceva.diagnostics.Diagnostic;
import exm.ceva.diagnostics.DiagnosticCode;
import exm.ceva.diagnostics.Severity;
import exm.ceva.verify.FixedSolverBackend;
import exm.ceva.verify.FunctionVerificationResult;
import exm.ceva.verify.SolverResult;
import exm.ceva.verify.VerificationOutcome;
import exm.ceva.verify.VerificationOutcome.Status;
import exm.ceva.verify.cache.FileVerificationCache;

public class AnalysisCoordinatorTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private static final Module EXTERNALS = new Module("ext",
      Collections.<Function>emptyList(), Arrays.asList(
      new ExternalFunction("execQuery",
          EffectSet.parse(Arrays.asList("db:w")), false, false, null)));

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("AnalysisCoordinatorTest.ceva.log", true);
  }

  /**
   * One function per analysis, plus one with contracts
   */
  private static Module sample() throws Exception {
    List<Function> fns = new ArrayList<Function>();
    fns.add(new FunctionBuilder("uninit").at("m.cv", 1).returns("i32")
        .body("(bind x i32) (return x)").build(EXTERNALS));
    fns.add(new FunctionBuilder("divide").at("m.cv", 10)
        .param("n", "i32").returns("i32")
        .body("(return (/ n 0))").build(EXTERNALS));
    fns.add(new FunctionBuilder("handle").at("m.cv", 20)
        .untrustedParam("q", "str")
        .body("(do (execQuery (+ \"SELECT \" q)))").build(EXTERNALS));
    fns.add(new FunctionBuilder("Abs").at("m.cv", 30)
        .param("n", "i32").returns("i32")
        .requires("(> n -2147483648)").ensures("(>= result 0)")
        .body("(if (< n 0) {(return (- n))} {(return n)})")
        .build(EXTERNALS));
    return new Module("m", fns, EXTERNALS.externals());
  }

  private static Module withUnknownCall() throws Exception {
    Function f = new FunctionBuilder("mystery").at("m.cv", 1)
        .body("(do (frobnicate 1))\n(do (frobnicate 1))")
        .build(EXTERNALS);
    return new Module("m", Arrays.asList(f), EXTERNALS.externals());
  }

  private static AnalysisOptions.Builder noSmt() {
    return AnalysisOptions.builder().useSmtVerification(false).workers(2);
  }

  private static List<Diagnostic> withCode(List<Diagnostic> ds,
                                           String code) {
    List<Diagnostic> res = new ArrayList<Diagnostic>();
    for (Diagnostic d: ds) {
      if (d.code().equals(code)) {
        res.add(d);
      }
    }
    return res;
  }

  @Test
  public void testAllAnalysesRun() throws Exception {
    AnalysisCoordinator coord = new AnalysisCoordinator(noSmt().build());
    AnalysisResult r = coord.analyze(sample());
    assertEquals(4, r.functionsAnalyzed());
    assertTrue(r.dataflowIssues() >= 1);
    assertTrue(r.bugPatternsFound() >= 1);
    assertEquals(1, r.taintVulnerabilities());
    assertNull(r.verificationSummary());
    assertTrue(r.hasErrors());
    assertEquals(1, withCode(r.diagnostics(),
                             DiagnosticCode.UNINITIALIZED_READ).size());
    assertEquals(1, withCode(r.diagnostics(),
                             DiagnosticCode.DIVISION_BY_ZERO).size());
    assertEquals(1, withCode(r.diagnostics(),
                             DiagnosticCode.SQL_INJECTION).size());

    // Sorted by position
    List<Diagnostic> ds = r.diagnostics();
    for (int i = 1; i < ds.size(); i++) {
      assertTrue(ds.get(i - 1).span().compareTo(ds.get(i).span()) <= 0);
    }
  }

  @Test
  public void testDisabledAnalysesDontRun() throws Exception {
    AnalysisOptions opts = noSmt().enableDataflow(false)
        .enableBugPatterns(false).enableTaintAnalysis(false).build();
    AnalysisResult r = new AnalysisCoordinator(opts).analyze(sample());
    assertEquals(4, r.functionsAnalyzed());
    assertTrue(r.diagnostics().isEmpty());
    assertFalse(r.hasErrors());
  }

  @Test
  public void testFaultIsolated() throws Exception {
    AnalysisOptions opts = noSmt().build();
    DataflowAnalyzer broken = new DataflowAnalyzer(1000, false) {
      @Override
      public List<Diagnostic> analyze(ControlFlowGraph cfg) {
        if (cfg.function().name().equals("divide")) {
          throw new IllegalStateException("broken lattice");
        }
        return super.analyze(cfg);
      }
    };
    AnalyzerRegistry base = AnalyzerRegistry.create(opts);
    AnalyzerRegistry registry = new AnalyzerRegistry(broken,
        base.bugPatterns(), base.taint(), null);
    AnalysisResult r = new AnalysisCoordinator(opts, registry)
                                                  .analyze(sample());
    List<Diagnostic> faults = withCode(r.diagnostics(),
                                       DiagnosticCode.INTERNAL_FAULT);
    assertEquals(1, faults.size());
    assertEquals(Severity.ERROR, faults.get(0).severity());
    assertTrue(faults.get(0).message(),
               faults.get(0).message().contains("divide"));
    assertTrue(faults.get(0).message(),
               faults.get(0).message().contains("broken lattice"));
    // Other functions are still analyzed
    assertEquals(1, withCode(r.diagnostics(),
                             DiagnosticCode.SQL_INJECTION).size());
    assertEquals(1, withCode(r.diagnostics(),
                             DiagnosticCode.UNINITIALIZED_READ).size());
  }

  @Test
  public void testUnknownCallPolicy() throws Exception {
    AnalysisOptions.Builder b = noSmt().enableDataflow(false)
        .enableBugPatterns(false).enableTaintAnalysis(false);

    List<Diagnostic> ds = new AnalysisCoordinator(
        b.unknownCallPolicy(UnknownCallPolicy.STRICT).build())
        .analyze(withUnknownCall()).diagnostics();
    assertEquals("One per call site", 2, ds.size());
    assertEquals(DiagnosticCode.UNKNOWN_CALL, ds.get(0).code());
    assertEquals(Severity.ERROR, ds.get(0).severity());
    assertEquals(Category.OTHER, ds.get(0).category());
    assertTrue(ds.get(0).message().contains("frobnicate"));

    ds = new AnalysisCoordinator(
        b.unknownCallPolicy(UnknownCallPolicy.DEFAULT).build())
        .analyze(withUnknownCall()).diagnostics();
    assertEquals(2, ds.size());
    assertEquals(Severity.WARNING, ds.get(0).severity());

    ds = new AnalysisCoordinator(
        b.unknownCallPolicy(UnknownCallPolicy.PERMISSIVE).build())
        .analyze(withUnknownCall()).diagnostics();
    assertTrue(ds.isEmpty());
  }

  @Test
  public void testSolverUnavailable() throws Exception {
    AnalysisOptions opts = noSmt().useSmtVerification(true).build();
    AnalyzerRegistry registry = AnalyzerRegistry.create(opts,
                                  FixedSolverBackend.unavailable(), null);
    AnalysisResult r = new AnalysisCoordinator(opts, registry)
                                                  .analyze(sample());
    List<Diagnostic> ds = withCode(r.diagnostics(),
                                   DiagnosticCode.SOLVER_UNAVAILABLE);
    assertEquals(1, ds.size());
    assertEquals(Severity.INFO, ds.get(0).severity());
    assertEquals(2, r.verificationSummary().skipped());
    assertEquals(0, r.verificationSummary().proven());
  }

  @Test
  public void testCachedRerunSkipsSolver() throws Exception {
    AnalysisOptions opts = noSmt().useSmtVerification(true)
        .enableDataflow(false).enableBugPatterns(false)
        .enableTaintAnalysis(false)
        .cacheEnabled(true).cacheDirectory(tmp.getRoot()).build();

    FixedSolverBackend first =
        new FixedSolverBackend(true, SolverResult.unsat());
    FileVerificationCache cache = new FileVerificationCache(tmp.getRoot());
    AnalysisResult r1 = new AnalysisCoordinator(opts,
        AnalyzerRegistry.create(opts, first, cache)).analyze(sample());
    assertEquals(2, r1.verificationSummary().proven());
    assertEquals(0, r1.verificationSummary().cacheHits());
    assertTrue(first.checks() > 0);
    assertEquals(1, cache.writes());

    FixedSolverBackend second =
        new FixedSolverBackend(true, SolverResult.unsat());
    AnalysisResult r2 = new AnalysisCoordinator(opts,
        AnalyzerRegistry.create(opts, second, cache)).analyze(sample());
    assertEquals(0, second.checks());
    assertEquals(2, r2.verificationSummary().proven());
    assertEquals(2, r2.verificationSummary().cacheHits());
    FunctionVerificationResult abs = r2.verificationResult("Abs");
    assertNotNull(abs);
    assertTrue(abs.isCacheHit());
  }

  @Test
  public void testDeadline() throws Exception {
    AnalysisOptions opts = noSmt().useSmtVerification(true).workers(1)
        .deadlineMs(1).build();
    DataflowAnalyzer slow = new DataflowAnalyzer(1000, false) {
      @Override
      public List<Diagnostic> analyze(ControlFlowGraph cfg) {
        try {
          Thread.sleep(100);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        return super.analyze(cfg);
      }
    };
    AnalyzerRegistry base = AnalyzerRegistry.create(opts,
        new FixedSolverBackend(true, SolverResult.unsat()), null);
    AnalyzerRegistry registry = new AnalyzerRegistry(slow, null, null,
                                                     base.verification());
    AnalysisResult r = new AnalysisCoordinator(opts, registry)
                                                  .analyze(sample());
    assertTrue(r.functionsAnalyzed() < 4);
    FunctionVerificationResult abs = r.verificationResult("Abs");
    assertEquals(2, abs.count(Status.SKIPPED));
    for (VerificationOutcome o: abs.outcomes()) {
      assertEquals(AnalysisCoordinator.DEADLINE_REASON, o.reason());
    }
  }
}
