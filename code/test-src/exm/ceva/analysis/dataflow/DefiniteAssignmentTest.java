package exm.ceva.analysis.dataflow;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
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

public class DefiniteAssignmentTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("DefiniteAssignmentTest.ceva.log", true);
  }

  private static List<Diagnostic> analyze(Function f) {
    DataflowAnalyzer analyzer = new DataflowAnalyzer(1000, false);
    return analyzer.analyze(ControlFlowBuilder.build(f));
  }

  private static List<Diagnostic> withCode(List<Diagnostic> diags,
                                           String code) {
    List<Diagnostic> res = new ArrayList<Diagnostic>();
    for (Diagnostic d: diags) {
      if (d.code().equals(code)) {
        res.add(d);
      }
    }
    return res;
  }

  @Test
  public void testInitializedOnAllPaths() throws Exception {
    Function f = new FunctionBuilder("Abs").param("n", "i32").returns("i32")
        .body("(bind r i32)" +
              "(if (< n 0) {(assign r (- n))} {(assign r n)})" +
              "(return r)").build();
    assertTrue(analyze(f).isEmpty());
  }

  @Test
  public void testOneDiagnosticForRepeatedReads() throws Exception {
    Function f = new FunctionBuilder("f").param("a", "i32").returns("i32")
        .at("f.cv", 1)
        .body("(bind x i32)\n" +
              "(bind y i32 (+ x 1))\n" +
              "(bind z i32 (* x 2))\n" +
              "(return (+ (+ x y) z))").build();
    List<Diagnostic> diags = withCode(analyze(f),
                                      DiagnosticCode.UNINITIALIZED_READ);
    assertEquals("One diagnostic per variable", 1, diags.size());
    Diagnostic d = diags.get(0);
    assertEquals(Severity.ERROR, d.severity());
    assertEquals(Category.DATAFLOW, d.category());
    assertEquals("Reported at first read", 3, d.span().getLine());
    assertTrue(d.message().contains("'x'"));
  }

  @Test
  public void testMaybeInitialized() throws Exception {
    Function f = new FunctionBuilder("f").param("a", "i32").returns("i32")
        .body("(bind x i32)" +
              "(if (> a 0) {(assign x 1)})" +
              "(return x)").build();
    List<Diagnostic> diags = analyze(f);
    assertEquals(1, diags.size());
    assertEquals(Severity.WARNING, diags.get(0).severity());
  }

  @Test
  public void testLoopAssignment() throws Exception {
    // x is assigned on the first trip round the do-while loop
    Function f = new FunctionBuilder("f").param("n", "i32").returns("i32")
        .body("(bind x i32) (bind i i32 0)" +
              "(do-while (< i n) {(assign x i) (assign i (+ i 1))})" +
              "(return x)").build();
    assertTrue(analyze(f).isEmpty());
  }

  @Test
  public void testUnknownStatementMayInitialize() throws Exception {
    Function f = new FunctionBuilder("f").param("a", "i32").returns("i32")
        .body("(bind x i32) (unknown \"macro\") (return x)").build();
    List<Diagnostic> diags = analyze(f);
    assertEquals(1, diags.size());
    assertEquals(Severity.WARNING, diags.get(0).severity());
  }

  @Test
  public void testDeadCodeAfterReturn() throws Exception {
    Function f = new FunctionBuilder("f").param("a", "i32").returns("i32")
        .at("f.cv", 1)
        .body("(return a)\n(bind b i32 1)\n(return b)").build();
    List<Diagnostic> diags = withCode(analyze(f), DiagnosticCode.DEAD_CODE);
    assertEquals(1, diags.size());
    assertEquals("At first dead statement", 3, diags.get(0).span().getLine());
  }

  @Test
  public void testForLoopNotDead() throws Exception {
    Function f = new FunctionBuilder("f").param("a", "[i32]").returns("i32")
        .body("(for i i32 0 (- (len a) 1) {(return (at a i))}) (return 0)")
        .build();
    assertTrue(withCode(analyze(f), DiagnosticCode.DEAD_CODE).isEmpty());
  }
}
