package exm.ceva.analysis.dataflow;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ceva.ast.Function;
import exm.ceva.ast.FunctionBuilder;
import exm.ceva.cfg.ControlFlowBuilder;
import exm.ceva.common.Logging;
import exm.ceva.diagnostics.Diagnostic;
import exm.ceva.diagnostics.DiagnosticCode;

public class DeadStoreTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("DeadStoreTest.ceva.log", true);
  }

  private static List<Diagnostic> analyze(Function f) {
    return new DataflowAnalyzer(1000, true).analyze(
                                        ControlFlowBuilder.build(f));
  }

  @Test
  public void testOverwrittenStore() throws Exception {
    Function f = new FunctionBuilder("f").param("a", "i32").returns("i32")
        .at("f.cv", 1)
        .body("(bind x i32 (+ a 1))\n(assign x 2)\n(return x)").build();
    List<Diagnostic> diags = analyze(f);
    assertEquals(1, diags.size());
    assertEquals(DiagnosticCode.DEAD_STORE, diags.get(0).code());
    assertEquals(2, diags.get(0).span().getLine());
  }

  @Test
  public void testLoopCarriedValueIsLive() throws Exception {
    Function f = new FunctionBuilder("Sum").param("n", "i32").returns("i32")
        .body("(bind s i32 0) (bind i i32 0)" +
              "(while (< i n) {(assign s (+ s i)) (assign i (+ i 1))})" +
              "(return s)").build();
    assertTrue(analyze(f).isEmpty());
  }

  @Test
  public void testUnderscoreAndLoopVariablesIgnored() throws Exception {
    Function f = new FunctionBuilder("f").param("n", "i32").returns("i32")
        .body("(bind _unused i32 n)" +
              "(for i i32 0 n {(do (log n))})" +
              "(return n)").build(null);
    assertTrue(analyze(f).isEmpty());
  }

  @Test
  public void testUnknownStatementKeepsStoresLive() throws Exception {
    Function f = new FunctionBuilder("f").param("n", "i32").returns("i32")
        .body("(bind x i32 n) (unknown \"asm\") (return n)").build();
    assertTrue(analyze(f).isEmpty());
  }
}
