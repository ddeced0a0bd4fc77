package exm.ceva.analysis.taint;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ceva.analysis.CallClassifier;
import exm.ceva.ast.ExternalFunction;
import exm.ceva.ast.Function;
import exm.ceva.ast.FunctionBuilder;
import exm.ceva.ast.Module;
import exm.ceva.cfg.ControlFlowBuilder;
import exm.ceva.common.Logging;
import exm.ceva.common.lang.Effects.EffectSet;
import exm.ceva.common.lang.Types;
import exm.ceva.diagnostics.Category;
import exm.ceva.diagnostics.Diagnostic;
import exm.ceva.diagnostics.DiagnosticCode;
import exm.ceva.diagnostics.Severity;

public class TaintAnalyzerTest {

  private static final Module MODULE = new Module("web",
      Collections.<Function>emptyList(), Arrays.asList(
      new ExternalFunction("execQuery", effects("db:w"), false, false, null),
      new ExternalFunction("runCommand", effects("process:w"), false, false,
                           null),
      new ExternalFunction("readLine", effects("console:r"), false, false,
                           Types.STRING),
      new ExternalFunction("clean", EffectSet.NONE, true, true,
                           Types.STRING)));

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("TaintAnalyzerTest.ceva.log", true);
  }

  private static EffectSet effects(String... e) {
    return EffectSet.parse(Arrays.asList(e));
  }

  private static List<Diagnostic> analyze(Function f, boolean patterns,
                                          boolean infer) {
    TaintAnalyzer analyzer = new TaintAnalyzer(new SanitizerRegistry(
        Collections.<String>emptyList(), patterns), infer, 1000);
    return analyzer.analyze(ControlFlowBuilder.build(f),
                            new CallClassifier(MODULE));
  }

  private static List<Diagnostic> analyze(Function f) {
    return analyze(f, true, false);
  }

  private static FunctionBuilder handler(String body) {
    return new FunctionBuilder("handle").at("web.cv", 1)
        .untrustedParam("q", "str").param("c", "bool").body(body);
  }

  @Test
  public void testTaintedParamReachesSqlSink() throws Exception {
    Function f = handler("(do (execQuery (+ \"SELECT \" q)))").build(MODULE);
    List<Diagnostic> diags = analyze(f);
    assertEquals(1, diags.size());
    Diagnostic d = diags.get(0);
    assertEquals(DiagnosticCode.SQL_INJECTION, d.code());
    assertEquals(Severity.ERROR, d.severity());
    assertEquals(Category.SECURITY, d.category());
    assertEquals("At sink call", 2, d.span().getLine());
    assertTrue(d.message(), d.message().contains("parameter 'q'"));
  }

  @Test
  public void testRegisteredSanitizer() throws Exception {
    Function f = handler("(do (execQuery (clean q)))").build(MODULE);
    assertTrue(analyze(f).isEmpty());
  }

  @Test
  public void testSanitizerNamePattern() throws Exception {
    Function f = handler("(do (execQuery (escapeHtml q)))").build(MODULE);
    assertTrue(analyze(f, true, false).isEmpty());
    assertEquals("Patterns disabled", 1, analyze(f, false, false).size());
  }

  @Test
  public void testPathsMergeIntoOneDiagnostic() throws Exception {
    Function f = handler(
        "(bind s str q)\n" +
        "(if c {(assign s (+ s \"a\"))} {(assign s (+ s \"b\"))})\n" +
        "(do (execQuery s))").build(MODULE);
    List<Diagnostic> diags = analyze(f);
    assertEquals(1, diags.size());
    assertEquals(4, diags.get(0).span().getLine());
  }

  @Test
  public void testOverwriteClearsTaint() throws Exception {
    Function f = handler(
        "(bind s str q)\n" +
        "(assign s \"constant\")\n" +
        "(do (execQuery s))").build(MODULE);
    assertTrue(analyze(f).isEmpty());
  }

  @Test
  public void testTaintOnOneBranchOnly() throws Exception {
    Function f = handler(
        "(bind s str \"ls\")\n" +
        "(if c {(assign s q)} {})\n" +
        "(do (runCommand s))").build(MODULE);
    List<Diagnostic> diags = analyze(f);
    assertEquals(1, diags.size());
    assertEquals(DiagnosticCode.COMMAND_INJECTION, diags.get(0).code());
  }

  @Test
  public void testSourceCall() throws Exception {
    Function f = new FunctionBuilder("shell").at("cli.cv", 1).body(
        "(bind line str (readLine))\n" +
        "(do (runCommand line))").build(MODULE);
    List<Diagnostic> diags = analyze(f);
    assertEquals(1, diags.size());
    assertEquals(DiagnosticCode.COMMAND_INJECTION, diags.get(0).code());
    assertTrue(diags.get(0).message().contains("readLine"));
  }

  @Test
  public void testOneDiagnosticPerSource() throws Exception {
    Function f = handler(
        "(bind line str (readLine))\n" +
        "(do (execQuery (+ line q)))").build(MODULE);
    assertEquals(2, analyze(f).size());
  }

  @Test
  public void testTrustedParam() throws Exception {
    Function f = new FunctionBuilder("lookup").param("q", "str")
        .body("(do (execQuery q))").build(MODULE);
    assertTrue(analyze(f).isEmpty());
  }

  @Test
  public void testInferredSourceByName() throws Exception {
    Function f = new FunctionBuilder("lookup").param("userInput", "str")
        .body("(do (execQuery userInput))").build(MODULE);
    assertTrue(analyze(f, true, false).isEmpty());
    assertEquals(1, analyze(f, true, true).size());
  }

  @Test
  public void testArrayStoreTaintsArray() throws Exception {
    Function f = handler(
        "(bind parts [str] (call split \"a b\"))\n" +
        "(store parts 0 q)\n" +
        "(do (execQuery (at parts 1)))").build(MODULE);
    assertEquals(1, analyze(f).size());
  }
}
