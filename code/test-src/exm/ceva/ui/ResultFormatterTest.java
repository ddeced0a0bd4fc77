package exm.ceva.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collections;

import org.junit.BeforeClass;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import exm.ceva.analysis.AnalysisResult;
import exm.ceva.common.Logging;
import exm.ceva.common.lang.SourceSpan;
import exm.ceva.diagnostics.Category;
import exm.ceva.diagnostics.Diagnostic;
import exm.ceva.diagnostics.DiagnosticCode;
import exm.ceva.verify.ContractKind;
import exm.ceva.verify.FunctionVerificationResult;
import exm.ceva.verify.VerificationOutcome;
import exm.ceva.verify.VerificationSummary;

public class ResultFormatterTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ResultFormatterTest.ceva.log", true);
  }

  private static AnalysisResult result() {
    Diagnostic d = Diagnostic.error(DiagnosticCode.DIVISION_BY_ZERO,
        "Division by zero", SourceSpan.at("m.cv", 3, 12),
        Category.BUG_PATTERN);
    FunctionVerificationResult fr = new FunctionVerificationResult("m.f",
        "f", Collections.<VerificationOutcome>emptyList(),
        Arrays.asList(VerificationOutcome.proven("m.f",
            ContractKind.POSTCONDITION, 0, SourceSpan.at("m.cv", 1, 1))));
    VerificationSummary summary = new VerificationSummary();
    summary.add(fr);
    return new AnalysisResult(1, 0, 1, 0, 42, Arrays.asList(d), summary,
                              Arrays.asList(fr));
  }

  private static String capture(boolean json) throws Exception {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true, "UTF-8");
    if (json) {
      ResultFormatter.printJson(result(), out);
    } else {
      ResultFormatter.printText(result(), out);
    }
    return bytes.toString("UTF-8");
  }

  @Test
  public void testJson() throws Exception {
    JsonNode root = new ObjectMapper().readTree(capture(true));
    assertEquals(1, root.get("functionsAnalyzed").asInt());
    assertEquals(1, root.get("bugPatternsFound").asInt());
    JsonNode d = root.get("diagnostics").get(0);
    assertEquals(DiagnosticCode.DIVISION_BY_ZERO, d.get("code").asText());
    assertEquals("ERROR", d.get("severity").asText());
    assertEquals(3, d.get("line").asInt());
    JsonNode ver = root.get("verification");
    assertEquals(1, ver.get("proven").asInt());
    JsonNode o = ver.get("functions").get(0).get("outcomes").get(0);
    assertEquals("PROVEN", o.get("status").asText());
    assertFalse(o.get("cacheHit").asBoolean());
  }

  @Test
  public void testText() throws Exception {
    String text = capture(false);
    assertTrue(text, text.contains(DiagnosticCode.DIVISION_BY_ZERO));
    assertTrue(text, text.contains("Analyzed 1 functions"));
    assertTrue(text, text.contains("Contracts: "));
  }
}
