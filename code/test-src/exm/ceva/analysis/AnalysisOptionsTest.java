package exm.ceva.analysis;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.util.Arrays;

import org.junit.After;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.ceva.common.Logging;
import exm.ceva.common.Settings;
import exm.ceva.common.exceptions.InvalidOptionException;
import exm.ceva.common.lang.IntegerMode;

public class AnalysisOptionsTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("AnalysisOptionsTest.ceva.log", true);
  }

  @After
  public void restoreSettings() {
    Settings.set(Settings.WORKERS, "0");
    Settings.set(Settings.TAINT_SANITIZERS, "");
    Settings.set(Settings.VERIFY_INTEGER_MODE, "trap");
    Settings.set(Settings.UNKNOWN_CALL_POLICY, "default");
    Settings.set(Settings.BUGPATTERN_OVERFLOW, "true");
    Settings.set(Settings.VERIFY_TIMEOUT_MS, "5000");
    Settings.set(Settings.VERIFY_K_INDUCTION, "false");
    Settings.set(Settings.VERIFY_K_INDUCTION_MAX_K, "3");
    Settings.set(Settings.BUGPATTERN_SMT_CONFIRM, "false");
    Settings.set(Settings.CACHE_CLEAR, "false");
    Settings.set(Settings.CACHE_MAX_BYTES, "0");
  }

  @Test
  public void testBuilderDefaults() {
    AnalysisOptions o = AnalysisOptions.builder().build();
    assertTrue(o.enableDataflow());
    assertTrue(o.enableBugPatterns());
    assertTrue(o.enableTaintAnalysis());
    assertTrue(o.useSmtVerification());
    assertEquals(IntegerMode.TRAP, o.integerMode());
    assertEquals(UnknownCallPolicy.DEFAULT, o.unknownCallPolicy());
    assertFalse(o.cacheEnabled());
    assertEquals(Runtime.getRuntime().availableProcessors(), o.workers());
    assertFalse(o.kInduction());
    assertEquals(3, o.kInductionMaxK());
    assertFalse(o.confirmBugPatterns());
    assertFalse(o.clearCache());
    assertEquals(0, o.cacheMaxBytes());
  }

  @Test
  public void testSolverExtrasFromSettings() throws Exception {
    AnalysisOptions o = AnalysisOptions.fromSettings();
    assertFalse("Off by default", o.kInduction());
    assertFalse(o.confirmBugPatterns());
    assertFalse(o.clearCache());

    Settings.set(Settings.VERIFY_K_INDUCTION, "true");
    Settings.set(Settings.VERIFY_K_INDUCTION_MAX_K, "5");
    Settings.set(Settings.BUGPATTERN_SMT_CONFIRM, "true");
    Settings.set(Settings.CACHE_CLEAR, "true");
    Settings.set(Settings.CACHE_MAX_BYTES, "1048576");
    o = AnalysisOptions.fromSettings();
    assertTrue(o.kInduction());
    assertEquals(5, o.kInductionMaxK());
    assertTrue(o.confirmBugPatterns());
    assertTrue(o.clearCache());
    assertEquals(1048576L, o.cacheMaxBytes());
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadInductionDepth() throws Exception {
    Settings.set(Settings.VERIFY_K_INDUCTION_MAX_K, "0");
    Settings.validateProperties();
  }

  @Test(expected=InvalidOptionException.class)
  public void testNegativeCacheLimit() throws Exception {
    Settings.set(Settings.CACHE_MAX_BYTES, "-1");
    Settings.validateProperties();
  }

  @Test(expected=IllegalStateException.class)
  public void testBuilderRejectsZeroDepth() {
    AnalysisOptions.builder().kInductionMaxK(0).build();
  }

  @Test
  public void testFromSettings() throws Exception {
    Settings.set(Settings.WORKERS, "3");
    Settings.set(Settings.TAINT_SANITIZERS, "clean, escapeHtml");
    Settings.set(Settings.VERIFY_INTEGER_MODE, "WRAP");
    Settings.set(Settings.UNKNOWN_CALL_POLICY, "strict");
    Settings.set(Settings.BUGPATTERN_OVERFLOW, "false");
    AnalysisOptions o = AnalysisOptions.fromSettings();
    assertEquals(3, o.workers());
    assertEquals(Arrays.asList("clean", "escapeHtml"), o.sanitizers());
    assertEquals(IntegerMode.WRAP, o.integerMode());
    assertEquals(UnknownCallPolicy.STRICT, o.unknownCallPolicy());
    assertFalse(o.isCheckerEnabled(Settings.BUGPATTERN_OVERFLOW));
    assertTrue(o.isCheckerEnabled(Settings.BUGPATTERN_DIV_ZERO));
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadNumber() throws Exception {
    Settings.set(Settings.VERIFY_TIMEOUT_MS, "soon");
    Settings.validateProperties();
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadMode() throws Exception {
    Settings.set(Settings.VERIFY_INTEGER_MODE, "saturate");
    Settings.validateProperties();
  }

  @Test(expected=IllegalStateException.class)
  public void testCacheNeedsDirectory() {
    AnalysisOptions.builder().cacheEnabled(true).build();
  }

  @Test
  public void testCacheDirectory() {
    File dir = new File("cache");
    AnalysisOptions o = AnalysisOptions.builder().cacheEnabled(true)
                                       .cacheDirectory(dir).build();
    assertEquals(dir, o.cacheDirectory());
  }
}
