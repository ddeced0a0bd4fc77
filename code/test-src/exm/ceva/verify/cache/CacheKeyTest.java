package exm.ceva.verify.cache;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ceva.ast.Function;
import exm.ceva.ast.Module;
import exm.ceva.ast.ModuleReader;
import exm.ceva.common.Logging;
import exm.ceva.common.lang.IntegerMode;

public class CacheKeyTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("CacheKeyTest.ceva.log", true);
  }

  private static Module module(String helperPost, String callerBody,
                               int line) throws Exception {
    String json = ("{'name': 'm', 'functions': [" +
        "{'name': 'helper', 'line': " + line + "," +
        " 'params': [{'name': 'x', 'type': 'i32'}], 'returns': 'i32'," +
        " 'ensures': ['" + helperPost + "'], 'body': '(return x)'}," +
        "{'name': 'caller', 'line': " + (line + 10) + "," +
        " 'params': [{'name': 'n', 'type': 'i32'}], 'returns': 'i32'," +
        " 'ensures': ['(>= result 0)'], 'body': '" + callerBody + "'}," +
        "{'name': 'other', 'returns': 'i32', 'body': '(return 1)'}" +
        "]}").replace('\'', '"');
    return new ModuleReader().read(json, "m.json");
  }

  private static CacheKey key(Module m, String fn, IntegerMode mode) {
    return CacheKey.compute(m.lookupFunction(fn), m, mode);
  }

  @Test
  public void testDeterministic() throws Exception {
    Module m1 = module("(== result x)", "(return (helper n))", 1);
    Module m2 = module("(== result x)", "(return (helper n))", 1);
    CacheKey k = key(m1, "caller", IntegerMode.TRAP);
    assertEquals(k, key(m2, "caller", IntegerMode.TRAP));
    assertEquals(64, k.hash().length());
    assertEquals(k.hash().substring(0, 2), k.prefix());
  }

  @Test
  public void testPositionsIgnored() throws Exception {
    Module m1 = module("(== result x)", "(return (helper n))", 1);
    Module m2 = module("(== result x)", "(return (helper n))", 40);
    assertEquals(key(m1, "caller", IntegerMode.TRAP),
                 key(m2, "caller", IntegerMode.TRAP));
  }

  @Test
  public void testBodyChangesKey() throws Exception {
    Module m1 = module("(== result x)", "(return (helper n))", 1);
    Module m2 = module("(== result x)", "(return (helper (+ n 1)))", 1);
    assertNotEquals(key(m1, "caller", IntegerMode.TRAP),
                    key(m2, "caller", IntegerMode.TRAP));
  }

  @Test
  public void testModeChangesKey() throws Exception {
    Module m = module("(== result x)", "(return (helper n))", 1);
    assertNotEquals(key(m, "caller", IntegerMode.TRAP),
                    key(m, "caller", IntegerMode.WRAP));
  }

  @Test
  public void testCalleeContractChangesKey() throws Exception {
    Module m1 = module("(== result x)", "(return (helper n))", 1);
    Module m2 = module("(>= result 0)", "(return (helper n))", 1);
    assertNotEquals(key(m1, "caller", IntegerMode.TRAP),
                    key(m2, "caller", IntegerMode.TRAP));
    // Functions that don't call helper are unaffected
    assertEquals(key(m1, "other", IntegerMode.TRAP),
                 key(m2, "other", IntegerMode.TRAP));
  }

  @Test
  public void testCanonicalFormListsCallees() throws Exception {
    Module m = module("(== result x)", "(return (helper n))", 1);
    String canonical = CacheKey.canonicalForm(m.lookupFunction("caller"), m,
                                              IntegerMode.TRAP, 0);
    assertTrue(canonical, canonical.contains("callee function helper"));
    assertFalse(canonical, canonical.contains("other"));
  }

  @Test
  public void testInductionDepthChangesKey() throws Exception {
    Module m = module("(== result x)", "(return (helper n))", 1);
    Function f = m.lookupFunction("caller");
    assertEquals(CacheKey.compute(f, m, IntegerMode.TRAP),
                 CacheKey.compute(f, m, IntegerMode.TRAP, 0));
    assertNotEquals(CacheKey.compute(f, m, IntegerMode.TRAP, 0),
                    CacheKey.compute(f, m, IntegerMode.TRAP, 3));
    assertNotEquals(CacheKey.compute(f, m, IntegerMode.TRAP, 2),
                    CacheKey.compute(f, m, IntegerMode.TRAP, 3));
  }
}
