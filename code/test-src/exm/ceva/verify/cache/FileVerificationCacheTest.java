package exm.ceva.verify.cache;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.ceva.ast.Function;
import exm.ceva.ast.FunctionBuilder;
import exm.ceva.common.Logging;
import exm.ceva.common.lang.IntegerMode;
import exm.ceva.common.lang.Value;
import exm.ceva.verify.ContractKind;
import exm.ceva.verify.Counterexample;
import exm.ceva.verify.FunctionVerificationResult;
import exm.ceva.verify.VerificationOutcome;
import exm.ceva.verify.VerificationOutcome.Status;

public class FileVerificationCacheTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("FileVerificationCacheTest.ceva.log", true);
  }

  private static Function clamp() throws Exception {
    return clamp("Clamp");
  }

  private static Function clamp(String name) throws Exception {
    return new FunctionBuilder(name)
        .param("value", "i32").param("min", "i32").param("max", "i32")
        .returns("i32")
        .requires("(<= min max)")
        .ensures("(<= result max)")
        .body("(return value)").build();
  }

  private static FunctionVerificationResult result(Function f) {
    Map<String, Value> values = new LinkedHashMap<String, Value>();
    values.put("value", Value.createIntLit(5));
    values.put("min", Value.createIntLit(0));
    values.put("max", Value.createIntLit(-2147483648L));
    values.put("result", Value.createIntLit(5));
    VerificationOutcome pre = VerificationOutcome.proven(f.id(),
        ContractKind.PRECONDITION, 0, f.preconditions().get(0).span());
    VerificationOutcome post = VerificationOutcome.disproven(f.id(),
        ContractKind.POSTCONDITION, 0, f.postconditions().get(0).span(),
        new Counterexample(values));
    return new FunctionVerificationResult(f.id(), f.name(),
        Arrays.asList(pre), Arrays.asList(post));
  }

  @Test
  public void testRoundTrip() throws Exception {
    Function f = clamp();
    FileVerificationCache cache = new FileVerificationCache(tmp.getRoot());
    CacheKey key = CacheKey.compute(f, null, IntegerMode.TRAP);
    assertNull(cache.get(key));
    assertEquals(1, cache.misses());

    cache.put(key, CacheEntry.forResult(key, result(f)));
    assertEquals(1, cache.writes());
    File file = cache.fileFor(key);
    assertTrue(file.isFile());
    assertEquals(key.prefix(), file.getParentFile().getName());

    CacheEntry entry = cache.get(key);
    assertNotNull(entry);
    assertEquals(1, cache.hits());
    assertEquals("Clamp", entry.functionName());

    FunctionVerificationResult r = entry.toResult(f);
    assertNotNull(r);
    assertTrue(r.isCacheHit());
    assertEquals(Status.PROVEN, r.preconditions().get(0).status());
    VerificationOutcome post = r.postconditions().get(0);
    assertEquals(Status.DISPROVEN, post.status());
    assertEquals(result(f).postconditions().get(0).counterexample(),
                 post.counterexample());
    assertEquals(f.postconditions().get(0).span(), post.span());
  }

  @Test
  public void testTransientNotStored() throws Exception {
    Function f = clamp();
    CacheKey key = CacheKey.compute(f, null, IntegerMode.TRAP);
    FunctionVerificationResult r = new FunctionVerificationResult(f.id(),
        f.name(), Arrays.asList(VerificationOutcome.solverLimit(f.id(),
            ContractKind.PRECONDITION, 0, null, "timeout")),
        Collections.<VerificationOutcome>emptyList());
    assertNull(CacheEntry.forResult(key, r));
  }

  @Test
  public void testCorruptEntryIsMiss() throws Exception {
    Function f = clamp();
    FileVerificationCache cache = new FileVerificationCache(tmp.getRoot());
    CacheKey key = CacheKey.compute(f, null, IntegerMode.TRAP);
    cache.put(key, CacheEntry.forResult(key, result(f)));
    FileUtils.writeStringToFile(cache.fileFor(key), "{\"format\": 1, \"ke",
                                "UTF-8");
    assertNull(cache.get(key));

    // Overwritten by the next put
    cache.put(key, CacheEntry.forResult(key, result(f)));
    assertNotNull(cache.get(key));
  }

  @Test
  public void testWrongKeyIsMiss() throws Exception {
    Function f = clamp();
    FileVerificationCache cache = new FileVerificationCache(tmp.getRoot());
    CacheKey key = CacheKey.compute(f, null, IntegerMode.TRAP);
    CacheKey other = CacheKey.compute(f, null, IntegerMode.WRAP);
    cache.put(key, CacheEntry.forResult(key, result(f)));
    File target = cache.fileFor(other);
    FileUtils.copyFile(cache.fileFor(key), target);
    assertNull(cache.get(other));
  }

  @Test
  public void testMismatchedContractsRejected() throws Exception {
    Function f = clamp();
    CacheKey key = CacheKey.compute(f, null, IntegerMode.TRAP);
    CacheEntry entry = CacheEntry.forResult(key, result(f));
    Function fewer = new FunctionBuilder("Clamp")
        .param("value", "i32").param("min", "i32").param("max", "i32")
        .returns("i32").ensures("(<= result max)")
        .body("(return value)").build();
    assertNull(entry.toResult(fewer));
  }

  @Test
  public void testClear() throws Exception {
    Function f = clamp();
    FileVerificationCache cache = new FileVerificationCache(tmp.getRoot());
    CacheKey key = CacheKey.compute(f, null, IntegerMode.TRAP);
    cache.put(key, CacheEntry.forResult(key, result(f)));
    assertTrue(cache.fileFor(key).isFile());

    cache.clear();
    assertNull(cache.get(key));
    assertTrue("Directory kept", tmp.getRoot().isDirectory());
  }

  @Test
  public void testEvictsLeastRecentlyUsed() throws Exception {
    FileVerificationCache unlimited =
                        new FileVerificationCache(tmp.getRoot());
    String[] names = {"ClampA", "ClampB", "ClampC", "ClampD"};
    CacheKey[] keys = new CacheKey[names.length];
    for (int i = 0; i < names.length; i++) {
      Function f = clamp(names[i]);
      keys[i] = CacheKey.compute(f, null, IntegerMode.TRAP);
      if (i < 3) {
        unlimited.put(keys[i], CacheEntry.forResult(keys[i], result(f)));
        // Oldest first, well in the past
        assertTrue(unlimited.fileFor(keys[i])
                            .setLastModified((i + 1) * 1000000L));
      }
    }
    assertEquals(0, unlimited.evictions());
    long entrySize = unlimited.fileFor(keys[0]).length();

    // Room for three and a half entries
    FileVerificationCache limited = new FileVerificationCache(
                  tmp.getRoot(), entrySize * 7 / 2);
    // Reading ClampA makes ClampB the least recently used
    assertNotNull(limited.get(keys[0]));
    Function d = clamp(names[3]);
    limited.put(keys[3], CacheEntry.forResult(keys[3], result(d)));

    assertEquals(2, limited.evictions());
    assertTrue(limited.fileFor(keys[0]).isFile());
    assertTrue(!limited.fileFor(keys[1]).isFile());
    assertTrue(!limited.fileFor(keys[2]).isFile());
    assertTrue(limited.fileFor(keys[3]).isFile());
  }
}
