package exm.ceva.analysis;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;

import java.io.File;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ceva.common.Logging;
import exm.ceva.verify.FixedSolverBackend;
import exm.ceva.verify.cache.CacheEntry;
import exm.ceva.verify.cache.CacheKey;
import exm.ceva.verify.cache.VerificationCache;

public class AnalyzerRegistryTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("AnalyzerRegistryTest.ceva.log", true);
  }

  /** Counts clears, stores nothing */
  private static class CountingCache implements VerificationCache {
    int clears = 0;

    @Override
    public CacheEntry get(CacheKey key) {
      return null;
    }

    @Override
    public void put(CacheKey key, CacheEntry entry) {
    }

    @Override
    public void clear() {
      clears++;
    }
  }

  private static AnalysisOptions.Builder cached() {
    return AnalysisOptions.builder().cacheEnabled(true)
                          .cacheDirectory(new File("cache"));
  }

  @Test
  public void testClearOnRequest() {
    CountingCache cache = new CountingCache();
    AnalyzerRegistry.create(cached().clearCache(true).build(),
                            FixedSolverBackend.unavailable(), cache);
    assertEquals(1, cache.clears);
  }

  @Test
  public void testNoClearByDefault() {
    CountingCache cache = new CountingCache();
    AnalyzerRegistry.create(cached().build(),
                            FixedSolverBackend.unavailable(), cache);
    assertEquals(0, cache.clears);

    // Nothing to clear with caching off
    AnalyzerRegistry.create(AnalysisOptions.builder().clearCache(true)
        .build(), FixedSolverBackend.unavailable(), cache);
    assertEquals(0, cache.clears);
  }

  @Test
  public void testExtrasEnabled() {
    AnalyzerRegistry r = AnalyzerRegistry.create(AnalysisOptions.builder()
          .kInduction(true).confirmBugPatterns(true).build(),
          FixedSolverBackend.unavailable(), null);
    assertNotNull(r.verification().synthesizer());
    assertEquals(3, r.verification().synthesizer().maxK());
    assertNotNull(r.bugPatterns().confirmer());

    r = AnalyzerRegistry.create(AnalysisOptions.builder().build(),
          FixedSolverBackend.unavailable(), null);
    assertNull(r.verification().synthesizer());
    assertNull(r.bugPatterns().confirmer());
  }
}
