/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.ceva.verify;

import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exm.ceva.ast.Function;
import exm.ceva.ast.Module;
import exm.ceva.common.Logging;
import exm.ceva.verify.cache.CacheEntry;
import exm.ceva.verify.cache.CacheKey;
import exm.ceva.verify.cache.VerificationCache;
import exm.ceva.verify.loop.LoopInvariant;
import exm.ceva.verify.loop.LoopInvariantSynthesizer;

/**
 * Verify functions, reusing cached outcomes for unchanged functions.
 * If a synthesizer is given, loop invariants are found first and
 * assumed when modelling the body.  They are found again on cache hits,
 * so that they are always reported.
 */
public class VerificationRunner {
  private static final Logger logger = Logging.getCevaLogger();

  private final SolverOrchestrator orchestrator;
  private final VerificationCache cache;
  private final LoopInvariantSynthesizer synthesizer;

  /**
   * @param cache null to disable caching
   */
  public VerificationRunner(SolverOrchestrator orchestrator,
                            VerificationCache cache) {
    this(orchestrator, cache, null);
  }

  /**
   * @param synthesizer null to model loops without invariants
   */
  public VerificationRunner(SolverOrchestrator orchestrator,
          VerificationCache cache, LoopInvariantSynthesizer synthesizer) {
    this.orchestrator = orchestrator;
    this.cache = cache;
    this.synthesizer = synthesizer;
  }

  public SolverOrchestrator orchestrator() {
    return orchestrator;
  }

  /**
   * @return null if loop invariants aren't looked for
   */
  public LoopInvariantSynthesizer synthesizer() {
    return synthesizer;
  }

  public boolean isSolverAvailable() {
    return orchestrator.backend().isAvailable();
  }

  public FunctionVerificationResult verify(Function f, Module module) {
    List<LoopInvariant> loops = Collections.emptyList();
    if (synthesizer != null) {
      loops = synthesizer.synthesize(f);
    }
    if (!f.hasContracts()) {
      return orchestrator.verify(f, module).withLoopInvariants(loops);
    }
    CacheKey key = null;
    if (cache != null) {
      key = CacheKey.compute(f, module, orchestrator.integerMode(),
                             synthesizer == null ? 0 : synthesizer.maxK());
      CacheEntry entry = cache.get(key);
      if (entry != null) {
        FunctionVerificationResult cached = entry.toResult(f);
        if (cached != null) {
          logger.debug("Cache hit for " + f.name() + ": " + key);
          return cached.withLoopInvariants(loops);
        }
        logger.debug("Cache entry " + key + " doesn't match " + f.name());
      }
    }

    FunctionVerificationResult result = orchestrator.verify(f, module,
            LoopInvariantSynthesizer.provenInvariants(loops))
            .withLoopInvariants(loops);

    if (cache != null) {
      CacheEntry entry = CacheEntry.forResult(key, result);
      if (entry != null) {
        cache.put(key, entry);
      } else {
        logger.debug("Not caching " + f.name() + ": transient outcome");
      }
    }
    return result;
  }
}
