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

package exm.ceva.analysis;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.ceva.analysis.bugpattern.BugPatternChecker;
import exm.ceva.analysis.bugpattern.BugPatternConfirmer;
import exm.ceva.analysis.bugpattern.BugPatternDetector;
import exm.ceva.analysis.dataflow.DataflowAnalyzer;
import exm.ceva.analysis.taint.SanitizerRegistry;
import exm.ceva.analysis.taint.TaintAnalyzer;
import exm.ceva.common.Logging;
import exm.ceva.verify.SolverBackend;
import exm.ceva.verify.SolverOrchestrator;
import exm.ceva.verify.VerificationRunner;
import exm.ceva.verify.cache.FileVerificationCache;
import exm.ceva.verify.cache.VerificationCache;
import exm.ceva.verify.loop.LoopInvariantSynthesizer;
import exm.ceva.verify.z3.Z3Backend;

/**
 * The analyzers enabled for a run, constructed once from the options
 * and shared by all workers.  Disabled analyzers are null.
 */
public class AnalyzerRegistry {
  private static final Logger logger = Logging.getCevaLogger();

  private final DataflowAnalyzer dataflow;
  private final BugPatternDetector bugPatterns;
  private final TaintAnalyzer taint;
  private final VerificationRunner verification;

  public AnalyzerRegistry(DataflowAnalyzer dataflow,
          BugPatternDetector bugPatterns, TaintAnalyzer taint,
          VerificationRunner verification) {
    this.dataflow = dataflow;
    this.bugPatterns = bugPatterns;
    this.taint = taint;
    this.verification = verification;
  }

  /**
   * Registry using Z3 and, if enabled, a file cache
   */
  public static AnalyzerRegistry create(AnalysisOptions options) {
    VerificationCache cache = null;
    if (options.cacheEnabled()) {
      cache = new FileVerificationCache(options.cacheDirectory(),
                                        options.cacheMaxBytes());
    }
    return create(options, new Z3Backend(), cache);
  }

  /**
   * @param cache null for no caching; ignored if caching is disabled.
   *        Cleared here if the options ask for it.
   */
  public static AnalyzerRegistry create(AnalysisOptions options,
                          SolverBackend backend, VerificationCache cache) {
    if (options.cacheEnabled() && cache != null && options.clearCache()) {
      logger.info("Clearing verification cache");
      cache.clear();
    }

    DataflowAnalyzer dataflow = null;
    if (options.enableDataflow()) {
      dataflow = new DataflowAnalyzer(options.dataflowMaxIterations(),
                                      options.reportDeadStores());
    }

    BugPatternDetector bugPatterns = null;
    if (options.enableBugPatterns()) {
      List<BugPatternChecker> checkers = new ArrayList<BugPatternChecker>();
      for (BugPatternChecker c: BugPatternDetector.allCheckers()) {
        if (options.isCheckerEnabled(c.getConfigEnabledKey())) {
          checkers.add(c);
        } else {
          logger.debug("Checker " + c.getName() + " disabled");
        }
      }
      BugPatternConfirmer confirmer = null;
      if (options.confirmBugPatterns()) {
        confirmer = new BugPatternConfirmer(backend, options.integerMode(),
                                            options.verificationTimeoutMs());
      }
      bugPatterns = new BugPatternDetector(checkers,
                              options.dataflowMaxIterations(), confirmer);
    }

    TaintAnalyzer taint = null;
    if (options.enableTaintAnalysis()) {
      SanitizerRegistry sanitizers = new SanitizerRegistry(
                  options.sanitizers(), options.sanitizerPatterns());
      taint = new TaintAnalyzer(sanitizers, options.inferTaintSources(),
                                options.dataflowMaxIterations());
    }

    VerificationRunner verification = null;
    if (options.useSmtVerification()) {
      SolverOrchestrator orchestrator = new SolverOrchestrator(backend,
          options.integerMode(), options.verificationTimeoutMs(),
          options.unrollThreshold(), options.pathLimit());
      LoopInvariantSynthesizer loops = null;
      if (options.kInduction()) {
        loops = new LoopInvariantSynthesizer(backend, options.integerMode(),
            options.kInductionMaxK(), options.verificationTimeoutMs());
      }
      verification = new VerificationRunner(orchestrator,
                              options.cacheEnabled() ? cache : null, loops);
    }
    return new AnalyzerRegistry(dataflow, bugPatterns, taint, verification);
  }

  public DataflowAnalyzer dataflow() {
    return dataflow;
  }

  public BugPatternDetector bugPatterns() {
    return bugPatterns;
  }

  public TaintAnalyzer taint() {
    return taint;
  }

  public VerificationRunner verification() {
    return verification;
  }
}
