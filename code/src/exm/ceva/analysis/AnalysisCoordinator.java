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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.log4j.Logger;

import exm.ceva.analysis.CallClassifier.Purity;
import exm.ceva.ast.CallExpr;
import exm.ceva.ast.Expression;
import exm.ceva.ast.Expressions;
import exm.ceva.ast.Function;
import exm.ceva.ast.Module;
import exm.ceva.cfg.ControlFlowBuilder;
import exm.ceva.cfg.ControlFlowGraph;
import exm.ceva.common.Logging;
import exm.ceva.common.util.Misc;
import exm.ceva.diagnostics.Category;
import exm.ceva.diagnostics.Diagnostic;
import exm.ceva.diagnostics.DiagnosticBag;
import exm.ceva.diagnostics.DiagnosticCode;
import exm.ceva.verify.FunctionVerificationResult;
import exm.ceva.verify.SolverOrchestrator;
import exm.ceva.verify.VerificationDiagnostics;
import exm.ceva.verify.VerificationRunner;
import exm.ceva.verify.VerificationSummary;

/**
 * Runs the enabled analyses over every function of a module.
 *
 * Functions are analyzed independently on a fixed pool of workers.  The
 * control flow graph of each function is built once and shared by the
 * analyzers.  A failure inside any analyzer is reported as a diagnostic
 * against the function: analyze() itself doesn't fail.
 */
public class AnalysisCoordinator {
  private static final Logger logger = Logging.getCevaLogger();

  public static final String DEADLINE_REASON = "deadline";
  public static final String FAULT_REASON = "internal error";

  private final AnalysisOptions options;
  private final AnalyzerRegistry registry;

  public AnalysisCoordinator(AnalysisOptions options) {
    this(options, AnalyzerRegistry.create(options));
  }

  public AnalysisCoordinator(AnalysisOptions options,
                             AnalyzerRegistry registry) {
    this.options = options;
    this.registry = registry;
  }

  public AnalysisOptions options() {
    return options;
  }

  public AnalyzerRegistry registry() {
    return registry;
  }

  public AnalysisResult analyze(Module module) {
    long start = System.currentTimeMillis();
    long deadline = options.deadlineMs() > 0 ?
                      start + options.deadlineMs() : Long.MAX_VALUE;
    CallClassifier classifier = new CallClassifier(module);
    List<Function> functions = module.functions();
    logger.debug("Analyzing " + functions.size() + " functions of " +
                 module.name() + " with " + options.workers() + " workers");

    List<FunctionReport> reports = runAll(module, classifier, deadline);

    DiagnosticBag bag = new DiagnosticBag();
    VerificationRunner verifier = registry.verification();
    if (verifier != null && !verifier.isSolverAvailable() &&
        hasContracts(functions)) {
      bag.add(Diagnostic.info(DiagnosticCode.SOLVER_UNAVAILABLE,
          "SMT solver " + verifier.orchestrator().backend().name() +
          " is not available, contracts were not verified: " +
          verifier.orchestrator().backend().unavailableReason(),
          functions.get(0).span(), Category.VERIFICATION));
    }

    int analyzed = 0;
    int dataflowIssues = 0;
    int bugPatterns = 0;
    int taintVulns = 0;
    VerificationSummary summary = verifier != null ?
                                    new VerificationSummary() : null;
    List<FunctionVerificationResult> verResults =
                              new ArrayList<FunctionVerificationResult>();
    for (FunctionReport r: reports) {
      if (!r.cutOff) {
        analyzed++;
      }
      dataflowIssues += r.dataflowIssues;
      bugPatterns += r.bugPatterns;
      taintVulns += r.taintVulnerabilities;
      bag.addAll(r.diagnostics);
      if (r.verification != null) {
        summary.add(r.verification);
        verResults.add(r.verification);
      }
    }

    long elapsed = System.currentTimeMillis() - start;
    logger.debug("Analyzed " + analyzed + "/" + functions.size() +
                 " functions in " + elapsed + "ms");
    return new AnalysisResult(analyzed, dataflowIssues, bugPatterns,
              taintVulns, elapsed, bag.sortedBySpan(), summary, verResults);
  }

  private List<FunctionReport> runAll(Module module,
                        CallClassifier classifier, long deadline) {
    List<Function> functions = module.functions();
    List<FunctionReport> reports = new ArrayList<FunctionReport>();
    if (functions.isEmpty()) {
      return reports;
    }
    int workers = Math.min(options.workers(), functions.size());
    ExecutorService pool = Executors.newFixedThreadPool(workers);
    try {
      List<Future<FunctionReport>> futures =
                              new ArrayList<Future<FunctionReport>>();
      for (Function f: functions) {
        futures.add(pool.submit(
                    new FunctionTask(f, module, classifier, deadline)));
      }
      boolean interrupted = false;
      for (int i = 0; i < functions.size(); i++) {
        Function f = functions.get(i);
        if (interrupted) {
          reports.add(cutOff(f));
          continue;
        }
        try {
          reports.add(futures.get(i).get());
        } catch (InterruptedException e) {
          logger.warn("Interrupted while waiting for analysis of " +
                      f.name());
          Thread.currentThread().interrupt();
          interrupted = true;
          reports.add(cutOff(f));
        } catch (ExecutionException e) {
          // Tasks catch everything, so this shouldn't happen
          reports.add(faulted(f, e.getCause()));
        }
      }
    } finally {
      pool.shutdownNow();
    }
    return reports;
  }

  private static boolean hasContracts(List<Function> functions) {
    for (Function f: functions) {
      if (f.hasContracts()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Report for a function that wasn't started before the deadline
   */
  private FunctionReport cutOff(Function f) {
    FunctionReport r = new FunctionReport();
    r.cutOff = true;
    if (registry.verification() != null) {
      r.verification = SolverOrchestrator.skipAll(f, DEADLINE_REASON);
    }
    return r;
  }

  private FunctionReport faulted(Function f, Throwable t) {
    logger.error("Internal error analyzing " + f.name() + ": " + t, t);
    FunctionReport r = new FunctionReport();
    r.diagnostics.add(Diagnostic.error(DiagnosticCode.INTERNAL_FAULT,
        "Internal error while analyzing " + f.name() + ": " +
        Misc.describe(t),
        f.span(), Category.OTHER));
    if (registry.verification() != null) {
      r.verification = SolverOrchestrator.skipAll(f, FAULT_REASON);
    }
    return r;
  }

  /**
   * Report calls whose target isn't declared anywhere
   */
  List<Diagnostic> checkUnknownCalls(Function f, CallClassifier classifier) {
    if (options.unknownCallPolicy() == UnknownCallPolicy.PERMISSIVE) {
      return Collections.emptyList();
    }
    List<CallExpr> calls = new ArrayList<CallExpr>(
                              Expressions.callsInBody(f.body()));
    for (Expression e: f.preconditions()) {
      calls.addAll(Expressions.calls(e));
    }
    for (Expression e: f.postconditions()) {
      calls.addAll(Expressions.calls(e));
    }

    List<Diagnostic> result = new ArrayList<Diagnostic>();
    Set<String> reported = new HashSet<String>();
    boolean strict = options.unknownCallPolicy() == UnknownCallPolicy.STRICT;
    for (CallExpr call: calls) {
      if (classifier.classify(call.target()) != Purity.UNKNOWN) {
        continue;
      }
      if (!reported.add(call.span() + "|" + call.target())) {
        continue;
      }
      String msg = "Call to undeclared function '" + call.target() +
                   "' in " + f.name() + ", treating it as effectful";
      if (strict) {
        result.add(Diagnostic.error(DiagnosticCode.UNKNOWN_CALL, msg,
                                    call.span(), Category.OTHER));
      } else {
        result.add(Diagnostic.warning(DiagnosticCode.UNKNOWN_CALL, msg,
                                      call.span(), Category.OTHER));
      }
    }
    return result;
  }

  private static class FunctionReport {
    boolean cutOff = false;
    int dataflowIssues = 0;
    int bugPatterns = 0;
    int taintVulnerabilities = 0;
    final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
    FunctionVerificationResult verification = null;
  }

  private class FunctionTask implements Callable<FunctionReport> {
    private final Function f;
    private final Module module;
    private final CallClassifier classifier;
    private final long deadline;

    FunctionTask(Function f, Module module, CallClassifier classifier,
                 long deadline) {
      this.f = f;
      this.module = module;
      this.classifier = classifier;
      this.deadline = deadline;
    }

    @Override
    public FunctionReport call() {
      if (System.currentTimeMillis() >= deadline) {
        logger.debug("Deadline passed, not analyzing " + f.name());
        return cutOff(f);
      }
      try {
        return analyzeFunction();
      } catch (Throwable t) {
        return faulted(f, t);
      }
    }

    private FunctionReport analyzeFunction() {
      FunctionReport r = new FunctionReport();
      ControlFlowGraph cfg = ControlFlowBuilder.build(f);
      r.diagnostics.addAll(checkUnknownCalls(f, classifier));

      if (registry.dataflow() != null) {
        List<Diagnostic> ds = registry.dataflow().analyze(cfg);
        r.dataflowIssues = ds.size();
        r.diagnostics.addAll(ds);
      }
      if (registry.bugPatterns() != null) {
        List<Diagnostic> ds = registry.bugPatterns().analyze(cfg);
        r.bugPatterns = ds.size();
        r.diagnostics.addAll(ds);
      }
      if (registry.taint() != null) {
        List<Diagnostic> ds = registry.taint().analyze(cfg, classifier);
        r.taintVulnerabilities = ds.size();
        r.diagnostics.addAll(ds);
      }
      if (registry.verification() != null) {
        r.verification = registry.verification().verify(f, module);
        r.diagnostics.addAll(VerificationDiagnostics.forResult(
                                    r.verification, options.verbose()));
      }
      return r;
    }
  }
}
