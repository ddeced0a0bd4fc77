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

package exm.ceva.analysis.taint;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.apache.log4j.Logger;

import exm.ceva.analysis.CallClassifier;
import exm.ceva.analysis.dataflow.DataflowResult;
import exm.ceva.analysis.dataflow.DataflowSolver;
import exm.ceva.ast.CallExpr;
import exm.ceva.ast.Expression;
import exm.ceva.ast.Expressions;
import exm.ceva.ast.Function;
import exm.ceva.ast.Statement;
import exm.ceva.cfg.BasicBlock;
import exm.ceva.cfg.ControlFlowGraph;
import exm.ceva.common.Logging;
import exm.ceva.diagnostics.Category;
import exm.ceva.diagnostics.Diagnostic;

/**
 * Reports calls to sinks whose arguments may carry untrusted data.
 * Each pair of sink call and originating source is reported once,
 * however many paths connect them.
 */
public class TaintAnalyzer {

  private static final Logger logger = Logging.getCevaLogger();

  private final SanitizerRegistry sanitizers;
  private final boolean inferSources;
  private final DataflowSolver solver;

  public TaintAnalyzer(SanitizerRegistry sanitizers, boolean inferSources,
                       int maxIterations) {
    this.sanitizers = sanitizers;
    this.inferSources = inferSources;
    this.solver = new DataflowSolver(maxIterations);
  }

  public SanitizerRegistry sanitizers() {
    return sanitizers;
  }

  public List<Diagnostic> analyze(ControlFlowGraph cfg,
                                  CallClassifier classifier) {
    Function f = cfg.function();
    TaintAnalysis analysis = new TaintAnalysis(f, classifier, sanitizers,
                                               inferSources);
    DataflowResult<TaintFacts> result = solver.solve(cfg, analysis);

    List<Diagnostic> diags = new ArrayList<Diagnostic>();
    Set<String> reported = new HashSet<String>();
    for (BasicBlock b: cfg.reversePostorder()) {
      TaintFacts facts = result.before(b);
      if (facts == null) {
        continue;
      }
      for (Statement stmt: b.statements()) {
        for (CallExpr call: Expressions.calls(stmt)) {
          checkSink(f, call, facts, analysis, reported, diags);
        }
        facts = analysis.transfer(stmt, facts);
      }
      if (b.hasBranch()) {
        for (CallExpr call: Expressions.calls(b.branchCondition())) {
          checkSink(f, call, facts, analysis, reported, diags);
        }
      }
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Taint: " + diags.size() + " vulnerabilities in " +
                   f.name());
    }
    return diags;
  }

  private void checkSink(Function f, CallExpr call, TaintFacts facts,
          TaintAnalysis analysis, Set<String> reported,
          List<Diagnostic> diags) {
    TaintSink sink = analysis.sinkKind(call);
    if (sink == null) {
      return;
    }
    Set<TaintLabel> labels = new TreeSet<TaintLabel>();
    for (Expression arg: call.children()) {
      labels.addAll(analysis.labels(arg, facts));
    }
    for (TaintLabel label: labels) {
      String key = call.span() + "|" + call.target() + "|" + label;
      if (!reported.add(key)) {
        continue;
      }
      String msg = sink.vulnerability() + ": untrusted data from " +
          label + " reaches " + sink.description() + " sink '" +
          call.target() + "' in " + f.name();
      logger.trace(msg);
      diags.add(Diagnostic.error(sink.diagnosticCode(), msg, call.span(),
                                 Category.SECURITY));
    }
  }
}
