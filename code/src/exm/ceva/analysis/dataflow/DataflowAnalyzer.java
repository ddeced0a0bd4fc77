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

package exm.ceva.analysis.dataflow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.ceva.analysis.dataflow.DefiniteAssignmentAnalysis.UnsafeRead;
import exm.ceva.ast.Expressions;
import exm.ceva.ast.Statement;
import exm.ceva.cfg.BasicBlock;
import exm.ceva.cfg.ControlFlowGraph;
import exm.ceva.common.Logging;
import exm.ceva.diagnostics.Category;
import exm.ceva.diagnostics.Diagnostic;
import exm.ceva.diagnostics.DiagnosticCode;

/**
 * Runs the dataflow checks on one function: reads of variables that are
 * not definitely initialized, unreachable code and, optionally, dead
 * stores.
 */
public class DataflowAnalyzer {

  private static final Logger logger = Logging.getCevaLogger();

  private final DataflowSolver solver;
  private final boolean reportDeadStores;

  public DataflowAnalyzer(int maxIterations, boolean reportDeadStores) {
    this.solver = new DataflowSolver(maxIterations);
    this.reportDeadStores = reportDeadStores;
  }

  public List<Diagnostic> analyze(ControlFlowGraph cfg) {
    List<Diagnostic> diags = new ArrayList<Diagnostic>();
    checkInitialization(cfg, diags);
    checkDeadCode(cfg, diags);
    if (reportDeadStores) {
      checkDeadStores(cfg, diags);
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Dataflow: " + diags.size() + " issue(s) in " +
                   cfg.function().name());
    }
    return diags;
  }

  private void checkInitialization(ControlFlowGraph cfg,
                                   List<Diagnostic> diags) {
    DefiniteAssignmentAnalysis analysis = new DefiniteAssignmentAnalysis(cfg);
    DataflowResult<InitFacts> facts = solver.solve(cfg, analysis);

    // Earliest unsafe read of each variable
    Map<String, UnsafeRead> first = new LinkedHashMap<String, UnsafeRead>();
    for (BasicBlock b: cfg.reversePostorder()) {
      InitFacts before = facts.before(b);
      if (before == null) {
        continue;
      }
      for (UnsafeRead read: analysis.unsafeReads(b, before)) {
        UnsafeRead prev = first.get(read.ref.name());
        if (prev == null ||
            read.ref.span().compareTo(prev.ref.span()) < 0) {
          first.put(read.ref.name(), read);
        }
      }
    }

    String fn = cfg.function().name();
    for (UnsafeRead read: first.values()) {
      String var = read.ref.name();
      if (read.state == InitState.UNINITIALIZED) {
        diags.add(Diagnostic.error(DiagnosticCode.UNINITIALIZED_READ,
            "Variable '" + var + "' is read before it is initialized in " +
            fn, read.ref.span(), Category.DATAFLOW));
      } else {
        diags.add(Diagnostic.warning(DiagnosticCode.UNINITIALIZED_READ,
            "Variable '" + var + "' may be read before it is initialized in "
            + fn, read.ref.span(), Category.DATAFLOW));
      }
    }
  }

  private void checkDeadCode(ControlFlowGraph cfg, List<Diagnostic> diags) {
    for (BasicBlock b: cfg.unreachableBlocks()) {
      if (b.isEmpty() || b.isSynthetic()) {
        continue;
      }
      diags.add(Diagnostic.warning(DiagnosticCode.DEAD_CODE,
          "Unreachable code in " + cfg.function().name(), b.firstSpan(),
          Category.DATAFLOW));
    }
  }

  private void checkDeadStores(ControlFlowGraph cfg, List<Diagnostic> diags) {
    LiveVariablesAnalysis analysis = new LiveVariablesAnalysis(cfg);
    DataflowResult<Set<String>> facts = solver.solve(cfg, analysis);
    Set<String> loopVars = cfg.loopVariables();
    for (BasicBlock b: cfg.reversePostorder()) {
      Set<String> liveOut = facts.after(b);
      if (liveOut == null || b.isSynthetic()) {
        continue;
      }
      for (Statement stmt: analysis.deadStores(b, liveOut)) {
        String var = Expressions.definedVar(stmt);
        if (var.startsWith("_") || loopVars.contains(var)) {
          continue;
        }
        if (Expressions.containsCall(Expressions.storedValue(stmt))) {
          // The call may be what matters
          continue;
        }
        diags.add(Diagnostic.warning(DiagnosticCode.DEAD_STORE,
            "Value stored to '" + var + "' is never read", stmt.span(),
            Category.DATAFLOW));
      }
    }
  }
}
