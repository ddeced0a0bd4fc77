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

package exm.ceva.analysis.bugpattern;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exm.ceva.analysis.dataflow.DataflowResult;
import exm.ceva.analysis.dataflow.DataflowSolver;
import exm.ceva.ast.ArrayStoreStatement;
import exm.ceva.ast.BinaryExpr;
import exm.ceva.ast.Expression;
import exm.ceva.ast.Expression.ExprKind;
import exm.ceva.ast.IndexExpr;
import exm.ceva.ast.Statement;
import exm.ceva.ast.Statement.StmtKind;
import exm.ceva.cfg.BasicBlock;
import exm.ceva.cfg.ControlFlowGraph;
import exm.ceva.common.Logging;
import exm.ceva.common.lang.Operators;
import exm.ceva.common.lang.Operators.BinaryOp;
import exm.ceva.diagnostics.Diagnostic;

/**
 * Runs the enabled bug-pattern checkers over one function, using the
 * value ranges and nullness computed by ValueRangeAnalysis.  Blocks with
 * unknown effect are not inspected.
 */
public class BugPatternDetector {

  private static final Logger logger = Logging.getCevaLogger();

  private final List<BugPatternChecker> checkers;
  private final DataflowSolver solver;
  /** Filters warnings through the solver, null if not wanted */
  private final BugPatternConfirmer confirmer;

  public BugPatternDetector(List<BugPatternChecker> checkers,
                            int maxIterations) {
    this(checkers, maxIterations, null);
  }

  public BugPatternDetector(List<BugPatternChecker> checkers,
                            int maxIterations, BugPatternConfirmer confirmer) {
    this.checkers = Collections.unmodifiableList(
                        new ArrayList<BugPatternChecker>(checkers));
    this.solver = new DataflowSolver(maxIterations);
    this.confirmer = confirmer;
  }

  /**
   * @return every checker this detector knows about
   */
  public static List<BugPatternChecker> allCheckers() {
    return Arrays.<BugPatternChecker>asList(
        new DivisionByZeroChecker(), new NullDereferenceChecker(),
        new IntegerOverflowChecker(), new IndexOutOfBoundsChecker());
  }

  public List<BugPatternChecker> checkers() {
    return checkers;
  }

  public BugPatternConfirmer confirmer() {
    return confirmer;
  }

  public List<Diagnostic> analyze(ControlFlowGraph cfg) {
    if (checkers.isEmpty()) {
      return Collections.emptyList();
    }
    ValueRangeAnalysis analysis = new ValueRangeAnalysis(cfg.function());
    DataflowResult<RangeFacts> result = solver.solve(cfg, analysis);
    CheckContext ctx = new CheckContext(cfg.function(), analysis);

    for (BasicBlock b: cfg.reversePostorder()) {
      RangeFacts facts = result.before(b);
      if (b.isUnknown() || facts == null || facts.isBottom()) {
        continue;
      }
      for (Statement stmt: b.statements()) {
        checkStatement(stmt, facts, ctx);
        facts = analysis.transfer(stmt, facts);
      }
      if (b.hasBranch()) {
        walk(b.branchCondition(), facts, ctx);
      }
    }

    List<Diagnostic> diags = confirmer == null ? ctx.diagnostics()
                                               : confirmer.confirm(ctx);
    if (logger.isDebugEnabled()) {
      logger.debug("Bug patterns: " + diags.size() + " in " +
                   cfg.function().name());
    }
    return diags;
  }

  private void checkStatement(Statement stmt, RangeFacts facts,
                              CheckContext ctx) {
    if (stmt.kind() == StmtKind.ARRAY_STORE) {
      // Check the store target like a read of the same element
      ArrayStoreStatement store = (ArrayStoreStatement)stmt;
      walk(store.index(), facts, ctx);
      walk(store.value(), facts, ctx);
      Expression target = new IndexExpr(store.arrayRef(), store.index(),
          store.value().type(), stmt.span());
      check(target, facts, ctx);
      return;
    }
    for (Expression e: stmt.expressions()) {
      walk(e, facts, ctx);
    }
  }

  /**
   * Check all nodes of e, children first.  The right operand of a
   * short-circuit connective is checked under the facts implied by the
   * left operand having the value that evaluates it.
   */
  private void walk(Expression e, RangeFacts facts, CheckContext ctx) {
    if (facts.isBottom()) {
      return;
    }
    if (e.kind() == ExprKind.BINARY &&
        Operators.isLogical(((BinaryExpr)e).op())) {
      BinaryExpr b = (BinaryExpr)e;
      walk(b.left(), facts, ctx);
      boolean evalRightWhen = b.op() != BinaryOp.OR;
      walk(b.right(), ctx.ranges().assume(b.left(), evalRightWhen, facts),
           ctx);
    } else {
      for (Expression child: e.children()) {
        walk(child, facts, ctx);
      }
    }
    check(e, facts, ctx);
  }

  private void check(Expression e, RangeFacts facts, CheckContext ctx) {
    for (BugPatternChecker checker: checkers) {
      if (logger.isTraceEnabled()) {
        logger.trace(checker.getName() + ": " + e + " with " + facts);
      }
      checker.check(e, facts, ctx);
    }
  }
}
