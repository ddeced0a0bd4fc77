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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import exm.ceva.ast.Expression;
import exm.ceva.ast.Expressions;
import exm.ceva.ast.Statement;
import exm.ceva.ast.Statement.StmtKind;
import exm.ceva.ast.VarRef;
import exm.ceva.cfg.BasicBlock;
import exm.ceva.cfg.ControlFlowGraph;

/**
 * Backward liveness of locals, used to find stores whose value is never
 * read.  Facts are immutable sets of live variable names.
 */
public class LiveVariablesAnalysis extends DataflowAnalysis<Set<String>> {

  private final Set<String> locals;

  public LiveVariablesAnalysis(ControlFlowGraph cfg) {
    this.locals = ImmutableSet.copyOf(
        Expressions.boundVars(cfg.function().body()));
  }

  @Override
  public Direction direction() {
    return Direction.BACKWARD;
  }

  @Override
  public Set<String> boundaryFact() {
    // Locals die when the function returns
    return Collections.emptySet();
  }

  @Override
  public Set<String> initialFact() {
    return Collections.emptySet();
  }

  @Override
  public Set<String> join(Set<String> a, Set<String> b) {
    return ImmutableSet.copyOf(Sets.union(a, b));
  }

  @Override
  public Set<String> transferBlock(BasicBlock block, Set<String> liveOut) {
    Set<String> live = new HashSet<String>(liveOut);
    Expression cond = block.branchCondition();
    if (cond != null) {
      live.addAll(Expressions.varNames(cond));
    }
    List<Statement> stmts = block.statements();
    for (int i = stmts.size() - 1; i >= 0; i--) {
      transfer(stmts.get(i), live);
    }
    return ImmutableSet.copyOf(live);
  }

  private void transfer(Statement stmt, Set<String> live) {
    if (stmt.kind() == StmtKind.UNKNOWN) {
      // May read anything
      live.addAll(locals);
      return;
    }
    String def = Expressions.definedVar(stmt);
    if (def != null) {
      live.remove(def);
    }
    for (VarRef ref: Expressions.reads(stmt)) {
      live.add(ref.name());
    }
  }

  /**
   * Statements in block that store a value into a local that is dead
   * right after the store
   * @param liveOut live variables at end of block
   */
  public List<Statement> deadStores(BasicBlock block, Set<String> liveOut) {
    List<Statement> result = new ArrayList<Statement>();
    Set<String> live = new HashSet<String>(liveOut);
    Expression cond = block.branchCondition();
    if (cond != null) {
      live.addAll(Expressions.varNames(cond));
    }
    List<Statement> stmts = block.statements();
    for (int i = stmts.size() - 1; i >= 0; i--) {
      Statement stmt = stmts.get(i);
      String def = Expressions.definedVar(stmt);
      if (def != null && locals.contains(def) && !live.contains(def) &&
          Expressions.storedValue(stmt) != null) {
        result.add(stmt);
      }
      transfer(stmt, live);
    }
    Collections.reverse(result);
    return result;
  }
}
