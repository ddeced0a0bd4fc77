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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import exm.ceva.ast.BindStatement;
import exm.ceva.ast.Expression;
import exm.ceva.ast.Expressions;
import exm.ceva.ast.Parameter;
import exm.ceva.ast.Statement;
import exm.ceva.ast.Statement.StmtKind;
import exm.ceva.ast.VarRef;
import exm.ceva.cfg.BasicBlock;
import exm.ceva.cfg.ControlFlowGraph;

/**
 * Forward definite-assignment analysis.  Parameters start initialized,
 * locals uninitialized.  A statement with unknown effect may have
 * written any local.
 */
public class DefiniteAssignmentAnalysis extends DataflowAnalysis<InitFacts> {

  /** A read of a variable that may not be initialized */
  public static class UnsafeRead {
    public final VarRef ref;
    public final InitState state;

    public UnsafeRead(VarRef ref, InitState state) {
      this.ref = ref;
      this.state = state;
    }
  }

  private final List<String> params = new ArrayList<String>();
  private final Set<String> locals;

  public DefiniteAssignmentAnalysis(ControlFlowGraph cfg) {
    for (Parameter p: cfg.function().params()) {
      params.add(p.name());
    }
    locals = new HashSet<String>(
        Expressions.boundVars(cfg.function().body()));
    locals.removeAll(params);
  }

  @Override
  public Direction direction() {
    return Direction.FORWARD;
  }

  @Override
  public InitFacts boundaryFact() {
    return InitFacts.initialized(params);
  }

  @Override
  public InitFacts initialFact() {
    return InitFacts.EMPTY;
  }

  @Override
  public InitFacts join(InitFacts a, InitFacts b) {
    return a.join(b);
  }

  @Override
  public InitFacts transferBlock(BasicBlock block, InitFacts input) {
    InitFacts facts = input;
    for (Statement stmt: block.statements()) {
      facts = transfer(stmt, facts);
    }
    return facts;
  }

  private InitFacts transfer(Statement stmt, InitFacts facts) {
    if (stmt.kind() == StmtKind.UNKNOWN) {
      InitFacts result = facts;
      for (String local: locals) {
        if (result.get(local) == InitState.UNINITIALIZED) {
          result = result.with(local, InitState.MAYBE_INITIALIZED);
        }
      }
      return result;
    }
    if (stmt.kind() == StmtKind.BIND &&
        ((BindStatement)stmt).init() == null) {
      return facts.with(((BindStatement)stmt).name(),
                        InitState.UNINITIALIZED);
    }
    String def = Expressions.definedVar(stmt);
    if (def != null) {
      return facts.with(def, InitState.INITIALIZED);
    }
    return facts;
  }

  /**
   * Replay a block from its entry fact and collect reads of locals that
   * are not definitely initialized, in statement order.
   */
  public List<UnsafeRead> unsafeReads(BasicBlock block, InitFacts before) {
    List<UnsafeRead> result = new ArrayList<UnsafeRead>();
    InitFacts facts = before;
    for (Statement stmt: block.statements()) {
      checkReads(Expressions.reads(stmt), facts, result);
      facts = transfer(stmt, facts);
    }
    Expression cond = block.branchCondition();
    if (cond != null) {
      checkReads(Expressions.varRefs(cond), facts, result);
    }
    return result;
  }

  private void checkReads(List<VarRef> refs, InitFacts facts,
                          List<UnsafeRead> out) {
    for (VarRef ref: refs) {
      if (!locals.contains(ref.name())) {
        continue;
      }
      InitState state = facts.get(ref.name());
      if (state != InitState.INITIALIZED) {
        out.add(new UnsafeRead(ref, state));
      }
    }
  }
}
