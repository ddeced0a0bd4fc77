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

package exm.ceva.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.ceva.ast.Expression;
import exm.ceva.ast.Statement;
import exm.ceva.common.lang.SourceSpan;

/**
 * A maximal straight-line statement sequence.  Compound statements never
 * appear in a block: they are broken up by ControlFlowBuilder.  A block
 * that ends in a branch holds its condition, and has one TRUE and one
 * FALSE outcome edge (either may be missing when the condition is a
 * constant).
 */
public class BasicBlock {
  private final int id;
  private final List<Statement> statements = new ArrayList<Statement>();
  private Expression branchCondition = null;
  private int line = 0;
  private SourceSpan firstSpan = SourceSpan.NONE;
  private boolean reachable = false;
  private boolean unknown = false;
  private boolean synthetic = false;

  final List<Edge> successors = new ArrayList<Edge>();
  final List<Edge> predecessors = new ArrayList<Edge>();

  BasicBlock(int id) {
    this.id = id;
  }

  public int id() {
    return id;
  }

  public List<Statement> statements() {
    return Collections.unmodifiableList(statements);
  }

  void addStatement(Statement stmt) {
    noteSpan(stmt.span());
    statements.add(stmt);
  }

  public Expression branchCondition() {
    return branchCondition;
  }

  public boolean hasBranch() {
    return branchCondition != null;
  }

  void setBranchCondition(Expression cond) {
    assert(branchCondition == null) : "Block " + id + " already branches";
    noteSpan(cond.span());
    this.branchCondition = cond;
  }

  private void noteSpan(SourceSpan span) {
    if (!firstSpan.isKnown() && span.isKnown()) {
      firstSpan = span;
      line = span.getLine();
    }
  }

  /**
   * @return source line of the first statement or condition, 0 if unknown
   */
  public int line() {
    return line;
  }

  /**
   * @return position of the first statement or condition of this block
   */
  public SourceSpan firstSpan() {
    return firstSpan;
  }

  public boolean isEmpty() {
    return statements.isEmpty() && branchCondition == null;
  }

  public boolean isReachable() {
    return reachable;
  }

  void setReachable(boolean reachable) {
    this.reachable = reachable;
  }

  /**
   * @return true if this block holds a statement with unknown effect
   */
  public boolean isUnknown() {
    return unknown;
  }

  void setUnknown() {
    this.unknown = true;
  }

  /**
   * @return true if the block only holds statements made up by the
   *    builder, e.g. a for loop increment
   */
  public boolean isSynthetic() {
    return synthetic;
  }

  void setSynthetic() {
    this.synthetic = true;
  }

  public List<Edge> successorEdges() {
    return Collections.unmodifiableList(successors);
  }

  public List<Edge> predecessorEdges() {
    return Collections.unmodifiableList(predecessors);
  }

  public List<BasicBlock> successors() {
    List<BasicBlock> res = new ArrayList<BasicBlock>(successors.size());
    for (Edge e: successors) {
      res.add(e.to());
    }
    return res;
  }

  public List<BasicBlock> predecessors() {
    List<BasicBlock> res = new ArrayList<BasicBlock>(predecessors.size());
    for (Edge e: predecessors) {
      res.add(e.from());
    }
    return res;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("B").append(id);
    if (unknown) {
      sb.append(" (unknown)");
    }
    if (!reachable) {
      sb.append(" (unreachable)");
    }
    sb.append(":\n");
    for (Statement stmt: statements) {
      sb.append("  ").append(stmt).append('\n');
    }
    if (branchCondition != null) {
      sb.append("  branch ").append(branchCondition).append('\n');
    }
    for (Edge e: successors) {
      sb.append("  ").append(e).append('\n');
    }
    return sb.toString();
  }
}
