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

/**
 * Directed, typed edge between basic blocks.
 *
 * A LOOP_BACK edge that leaves a conditional block (e.g. the test of a
 * do-while loop) is taken when the condition holds: see isTrueOutcome().
 */
public class Edge {
  private final BasicBlock from;
  private final BasicBlock to;
  private final EdgeKind kind;
  private final boolean trueOutcome;

  Edge(BasicBlock from, BasicBlock to, EdgeKind kind, boolean trueOutcome) {
    this.from = from;
    this.to = to;
    this.kind = kind;
    this.trueOutcome = trueOutcome;
  }

  public BasicBlock from() {
    return from;
  }

  public BasicBlock to() {
    return to;
  }

  public EdgeKind kind() {
    return kind;
  }

  /**
   * @return true if this edge leaves a branching block and is only
   *          followed when the branch condition is true
   */
  public boolean isTrueOutcome() {
    return from.hasBranch() && trueOutcome;
  }

  /**
   * @return true if this edge leaves a branching block and is only
   *          followed when the branch condition is false
   */
  public boolean isFalseOutcome() {
    return from.hasBranch() && !trueOutcome;
  }

  @Override
  public String toString() {
    return from.id() + " -" + kind.name().toLowerCase() + "-> " + to.id();
  }
}
