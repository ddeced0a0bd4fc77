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


package exm.ceva.verify.loop;

import exm.ceva.ast.Expression;
import exm.ceva.ast.SExpressions;
import exm.ceva.ast.Statement;

/**
 * What k-induction found out about one loop: an invariant of its
 * induction variable, or why none could be proven.
 */
public class LoopInvariant {
  public static enum Status {
    PROVEN,
    /** Candidates exist but none was proven within the bound */
    UNKNOWN,
  }

  private final Statement loop;
  private final String variable;
  private final Status status;
  private final Expression invariant;
  private final int k;
  private final String reason;

  private LoopInvariant(Statement loop, String variable, Status status,
                        Expression invariant, int k, String reason) {
    this.loop = loop;
    this.variable = variable;
    this.status = status;
    this.invariant = invariant;
    this.k = k;
    this.reason = reason;
  }

  /**
   * @param k smallest induction depth that proved it
   */
  public static LoopInvariant proven(Statement loop, String variable,
                                     Expression invariant, int k) {
    return new LoopInvariant(loop, variable, Status.PROVEN, invariant, k,
                             null);
  }

  public static LoopInvariant unknown(Statement loop, String variable,
                                      String reason) {
    return new LoopInvariant(loop, variable, Status.UNKNOWN, null, 0,
                             reason);
  }

  public Statement loop() {
    return loop;
  }

  public String variable() {
    return variable;
  }

  public Status status() {
    return status;
  }

  public boolean isProven() {
    return status == Status.PROVEN;
  }

  /**
   * @return invariant at the loop head, or null if not proven
   */
  public Expression invariant() {
    return invariant;
  }

  public int k() {
    return k;
  }

  public String reason() {
    return reason;
  }

  @Override
  public String toString() {
    if (isProven()) {
      return "loop at " + loop.span() + ": " +
             SExpressions.print(invariant) + " (k=" + k + ")";
    }
    return "loop at " + loop.span() + ": unknown, " + reason;
  }
}
