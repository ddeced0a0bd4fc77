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

package exm.ceva.verify.formula;

import exm.ceva.common.lang.SourceSpan;

/**
 * A condition that must hold for a term to be defined: a divisor is
 * non-zero, an index is in bounds, an operation does not overflow.
 * The condition only needs to hold when the guard does, i.e. when the
 * guarded subterm is actually evaluated.
 */
public class SideCondition {
  public static enum Reason {
    DIVISION,
    BOUNDS,
    OVERFLOW;
  }

  private final Reason reason;
  private final Term guard;
  private final Term condition;
  private final SourceSpan span;

  public SideCondition(Reason reason, Term guard, Term condition,
                       SourceSpan span) {
    this.reason = reason;
    this.guard = guard;
    this.condition = condition;
    this.span = span;
  }

  public Reason reason() {
    return reason;
  }

  public Term guard() {
    return guard;
  }

  public Term condition() {
    return condition;
  }

  public SourceSpan span() {
    return span;
  }

  /**
   * @return guard implies condition
   */
  public Term asTerm() {
    return Term.implies(guard, condition);
  }

  public String describe() {
    switch (reason) {
      case DIVISION:
        return "divisor may be zero";
      case BOUNDS:
        return "index may be out of bounds";
      default:
        return "arithmetic may overflow";
    }
  }

  @Override
  public String toString() {
    return reason + ": " + asTerm();
  }
}
