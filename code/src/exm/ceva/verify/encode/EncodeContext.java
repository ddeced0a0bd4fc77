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

package exm.ceva.verify.encode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import exm.ceva.common.lang.SourceSpan;
import exm.ceva.verify.formula.SideCondition;
import exm.ceva.verify.formula.Term;

/**
 * State threaded through the encoding of one expression: the symbols
 * variables map to, the guard under which the current subterm is
 * evaluated, and what the encoding collected on the way.
 */
public class EncodeContext {
  private final Map<String, Term> vars;
  private final CallHandler calls;
  private Term guard;
  private final List<SideCondition> sideConditions =
                                    new ArrayList<SideCondition>();
  /** Facts about uninterpreted symbols introduced while encoding */
  private final List<Term> assumptions = new ArrayList<Term>();
  private final List<String> partialReasons = new ArrayList<String>();

  /**
   * @param calls handler for non-builtin calls, or null to reject them
   */
  public EncodeContext(Map<String, Term> vars, CallHandler calls,
                       Term guard) {
    this.vars = vars;
    this.calls = calls;
    this.guard = guard;
  }

  public EncodeContext(Map<String, Term> vars) {
    this(vars, null, Term.TRUE);
  }

  /**
   * @return symbol for variable, or null if it has none
   */
  public Term lookup(String name) {
    return vars.get(name);
  }

  public CallHandler calls() {
    return calls;
  }

  public Term guard() {
    return guard;
  }

  public void setGuard(Term newGuard) {
    this.guard = newGuard;
  }

  public void addSideCondition(SideCondition.Reason reason, Term condition,
                               SourceSpan span) {
    if (!condition.isTrue()) {
      sideConditions.add(new SideCondition(reason, guard, condition, span));
    }
  }

  public List<SideCondition> sideConditions() {
    return Collections.unmodifiableList(sideConditions);
  }

  public void assume(Term fact) {
    if (!fact.isTrue()) {
      assumptions.add(fact);
    }
  }

  public List<Term> assumptions() {
    return Collections.unmodifiableList(assumptions);
  }

  public void markPartial(String reason) {
    if (!partialReasons.contains(reason)) {
      partialReasons.add(reason);
    }
  }

  public boolean isPartial() {
    return !partialReasons.isEmpty();
  }

  public List<String> partialReasons() {
    return Collections.unmodifiableList(partialReasons);
  }
}
