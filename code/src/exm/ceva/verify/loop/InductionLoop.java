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

import java.math.BigInteger;
import java.util.Collections;
import java.util.Set;

import exm.ceva.ast.Expression;
import exm.ceva.ast.Statement;
import exm.ceva.ast.VarRef;
import exm.ceva.common.lang.Types.Type;

/**
 * A loop reduced to what k-induction needs: the induction variable, its
 * value on entry, the condition for another iteration and how one
 * iteration changes the variable.
 */
class InductionLoop {
  private final Statement loop;
  private final String var;
  private final Type varType;
  private final Expression entry;
  private final Expression guard;
  private final Expression update;
  private final BigInteger step;
  private final Set<String> modified;

  /**
   * @param entry value of var the first time the head is reached
   * @param guard condition tested at the head, or null if there is none
   *              to assume
   * @param update new value of var in terms of its value at the head
   * @param modified every variable the loop may change, including var
   */
  InductionLoop(Statement loop, String var, Type varType, Expression entry,
                Expression guard, Expression update, BigInteger step,
                Set<String> modified) {
    this.loop = loop;
    this.var = var;
    this.varType = varType;
    this.entry = entry;
    this.guard = guard;
    this.update = update;
    this.step = step;
    this.modified = Collections.unmodifiableSet(modified);
  }

  Statement loop() {
    return loop;
  }

  String var() {
    return var;
  }

  Type varType() {
    return varType;
  }

  VarRef varRef() {
    return new VarRef(var, varType, loop.span());
  }

  Expression entry() {
    return entry;
  }

  Expression guard() {
    return guard;
  }

  Expression update() {
    return update;
  }

  BigInteger step() {
    return step;
  }

  boolean ascending() {
    return step.signum() > 0;
  }

  Set<String> modified() {
    return modified;
  }
}
