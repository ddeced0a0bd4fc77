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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Encoding of one contract expression.  Built for a single function and
 * never shared.
 */
public class ContractFormula {
  private final Term formula;
  private final List<SideCondition> sideConditions;
  private final boolean partial;

  /**
   * @param partial true if the encoding over-approximates, so that a
   *                satisfying model is not necessarily a real violation
   */
  public ContractFormula(Term formula, List<SideCondition> sideConditions,
                         boolean partial) {
    assert(formula.sort().isBool()) : formula;
    this.formula = formula;
    this.sideConditions = Collections.unmodifiableList(
                    new ArrayList<SideCondition>(sideConditions));
    this.partial = partial;
  }

  public Term formula() {
    return formula;
  }

  public List<SideCondition> sideConditions() {
    return sideConditions;
  }

  /**
   * @return conjunction of all side conditions
   */
  public Term definedness() {
    List<Term> conds = new ArrayList<Term>();
    for (SideCondition sc: sideConditions) {
      conds.add(sc.asTerm());
    }
    return Term.and(conds);
  }

  public boolean isPartial() {
    return partial;
  }

  @Override
  public String toString() {
    return formula + (sideConditions.isEmpty() ? "" :
                        " given " + sideConditions) +
           (partial ? " (partial)" : "");
  }
}
