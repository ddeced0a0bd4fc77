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

import exm.ceva.ast.Expression;
import exm.ceva.common.lang.SourceSpan;
import exm.ceva.verify.ContractKind;
import exm.ceva.verify.formula.ContractFormula;

/**
 * A contract together with its formula, or the reason it has none
 */
public class EncodedContract {
  private final ContractKind kind;
  private final int index;
  private final Expression expression;
  private final ContractFormula formula;
  private final String unsupportedReason;

  private EncodedContract(ContractKind kind, int index, Expression expression,
                  ContractFormula formula, String unsupportedReason) {
    this.kind = kind;
    this.index = index;
    this.expression = expression;
    this.formula = formula;
    this.unsupportedReason = unsupportedReason;
  }

  public static EncodedContract supported(ContractKind kind, int index,
                    Expression expression, ContractFormula formula) {
    return new EncodedContract(kind, index, expression, formula, null);
  }

  public static EncodedContract unsupported(ContractKind kind, int index,
                    Expression expression, String reason) {
    return new EncodedContract(kind, index, expression, null, reason);
  }

  public ContractKind kind() {
    return kind;
  }

  public int index() {
    return index;
  }

  public Expression expression() {
    return expression;
  }

  public SourceSpan span() {
    return expression.span();
  }

  public boolean isSupported() {
    return formula != null;
  }

  /**
   * @return the formula, null if unsupported
   */
  public ContractFormula formula() {
    return formula;
  }

  public String unsupportedReason() {
    return unsupportedReason;
  }

  @Override
  public String toString() {
    return kind.description() + " " + expression + " => " +
          (isSupported() ? formula.toString()
                         : "unsupported: " + unsupportedReason);
  }
}
