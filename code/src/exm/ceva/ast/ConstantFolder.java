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

package exm.ceva.ast;

import exm.ceva.common.lang.OpEvaluator;
import exm.ceva.common.lang.Value;

/**
 * Evaluate expressions built only from literals and operators.
 */
public class ConstantFolder {

  /**
   * @return the value of e if it is a compile-time constant, else null.
   *    Integer results are exact, not wrapped to e's type.
   */
  public static Value fold(Expression e) {
    switch (e.kind()) {
      case LITERAL:
        return ((Literal)e).value();
      case UNARY: {
        UnaryExpr u = (UnaryExpr)e;
        return OpEvaluator.eval(u.op(), fold(u.operand()));
      }
      case BINARY: {
        BinaryExpr b = (BinaryExpr)e;
        Value left = fold(b.left());
        // Right side may be irrelevant, e.g. false && x
        Value right = left == null ? null : fold(b.right());
        return OpEvaluator.eval(b.op(), left, right);
      }
      default:
        return null;
    }
  }

  /**
   * @return constant boolean value of condition, or null if not constant
   */
  public static Boolean foldCondition(Expression cond) {
    Value v = fold(cond);
    if (v != null && v.isBoolVal()) {
      return v.getBoolLit();
    }
    return null;
  }
}
