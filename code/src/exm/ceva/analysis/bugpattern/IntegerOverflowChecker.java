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

package exm.ceva.analysis.bugpattern;

import exm.ceva.ast.BinaryExpr;
import exm.ceva.ast.Expression;
import exm.ceva.ast.Expression.ExprKind;
import exm.ceva.ast.UnaryExpr;
import exm.ceva.common.Settings;
import exm.ceva.common.lang.Operators;
import exm.ceva.common.lang.Types.Type;
import exm.ceva.diagnostics.DiagnosticCode;
import exm.ceva.diagnostics.Severity;

/**
 * Arithmetic whose result is outside the range of its type for every
 * possible operand value, typically constant operands
 */
public class IntegerOverflowChecker implements BugPatternChecker {

  @Override
  public String getName() {
    return "IntegerOverflow";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.BUGPATTERN_OVERFLOW;
  }

  @Override
  public void check(Expression node, RangeFacts facts, CheckContext ctx) {
    Type t = node.type();
    if (!t.isInteger()) {
      return;
    }
    if (node.kind() == ExprKind.BINARY) {
      if (!Operators.canOverflow(((BinaryExpr)node).op())) {
        return;
      }
    } else if (node.kind() != ExprKind.UNARY ||
               ((UnaryExpr)node).op() != Operators.UnaryOp.NEG) {
      return;
    }
    ValueRange exact = ctx.ranges().exactRange(node, facts);
    if (exact.disjoint(t.minValue(), t.maxValue())) {
      ctx.report(DiagnosticCode.INTEGER_OVERFLOW, Severity.WARNING, node,
                 "Integer overflow: " + node + " is " + exact +
                 ", outside the range of " + t.typeName());
    }
  }
}
