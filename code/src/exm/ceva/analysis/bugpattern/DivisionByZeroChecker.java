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
import exm.ceva.common.Settings;
import exm.ceva.common.lang.Operators;
import exm.ceva.diagnostics.DiagnosticCode;
import exm.ceva.diagnostics.Severity;

/**
 * Integer division or remainder by a divisor that is zero, or whose
 * range includes zero with nothing ruling it out.
 */
public class DivisionByZeroChecker implements BugPatternChecker {

  @Override
  public String getName() {
    return "DivideByZero";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.BUGPATTERN_DIV_ZERO;
  }

  @Override
  public void check(Expression node, RangeFacts facts, CheckContext ctx) {
    if (node.kind() != ExprKind.BINARY) {
      return;
    }
    BinaryExpr b = (BinaryExpr)node;
    if (!Operators.isDivision(b.op()) || !b.left().type().isInteger() ||
        !b.right().type().isInteger()) {
      return;
    }
    ValueRange divisor = ctx.ranges().range(b.right(), facts);
    if (divisor.isZero()) {
      ctx.report(DiagnosticCode.DIVISION_BY_ZERO, Severity.ERROR, node,
                 "Division by zero: " + b);
    } else if (divisor.mayBeZero()) {
      ctx.report(DiagnosticCode.DIVISION_BY_ZERO, Severity.WARNING, node,
                 "Possible division by zero: divisor " + b.right() +
                 " may be zero");
    }
  }
}
