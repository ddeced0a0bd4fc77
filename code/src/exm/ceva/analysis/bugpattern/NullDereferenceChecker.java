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

import exm.ceva.ast.Expression;
import exm.ceva.ast.Expression.ExprKind;
import exm.ceva.common.Settings;
import exm.ceva.diagnostics.DiagnosticCode;
import exm.ceva.diagnostics.Severity;

/**
 * Index, length or method call on a variable that may be null with no
 * null check on the way there
 */
public class NullDereferenceChecker implements BugPatternChecker {

  @Override
  public String getName() {
    return "NullDereference";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.BUGPATTERN_NULL_DEREF;
  }

  @Override
  public void check(Expression node, RangeFacts facts, CheckContext ctx) {
    Expression obj = ValueRangeAnalysis.dereferenced(node);
    if (obj == null || (obj.kind() != ExprKind.VARIABLE &&
                        obj.kind() != ExprKind.LITERAL)) {
      return;
    }
    switch (ctx.ranges().nullness(obj, facts)) {
      case NULL:
        ctx.report(DiagnosticCode.NULL_DEREFERENCE, Severity.ERROR, node,
                   "Null dereference: " + obj + " is null in " + node);
        break;
      case MAYBE_NULL:
        ctx.report(DiagnosticCode.NULL_DEREFERENCE, Severity.WARNING, node,
                   "Possible null dereference: " + obj + " may be null in "
                   + node);
        break;
      default:
        break;
    }
  }
}
