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

import java.math.BigInteger;

import exm.ceva.ast.Expression;
import exm.ceva.ast.Expression.ExprKind;
import exm.ceva.ast.IndexExpr;
import exm.ceva.common.Settings;
import exm.ceva.common.lang.Types.Type;
import exm.ceva.diagnostics.DiagnosticCode;
import exm.ceva.diagnostics.Severity;

/**
 * Array index whose known range is not contained in [0, length).
 *
 * Only fires on evidence: either the index is definitely out of bounds,
 * or both the index range and the array length were narrowed by the
 * program (constants, tests, preconditions).
 */
public class IndexOutOfBoundsChecker implements BugPatternChecker {

  @Override
  public String getName() {
    return "IndexOutOfBounds";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.BUGPATTERN_INDEX_OOB;
  }

  @Override
  public void check(Expression node, RangeFacts facts, CheckContext ctx) {
    if (node.kind() != ExprKind.INDEX) {
      return;
    }
    IndexExpr ix = (IndexExpr)node;
    ValueRangeAnalysis ranges = ctx.ranges();
    ValueRange index = ranges.range(ix.index(), facts);
    ValueRange length = ranges.lengthOf(ix.array(), facts);

    boolean negative = index.hi() != null && index.hi().signum() < 0;
    boolean beyondEnd = index.lo() != null && length.hi() != null &&
                        index.lo().compareTo(length.hi()) >= 0;
    if (negative || beyondEnd) {
      ctx.report(DiagnosticCode.INDEX_OUT_OF_BOUNDS, Severity.ERROR, node,
                 "Index out of bounds: " + ix.index() + " is " + index +
                 ", length of " + ix.array() + " is " + length);
      return;
    }

    if (!narrowed(index, ix.index().type()) ||
        !ranges.lengthKnown(ix.array(), facts)) {
      return;
    }
    boolean contained = index.lo().signum() >= 0 && length.lo() != null &&
                        index.hi().compareTo(length.lo()) < 0;
    if (!contained) {
      ctx.report(DiagnosticCode.INDEX_OUT_OF_BOUNDS, Severity.WARNING, node,
                 "Possible index out of bounds: " + ix.index() + " is " +
                 index + ", length of " + ix.array() + " is " + length);
    }
  }

  /**
   * @return true if both bounds are tighter than those of the type.  The
   *    lower bound of an unsigned type is zero anyway.
   */
  private static boolean narrowed(ValueRange r, Type t) {
    if (!r.isFinite() || !t.isInteger()) {
      return false;
    }
    BigInteger min = t.minValue();
    BigInteger max = t.maxValue();
    return (r.lo().compareTo(min) > 0 || !t.isSigned()) &&
           r.hi().compareTo(max) < 0;
  }
}
