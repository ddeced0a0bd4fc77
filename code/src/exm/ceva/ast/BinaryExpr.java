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

import java.util.Arrays;
import java.util.List;

import exm.ceva.common.lang.Operators.BinaryOp;
import exm.ceva.common.lang.SourceSpan;
import exm.ceva.common.lang.Types.Type;

public class BinaryExpr extends Expression {
  private final BinaryOp op;
  private final Expression left;
  private final Expression right;

  public BinaryExpr(BinaryOp op, Expression left, Expression right,
                    Type type, SourceSpan span) {
    super(type, span);
    this.op = op;
    this.left = left;
    this.right = right;
  }

  public BinaryOp op() {
    return op;
  }

  public Expression left() {
    return left;
  }

  public Expression right() {
    return right;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.BINARY;
  }

  @Override
  public List<Expression> children() {
    return Arrays.asList(left, right);
  }
}
