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

import java.util.Collections;
import java.util.List;

import exm.ceva.common.lang.Operators.UnaryOp;
import exm.ceva.common.lang.SourceSpan;
import exm.ceva.common.lang.Types.Type;

public class UnaryExpr extends Expression {
  private final UnaryOp op;
  private final Expression operand;

  public UnaryExpr(UnaryOp op, Expression operand, Type type,
                   SourceSpan span) {
    super(type, span);
    this.op = op;
    this.operand = operand;
  }

  public UnaryOp op() {
    return op;
  }

  public Expression operand() {
    return operand;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.UNARY;
  }

  @Override
  public List<Expression> children() {
    return Collections.singletonList(operand);
  }
}
