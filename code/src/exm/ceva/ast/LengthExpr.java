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

import exm.ceva.common.lang.SourceSpan;
import exm.ceva.common.lang.Types;

/**
 * Length of an array or string, always of type i32
 */
public class LengthExpr extends Expression {
  private final Expression operand;

  public LengthExpr(Expression operand, SourceSpan span) {
    super(Types.I32, span);
    this.operand = operand;
  }

  public Expression operand() {
    return operand;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.LENGTH;
  }

  @Override
  public List<Expression> children() {
    return Collections.singletonList(operand);
  }
}
