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

import java.util.List;

import exm.ceva.common.lang.SourceSpan;
import exm.ceva.common.lang.Types.Type;

/**
 * Immutable typed expression tree.  Shared read-only between the formula
 * encoder and the analyzers.
 */
public abstract class Expression {

  public static enum ExprKind {
    LITERAL,
    VARIABLE,
    UNARY,
    BINARY,
    CALL,
    INDEX,
    LENGTH,
  }

  protected final Type type;
  protected final SourceSpan span;

  protected Expression(Type type, SourceSpan span) {
    this.type = type;
    this.span = span == null ? SourceSpan.NONE : span;
  }

  public abstract ExprKind kind();

  /**
   * @return direct subexpressions, in evaluation order
   */
  public abstract List<Expression> children();

  public Type type() {
    return type;
  }

  public SourceSpan span() {
    return span;
  }

  @Override
  public String toString() {
    return SExpressions.print(this);
  }
}
