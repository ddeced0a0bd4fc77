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

/**
 * return or throw: both leave the function
 */
public class ExitStatement extends Statement {
  private final boolean isThrow;
  private final Expression value;

  public ExitStatement(boolean isThrow, Expression value, SourceSpan span) {
    super(span);
    this.isThrow = isThrow;
    this.value = value;
  }

  public static ExitStatement returnStmt(Expression value, SourceSpan span) {
    return new ExitStatement(false, value, span);
  }

  public static ExitStatement throwStmt(Expression value, SourceSpan span) {
    return new ExitStatement(true, value, span);
  }

  /**
   * @return returned or thrown value, may be null
   */
  public Expression value() {
    return value;
  }

  @Override
  public StmtKind kind() {
    return isThrow ? StmtKind.THROW : StmtKind.RETURN;
  }

  @Override
  public List<Expression> expressions() {
    if (value == null) {
      return Collections.emptyList();
    }
    return Collections.singletonList(value);
  }
}
