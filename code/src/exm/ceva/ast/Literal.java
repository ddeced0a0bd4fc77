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
import exm.ceva.common.lang.Types.Type;
import exm.ceva.common.lang.Value;

public class Literal extends Expression {
  private final Value value;

  public Literal(Value value, Type type, SourceSpan span) {
    super(type, span);
    this.value = value;
  }

  public static Literal intLit(long v, Type type) {
    return new Literal(Value.createIntLit(v), type, SourceSpan.NONE);
  }

  public static Literal boolLit(boolean v) {
    return new Literal(Value.createBoolLit(v), Types.BOOL, SourceSpan.NONE);
  }

  public static Literal nullLit(SourceSpan span) {
    return new Literal(Value.nullValue(), Types.NULL, span);
  }

  public Value value() {
    return value;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.LITERAL;
  }

  @Override
  public List<Expression> children() {
    return Collections.emptyList();
  }
}
