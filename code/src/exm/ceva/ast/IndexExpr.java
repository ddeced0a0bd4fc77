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

import exm.ceva.common.lang.SourceSpan;
import exm.ceva.common.lang.Types.Type;

/**
 * Array element read: array[index]
 */
public class IndexExpr extends Expression {
  private final Expression array;
  private final Expression index;

  public IndexExpr(Expression array, Expression index, Type type,
                   SourceSpan span) {
    super(type, span);
    this.array = array;
    this.index = index;
  }

  public Expression array() {
    return array;
  }

  public Expression index() {
    return index;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.INDEX;
  }

  @Override
  public List<Expression> children() {
    return Arrays.asList(array, index);
  }
}
