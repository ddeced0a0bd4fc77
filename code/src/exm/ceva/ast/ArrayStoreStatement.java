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

/**
 * Array element write: array[index] = value
 */
public class ArrayStoreStatement extends Statement {
  private final String array;
  private final Expression arrayRef;
  private final Expression index;
  private final Expression value;

  public ArrayStoreStatement(VarRef arrayRef, Expression index,
                             Expression value, SourceSpan span) {
    super(span);
    this.array = arrayRef.name();
    this.arrayRef = arrayRef;
    this.index = index;
    this.value = value;
  }

  public String arrayName() {
    return array;
  }

  public Expression arrayRef() {
    return arrayRef;
  }

  public Expression index() {
    return index;
  }

  public Expression value() {
    return value;
  }

  @Override
  public StmtKind kind() {
    return StmtKind.ARRAY_STORE;
  }

  @Override
  public List<Expression> expressions() {
    return Arrays.asList(arrayRef, index, value);
  }
}
