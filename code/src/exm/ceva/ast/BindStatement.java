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
import exm.ceva.common.lang.Types.Type;

/**
 * Declaration of a local, optionally with an initializer
 */
public class BindStatement extends Statement {
  private final String name;
  private final Type type;
  private final Expression init;

  public BindStatement(String name, Type type, Expression init,
                       SourceSpan span) {
    super(span);
    this.name = name;
    this.type = type;
    this.init = init;
  }

  public String name() {
    return name;
  }

  public Type type() {
    return type;
  }

  /**
   * @return initializer, or null if declared without a value
   */
  public Expression init() {
    return init;
  }

  @Override
  public StmtKind kind() {
    return StmtKind.BIND;
  }

  @Override
  public List<Expression> expressions() {
    if (init == null) {
      return Collections.emptyList();
    }
    return Collections.singletonList(init);
  }
}
