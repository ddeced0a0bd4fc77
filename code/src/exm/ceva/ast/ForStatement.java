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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.ceva.common.lang.SourceSpan;
import exm.ceva.common.lang.Types.Type;

/**
 * Counted loop: for var from .. to [step s], both bounds inclusive.
 * The step defaults to 1.
 */
public class ForStatement extends Statement {
  private final String var;
  private final Type varType;
  private final Expression from;
  private final Expression to;
  private final Expression step;
  private final List<Statement> body;

  public ForStatement(String var, Type varType, Expression from,
                      Expression to, Expression step, List<Statement> body,
                      SourceSpan span) {
    super(span);
    this.var = var;
    this.varType = varType;
    this.from = from;
    this.to = to;
    this.step = step;
    this.body = Collections.unmodifiableList(new ArrayList<Statement>(body));
  }

  public String var() {
    return var;
  }

  public Type varType() {
    return varType;
  }

  public Expression from() {
    return from;
  }

  public Expression to() {
    return to;
  }

  /**
   * @return step, or null for the default of 1
   */
  public Expression step() {
    return step;
  }

  public List<Statement> body() {
    return body;
  }

  @Override
  public StmtKind kind() {
    return StmtKind.FOR;
  }

  @Override
  public List<Expression> expressions() {
    if (step == null) {
      return Arrays.asList(from, to);
    }
    return Arrays.asList(from, to, step);
  }

  @Override
  public List<List<Statement>> bodies() {
    return Collections.singletonList(body);
  }
}
