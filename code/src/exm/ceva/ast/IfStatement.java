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

/**
 * if/else.  Else-if chains nest in the else body.
 */
public class IfStatement extends Statement {
  private final Expression condition;
  private final List<Statement> thenBody;
  private final List<Statement> elseBody;

  public IfStatement(Expression condition, List<Statement> thenBody,
                     List<Statement> elseBody, SourceSpan span) {
    super(span);
    this.condition = condition;
    this.thenBody = Collections.unmodifiableList(
                          new ArrayList<Statement>(thenBody));
    this.elseBody = Collections.unmodifiableList(elseBody == null ?
            new ArrayList<Statement>() : new ArrayList<Statement>(elseBody));
  }

  public Expression condition() {
    return condition;
  }

  public List<Statement> thenBody() {
    return thenBody;
  }

  public List<Statement> elseBody() {
    return elseBody;
  }

  @Override
  public StmtKind kind() {
    return StmtKind.IF;
  }

  @Override
  public List<Expression> expressions() {
    return Collections.singletonList(condition);
  }

  @Override
  public List<List<Statement>> bodies() {
    return Arrays.asList(thenBody, elseBody);
  }
}
