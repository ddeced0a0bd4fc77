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
import java.util.Collections;
import java.util.List;

import exm.ceva.common.lang.SourceSpan;

/**
 * while and do-while loops
 */
public class WhileStatement extends Statement {
  private final Expression condition;
  private final List<Statement> body;
  private final boolean testFirst;

  public WhileStatement(Expression condition, List<Statement> body,
                        boolean testFirst, SourceSpan span) {
    super(span);
    this.condition = condition;
    this.body = Collections.unmodifiableList(new ArrayList<Statement>(body));
    this.testFirst = testFirst;
  }

  public static WhileStatement doWhile(List<Statement> body,
                            Expression condition, SourceSpan span) {
    return new WhileStatement(condition, body, false, span);
  }

  public Expression condition() {
    return condition;
  }

  public List<Statement> body() {
    return body;
  }

  /**
   * @return false for do-while, where the body runs before the first test
   */
  public boolean testFirst() {
    return testFirst;
  }

  @Override
  public StmtKind kind() {
    return testFirst ? StmtKind.WHILE : StmtKind.DO_WHILE;
  }

  @Override
  public List<Expression> expressions() {
    return Collections.singletonList(condition);
  }

  @Override
  public List<List<Statement>> bodies() {
    return Collections.singletonList(body);
  }
}
