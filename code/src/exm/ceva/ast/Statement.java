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
 * Statement of a function body.  Compound statements hold nested bodies.
 */
public abstract class Statement {

  public static enum StmtKind {
    BIND,
    ASSIGN,
    ARRAY_STORE,
    IF,
    WHILE,
    DO_WHILE,
    FOR,
    BREAK,
    CONTINUE,
    RETURN,
    THROW,
    CALL,
    /** Anything the front end could not type; worst-case effects */
    UNKNOWN,
  }

  protected final SourceSpan span;

  protected Statement(SourceSpan span) {
    this.span = span == null ? SourceSpan.NONE : span;
  }

  public abstract StmtKind kind();

  /**
   * @return expressions evaluated directly by this statement, not
   *         including those inside nested bodies
   */
  public abstract List<Expression> expressions();

  /**
   * @return nested statement lists
   */
  public List<List<Statement>> bodies() {
    return Collections.emptyList();
  }

  public SourceSpan span() {
    return span;
  }

  @Override
  public String toString() {
    return SExpressions.print(this);
  }
}
