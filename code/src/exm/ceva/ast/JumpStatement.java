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
 * break or continue of the innermost loop
 */
public class JumpStatement extends Statement {
  private final boolean isBreak;

  public JumpStatement(boolean isBreak, SourceSpan span) {
    super(span);
    this.isBreak = isBreak;
  }

  public static JumpStatement breakStmt(SourceSpan span) {
    return new JumpStatement(true, span);
  }

  public static JumpStatement continueStmt(SourceSpan span) {
    return new JumpStatement(false, span);
  }

  @Override
  public StmtKind kind() {
    return isBreak ? StmtKind.BREAK : StmtKind.CONTINUE;
  }

  @Override
  public List<Expression> expressions() {
    return Collections.emptyList();
  }
}
