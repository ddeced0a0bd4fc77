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
 * Statement the front end could not represent.  May read or write
 * anything, so analyses assume the worst and do not look inside.
 */
public class UnknownStatement extends Statement {
  private final String description;

  public UnknownStatement(String description, SourceSpan span) {
    super(span);
    this.description = description;
  }

  public String description() {
    return description;
  }

  @Override
  public StmtKind kind() {
    return StmtKind.UNKNOWN;
  }

  @Override
  public List<Expression> expressions() {
    return Collections.emptyList();
  }
}
