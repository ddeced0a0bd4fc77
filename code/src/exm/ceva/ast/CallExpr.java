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
import exm.ceva.common.lang.Types.Type;

/**
 * Function or method call.  A call with a receiver (x.f(...)) dereferences
 * the receiver.
 */
public class CallExpr extends Expression {
  private final String target;
  private final Expression receiver;
  private final List<Expression> args;

  public CallExpr(String target, Expression receiver, List<Expression> args,
                  Type type, SourceSpan span) {
    super(type, span);
    this.target = target;
    this.receiver = receiver;
    this.args = Collections.unmodifiableList(new ArrayList<Expression>(args));
  }

  public CallExpr(String target, List<Expression> args, Type type,
                  SourceSpan span) {
    this(target, null, args, type, span);
  }

  public String target() {
    return target;
  }

  /**
   * @return receiver, or null for a plain function call
   */
  public Expression receiver() {
    return receiver;
  }

  public List<Expression> args() {
    return args;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.CALL;
  }

  @Override
  public List<Expression> children() {
    if (receiver == null) {
      return args;
    }
    List<Expression> result = new ArrayList<Expression>(args.size() + 1);
    result.add(receiver);
    result.addAll(args);
    return result;
  }
}
