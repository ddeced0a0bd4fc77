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

import exm.ceva.common.exceptions.UserException;
import exm.ceva.common.lang.Effects.EffectSet;
import exm.ceva.common.lang.SourceSpan;
import exm.ceva.common.lang.Types;
import exm.ceva.common.lang.Types.Type;

/**
 * Assemble a Function from textual parts: types by name, contracts and
 * body as S-expressions.  Text is only parsed in build(), once the whole
 * signature is known.
 */
public class FunctionBuilder {
  private final String name;
  private String id;
  private String file = "";
  private int line = 1;
  private final List<Parameter> params = new ArrayList<Parameter>();
  private Type returnType = Types.VOID;
  private final List<String> requires = new ArrayList<String>();
  private final List<String> ensures = new ArrayList<String>();
  private final List<String> effects = new ArrayList<String>();
  private String body = "";
  private int bodyLine = -1;

  public FunctionBuilder(String name) {
    this.name = name;
    this.id = name;
  }

  public FunctionBuilder id(String newId) {
    this.id = newId;
    return this;
  }

  /**
   * Position of the function header; the body starts on the next line
   * unless set with bodyAt()
   */
  public FunctionBuilder at(String newFile, int newLine) {
    this.file = newFile;
    this.line = newLine;
    return this;
  }

  public FunctionBuilder bodyAt(int newLine) {
    this.bodyLine = newLine;
    return this;
  }

  public FunctionBuilder param(String paramName, String type) {
    params.add(new Parameter(paramName, Types.parse(type), false,
                             SourceSpan.at(file, line, 0)));
    return this;
  }

  public FunctionBuilder untrustedParam(String paramName, String type) {
    params.add(new Parameter(paramName, Types.parse(type), true,
                             SourceSpan.at(file, line, 0)));
    return this;
  }

  public FunctionBuilder returns(String type) {
    this.returnType = Types.parse(type);
    return this;
  }

  public FunctionBuilder requires(String... exprs) {
    requires.addAll(Arrays.asList(exprs));
    return this;
  }

  public FunctionBuilder ensures(String... exprs) {
    ensures.addAll(Arrays.asList(exprs));
    return this;
  }

  public FunctionBuilder effects(String... effectStrings) {
    effects.addAll(Arrays.asList(effectStrings));
    return this;
  }

  public FunctionBuilder body(String text) {
    this.body = text;
    return this;
  }

  public Function build() throws UserException {
    return build(null);
  }

  /**
   * @param module module whose functions are callable from this one,
   *              or null
   */
  public Function build(Module module) throws UserException {
    Function sig = new Function(id, name, params, returnType,
        Collections.<Expression>emptyList(),
        Collections.<Expression>emptyList(), EffectSet.NONE,
        Collections.<Statement>emptyList(), null);
    Scope scope = Scope.forFunction(sig, module);
    // Allow recursion
    scope.defineFunction(name, returnType);

    SourceSpan header = SourceSpan.at(file, line, 0);
    List<Expression> pre = SExpressionParser.parseAll(requires, scope, header);
    List<Expression> post = SExpressionParser.parseAll(ensures, scope, header);
    int firstBodyLine = bodyLine > 0 ? bodyLine : line + 1;
    List<Statement> stmts = SExpressionParser.parseBody(body, scope,
                              SourceSpan.at(file, firstBodyLine, 0));
    return new Function(id, name, params, returnType, pre, post,
                        EffectSet.parse(effects), stmts, header);
  }
}
