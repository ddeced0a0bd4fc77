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

import org.apache.commons.lang3.StringUtils;

import exm.ceva.common.lang.Effects.EffectSet;
import exm.ceva.common.lang.SourceSpan;
import exm.ceva.common.lang.Types.Type;

/**
 * A function of the module under analysis.  Immutable once built.
 */
public class Function {
  private final String id;
  private final String name;
  private final List<Parameter> params;
  private final Type returnType;
  private final List<Expression> preconditions;
  private final List<Expression> postconditions;
  private final EffectSet effects;
  private final List<Statement> body;
  private final SourceSpan span;

  public Function(String id, String name, List<Parameter> params,
                  Type returnType, List<Expression> preconditions,
                  List<Expression> postconditions, EffectSet effects,
                  List<Statement> body, SourceSpan span) {
    this.id = id;
    this.name = name;
    this.params = Collections.unmodifiableList(
                              new ArrayList<Parameter>(params));
    this.returnType = returnType;
    this.preconditions = Collections.unmodifiableList(
                              new ArrayList<Expression>(preconditions));
    this.postconditions = Collections.unmodifiableList(
                              new ArrayList<Expression>(postconditions));
    this.effects = effects == null ? EffectSet.NONE : effects;
    this.body = Collections.unmodifiableList(new ArrayList<Statement>(body));
    this.span = span == null ? SourceSpan.NONE : span;
  }

  public String id() {
    return id;
  }

  public String name() {
    return name;
  }

  public List<Parameter> params() {
    return params;
  }

  public Parameter param(String paramName) {
    for (Parameter p: params) {
      if (p.name().equals(paramName)) {
        return p;
      }
    }
    return null;
  }

  public Type returnType() {
    return returnType;
  }

  public List<Expression> preconditions() {
    return preconditions;
  }

  public List<Expression> postconditions() {
    return postconditions;
  }

  public int contractCount() {
    return preconditions.size() + postconditions.size();
  }

  public boolean hasContracts() {
    return contractCount() > 0;
  }

  public EffectSet effects() {
    return effects;
  }

  /**
   * Functions with no declared effects are pure
   */
  public boolean isPure() {
    return effects.isEmpty();
  }

  public List<Statement> body() {
    return body;
  }

  public SourceSpan span() {
    return span;
  }

  /**
   * @return signature string, e.g. Abs(n:i32)->i32
   */
  public String signature() {
    List<String> ps = new ArrayList<String>();
    for (Parameter p: params) {
      ps.add(p.name() + ":" + p.type().typeName());
    }
    return name + "(" + StringUtils.join(ps, ",") + ")->" +
           returnType.typeName();
  }

  @Override
  public String toString() {
    return id + " " + signature();
  }
}
