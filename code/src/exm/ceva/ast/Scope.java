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

import java.util.HashMap;
import java.util.Map;

import exm.ceva.common.lang.Types;
import exm.ceva.common.lang.Types.Type;

/**
 * Names visible while typing the expressions of one function:
 * parameters, locals, result, and callable functions.
 */
public class Scope {
  /** Type given to things we know nothing about */
  public static final Type UNKNOWN = Types.named("unknown");

  private final Map<String, Type> vars = new HashMap<String, Type>();
  private final Map<String, Type> functions = new HashMap<String, Type>();

  public void defineVar(String name, Type type) {
    vars.put(name, type);
  }

  public void defineFunction(String name, Type returnType) {
    functions.put(name, returnType);
  }

  /**
   * @return the type, or null if undefined
   */
  public Type lookupVar(String name) {
    return vars.get(name);
  }

  /**
   * @return return type, UNKNOWN if called function is not declared
   */
  public Type lookupFunction(String name) {
    Type t = functions.get(name);
    return t == null ? UNKNOWN : t;
  }

  public static Scope forFunction(Function f, Module module) {
    Scope scope = new Scope();
    if (module != null) {
      for (Function g: module.functions()) {
        scope.defineFunction(g.name(), g.returnType());
      }
      for (ExternalFunction e: module.externals()) {
        if (e.returnType() != null) {
          scope.defineFunction(e.name(), e.returnType());
        }
      }
    }
    for (Parameter p: f.params()) {
      scope.defineVar(p.name(), p.type());
    }
    if (!f.returnType().isVoid()) {
      scope.defineVar(VarRef.RESULT, f.returnType());
    }
    return scope;
  }
}
