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

import exm.ceva.common.lang.Effects.EffectSet;
import exm.ceva.common.lang.Types.Type;

/**
 * Declaration of a function defined outside the module, e.g. a library
 * binding.  Calls to functions with no declaration at all are unknown.
 */
public class ExternalFunction {
  private final String name;
  private final EffectSet effects;
  private final boolean pure;
  private final boolean sanitizer;
  private final Type returnType;

  public ExternalFunction(String name, EffectSet effects, boolean pure,
                          boolean sanitizer, Type returnType) {
    this.name = name;
    this.effects = effects == null ? EffectSet.NONE : effects;
    this.pure = pure;
    this.sanitizer = sanitizer;
    this.returnType = returnType;
  }

  public String name() {
    return name;
  }

  public EffectSet effects() {
    return effects;
  }

  /**
   * @return true if declared free of effects and deterministic
   */
  public boolean isPure() {
    return pure && effects.isEmpty();
  }

  /**
   * @return true if registered as clearing taint from its result
   */
  public boolean isSanitizer() {
    return sanitizer;
  }

  /**
   * @return return type, or null if not declared
   */
  public Type returnType() {
    return returnType;
  }

  public String signature() {
    return name + (returnType == null ? "" : "->" + returnType.typeName()) +
          effects + (isPure() ? " pure" : "") + (sanitizer ? " sanitizer" : "");
  }
}
