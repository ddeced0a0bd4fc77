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

package exm.ceva.analysis;

import exm.ceva.ast.ExternalFunction;
import exm.ceva.ast.Function;
import exm.ceva.ast.Module;
import exm.ceva.common.lang.Builtins;
import exm.ceva.common.lang.Effects.EffectSet;

/**
 * Decides what is known about the function a call targets, from the
 * module's own definitions and its external declarations.
 */
public class CallClassifier {

  public static enum Purity {
    PURE,
    EFFECTFUL,
    /** Callee not declared anywhere: nothing can be assumed */
    UNKNOWN;
  }

  private final Module module;

  /**
   * @param module may be null, in which case only builtins are known
   */
  public CallClassifier(Module module) {
    this.module = module;
  }

  public Module module() {
    return module;
  }

  public Purity classify(String target) {
    if (Builtins.isBuiltin(target)) {
      return Purity.PURE;
    }
    if (module != null) {
      Function f = module.lookupFunction(target);
      if (f != null) {
        return f.isPure() ? Purity.PURE : Purity.EFFECTFUL;
      }
      ExternalFunction ext = module.lookupExternal(target);
      if (ext != null) {
        return ext.isPure() ? Purity.PURE : Purity.EFFECTFUL;
      }
    }
    return Purity.UNKNOWN;
  }

  public boolean isKnown(String target) {
    return classify(target) != Purity.UNKNOWN;
  }

  /**
   * @return declared effects of callee, or null if callee is unknown
   */
  public EffectSet effectsOf(String target) {
    if (Builtins.isBuiltin(target)) {
      return EffectSet.NONE;
    }
    if (module != null) {
      Function f = module.lookupFunction(target);
      if (f != null) {
        return f.effects();
      }
      ExternalFunction ext = module.lookupExternal(target);
      if (ext != null) {
        return ext.effects();
      }
    }
    return null;
  }
}
