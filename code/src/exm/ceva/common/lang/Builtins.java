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

package exm.ceva.common.lang;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import exm.ceva.common.lang.Types.Type;

/**
 * Functions built into the language.  All are pure.
 */
public class Builtins {
  public static final String ABS = "abs";
  public static final String MIN = "min";
  public static final String MAX = "max";

  private static final Set<String> names =
        new HashSet<String>(Arrays.asList(ABS, MIN, MAX));

  public static boolean isBuiltin(String name) {
    return names.contains(name);
  }

  /**
   * @return result type of builtin applied to args of given types,
   *         or null if not applicable
   */
  public static Type resultType(String name, List<Type> argTypes) {
    if (name.equals(ABS) && argTypes.size() == 1 &&
        argTypes.get(0).isNumeric()) {
      return argTypes.get(0);
    } else if ((name.equals(MIN) || name.equals(MAX)) &&
               argTypes.size() == 2) {
      Type a = argTypes.get(0), b = argTypes.get(1);
      if (a.isInteger() && b.isInteger()) {
        return Types.widerInt(a, b);
      } else if (a.isNumeric() && b.isNumeric()) {
        return Types.F64;
      }
    }
    return null;
  }
}
