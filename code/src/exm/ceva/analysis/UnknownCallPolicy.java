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

/**
 * How calls to functions that are neither defined in the module nor
 * declared external are reported.  They are treated as effectful in
 * every case.
 */
public enum UnknownCallPolicy {
  /** Error at each call site */
  STRICT,
  /** Warning at each call site */
  DEFAULT,
  /** Not reported */
  PERMISSIVE;

  public static UnknownCallPolicy fromString(String s) {
    return valueOf(s.trim().toUpperCase());
  }
}
