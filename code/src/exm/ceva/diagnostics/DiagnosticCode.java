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

package exm.ceva.diagnostics;

/**
 * Stable diagnostic codes.  Codes are part of the output format: never
 * renumber an existing code.
 */
public class DiagnosticCode {
  /* Calls */
  public static final String UNKNOWN_CALL = "CV0411";

  /* Verification */
  public static final String SOLVER_UNAVAILABLE = "CV0700";
  public static final String PRECONDITION_DISPROVEN = "CV0701";
  public static final String POSTCONDITION_DISPROVEN = "CV0702";
  public static final String CONTRACT_PROVEN = "CV0703";
  public static final String LOOP_INVARIANT_PROVEN = "CV0710";
  public static final String LOOP_INVARIANT_UNKNOWN = "CV0711";

  /* Dataflow */
  public static final String UNINITIALIZED_READ = "CV0900";
  public static final String DEAD_CODE = "CV0901";
  public static final String DEAD_STORE = "CV0902";

  /* Bug patterns */
  public static final String DIVISION_BY_ZERO = "CV0920";
  public static final String INDEX_OUT_OF_BOUNDS = "CV0921";
  public static final String NULL_DEREFERENCE = "CV0922";
  public static final String INTEGER_OVERFLOW = "CV0923";

  /* Taint */
  public static final String SQL_INJECTION = "CV0980";
  public static final String COMMAND_INJECTION = "CV0981";
  public static final String PATH_TRAVERSAL = "CV0982";
  public static final String CROSS_SITE_SCRIPTING = "CV0983";
  public static final String TAINTED_SINK = "CV0984";

  public static final String INTERNAL_FAULT = "CV0999";
}
