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

package exm.ceva.verify;

import java.util.Collection;
import java.util.List;

import exm.ceva.verify.formula.Term;

/**
 * Solver state for one function.  Not thread-safe.
 */
public interface SolverSession {
  /**
   * Check whether the conjunction of the assertions is satisfiable.
   * Assertions don't persist beyond this check.
   * @param modelSymbols variables to report values for if satisfiable
   */
  public SolverResult check(List<Term> assertions,
                            Collection<Term> modelSymbols);

  /**
   * Release solver resources.  The session can't be used afterwards.
   */
  public void close();
}
