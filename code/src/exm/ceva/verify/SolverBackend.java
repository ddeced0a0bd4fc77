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

/**
 * An SMT solver the orchestrator can hand formulas to.  A backend is
 * shared by all workers; sessions are not.
 */
public interface SolverBackend {
  public String name();

  /**
   * @return true if the solver can be used in this process, e.g. its
   *        native library loads
   */
  public boolean isAvailable();

  /**
   * @return why the solver is unavailable, null if it is available
   */
  public String unavailableReason();

  /**
   * Open a session for the checks of one function.  Caller must close
   * it.
   * @param timeoutMs limit for each individual check
   */
  public SolverSession openSession(long timeoutMs);
}
