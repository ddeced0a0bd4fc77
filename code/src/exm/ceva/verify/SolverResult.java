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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import exm.ceva.common.lang.Value;

public class SolverResult {
  public static enum Status {
    SAT,
    UNSAT,
    /** Includes timeouts */
    UNKNOWN;
  }

  private final Status status;
  private final Map<String, Value> model;
  private final String reason;

  private SolverResult(Status status, Map<String, Value> model,
                       String reason) {
    this.status = status;
    this.model = model;
    this.reason = reason;
  }

  /**
   * @param model values of requested symbols the solver assigned
   */
  public static SolverResult sat(Map<String, Value> model) {
    return new SolverResult(Status.SAT, Collections.unmodifiableMap(
                    new LinkedHashMap<String, Value>(model)), null);
  }

  public static SolverResult unsat() {
    return new SolverResult(Status.UNSAT,
                            Collections.<String, Value>emptyMap(), null);
  }

  public static SolverResult unknown(String reason) {
    return new SolverResult(Status.UNKNOWN,
                            Collections.<String, Value>emptyMap(), reason);
  }

  public Status status() {
    return status;
  }

  public boolean isSat() {
    return status == Status.SAT;
  }

  public boolean isUnsat() {
    return status == Status.UNSAT;
  }

  public Map<String, Value> model() {
    return model;
  }

  /**
   * @return explanation for UNKNOWN
   */
  public String reason() {
    return reason;
  }

  @Override
  public String toString() {
    switch (status) {
      case SAT:
        return "sat " + model;
      case UNKNOWN:
        return "unknown (" + reason + ")";
      default:
        return "unsat";
    }
  }
}
