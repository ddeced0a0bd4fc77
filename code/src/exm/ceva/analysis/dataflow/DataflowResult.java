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

package exm.ceva.analysis.dataflow;

import java.util.HashMap;
import java.util.Map;

import exm.ceva.cfg.BasicBlock;

/**
 * Solution of a dataflow problem: facts at the start and end of each
 * reachable block, in program order regardless of analysis direction.
 */
public class DataflowResult<F> {
  private final Map<BasicBlock, F> before = new HashMap<BasicBlock, F>();
  private final Map<BasicBlock, F> after = new HashMap<BasicBlock, F>();
  private boolean converged = true;
  private int visits = 0;

  void setBefore(BasicBlock b, F fact) {
    before.put(b, fact);
  }

  void setAfter(BasicBlock b, F fact) {
    after.put(b, fact);
  }

  void setConverged(boolean converged) {
    this.converged = converged;
  }

  void setVisits(int visits) {
    this.visits = visits;
  }

  /**
   * @return fact at start of block, or null if block was not reached
   */
  public F before(BasicBlock b) {
    return before.get(b);
  }

  /**
   * @return fact at end of block, or null if block was not reached
   */
  public F after(BasicBlock b) {
    return after.get(b);
  }

  /**
   * @return false if the iteration limit was hit before a fixed point
   */
  public boolean converged() {
    return converged;
  }

  public int visits() {
    return visits;
  }
}
