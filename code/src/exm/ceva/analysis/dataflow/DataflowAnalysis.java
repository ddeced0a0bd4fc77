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

import exm.ceva.cfg.BasicBlock;
import exm.ceva.cfg.Edge;

/**
 * A dataflow problem over a control flow graph, solved by DataflowSolver.
 *
 * Facts must be immutable values with a meaningful equals().
 *
 * @param <F> type of dataflow fact
 */
public abstract class DataflowAnalysis<F> {

  public static enum Direction {
    FORWARD,
    BACKWARD;
  }

  public abstract Direction direction();

  /**
   * @return fact at function entry for a forward analysis, or at
   *        function exit for a backward one
   */
  public abstract F boundaryFact();

  /**
   * @return fact for a block none of whose inputs have been computed
   */
  public abstract F initialFact();

  public abstract F join(F a, F b);

  /**
   * Apply the effect of the block's statements, in the analysis
   * direction.  For a backward analysis the input is the fact at the
   * end of the block and the result the fact at its start.
   */
  public abstract F transferBlock(BasicBlock block, F input);

  /**
   * Refine the fact leaving a block along a particular edge, e.g. with
   * the outcome of a branch condition.  Only used by forward analyses.
   */
  public F transferEdge(Edge edge, F fact) {
    return fact;
  }

  /**
   * Accelerate convergence at loop headers once they have been visited
   * a few times.  Default is no widening, fine for finite lattices.
   * @param previous fact at header from last visit
   * @param next newly joined fact
   */
  public F widen(F previous, F next) {
    return next;
  }
}
