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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.apache.log4j.Logger;

import exm.ceva.analysis.dataflow.DataflowAnalysis.Direction;
import exm.ceva.cfg.BasicBlock;
import exm.ceva.cfg.ControlFlowGraph;
import exm.ceva.cfg.Edge;
import exm.ceva.common.Logging;

/**
 * Worklist fixed-point iteration for DataflowAnalysis problems.  Blocks
 * are processed in reverse postorder (postorder for backward problems)
 * so most problems converge in a couple of passes.  Unreachable blocks
 * are never visited.
 */
public class DataflowSolver {

  private static final Logger logger = Logging.getCevaLogger();

  /** Visits to a loop header before widening kicks in */
  public static final int WIDEN_AFTER_VISITS = 3;

  private final int maxIterations;

  /**
   * @param maxIterations maximum number of times any one block is
   *          processed before giving up
   */
  public DataflowSolver(int maxIterations) {
    assert(maxIterations > 0);
    this.maxIterations = maxIterations;
  }

  public <F> DataflowResult<F> solve(ControlFlowGraph cfg,
                                     DataflowAnalysis<F> analysis) {
    List<BasicBlock> order = new ArrayList<BasicBlock>(cfg.reversePostorder());
    boolean forward = analysis.direction() == Direction.FORWARD;
    if (!forward) {
      Collections.reverse(order);
    }
    Map<BasicBlock, Integer> position = new HashMap<BasicBlock, Integer>();
    for (int i = 0; i < order.size(); i++) {
      position.put(order.get(i), i);
    }

    // Facts at the input and output side of each block in the direction
    // of the analysis
    Map<BasicBlock, F> inFacts = new HashMap<BasicBlock, F>();
    Map<BasicBlock, F> outFacts = new HashMap<BasicBlock, F>();
    Map<BasicBlock, Integer> visitCounts = new HashMap<BasicBlock, Integer>();
    BasicBlock boundary = forward ? cfg.entry() : cfg.exit();

    TreeSet<Integer> worklist = new TreeSet<Integer>();
    for (int i = 0; i < order.size(); i++) {
      worklist.add(i);
    }

    DataflowResult<F> result = new DataflowResult<F>();
    int totalVisits = 0;
    while (!worklist.isEmpty()) {
      BasicBlock b = order.get(worklist.pollFirst());
      int visits = increment(visitCounts, b);
      totalVisits++;
      if (visits > maxIterations) {
        logger.warn("Dataflow analysis " + analysis.getClass().getSimpleName()
            + " did not converge in " + maxIterations + " iterations for "
            + cfg.function().name());
        result.setConverged(false);
        break;
      }

      F in = joinInputs(analysis, b, forward, outFacts);
      if (b == boundary) {
        in = in == null ? analysis.boundaryFact()
                        : analysis.join(in, analysis.boundaryFact());
      } else if (in == null) {
        in = analysis.initialFact();
      }
      F oldIn = inFacts.get(b);
      if (oldIn != null && forward && cfg.isLoopHeader(b) &&
          visits > WIDEN_AFTER_VISITS) {
        in = analysis.widen(oldIn, in);
      }
      inFacts.put(b, in);

      F out = analysis.transferBlock(b, in);
      F oldOut = outFacts.get(b);
      if (oldOut != null && oldOut.equals(out)) {
        continue;
      }
      outFacts.put(b, out);

      for (BasicBlock next: forward ? b.successors() : b.predecessors()) {
        Integer pos = position.get(next);
        if (pos != null) {
          worklist.add(pos);
        }
      }
    }

    for (BasicBlock b: order) {
      F in = inFacts.get(b);
      F out = outFacts.get(b);
      if (forward) {
        result.setBefore(b, in);
        result.setAfter(b, out);
      } else {
        result.setBefore(b, out);
        result.setAfter(b, in);
      }
    }
    result.setVisits(totalVisits);
    if (logger.isTraceEnabled()) {
      logger.trace(analysis.getClass().getSimpleName() + " on " +
                   cfg.function().name() + ": " + totalVisits + " visits");
    }
    return result;
  }

  /**
   * Join the facts flowing into b from neighbours already processed
   * @return null if no input has been computed yet
   */
  private static <F> F joinInputs(DataflowAnalysis<F> analysis,
        BasicBlock b, boolean forward, Map<BasicBlock, F> outFacts) {
    F result = null;
    List<Edge> edges = forward ? b.predecessorEdges() : b.successorEdges();
    for (Edge e: edges) {
      BasicBlock other = forward ? e.from() : e.to();
      F fact = outFacts.get(other);
      if (fact == null) {
        continue;
      }
      if (forward) {
        fact = analysis.transferEdge(e, fact);
        if (fact == null) {
          // Edge can't be taken
          continue;
        }
      }
      result = result == null ? fact : analysis.join(result, fact);
    }
    return result;
  }

  private static int increment(Map<BasicBlock, Integer> counts,
                               BasicBlock b) {
    Integer prev = counts.get(b);
    int n = prev == null ? 1 : prev + 1;
    counts.put(b, n);
    return n;
  }
}
