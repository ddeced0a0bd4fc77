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

package exm.ceva.cfg;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import exm.ceva.ast.Function;

/**
 * Control flow graph of one function body.  Built fresh for each analysis
 * run by ControlFlowBuilder and read-only afterwards.
 */
public class ControlFlowGraph {
  private final Function function;
  private final List<BasicBlock> blocks = new ArrayList<BasicBlock>();
  private final BasicBlock entry;
  private final BasicBlock exit;

  /** Variables introduced by for loops */
  private final Set<String> loopVariables = new LinkedHashSet<String>();

  private List<BasicBlock> rpo = null;

  ControlFlowGraph(Function function) {
    this.function = function;
    this.entry = newBlock();
    this.exit = newBlock();
  }

  BasicBlock newBlock() {
    BasicBlock b = new BasicBlock(blocks.size());
    blocks.add(b);
    return b;
  }

  Edge addEdge(BasicBlock from, BasicBlock to, EdgeKind kind) {
    return addEdge(from, to, kind, kind != EdgeKind.FALSE_BRANCH);
  }

  Edge addEdge(BasicBlock from, BasicBlock to, EdgeKind kind,
               boolean trueOutcome) {
    Edge e = new Edge(from, to, kind, trueOutcome);
    from.successors.add(e);
    to.predecessors.add(e);
    return e;
  }

  void addLoopVariable(String var) {
    loopVariables.add(var);
  }

  public Function function() {
    return function;
  }

  public BasicBlock entry() {
    return entry;
  }

  public BasicBlock exit() {
    return exit;
  }

  /**
   * @return all blocks, reachable or not, in creation order
   */
  public List<BasicBlock> blocks() {
    return Collections.unmodifiableList(blocks);
  }

  public BasicBlock block(int id) {
    return blocks.get(id);
  }

  public int size() {
    return blocks.size();
  }

  public List<BasicBlock> unreachableBlocks() {
    List<BasicBlock> res = new ArrayList<BasicBlock>();
    for (BasicBlock b: blocks) {
      if (!b.isReachable()) {
        res.add(b);
      }
    }
    return res;
  }

  public Set<String> loopVariables() {
    return Collections.unmodifiableSet(loopVariables);
  }

  /**
   * @return true if block is the target of a loop back edge
   */
  public boolean isLoopHeader(BasicBlock b) {
    for (Edge e: b.predecessors) {
      if (e.kind() == EdgeKind.LOOP_BACK) {
        return true;
      }
    }
    return false;
  }

  /**
   * Mark every block reachable from entry
   */
  void computeReachability() {
    Deque<BasicBlock> stack = new ArrayDeque<BasicBlock>();
    for (BasicBlock b: blocks) {
      b.setReachable(false);
    }
    entry.setReachable(true);
    stack.push(entry);
    while (!stack.isEmpty()) {
      BasicBlock b = stack.pop();
      for (Edge e: b.successors) {
        if (!e.to().isReachable()) {
          e.to().setReachable(true);
          stack.push(e.to());
        }
      }
    }
    rpo = null;
  }

  /**
   * Reachable blocks in reverse postorder from entry: every block comes
   * before its successors, except along loop back edges.
   */
  public List<BasicBlock> reversePostorder() {
    if (rpo == null) {
      List<BasicBlock> post = new ArrayList<BasicBlock>();
      postorder(entry, new HashSet<BasicBlock>(), post);
      Collections.reverse(post);
      rpo = Collections.unmodifiableList(post);
    }
    return rpo;
  }

  /**
   * Iterative depth-first walk, so deeply nested bodies can't overflow
   * the stack
   */
  private static void postorder(BasicBlock start, Set<BasicBlock> visited,
                                List<BasicBlock> out) {
    Deque<BasicBlock> blockStack = new ArrayDeque<BasicBlock>();
    Deque<Integer> nextSucc = new ArrayDeque<Integer>();
    visited.add(start);
    blockStack.push(start);
    nextSucc.push(0);
    while (!blockStack.isEmpty()) {
      BasicBlock b = blockStack.peek();
      int i = nextSucc.pop();
      if (i < b.successors.size()) {
        nextSucc.push(i + 1);
        BasicBlock succ = b.successors.get(i).to();
        if (visited.add(succ)) {
          blockStack.push(succ);
          nextSucc.push(0);
        }
      } else {
        blockStack.pop();
        out.add(b);
      }
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("CFG of ").append(function.name()).append(" (entry B")
      .append(entry.id()).append(", exit B").append(exit.id()).append(")\n");
    for (BasicBlock b: blocks) {
      sb.append(b);
    }
    return sb.toString();
  }
}
