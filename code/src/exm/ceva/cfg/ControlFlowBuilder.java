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

import java.util.List;

import org.apache.log4j.Logger;

import exm.ceva.ast.AssignStatement;
import exm.ceva.ast.BinaryExpr;
import exm.ceva.ast.BindStatement;
import exm.ceva.ast.ConstantFolder;
import exm.ceva.ast.Expression;
import exm.ceva.ast.ForStatement;
import exm.ceva.ast.Function;
import exm.ceva.ast.IfStatement;
import exm.ceva.ast.Literal;
import exm.ceva.ast.Statement;
import exm.ceva.ast.VarRef;
import exm.ceva.ast.WhileStatement;
import exm.ceva.common.Logging;
import exm.ceva.common.lang.Operators.BinaryOp;
import exm.ceva.common.lang.SourceSpan;
import exm.ceva.common.lang.Types;
import exm.ceva.common.lang.Types.Type;
import exm.ceva.common.lang.Value;
import exm.ceva.common.util.StackLite;

/**
 * Build the control flow graph of a function body with a single linear
 * pass over the statements, keeping a cursor on the current block.
 *
 * Any body produces a graph: break/continue outside a loop are ignored,
 * and statements after a return, throw, break or continue land in fresh
 * blocks that are flagged unreachable.
 */
public class ControlFlowBuilder {

  private static final Logger logger = Logging.getCevaLogger();

  /** Where break and continue go in the innermost loop */
  private static class LoopTargets {
    final BasicBlock breakTarget;
    final BasicBlock continueTarget;
    final EdgeKind continueKind;

    LoopTargets(BasicBlock breakTarget, BasicBlock continueTarget,
                EdgeKind continueKind) {
      this.breakTarget = breakTarget;
      this.continueTarget = continueTarget;
      this.continueKind = continueKind;
    }
  }

  private final ControlFlowGraph cfg;
  private final StackLite<LoopTargets> loops = new StackLite<LoopTargets>();
  private BasicBlock current;

  private ControlFlowBuilder(Function function) {
    this.cfg = new ControlFlowGraph(function);
  }

  public static ControlFlowGraph build(Function function) {
    ControlFlowBuilder builder = new ControlFlowBuilder(function);
    return builder.buildGraph();
  }

  private ControlFlowGraph buildGraph() {
    current = cfg.entry();
    buildBody(cfg.function().body());
    // Falling off the end is an implicit return
    cfg.addEdge(current, cfg.exit(), EdgeKind.FALLTHROUGH);
    cfg.computeReachability();

    if (logger.isTraceEnabled()) {
      logger.trace(cfg.toString());
    }
    return cfg;
  }

  private void buildBody(List<Statement> body) {
    for (Statement stmt: body) {
      buildStatement(stmt);
    }
  }

  private void buildStatement(Statement stmt) {
    switch (stmt.kind()) {
      case BIND:
      case ASSIGN:
      case ARRAY_STORE:
      case CALL:
        current.addStatement(stmt);
        break;
      case IF:
        buildIf((IfStatement)stmt);
        break;
      case WHILE:
        buildWhile((WhileStatement)stmt);
        break;
      case DO_WHILE:
        buildDoWhile((WhileStatement)stmt);
        break;
      case FOR:
        buildFor((ForStatement)stmt);
        break;
      case BREAK:
      case CONTINUE:
        buildJump(stmt);
        break;
      case RETURN:
        current.addStatement(stmt);
        cfg.addEdge(current, cfg.exit(), EdgeKind.RETURN);
        current = cfg.newBlock();
        break;
      case THROW:
        current.addStatement(stmt);
        cfg.addEdge(current, cfg.exit(), EdgeKind.THROW);
        current = cfg.newBlock();
        break;
      case UNKNOWN:
      default:
        // Opaque: isolate in its own block
        buildUnknown(stmt);
        break;
    }
  }

  private void buildUnknown(Statement stmt) {
    BasicBlock opaque = cfg.newBlock();
    cfg.addEdge(current, opaque, EdgeKind.FALLTHROUGH);
    opaque.addStatement(stmt);
    opaque.setUnknown();
    current = cfg.newBlock();
    cfg.addEdge(opaque, current, EdgeKind.FALLTHROUGH);
  }

  private void buildJump(Statement stmt) {
    LoopTargets loop = loops.peek();
    if (loop == null) {
      logger.debug(stmt.kind() + " outside loop at " + stmt.span() +
                   " in " + cfg.function().name() + ": ignored");
      return;
    }
    if (stmt.kind() == Statement.StmtKind.BREAK) {
      cfg.addEdge(current, loop.breakTarget, EdgeKind.FALLTHROUGH);
    } else {
      cfg.addEdge(current, loop.continueTarget, loop.continueKind);
    }
    current = cfg.newBlock();
  }

  /**
   * End current block with a two-way branch.  A constant condition only
   * gets the edge that can be taken.
   */
  private void branch(BasicBlock from, Expression cond,
                      BasicBlock ifTrue, EdgeKind trueKind,
                      BasicBlock ifFalse) {
    from.setBranchCondition(cond);
    Boolean constant = ConstantFolder.foldCondition(cond);
    if (constant == null || constant) {
      cfg.addEdge(from, ifTrue, trueKind, true);
    }
    if (constant == null || !constant) {
      cfg.addEdge(from, ifFalse, EdgeKind.FALSE_BRANCH, false);
    }
  }

  private void buildIf(IfStatement stmt) {
    BasicBlock thenBlock = cfg.newBlock();
    BasicBlock elseBlock = cfg.newBlock();
    BasicBlock join = cfg.newBlock();
    branch(current, stmt.condition(), thenBlock, EdgeKind.TRUE_BRANCH,
           elseBlock);

    current = thenBlock;
    buildBody(stmt.thenBody());
    cfg.addEdge(current, join, EdgeKind.FALLTHROUGH);

    current = elseBlock;
    buildBody(stmt.elseBody());
    cfg.addEdge(current, join, EdgeKind.FALLTHROUGH);

    current = join;
  }

  private void buildWhile(WhileStatement stmt) {
    BasicBlock header = cfg.newBlock();
    BasicBlock body = cfg.newBlock();
    BasicBlock after = cfg.newBlock();
    cfg.addEdge(current, header, EdgeKind.FALLTHROUGH);
    branch(header, stmt.condition(), body, EdgeKind.TRUE_BRANCH, after);

    loops.push(new LoopTargets(after, header, EdgeKind.LOOP_BACK));
    current = body;
    buildBody(stmt.body());
    cfg.addEdge(current, header, EdgeKind.LOOP_BACK);
    loops.pop();

    current = after;
  }

  private void buildDoWhile(WhileStatement stmt) {
    BasicBlock body = cfg.newBlock();
    BasicBlock test = cfg.newBlock();
    BasicBlock after = cfg.newBlock();
    cfg.addEdge(current, body, EdgeKind.FALLTHROUGH);

    loops.push(new LoopTargets(after, test, EdgeKind.FALLTHROUGH));
    current = body;
    buildBody(stmt.body());
    cfg.addEdge(current, test, EdgeKind.FALLTHROUGH);
    loops.pop();

    branch(test, stmt.condition(), body, EdgeKind.LOOP_BACK, after);
    current = after;
  }

  /**
   * for i from a to b step s { body } becomes:
   *   i = a; while (i <= b) { body; i = i + s }
   * with continue going to the increment, which lives in its own latch
   * block.  The comparison is >= for a negative constant step.
   */
  private void buildFor(ForStatement stmt) {
    SourceSpan span = stmt.span();
    Type t = stmt.varType();
    cfg.addLoopVariable(stmt.var());
    current.addStatement(new BindStatement(stmt.var(), t, stmt.from(), span));

    BasicBlock header = cfg.newBlock();
    BasicBlock body = cfg.newBlock();
    BasicBlock latch = cfg.newBlock();
    BasicBlock after = cfg.newBlock();
    cfg.addEdge(current, header, EdgeKind.FALLTHROUGH);

    Expression step = stmt.step() != null ? stmt.step() : Literal.intLit(1, t);
    BinaryOp cmp = isNegative(step) ? BinaryOp.GTE : BinaryOp.LTE;
    Expression cond = new BinaryExpr(cmp, new VarRef(stmt.var(), t, span),
                                     stmt.to(), Types.BOOL, span);
    branch(header, cond, body, EdgeKind.TRUE_BRANCH, after);

    loops.push(new LoopTargets(after, latch, EdgeKind.FALLTHROUGH));
    current = body;
    buildBody(stmt.body());
    cfg.addEdge(current, latch, EdgeKind.FALLTHROUGH);
    loops.pop();

    Expression next = new BinaryExpr(BinaryOp.ADD,
            new VarRef(stmt.var(), t, span), step, t, span);
    latch.addStatement(new AssignStatement(stmt.var(), next, span));
    latch.setSynthetic();
    cfg.addEdge(latch, header, EdgeKind.LOOP_BACK);

    current = after;
  }

  private static boolean isNegative(Expression step) {
    Value v = ConstantFolder.fold(step);
    return v != null && v.isIntVal() && v.getIntLit().signum() < 0;
  }
}
