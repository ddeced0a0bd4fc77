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


package exm.ceva.verify.loop;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.ceva.ast.AssignStatement;
import exm.ceva.ast.BinaryExpr;
import exm.ceva.ast.CallExpr;
import exm.ceva.ast.ConstantFolder;
import exm.ceva.ast.Expression;
import exm.ceva.ast.Expression.ExprKind;
import exm.ceva.ast.Expressions;
import exm.ceva.ast.ForStatement;
import exm.ceva.ast.Function;
import exm.ceva.ast.Literal;
import exm.ceva.ast.Statement;
import exm.ceva.ast.Statement.StmtKind;
import exm.ceva.ast.VarRef;
import exm.ceva.ast.WhileStatement;
import exm.ceva.common.Logging;
import exm.ceva.common.lang.IntegerMode;
import exm.ceva.common.lang.OpEvaluator;
import exm.ceva.common.lang.Operators.BinaryOp;
import exm.ceva.common.lang.Types;
import exm.ceva.common.lang.Types.Type;
import exm.ceva.common.lang.Value;
import exm.ceva.verify.SolverBackend;
import exm.ceva.verify.SolverSession;
import exm.ceva.verify.encode.FormulaEncoder;
import exm.ceva.verify.loop.KInductionProver.Result;
import exm.ceva.verify.loop.KInductionProver.Verdict;

/**
 * Finds invariants of loop induction variables by k-induction.
 *
 * A loop has an induction variable v if each iteration adds the same
 * constant to it:
 * <ul>
 * <li>for loops with a constant step whose body doesn't assign the loop
 *     variable;</li>
 * <li>while loops whose body assigns v exactly once, at its top level,
 *     as (+ v c) or (- v c), and has no continue.  The entry value of v
 *     must be a constant assigned earlier in the same block.</li>
 * </ul>
 * Loops containing unknown statements are skipped.
 *
 * Candidates only refer to v and to variables the loop doesn't modify:
 * v stays on the side of its entry value that the step moves it to, and
 * for unit steps under a strict bound, v doesn't pass the bound.
 * The conjunction of the candidates proven is the loop's invariant.
 */
public class LoopInvariantSynthesizer {
  private static final Logger logger = Logging.getCevaLogger();

  private final SolverBackend backend;
  private final FormulaEncoder encoder;
  private final int maxK;
  private final long timeoutMs;

  public LoopInvariantSynthesizer(SolverBackend backend, IntegerMode mode,
                                  int maxK, long timeoutMs) {
    this.backend = backend;
    this.encoder = new FormulaEncoder(mode);
    this.maxK = maxK;
    this.timeoutMs = timeoutMs;
  }

  public int maxK() {
    return maxK;
  }

  /**
   * @return one result per loop with an induction variable, in source
   *         order.  Empty if the solver is unavailable.
   */
  public List<LoopInvariant> synthesize(Function f) {
    List<InductionLoop> loops = new ArrayList<InductionLoop>();
    findLoops(f.body(), loops);
    if (loops.isEmpty() || !backend.isAvailable()) {
      return Collections.emptyList();
    }
    List<LoopInvariant> result = new ArrayList<LoopInvariant>();
    SolverSession session = backend.openSession(timeoutMs);
    try {
      KInductionProver prover = new KInductionProver(encoder, session, maxK);
      for (InductionLoop loop: loops) {
        LoopInvariant inv = synthesize(loop, prover);
        if (inv != null) {
          if (logger.isDebugEnabled()) {
            logger.debug(f.name() + ": " + inv);
          }
          result.add(inv);
        }
      }
    } finally {
      session.close();
    }
    return result;
  }

  /**
   * @return null if none of the candidates could be encoded
   */
  private LoopInvariant synthesize(InductionLoop loop,
                                   KInductionProver prover) {
    List<Expression> candidates = candidates(loop);
    List<Expression> proven = new ArrayList<Expression>();
    int k = 0;
    String reason = null;
    boolean supported = false;
    for (Expression c: candidates) {
      Result r = prover.prove(loop, c);
      if (r.verdict != Verdict.UNSUPPORTED) {
        supported = true;
      }
      if (r.verdict == Verdict.PROVEN) {
        proven.add(c);
        k = Math.max(k, r.k);
      } else if (reason == null && r.verdict != Verdict.UNSUPPORTED) {
        reason = r.reason;
      }
    }
    if (proven.isEmpty() && candidates.size() > 1) {
      // Together they may be inductive when neither is alone
      Expression all = conjunction(candidates, loop);
      Result r = prover.prove(loop, all);
      if (r.verdict == Verdict.PROVEN) {
        proven.add(all);
        k = r.k;
      }
    }
    if (!supported) {
      return null;
    } else if (proven.isEmpty()) {
      return LoopInvariant.unknown(loop.loop(), loop.var(), reason);
    }
    return LoopInvariant.proven(loop.loop(), loop.var(),
                                conjunction(proven, loop), k);
  }

  /**
   * Invariants to assume at loop heads when modelling a body
   */
  public static Map<Statement, Expression> provenInvariants(
                                          List<LoopInvariant> results) {
    Map<Statement, Expression> map =
                          new IdentityHashMap<Statement, Expression>();
    for (LoopInvariant inv: results) {
      if (inv.isProven()) {
        map.put(inv.loop(), inv.invariant());
      }
    }
    return map;
  }

  static List<Expression> candidates(InductionLoop loop) {
    List<Expression> result = new ArrayList<Expression>();
    VarRef v = loop.varRef();
    boolean up = loop.ascending();
    result.add(compare(up ? BinaryOp.GTE : BinaryOp.LTE, v, loop.entry(),
                       loop));
    Expression bound = strictBound(loop);
    if (bound != null && loop.step().abs().equals(BigInteger.ONE)) {
      Expression within = compare(up ? BinaryOp.LTE : BinaryOp.GTE, v,
                                  bound, loop);
      Expression atEntry = compare(BinaryOp.EQ, v, loop.entry(), loop);
      result.add(new BinaryExpr(BinaryOp.OR, within, atEntry, Types.BOOL,
                                loop.loop().span()));
    }
    return result;
  }

  private static Expression compare(BinaryOp op, Expression l,
                                    Expression r, InductionLoop loop) {
    return new BinaryExpr(op, l, r, Types.BOOL, loop.loop().span());
  }

  private static Expression conjunction(List<Expression> parts,
                                        InductionLoop loop) {
    Expression acc = parts.get(0);
    for (int i = 1; i < parts.size(); i++) {
      acc = new BinaryExpr(BinaryOp.AND, acc, parts.get(i), Types.BOOL,
                           loop.loop().span());
    }
    return acc;
  }

  /**
   * @return b if the loop condition is v < b going up, or v > b going
   *         down, with b not modified by the loop; else null
   */
  private static Expression strictBound(InductionLoop loop) {
    Expression guard = loop.guard();
    if (guard == null || guard.kind() != ExprKind.BINARY) {
      return null;
    }
    BinaryExpr b = (BinaryExpr)guard;
    BinaryOp toward = loop.ascending() ? BinaryOp.LT : BinaryOp.GT;
    BinaryOp away = loop.ascending() ? BinaryOp.GT : BinaryOp.LT;
    Expression bound;
    if (b.op() == toward && isVar(b.left(), loop.var())) {
      bound = b.right();
    } else if (b.op() == away && isVar(b.right(), loop.var())) {
      bound = b.left();
    } else {
      return null;
    }
    if (!Collections.disjoint(Expressions.varNames(bound),
                              loop.modified())) {
      return null;
    }
    return bound;
  }

  private static boolean isVar(Expression e, String name) {
    return e.kind() == ExprKind.VARIABLE && ((VarRef)e).name().equals(name);
  }

  /* -- finding induction variables -- */

  static void findLoops(List<Statement> body, List<InductionLoop> out) {
    for (int i = 0; i < body.size(); i++) {
      Statement stmt = body.get(i);
      InductionLoop loop = null;
      if (stmt.kind() == StmtKind.FOR) {
        loop = forLoop((ForStatement)stmt);
      } else if (stmt.kind() == StmtKind.WHILE ||
                 stmt.kind() == StmtKind.DO_WHILE) {
        loop = whileLoop((WhileStatement)stmt, body.subList(0, i));
      }
      if (loop != null) {
        out.add(loop);
      }
      for (List<Statement> nested: stmt.bodies()) {
        findLoops(nested, out);
      }
    }
  }

  private static InductionLoop forLoop(ForStatement loop) {
    if (!loop.varType().isInteger() ||
        Expressions.containsKind(loop.body(), StmtKind.UNKNOWN)) {
      return null;
    }
    Set<String> modified = modifiedVars(loop.body());
    if (modified.contains(loop.var())) {
      return null;
    }
    modified.add(loop.var());
    Expression stepExpr = loop.step() != null ? loop.step()
                                  : Literal.intLit(1, loop.varType());
    Value step = ConstantFolder.fold(stepExpr);
    if (step == null || !step.isIntVal() || step.getIntLit().signum() == 0) {
      return null;
    }
    if (!Collections.disjoint(Expressions.varNames(loop.from()), modified)) {
      return null;
    }
    VarRef v = new VarRef(loop.var(), loop.varType(), loop.span());
    Expression guard;
    if (step.getIntLit().signum() > 0) {
      guard = new BinaryExpr(BinaryOp.LTE, v, loop.to(), Types.BOOL,
                             loop.span());
    } else {
      guard = new BinaryExpr(BinaryOp.LTE, loop.to(), v, Types.BOOL,
                             loop.span());
    }
    Expression update = new BinaryExpr(BinaryOp.ADD, v, stepExpr,
                                       loop.varType(), loop.span());
    return new InductionLoop(loop, loop.var(), loop.varType(), loop.from(),
                             guard, update, step.getIntLit(), modified);
  }

  private static InductionLoop whileLoop(WhileStatement loop,
                                         List<Statement> before) {
    List<Statement> body = loop.body();
    if (Expressions.containsKind(body, StmtKind.UNKNOWN) ||
        Expressions.containsKind(body, StmtKind.CONTINUE)) {
      return null;
    }
    for (Statement stmt: body) {
      if (stmt.kind() != StmtKind.ASSIGN) {
        continue;
      }
      AssignStatement a = (AssignStatement)stmt;
      BigInteger step = constantStep(a);
      if (step == null || countDefinitions(body, a.name()) != 1) {
        continue;
      }
      Type type = null;
      for (VarRef ref: Expressions.varRefs(a.value())) {
        if (ref.name().equals(a.name())) {
          type = ref.type();
        }
      }
      if (type == null || !type.isInteger()) {
        continue;
      }
      Expression entry = entryValue(before, a.name(), type);
      if (entry == null) {
        continue;
      }
      return new InductionLoop(loop, a.name(), type, entry,
                        loop.testFirst() ? loop.condition() : null,
                        a.value(), step, modifiedVars(body));
    }
    return null;
  }

  /**
   * @return c for v := v + c, v := c + v or -c for v := v - c, where c is
   *         a non-zero constant; else null
   */
  private static BigInteger constantStep(AssignStatement a) {
    if (a.value().kind() != ExprKind.BINARY) {
      return null;
    }
    BinaryExpr b = (BinaryExpr)a.value();
    Expression other;
    if (isVar(b.left(), a.name())) {
      other = b.right();
    } else if (b.op() == BinaryOp.ADD && isVar(b.right(), a.name())) {
      other = b.left();
    } else {
      return null;
    }
    Value c = ConstantFolder.fold(other);
    if (c == null || !c.isIntVal() || c.getIntLit().signum() == 0) {
      return null;
    }
    if (b.op() == BinaryOp.ADD) {
      return c.getIntLit();
    } else if (b.op() == BinaryOp.SUB) {
      return c.getIntLit().negate();
    }
    return null;
  }

  /**
   * Constant last stored in name by the statements before a loop, if no
   * later statement may change it
   */
  private static Expression entryValue(List<Statement> before, String name,
                                       Type type) {
    for (int i = before.size() - 1; i >= 0; i--) {
      Statement stmt = before.get(i);
      if (stmt.kind() == StmtKind.UNKNOWN) {
        return null;
      }
      if (name.equals(Expressions.definedVar(stmt))) {
        Expression init = Expressions.storedValue(stmt);
        Value v = init == null ? null : ConstantFolder.fold(init);
        if (v == null || !v.isIntVal()) {
          return null;
        }
        return new Literal(Value.createIntLit(
                OpEvaluator.wrap(v.getIntLit(), type)), type, stmt.span());
      }
      if (Expressions.assignedVars(Collections.singletonList(stmt))
                     .contains(name)) {
        return null;
      }
    }
    return null;
  }

  private static int countDefinitions(List<Statement> body, String name) {
    int n = 0;
    for (Statement stmt: body) {
      if (name.equals(Expressions.definedVar(stmt)) ||
          (stmt.kind() == StmtKind.FOR &&
           ((ForStatement)stmt).var().equals(name))) {
        n++;
      }
      for (List<Statement> nested: stmt.bodies()) {
        n += countDefinitions(nested, name);
      }
    }
    return n;
  }

  /**
   * Variables a loop body may change: those assigned or stored into, and
   * arrays passed to calls
   */
  private static Set<String> modifiedVars(List<Statement> body) {
    Set<String> result = new LinkedHashSet<String>(
                                  Expressions.assignedVars(body));
    for (CallExpr call: Expressions.callsInBody(body)) {
      List<Expression> passed = new ArrayList<Expression>(call.args());
      if (call.receiver() != null) {
        passed.add(call.receiver());
      }
      for (Expression arg: passed) {
        if (arg.kind() == ExprKind.VARIABLE && arg.type().isArray()) {
          result.add(((VarRef)arg).name());
        }
      }
    }
    return result;
  }
}
