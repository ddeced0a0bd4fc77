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

package exm.ceva.verify.encode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.ceva.ast.ArrayStoreStatement;
import exm.ceva.ast.AssignStatement;
import exm.ceva.ast.BindStatement;
import exm.ceva.ast.CallExpr;
import exm.ceva.ast.CallStatement;
import exm.ceva.ast.ConstantFolder;
import exm.ceva.ast.ExitStatement;
import exm.ceva.ast.Expression;
import exm.ceva.ast.Expression.ExprKind;
import exm.ceva.ast.Expressions;
import exm.ceva.ast.ExternalFunction;
import exm.ceva.ast.ForStatement;
import exm.ceva.ast.Function;
import exm.ceva.ast.IfStatement;
import exm.ceva.ast.Module;
import exm.ceva.ast.Statement;
import exm.ceva.ast.Statement.StmtKind;
import exm.ceva.ast.VarRef;
import exm.ceva.ast.WhileStatement;
import exm.ceva.common.Logging;
import exm.ceva.common.exceptions.CevaRuntimeError;
import exm.ceva.common.exceptions.UnsupportedConstructException;
import exm.ceva.common.lang.Builtins;
import exm.ceva.common.lang.OpEvaluator;
import exm.ceva.common.lang.Types.Type;
import exm.ceva.common.lang.Value;
import exm.ceva.verify.ContractKind;
import exm.ceva.verify.formula.FormulaOp;
import exm.ceva.verify.formula.SideCondition;
import exm.ceva.verify.formula.Sort;
import exm.ceva.verify.formula.Term;

/**
 * Symbolic execution of a function body, splitting paths at branches.
 *
 * Each path that returns contributes its path condition and returned
 * value; the model says the result is the value of whichever path was
 * taken.  An operation that would trap (division by zero, index out of
 * bounds, overflow in trap mode) ends its path without returning.
 *
 * Where the body can't be followed exactly the model over-approximates
 * and is marked partial: calls with effects return fresh symbols, and a
 * body with too many paths constrains nothing.  A loop that isn't
 * unrolled is entered in a state where everything it may change is a
 * fresh symbol, constrained only by a proven loop invariant if there is
 * one.  From there one arbitrary iteration is followed, so that returns
 * and breaks inside the loop are part of the model, and the loop is
 * left normally with its condition false.
 */
public class BodyEncoder {

  private static final Logger logger = Logging.getCevaLogger();

  private final FormulaEncoder encoder;
  private final Module module;
  private final int unrollThreshold;
  private final int pathLimit;
  private final Map<Statement, Expression> loopInvariants;

  /**
   * @param module module callees are looked up in, may be null
   * @param unrollThreshold max iterations of a constant-bounded for
   *                  loop to unroll
   * @param pathLimit max number of live paths before giving up
   */
  public BodyEncoder(FormulaEncoder encoder, Module module,
                     int unrollThreshold, int pathLimit) {
    this(encoder, module, unrollThreshold, pathLimit,
         Collections.<Statement, Expression>emptyMap());
  }

  /**
   * @param loopInvariants invariants known to hold at the head of loops
   *        of the function, keyed by loop statement
   */
  public BodyEncoder(FormulaEncoder encoder, Module module,
                     int unrollThreshold, int pathLimit,
                     Map<Statement, Expression> loopInvariants) {
    this.encoder = encoder;
    this.module = module;
    this.unrollThreshold = unrollThreshold;
    this.pathLimit = pathLimit;
    this.loopInvariants = new IdentityHashMap<Statement, Expression>(
                                                      loopInvariants);
  }

  /**
   * @param symbols parameter and result symbols, as for the contracts
   */
  public BodyModel encode(Function f, Map<String, Term> symbols) {
    Run run = new Run(f);
    State init = new State(new LinkedHashMap<String, Term>(symbols),
                           Term.TRUE);
    init.env.remove(VarRef.RESULT);
    try {
      List<State> finalStates = run.execBody(f.body(),
                                      Collections.singletonList(init));
      if (f.returnType().isVoid()) {
        // Falling off the end is a normal return
        for (State st: finalStates) {
          run.exitPcs.add(st.pc);
          run.exitValues.add(null);
        }
      }
    } catch (PathLimitExceeded e) {
      logger.debug(f.name() + ": more than " + pathLimit + " paths");
      return BodyModel.unconstrained("more than " + pathLimit +
                                     " paths through body");
    }
    BodyModel model = run.buildModel(symbols.get(VarRef.RESULT));
    if (logger.isTraceEnabled()) {
      logger.trace("Body model of " + f.name() + ": " + model);
    }
    return model;
  }

  private static class PathLimitExceeded extends Exception {
    private static final long serialVersionUID = 1L;
  }

  /**
   * One path being followed.  Mutable: copied where paths split.
   */
  private static class State {
    final Map<String, Term> env;
    Term pc;
    boolean breaking = false;
    boolean continuing = false;

    State(Map<String, Term> env, Term pc) {
      this.env = env;
      this.pc = pc;
    }

    State copy(Term newPc) {
      State s = new State(new LinkedHashMap<String, Term>(env), newPc);
      s.breaking = breaking;
      s.continuing = continuing;
      return s;
    }

    boolean active() {
      return !breaking && !continuing;
    }

    void assume(Term fact) {
      pc = Term.and(pc, fact);
    }
  }

  /**
   * Encoding of one body
   */
  private class Run implements CallHandler {
    private final Function function;
    private final List<Term> exitPcs = new ArrayList<Term>();
    private final List<Term> exitValues = new ArrayList<Term>();
    private final List<String> partialReasons = new ArrayList<String>();
    private int freshCounter = 0;

    Run(Function function) {
      this.function = function;
    }

    void markPartial(String reason) {
      if (!partialReasons.contains(reason)) {
        partialReasons.add(reason);
      }
    }

    Term fresh(String name, Sort sort) {
      return Term.var(name + "!" + (freshCounter++), sort);
    }

    BodyModel buildModel(Term result) {
      Term returns = Term.or(exitPcs);
      Term constraint = returns;
      if (result != null && !exitPcs.isEmpty()) {
        // Last path is the default: one of the paths is always taken
        Term value = null;
        for (int i = exitPcs.size() - 1; i >= 0; i--) {
          Term v = exitValues.get(i);
          if (v == null) {
            v = fresh(VarRef.RESULT, result.sort());
          }
          value = value == null ? v : Term.ite(exitPcs.get(i), v, value);
        }
        constraint = Term.and(returns, Term.eq(result, value));
      }
      return new BodyModel(constraint, partialReasons, exitPcs.size());
    }

    List<State> execBody(List<Statement> stmts, List<State> states)
                                          throws PathLimitExceeded {
      List<State> current = states;
      for (Statement stmt: stmts) {
        List<State> next = new ArrayList<State>();
        for (State st: current) {
          if (st.active()) {
            next.addAll(exec(stmt, st));
          } else {
            next.add(st);
          }
        }
        if (next.size() > pathLimit) {
          throw new PathLimitExceeded();
        }
        current = next;
      }
      return current;
    }

    private List<State> exec(Statement stmt, State st)
                                      throws PathLimitExceeded {
      switch (stmt.kind()) {
        case BIND: {
          BindStatement b = (BindStatement)stmt;
          define(st, b.name(), b.type(), b.init());
          return Collections.singletonList(st);
        }
        case ASSIGN: {
          AssignStatement a = (AssignStatement)stmt;
          Term old = st.env.get(a.name());
          define(st, a.name(), old == null ? null : old.sort().sourceType(),
                 a.value());
          return Collections.singletonList(st);
        }
        case ARRAY_STORE:
          store(st, (ArrayStoreStatement)stmt);
          return Collections.singletonList(st);
        case IF:
          return execIf(st, (IfStatement)stmt);
        case WHILE:
        case DO_WHILE:
          return execWhile(st, (WhileStatement)stmt);
        case FOR:
          return execFor(st, (ForStatement)stmt);
        case BREAK:
          st.breaking = true;
          return Collections.singletonList(st);
        case CONTINUE:
          st.continuing = true;
          return Collections.singletonList(st);
        case RETURN: {
          Expression value = ((ExitStatement)stmt).value();
          Term v = null;
          if (value != null && !function.returnType().isVoid()) {
            v = eval(value, st, sortOf(function.returnType()));
          }
          exitPcs.add(st.pc);
          exitValues.add(v);
          return Collections.emptyList();
        }
        case THROW:
          return Collections.emptyList();
        case CALL:
          execCall(st, ((CallStatement)stmt).call());
          return Collections.singletonList(st);
        case UNKNOWN:
          markPartial("unknown statement at " + stmt.span());
          havoc(st, new ArrayList<String>(st.env.keySet()));
          return Collections.singletonList(st);
        default:
          throw new CevaRuntimeError("Unexpected statement " + stmt.kind());
      }
    }

    /**
     * Bind name to the value of init, or to a fresh symbol if it has no
     * initializer or can't be encoded
     */
    private void define(State st, String name, Type type, Expression init) {
      Sort sort = type == null ? null : sortOf(type);
      Term value = null;
      if (init != null) {
        value = eval(init, st, sort);
      }
      if (value == null && sort != null) {
        value = fresh(name, sort);
      }
      if (value == null) {
        st.env.remove(name);
      } else {
        st.env.put(name, value);
      }
      if (sort != null && sort.isArray()) {
        Term len = init != null && init.kind() == ExprKind.VARIABLE
            ? st.env.get(((VarRef)init).name() + FormulaEncoder.LENGTH_SUFFIX)
            : null;
        st.env.put(name + FormulaEncoder.LENGTH_SUFFIX,
            len != null ? len : fresh(name + FormulaEncoder.LENGTH_SUFFIX,
                                      Sort.INDEX));
      }
    }

    private void store(State st, ArrayStoreStatement store) {
      String name = store.arrayName();
      Term arr = st.env.get(name);
      Term len = st.env.get(name + FormulaEncoder.LENGTH_SUFFIX);
      if (arr == null || len == null || !arr.sort().isArray()) {
        markPartial("store to '" + name + "' at " + store.span());
        return;
      }
      Term index = eval(store.index(), st, null);
      Term value = eval(store.value(), st, arr.sort().elemSort());
      if (index == null || value == null || !index.sort().isBitVec()) {
        st.env.put(name, fresh(name, arr.sort()));
        return;
      }
      Term i = FormulaEncoder.inIndexSort(index);
      st.assume(Term.and(Term.le(Term.intConst(0, Sort.INDEX), i),
                         Term.lt(i, len)));
      st.env.put(name, Term.app(FormulaOp.STORE, arr.sort(), arr, i, value));
    }

    private List<State> execIf(State st, IfStatement stmt)
                                      throws PathLimitExceeded {
      Term c = eval(stmt.condition(), st, Sort.BOOL);
      List<State> result = new ArrayList<State>();
      if (c == null) {
        result.addAll(execBody(stmt.thenBody(),
                        Collections.singletonList(st.copy(st.pc))));
        result.addAll(execBody(stmt.elseBody(),
                        Collections.singletonList(st)));
        return result;
      }
      if (!c.isFalse()) {
        result.addAll(execBody(stmt.thenBody(), Collections.singletonList(
                        st.copy(Term.and(st.pc, c)))));
      }
      if (!c.isTrue()) {
        st.pc = Term.and(st.pc, Term.not(c));
        result.addAll(execBody(stmt.elseBody(),
                               Collections.singletonList(st)));
      }
      return result;
    }

    private List<State> execWhile(State st, WhileStatement loop)
                                      throws PathLimitExceeded {
      Boolean cond = ConstantFolder.foldCondition(loop.condition());
      if (cond != null && !cond) {
        if (loop.testFirst()) {
          return Collections.singletonList(st);
        }
        // do-while (false): body runs once
        return leaveLoop(execBody(loop.body(),
                                  Collections.singletonList(st)));
      }
      widenLoop(st, loop, loop.body(), null);
      State iter = st.copy(st.pc);
      if (loop.testFirst()) {
        Term c = eval(loop.condition(), iter, Sort.BOOL);
        if (c != null) {
          iter.assume(c);
        }
      }
      Term c = eval(loop.condition(), st, Sort.BOOL);
      if (c != null) {
        st.assume(Term.not(c));
      }
      return exits(st, execBody(loop.body(),
                                Collections.singletonList(iter)));
    }

    private List<State> execFor(State st, ForStatement loop)
                                      throws PathLimitExceeded {
      Sort varSort = sortOf(loop.varType());
      Value from = ConstantFolder.fold(loop.from());
      Value to = ConstantFolder.fold(loop.to());
      Value step = loop.step() == null ? Value.createIntLit(1)
                                       : ConstantFolder.fold(loop.step());
      if (varSort != null && varSort.isBitVec() && isInt(from) &&
          isInt(to) && isInt(step) && step.getIntLit().signum() != 0) {
        BigInteger n = iterations(from.getIntLit(), to.getIntLit(),
                                  step.getIntLit());
        if (n.compareTo(BigInteger.valueOf(unrollThreshold)) <= 0) {
          return unroll(st, loop, varSort, from.getIntLit(), n.intValue(),
                        step.getIntLit());
        }
      }

      if (varSort != null) {
        // Evaluated for its side conditions
        eval(loop.from(), st, varSort);
      }
      widenLoop(st, loop, loop.body(), loop.var());
      // The bound is tested again before each iteration
      Term var = st.env.get(loop.var());
      Term toTerm = varSort == null ? null : eval(loop.to(), st, varSort);
      boolean descending = step != null && step.isIntVal() &&
                           step.getIntLit().signum() < 0;
      State iter = st.copy(st.pc);
      if (var != null && toTerm != null && var.sort().isBitVec()) {
        if (descending) {
          iter.assume(Term.le(toTerm, var));
          st.assume(Term.lt(var, toTerm));
        } else {
          iter.assume(Term.le(var, toTerm));
          st.assume(Term.lt(toTerm, var));
        }
      }
      return exits(st, execBody(loop.body(),
                                Collections.singletonList(iter)));
    }

    private List<State> unroll(State st, ForStatement loop, Sort varSort,
        BigInteger from, int iterations, BigInteger step)
                                        throws PathLimitExceeded {
      List<State> running = Collections.singletonList(st);
      List<State> exited = new ArrayList<State>();
      BigInteger v = from;
      Type varType = varSort.sourceType();
      for (int i = 0; i < iterations; i++) {
        for (State s: running) {
          s.env.put(loop.var(), Term.intConst(OpEvaluator.wrap(v, varType),
                                              varSort));
        }
        running = execBody(loop.body(), running);
        List<State> next = new ArrayList<State>();
        for (State s: running) {
          if (s.breaking) {
            s.breaking = false;
            exited.add(s);
          } else {
            s.continuing = false;
            next.add(s);
          }
        }
        running = next;
        v = v.add(step);
      }
      for (State s: running) {
        s.env.put(loop.var(), Term.intConst(OpEvaluator.wrap(v, varType),
                                            varSort));
      }
      List<State> result = new ArrayList<State>(running);
      result.addAll(exited);
      return result;
    }

    private List<State> leaveLoop(List<State> states) {
      for (State s: states) {
        s.breaking = false;
        s.continuing = false;
      }
      return states;
    }

    /**
     * States after a widened loop: the normal exit, plus the states that
     * broke out of the iteration that was followed.  Iterations that
     * complete go back to the head, which the widened state covers.
     */
    private List<State> exits(State normalExit, List<State> iteration) {
      List<State> result = new ArrayList<State>();
      if (!normalExit.pc.isFalse()) {
        result.add(normalExit);
      }
      for (State s: iteration) {
        if (s.breaking && !s.pc.isFalse()) {
          s.breaking = false;
          result.add(s);
        }
      }
      return result;
    }

    /**
     * Forget everything the loop may change
     */
    private void widenLoop(State st, Statement loop, List<Statement> body,
                           String loopVar) {
      markPartial("loop at " + loop.span() + " not unrolled");
      Set<String> changed = new LinkedHashSet<String>();
      if (Expressions.containsKind(body, StmtKind.UNKNOWN)) {
        changed.addAll(st.env.keySet());
      } else {
        changed.addAll(Expressions.assignedVars(body));
        for (String name: redefinedVars(body)) {
          changed.add(name + FormulaEncoder.LENGTH_SUFFIX);
        }
        changed.addAll(effectArrays(Expressions.callsInBody(body)));
      }
      if (loopVar != null) {
        changed.add(loopVar);
        if (!st.env.containsKey(loopVar)) {
          Sort s = sortOf(((ForStatement)loop).varType());
          if (s != null) {
            st.env.put(loopVar, fresh(loopVar, s));
          }
        }
      }
      havoc(st, changed);

      Expression invariant = loopInvariants.get(loop);
      if (invariant != null) {
        Term inv = eval(invariant, st, Sort.BOOL);
        if (inv != null) {
          st.assume(inv);
        }
      }
    }

    private void havoc(State st, Collection<String> names) {
      for (String name: names) {
        Term old = st.env.get(name);
        if (old != null) {
          st.env.put(name, fresh(name, old.sort()));
        }
      }
    }

    /**
     * Arrays passed to calls that may modify them
     */
    private List<String> effectArrays(List<CallExpr> calls) {
      List<String> result = new ArrayList<String>();
      for (CallExpr call: calls) {
        if (isPure(call.target())) {
          continue;
        }
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

    private void execCall(State st, CallExpr call) {
      for (Expression arg: call.args()) {
        eval(arg, st, null);
      }
      if (!isPure(call.target())) {
        markPartial("call to '" + call.target() + "' may have effects");
        havoc(st, effectArrays(Collections.singletonList(call)));
      }
    }

    /**
     * Encode e in the state's environment.  Conditions for e to be
     * defined are added to the path condition.
     * @param target sort to convert integer results to, or null
     * @return the term, or null if e can't be encoded
     */
    private Term eval(Expression e, State st, Sort target) {
      EncodeContext ctx = new EncodeContext(st.env, this, st.pc);
      Term t;
      try {
        t = encoder.encode(e, ctx);
      } catch (UnsupportedConstructException ex) {
        markPartial(ex.getMessage() + " at " + e.span());
        havoc(st, effectArrays(Expressions.calls(e)));
        return null;
      }
      havoc(st, effectArrays(Expressions.calls(e)));
      for (String reason: ctx.partialReasons()) {
        markPartial(reason);
      }
      for (SideCondition sc: ctx.sideConditions()) {
        st.assume(sc.asTerm());
      }
      for (Term fact: ctx.assumptions()) {
        st.assume(fact);
      }
      if (target == null || t.sort().equals(target)) {
        return t;
      } else if (t.sort().isBitVec() && target.isBitVec()) {
        return FormulaEncoder.coerce(t, target);
      }
      markPartial("value of sort " + t.sort() + " where " + target +
                  " expected at " + e.span());
      return null;
    }

    @Override
    public Term encodeCall(CallExpr call, List<Term> args, Sort sort,
          EncodeContext ctx) throws UnsupportedConstructException {
      if (sort == null) {
        throw new UnsupportedConstructException(call.span(),
              "value of call to '" + call.target() + "' without result");
      }
      if (!isPure(call.target())) {
        ctx.markPartial("call to '" + call.target() + "' may have effects");
        return fresh(call.target(), sort);
      }
      Term app = Term.call(call.target(), sort, args);
      Function callee = module == null ? null
                                       : module.lookupFunction(call.target());
      if (callee == null || !constrainCall(callee, call, args, app, ctx)) {
        ctx.markPartial("result of '" + call.target() + "' is unconstrained");
      }
      return app;
    }

    /**
     * Assume the callee's postconditions for this call, provided its
     * preconditions hold
     * @return true if at least one postcondition could be assumed
     */
    private boolean constrainCall(Function callee, CallExpr call,
                  List<Term> args, Term app, EncodeContext ctx) {
      if (callee.params().size() != args.size()) {
        return false;
      }
      Map<String, Term> syms = FormulaEncoder.signatureSymbols(callee);
      Map<String, Term> bound = new LinkedHashMap<String, Term>();
      for (int i = 0; i < args.size(); i++) {
        String pname = callee.params().get(i).name();
        Term psym = syms.get(pname);
        Term arg = args.get(i);
        if (psym == null) {
          continue;
        }
        if (psym.sort().isBitVec() && arg.sort().isBitVec()) {
          bound.put(pname, FormulaEncoder.coerce(arg, psym.sort()));
        } else if (psym.sort().equals(arg.sort())) {
          bound.put(pname, arg);
        }
        Expression argExpr = call.args().get(i);
        if (psym.sort().isArray() && argExpr.kind() == ExprKind.VARIABLE) {
          Term len = ctx.lookup(((VarRef)argExpr).name() +
                                FormulaEncoder.LENGTH_SUFFIX);
          if (len != null) {
            bound.put(pname + FormulaEncoder.LENGTH_SUFFIX, len);
          }
        }
      }
      bound.put(VarRef.RESULT, app);

      List<Term> pres = new ArrayList<Term>();
      for (int i = 0; i < callee.preconditions().size(); i++) {
        EncodedContract pre = encoder.encodeContract(callee, bound,
            callee.preconditions().get(i), ContractKind.PRECONDITION, i);
        if (!pre.isSupported()) {
          // Assuming the postconditions without all preconditions
          // would be unsound
          return false;
        }
        pres.add(pre.formula().formula());
      }
      List<Term> posts = new ArrayList<Term>();
      for (int i = 0; i < callee.postconditions().size(); i++) {
        EncodedContract post = encoder.encodeContract(callee, bound,
            callee.postconditions().get(i), ContractKind.POSTCONDITION, i);
        if (post.isSupported()) {
          posts.add(post.formula().formula());
        }
      }
      if (posts.isEmpty()) {
        return false;
      }
      ctx.assume(Term.implies(Term.and(pres), Term.and(posts)));
      return true;
    }

    private boolean isPure(String target) {
      if (Builtins.isBuiltin(target)) {
        return true;
      } else if (module == null) {
        return false;
      }
      Function g = module.lookupFunction(target);
      if (g != null) {
        return g.isPure();
      }
      ExternalFunction ext = module.lookupExternal(target);
      return ext != null && ext.isPure();
    }
  }

  /**
   * Variables bound or assigned anywhere in body, not counting stores
   * into arrays
   */
  private static Set<String> redefinedVars(List<Statement> body) {
    Set<String> result = new LinkedHashSet<String>();
    for (Statement stmt: body) {
      String def = Expressions.definedVar(stmt);
      if (def != null) {
        result.add(def);
      }
      for (List<Statement> nested: stmt.bodies()) {
        result.addAll(redefinedVars(nested));
      }
    }
    return result;
  }

  private static Sort sortOf(Type type) {
    try {
      return Sort.forType(type, null);
    } catch (UnsupportedConstructException e) {
      return null;
    }
  }

  private static boolean isInt(Value v) {
    return v != null && v.isIntVal();
  }

  /**
   * Number of iterations of for (i = from; i <= to (>= if step < 0);
   * i += step)
   */
  static BigInteger iterations(BigInteger from, BigInteger to,
                               BigInteger step) {
    BigInteger span = step.signum() > 0 ? to.subtract(from)
                                        : from.subtract(to);
    if (span.signum() < 0) {
      return BigInteger.ZERO;
    }
    return span.divide(step.abs()).add(BigInteger.ONE);
  }
}
