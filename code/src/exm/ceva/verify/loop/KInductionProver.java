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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.ceva.ast.Expression;
import exm.ceva.ast.Expressions;
import exm.ceva.ast.SExpressions;
import exm.ceva.ast.VarRef;
import exm.ceva.common.Logging;
import exm.ceva.common.exceptions.UnsupportedConstructException;
import exm.ceva.common.lang.Types.Type;
import exm.ceva.verify.SolverResult;
import exm.ceva.verify.SolverSession;
import exm.ceva.verify.encode.EncodeContext;
import exm.ceva.verify.encode.FormulaEncoder;
import exm.ceva.verify.formula.SideCondition;
import exm.ceva.verify.formula.Sort;
import exm.ceva.verify.formula.Term;

/**
 * Proves a candidate loop invariant by k-induction, for k = 1 up to a
 * bound.
 *
 * State i of the loop maps each variable the loop modifies to its own
 * symbol, and every other variable to one symbol shared by all states.
 * Only the induction variable is related between states; everything
 * else the loop modifies is unconstrained.  For each k:
 * <ul>
 * <li>base case: the candidate holds in state k-1 of every run that
 *     starts from the entry value and takes k-1 iterations;</li>
 * <li>inductive step: if it holds in k consecutive states linked by
 *     iterations, it holds in the next one.</li>
 * </ul>
 * Evaluations that would trap are assumed not to happen: a run that traps
 * never reaches the head again.
 */
class KInductionProver {
  private static final Logger logger = Logging.getCevaLogger();

  static enum Verdict {
    PROVEN,
    /** The base case has a counterexample: not an invariant */
    REFUTED,
    UNKNOWN,
    /** Some expression involved can't be encoded */
    UNSUPPORTED,
  }

  static class Result {
    final Verdict verdict;
    final int k;
    final String reason;

    private Result(Verdict verdict, int k, String reason) {
      this.verdict = verdict;
      this.k = k;
      this.reason = reason;
    }

    @Override
    public String toString() {
      return verdict + (verdict == Verdict.PROVEN ? " k=" + k
                                                  : ": " + reason);
    }
  }

  private final FormulaEncoder encoder;
  private final SolverSession session;
  private final int maxK;
  private int checks = 0;

  KInductionProver(FormulaEncoder encoder, SolverSession session, int maxK) {
    this.encoder = encoder;
    this.session = session;
    this.maxK = maxK;
  }

  /**
   * @return number of solver checks made
   */
  int checks() {
    return checks;
  }

  Result prove(InductionLoop loop, Expression candidate) {
    Map<String, Type> vars = variables(loop, candidate);
    List<Map<String, Term>> states = new ArrayList<Map<String, Term>>();
    List<Term> init = new ArrayList<Term>();
    /* Facts linking state i to state i+1 */
    List<List<Term>> iterations = new ArrayList<List<Term>>();
    List<Term> invariants = new ArrayList<Term>();
    /* Definedness of invariant i */
    List<List<Term>> invariantFacts = new ArrayList<List<Term>>();
    try {
      for (int i = 0; i <= maxK; i++) {
        states.add(state(loop, vars, i));
      }
      Term v0 = states.get(0).get(loop.var());
      Term entry = encode(loop.entry(), states.get(0), init);
      if (!entry.sort().isBitVec() || !v0.sort().isBitVec()) {
        throw new UnsupportedConstructException(loop.entry().span(),
                                  "non-integer induction variable");
      }
      init.add(Term.eq(v0, FormulaEncoder.coerce(entry, v0.sort())));
      for (int i = 0; i < maxK; i++) {
        iterations.add(iteration(loop, states.get(i), states.get(i + 1)));
      }
      for (int i = 0; i <= maxK; i++) {
        List<Term> facts = new ArrayList<Term>();
        Term inv = encode(candidate, states.get(i), facts);
        if (!inv.sort().isBool()) {
          throw new UnsupportedConstructException(candidate.span(),
                                  "invariant is not a boolean expression");
        }
        invariants.add(inv);
        invariantFacts.add(facts);
      }
    } catch (UnsupportedConstructException e) {
      logger.debug("k-induction on " + SExpressions.print(candidate) +
                   ": " + e.getMessage());
      return new Result(Verdict.UNSUPPORTED, 0, e.getMessage());
    }

    String unknown = null;
    for (int k = 1; k <= maxK; k++) {
      List<Term> base = new ArrayList<Term>(init);
      for (int i = 0; i < k - 1; i++) {
        base.addAll(iterations.get(i));
      }
      base.addAll(invariantFacts.get(k - 1));
      base.add(Term.not(invariants.get(k - 1)));
      SolverResult r = check(base);
      if (r.isSat()) {
        return new Result(Verdict.REFUTED, k, "fails after " + (k - 1) +
                          " iteration(s)");
      } else if (!r.isUnsat()) {
        return new Result(Verdict.UNKNOWN, k, "solver returned unknown: " +
                          r.reason());
      }

      List<Term> step = new ArrayList<Term>();
      for (int i = 0; i < k; i++) {
        step.addAll(invariantFacts.get(i));
        step.add(invariants.get(i));
        step.addAll(iterations.get(i));
      }
      step.addAll(invariantFacts.get(k));
      step.add(Term.not(invariants.get(k)));
      r = check(step);
      if (r.isUnsat()) {
        return new Result(Verdict.PROVEN, k, null);
      } else if (!r.isSat()) {
        unknown = "solver returned unknown: " + r.reason();
      }
    }
    if (unknown != null) {
      return new Result(Verdict.UNKNOWN, maxK, unknown);
    }
    return new Result(Verdict.UNKNOWN, maxK, "not " + maxK + "-inductive");
  }

  /**
   * Variables referred to by the loop and the candidate, with their types
   */
  private static Map<String, Type> variables(InductionLoop loop,
                                             Expression candidate) {
    Map<String, Type> vars = new LinkedHashMap<String, Type>();
    vars.put(loop.var(), loop.varType());
    List<Expression> exprs = new ArrayList<Expression>();
    exprs.add(loop.entry());
    exprs.add(loop.update());
    exprs.add(candidate);
    if (loop.guard() != null) {
      exprs.add(loop.guard());
    }
    for (Expression e: exprs) {
      for (VarRef ref: Expressions.varRefs(e)) {
        if (!vars.containsKey(ref.name())) {
          vars.put(ref.name(), ref.type());
        }
      }
    }
    return vars;
  }

  private static Map<String, Term> state(InductionLoop loop,
        Map<String, Type> vars, int i) throws UnsupportedConstructException {
    Map<String, Term> env = new LinkedHashMap<String, Term>();
    for (Map.Entry<String, Type> e: vars.entrySet()) {
      String name = e.getKey();
      Sort sort = Sort.forType(e.getValue(), loop.loop().span());
      String sym = loop.modified().contains(name) ? name + "@" + i : name;
      env.put(name, Term.var(sym, sort));
      if (sort.isArray()) {
        env.put(name + FormulaEncoder.LENGTH_SUFFIX,
                Term.var(sym + FormulaEncoder.LENGTH_SUFFIX, Sort.INDEX));
      }
    }
    return env;
  }

  /**
   * Facts for one iteration from state "from" to state "to"
   */
  private List<Term> iteration(InductionLoop loop, Map<String, Term> from,
          Map<String, Term> to) throws UnsupportedConstructException {
    List<Term> facts = new ArrayList<Term>();
    if (loop.guard() != null) {
      Term g = encode(loop.guard(), from, facts);
      if (!g.sort().isBool()) {
        throw new UnsupportedConstructException(loop.guard().span(),
                                  "loop condition is not boolean");
      }
      facts.add(g);
    }
    Term next = encode(loop.update(), from, facts);
    Term v = to.get(loop.var());
    if (!next.sort().isBitVec()) {
      throw new UnsupportedConstructException(loop.update().span(),
                                  "non-integer update of " + loop.var());
    }
    facts.add(Term.eq(v, FormulaEncoder.coerce(next, v.sort())));
    return facts;
  }

  /**
   * Encode e, adding what it takes for e to be defined to facts
   */
  private Term encode(Expression e, Map<String, Term> env, List<Term> facts)
                                  throws UnsupportedConstructException {
    EncodeContext ctx = new EncodeContext(env);
    Term t = encoder.encode(e, ctx);
    if (ctx.isPartial()) {
      throw new UnsupportedConstructException(e.span(),
          "partial encoding: " + ctx.partialReasons());
    }
    for (SideCondition sc: ctx.sideConditions()) {
      facts.add(sc.asTerm());
    }
    facts.addAll(ctx.assumptions());
    return t;
  }

  private SolverResult check(List<Term> assertions) {
    checks++;
    SolverResult r = session.check(assertions,
                                   Collections.<Term>emptyList());
    if (logger.isTraceEnabled()) {
      logger.trace("k-induction check " + checks + ": " + r);
    }
    return r;
  }
}
