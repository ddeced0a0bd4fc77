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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.log4j.Logger;

import exm.ceva.ast.Expression;
import exm.ceva.ast.Function;
import exm.ceva.ast.Module;
import exm.ceva.ast.Statement;
import exm.ceva.ast.VarRef;
import exm.ceva.common.Logging;
import exm.ceva.common.lang.IntegerMode;
import exm.ceva.common.lang.Value;
import exm.ceva.verify.encode.BodyEncoder;
import exm.ceva.verify.encode.BodyModel;
import exm.ceva.verify.encode.EncodedContract;
import exm.ceva.verify.encode.FormulaEncoder;
import exm.ceva.verify.formula.ContractFormula;
import exm.ceva.verify.formula.SideCondition;
import exm.ceva.verify.formula.Sort;
import exm.ceva.verify.formula.Term;

/**
 * Proves or refutes the contracts of a function.
 *
 * Preconditions are axioms of the function.  Each precondition is
 * checked for consistency with the others: it is only disproven if the
 * preconditions together are unsatisfiable and the precondition can be
 * violated on its own.
 *
 * Postconditions are checked against a model of the body, assuming the
 * preconditions and any earlier postconditions already proven.
 * A satisfying assignment only counts as a counterexample when neither
 * the body model nor the postcondition over-approximates, and the
 * postcondition really fails when evaluated on the assignment.
 *
 * Thread-safe: each call to verify() uses its own solver session.
 */
public class SolverOrchestrator {
  private static final Logger logger = Logging.getCevaLogger();

  /** Timeouts below this make every non-trivial check fail */
  public static final long MIN_TIMEOUT_MS = 50;

  public static final String SOLVER_UNAVAILABLE = "solver unavailable";

  private final SolverBackend backend;
  private final FormulaEncoder encoder;
  private final ContractEvaluator evaluator;
  private final long timeoutMs;
  private final int unrollThreshold;
  private final int pathLimit;

  private final AtomicInteger solverInvocations = new AtomicInteger(0);

  public SolverOrchestrator(SolverBackend backend, IntegerMode mode,
              long timeoutMs, int unrollThreshold, int pathLimit) {
    this.backend = backend;
    this.encoder = new FormulaEncoder(mode);
    this.evaluator = new ContractEvaluator(mode);
    this.timeoutMs = Math.max(timeoutMs, MIN_TIMEOUT_MS);
    this.unrollThreshold = unrollThreshold;
    this.pathLimit = pathLimit;
  }

  public SolverBackend backend() {
    return backend;
  }

  public IntegerMode integerMode() {
    return encoder.integerMode();
  }

  public long timeoutMs() {
    return timeoutMs;
  }

  /**
   * @return number of solver checks made so far, over all functions
   */
  public int getSolverInvocations() {
    return solverInvocations.get();
  }

  /**
   * @param module module the function belongs to, used to model calls.
   *              May be null.
   */
  public FunctionVerificationResult verify(Function f, Module module) {
    return verify(f, module, Collections.<Statement, Expression>emptyMap());
  }

  /**
   * @param loopInvariants proven invariants of loops in f's body, assumed
   *              at the loop heads
   */
  public FunctionVerificationResult verify(Function f, Module module,
                          Map<Statement, Expression> loopInvariants) {
    if (!f.hasContracts()) {
      return new FunctionVerificationResult(f.id(), f.name(),
                Collections.<VerificationOutcome>emptyList(),
                Collections.<VerificationOutcome>emptyList());
    }
    if (!backend.isAvailable()) {
      return skipAll(f, SOLVER_UNAVAILABLE);
    }

    Map<String, Term> symbols = FormulaEncoder.signatureSymbols(f);
    List<EncodedContract> pres = encodeAll(f, symbols, f.preconditions(),
                                           ContractKind.PRECONDITION);
    List<EncodedContract> posts = encodeAll(f, symbols, f.postconditions(),
                                            ContractKind.POSTCONDITION);

    SolverSession session = backend.openSession(timeoutMs);
    try {
      Run run = new Run(f, module, session, symbols, pres, loopInvariants);
      List<VerificationOutcome> preOutcomes =
                                  new ArrayList<VerificationOutcome>();
      for (EncodedContract pre: pres) {
        preOutcomes.add(run.checkPrecondition(pre));
      }
      List<VerificationOutcome> postOutcomes =
                                  new ArrayList<VerificationOutcome>();
      for (EncodedContract post: posts) {
        postOutcomes.add(run.checkPostcondition(post));
      }
      if (logger.isDebugEnabled()) {
        for (VerificationOutcome o: preOutcomes) {
          logger.debug(o.toString());
        }
        for (VerificationOutcome o: postOutcomes) {
          logger.debug(o.toString());
        }
      }
      return new FunctionVerificationResult(f.id(), f.name(),
                                            preOutcomes, postOutcomes);
    } finally {
      session.close();
    }
  }

  /**
   * Result with every contract of f skipped
   */
  public static FunctionVerificationResult skipAll(Function f,
                                                   String reason) {
    List<VerificationOutcome> pre = new ArrayList<VerificationOutcome>();
    for (int i = 0; i < f.preconditions().size(); i++) {
      pre.add(VerificationOutcome.skipped(f.id(), ContractKind.PRECONDITION,
                          i, f.preconditions().get(i).span(), reason));
    }
    List<VerificationOutcome> post = new ArrayList<VerificationOutcome>();
    for (int i = 0; i < f.postconditions().size(); i++) {
      post.add(VerificationOutcome.skipped(f.id(), ContractKind.POSTCONDITION,
                          i, f.postconditions().get(i).span(), reason));
    }
    return new FunctionVerificationResult(f.id(), f.name(), pre, post);
  }

  private List<EncodedContract> encodeAll(Function f,
          Map<String, Term> symbols, List<Expression> contracts,
          ContractKind kind) {
    List<EncodedContract> result = new ArrayList<EncodedContract>();
    for (int i = 0; i < contracts.size(); i++) {
      result.add(encoder.encodeContract(f, symbols, contracts.get(i),
                                        kind, i));
    }
    return result;
  }

  /**
   * State for verifying one function
   */
  private class Run {
    private final Function f;
    private final Module module;
    private final SolverSession session;
    private final Map<String, Term> symbols;
    private final Map<Statement, Expression> loopInvariants;
    private final List<Term> domains = new ArrayList<Term>();
    private final List<Term> axioms = new ArrayList<Term>();
    private final List<Term> lemmas = new ArrayList<Term>();
    private BodyModel body = null;
    /** Result of checking that the axioms are consistent, once needed */
    private SolverResult axiomCheck = null;

    Run(Function f, Module module, SolverSession session,
        Map<String, Term> symbols, List<EncodedContract> pres,
        Map<Statement, Expression> loopInvariants) {
      this.f = f;
      this.module = module;
      this.session = session;
      this.symbols = symbols;
      this.loopInvariants = loopInvariants;
      for (Map.Entry<String, Term> e: symbols.entrySet()) {
        if (e.getKey().endsWith(FormulaEncoder.LENGTH_SUFFIX)) {
          domains.add(Term.le(Term.intConst(0, Sort.INDEX), e.getValue()));
        }
      }
      axioms.addAll(domains);
      for (EncodedContract pre: pres) {
        if (pre.isSupported()) {
          axioms.add(pre.formula().definedness());
          axioms.add(pre.formula().formula());
        }
      }
    }

    VerificationOutcome checkPrecondition(EncodedContract pre) {
      if (!pre.isSupported()) {
        return VerificationOutcome.unsupported(f.id(), pre.kind(),
                pre.index(), pre.span(), pre.unsupportedReason());
      }
      ContractFormula formula = pre.formula();
      SolverResult r = check(with(axioms, Term.not(formula.formula())),
                             modelSymbols(false));
      if (r.isSat()) {
        return counterexampleOutcome(pre, formula, r.model());
      } else if (!r.isUnsat()) {
        return limit(pre, r);
      }

      if (axiomCheck == null) {
        axiomCheck = check(axioms, Collections.<Term>emptyList());
      }
      if (axiomCheck.isSat()) {
        return proven(pre);
      } else if (!axiomCheck.isUnsat()) {
        return limit(pre, axiomCheck);
      }

      // Preconditions contradict each other: find which can fail
      List<Term> alone = new ArrayList<Term>(domains);
      alone.add(formula.definedness());
      alone.add(Term.not(formula.formula()));
      r = check(alone, modelSymbols(false));
      if (r.isUnsat()) {
        return proven(pre);
      } else if (r.isSat()) {
        return counterexampleOutcome(pre, formula, r.model());
      }
      return limit(pre, r);
    }

    VerificationOutcome checkPostcondition(EncodedContract post) {
      if (!post.isSupported()) {
        return VerificationOutcome.unsupported(f.id(), post.kind(),
                post.index(), post.span(), post.unsupportedReason());
      }
      if (body == null) {
        BodyEncoder be = new BodyEncoder(encoder, module,
                            unrollThreshold, pathLimit, loopInvariants);
        body = be.encode(f, symbols);
      }
      ContractFormula formula = post.formula();
      List<Term> base = new ArrayList<Term>(axioms);
      base.add(body.constraint());
      base.addAll(lemmas);

      List<Term> query = new ArrayList<Term>(base);
      query.add(formula.definedness());
      query.add(Term.not(formula.formula()));
      SolverResult r = check(query, modelSymbols(true));
      if (r.isSat()) {
        if (body.isPartial()) {
          return VerificationOutcome.unproven(f.id(), post.kind(),
                post.index(), post.span(), body.describePartial());
        }
        return counterexampleOutcome(post, formula, r.model());
      } else if (!r.isUnsat()) {
        return limit(post, r);
      }

      if (!formula.sideConditions().isEmpty()) {
        SolverResult defined = check(with(base,
                  Term.not(formula.definedness())),
                  Collections.<Term>emptyList());
        if (defined.isSat()) {
          return VerificationOutcome.unproven(f.id(), post.kind(),
                  post.index(), post.span(), "postcondition may be " +
                  "undefined: " + describe(formula.sideConditions()));
        } else if (!defined.isUnsat()) {
          return limit(post, defined);
        }
      }
      lemmas.add(formula.definedness());
      lemmas.add(formula.formula());
      return proven(post);
    }

    /**
     * Outcome for a satisfying model of the negated contract
     */
    private VerificationOutcome counterexampleOutcome(EncodedContract c,
                      ContractFormula formula, Map<String, Value> model) {
      if (formula.isPartial()) {
        return VerificationOutcome.unproven(f.id(), c.kind(), c.index(),
                c.span(), c.kind().description() +
                " is only partially encoded");
      }
      Counterexample cex = new Counterexample(model);
      if (!confirmed(c, cex)) {
        logger.debug(f.name() + ": counterexample " + cex.describe() +
                     " for " + c + " not confirmed");
        return VerificationOutcome.unproven(f.id(), c.kind(), c.index(),
                c.span(), "counterexample " + cex.describe() +
                " could not be confirmed");
      }
      return VerificationOutcome.disproven(f.id(), c.kind(), c.index(),
                                           c.span(), cex);
    }

    /**
     * Evaluate the contracts on the counterexample.  Undecidable
     * evaluations (e.g. array contents) don't refute it.
     */
    private boolean confirmed(EncodedContract c, Counterexample cex) {
      if (Boolean.TRUE.equals(evaluator.holds(c.expression(),
                                              cex.values()))) {
        return false;
      }
      if (c.kind() == ContractKind.POSTCONDITION) {
        for (Expression pre: f.preconditions()) {
          if (Boolean.FALSE.equals(evaluator.holds(pre, cex.values()))) {
            return false;
          }
        }
      }
      return true;
    }

    private VerificationOutcome proven(EncodedContract c) {
      return VerificationOutcome.proven(f.id(), c.kind(), c.index(),
                                        c.span());
    }

    private VerificationOutcome limit(EncodedContract c, SolverResult r) {
      return VerificationOutcome.solverLimit(f.id(), c.kind(), c.index(),
                c.span(), "solver returned unknown: " + r.reason());
    }

    /**
     * Symbols to report in counterexamples.  Array contents are left out.
     */
    private Collection<Term> modelSymbols(boolean includeResult) {
      List<Term> result = new ArrayList<Term>();
      for (Map.Entry<String, Term> e: symbols.entrySet()) {
        if (e.getValue().sort().isArray()) {
          continue;
        }
        if (!includeResult && e.getKey().equals(VarRef.RESULT)) {
          continue;
        }
        result.add(e.getValue());
      }
      return result;
    }

    private SolverResult check(List<Term> assertions,
                               Collection<Term> modelSymbols) {
      solverInvocations.incrementAndGet();
      SolverResult r = session.check(assertions, modelSymbols);
      if (logger.isTraceEnabled()) {
        logger.trace(f.name() + ": " + r);
      }
      return r;
    }
  }

  private static List<Term> with(List<Term> terms, Term extra) {
    List<Term> result = new ArrayList<Term>(terms);
    result.add(extra);
    return result;
  }

  private static String describe(List<SideCondition> conds) {
    StringBuilder sb = new StringBuilder();
    for (SideCondition sc: conds) {
      if (sb.length() > 0) {
        sb.append("; ");
      }
      sb.append(sc.describe());
    }
    return sb.toString();
  }
}
