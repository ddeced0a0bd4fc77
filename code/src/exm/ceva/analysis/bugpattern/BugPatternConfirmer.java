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


package exm.ceva.analysis.bugpattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.ceva.ast.BinaryExpr;
import exm.ceva.ast.Expression;
import exm.ceva.ast.Expression.ExprKind;
import exm.ceva.ast.Expressions;
import exm.ceva.ast.Function;
import exm.ceva.ast.IndexExpr;
import exm.ceva.ast.Parameter;
import exm.ceva.ast.VarRef;
import exm.ceva.common.Logging;
import exm.ceva.common.exceptions.UnsupportedConstructException;
import exm.ceva.common.lang.IntegerMode;
import exm.ceva.diagnostics.Diagnostic;
import exm.ceva.diagnostics.DiagnosticCode;
import exm.ceva.diagnostics.Severity;
import exm.ceva.verify.ContractKind;
import exm.ceva.verify.SolverBackend;
import exm.ceva.verify.SolverResult;
import exm.ceva.verify.SolverSession;
import exm.ceva.verify.encode.EncodeContext;
import exm.ceva.verify.encode.EncodedContract;
import exm.ceva.verify.encode.FormulaEncoder;
import exm.ceva.verify.formula.SideCondition;
import exm.ceva.verify.formula.Sort;
import exm.ceva.verify.formula.Term;

/**
 * Asks the solver whether a possible division by zero or out of bounds
 * index can happen at all under the preconditions.  Warnings it shows
 * to be impossible are dropped; everything else is kept.
 *
 * Only nodes whose operands are parameters the body never reassigns are
 * checked, since their values at the node are the values on entry.
 */
public class BugPatternConfirmer {

  private static final Logger logger = Logging.getCevaLogger();

  private final SolverBackend backend;
  private final FormulaEncoder encoder;
  private final long timeoutMs;

  private int refuted = 0;

  public BugPatternConfirmer(SolverBackend backend, IntegerMode mode,
                             long timeoutMs) {
    this.backend = backend;
    this.encoder = new FormulaEncoder(mode);
    this.timeoutMs = timeoutMs;
  }

  /**
   * @return number of warnings dropped so far
   */
  public int refuted() {
    return refuted;
  }

  /**
   * @return the diagnostics of ctx, less the warnings shown impossible
   */
  public List<Diagnostic> confirm(CheckContext ctx) {
    List<Diagnostic> diags = ctx.diagnostics();
    List<Diagnostic> candidates = new ArrayList<Diagnostic>();
    for (Diagnostic d: diags) {
      if (isCandidate(d)) {
        candidates.add(d);
      }
    }
    if (candidates.isEmpty() || !backend.isAvailable()) {
      return diags;
    }

    Function f = ctx.function();
    Map<String, Term> symbols = FormulaEncoder.signatureSymbols(f);
    Set<String> stable = stableParams(f);
    List<Term> axioms = axioms(f, symbols);
    Set<Diagnostic> impossible = new HashSet<Diagnostic>();

    SolverSession session = backend.openSession(timeoutMs);
    try {
      for (Diagnostic d: candidates) {
        Expression node = ctx.reportedAt(d);
        if (node == null || !onlyReads(node, stable)) {
          continue;
        }
        List<Term> query = badCondition(node, symbols);
        if (query == null) {
          continue;
        }
        query.addAll(axioms);
        SolverResult r = session.check(query,
                                       Collections.<Term>emptyList());
        if (r.isUnsat()) {
          logger.debug("Refuted: " + d);
          impossible.add(d);
        } else if (logger.isTraceEnabled()) {
          logger.trace("Kept " + d + ": " + r.status());
        }
      }
    } finally {
      session.close();
    }

    if (impossible.isEmpty()) {
      return diags;
    }
    refuted += impossible.size();
    List<Diagnostic> result = new ArrayList<Diagnostic>();
    for (Diagnostic d: diags) {
      if (!impossible.contains(d)) {
        result.add(d);
      }
    }
    return result;
  }

  private static boolean isCandidate(Diagnostic d) {
    return d.severity() == Severity.WARNING &&
           (d.code().equals(DiagnosticCode.DIVISION_BY_ZERO) ||
            d.code().equals(DiagnosticCode.INDEX_OUT_OF_BOUNDS));
  }

  /**
   * Parameters that keep their entry value throughout the body
   */
  private static Set<String> stableParams(Function f) {
    Set<String> changed = new HashSet<String>();
    changed.addAll(Expressions.assignedVars(f.body()));
    changed.addAll(Expressions.boundVars(f.body()));
    Set<String> stable = new HashSet<String>();
    for (Parameter p: f.params()) {
      if (!changed.contains(p.name())) {
        stable.add(p.name());
      }
    }
    return stable;
  }

  private static boolean onlyReads(Expression node, Set<String> stable) {
    if (Expressions.containsCall(node)) {
      return false;
    }
    for (String name: Expressions.varNames(node)) {
      if (!stable.contains(name)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Array lengths are non-negative and the encodable preconditions hold
   */
  private List<Term> axioms(Function f, Map<String, Term> symbols) {
    List<Term> axioms = new ArrayList<Term>();
    for (Map.Entry<String, Term> e: symbols.entrySet()) {
      if (e.getKey().endsWith(FormulaEncoder.LENGTH_SUFFIX)) {
        axioms.add(Term.le(Term.intConst(0, Sort.INDEX), e.getValue()));
      }
    }
    List<Expression> pres = f.preconditions();
    for (int i = 0; i < pres.size(); i++) {
      EncodedContract pre = encoder.encodeContract(f, symbols, pres.get(i),
                                          ContractKind.PRECONDITION, i);
      if (pre.isSupported()) {
        axioms.add(pre.formula().definedness());
        axioms.add(pre.formula().formula());
      }
    }
    return axioms;
  }

  /**
   * @return assertions satisfiable exactly when the problem reported at
   *    node can occur, or null if node can't be encoded
   */
  private List<Term> badCondition(Expression node,
                                  Map<String, Term> symbols) {
    EncodeContext ctx = new EncodeContext(symbols);
    Term bad;
    try {
      if (node.kind() == ExprKind.BINARY) {
        Term divisor = encoder.encode(((BinaryExpr)node).right(), ctx);
        if (!divisor.sort().isBitVec()) {
          return null;
        }
        bad = Term.eq(divisor, Term.intConst(0, divisor.sort()));
      } else if (node.kind() == ExprKind.INDEX) {
        IndexExpr ix = (IndexExpr)node;
        if (ix.array().kind() != ExprKind.VARIABLE) {
          return null;
        }
        Term len = ctx.lookup(((VarRef)ix.array()).name() +
                              FormulaEncoder.LENGTH_SUFFIX);
        Term index = encoder.encode(ix.index(), ctx);
        if (len == null || !index.sort().isBitVec()) {
          return null;
        }
        Term i = FormulaEncoder.inIndexSort(index);
        bad = Term.or(Term.lt(i, Term.intConst(0, Sort.INDEX)),
                      Term.le(len, i));
      } else {
        return null;
      }
    } catch (UnsupportedConstructException e) {
      logger.trace("Can't check " + node + ": " + e.getMessage());
      return null;
    }
    if (ctx.isPartial()) {
      return null;
    }
    List<Term> query = new ArrayList<Term>();
    // Operands evaluated without trapping to reach the node
    for (SideCondition sc: ctx.sideConditions()) {
      query.add(sc.asTerm());
    }
    query.add(bad);
    return query;
  }
}
