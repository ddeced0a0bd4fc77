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

package exm.ceva.verify.z3;

import java.math.BigInteger;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.RatNum;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;

import exm.ceva.common.Logging;
import exm.ceva.common.lang.OpEvaluator;
import exm.ceva.common.lang.Value;
import exm.ceva.verify.SolverResult;
import exm.ceva.verify.SolverSession;
import exm.ceva.verify.formula.Sort;
import exm.ceva.verify.formula.Term;

/**
 * A Z3 context and solver used for all checks of one function.
 * Each check runs in its own push/pop scope.
 */
class Z3SolverSession implements SolverSession {
  private static final Logger logger = Logging.getCevaLogger();

  private final Context ctx;
  private final Solver solver;
  private final Z3Translator translator;
  private boolean closed = false;

  Z3SolverSession(long timeoutMs) {
    this.ctx = new Context();
    this.solver = ctx.mkSolver();
    Params params = ctx.mkParams();
    params.add("timeout", (int)Math.min(timeoutMs, Integer.MAX_VALUE));
    solver.setParameters(params);
    this.translator = new Z3Translator(ctx);
  }

  @Override
  public SolverResult check(List<Term> assertions,
                            Collection<Term> modelSymbols) {
    if (closed) {
      throw new IllegalStateException("Session already closed");
    }
    solver.push();
    try {
      for (Term a: assertions) {
        solver.add(translator.translateBool(a));
      }
      Status status = solver.check();
      if (logger.isTraceEnabled()) {
        logger.trace("z3 " + status + " for " + assertions);
      }
      switch (status) {
        case UNSATISFIABLE:
          return SolverResult.unsat();
        case SATISFIABLE:
          return SolverResult.sat(extractModel(solver.getModel(),
                                               modelSymbols));
        default:
          String reason = solver.getReasonUnknown();
          return SolverResult.unknown(reason == null ? "unknown" : reason);
      }
    } catch (Z3Exception e) {
      logger.debug("z3 failure: " + e.getMessage());
      return SolverResult.unknown("solver error: " + e.getMessage());
    } finally {
      solver.pop();
    }
  }

  private Map<String, Value> extractModel(Model model,
                                          Collection<Term> symbols) {
    Map<String, Value> values = new LinkedHashMap<String, Value>();
    for (Term sym: symbols) {
      Value v = modelValue(model.eval(translator.translate(sym), true),
                           sym.sort());
      if (v != null) {
        values.put(sym.name(), v);
      }
    }
    return values;
  }

  /**
   * @return null if the value can't be represented (arrays, irrational
   *        reals)
   */
  private static Value modelValue(Expr<?> e, Sort sort) {
    switch (sort.kind()) {
      case BOOL:
        if (e.isTrue()) {
          return Value.createBoolLit(true);
        } else if (e.isFalse()) {
          return Value.createBoolLit(false);
        }
        return null;
      case BITVEC:
        if (e instanceof BitVecNum) {
          BigInteger bits = ((BitVecNum)e).getBigInteger();
          return Value.createIntLit(
                  OpEvaluator.fromBits(bits, sort.sourceType()));
        }
        return null;
      case REAL:
        if (e instanceof RatNum) {
          RatNum r = (RatNum)e;
          double num = r.getBigIntNumerator().doubleValue();
          double den = r.getBigIntDenominator().doubleValue();
          return Value.createRealLit(num / den);
        }
        return null;
      case STRING:
        if (e.isString()) {
          return Value.createStringLit(e.getString());
        }
        return null;
      default:
        return null;
    }
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      ctx.close();
    }
  }
}
