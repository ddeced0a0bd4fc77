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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.microsoft.z3.ArraySort;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.CharSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.RealSort;
import com.microsoft.z3.SeqSort;

import exm.ceva.common.exceptions.CevaRuntimeError;
import exm.ceva.common.lang.Value;
import exm.ceva.verify.formula.FormulaOp;
import exm.ceva.verify.formula.Sort;
import exm.ceva.verify.formula.Term;

/**
 * Builds Z3 expressions from formula terms.  Translations are memoized,
 * so shared subterms are built once per context.
 */
class Z3Translator {
  private final Context ctx;
  private final Map<Term, Expr<?>> cache = new HashMap<Term, Expr<?>>();
  private final Map<String, FuncDecl<?>> functions =
                                  new HashMap<String, FuncDecl<?>>();

  Z3Translator(Context ctx) {
    this.ctx = ctx;
  }

  com.microsoft.z3.Sort sort(Sort s) {
    switch (s.kind()) {
      case BOOL:
        return ctx.getBoolSort();
      case BITVEC:
        return ctx.mkBitVecSort(s.bits());
      case REAL:
        return ctx.getRealSort();
      case STRING:
        return ctx.mkStringSort();
      case ARRAY:
        return ctx.mkArraySort(ctx.mkBitVecSort(Sort.INDEX.bits()),
                               sort(s.elemSort()));
      default:
        throw new CevaRuntimeError("Unknown sort " + s);
    }
  }

  Expr<?> translate(Term t) {
    Expr<?> e = cache.get(t);
    if (e == null) {
      e = build(t);
      cache.put(t, e);
    }
    return e;
  }

  Expr<BoolSort> translateBool(Term t) {
    return bool(translate(t));
  }

  private Expr<?> build(Term t) {
    switch (t.kind()) {
      case CONST:
        return constant(t.value(), t.sort());
      case VAR:
        return ctx.mkConst(t.name(), sort(t.sort()));
      case CALL:
        return call(t);
      case APP:
        return app(t);
      default:
        throw new CevaRuntimeError("Unknown term kind " + t.kind());
    }
  }

  private Expr<?> constant(Value v, Sort s) {
    switch (s.kind()) {
      case BOOL:
        return ctx.mkBool(v.getBoolLit());
      case BITVEC: {
        // Two's complement bit pattern
        BigInteger bits = v.getIntLit().mod(
                              BigInteger.ONE.shiftLeft(s.bits()));
        return ctx.mkBV(bits.toString(), s.bits());
      }
      case REAL:
        return ctx.mkReal(new BigDecimal(v.getRealLit()).toPlainString());
      case STRING:
        return ctx.mkString(v.getStringLit());
      default:
        throw new CevaRuntimeError("No constants of sort " + s);
    }
  }

  private Expr<?> call(Term t) {
    List<Term> args = t.args();
    com.microsoft.z3.Sort[] domain = new com.microsoft.z3.Sort[args.size()];
    Expr<?>[] actuals = new Expr<?>[args.size()];
    StringBuilder key = new StringBuilder(t.name());
    for (int i = 0; i < args.size(); i++) {
      domain[i] = sort(args.get(i).sort());
      actuals[i] = translate(args.get(i));
      key.append(' ').append(args.get(i).sort());
    }
    key.append(" -> ").append(t.sort());
    FuncDecl<?> f = functions.get(key.toString());
    if (f == null) {
      // Same name at different sorts must be different functions
      String name = functions.isEmpty() ? t.name()
                          : t.name() + "!" + functions.size();
      f = ctx.mkFuncDecl(name, domain, sort(t.sort()));
      functions.put(key.toString(), f);
    }
    return ctx.mkApp(f, actuals);
  }

  private Expr<?> app(Term t) {
    List<Term> args = t.args();
    FormulaOp op = t.op();
    Sort argSort = args.isEmpty() ? null : args.get(0).sort();
    switch (op) {
      case AND:
        return ctx.mkAnd(boolArgs(args));
      case OR:
        return ctx.mkOr(boolArgs(args));
      case NOT:
        return ctx.mkNot(bool(arg(t, 0)));
      case IMPLIES:
        return ctx.mkImplies(bool(arg(t, 0)), bool(arg(t, 1)));
      case ITE:
        return ctx.mkITE(bool(arg(t, 0)), any(arg(t, 1)), any(arg(t, 2)));
      case EQ:
        return ctx.mkEq(any(arg(t, 0)), any(arg(t, 1)));
      case LT:
        if (argSort.isReal()) {
          return ctx.mkLt(real(arg(t, 0)), real(arg(t, 1)));
        }
        return argSort.isSigned() ? ctx.mkBVSLT(bv(arg(t, 0)), bv(arg(t, 1)))
                                  : ctx.mkBVULT(bv(arg(t, 0)), bv(arg(t, 1)));
      case LE:
        if (argSort.isReal()) {
          return ctx.mkLe(real(arg(t, 0)), real(arg(t, 1)));
        }
        return argSort.isSigned() ? ctx.mkBVSLE(bv(arg(t, 0)), bv(arg(t, 1)))
                                  : ctx.mkBVULE(bv(arg(t, 0)), bv(arg(t, 1)));
      case ADD:
        if (argSort.isReal()) {
          return ctx.mkAdd(real(arg(t, 0)), real(arg(t, 1)));
        }
        return ctx.mkBVAdd(bv(arg(t, 0)), bv(arg(t, 1)));
      case SUB:
        if (argSort.isReal()) {
          return ctx.mkSub(real(arg(t, 0)), real(arg(t, 1)));
        }
        return ctx.mkBVSub(bv(arg(t, 0)), bv(arg(t, 1)));
      case MUL:
        if (argSort.isReal()) {
          return ctx.mkMul(real(arg(t, 0)), real(arg(t, 1)));
        }
        return ctx.mkBVMul(bv(arg(t, 0)), bv(arg(t, 1)));
      case DIV:
        if (argSort.isReal()) {
          return ctx.mkDiv(real(arg(t, 0)), real(arg(t, 1)));
        }
        return argSort.isSigned()
            ? ctx.mkBVSDiv(bv(arg(t, 0)), bv(arg(t, 1)))
            : ctx.mkBVUDiv(bv(arg(t, 0)), bv(arg(t, 1)));
      case REM:
        return argSort.isSigned()
            ? ctx.mkBVSRem(bv(arg(t, 0)), bv(arg(t, 1)))
            : ctx.mkBVURem(bv(arg(t, 0)), bv(arg(t, 1)));
      case NEG:
        if (argSort.isReal()) {
          return ctx.mkUnaryMinus(real(arg(t, 0)));
        }
        return ctx.mkBVNeg(bv(arg(t, 0)));
      case BIT_AND:
        return ctx.mkBVAND(bv(arg(t, 0)), bv(arg(t, 1)));
      case BIT_OR:
        return ctx.mkBVOR(bv(arg(t, 0)), bv(arg(t, 1)));
      case BIT_XOR:
        return ctx.mkBVXOR(bv(arg(t, 0)), bv(arg(t, 1)));
      case BIT_NOT:
        return ctx.mkBVNot(bv(arg(t, 0)));
      case SHL:
        return ctx.mkBVSHL(bv(arg(t, 0)), bv(arg(t, 1)));
      case SHR:
        return argSort.isSigned()
            ? ctx.mkBVASHR(bv(arg(t, 0)), bv(arg(t, 1)))
            : ctx.mkBVLSHR(bv(arg(t, 0)), bv(arg(t, 1)));
      case EXTEND: {
        int extra = t.sort().bits() - argSort.bits();
        return argSort.isSigned() ? ctx.mkSignExt(extra, bv(arg(t, 0)))
                                  : ctx.mkZeroExt(extra, bv(arg(t, 0)));
      }
      case TRUNCATE:
        return ctx.mkExtract(t.sort().bits() - 1, 0, bv(arg(t, 0)));
      case REINTERPRET:
        return arg(t, 0);
      case STR_LENGTH:
        return ctx.mkInt2BV(Sort.INDEX.bits(), ctx.mkLength(str(arg(t, 0))));
      case SELECT:
        return ctx.mkSelect(array(arg(t, 0)), bv(arg(t, 1)));
      case STORE:
        return ctx.mkStore(array(arg(t, 0)), bv(arg(t, 1)), any(arg(t, 2)));
      default:
        throw new CevaRuntimeError("Unknown operator " + op);
    }
  }

  private Expr<?> arg(Term t, int i) {
    return translate(t.args().get(i));
  }

  @SuppressWarnings("unchecked")
  private Expr<BoolSort>[] boolArgs(List<Term> args) {
    Expr<BoolSort>[] result = new Expr[args.size()];
    for (int i = 0; i < args.size(); i++) {
      result[i] = bool(translate(args.get(i)));
    }
    return result;
  }

  @SuppressWarnings("unchecked")
  private static Expr<BoolSort> bool(Expr<?> e) {
    return (Expr<BoolSort>)e;
  }

  @SuppressWarnings("unchecked")
  private static Expr<BitVecSort> bv(Expr<?> e) {
    return (Expr<BitVecSort>)e;
  }

  @SuppressWarnings("unchecked")
  private static Expr<RealSort> real(Expr<?> e) {
    return (Expr<RealSort>)e;
  }

  @SuppressWarnings("unchecked")
  private static Expr<SeqSort<CharSort>> str(Expr<?> e) {
    return (Expr<SeqSort<CharSort>>)e;
  }

  @SuppressWarnings("unchecked")
  private static Expr<ArraySort<BitVecSort, com.microsoft.z3.Sort>> array(
                                                          Expr<?> e) {
    return (Expr<ArraySort<BitVecSort, com.microsoft.z3.Sort>>)e;
  }

  @SuppressWarnings("unchecked")
  private static Expr<com.microsoft.z3.Sort> any(Expr<?> e) {
    return (Expr<com.microsoft.z3.Sort>)e;
  }
}
