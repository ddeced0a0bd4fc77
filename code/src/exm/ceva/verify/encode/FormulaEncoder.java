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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.ceva.ast.BinaryExpr;
import exm.ceva.ast.CallExpr;
import exm.ceva.ast.Expression;
import exm.ceva.ast.Expression.ExprKind;
import exm.ceva.ast.Function;
import exm.ceva.ast.IndexExpr;
import exm.ceva.ast.LengthExpr;
import exm.ceva.ast.Literal;
import exm.ceva.ast.Parameter;
import exm.ceva.ast.UnaryExpr;
import exm.ceva.ast.VarRef;
import exm.ceva.common.Logging;
import exm.ceva.common.exceptions.CevaRuntimeError;
import exm.ceva.common.exceptions.UnsupportedConstructException;
import exm.ceva.common.lang.Builtins;
import exm.ceva.common.lang.IntegerMode;
import exm.ceva.common.lang.OpEvaluator;
import exm.ceva.common.lang.Operators.BinaryOp;
import exm.ceva.common.lang.SourceSpan;
import exm.ceva.common.lang.Types;
import exm.ceva.common.lang.Types.Type;
import exm.ceva.common.lang.Value;
import exm.ceva.verify.ContractKind;
import exm.ceva.verify.formula.ContractFormula;
import exm.ceva.verify.formula.FormulaOp;
import exm.ceva.verify.formula.SideCondition.Reason;
import exm.ceva.verify.formula.Sort;
import exm.ceva.verify.formula.Term;

/**
 * Translates typed expressions into solver-neutral formulas.
 *
 * Integers are bit-vectors of the width of their type.  Under
 * IntegerMode.WRAP arithmetic is modular; under TRAP every operation
 * that can overflow gets a side condition saying it doesn't, checked by
 * sign/zero-extending the operands to twice the width.  Division and
 * indexing always get side conditions.  Side conditions are guarded by
 * the short-circuit context they are evaluated in.
 */
public class FormulaEncoder {

  private static final Logger logger = Logging.getCevaLogger();

  /**
   * Changes whenever the encoding changes meaning, so that cached
   * outcomes from older encoders are not reused
   */
  public static final String ENCODER_VERSION = "ceva-encoder-3";

  /** Suffix of the symbol standing for an array's length */
  public static final String LENGTH_SUFFIX = ".length";

  private final IntegerMode mode;

  public FormulaEncoder(IntegerMode mode) {
    this.mode = mode;
  }

  public IntegerMode integerMode() {
    return mode;
  }

  /**
   * Symbols for the parameters of f, the lengths of its array
   * parameters, and its result.  Parameters of types with no encoding
   * get no symbol, so contracts mentioning them are unsupported.
   */
  public static Map<String, Term> signatureSymbols(Function f) {
    Map<String, Term> syms = new LinkedHashMap<String, Term>();
    for (Parameter p: f.params()) {
      addSymbol(syms, p.name(), p.type(), p.span());
    }
    if (!f.returnType().isVoid()) {
      addSymbol(syms, VarRef.RESULT, f.returnType(), f.span());
    }
    return syms;
  }

  private static void addSymbol(Map<String, Term> syms, String name,
                                Type type, SourceSpan span) {
    try {
      Sort sort = Sort.forType(type, span);
      syms.put(name, Term.var(name, sort));
      if (sort.isArray()) {
        syms.put(name + LENGTH_SUFFIX,
                 Term.var(name + LENGTH_SUFFIX, Sort.INDEX));
      }
    } catch (UnsupportedConstructException e) {
      logger.trace("No symbol for " + name + ": " + e.getMessage());
    }
  }

  /**
   * Encode one contract of f.  Never fails: contracts that can't be
   * encoded come back unsupported.
   */
  public EncodedContract encodeContract(Function f, Map<String, Term> symbols,
        Expression contract, ContractKind kind, int index) {
    EncodeContext ctx = new EncodeContext(symbols);
    try {
      Term t = encode(contract, ctx);
      if (!t.sort().isBool()) {
        throw new UnsupportedConstructException(contract.span(),
                                    "contract is not a boolean expression");
      }
      ContractFormula formula = new ContractFormula(t, ctx.sideConditions(),
                                                    ctx.isPartial());
      if (logger.isTraceEnabled()) {
        logger.trace(f.name() + " " + kind.description() + " " + index +
                     ": " + formula);
      }
      return EncodedContract.supported(kind, index, contract, formula);
    } catch (UnsupportedConstructException e) {
      logger.debug(f.name() + " " + kind.description() + " " + index +
                   " unsupported: " + e.getMessage());
      return EncodedContract.unsupported(kind, index, contract,
                                         e.getMessage());
    }
  }

  public Term encode(Expression e, EncodeContext ctx)
                          throws UnsupportedConstructException {
    switch (e.kind()) {
      case LITERAL:
        return encodeLiteral((Literal)e);
      case VARIABLE: {
        Term t = ctx.lookup(((VarRef)e).name());
        if (t == null) {
          throw new UnsupportedConstructException(e.span(),
              "no encoding for variable '" + ((VarRef)e).name() + "'");
        }
        return t;
      }
      case UNARY:
        return encodeUnary((UnaryExpr)e, ctx);
      case BINARY:
        return encodeBinary((BinaryExpr)e, ctx);
      case CALL:
        return encodeCall((CallExpr)e, ctx);
      case INDEX:
        return encodeIndex((IndexExpr)e, ctx);
      case LENGTH:
        return encodeLength((LengthExpr)e, ctx);
      default:
        throw new CevaRuntimeError("Unexpected expression kind " + e.kind());
    }
  }

  private Term encodeLiteral(Literal lit)
                      throws UnsupportedConstructException {
    Value v = lit.value();
    Type t = lit.type();
    if (v.isNull()) {
      throw new UnsupportedConstructException(lit.span(),
                                        "comparison with null");
    } else if (v.isBoolVal()) {
      return Term.boolConst(v.getBoolLit());
    } else if (v.isIntVal() && t.isInteger()) {
      return Term.intConst(OpEvaluator.wrap(v.getIntLit(), t),
                           Sort.forType(t, lit.span()));
    } else if (v.isRealVal() || (v.isIntVal() && t.isFloat())) {
      return Term.constant(Value.createRealLit(v.getRealLit()), Sort.REAL);
    } else if (v.isStringVal()) {
      return Term.constant(v, Sort.STRING);
    }
    throw new UnsupportedConstructException(lit.span(),
                                    "literal " + v + " of type " + t);
  }

  private Term encodeUnary(UnaryExpr u, EncodeContext ctx)
                    throws UnsupportedConstructException {
    Term x = encode(u.operand(), ctx);
    switch (u.op()) {
      case NOT:
        requireBool(x, u);
        return Term.not(x);
      case BIT_NOT:
        if (x.sort().isBool()) {
          return Term.not(x);
        }
        requireBitVec(x, u);
        return Term.app(FormulaOp.BIT_NOT, x.sort(), x);
      case NEG:
        if (x.sort().isReal()) {
          return Term.app(FormulaOp.NEG, Sort.REAL, x);
        }
        requireBitVec(x, u);
        if (mode == IntegerMode.TRAP) {
          ctx.addSideCondition(Reason.OVERFLOW, negationSafe(x), u.span());
        }
        return Term.app(FormulaOp.NEG, x.sort(), x);
      default:
        throw new CevaRuntimeError("Unknown unary op " + u.op());
    }
  }

  /**
   * Negating the minimum signed value, or any non-zero unsigned value,
   * overflows
   */
  private static Term negationSafe(Term x) {
    Sort s = x.sort();
    if (s.isSigned()) {
      return Term.not(Term.eq(x, Term.intConst(minValue(s), s)));
    }
    return Term.eq(x, Term.intConst(0, s));
  }

  private Term encodeBinary(BinaryExpr b, EncodeContext ctx)
                      throws UnsupportedConstructException {
    BinaryOp op = b.op();
    switch (op) {
      case AND:
      case OR:
      case IMPLIES:
        return encodeLogical(b, ctx);
      default:
        break;
    }

    Term l = encode(b.left(), ctx);
    Term r = encode(b.right(), ctx);
    switch (op) {
      case EQ:
      case NEQ:
      case LT:
      case LTE:
      case GT:
      case GTE:
        return encodeComparison(b, l, r);
      case ADD:
      case SUB:
      case MUL:
      case DIV:
      case MOD:
        return encodeArithmetic(b, l, r, ctx);
      case BIT_AND:
      case BIT_OR:
      case BIT_XOR:
        return encodeBitwise(b, l, r);
      case SHL:
      case SHR: {
        Sort s = resultIntSort(b, l, r);
        FormulaOp fop = op == BinaryOp.SHL ? FormulaOp.SHL : FormulaOp.SHR;
        return Term.app(fop, s, coerce(l, s), coerce(r, s));
      }
      default:
        throw new CevaRuntimeError("Unknown binary op " + op);
    }
  }

  /**
   * The right operand is only evaluated when the left one doesn't decide
   * the result, so its side conditions are guarded by that
   */
  private Term encodeLogical(BinaryExpr b, EncodeContext ctx)
                      throws UnsupportedConstructException {
    Term l = encode(b.left(), ctx);
    requireBool(l, b.left());
    Term outer = ctx.guard();
    Term evalRight = b.op() == BinaryOp.OR ? Term.not(l) : l;
    ctx.setGuard(Term.and(outer, evalRight));
    Term r;
    try {
      r = encode(b.right(), ctx);
    } finally {
      ctx.setGuard(outer);
    }
    requireBool(r, b.right());
    switch (b.op()) {
      case AND:
        return Term.and(l, r);
      case OR:
        return Term.or(l, r);
      default:
        return Term.implies(l, r);
    }
  }

  private Term encodeComparison(BinaryExpr b, Term l, Term r)
                      throws UnsupportedConstructException {
    Sort ls = l.sort(), rs = r.sort();
    Term a, c;
    if (ls.isBitVec() && rs.isBitVec()) {
      Sort s = Sort.forType(Types.widerInt(ls.sourceType(), rs.sourceType()),
                            b.span());
      a = coerce(l, s);
      c = coerce(r, s);
    } else if (ls.equals(rs) && (ls.isReal() || ls.isBool() ||
                                 ls.isString())) {
      a = l;
      c = r;
      if (!ls.isReal() && b.op() != BinaryOp.EQ && b.op() != BinaryOp.NEQ) {
        throw new UnsupportedConstructException(b.span(),
            "ordering comparison on " + b.left().type());
      }
    } else {
      throw new UnsupportedConstructException(b.span(),
          "comparison of " + b.left().type() + " with " + b.right().type());
    }

    switch (b.op()) {
      case EQ:
        return Term.eq(a, c);
      case NEQ:
        return Term.not(Term.eq(a, c));
      case LT:
        return Term.lt(a, c);
      case LTE:
        return Term.le(a, c);
      case GT:
        return Term.lt(c, a);
      case GTE:
        return Term.le(c, a);
      default:
        throw new CevaRuntimeError("Not a comparison: " + b.op());
    }
  }

  private Term encodeArithmetic(BinaryExpr b, Term l, Term r,
              EncodeContext ctx) throws UnsupportedConstructException {
    if (l.sort().isReal() && r.sort().isReal()) {
      return encodeRealArithmetic(b, l, r, ctx);
    } else if (!l.sort().isBitVec() || !r.sort().isBitVec()) {
      throw new UnsupportedConstructException(b.span(),
          "arithmetic on " + b.left().type() + " and " + b.right().type());
    }

    Sort s = resultIntSort(b, l, r);
    Term x = coerce(l, s), y = coerce(r, s);
    FormulaOp fop = arithOp(b.op());
    if (fop == FormulaOp.DIV || fop == FormulaOp.REM) {
      ctx.addSideCondition(Reason.DIVISION,
              Term.not(Term.eq(y, Term.intConst(0, s))), b.span());
    }
    if (mode == IntegerMode.TRAP) {
      ctx.addSideCondition(Reason.OVERFLOW, noOverflow(fop, x, y, s),
                           b.span());
    }
    return Term.app(fop, s, x, y);
  }

  private Term encodeRealArithmetic(BinaryExpr b, Term l, Term r,
              EncodeContext ctx) throws UnsupportedConstructException {
    FormulaOp fop = arithOp(b.op());
    if (fop == FormulaOp.REM) {
      throw new UnsupportedConstructException(b.span(),
                                    "remainder of floating point values");
    } else if (fop == FormulaOp.DIV) {
      ctx.addSideCondition(Reason.DIVISION, Term.not(Term.eq(r,
          Term.constant(Value.createRealLit(0.0), Sort.REAL))), b.span());
    }
    return Term.app(fop, Sort.REAL, l, r);
  }

  private static FormulaOp arithOp(BinaryOp op) {
    switch (op) {
      case ADD:
        return FormulaOp.ADD;
      case SUB:
        return FormulaOp.SUB;
      case MUL:
        return FormulaOp.MUL;
      case DIV:
        return FormulaOp.DIV;
      case MOD:
        return FormulaOp.REM;
      default:
        throw new CevaRuntimeError("Not arithmetic: " + op);
    }
  }

  /**
   * Condition that x op y, computed exactly, is within the range of s
   */
  static Term noOverflow(FormulaOp op, Term x, Term y, Sort s) {
    switch (op) {
      case ADD:
      case SUB:
      case MUL: {
        // Twice the width plus headroom for the sign of unsigned results
        Sort wide = Sort.bitVec(s.bits() * 2 + 2, true);
        Term exact = Term.app(op, wide, Term.app(FormulaOp.EXTEND, wide, x),
                              Term.app(FormulaOp.EXTEND, wide, y));
        return Term.and(Term.le(Term.intConst(minValue(s), wide), exact),
                        Term.le(exact, Term.intConst(maxValue(s), wide)));
      }
      case DIV:
        if (s.isSigned()) {
          return Term.not(Term.and(
                  Term.eq(x, Term.intConst(minValue(s), s)),
                  Term.eq(y, Term.intConst(-1, s))));
        }
        return Term.TRUE;
      default:
        return Term.TRUE;
    }
  }

  private Term encodeBitwise(BinaryExpr b, Term l, Term r)
                      throws UnsupportedConstructException {
    if (l.sort().isBool() && r.sort().isBool()) {
      switch (b.op()) {
        case BIT_AND:
          return Term.and(l, r);
        case BIT_OR:
          return Term.or(l, r);
        default:
          return Term.not(Term.eq(l, r));
      }
    }
    Sort s = resultIntSort(b, l, r);
    FormulaOp fop;
    switch (b.op()) {
      case BIT_AND:
        fop = FormulaOp.BIT_AND;
        break;
      case BIT_OR:
        fop = FormulaOp.BIT_OR;
        break;
      default:
        fop = FormulaOp.BIT_XOR;
        break;
    }
    return Term.app(fop, s, coerce(l, s), coerce(r, s));
  }

  /**
   * Sort integer operations are carried out in: the expression's own type
   * if it is an integer type, otherwise the wider operand type
   */
  private static Sort resultIntSort(Expression e, Term l, Term r)
                      throws UnsupportedConstructException {
    if (!l.sort().isBitVec() || !r.sort().isBitVec()) {
      throw new UnsupportedConstructException(e.span(),
                            "integer operation on non-integer operands");
    }
    if (e.type().isInteger()) {
      return Sort.forType(e.type(), e.span());
    }
    return Sort.forType(Types.widerInt(l.sort().sourceType(),
                                       r.sort().sourceType()), e.span());
  }

  private Term encodeCall(CallExpr call, EncodeContext ctx)
                      throws UnsupportedConstructException {
    if (call.receiver() != null) {
      throw new UnsupportedConstructException(call.span(),
                  "method call '" + call.target() + "'");
    }
    List<Term> args = new ArrayList<Term>();
    for (Expression arg: call.args()) {
      args.add(encode(arg, ctx));
    }
    if (Builtins.isBuiltin(call.target())) {
      return encodeBuiltin(call, args, ctx);
    }
    if (ctx.calls() == null) {
      throw new UnsupportedConstructException(call.span(),
                  "call to '" + call.target() + "'");
    }
    Sort sort = call.type().isVoid() ? null
                        : Sort.forType(call.type(), call.span());
    return ctx.calls().encodeCall(call, args, sort, ctx);
  }

  private Term encodeBuiltin(CallExpr call, List<Term> args,
        EncodeContext ctx) throws UnsupportedConstructException {
    String name = call.target();
    if (name.equals(Builtins.ABS) && args.size() == 1) {
      Term x = args.get(0);
      if (x.sort().isReal()) {
        Term zero = Term.constant(Value.createRealLit(0.0), Sort.REAL);
        return Term.ite(Term.lt(x, zero), Term.app(FormulaOp.NEG, Sort.REAL, x),
                        x);
      }
      requireBitVec(x, call);
      if (!x.sort().isSigned()) {
        return x;
      }
      if (mode == IntegerMode.TRAP) {
        ctx.addSideCondition(Reason.OVERFLOW, negationSafe(x), call.span());
      }
      return Term.ite(Term.lt(x, Term.intConst(0, x.sort())),
                      Term.app(FormulaOp.NEG, x.sort(), x), x);
    } else if ((name.equals(Builtins.MIN) || name.equals(Builtins.MAX)) &&
               args.size() == 2) {
      Term a = args.get(0), b = args.get(1);
      if (a.sort().isBitVec() && b.sort().isBitVec()) {
        Sort s = resultIntSort(call, a, b);
        a = coerce(a, s);
        b = coerce(b, s);
      } else if (!a.sort().isReal() || !b.sort().isReal()) {
        throw new UnsupportedConstructException(call.span(),
                  name + " of " + a.sort() + " and " + b.sort());
      }
      Term aFirst = name.equals(Builtins.MIN) ? Term.le(a, b) : Term.le(b, a);
      return Term.ite(aFirst, a, b);
    }
    throw new UnsupportedConstructException(call.span(),
                  "builtin " + name + " with " + args.size() + " arguments");
  }

  private Term encodeIndex(IndexExpr ix, EncodeContext ctx)
                        throws UnsupportedConstructException {
    if (ix.array().kind() != ExprKind.VARIABLE) {
      throw new UnsupportedConstructException(ix.span(),
                  "indexing an expression other than a variable");
    }
    String arrName = ((VarRef)ix.array()).name();
    Term arr = encode(ix.array(), ctx);
    Term len = ctx.lookup(arrName + LENGTH_SUFFIX);
    if (!arr.sort().isArray() || len == null) {
      throw new UnsupportedConstructException(ix.span(),
                  "indexing '" + arrName + "'");
    }
    Term index = encode(ix.index(), ctx);
    if (!index.sort().isBitVec()) {
      throw new UnsupportedConstructException(ix.span(), "non-integer index");
    }
    Term i = inIndexSort(index);
    ctx.addSideCondition(Reason.BOUNDS, Term.and(
          Term.le(Term.intConst(0, Sort.INDEX), i), Term.lt(i, len)),
          ix.span());
    return Term.app(FormulaOp.SELECT, arr.sort().elemSort(), arr, i);
  }

  /**
   * Convert an integer to the index sort, preserving its value when it
   * is in the range of any valid index
   */
  public static Term inIndexSort(Term index) {
    Sort s = index.sort();
    if (s.bits() > Sort.INDEX.bits()) {
      // Values too large to be indices stay out of bounds after clamping
      Term big = Term.intConst(maxValue(Sort.INDEX), Sort.INDEX);
      Term fits = s.isSigned()
          ? Term.and(Term.le(Term.intConst(minValue(Sort.INDEX), s), index),
                     Term.le(index, Term.intConst(maxValue(Sort.INDEX), s)))
          : Term.le(index, Term.intConst(maxValue(Sort.INDEX), s));
      Term truncated = Term.app(FormulaOp.TRUNCATE, Sort.INDEX, index);
      Term negative = s.isSigned()
          ? Term.lt(index, Term.intConst(0, s)) : Term.FALSE;
      return Term.ite(fits, truncated,
               Term.ite(negative, Term.intConst(-1, Sort.INDEX), big));
    }
    return coerce(index, Sort.INDEX);
  }

  private Term encodeLength(LengthExpr len, EncodeContext ctx)
                        throws UnsupportedConstructException {
    Expression operand = len.operand();
    if (operand.type().nonNullable().isString()) {
      Term s = encode(operand, ctx);
      return Term.app(FormulaOp.STR_LENGTH, Sort.INDEX, s);
    }
    if (operand.kind() == ExprKind.VARIABLE) {
      Term t = ctx.lookup(((VarRef)operand).name() + LENGTH_SUFFIX);
      if (t != null) {
        return t;
      }
    }
    throw new UnsupportedConstructException(len.span(),
                              "length of " + operand);
  }

  /**
   * Convert an integer term to another integer sort, as the source
   * language converts between integer types
   */
  public static Term coerce(Term t, Sort target) {
    Sort s = t.sort();
    if (s.equals(target)) {
      return t;
    }
    assert(s.isBitVec() && target.isBitVec()) : s + " " + target;
    if (t.isConstant()) {
      return Term.intConst(OpEvaluator.wrap(t.value().getIntLit(),
                                            target.sourceType()), target);
    }
    if (s.bits() == target.bits()) {
      return Term.app(FormulaOp.REINTERPRET, target, t);
    } else if (s.bits() < target.bits()) {
      return Term.app(FormulaOp.EXTEND, target, t);
    } else {
      return Term.app(FormulaOp.TRUNCATE, target, t);
    }
  }

  static BigInteger minValue(Sort s) {
    return s.sourceType().minValue();
  }

  static BigInteger maxValue(Sort s) {
    return s.sourceType().maxValue();
  }

  private static void requireBool(Term t, Expression e)
                      throws UnsupportedConstructException {
    if (!t.sort().isBool()) {
      throw new UnsupportedConstructException(e.span(),
                                    "expected boolean: " + e);
    }
  }

  private static void requireBitVec(Term t, Expression e)
                      throws UnsupportedConstructException {
    if (!t.sort().isBitVec()) {
      throw new UnsupportedConstructException(e.span(),
                                    "expected integer: " + e);
    }
  }
}
