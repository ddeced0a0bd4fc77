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

import java.math.BigInteger;
import java.util.List;

import exm.ceva.analysis.dataflow.DataflowAnalysis;
import exm.ceva.ast.BinaryExpr;
import exm.ceva.ast.CallExpr;
import exm.ceva.ast.ConstantFolder;
import exm.ceva.ast.Expression;
import exm.ceva.ast.Expression.ExprKind;
import exm.ceva.ast.Expressions;
import exm.ceva.ast.Function;
import exm.ceva.ast.IndexExpr;
import exm.ceva.ast.LengthExpr;
import exm.ceva.ast.Literal;
import exm.ceva.ast.Statement;
import exm.ceva.ast.UnaryExpr;
import exm.ceva.ast.VarRef;
import exm.ceva.cfg.BasicBlock;
import exm.ceva.cfg.Edge;
import exm.ceva.common.lang.Builtins;
import exm.ceva.common.lang.Operators;
import exm.ceva.common.lang.Operators.BinaryOp;
import exm.ceva.common.lang.Types;
import exm.ceva.common.lang.Types.Type;
import exm.ceva.common.lang.Value;

/**
 * Forward value-range and nullness analysis.  Facts at entry come from
 * the parameter types and the preconditions; branch conditions refine
 * facts along the true and false edges.
 */
public class ValueRangeAnalysis extends DataflowAnalysis<RangeFacts> {

  private static final ValueRange LENGTH_RANGE =
                  ValueRange.of(BigInteger.ZERO, Types.I32.maxValue());

  private final Function function;

  public ValueRangeAnalysis(Function function) {
    this.function = function;
  }

  @Override
  public Direction direction() {
    return Direction.FORWARD;
  }

  @Override
  public RangeFacts boundaryFact() {
    RangeFacts facts = RangeFacts.EMPTY;
    for (Expression pre: function.preconditions()) {
      facts = assume(pre, true, facts);
    }
    return facts;
  }

  @Override
  public RangeFacts initialFact() {
    return RangeFacts.BOTTOM;
  }

  @Override
  public RangeFacts join(RangeFacts a, RangeFacts b) {
    return a.join(b);
  }

  @Override
  public RangeFacts widen(RangeFacts previous, RangeFacts next) {
    return previous.widen(next);
  }

  @Override
  public RangeFacts transferBlock(BasicBlock block, RangeFacts input) {
    RangeFacts facts = input;
    for (Statement stmt: block.statements()) {
      facts = transfer(stmt, facts);
    }
    return facts;
  }

  @Override
  public RangeFacts transferEdge(Edge edge, RangeFacts fact) {
    RangeFacts result = fact;
    if (edge.isTrueOutcome()) {
      result = assume(edge.from().branchCondition(), true, fact);
    } else if (edge.isFalseOutcome()) {
      result = assume(edge.from().branchCondition(), false, fact);
    }
    // Infeasible edge
    return result.isBottom() ? null : result;
  }

  public RangeFacts transfer(Statement stmt, RangeFacts facts) {
    if (facts.isBottom()) {
      return facts;
    }
    switch (stmt.kind()) {
      case UNKNOWN:
        return RangeFacts.EMPTY;
      case BIND:
      case ASSIGN: {
        String var = Expressions.definedVar(stmt);
        Expression value = Expressions.storedValue(stmt);
        RangeFacts result = derefsSucceeded(stmt, facts).forget(var);
        if (value != null) {
          result = define(var, value, facts, result);
        }
        return result;
      }
      default:
        return derefsSucceeded(stmt, facts);
    }
  }

  private RangeFacts define(String var, Expression value, RangeFacts before,
                            RangeFacts after) {
    Type t = value.type();
    RangeFacts result = after;
    if (t.isInteger()) {
      result = result.withRange(var, range(value, before));
    } else if (t.isArray()) {
      result = result.withLength(var, lengthOf(value, before));
    }
    if (!result.isBottom()) {
      result = result.withNullness(var, nullness(value, before));
    }
    return result;
  }

  /**
   * After a statement completes, anything it dereferenced was non-null
   */
  private RangeFacts derefsSucceeded(Statement stmt, RangeFacts facts) {
    RangeFacts result = facts;
    for (Expression e: stmt.expressions()) {
      result = markDerefs(e, result);
    }
    return result;
  }

  private RangeFacts markDerefs(Expression e, RangeFacts facts) {
    RangeFacts result = facts;
    if (e.kind() == ExprKind.BINARY &&
        Operators.isLogical(((BinaryExpr)e).op())) {
      // Right operand may not have run
      return markDerefs(((BinaryExpr)e).left(), result);
    }
    for (Expression child: e.children()) {
      result = markDerefs(child, result);
    }
    Expression obj = dereferenced(e);
    if (obj != null && obj.kind() == ExprKind.VARIABLE) {
      result = result.withNullness(((VarRef)obj).name(), Nullness.NON_NULL);
    }
    return result;
  }

  /**
   * @return the object dereferenced by e, or null if e doesn't
   *         dereference anything
   */
  public static Expression dereferenced(Expression e) {
    switch (e.kind()) {
      case INDEX:
        return ((IndexExpr)e).array();
      case LENGTH:
        return ((LengthExpr)e).operand();
      case CALL:
        return ((CallExpr)e).receiver();
      default:
        return null;
    }
  }

  /* -- evaluation -- */

  /**
   * @return range of values e may have, within the range of e's type
   */
  public ValueRange range(Expression e, RangeFacts facts) {
    return normalize(exactRange(e, facts), e.type());
  }

  private static ValueRange normalize(ValueRange r, Type t) {
    if (!t.isInteger()) {
      return r;
    }
    ValueRange typeRange = ValueRange.forType(t);
    if (r.within(t)) {
      return r;
    } else if (r.disjoint(t.minValue(), t.maxValue())) {
      // Always overflows: result depends on integer mode
      return typeRange;
    }
    return r.intersect(typeRange);
  }

  /**
   * Range of the mathematically exact result of e, before any wrapping
   * to the type of e
   */
  public ValueRange exactRange(Expression e, RangeFacts facts) {
    switch (e.kind()) {
      case LITERAL: {
        Value v = ((Literal)e).value();
        if (v.isIntVal()) {
          return ValueRange.constant(v.getIntLit());
        }
        return ValueRange.TOP;
      }
      case VARIABLE: {
        ValueRange known = facts.range(((VarRef)e).name());
        ValueRange typeRange = ValueRange.forType(e.type());
        return known == null ? typeRange : known.intersect(typeRange);
      }
      case UNARY: {
        UnaryExpr u = (UnaryExpr)e;
        if (u.op() == Operators.UnaryOp.NEG) {
          return range(u.operand(), facts).negate();
        }
        return ValueRange.forType(e.type());
      }
      case BINARY:
        return binaryRange((BinaryExpr)e, facts);
      case LENGTH:
        return lengthOf(((LengthExpr)e).operand(), facts);
      case CALL:
        return callRange((CallExpr)e, facts);
      default:
        return ValueRange.forType(e.type());
    }
  }

  private ValueRange binaryRange(BinaryExpr b, RangeFacts facts) {
    if (!b.type().isInteger()) {
      return ValueRange.TOP;
    }
    Value constant = ConstantFolder.fold(b);
    if (constant != null && constant.isIntVal()) {
      return ValueRange.constant(constant.getIntLit());
    }
    ValueRange l = range(b.left(), facts);
    ValueRange r = range(b.right(), facts);
    switch (b.op()) {
      case ADD:
        return l.add(r);
      case SUB:
        return l.subtract(r);
      case MUL:
        return l.multiply(r);
      case DIV:
        return l.divide(r);
      case MOD:
        return l.remainder(r);
      default:
        return ValueRange.forType(b.type());
    }
  }

  private ValueRange callRange(CallExpr call, RangeFacts facts) {
    List<Expression> args = call.args();
    if (call.receiver() == null && Builtins.isBuiltin(call.target()) &&
        call.type().isInteger()) {
      if (call.target().equals(Builtins.ABS) && args.size() == 1) {
        return range(args.get(0), facts).abs();
      } else if (args.size() == 2) {
        ValueRange a = range(args.get(0), facts);
        ValueRange b = range(args.get(1), facts);
        return call.target().equals(Builtins.MIN) ? a.min(b) : a.max(b);
      }
    }
    return ValueRange.forType(call.type());
  }

  /**
   * Range of the length of an array-valued expression
   */
  public ValueRange lengthOf(Expression array, RangeFacts facts) {
    if (array.kind() == ExprKind.VARIABLE) {
      ValueRange known = facts.length(((VarRef)array).name());
      if (known != null) {
        return known.intersect(LENGTH_RANGE);
      }
    }
    return LENGTH_RANGE;
  }

  /**
   * @return true if something specific is known about the length of the
   *        array, e.g. from a precondition or a test
   */
  public boolean lengthKnown(Expression array, RangeFacts facts) {
    return array.kind() == ExprKind.VARIABLE &&
           facts.length(((VarRef)array).name()) != null;
  }

  public Nullness nullness(Expression e, RangeFacts facts) {
    switch (e.kind()) {
      case LITERAL:
        return ((Literal)e).value().isNull() ? Nullness.NULL
                                             : Nullness.NON_NULL;
      case VARIABLE: {
        Nullness known = facts.nullness(((VarRef)e).name());
        if (known != null) {
          return known;
        }
        return e.type().isNullable() ? Nullness.MAYBE_NULL : Nullness.NON_NULL;
      }
      default:
        return e.type().isNullable() ? Nullness.MAYBE_NULL : Nullness.NON_NULL;
    }
  }

  /* -- refinement -- */

  /**
   * Refine facts with the knowledge that cond evaluated to outcome
   * @return refined facts, BOTTOM if that is impossible
   */
  public RangeFacts assume(Expression cond, boolean outcome,
                           RangeFacts facts) {
    if (facts.isBottom()) {
      return facts;
    }
    Boolean constant = ConstantFolder.foldCondition(cond);
    if (constant != null) {
      return constant == outcome ? facts : RangeFacts.BOTTOM;
    }
    if (cond.kind() == ExprKind.UNARY &&
        ((UnaryExpr)cond).op() == Operators.UnaryOp.NOT) {
      return assume(((UnaryExpr)cond).operand(), !outcome, facts);
    }
    if (cond.kind() != ExprKind.BINARY) {
      return facts;
    }
    BinaryExpr b = (BinaryExpr)cond;
    Expression l = b.left();
    Expression r = b.right();
    switch (b.op()) {
      case AND:
        if (outcome) {
          return assume(r, true, assume(l, true, facts));
        }
        return assume(l, false, facts).join(
               assume(r, false, assume(l, true, facts)));
      case OR:
        if (outcome) {
          return assume(l, true, facts).join(
                 assume(r, true, assume(l, false, facts)));
        }
        return assume(r, false, assume(l, false, facts));
      case IMPLIES:
        if (outcome) {
          return assume(l, false, facts).join(
                 assume(r, true, assume(l, true, facts)));
        }
        return assume(r, false, assume(l, true, facts));
      default:
        break;
    }
    if (!Operators.isComparison(b.op())) {
      return facts;
    }
    BinaryOp op = outcome ? b.op() : Operators.negate(b.op());
    if (op == BinaryOp.EQ || op == BinaryOp.NEQ) {
      RangeFacts nullRefined = assumeNullCheck(l, op, r, facts);
      if (nullRefined != null) {
        return nullRefined;
      }
    }
    RangeFacts result = refine(l, op, r, facts);
    return refine(r, Operators.flip(op), l, result);
  }

  private RangeFacts assumeNullCheck(Expression l, BinaryOp op,
                                     Expression r, RangeFacts facts) {
    Expression var;
    if (isNullLiteral(r)) {
      var = l;
    } else if (isNullLiteral(l)) {
      var = r;
    } else {
      return null;
    }
    if (var.kind() != ExprKind.VARIABLE) {
      return facts;
    }
    String name = ((VarRef)var).name();
    Nullness current = nullness(var, facts);
    Nullness assumed = op == BinaryOp.EQ ? Nullness.NULL : Nullness.NON_NULL;
    if (current != Nullness.MAYBE_NULL && current != assumed) {
      return RangeFacts.BOTTOM;
    }
    return facts.withNullness(name, assumed);
  }

  private static boolean isNullLiteral(Expression e) {
    return e.kind() == ExprKind.LITERAL && ((Literal)e).value().isNull();
  }

  /**
   * Narrow what is known about target given "target op other"
   */
  private RangeFacts refine(Expression target, BinaryOp op, Expression other,
                            RangeFacts facts) {
    if (facts.isBottom() || !target.type().isInteger() ||
        !other.type().isInteger()) {
      return facts;
    }
    boolean isLength = target.kind() == ExprKind.LENGTH &&
        ((LengthExpr)target).operand().kind() == ExprKind.VARIABLE;
    if (target.kind() != ExprKind.VARIABLE && !isLength) {
      return facts;
    }
    ValueRange cur = range(target, facts);
    ValueRange bound = range(other, facts);
    ValueRange refined = narrow(cur, op, bound);
    if (refined.equals(cur)) {
      return facts;
    }
    if (isLength) {
      VarRef array = (VarRef)((LengthExpr)target).operand();
      return facts.withLength(array.name(), refined);
    }
    return facts.withRange(((VarRef)target).name(), refined);
  }

  private static ValueRange narrow(ValueRange cur, BinaryOp op,
                                   ValueRange bound) {
    switch (op) {
      case LT:
        return bound.hi() == null ? cur
               : cur.atMost(bound.hi().subtract(BigInteger.ONE));
      case LTE:
        return bound.hi() == null ? cur : cur.atMost(bound.hi());
      case GT:
        return bound.lo() == null ? cur
               : cur.atLeast(bound.lo().add(BigInteger.ONE));
      case GTE:
        return bound.lo() == null ? cur : cur.atLeast(bound.lo());
      case EQ:
        return cur.intersect(bound);
      case NEQ:
        if (!bound.isConstant()) {
          return cur;
        }
        if (bound.isZero()) {
          return cur.withoutZero();
        } else if (bound.lo().equals(cur.lo())) {
          return cur.atLeast(cur.lo().add(BigInteger.ONE));
        } else if (bound.hi().equals(cur.hi())) {
          return cur.atMost(cur.hi().subtract(BigInteger.ONE));
        }
        return cur;
      default:
        return cur;
    }
  }
}
