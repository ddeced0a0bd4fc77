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

import java.math.BigInteger;
import java.util.Map;

import exm.ceva.ast.BinaryExpr;
import exm.ceva.ast.CallExpr;
import exm.ceva.ast.Expression;
import exm.ceva.ast.LengthExpr;
import exm.ceva.ast.Literal;
import exm.ceva.ast.UnaryExpr;
import exm.ceva.ast.VarRef;
import exm.ceva.ast.Expression.ExprKind;
import exm.ceva.common.lang.Builtins;
import exm.ceva.common.lang.IntegerMode;
import exm.ceva.common.lang.OpEvaluator;
import exm.ceva.common.lang.Operators;
import exm.ceva.common.lang.Operators.BinaryOp;
import exm.ceva.common.lang.Types;
import exm.ceva.common.lang.Types.Type;
import exm.ceva.common.lang.Value;
import exm.ceva.verify.encode.FormulaEncoder;

/**
 * Evaluates contract expressions on concrete values, with the same
 * integer semantics as the formula encoder.  Used to check that a
 * solver model really violates a contract.
 */
public class ContractEvaluator {
  private final IntegerMode mode;

  public ContractEvaluator(IntegerMode mode) {
    this.mode = mode;
  }

  /**
   * @return whether the contract holds, or null if it can't be decided
   *        from the given values (unknown variables, array contents,
   *        calls, or an operation that traps)
   */
  public Boolean holds(Expression contract, Map<String, Value> env) {
    Value v = eval(contract, env);
    if (v == null || !v.isBoolVal()) {
      return null;
    }
    return v.getBoolLit();
  }

  public Value eval(Expression e, Map<String, Value> env) {
    switch (e.kind()) {
      case LITERAL: {
        Literal lit = (Literal)e;
        if (lit.value().isIntVal() && lit.type().isInteger()) {
          return Value.createIntLit(OpEvaluator.wrap(
                          lit.value().getIntLit(), lit.type()));
        }
        return lit.value();
      }
      case VARIABLE:
        return env.get(((VarRef)e).name());
      case UNARY: {
        UnaryExpr u = (UnaryExpr)e;
        Value x = eval(u.operand(), env);
        return checkRange(OpEvaluator.eval(u.op(), x), e.type());
      }
      case BINARY:
        return evalBinary((BinaryExpr)e, env);
      case CALL:
        return evalCall((CallExpr)e, env);
      case LENGTH: {
        Expression operand = ((LengthExpr)e).operand();
        if (operand.kind() == ExprKind.VARIABLE) {
          Value len = env.get(((VarRef)operand).name() +
                              FormulaEncoder.LENGTH_SUFFIX);
          if (len != null) {
            return len;
          }
        }
        Value s = eval(operand, env);
        if (s != null && s.isStringVal()) {
          return Value.createIntLit(s.getStringLit().length());
        }
        return null;
      }
      default:
        // Array contents are not part of counterexamples
        return null;
    }
  }

  private Value evalBinary(BinaryExpr b, Map<String, Value> env) {
    BinaryOp op = b.op();
    Value l = eval(b.left(), env);
    if (Operators.isLogical(op)) {
      // Right operand may be needed only if left is known
      Value shortCut = OpEvaluator.eval(op, l, null);
      if (shortCut != null) {
        return shortCut;
      }
      return OpEvaluator.eval(op, l, eval(b.right(), env));
    }
    Value r = eval(b.right(), env);
    if (l == null || r == null) {
      return null;
    }
    Type lt = b.left().type(), rt = b.right().type();
    if (l.isIntVal() && r.isIntVal() && lt.isInteger() && rt.isInteger()) {
      Type t = b.type().isInteger() ? b.type() : Types.widerInt(lt, rt);
      l = Value.createIntLit(OpEvaluator.wrap(l.getIntLit(), t));
      r = Value.createIntLit(OpEvaluator.wrap(r.getIntLit(), t));
      if (Operators.isDivision(op) && r.getIntLit().signum() == 0) {
        return null;
      }
      return checkRange(OpEvaluator.eval(op, l, r), b.type());
    }
    return OpEvaluator.eval(op, l, r);
  }

  private Value evalCall(CallExpr call, Map<String, Value> env) {
    if (!Builtins.isBuiltin(call.target()) || call.receiver() != null) {
      return null;
    }
    Value[] args = new Value[call.args().size()];
    for (int i = 0; i < args.length; i++) {
      args[i] = eval(call.args().get(i), env);
      if (args[i] == null || !(args[i].isIntVal() || args[i].isRealVal())) {
        return null;
      }
    }
    String name = call.target();
    if (name.equals(Builtins.ABS) && args.length == 1) {
      if (args[0].isIntVal()) {
        return checkRange(Value.createIntLit(args[0].getIntLit().abs()),
                          call.type());
      }
      return Value.createRealLit(Math.abs(args[0].getRealLit()));
    } else if (args.length == 2) {
      boolean min = name.equals(Builtins.MIN);
      if (args[0].isIntVal() && args[1].isIntVal()) {
        BigInteger a = args[0].getIntLit(), b = args[1].getIntLit();
        return Value.createIntLit(min ? a.min(b) : a.max(b));
      }
      double a = args[0].getRealLit(), b = args[1].getRealLit();
      return Value.createRealLit(min ? Math.min(a, b) : Math.max(a, b));
    }
    return null;
  }

  /**
   * Apply integer mode to an exact result: wrap it, or give up on it
   * if it traps
   */
  private Value checkRange(Value v, Type type) {
    if (v == null || !v.isIntVal() || !type.isInteger()) {
      return v;
    }
    if (type.inRange(v.getIntLit())) {
      return v;
    } else if (mode == IntegerMode.WRAP) {
      return Value.createIntLit(OpEvaluator.wrap(v.getIntLit(), type));
    }
    return null;
  }
}
