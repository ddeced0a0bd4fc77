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

package exm.ceva.common.lang;

import java.math.BigInteger;

import exm.ceva.common.lang.Operators.BinaryOp;
import exm.ceva.common.lang.Operators.UnaryOp;
import exm.ceva.common.lang.Types.Type;

/**
 * Compile time evaluation of operators on constant values.
 *
 * Integer results are exact (unbounded): callers decide what happens when
 * the result leaves the range of the declared type, see wrap() and
 * Type.inRange().
 */
public class OpEvaluator {

  /**
   * Try to do compile-time evaluation of operator
   *
   * @param op
   * @param left null if not constant
   * @param right null if not constant
   * @return output value of op if it could be evaluated at compile-time, null
   *         otherwise.  Also null for division by zero, which is left for
   *         the bug-pattern checks to report.
   */
  public static Value eval(BinaryOp op, Value left, Value right) {
    if (Operators.isLogical(op)) {
      return evalShortCircuit(op, left, right);
    }
    if (left == null || right == null) {
      return null;
    }
    if (left.isIntVal() && right.isIntVal()) {
      return evalIntOp(op, left.getIntLit(), right.getIntLit());
    } else if (isNumeric(left) && isNumeric(right)) {
      return evalRealOp(op, left.getRealLit(), right.getRealLit());
    } else if (left.isBoolVal() && right.isBoolVal()) {
      return evalBoolOp(op, left.getBoolLit(), right.getBoolLit());
    } else if (op == BinaryOp.EQ || op == BinaryOp.NEQ) {
      // Strings, nulls, mixed null/non-null
      boolean eq = left.equals(right);
      return Value.createBoolLit(op == BinaryOp.EQ ? eq : !eq);
    } else if (op == BinaryOp.ADD && left.isStringVal() &&
               right.isStringVal()) {
      return Value.createStringLit(left.getStringLit() + right.getStringLit());
    }
    return null;
  }

  private static boolean isNumeric(Value v) {
    return v.isIntVal() || v.isRealVal();
  }

  /**
   * Short-circuit connectives can sometimes be evaluated with only the
   * left argument known
   */
  private static Value evalShortCircuit(BinaryOp op, Value left, Value right) {
    if (left == null || !left.isBoolVal()) {
      return null;
    }
    boolean l = left.getBoolLit();
    switch (op) {
      case AND:
        if (!l) {
          return Value.createBoolLit(false);
        }
        break;
      case OR:
        if (l) {
          return Value.createBoolLit(true);
        }
        break;
      case IMPLIES:
        if (!l) {
          return Value.createBoolLit(true);
        }
        break;
      default:
        throw new IllegalArgumentException(op.toString());
    }
    if (right == null || !right.isBoolVal()) {
      return null;
    }
    return right;
  }

  private static Value evalIntOp(BinaryOp op, BigInteger a, BigInteger b) {
    switch (op) {
      case ADD:
        return Value.createIntLit(a.add(b));
      case SUB:
        return Value.createIntLit(a.subtract(b));
      case MUL:
        return Value.createIntLit(a.multiply(b));
      case DIV:
        if (b.signum() == 0) {
          return null;
        }
        // BigInteger division truncates toward zero like the target language
        return Value.createIntLit(a.divide(b));
      case MOD:
        if (b.signum() == 0) {
          return null;
        }
        return Value.createIntLit(a.remainder(b));
      case EQ:
        return Value.createBoolLit(a.equals(b));
      case NEQ:
        return Value.createBoolLit(!a.equals(b));
      case LT:
        return Value.createBoolLit(a.compareTo(b) < 0);
      case LTE:
        return Value.createBoolLit(a.compareTo(b) <= 0);
      case GT:
        return Value.createBoolLit(a.compareTo(b) > 0);
      case GTE:
        return Value.createBoolLit(a.compareTo(b) >= 0);
      case BIT_AND:
        return Value.createIntLit(a.and(b));
      case BIT_OR:
        return Value.createIntLit(a.or(b));
      case BIT_XOR:
        return Value.createIntLit(a.xor(b));
      case SHL:
        if (b.signum() < 0 || b.bitLength() > 7) {
          return null;
        }
        return Value.createIntLit(a.shiftLeft(b.intValue()));
      case SHR:
        if (b.signum() < 0 || b.bitLength() > 7) {
          return null;
        }
        return Value.createIntLit(a.shiftRight(b.intValue()));
      default:
        return null;
    }
  }

  private static Value evalRealOp(BinaryOp op, double a, double b) {
    switch (op) {
      case ADD:
        return Value.createRealLit(a + b);
      case SUB:
        return Value.createRealLit(a - b);
      case MUL:
        return Value.createRealLit(a * b);
      case DIV:
        if (b == 0.0) {
          return null;
        }
        return Value.createRealLit(a / b);
      case EQ:
        return Value.createBoolLit(a == b);
      case NEQ:
        return Value.createBoolLit(a != b);
      case LT:
        return Value.createBoolLit(a < b);
      case LTE:
        return Value.createBoolLit(a <= b);
      case GT:
        return Value.createBoolLit(a > b);
      case GTE:
        return Value.createBoolLit(a >= b);
      default:
        return null;
    }
  }

  private static Value evalBoolOp(BinaryOp op, boolean a, boolean b) {
    switch (op) {
      case EQ:
        return Value.createBoolLit(a == b);
      case NEQ:
      case BIT_XOR:
        return Value.createBoolLit(a != b);
      case BIT_AND:
        return Value.createBoolLit(a && b);
      case BIT_OR:
        return Value.createBoolLit(a || b);
      default:
        return null;
    }
  }

  public static Value eval(UnaryOp op, Value operand) {
    if (operand == null) {
      return null;
    }
    switch (op) {
      case NEG:
        if (operand.isIntVal()) {
          return Value.createIntLit(operand.getIntLit().negate());
        } else if (operand.isRealVal()) {
          return Value.createRealLit(-operand.getRealLit());
        }
        return null;
      case NOT:
        if (operand.isBoolVal()) {
          return Value.createBoolLit(!operand.getBoolLit());
        }
        return null;
      case BIT_NOT:
        if (operand.isIntVal()) {
          return Value.createIntLit(operand.getIntLit().not());
        }
        return null;
      default:
        return null;
    }
  }

  /**
   * Reduce an exact integer into the range of a type using two's
   * complement wrap-around
   */
  public static BigInteger wrap(BigInteger v, Type type) {
    BigInteger modulus = BigInteger.ONE.shiftLeft(type.bits());
    BigInteger r = v.mod(modulus);
    if (type.isSigned() && r.compareTo(type.maxValue()) > 0) {
      r = r.subtract(modulus);
    }
    return r;
  }

  /**
   * Interpret the unsigned bit pattern of a bit-vector as a value of type
   */
  public static BigInteger fromBits(BigInteger unsignedBits, Type type) {
    return wrap(unsignedBits, type);
  }
}
