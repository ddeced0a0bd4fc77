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

import java.util.HashMap;
import java.util.Map;

/**
 * Operators of the expression language.
 */
public class Operators {

  public static enum BinaryOp {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    EQ("=="),
    NEQ("!="),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    AND("&&"),
    OR("||"),
    IMPLIES("->"),
    BIT_AND("&"),
    BIT_OR("|"),
    BIT_XOR("^"),
    SHL("<<"),
    SHR(">>");

    private final String symbol;

    private BinaryOp(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  public static enum UnaryOp {
    NEG("-"),
    NOT("!"),
    BIT_NOT("~");

    private final String symbol;

    private UnaryOp(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  private static final Map<String, BinaryOp> binarySymbols =
                                new HashMap<String, BinaryOp>();
  private static final Map<String, UnaryOp> unarySymbols =
                                new HashMap<String, UnaryOp>();
  static {
    for (BinaryOp op: BinaryOp.values()) {
      binarySymbols.put(op.symbol(), op);
    }
    // Alternative spellings
    binarySymbols.put("=", BinaryOp.EQ);
    binarySymbols.put("and", BinaryOp.AND);
    binarySymbols.put("or", BinaryOp.OR);
    binarySymbols.put("implies", BinaryOp.IMPLIES);
    binarySymbols.put("==>", BinaryOp.IMPLIES);
    binarySymbols.put("mod", BinaryOp.MOD);

    for (UnaryOp op: UnaryOp.values()) {
      unarySymbols.put(op.symbol(), op);
    }
    unarySymbols.put("not", UnaryOp.NOT);
    unarySymbols.put("neg", UnaryOp.NEG);
  }

  /**
   * @return the binary operator, or null if not an operator symbol
   */
  public static BinaryOp binaryFromSymbol(String symbol) {
    return binarySymbols.get(symbol);
  }

  /**
   * @return the unary operator, or null if not an operator symbol
   */
  public static UnaryOp unaryFromSymbol(String symbol) {
    return unarySymbols.get(symbol);
  }

  public static boolean isArithmetic(BinaryOp op) {
    switch (op) {
      case ADD:
      case SUB:
      case MUL:
      case DIV:
      case MOD:
        return true;
      default:
        return false;
    }
  }

  public static boolean isBitwise(BinaryOp op) {
    switch (op) {
      case BIT_AND:
      case BIT_OR:
      case BIT_XOR:
      case SHL:
      case SHR:
        return true;
      default:
        return false;
    }
  }

  public static boolean isComparison(BinaryOp op) {
    switch (op) {
      case EQ:
      case NEQ:
      case LT:
      case LTE:
      case GT:
      case GTE:
        return true;
      default:
        return false;
    }
  }

  /**
   * Boolean connectives.  These short-circuit: the right operand is only
   * evaluated depending on the left one.
   */
  public static boolean isLogical(BinaryOp op) {
    return op == BinaryOp.AND || op == BinaryOp.OR || op == BinaryOp.IMPLIES;
  }

  public static boolean isDivision(BinaryOp op) {
    return op == BinaryOp.DIV || op == BinaryOp.MOD;
  }

  /**
   * Operators that can leave the range of their integer type
   */
  public static boolean canOverflow(BinaryOp op) {
    return op == BinaryOp.ADD || op == BinaryOp.SUB ||
           op == BinaryOp.MUL || op == BinaryOp.DIV || op == BinaryOp.SHL;
  }

  /**
   * Comparison with operands swapped: a op b == b flip(op) a
   */
  public static BinaryOp flip(BinaryOp op) {
    switch (op) {
      case LT:
        return BinaryOp.GT;
      case LTE:
        return BinaryOp.GTE;
      case GT:
        return BinaryOp.LT;
      case GTE:
        return BinaryOp.LTE;
      default:
        return op;
    }
  }

  /**
   * Logical negation of comparison: !(a op b) == a negate(op) b
   */
  public static BinaryOp negate(BinaryOp op) {
    switch (op) {
      case EQ:
        return BinaryOp.NEQ;
      case NEQ:
        return BinaryOp.EQ;
      case LT:
        return BinaryOp.GTE;
      case LTE:
        return BinaryOp.GT;
      case GT:
        return BinaryOp.LTE;
      case GTE:
        return BinaryOp.LT;
      default:
        throw new IllegalArgumentException("Not a comparison: " + op);
    }
  }
}
