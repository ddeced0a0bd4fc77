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

package exm.ceva.verify.formula;

/**
 * Operators of formula terms.  Arithmetic and comparison operators apply
 * to bit-vector and real sorts; for bit-vectors the signedness of the
 * operand sort selects the signed or unsigned variant.
 */
public enum FormulaOp {
  ADD,
  SUB,
  MUL,
  /** Truncating division */
  DIV,
  /** Remainder with the sign of the dividend */
  REM,
  NEG,

  EQ,
  LT,
  LE,

  AND,
  OR,
  NOT,
  IMPLIES,
  ITE,

  BIT_AND,
  BIT_OR,
  BIT_XOR,
  BIT_NOT,
  SHL,
  /** Arithmetic shift for signed operands, logical otherwise */
  SHR,

  /** Widen to the result sort: sign or zero extension per operand sort */
  EXTEND,
  /** Keep the low bits of the operand */
  TRUNCATE,
  /** Convert between signed and unsigned bit-vectors of equal width */
  REINTERPRET,

  /** Length of a string, as an INDEX bit-vector */
  STR_LENGTH,

  SELECT,
  STORE;

  public boolean isComparison() {
    return this == EQ || this == LT || this == LE;
  }
}
