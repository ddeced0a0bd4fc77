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

import exm.ceva.common.exceptions.UnsupportedConstructException;
import exm.ceva.common.lang.SourceSpan;
import exm.ceva.common.lang.Types;
import exm.ceva.common.lang.Types.Type;

/**
 * Sorts of formula terms.  Bit-vectors remember the signedness of the
 * source type, which decides how comparisons, division and extension
 * are encoded.
 */
public class Sort {
  public static enum SortKind {
    BOOL,
    BITVEC,
    REAL,
    STRING,
    ARRAY,
  }

  public static final Sort BOOL = new Sort(SortKind.BOOL, 0, false, null);
  public static final Sort REAL = new Sort(SortKind.REAL, 0, false, null);
  public static final Sort STRING = new Sort(SortKind.STRING, 0, false, null);
  /** Array indices and lengths */
  public static final Sort INDEX = bitVec(32, true);

  private final SortKind kind;
  private final int bits;
  private final boolean signed;
  private final Sort elemSort;

  private Sort(SortKind kind, int bits, boolean signed, Sort elemSort) {
    this.kind = kind;
    this.bits = bits;
    this.signed = signed;
    this.elemSort = elemSort;
  }

  public static Sort bitVec(int bits, boolean signed) {
    return new Sort(SortKind.BITVEC, bits, signed, null);
  }

  public static Sort arrayOf(Sort elemSort) {
    return new Sort(SortKind.ARRAY, 0, false, elemSort);
  }

  /**
   * Sort of values of a source type.  Nullable types get the sort of
   * the non-null type: comparisons with null are rejected separately.
   * @throws UnsupportedConstructException if there is no encoding
   */
  public static Sort forType(Type type, SourceSpan span)
                      throws UnsupportedConstructException {
    Type t = type.nonNullable();
    if (t.isInteger()) {
      return bitVec(t.bits(), t.isSigned());
    } else if (t.isFloat()) {
      return REAL;
    } else if (t.isBool()) {
      return BOOL;
    } else if (t.isString()) {
      return STRING;
    } else if (t.isArray()) {
      return arrayOf(forType(t.elemType(), span));
    }
    throw new UnsupportedConstructException(span,
                  "no solver encoding for values of type " + type);
  }

  /**
   * Inverse of forType() for sorts with a source type
   */
  public Type sourceType() {
    switch (kind) {
      case BOOL:
        return Types.BOOL;
      case REAL:
        return Types.F64;
      case STRING:
        return Types.STRING;
      case BITVEC:
        return Types.parse((signed ? "i" : "u") + bits);
      default:
        return Types.arrayOf(elemSort.sourceType());
    }
  }

  public SortKind kind() {
    return kind;
  }

  public boolean isBool() {
    return kind == SortKind.BOOL;
  }

  public boolean isBitVec() {
    return kind == SortKind.BITVEC;
  }

  public boolean isReal() {
    return kind == SortKind.REAL;
  }

  public boolean isString() {
    return kind == SortKind.STRING;
  }

  public boolean isArray() {
    return kind == SortKind.ARRAY;
  }

  public int bits() {
    assert(isBitVec()) : this;
    return bits;
  }

  public boolean isSigned() {
    assert(isBitVec()) : this;
    return signed;
  }

  public Sort elemSort() {
    assert(isArray()) : this;
    return elemSort;
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Sort && toString().equals(obj.toString());
  }

  @Override
  public String toString() {
    switch (kind) {
      case BITVEC:
        return (signed ? "(_ BitVec " : "(_ UBitVec ") + bits + ")";
      case ARRAY:
        return "(Array " + INDEX + " " + elemSort + ")";
      case BOOL:
        return "Bool";
      case REAL:
        return "Real";
      default:
        return "String";
    }
  }
}
