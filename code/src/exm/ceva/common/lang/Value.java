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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.ceva.common.exceptions.CevaRuntimeError;

/**
 * A concrete value: a literal in the source program, or a value taken from
 * a solver model.  Integers are kept as BigInteger so that out-of-range
 * results can be represented and checked.
 */
public class Value {

  public static enum ValueKind {
    INTVAL,
    REALVAL,
    BOOLVAL,
    STRINGVAL,
    NULLVAL,
    ARRAYVAL,
  }

  private static final Value NULL_VALUE = new Value(ValueKind.NULLVAL, null,
                                           0.0, false, null, null);
  private static final Value TRUE = new Value(ValueKind.BOOLVAL, null,
                                           0.0, true, null, null);
  private static final Value FALSE = new Value(ValueKind.BOOLVAL, null,
                                           0.0, false, null, null);

  private final ValueKind kind;
  private final BigInteger intlit;
  private final double reallit;
  private final boolean boollit;
  private final String stringlit;
  private final List<Value> elems;

  private Value(ValueKind kind, BigInteger intlit, double reallit,
                boolean boollit, String stringlit, List<Value> elems) {
    this.kind = kind;
    this.intlit = intlit;
    this.reallit = reallit;
    this.boollit = boollit;
    this.stringlit = stringlit;
    this.elems = elems;
  }

  public static Value createIntLit(BigInteger v) {
    assert(v != null);
    return new Value(ValueKind.INTVAL, v, 0.0, false, null, null);
  }

  public static Value createIntLit(long v) {
    return createIntLit(BigInteger.valueOf(v));
  }

  public static Value createRealLit(double v) {
    return new Value(ValueKind.REALVAL, null, v, false, null, null);
  }

  public static Value createBoolLit(boolean v) {
    return v ? TRUE : FALSE;
  }

  public static Value createStringLit(String v) {
    assert(v != null);
    return new Value(ValueKind.STRINGVAL, null, 0.0, false, v, null);
  }

  public static Value createArray(List<Value> elems) {
    return new Value(ValueKind.ARRAYVAL, null, 0.0, false, null,
              Collections.unmodifiableList(new ArrayList<Value>(elems)));
  }

  public static Value nullValue() {
    return NULL_VALUE;
  }

  public ValueKind getKind() {
    return kind;
  }

  public boolean isIntVal() {
    return kind == ValueKind.INTVAL;
  }

  public boolean isRealVal() {
    return kind == ValueKind.REALVAL;
  }

  public boolean isBoolVal() {
    return kind == ValueKind.BOOLVAL;
  }

  public boolean isStringVal() {
    return kind == ValueKind.STRINGVAL;
  }

  public boolean isNull() {
    return kind == ValueKind.NULLVAL;
  }

  public boolean isArrayVal() {
    return kind == ValueKind.ARRAYVAL;
  }

  public BigInteger getIntLit() {
    if (kind == ValueKind.INTVAL) {
      return intlit;
    } else {
      throw new CevaRuntimeError("getIntLit for non-int value " + this);
    }
  }

  public double getRealLit() {
    if (kind == ValueKind.REALVAL) {
      return reallit;
    } else if (kind == ValueKind.INTVAL) {
      return intlit.doubleValue();
    } else {
      throw new CevaRuntimeError("getRealLit for non-numeric value " + this);
    }
  }

  public boolean getBoolLit() {
    if (kind == ValueKind.BOOLVAL) {
      return boollit;
    } else {
      throw new CevaRuntimeError("getBoolLit for non-bool value " + this);
    }
  }

  public String getStringLit() {
    if (kind == ValueKind.STRINGVAL) {
      return stringlit;
    } else {
      throw new CevaRuntimeError("getStringLit for non-string value " + this);
    }
  }

  public List<Value> getElems() {
    if (kind == ValueKind.ARRAYVAL) {
      return elems;
    } else {
      throw new CevaRuntimeError("getElems for non-array value " + this);
    }
  }

  /**
   * Parse a value from its toString() form, given the kind
   */
  public static Value parse(ValueKind kind, String text) {
    switch (kind) {
      case INTVAL:
        return createIntLit(new BigInteger(text.trim()));
      case REALVAL:
        return createRealLit(Double.parseDouble(text.trim()));
      case BOOLVAL:
        return createBoolLit(Boolean.parseBoolean(text.trim()));
      case STRINGVAL:
        return createStringLit(unquote(text));
      case NULLVAL:
        return NULL_VALUE;
      default:
        throw new CevaRuntimeError("Cannot parse value of kind " + kind);
    }
  }

  public static String quote(String s) {
    return "\"" + StringUtils.replaceEach(s, new String[] {"\\", "\""},
                                     new String[] {"\\\\", "\\\""}) + "\"";
  }

  public static String unquote(String s) {
    String t = s.trim();
    if (t.length() >= 2 && t.startsWith("\"") && t.endsWith("\"")) {
      t = t.substring(1, t.length() - 1);
      return StringUtils.replaceEach(t, new String[] {"\\\"", "\\\\"},
                                        new String[] {"\"", "\\"});
    }
    return t;
  }

  @Override
  public String toString() {
    switch (kind) {
      case INTVAL:
        return intlit.toString();
      case REALVAL:
        return Double.toString(reallit);
      case BOOLVAL:
        return Boolean.toString(boollit);
      case STRINGVAL:
        return quote(stringlit);
      case NULLVAL:
        return "null";
      case ARRAYVAL:
        return "[" + StringUtils.join(elems, ", ") + "]";
      default:
        throw new CevaRuntimeError("Unknown value kind " + kind);
    }
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 31 + toString().hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Value)) {
      return false;
    }
    Value other = (Value) obj;
    return kind == other.kind && toString().equals(other.toString());
  }
}
