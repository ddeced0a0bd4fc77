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
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

import exm.ceva.common.exceptions.CevaRuntimeError;

/**
 * Static types of the source language.
 *
 * Integer types are bounded and carry their width and signedness, since
 * both the verifier and the overflow checks need the exact range.
 */
public class Types {

  public static enum TypeKind {
    INT,
    FLOAT,
    BOOL,
    STRING,
    ARRAY,
    VOID,
    /** Opaque named type, e.g. a class from the target language */
    NAMED,
  }

  public static class Type {
    private final TypeKind kind;
    private final String name;
    private final int bits;
    private final boolean signed;
    private final Type elemType;
    private final boolean nullable;

    private Type(TypeKind kind, String name, int bits, boolean signed,
                 Type elemType, boolean nullable) {
      this.kind = kind;
      this.name = name;
      this.bits = bits;
      this.signed = signed;
      this.elemType = elemType;
      this.nullable = nullable;
    }

    public TypeKind kind() {
      return kind;
    }

    public boolean isInteger() {
      return kind == TypeKind.INT;
    }

    public boolean isFloat() {
      return kind == TypeKind.FLOAT;
    }

    public boolean isNumeric() {
      return isInteger() || isFloat();
    }

    public boolean isBool() {
      return kind == TypeKind.BOOL;
    }

    public boolean isString() {
      return kind == TypeKind.STRING;
    }

    public boolean isArray() {
      return kind == TypeKind.ARRAY;
    }

    public boolean isVoid() {
      return kind == TypeKind.VOID;
    }

    public boolean isNullable() {
      return nullable;
    }

    /**
     * @return width in bits of integer type
     */
    public int bits() {
      assert(isInteger()) : this;
      return bits;
    }

    public boolean isSigned() {
      assert(isInteger()) : this;
      return signed;
    }

    public Type elemType() {
      assert(isArray()) : this;
      return elemType;
    }

    public BigInteger minValue() {
      assert(isInteger()) : this;
      if (signed) {
        return BigInteger.ONE.shiftLeft(bits - 1).negate();
      } else {
        return BigInteger.ZERO;
      }
    }

    public BigInteger maxValue() {
      assert(isInteger()) : this;
      if (signed) {
        return BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE);
      } else {
        return BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
      }
    }

    public boolean inRange(BigInteger v) {
      return v.compareTo(minValue()) >= 0 && v.compareTo(maxValue()) <= 0;
    }

    public Type asNullable() {
      if (nullable) {
        return this;
      }
      return new Type(kind, name, bits, signed, elemType, true);
    }

    public Type nonNullable() {
      if (!nullable) {
        return this;
      }
      return new Type(kind, name, bits, signed, elemType, false);
    }

    /**
     * Canonical name, parseable by Types.parse()
     */
    public String typeName() {
      String base;
      if (kind == TypeKind.ARRAY) {
        base = "[" + elemType.typeName() + "]";
      } else {
        base = name;
      }
      return nullable ? base + "?" : base;
    }

    @Override
    public String toString() {
      return typeName();
    }

    @Override
    public int hashCode() {
      return typeName().hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Type)) {
        return false;
      }
      return typeName().equals(((Type)obj).typeName());
    }
  }

  public static final Type I8 = intType(8, true);
  public static final Type I16 = intType(16, true);
  public static final Type I32 = intType(32, true);
  public static final Type I64 = intType(64, true);
  public static final Type U8 = intType(8, false);
  public static final Type U16 = intType(16, false);
  public static final Type U32 = intType(32, false);
  public static final Type U64 = intType(64, false);
  public static final Type F64 = new Type(TypeKind.FLOAT, "f64", 64, true,
                                          null, false);
  public static final Type BOOL = new Type(TypeKind.BOOL, "bool", 1, false,
                                           null, false);
  public static final Type STRING = new Type(TypeKind.STRING, "str", 0, false,
                                             null, false);
  public static final Type VOID = new Type(TypeKind.VOID, "void", 0, false,
                                           null, false);

  /** Type of the null literal */
  public static final Type NULL = named("null").asNullable();

  /** Looks like an integer type, so can't be an opaque name */
  private static final Pattern INT_TYPE_NAME =
                                  Pattern.compile("[iuIU][0-9]+");

  private static final Map<String, Type> builtinNames =
                                  new HashMap<String, Type>();
  static {
    for (Type t: new Type[] {I8, I16, I32, I64, U8, U16, U32, U64,
                             F64, BOOL, STRING, VOID}) {
      builtinNames.put(t.typeName(), t);
    }
    builtinNames.put("int", I32);
    builtinNames.put("long", I64);
    builtinNames.put("byte", U8);
    builtinNames.put("float", F64);
    builtinNames.put("double", F64);
    builtinNames.put("string", STRING);
    builtinNames.put("boolean", BOOL);
  }

  private static Type intType(int bits, boolean signed) {
    return new Type(TypeKind.INT, (signed ? "i" : "u") + bits,
                    bits, signed, null, false);
  }

  public static Type arrayOf(Type elemType) {
    return new Type(TypeKind.ARRAY, null, 0, false, elemType, false);
  }

  public static Type named(String name) {
    return new Type(TypeKind.NAMED, name, 0, false, null, false);
  }

  /**
   * Parse a type name such as i32, u8?, [str] or [[i64]]
   * @param text
   * @return the type
   */
  public static Type parse(String text) {
    String s = text.trim();
    if (s.isEmpty()) {
      throw new CevaRuntimeError("Empty type name");
    }
    if (s.endsWith("?")) {
      return parse(s.substring(0, s.length() - 1)).asNullable();
    }
    if (s.startsWith("[")) {
      if (!s.endsWith("]")) {
        throw new CevaRuntimeError("Bad array type: " + text);
      }
      return arrayOf(parse(s.substring(1, s.length() - 1)));
    }
    Type builtin = builtinNames.get(s.toLowerCase());
    if (builtin != null) {
      return builtin;
    }
    if (INT_TYPE_NAME.matcher(s).matches()) {
      throw new CevaRuntimeError("Unsupported integer width: " + text);
    }
    return named(s);
  }

  /**
   * The type arithmetic on two integer operands is carried out in:
   * the wider of the two, or the signed one if equal widths differ
   * in signedness.
   */
  public static Type widerInt(Type a, Type b) {
    assert(a.isInteger() && b.isInteger());
    if (a.bits() != b.bits()) {
      return a.bits() > b.bits() ? a : b;
    }
    return a.isSigned() ? a : b;
  }
}
