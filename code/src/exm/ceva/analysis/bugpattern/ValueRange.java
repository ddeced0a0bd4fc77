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

import exm.ceva.common.lang.Types.Type;

/**
 * Interval of exact integers [lo, hi], where a null bound is infinite,
 * plus a flag recording that zero is known to be excluded (e.g. after a
 * test x != 0), which a convex interval can't express otherwise.
 *
 * Arithmetic is exact: results are not wrapped to any type.
 */
public class ValueRange {
  public static final ValueRange TOP = new ValueRange(null, null, false);

  private final BigInteger lo;
  private final BigInteger hi;
  private final boolean excludesZero;

  private ValueRange(BigInteger lo, BigInteger hi, boolean excludesZero) {
    this.lo = lo;
    this.hi = hi;
    // Normalize: zero-exclusion is implied when zero is outside
    this.excludesZero = excludesZero && containsZero(lo, hi);
  }

  public static ValueRange of(BigInteger lo, BigInteger hi) {
    return new ValueRange(lo, hi, false);
  }

  public static ValueRange of(long lo, long hi) {
    return of(BigInteger.valueOf(lo), BigInteger.valueOf(hi));
  }

  public static ValueRange constant(BigInteger v) {
    return of(v, v);
  }

  public static ValueRange forType(Type t) {
    if (t != null && t.isInteger()) {
      return of(t.minValue(), t.maxValue());
    }
    return TOP;
  }

  public BigInteger lo() {
    return lo;
  }

  public BigInteger hi() {
    return hi;
  }

  public boolean excludesZero() {
    return excludesZero;
  }

  public boolean isConstant() {
    return lo != null && lo.equals(hi);
  }

  public boolean isFinite() {
    return lo != null && hi != null;
  }

  public boolean isEmpty() {
    return lo != null && hi != null && lo.compareTo(hi) > 0;
  }

  private static boolean containsZero(BigInteger lo, BigInteger hi) {
    return (lo == null || lo.signum() <= 0) && (hi == null || hi.signum() >= 0);
  }

  public boolean mayBeZero() {
    return containsZero(lo, hi) && !excludesZero;
  }

  public boolean isZero() {
    return isConstant() && lo.signum() == 0;
  }

  public ValueRange withoutZero() {
    if (isZero()) {
      // Empty
      return of(BigInteger.ONE, BigInteger.ZERO);
    }
    if (lo != null && lo.signum() == 0) {
      return of(BigInteger.ONE, hi);
    }
    if (hi != null && hi.signum() == 0) {
      return of(lo, BigInteger.ONE.negate());
    }
    return new ValueRange(lo, hi, true);
  }

  /**
   * @return true if every value in this range is within [min, max]
   */
  public boolean within(BigInteger min, BigInteger max) {
    return lo != null && hi != null &&
           lo.compareTo(min) >= 0 && hi.compareTo(max) <= 0;
  }

  public boolean within(Type t) {
    return within(t.minValue(), t.maxValue());
  }

  /**
   * @return true if no value in this range is within [min, max]
   */
  public boolean disjoint(BigInteger min, BigInteger max) {
    return (hi != null && hi.compareTo(min) < 0) ||
           (lo != null && lo.compareTo(max) > 0);
  }

  public ValueRange join(ValueRange o) {
    if (this.isEmpty()) {
      return o;
    } else if (o.isEmpty()) {
      return this;
    }
    BigInteger l = (lo == null || o.lo == null) ? null : lo.min(o.lo);
    BigInteger h = (hi == null || o.hi == null) ? null : hi.max(o.hi);
    return new ValueRange(l, h, excludesZero && o.excludesZero);
  }

  /**
   * Standard interval widening: bounds that moved become infinite
   */
  public ValueRange widen(ValueRange next) {
    if (this.isEmpty()) {
      return next;
    }
    BigInteger l = lo;
    BigInteger h = hi;
    if (next.lo == null || (lo != null && next.lo.compareTo(lo) < 0)) {
      l = null;
    }
    if (next.hi == null || (hi != null && next.hi.compareTo(hi) > 0)) {
      h = null;
    }
    return new ValueRange(l, h, excludesZero && next.excludesZero);
  }

  public ValueRange intersect(ValueRange o) {
    BigInteger l = maxLo(lo, o.lo);
    BigInteger h = minHi(hi, o.hi);
    return new ValueRange(l, h, excludesZero || o.excludesZero);
  }

  /** Restrict to values &lt;= bound */
  public ValueRange atMost(BigInteger bound) {
    return new ValueRange(lo, minHi(hi, bound), excludesZero);
  }

  /** Restrict to values &gt;= bound */
  public ValueRange atLeast(BigInteger bound) {
    return new ValueRange(maxLo(lo, bound), hi, excludesZero);
  }

  private static BigInteger maxLo(BigInteger a, BigInteger b) {
    if (a == null) {
      return b;
    } else if (b == null) {
      return a;
    }
    return a.max(b);
  }

  private static BigInteger minHi(BigInteger a, BigInteger b) {
    if (a == null) {
      return b;
    } else if (b == null) {
      return a;
    }
    return a.min(b);
  }

  /* -- arithmetic -- */

  public ValueRange add(ValueRange o) {
    return of(addBound(lo, o.lo), addBound(hi, o.hi));
  }

  public ValueRange negate() {
    return new ValueRange(hi == null ? null : hi.negate(),
                          lo == null ? null : lo.negate(), excludesZero);
  }

  public ValueRange subtract(ValueRange o) {
    return add(o.negate());
  }

  private static BigInteger addBound(BigInteger a, BigInteger b) {
    return (a == null || b == null) ? null : a.add(b);
  }

  public ValueRange multiply(ValueRange o) {
    if (!isFinite() || !o.isFinite()) {
      if (isZero() || o.isZero()) {
        return constant(BigInteger.ZERO);
      }
      return TOP;
    }
    BigInteger a = lo.multiply(o.lo);
    BigInteger b = lo.multiply(o.hi);
    BigInteger c = hi.multiply(o.lo);
    BigInteger d = hi.multiply(o.hi);
    return of(a.min(b).min(c).min(d), a.max(b).max(c).max(d));
  }

  /**
   * Truncating division, for divisors that can't be zero
   */
  public ValueRange divide(ValueRange o) {
    if (!isFinite() || !o.isFinite() || o.mayBeZero()) {
      return TOP;
    }
    if (o.lo.signum() <= 0 && o.hi.signum() >= 0) {
      // Zero excluded but divisor spans it: quotient magnitude is at
      // most that of the dividend
      BigInteger m = lo.abs().max(hi.abs());
      return of(m.negate(), m);
    }
    BigInteger a = lo.divide(o.lo);
    BigInteger b = lo.divide(o.hi);
    BigInteger c = hi.divide(o.lo);
    BigInteger d = hi.divide(o.hi);
    return of(a.min(b).min(c).min(d), a.max(b).max(c).max(d));
  }

  public ValueRange remainder(ValueRange o) {
    if (!o.isFinite()) {
      return TOP;
    }
    // |a % b| < |b|, sign follows dividend
    BigInteger m = o.lo.abs().max(o.hi.abs()).subtract(BigInteger.ONE);
    if (m.signum() < 0) {
      return TOP;
    }
    BigInteger l = (lo != null && lo.signum() >= 0) ? BigInteger.ZERO
                                                    : m.negate();
    BigInteger h = (hi != null && hi.signum() <= 0) ? BigInteger.ZERO : m;
    return of(l, h);
  }

  public ValueRange abs() {
    if (lo != null && lo.signum() >= 0) {
      return this;
    } else if (hi != null && hi.signum() <= 0) {
      return negate();
    }
    BigInteger h = (lo == null || hi == null) ? null : lo.abs().max(hi);
    return of(BigInteger.ZERO, h);
  }

  public ValueRange min(ValueRange o) {
    return of(lo == null || o.lo == null ? null : lo.min(o.lo),
              minHi(hi, o.hi));
  }

  public ValueRange max(ValueRange o) {
    return of(maxLo(lo, o.lo),
              hi == null || o.hi == null ? null : hi.max(o.hi));
  }

  @Override
  public int hashCode() {
    return (lo == null ? 0 : lo.hashCode()) * 31 +
           (hi == null ? 0 : hi.hashCode()) + (excludesZero ? 1 : 0);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ValueRange)) {
      return false;
    }
    ValueRange o = (ValueRange)obj;
    return eq(lo, o.lo) && eq(hi, o.hi) && excludesZero == o.excludesZero;
  }

  private static boolean eq(BigInteger a, BigInteger b) {
    return a == null ? b == null : a.equals(b);
  }

  @Override
  public String toString() {
    String s = "[" + (lo == null ? "-inf" : lo) + ", " +
                     (hi == null ? "+inf" : hi) + "]";
    return excludesZero ? s + "\\{0}" : s;
  }
}
