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

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable per-variable facts for the bug-pattern checks: integer value
 * ranges, array length ranges and nullness.  A variable with no entry has
 * the default for its type.  BOTTOM marks program points that can't be
 * reached.
 */
public class RangeFacts {
  public static final RangeFacts BOTTOM = new RangeFacts(
      new HashMap<String, ValueRange>(), new HashMap<String, ValueRange>(),
      new HashMap<String, Nullness>(), true);

  public static final RangeFacts EMPTY = new RangeFacts(
      new HashMap<String, ValueRange>(), new HashMap<String, ValueRange>(),
      new HashMap<String, Nullness>(), false);

  private final Map<String, ValueRange> ranges;
  private final Map<String, ValueRange> lengths;
  private final Map<String, Nullness> nullness;
  private final boolean bottom;

  private RangeFacts(Map<String, ValueRange> ranges,
                     Map<String, ValueRange> lengths,
                     Map<String, Nullness> nullness, boolean bottom) {
    this.ranges = ranges;
    this.lengths = lengths;
    this.nullness = nullness;
    this.bottom = bottom;
  }

  public boolean isBottom() {
    return bottom;
  }

  /** @return range, or null if nothing known */
  public ValueRange range(String var) {
    return ranges.get(var);
  }

  /** @return length range of array variable, or null if nothing known */
  public ValueRange length(String var) {
    return lengths.get(var);
  }

  /** @return nullness, or null if nothing known */
  public Nullness nullness(String var) {
    return nullness.get(var);
  }

  private RangeFacts copy(Map<String, ValueRange> r,
                          Map<String, ValueRange> l,
                          Map<String, Nullness> n) {
    return new RangeFacts(r, l, n, false);
  }

  /**
   * @return facts with a new range for var; an empty range means the
   *       program point is unreachable
   */
  public RangeFacts withRange(String var, ValueRange r) {
    if (bottom || r.isEmpty()) {
      return BOTTOM;
    }
    Map<String, ValueRange> r2 = new HashMap<String, ValueRange>(ranges);
    r2.put(var, r);
    return copy(r2, lengths, nullness);
  }

  public RangeFacts withLength(String var, ValueRange r) {
    if (bottom || r.isEmpty()) {
      return BOTTOM;
    }
    Map<String, ValueRange> l2 = new HashMap<String, ValueRange>(lengths);
    l2.put(var, r);
    return copy(ranges, l2, nullness);
  }

  public RangeFacts withNullness(String var, Nullness n) {
    if (bottom) {
      return BOTTOM;
    }
    Map<String, Nullness> n2 = new HashMap<String, Nullness>(nullness);
    n2.put(var, n);
    return copy(ranges, lengths, n2);
  }

  /**
   * Forget everything about var, e.g. when it is redefined
   */
  public RangeFacts forget(String var) {
    if (bottom) {
      return BOTTOM;
    }
    Map<String, ValueRange> r2 = new HashMap<String, ValueRange>(ranges);
    Map<String, ValueRange> l2 = new HashMap<String, ValueRange>(lengths);
    Map<String, Nullness> n2 = new HashMap<String, Nullness>(nullness);
    r2.remove(var);
    l2.remove(var);
    n2.remove(var);
    return copy(r2, l2, n2);
  }

  public RangeFacts join(RangeFacts o) {
    if (bottom) {
      return o;
    } else if (o.bottom) {
      return this;
    }
    return copy(joinMaps(ranges, o.ranges, false),
                joinMaps(lengths, o.lengths, false),
                joinNullness(nullness, o.nullness));
  }

  public RangeFacts widen(RangeFacts next) {
    if (bottom) {
      return next;
    } else if (next.bottom) {
      return this;
    }
    return copy(joinMaps(ranges, next.ranges, true),
                joinMaps(lengths, next.lengths, true),
                joinNullness(nullness, next.nullness));
  }

  /**
   * Variables only known on one side are unconstrained after the join
   */
  private static Map<String, ValueRange> joinMaps(Map<String, ValueRange> a,
                        Map<String, ValueRange> b, boolean widen) {
    Map<String, ValueRange> res = new HashMap<String, ValueRange>();
    for (Map.Entry<String, ValueRange> e: a.entrySet()) {
      ValueRange other = b.get(e.getKey());
      if (other != null) {
        res.put(e.getKey(), widen ? e.getValue().widen(other)
                                  : e.getValue().join(other));
      }
    }
    return res;
  }

  private static Map<String, Nullness> joinNullness(Map<String, Nullness> a,
                                                    Map<String, Nullness> b) {
    Map<String, Nullness> res = new HashMap<String, Nullness>();
    Set<String> keys = new HashSet<String>(a.keySet());
    keys.retainAll(b.keySet());
    for (String k: keys) {
      res.put(k, a.get(k).join(b.get(k)));
    }
    return res;
  }

  @Override
  public int hashCode() {
    return ranges.hashCode() ^ lengths.hashCode() ^ nullness.hashCode() ^
           (bottom ? 1 : 0);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof RangeFacts)) {
      return false;
    }
    RangeFacts o = (RangeFacts)obj;
    return bottom == o.bottom && ranges.equals(o.ranges) &&
           lengths.equals(o.lengths) && nullness.equals(o.nullness);
  }

  @Override
  public String toString() {
    if (bottom) {
      return "BOTTOM";
    }
    return "ranges=" + ranges + " lengths=" + lengths +
           " nullness=" + nullness;
  }
}
