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

package exm.ceva.analysis.taint;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Immutable map from variable to the labels of the untrusted sources its
 * value may derive from.  A variable with no labels is untainted.
 */
public class TaintFacts {
  public static final TaintFacts EMPTY =
      new TaintFacts(ImmutableMap.<String, ImmutableSortedSet<TaintLabel>>of());

  private final ImmutableMap<String, ImmutableSortedSet<TaintLabel>> labels;

  private TaintFacts(
      ImmutableMap<String, ImmutableSortedSet<TaintLabel>> labels) {
    this.labels = labels;
  }

  public Set<TaintLabel> get(String var) {
    ImmutableSortedSet<TaintLabel> l = labels.get(var);
    return l == null ? ImmutableSortedSet.<TaintLabel>of() : l;
  }

  public boolean isTainted(String var) {
    return labels.containsKey(var);
  }

  public TaintFacts with(String var, Set<TaintLabel> varLabels) {
    Map<String, ImmutableSortedSet<TaintLabel>> m =
        new HashMap<String, ImmutableSortedSet<TaintLabel>>(labels);
    if (varLabels.isEmpty()) {
      m.remove(var);
    } else {
      m.put(var, ImmutableSortedSet.copyOf(varLabels));
    }
    return new TaintFacts(ImmutableMap.copyOf(m));
  }

  public TaintFacts join(TaintFacts o) {
    if (o == this || o.labels.isEmpty()) {
      return this;
    } else if (labels.isEmpty()) {
      return o;
    }
    Map<String, ImmutableSortedSet<TaintLabel>> m =
        new HashMap<String, ImmutableSortedSet<TaintLabel>>(labels);
    for (Map.Entry<String, ImmutableSortedSet<TaintLabel>> e:
                                                  o.labels.entrySet()) {
      ImmutableSortedSet<TaintLabel> mine = m.get(e.getKey());
      if (mine == null) {
        m.put(e.getKey(), e.getValue());
      } else {
        m.put(e.getKey(), ImmutableSortedSet.<TaintLabel>naturalOrder()
                            .addAll(mine).addAll(e.getValue()).build());
      }
    }
    return new TaintFacts(ImmutableMap.copyOf(m));
  }

  @Override
  public int hashCode() {
    return labels.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof TaintFacts &&
           labels.equals(((TaintFacts)obj).labels);
  }

  @Override
  public String toString() {
    return labels.toString();
  }
}
