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

package exm.ceva.analysis.dataflow;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable map from variable to InitState.  Variables not in the map
 * are uninitialized.
 */
public class InitFacts {
  public static final InitFacts EMPTY =
              new InitFacts(new HashMap<String, InitState>());

  private final Map<String, InitState> states;

  private InitFacts(Map<String, InitState> states) {
    this.states = states;
  }

  public static InitFacts initialized(Collection<String> vars) {
    Map<String, InitState> states = new HashMap<String, InitState>();
    for (String v: vars) {
      states.put(v, InitState.INITIALIZED);
    }
    return new InitFacts(states);
  }

  public InitState get(String var) {
    InitState s = states.get(var);
    return s == null ? InitState.UNINITIALIZED : s;
  }

  public InitFacts with(String var, InitState state) {
    if (get(var) == state) {
      return this;
    }
    Map<String, InitState> copy = new HashMap<String, InitState>(states);
    if (state == InitState.UNINITIALIZED) {
      copy.remove(var);
    } else {
      copy.put(var, state);
    }
    return new InitFacts(copy);
  }

  public InitFacts join(InitFacts other) {
    if (this == other) {
      return this;
    }
    Set<String> vars = new HashSet<String>(states.keySet());
    vars.addAll(other.states.keySet());
    Map<String, InitState> joined = new HashMap<String, InitState>();
    for (String v: vars) {
      InitState s = get(v).join(other.get(v));
      if (s != InitState.UNINITIALIZED) {
        joined.put(v, s);
      }
    }
    return new InitFacts(joined);
  }

  @Override
  public int hashCode() {
    return states.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof InitFacts &&
           states.equals(((InitFacts)obj).states);
  }

  @Override
  public String toString() {
    return states.toString();
  }
}
