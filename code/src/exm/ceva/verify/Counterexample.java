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

package exm.ceva.verify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import exm.ceva.common.lang.Value;

/**
 * Concrete values for the parameters (and result) of a function that
 * violate a contract.  Array parameters appear only through their
 * length, named like "a.length".
 */
public class Counterexample {
  private final Map<String, Value> values;

  public Counterexample(Map<String, Value> values) {
    this.values = Collections.unmodifiableMap(
                        new LinkedHashMap<String, Value>(values));
  }

  /**
   * @return values in parameter order, result last
   */
  public Map<String, Value> values() {
    return values;
  }

  public Value get(String name) {
    return values.get(name);
  }

  /**
   * @return e.g. "v=11, lo=0, hi=10, result=11"
   */
  public String describe() {
    List<String> parts = new ArrayList<String>();
    for (Map.Entry<String, Value> e: values.entrySet()) {
      parts.add(e.getKey() + "=" + e.getValue());
    }
    return StringUtils.join(parts, ", ");
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Counterexample &&
           values.equals(((Counterexample)obj).values);
  }

  @Override
  public String toString() {
    return describe();
  }
}
