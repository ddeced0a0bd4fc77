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

package exm.ceva.verify.encode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.ceva.verify.formula.Term;

/**
 * What a function body tells the solver: a constraint relating the
 * result symbol to the parameter symbols on every path that returns
 * normally.
 */
public class BodyModel {
  private final Term constraint;
  private final List<String> partialReasons;
  private final int paths;

  public BodyModel(Term constraint, List<String> partialReasons, int paths) {
    this.constraint = constraint;
    this.partialReasons = Collections.unmodifiableList(
                              new ArrayList<String>(partialReasons));
    this.paths = paths;
  }

  /**
   * Model that says nothing about the result
   */
  public static BodyModel unconstrained(String reason) {
    return new BodyModel(Term.TRUE, Collections.singletonList(reason), 0);
  }

  public Term constraint() {
    return constraint;
  }

  /**
   * @return true if the model over-approximates the body, so that a
   *        counterexample may not correspond to a real execution
   */
  public boolean isPartial() {
    return !partialReasons.isEmpty();
  }

  public List<String> partialReasons() {
    return partialReasons;
  }

  public String describePartial() {
    return StringUtils.join(partialReasons, "; ");
  }

  /**
   * @return number of returning paths in the model
   */
  public int paths() {
    return paths;
  }

  @Override
  public String toString() {
    return constraint + (isPartial() ? " (partial: " + describePartial() + ")"
                                     : "");
  }
}
