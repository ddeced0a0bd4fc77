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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.ceva.ast.Expression;
import exm.ceva.ast.Function;
import exm.ceva.diagnostics.Category;
import exm.ceva.diagnostics.Diagnostic;
import exm.ceva.diagnostics.Severity;

/**
 * What a checker needs while checking one function
 */
public class CheckContext {
  private final Function function;
  private final ValueRangeAnalysis ranges;
  /** Each report with the node it was first reported at */
  private final Map<Diagnostic, Expression> diagnostics =
                              new LinkedHashMap<Diagnostic, Expression>();

  public CheckContext(Function function, ValueRangeAnalysis ranges) {
    this.function = function;
    this.ranges = ranges;
  }

  public Function function() {
    return function;
  }

  public ValueRangeAnalysis ranges() {
    return ranges;
  }

  /**
   * Report a problem at a node.  Identical reports are merged.
   */
  public void report(String code, Severity severity, Expression at,
                     String message) {
    Diagnostic d = new Diagnostic(code, message + " in " + function.name(),
                                  severity, at.span(), Category.BUG_PATTERN);
    if (!diagnostics.containsKey(d)) {
      diagnostics.put(d, at);
    }
  }

  public List<Diagnostic> diagnostics() {
    return new ArrayList<Diagnostic>(diagnostics.keySet());
  }

  /**
   * @return the node d was reported at, null if not reported here
   */
  public Expression reportedAt(Diagnostic d) {
    return diagnostics.get(d);
  }
}
