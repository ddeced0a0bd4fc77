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

package exm.ceva.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A typed module handed over by the front end
 */
public class Module {
  private final String name;
  private final List<Function> functions;
  private final Map<String, Function> byName;
  private final Map<String, ExternalFunction> externals;

  public Module(String name, List<Function> functions,
                List<ExternalFunction> externals) {
    this.name = name;
    this.functions = Collections.unmodifiableList(
                              new ArrayList<Function>(functions));
    this.byName = new LinkedHashMap<String, Function>();
    for (Function f: functions) {
      byName.put(f.name(), f);
    }
    this.externals = new LinkedHashMap<String, ExternalFunction>();
    for (ExternalFunction e: externals) {
      this.externals.put(e.name(), e);
    }
  }

  public Module(String name, List<Function> functions) {
    this(name, functions, Collections.<ExternalFunction>emptyList());
  }

  public String name() {
    return name;
  }

  public List<Function> functions() {
    return functions;
  }

  /**
   * @return function defined in this module, or null
   */
  public Function lookupFunction(String fnName) {
    return byName.get(fnName);
  }

  /**
   * @return external declaration, or null
   */
  public ExternalFunction lookupExternal(String fnName) {
    return externals.get(fnName);
  }

  public List<ExternalFunction> externals() {
    return Collections.unmodifiableList(
              new ArrayList<ExternalFunction>(externals.values()));
  }
}
