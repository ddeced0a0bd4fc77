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

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

import exm.ceva.ast.ExternalFunction;
import exm.ceva.ast.Module;

/**
 * Functions whose result is clean whatever their arguments were.
 * Built once per analysis run.
 */
public class SanitizerRegistry {

  private static final Pattern SANITIZER_NAME = Pattern.compile(
      "(?i).*(escape|sanitize|sanitise|encode|quote|parameterize).*");

  private final Set<String> names = new HashSet<String>();
  private final boolean usePatterns;

  /**
   * @param names explicitly registered sanitizers
   * @param usePatterns also treat functions with sanitizer-like names
   *                    as sanitizers
   */
  public SanitizerRegistry(Collection<String> names, boolean usePatterns) {
    this.names.addAll(names);
    this.usePatterns = usePatterns;
  }

  public void register(String name) {
    names.add(name);
  }

  public boolean usesPatterns() {
    return usePatterns;
  }

  /**
   * @param module module to look up externals flagged as sanitizers,
   *               may be null
   */
  public boolean isSanitizer(String fnName, Module module) {
    if (names.contains(fnName)) {
      return true;
    }
    if (module != null) {
      ExternalFunction ext = module.lookupExternal(fnName);
      if (ext != null && ext.isSanitizer()) {
        return true;
      }
    }
    return usePatterns && SANITIZER_NAME.matcher(fnName).matches();
  }
}
