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

import exm.ceva.common.lang.SourceSpan;
import exm.ceva.common.lang.Types.Type;

public class Parameter {
  private final String name;
  private final Type type;
  private final boolean untrusted;
  private final SourceSpan span;

  /**
   * @param name
   * @param type
   * @param untrusted true if the value is externally supplied input
   * @param span
   */
  public Parameter(String name, Type type, boolean untrusted,
                   SourceSpan span) {
    this.name = name;
    this.type = type;
    this.untrusted = untrusted;
    this.span = span == null ? SourceSpan.NONE : span;
  }

  public Parameter(String name, Type type) {
    this(name, type, false, SourceSpan.NONE);
  }

  public String name() {
    return name;
  }

  public Type type() {
    return type;
  }

  public boolean isUntrusted() {
    return untrusted;
  }

  public SourceSpan span() {
    return span;
  }

  @Override
  public String toString() {
    return name + ":" + type.typeName() + (untrusted ? " untrusted" : "");
  }
}
