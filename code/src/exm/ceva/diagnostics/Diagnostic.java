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

package exm.ceva.diagnostics;

import exm.ceva.common.lang.SourceSpan;

/**
 * A single reported problem.  Immutable.
 */
public class Diagnostic {
  private final String code;
  private final String message;
  private final Severity severity;
  private final SourceSpan span;
  private final Category category;

  public Diagnostic(String code, String message, Severity severity,
                    SourceSpan span, Category category) {
    assert(code != null);
    assert(severity != null);
    assert(category != null);
    this.code = code;
    this.message = message;
    this.severity = severity;
    this.span = span == null ? SourceSpan.NONE : span;
    this.category = category;
  }

  public static Diagnostic error(String code, String message,
                           SourceSpan span, Category category) {
    return new Diagnostic(code, message, Severity.ERROR, span, category);
  }

  public static Diagnostic warning(String code, String message,
                           SourceSpan span, Category category) {
    return new Diagnostic(code, message, Severity.WARNING, span, category);
  }

  public static Diagnostic info(String code, String message,
                           SourceSpan span, Category category) {
    return new Diagnostic(code, message, Severity.INFO, span, category);
  }

  public String code() {
    return code;
  }

  public String message() {
    return message;
  }

  public Severity severity() {
    return severity;
  }

  public SourceSpan span() {
    return span;
  }

  public Category category() {
    return category;
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  @Override
  public String toString() {
    return span + ": " + severity.label() + " " + code + ": " + message;
  }

  @Override
  public int hashCode() {
    return toString().hashCode() ^ category.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Diagnostic)) {
      return false;
    }
    Diagnostic other = (Diagnostic)obj;
    return code.equals(other.code) && message.equals(other.message) &&
           severity == other.severity && span.equals(other.span) &&
           category == other.category;
  }
}
