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

import exm.ceva.common.lang.SourceSpan;

/**
 * Where a tainted value came from: an untrusted parameter or a call that
 * reads external input.
 */
public class TaintLabel implements Comparable<TaintLabel> {
  private final String source;
  private final SourceSpan span;

  public TaintLabel(String source, SourceSpan span) {
    this.source = source;
    this.span = span == null ? SourceSpan.NONE : span;
  }

  /**
   * @return description of the source, e.g. "parameter 'query'"
   */
  public String source() {
    return source;
  }

  public SourceSpan span() {
    return span;
  }

  @Override
  public int compareTo(TaintLabel o) {
    int c = span.compareTo(o.span);
    return c != 0 ? c : source.compareTo(o.source);
  }

  @Override
  public int hashCode() {
    return source.hashCode() * 31 + span.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof TaintLabel)) {
      return false;
    }
    TaintLabel o = (TaintLabel)obj;
    return source.equals(o.source) && span.equals(o.span);
  }

  @Override
  public String toString() {
    if (span.isKnown()) {
      return source + " (" + span + ")";
    }
    return source;
  }
}
