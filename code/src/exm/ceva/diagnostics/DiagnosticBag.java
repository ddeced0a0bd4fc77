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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Append-only diagnostic collection shared by all workers of one
 * analysis run.
 */
public class DiagnosticBag {
  private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

  public static final Comparator<Diagnostic> BY_SPAN =
      new Comparator<Diagnostic>() {
    @Override
    public int compare(Diagnostic d1, Diagnostic d2) {
      return d1.span().compareTo(d2.span());
    }
  };

  public synchronized void add(Diagnostic d) {
    diagnostics.add(d);
  }

  public synchronized void addAll(Collection<Diagnostic> ds) {
    diagnostics.addAll(ds);
  }

  public synchronized int size() {
    return diagnostics.size();
  }

  /**
   * @return copy of the diagnostics in insertion order
   */
  public synchronized List<Diagnostic> snapshot() {
    return new ArrayList<Diagnostic>(diagnostics);
  }

  /**
   * Diagnostics stable-sorted by source span: diagnostics at the same
   * position keep their insertion order.
   */
  public List<Diagnostic> sortedBySpan() {
    List<Diagnostic> result = snapshot();
    Collections.sort(result, BY_SPAN);
    return Collections.unmodifiableList(result);
  }

  public synchronized int count(Category category) {
    int n = 0;
    for (Diagnostic d: diagnostics) {
      if (d.category() == category) {
        n++;
      }
    }
    return n;
  }

  public synchronized boolean hasErrors() {
    for (Diagnostic d: diagnostics) {
      if (d.isError()) {
        return true;
      }
    }
    return false;
  }
}
