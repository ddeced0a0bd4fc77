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

package exm.ceva.verify.cache;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.ceva.ast.Expression;
import exm.ceva.ast.Function;
import exm.ceva.verify.ContractKind;
import exm.ceva.verify.Counterexample;
import exm.ceva.verify.FunctionVerificationResult;
import exm.ceva.verify.VerificationOutcome;
import exm.ceva.verify.VerificationOutcome.Status;

/**
 * Stored outcomes of one function.  Source positions aren't stored:
 * they are taken from the function when the entry is used.
 */
public class CacheEntry {

  public static class StoredOutcome {
    private final ContractKind kind;
    private final int index;
    private final Status status;
    private final Counterexample counterexample;
    private final String reason;

    public StoredOutcome(ContractKind kind, int index, Status status,
                         Counterexample counterexample, String reason) {
      this.kind = kind;
      this.index = index;
      this.status = status;
      this.counterexample = counterexample;
      this.reason = reason;
    }

    public ContractKind kind() {
      return kind;
    }

    public int index() {
      return index;
    }

    public Status status() {
      return status;
    }

    public Counterexample counterexample() {
      return counterexample;
    }

    public String reason() {
      return reason;
    }
  }

  private final String key;
  private final long timestamp;
  private final String functionName;
  private final List<StoredOutcome> outcomes;

  public CacheEntry(String key, long timestamp, String functionName,
                    List<StoredOutcome> outcomes) {
    this.key = key;
    this.timestamp = timestamp;
    this.functionName = functionName;
    this.outcomes = Collections.unmodifiableList(
                          new ArrayList<StoredOutcome>(outcomes));
  }

  /**
   * @return entry for result, or null if some outcome must not be cached
   */
  public static CacheEntry forResult(CacheKey key,
                                     FunctionVerificationResult result) {
    List<StoredOutcome> stored = new ArrayList<StoredOutcome>();
    for (VerificationOutcome o: result.outcomes()) {
      if (o.isTransient()) {
        return null;
      }
      stored.add(new StoredOutcome(o.kind(), o.index(), o.status(),
                                   o.counterexample(), o.reason()));
    }
    return new CacheEntry(key.hash(), System.currentTimeMillis(),
                          result.functionName(), stored);
  }

  public String key() {
    return key;
  }

  /**
   * @return creation time in milliseconds since the epoch
   */
  public long timestamp() {
    return timestamp;
  }

  public String functionName() {
    return functionName;
  }

  public List<StoredOutcome> outcomes() {
    return outcomes;
  }

  /**
   * Rebuild the verification result of f from this entry
   * @return the result, or null if the entry doesn't match the contracts
   *         of f
   */
  public FunctionVerificationResult toResult(Function f) {
    List<VerificationOutcome> pre = new ArrayList<VerificationOutcome>();
    List<VerificationOutcome> post = new ArrayList<VerificationOutcome>();
    for (StoredOutcome s: outcomes) {
      boolean isPre = s.kind() == ContractKind.PRECONDITION;
      List<Expression> contracts = isPre ? f.preconditions()
                                         : f.postconditions();
      List<VerificationOutcome> dest = isPre ? pre : post;
      if (s.index() != dest.size() || s.index() >= contracts.size()) {
        return null;
      }
      if ((s.status() == Status.DISPROVEN) != (s.counterexample() != null)) {
        return null;
      }
      dest.add(VerificationOutcome.fromCache(f.id(), s.kind(), s.index(),
                contracts.get(s.index()).span(), s.status(),
                s.counterexample(), s.reason()));
    }
    if (pre.size() != f.preconditions().size() ||
        post.size() != f.postconditions().size()) {
      return null;
    }
    return new FunctionVerificationResult(f.id(), f.name(), pre, post);
  }
}
