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

import exm.ceva.common.lang.SourceSpan;

/**
 * Result of trying to verify one contract of one function
 */
public class VerificationOutcome {
  public static enum Status {
    PROVEN,
    DISPROVEN,
    UNPROVEN,
    UNSUPPORTED,
    SKIPPED;
  }

  private final String functionId;
  private final ContractKind kind;
  private final int index;
  private final SourceSpan span;
  private final Status status;
  private final Counterexample counterexample;
  private final String reason;
  /** Depends on solver limits rather than the function: don't cache */
  private final boolean transientResult;
  private final boolean cacheHit;

  private VerificationOutcome(String functionId, ContractKind kind,
      int index, SourceSpan span, Status status,
      Counterexample counterexample, String reason,
      boolean transientResult, boolean cacheHit) {
    this.functionId = functionId;
    this.kind = kind;
    this.index = index;
    this.span = span == null ? SourceSpan.NONE : span;
    this.status = status;
    this.counterexample = counterexample;
    this.reason = reason;
    this.transientResult = transientResult;
    this.cacheHit = cacheHit;
  }

  public static VerificationOutcome proven(String functionId,
          ContractKind kind, int index, SourceSpan span) {
    return new VerificationOutcome(functionId, kind, index, span,
                        Status.PROVEN, null, null, false, false);
  }

  public static VerificationOutcome disproven(String functionId,
      ContractKind kind, int index, SourceSpan span, Counterexample cex) {
    assert(cex != null);
    return new VerificationOutcome(functionId, kind, index, span,
                        Status.DISPROVEN, cex, null, false, false);
  }

  public static VerificationOutcome unproven(String functionId,
      ContractKind kind, int index, SourceSpan span, String reason) {
    return new VerificationOutcome(functionId, kind, index, span,
                        Status.UNPROVEN, null, reason, false, false);
  }

  /**
   * Unproven because the solver gave up (timeout or unknown)
   */
  public static VerificationOutcome solverLimit(String functionId,
      ContractKind kind, int index, SourceSpan span, String reason) {
    return new VerificationOutcome(functionId, kind, index, span,
                        Status.UNPROVEN, null, reason, true, false);
  }

  public static VerificationOutcome unsupported(String functionId,
      ContractKind kind, int index, SourceSpan span, String reason) {
    return new VerificationOutcome(functionId, kind, index, span,
                        Status.UNSUPPORTED, null, reason, false, false);
  }

  public static VerificationOutcome skipped(String functionId,
      ContractKind kind, int index, SourceSpan span, String reason) {
    return new VerificationOutcome(functionId, kind, index, span,
                        Status.SKIPPED, null, reason, true, false);
  }

  /**
   * Rebuild an outcome read back from the cache
   */
  public static VerificationOutcome fromCache(String functionId,
      ContractKind kind, int index, SourceSpan span, Status status,
      Counterexample cex, String reason) {
    return new VerificationOutcome(functionId, kind, index, span, status,
                                   cex, reason, false, true);
  }

  public String functionId() {
    return functionId;
  }

  public ContractKind kind() {
    return kind;
  }

  /**
   * @return position of the contract among those of its kind
   */
  public int index() {
    return index;
  }

  public SourceSpan span() {
    return span;
  }

  public Status status() {
    return status;
  }

  /**
   * @return counterexample, only for DISPROVEN
   */
  public Counterexample counterexample() {
    return counterexample;
  }

  /**
   * @return explanation for UNPROVEN, UNSUPPORTED and SKIPPED, may be null
   */
  public String reason() {
    return reason;
  }

  public boolean isTransient() {
    return transientResult;
  }

  public boolean isCacheHit() {
    return cacheHit;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(functionId).append(' ').append(kind.description())
      .append(" #").append(index).append(": ").append(status);
    if (counterexample != null) {
      sb.append(" [").append(counterexample.describe()).append(']');
    } else if (reason != null) {
      sb.append(" (").append(reason).append(')');
    }
    if (cacheHit) {
      sb.append(" (cached)");
    }
    return sb.toString();
  }
}
