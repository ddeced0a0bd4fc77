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

import exm.ceva.verify.VerificationOutcome.Status;

/**
 * Counts of contract outcomes across a module.  Not thread-safe:
 * results are added after workers finish.
 */
public class VerificationSummary {
  private int proven = 0;
  private int disproven = 0;
  private int unproven = 0;
  private int unsupported = 0;
  private int skipped = 0;
  private int cacheHits = 0;

  public void add(FunctionVerificationResult result) {
    for (VerificationOutcome o: result.outcomes()) {
      add(o);
    }
  }

  public void add(VerificationOutcome o) {
    switch (o.status()) {
      case PROVEN:
        proven++;
        break;
      case DISPROVEN:
        disproven++;
        break;
      case UNPROVEN:
        unproven++;
        break;
      case UNSUPPORTED:
        unsupported++;
        break;
      case SKIPPED:
        skipped++;
        break;
      default:
        throw new IllegalArgumentException(o.status().toString());
    }
    if (o.isCacheHit()) {
      cacheHits++;
    }
  }

  public int proven() {
    return proven;
  }

  public int disproven() {
    return disproven;
  }

  public int unproven() {
    return unproven;
  }

  public int unsupported() {
    return unsupported;
  }

  public int skipped() {
    return skipped;
  }

  public int cacheHits() {
    return cacheHits;
  }

  public int count(Status status) {
    switch (status) {
      case PROVEN:
        return proven;
      case DISPROVEN:
        return disproven;
      case UNPROVEN:
        return unproven;
      case UNSUPPORTED:
        return unsupported;
      default:
        return skipped;
    }
  }

  public int total() {
    return proven + disproven + unproven + unsupported + skipped;
  }

  @Override
  public String toString() {
    return "proven: " + proven + ", disproven: " + disproven +
           ", unproven: " + unproven + ", unsupported: " + unsupported +
           ", skipped: " + skipped + ", cache hits: " + cacheHits;
  }
}
