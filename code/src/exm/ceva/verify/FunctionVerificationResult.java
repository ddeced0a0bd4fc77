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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.ceva.verify.VerificationOutcome.Status;
import exm.ceva.verify.loop.LoopInvariant;

/**
 * Outcomes for all contracts of one function: one per precondition, then
 * one per postcondition, in declaration order.  Loop invariants found
 * for the body, if synthesis is enabled, are carried along.
 */
public class FunctionVerificationResult {
  private final String functionId;
  private final String functionName;
  private final List<VerificationOutcome> preconditions;
  private final List<VerificationOutcome> postconditions;
  private final List<LoopInvariant> loopInvariants;

  public FunctionVerificationResult(String functionId, String functionName,
                          List<VerificationOutcome> preconditions,
                          List<VerificationOutcome> postconditions) {
    this(functionId, functionName, preconditions, postconditions,
         Collections.<LoopInvariant>emptyList());
  }

  public FunctionVerificationResult(String functionId, String functionName,
                          List<VerificationOutcome> preconditions,
                          List<VerificationOutcome> postconditions,
                          List<LoopInvariant> loopInvariants) {
    this.functionId = functionId;
    this.functionName = functionName;
    this.preconditions = Collections.unmodifiableList(
                    new ArrayList<VerificationOutcome>(preconditions));
    this.postconditions = Collections.unmodifiableList(
                    new ArrayList<VerificationOutcome>(postconditions));
    this.loopInvariants = Collections.unmodifiableList(
                    new ArrayList<LoopInvariant>(loopInvariants));
  }

  /**
   * @return copy of this result with the given loop invariants
   */
  public FunctionVerificationResult withLoopInvariants(
                                      List<LoopInvariant> invariants) {
    return new FunctionVerificationResult(functionId, functionName,
                            preconditions, postconditions, invariants);
  }

  public String functionId() {
    return functionId;
  }

  public String functionName() {
    return functionName;
  }

  public List<VerificationOutcome> preconditions() {
    return preconditions;
  }

  public List<VerificationOutcome> postconditions() {
    return postconditions;
  }

  public List<LoopInvariant> loopInvariants() {
    return loopInvariants;
  }

  public List<VerificationOutcome> outcomes() {
    List<VerificationOutcome> all = new ArrayList<VerificationOutcome>(
                  preconditions.size() + postconditions.size());
    all.addAll(preconditions);
    all.addAll(postconditions);
    return all;
  }

  public int count(Status status) {
    int n = 0;
    for (VerificationOutcome o: outcomes()) {
      if (o.status() == status) {
        n++;
      }
    }
    return n;
  }

  /**
   * @return true if any outcome depends on solver limits
   */
  public boolean hasTransientOutcome() {
    for (VerificationOutcome o: outcomes()) {
      if (o.isTransient()) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return true if the outcomes were read back from the cache
   */
  public boolean isCacheHit() {
    List<VerificationOutcome> all = outcomes();
    return !all.isEmpty() && all.get(0).isCacheHit();
  }

  /**
   * Descriptions of counterexamples of disproven contracts
   */
  public List<String> counterexamples() {
    List<String> result = new ArrayList<String>();
    for (VerificationOutcome o: outcomes()) {
      if (o.counterexample() != null) {
        result.add(o.counterexample().describe());
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return functionName + ": " + outcomes();
  }
}
