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

package exm.ceva.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.ceva.diagnostics.Diagnostic;
import exm.ceva.verify.FunctionVerificationResult;
import exm.ceva.verify.VerificationSummary;

/**
 * Everything one analysis run produced
 */
public class AnalysisResult {
  private final int functionsAnalyzed;
  private final int dataflowIssues;
  private final int bugPatternsFound;
  private final int taintVulnerabilities;
  private final long elapsedMs;
  private final List<Diagnostic> diagnostics;
  private final VerificationSummary verificationSummary;
  private final List<FunctionVerificationResult> verificationResults;

  public AnalysisResult(int functionsAnalyzed, int dataflowIssues,
      int bugPatternsFound, int taintVulnerabilities, long elapsedMs,
      List<Diagnostic> diagnostics, VerificationSummary verificationSummary,
      List<FunctionVerificationResult> verificationResults) {
    this.functionsAnalyzed = functionsAnalyzed;
    this.dataflowIssues = dataflowIssues;
    this.bugPatternsFound = bugPatternsFound;
    this.taintVulnerabilities = taintVulnerabilities;
    this.elapsedMs = elapsedMs;
    this.diagnostics = Collections.unmodifiableList(
                          new ArrayList<Diagnostic>(diagnostics));
    this.verificationSummary = verificationSummary;
    this.verificationResults = Collections.unmodifiableList(
          new ArrayList<FunctionVerificationResult>(verificationResults));
  }

  /**
   * @return number of functions whose analysis ran, including those that
   *          hit an internal fault, but not those cut off by the deadline
   */
  public int functionsAnalyzed() {
    return functionsAnalyzed;
  }

  public int dataflowIssues() {
    return dataflowIssues;
  }

  public int bugPatternsFound() {
    return bugPatternsFound;
  }

  public int taintVulnerabilities() {
    return taintVulnerabilities;
  }

  public long elapsedMs() {
    return elapsedMs;
  }

  /**
   * @return diagnostics ordered by position
   */
  public List<Diagnostic> diagnostics() {
    return diagnostics;
  }

  public boolean hasErrors() {
    for (Diagnostic d: diagnostics) {
      if (d.isError()) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return null if verification wasn't requested
   */
  public VerificationSummary verificationSummary() {
    return verificationSummary;
  }

  public List<FunctionVerificationResult> verificationResults() {
    return verificationResults;
  }

  /**
   * @return result for function with the given id, or null
   */
  public FunctionVerificationResult verificationResult(String functionId) {
    for (FunctionVerificationResult r: verificationResults) {
      if (r.functionId().equals(functionId)) {
        return r;
      }
    }
    return null;
  }
}
