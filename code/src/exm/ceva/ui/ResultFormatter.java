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

package exm.ceva.ui;

import java.io.IOException;
import java.io.PrintStream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import exm.ceva.analysis.AnalysisResult;
import exm.ceva.diagnostics.Diagnostic;
import exm.ceva.verify.FunctionVerificationResult;
import exm.ceva.verify.VerificationOutcome;
import exm.ceva.verify.VerificationSummary;

/**
 * Print analysis results for people (text) or tools (JSON)
 */
public class ResultFormatter {

  public static void printText(AnalysisResult result, PrintStream out) {
    for (Diagnostic d: result.diagnostics()) {
      out.println(d);
    }
    out.println("Analyzed " + result.functionsAnalyzed() + " functions in " +
                result.elapsedMs() + "ms: " + result.dataflowIssues() +
                " dataflow issues, " + result.bugPatternsFound() +
                " bug patterns, " + result.taintVulnerabilities() +
                " taint vulnerabilities");
    VerificationSummary summary = result.verificationSummary();
    if (summary != null) {
      out.println("Contracts: " + summary);
    }
  }

  public static void printJson(AnalysisResult result, PrintStream out)
                                                        throws IOException {
    ObjectMapper mapper = new ObjectMapper();
    ObjectNode root = mapper.createObjectNode();
    root.put("functionsAnalyzed", result.functionsAnalyzed());
    root.put("dataflowIssues", result.dataflowIssues());
    root.put("bugPatternsFound", result.bugPatternsFound());
    root.put("taintVulnerabilities", result.taintVulnerabilities());
    root.put("elapsedMs", result.elapsedMs());

    ArrayNode diags = root.putArray("diagnostics");
    for (Diagnostic d: result.diagnostics()) {
      ObjectNode dn = diags.addObject();
      dn.put("code", d.code());
      dn.put("severity", d.severity().name());
      dn.put("category", d.category().name());
      dn.put("file", d.span().getFile());
      dn.put("line", d.span().getLine());
      dn.put("column", d.span().getColumn());
      dn.put("message", d.message());
    }

    VerificationSummary summary = result.verificationSummary();
    if (summary != null) {
      ObjectNode sn = root.putObject("verification");
      sn.put("proven", summary.proven());
      sn.put("disproven", summary.disproven());
      sn.put("unproven", summary.unproven());
      sn.put("unsupported", summary.unsupported());
      sn.put("skipped", summary.skipped());
      sn.put("cacheHits", summary.cacheHits());
      ArrayNode fns = sn.putArray("functions");
      for (FunctionVerificationResult fr: result.verificationResults()) {
        ObjectNode fn = fns.addObject();
        fn.put("id", fr.functionId());
        fn.put("name", fr.functionName());
        ArrayNode outcomes = fn.putArray("outcomes");
        for (VerificationOutcome o: fr.outcomes()) {
          ObjectNode on = outcomes.addObject();
          on.put("kind", o.kind().description());
          on.put("index", o.index());
          on.put("status", o.status().name());
          on.put("cacheHit", o.isCacheHit());
          if (o.counterexample() != null) {
            on.put("counterexample", o.counterexample().describe());
          }
          if (o.reason() != null) {
            on.put("reason", o.reason());
          }
        }
      }
    }
    out.println(mapper.writerWithDefaultPrettyPrinter()
                      .writeValueAsString(root));
  }
}
