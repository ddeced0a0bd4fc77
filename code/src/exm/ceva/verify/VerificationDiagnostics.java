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
import java.util.List;

import exm.ceva.ast.SExpressions;
import exm.ceva.diagnostics.Category;
import exm.ceva.diagnostics.Diagnostic;
import exm.ceva.diagnostics.DiagnosticCode;
import exm.ceva.verify.loop.LoopInvariant;

/**
 * Report verification outcomes as diagnostics.  Only refuted contracts
 * are reported by default; proven postconditions too if verbose.
 * Loop invariants are reported whenever they were looked for.
 */
public class VerificationDiagnostics {

  public static List<Diagnostic> forResult(FunctionVerificationResult r,
                                           boolean verbose) {
    List<Diagnostic> result = new ArrayList<Diagnostic>();
    for (VerificationOutcome o: r.preconditions()) {
      if (o.status() == VerificationOutcome.Status.DISPROVEN) {
        result.add(Diagnostic.warning(DiagnosticCode.PRECONDITION_DISPROVEN,
            "Preconditions of " + r.functionName() + " are contradictory: " +
            "precondition " + (o.index() + 1) + " fails when " +
            o.counterexample().describe(),
            o.span(), Category.VERIFICATION));
      }
    }
    for (VerificationOutcome o: r.postconditions()) {
      if (o.status() == VerificationOutcome.Status.DISPROVEN) {
        result.add(Diagnostic.warning(DiagnosticCode.POSTCONDITION_DISPROVEN,
            "Postcondition " + (o.index() + 1) + " of " + r.functionName() +
            " does not hold, counterexample: " +
            o.counterexample().describe(),
            o.span(), Category.VERIFICATION));
      } else if (verbose && o.status() == VerificationOutcome.Status.PROVEN) {
        result.add(Diagnostic.info(DiagnosticCode.CONTRACT_PROVEN,
            "Postcondition " + (o.index() + 1) + " of " + r.functionName() +
            " proven" + (o.isCacheHit() ? " (cached)" : ""),
            o.span(), Category.VERIFICATION));
      }
    }
    for (LoopInvariant inv: r.loopInvariants()) {
      if (inv.isProven()) {
        result.add(Diagnostic.info(DiagnosticCode.LOOP_INVARIANT_PROVEN,
            "Loop invariant " + SExpressions.print(inv.invariant()) +
            " in " + r.functionName() + " proven by " + inv.k() +
            "-induction", inv.loop().span(), Category.VERIFICATION));
      } else {
        result.add(Diagnostic.warning(DiagnosticCode.LOOP_INVARIANT_UNKNOWN,
            "No invariant of '" + inv.variable() + "' proven for loop in " +
            r.functionName() + ": " + inv.reason(),
            inv.loop().span(), Category.VERIFICATION));
      }
    }
    return result;
  }
}
