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

import exm.ceva.diagnostics.DiagnosticCode;

/**
 * Kinds of sensitive operation, with the diagnostic reported when
 * untrusted data reaches one
 */
public enum TaintSink {
  SQL_QUERY("SqlInjection", DiagnosticCode.SQL_INJECTION),
  COMMAND_EXECUTION("CommandInjection", DiagnosticCode.COMMAND_INJECTION),
  FILE_PATH("PathTraversal", DiagnosticCode.PATH_TRAVERSAL),
  HTML_OUTPUT("CrossSiteScripting", DiagnosticCode.CROSS_SITE_SCRIPTING),
  URL_REDIRECT("TaintedSink", DiagnosticCode.TAINTED_SINK),
  CODE_EVAL("TaintedSink", DiagnosticCode.TAINTED_SINK),
  DESERIALIZATION("TaintedSink", DiagnosticCode.TAINTED_SINK),
  LOG_OUTPUT("TaintedSink", DiagnosticCode.TAINTED_SINK);

  private final String vulnerability;
  private final String code;

  private TaintSink(String vulnerability, String code) {
    this.vulnerability = vulnerability;
    this.code = code;
  }

  public String vulnerability() {
    return vulnerability;
  }

  public String diagnosticCode() {
    return code;
  }

  public String description() {
    return name().toLowerCase().replace('_', ' ');
  }
}
