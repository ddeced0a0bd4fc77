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

package exm.ceva.common;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.ceva.common.exceptions.InvalidOptionException;

/**
 * General analysis settings.  Defaults are set here and can be overridden
 * by Java system properties of the same name, or by the command line.
 *
 * Analyses never read these directly: an AnalysisOptions snapshot is taken
 * once per run.
 */
public class Settings
{
  public static final String ANALYSIS_DATAFLOW = "ceva.analysis.dataflow";
  public static final String ANALYSIS_DEAD_STORES = "ceva.analysis.dead-stores";
  public static final String ANALYSIS_BUG_PATTERNS = "ceva.analysis.bug-patterns";
  public static final String ANALYSIS_TAINT = "ceva.analysis.taint";

  public static final String BUGPATTERN_DIV_ZERO =
                                  "ceva.bugpattern.division-by-zero";
  public static final String BUGPATTERN_NULL_DEREF =
                                  "ceva.bugpattern.null-dereference";
  public static final String BUGPATTERN_OVERFLOW =
                                  "ceva.bugpattern.integer-overflow";
  public static final String BUGPATTERN_INDEX_OOB =
                                  "ceva.bugpattern.index-out-of-bounds";
  /* Ask the solver whether a division or index warning can really happen */
  public static final String BUGPATTERN_SMT_CONFIRM =
                                  "ceva.bugpattern.smt-confirm";

  /* Guess taint sources from parameter and call names */
  public static final String TAINT_INFER_SOURCES = "ceva.taint.infer-sources";
  /* Treat escape/sanitize/encode/... call names as sanitizers */
  public static final String TAINT_SANITIZER_PATTERNS =
                                  "ceva.taint.sanitizer-patterns";
  /* Comma-separated list of additional sanitizer function names */
  public static final String TAINT_SANITIZERS = "ceva.taint.sanitizers";

  public static final String VERIFY_SMT = "ceva.verify.smt";
  public static final String VERIFY_TIMEOUT_MS = "ceva.verify.timeout-ms";
  public static final String VERIFY_INTEGER_MODE = "ceva.verify.integer-mode";
  // Max iterations of a constant-bounded loop to unroll in body models
  public static final String VERIFY_UNROLL_THRESHOLD =
                                  "ceva.verify.unroll-threshold";
  // Max number of paths explored when modelling a body
  public static final String VERIFY_PATH_LIMIT = "ceva.verify.path-limit";
  public static final String VERIFY_VERBOSE = "ceva.verify.verbose";
  // Try to prove loop invariants by k-induction before widening
  public static final String VERIFY_K_INDUCTION = "ceva.verify.k-induction";
  public static final String VERIFY_K_INDUCTION_MAX_K =
                                  "ceva.verify.k-induction.max-k";

  public static final String CACHE_ENABLED = "ceva.cache.enabled";
  public static final String CACHE_DIR = "ceva.cache.dir";
  /* Delete all cache entries before the run */
  public static final String CACHE_CLEAR = "ceva.cache.clear";
  /* Evict oldest entries when the cache grows past this many bytes */
  public static final String CACHE_MAX_BYTES = "ceva.cache.max-bytes";

  public static final String UNKNOWN_CALL_POLICY = "ceva.unknown-call-policy";
  public static final String WORKERS = "ceva.workers";
  public static final String DEADLINE_MS = "ceva.deadline-ms";
  public static final String DATAFLOW_MAX_ITERATIONS =
                                  "ceva.dataflow.max-iterations";

  public static final String INPUT_FILENAME = "ceva.input_filename";
  public static final String LOG_FILE = "ceva.log.file";
  public static final String LOG_TRACE = "ceva.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(ANALYSIS_DATAFLOW, "true");
    defaults.setProperty(ANALYSIS_DEAD_STORES, "true");
    defaults.setProperty(ANALYSIS_BUG_PATTERNS, "true");
    defaults.setProperty(ANALYSIS_TAINT, "true");

    defaults.setProperty(BUGPATTERN_DIV_ZERO, "true");
    defaults.setProperty(BUGPATTERN_NULL_DEREF, "true");
    defaults.setProperty(BUGPATTERN_OVERFLOW, "true");
    defaults.setProperty(BUGPATTERN_INDEX_OOB, "true");
    defaults.setProperty(BUGPATTERN_SMT_CONFIRM, "false");

    defaults.setProperty(TAINT_INFER_SOURCES, "false");
    defaults.setProperty(TAINT_SANITIZER_PATTERNS, "true");
    defaults.setProperty(TAINT_SANITIZERS, "");

    defaults.setProperty(VERIFY_SMT, "true");
    defaults.setProperty(VERIFY_TIMEOUT_MS, "5000");
    defaults.setProperty(VERIFY_INTEGER_MODE, "trap");
    defaults.setProperty(VERIFY_UNROLL_THRESHOLD, "16");
    defaults.setProperty(VERIFY_PATH_LIMIT, "64");
    defaults.setProperty(VERIFY_VERBOSE, "false");
    defaults.setProperty(VERIFY_K_INDUCTION, "false");
    defaults.setProperty(VERIFY_K_INDUCTION_MAX_K, "3");

    defaults.setProperty(CACHE_ENABLED, "true");
    defaults.setProperty(CACHE_DIR, System.getProperty("user.home") +
                    File.separator + ".ceva" + File.separator + "cache");
    defaults.setProperty(CACHE_CLEAR, "false");
    // 0 means no limit
    defaults.setProperty(CACHE_MAX_BYTES, "0");

    defaults.setProperty(UNKNOWN_CALL_POLICY, "default");
    // 0 means one worker per available processor
    defaults.setProperty(WORKERS, "0");
    // 0 means no deadline
    defaults.setProperty(DEADLINE_MS, "0");
    defaults.setProperty(DATAFLOW_MAX_ITERATIONS, "1000");

    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initCevaProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  public static void validateProperties() throws InvalidOptionException {
    getBoolean(ANALYSIS_DATAFLOW);
    getBoolean(ANALYSIS_DEAD_STORES);
    getBoolean(ANALYSIS_BUG_PATTERNS);
    getBoolean(ANALYSIS_TAINT);
    getBoolean(BUGPATTERN_DIV_ZERO);
    getBoolean(BUGPATTERN_NULL_DEREF);
    getBoolean(BUGPATTERN_OVERFLOW);
    getBoolean(BUGPATTERN_INDEX_OOB);
    getBoolean(BUGPATTERN_SMT_CONFIRM);
    getBoolean(TAINT_INFER_SOURCES);
    getBoolean(TAINT_SANITIZER_PATTERNS);
    getBoolean(VERIFY_SMT);
    getBoolean(VERIFY_VERBOSE);
    getBoolean(VERIFY_K_INDUCTION);
    getBoolean(CACHE_ENABLED);
    getBoolean(CACHE_CLEAR);
    getBoolean(LOG_TRACE);

    if (getLong(VERIFY_TIMEOUT_MS) < 0) {
      throw new InvalidOptionException(VERIFY_TIMEOUT_MS +
                                        " must not be negative");
    }
    getInt(VERIFY_UNROLL_THRESHOLD);
    getInt(VERIFY_PATH_LIMIT);
    if (getInt(VERIFY_K_INDUCTION_MAX_K) < 1) {
      throw new InvalidOptionException(VERIFY_K_INDUCTION_MAX_K +
                                        " must be at least 1");
    }
    if (getLong(CACHE_MAX_BYTES) < 0) {
      throw new InvalidOptionException(CACHE_MAX_BYTES +
                                        " must not be negative");
    }
    getInt(WORKERS);
    getLong(DEADLINE_MS);
    getInt(DATAFLOW_MAX_ITERATIONS);

    checkOneOf(VERIFY_INTEGER_MODE, Arrays.asList("wrap", "trap"));
    checkOneOf(UNKNOWN_CALL_POLICY,
               Arrays.asList("strict", "default", "permissive"));
  }

  public static String get(String key) {
    return properties.getProperty(key);
  }

  /**
   * Throw an exception if the property value for the specified key
   * is not in the set.  We are insensitive to the case
   * @param key
   * @param validVals
   * @throws InvalidOptionException
   */
  private static void checkOneOf(String key, List<String> validVals)
                                                  throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    String lcaseVal = val.toLowerCase();
    for (String vv: validVals) {
      if (lcaseVal.equals(vv.toLowerCase())) {
        return;
      }
    }

    StringBuilder sb = new StringBuilder();
    for (String vv: validVals) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append("'");
      sb.append(vv);
      sb.append("'");
    }
    throw new InvalidOptionException("Expected property " + key + " to be one of: "
        + sb.toString() + " but was '" + val + "'");
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static int getInt(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Integer.parseInt(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
