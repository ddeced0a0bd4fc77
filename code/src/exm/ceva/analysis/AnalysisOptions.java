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

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import exm.ceva.analysis.bugpattern.BugPatternChecker;
import exm.ceva.analysis.bugpattern.BugPatternDetector;
import exm.ceva.common.Settings;
import exm.ceva.common.exceptions.InvalidOptionException;
import exm.ceva.common.lang.IntegerMode;

/**
 * Immutable snapshot of the options for one analysis run.  Built either
 * with a Builder or from the global Settings.
 */
public class AnalysisOptions {
  private final boolean enableDataflow;
  private final boolean reportDeadStores;
  private final boolean enableBugPatterns;
  private final Set<String> disabledCheckers;
  private final boolean enableTaintAnalysis;
  private final boolean inferTaintSources;
  private final boolean sanitizerPatterns;
  private final List<String> sanitizers;
  private final boolean useSmtVerification;
  private final long verificationTimeoutMs;
  private final IntegerMode integerMode;
  private final int unrollThreshold;
  private final int pathLimit;
  private final boolean verbose;
  private final boolean kInduction;
  private final int kInductionMaxK;
  private final boolean confirmBugPatterns;
  private final boolean cacheEnabled;
  private final File cacheDirectory;
  private final boolean clearCache;
  private final long cacheMaxBytes;
  private final UnknownCallPolicy unknownCallPolicy;
  private final int workers;
  private final long deadlineMs;
  private final int dataflowMaxIterations;

  private AnalysisOptions(Builder b) {
    this.enableDataflow = b.enableDataflow;
    this.reportDeadStores = b.reportDeadStores;
    this.enableBugPatterns = b.enableBugPatterns;
    this.disabledCheckers = Collections.unmodifiableSet(
                                new HashSet<String>(b.disabledCheckers));
    this.enableTaintAnalysis = b.enableTaintAnalysis;
    this.inferTaintSources = b.inferTaintSources;
    this.sanitizerPatterns = b.sanitizerPatterns;
    this.sanitizers = Collections.unmodifiableList(
                                new ArrayList<String>(b.sanitizers));
    this.useSmtVerification = b.useSmtVerification;
    this.verificationTimeoutMs = b.verificationTimeoutMs;
    this.integerMode = b.integerMode;
    this.unrollThreshold = b.unrollThreshold;
    this.pathLimit = b.pathLimit;
    this.verbose = b.verbose;
    this.kInduction = b.kInduction;
    this.kInductionMaxK = b.kInductionMaxK;
    this.confirmBugPatterns = b.confirmBugPatterns;
    this.cacheEnabled = b.cacheEnabled;
    this.cacheDirectory = b.cacheDirectory;
    this.clearCache = b.clearCache;
    this.cacheMaxBytes = b.cacheMaxBytes;
    this.unknownCallPolicy = b.unknownCallPolicy;
    this.workers = b.workers;
    this.deadlineMs = b.deadlineMs;
    this.dataflowMaxIterations = b.dataflowMaxIterations;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Options from the current Settings
   */
  public static AnalysisOptions fromSettings() throws InvalidOptionException {
    Builder b = new Builder();
    b.enableDataflow(Settings.getBoolean(Settings.ANALYSIS_DATAFLOW));
    b.reportDeadStores(Settings.getBoolean(Settings.ANALYSIS_DEAD_STORES));
    b.enableBugPatterns(Settings.getBoolean(Settings.ANALYSIS_BUG_PATTERNS));
    for (BugPatternChecker c: BugPatternDetector.allCheckers()) {
      if (!Settings.getBoolean(c.getConfigEnabledKey())) {
        b.disableChecker(c.getConfigEnabledKey());
      }
    }
    b.enableTaintAnalysis(Settings.getBoolean(Settings.ANALYSIS_TAINT));
    b.inferTaintSources(Settings.getBoolean(Settings.TAINT_INFER_SOURCES));
    b.sanitizerPatterns(Settings.getBoolean(
                                  Settings.TAINT_SANITIZER_PATTERNS));
    for (String s: StringUtils.split(Settings.get(Settings.TAINT_SANITIZERS),
                                     ", ")) {
      b.addSanitizer(s);
    }
    b.useSmtVerification(Settings.getBoolean(Settings.VERIFY_SMT));
    b.verificationTimeoutMs(Settings.getLong(Settings.VERIFY_TIMEOUT_MS));
    b.integerMode(IntegerMode.fromString(
                          Settings.get(Settings.VERIFY_INTEGER_MODE)));
    b.unrollThreshold(Settings.getInt(Settings.VERIFY_UNROLL_THRESHOLD));
    b.pathLimit(Settings.getInt(Settings.VERIFY_PATH_LIMIT));
    b.verbose(Settings.getBoolean(Settings.VERIFY_VERBOSE));
    b.kInduction(Settings.getBoolean(Settings.VERIFY_K_INDUCTION));
    b.kInductionMaxK(Settings.getInt(Settings.VERIFY_K_INDUCTION_MAX_K));
    b.confirmBugPatterns(Settings.getBoolean(
                                  Settings.BUGPATTERN_SMT_CONFIRM));
    b.cacheEnabled(Settings.getBoolean(Settings.CACHE_ENABLED));
    b.cacheDirectory(new File(Settings.get(Settings.CACHE_DIR)));
    b.clearCache(Settings.getBoolean(Settings.CACHE_CLEAR));
    b.cacheMaxBytes(Settings.getLong(Settings.CACHE_MAX_BYTES));
    b.unknownCallPolicy(UnknownCallPolicy.fromString(
                          Settings.get(Settings.UNKNOWN_CALL_POLICY)));
    b.workers(Settings.getInt(Settings.WORKERS));
    b.deadlineMs(Settings.getLong(Settings.DEADLINE_MS));
    b.dataflowMaxIterations(Settings.getInt(
                          Settings.DATAFLOW_MAX_ITERATIONS));
    return b.build();
  }

  public boolean enableDataflow() {
    return enableDataflow;
  }

  public boolean reportDeadStores() {
    return reportDeadStores;
  }

  public boolean enableBugPatterns() {
    return enableBugPatterns;
  }

  /**
   * @param enabledKey the checker's configuration key
   */
  public boolean isCheckerEnabled(String enabledKey) {
    return !disabledCheckers.contains(enabledKey);
  }

  public boolean enableTaintAnalysis() {
    return enableTaintAnalysis;
  }

  public boolean inferTaintSources() {
    return inferTaintSources;
  }

  public boolean sanitizerPatterns() {
    return sanitizerPatterns;
  }

  public List<String> sanitizers() {
    return sanitizers;
  }

  public boolean useSmtVerification() {
    return useSmtVerification;
  }

  public long verificationTimeoutMs() {
    return verificationTimeoutMs;
  }

  public IntegerMode integerMode() {
    return integerMode;
  }

  public int unrollThreshold() {
    return unrollThreshold;
  }

  public int pathLimit() {
    return pathLimit;
  }

  public boolean verbose() {
    return verbose;
  }

  /**
   * @return true if loop invariants are synthesized by k-induction
   */
  public boolean kInduction() {
    return kInduction;
  }

  public int kInductionMaxK() {
    return kInductionMaxK;
  }

  /**
   * @return true if division and index warnings are checked with the
   *         solver before being reported
   */
  public boolean confirmBugPatterns() {
    return confirmBugPatterns;
  }

  public boolean cacheEnabled() {
    return cacheEnabled;
  }

  public File cacheDirectory() {
    return cacheDirectory;
  }

  public boolean clearCache() {
    return clearCache;
  }

  /**
   * @return size the cache is kept under, 0 if unlimited
   */
  public long cacheMaxBytes() {
    return cacheMaxBytes;
  }

  public UnknownCallPolicy unknownCallPolicy() {
    return unknownCallPolicy;
  }

  /**
   * @return number of worker threads, at least 1
   */
  public int workers() {
    if (workers > 0) {
      return workers;
    }
    return Runtime.getRuntime().availableProcessors();
  }

  /**
   * @return time limit for the whole run, 0 if none
   */
  public long deadlineMs() {
    return deadlineMs;
  }

  public int dataflowMaxIterations() {
    return dataflowMaxIterations;
  }

  public static class Builder {
    private boolean enableDataflow = true;
    private boolean reportDeadStores = true;
    private boolean enableBugPatterns = true;
    private final Set<String> disabledCheckers = new HashSet<String>();
    private boolean enableTaintAnalysis = true;
    private boolean inferTaintSources = false;
    private boolean sanitizerPatterns = true;
    private final List<String> sanitizers = new ArrayList<String>();
    private boolean useSmtVerification = true;
    private long verificationTimeoutMs = 5000;
    private IntegerMode integerMode = IntegerMode.TRAP;
    private int unrollThreshold = 16;
    private int pathLimit = 64;
    private boolean verbose = false;
    private boolean kInduction = false;
    private int kInductionMaxK = 3;
    private boolean confirmBugPatterns = false;
    private boolean cacheEnabled = false;
    private File cacheDirectory = null;
    private boolean clearCache = false;
    private long cacheMaxBytes = 0;
    private UnknownCallPolicy unknownCallPolicy = UnknownCallPolicy.DEFAULT;
    private int workers = 0;
    private long deadlineMs = 0;
    private int dataflowMaxIterations = 1000;

    private Builder() {
    }

    public Builder enableDataflow(boolean val) {
      this.enableDataflow = val;
      return this;
    }

    public Builder reportDeadStores(boolean val) {
      this.reportDeadStores = val;
      return this;
    }

    public Builder enableBugPatterns(boolean val) {
      this.enableBugPatterns = val;
      return this;
    }

    public Builder disableChecker(String enabledKey) {
      this.disabledCheckers.add(enabledKey);
      return this;
    }

    public Builder enableTaintAnalysis(boolean val) {
      this.enableTaintAnalysis = val;
      return this;
    }

    public Builder inferTaintSources(boolean val) {
      this.inferTaintSources = val;
      return this;
    }

    public Builder sanitizerPatterns(boolean val) {
      this.sanitizerPatterns = val;
      return this;
    }

    public Builder addSanitizer(String name) {
      this.sanitizers.add(name);
      return this;
    }

    public Builder useSmtVerification(boolean val) {
      this.useSmtVerification = val;
      return this;
    }

    public Builder verificationTimeoutMs(long val) {
      this.verificationTimeoutMs = val;
      return this;
    }

    public Builder integerMode(IntegerMode val) {
      this.integerMode = val;
      return this;
    }

    public Builder unrollThreshold(int val) {
      this.unrollThreshold = val;
      return this;
    }

    public Builder pathLimit(int val) {
      this.pathLimit = val;
      return this;
    }

    public Builder verbose(boolean val) {
      this.verbose = val;
      return this;
    }

    public Builder kInduction(boolean val) {
      this.kInduction = val;
      return this;
    }

    public Builder kInductionMaxK(int val) {
      this.kInductionMaxK = val;
      return this;
    }

    public Builder confirmBugPatterns(boolean val) {
      this.confirmBugPatterns = val;
      return this;
    }

    public Builder clearCache(boolean val) {
      this.clearCache = val;
      return this;
    }

    public Builder cacheMaxBytes(long val) {
      this.cacheMaxBytes = val;
      return this;
    }

    public Builder cacheEnabled(boolean val) {
      this.cacheEnabled = val;
      return this;
    }

    public Builder cacheDirectory(File val) {
      this.cacheDirectory = val;
      return this;
    }

    public Builder unknownCallPolicy(UnknownCallPolicy val) {
      this.unknownCallPolicy = val;
      return this;
    }

    public Builder workers(int val) {
      this.workers = val;
      return this;
    }

    public Builder deadlineMs(long val) {
      this.deadlineMs = val;
      return this;
    }

    public Builder dataflowMaxIterations(int val) {
      this.dataflowMaxIterations = val;
      return this;
    }

    public AnalysisOptions build() {
      if (cacheEnabled && cacheDirectory == null) {
        throw new IllegalStateException("cache enabled without directory");
      }
      if (kInductionMaxK < 1) {
        throw new IllegalStateException("k-induction bound must be >= 1");
      }
      return new AnalysisOptions(this);
    }
  }
}
