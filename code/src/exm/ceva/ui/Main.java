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

import java.io.File;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;

import exm.ceva.common.Logging;
import exm.ceva.common.Settings;
import exm.ceva.common.exceptions.CevaFatal;
import exm.ceva.common.exceptions.InvalidOptionException;

/**
 * Command line interface to the analyzer.  Most options map onto
 * settings (see Settings.java), which can also be given as Java
 * properties or with -D.
 */
public class Main {
  private static final String SETTING_FLAG = "D";
  private static final String NO_DATAFLOW = "no-dataflow";
  private static final String NO_BUG_PATTERNS = "no-bug-patterns";
  private static final String NO_TAINT = "no-taint";
  private static final String NO_SMT = "no-smt";
  private static final String TIMEOUT = "timeout";
  private static final String NO_CACHE = "no-cache";
  private static final String CACHE_DIR = "cache-dir";
  private static final String POLICY = "policy";
  private static final String WORKERS = "workers";
  private static final String DEADLINE = "deadline";
  private static final String VERBOSE = "verbose";
  private static final String JSON = "json";

  public static void main(String[] args) {
    try {
      Settings.initCevaProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_USER.code());
    }

    Args cevaArgs = processArgs(args);

    try {
      Settings.validateProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    Logger logger = null;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    File input = new File(cevaArgs.inputFilename);
    if (!input.isFile() || !input.canRead()) {
      System.out.println("Input file \"" + input + "\" is not readable");
      System.exit(ExitCode.ERROR_IO.code());
    }

    try {
      CevaDriver driver = new CevaDriver(logger);
      ExitCode code = driver.run(input, cevaArgs.json, System.out);
      System.exit(code.code());
    } catch (CevaFatal ex) {
      System.exit(ex.exitCode);
    }
  }

  private static Options initOptions() {
    Options opts = new Options();

    Option setting = new Option(SETTING_FLAG, true,
                                "Set a setting, e.g. -Dceva.workers=4");
    setting.setArgs(2);
    setting.setValueSeparator('=');
    opts.addOption(setting);

    opts.addOption(null, NO_DATAFLOW, false,
                   "Skip uninitialized variable and dead code analysis");
    opts.addOption(null, NO_BUG_PATTERNS, false,
                   "Skip bug pattern detection");
    opts.addOption(null, NO_TAINT, false, "Skip taint analysis");
    opts.addOption(null, NO_SMT, false, "Don't verify contracts");
    opts.addOption(null, TIMEOUT, true,
                   "Solver timeout per check in milliseconds");
    opts.addOption(null, NO_CACHE, false,
                   "Don't read or write cached verification results");
    opts.addOption(null, CACHE_DIR, true,
                   "Directory for cached verification results");
    opts.addOption(null, POLICY, true,
                   "Unknown call policy: strict, default or permissive");
    opts.addOption(null, WORKERS, true, "Number of worker threads");
    opts.addOption(null, DEADLINE, true,
                   "Stop starting new functions after this many milliseconds");
    opts.addOption("v", VERBOSE, false, "Also report proven contracts");
    opts.addOption(null, JSON, false, "Print results as JSON");
    return opts;
  }

  private static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd = null;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
      return null;
    }

    Properties settings = cmd.getOptionProperties(SETTING_FLAG);
    for (String key: settings.stringPropertyNames()) {
      Settings.set(key, settings.getProperty(key));
    }

    disableIfSet(cmd, NO_DATAFLOW, Settings.ANALYSIS_DATAFLOW);
    disableIfSet(cmd, NO_BUG_PATTERNS, Settings.ANALYSIS_BUG_PATTERNS);
    disableIfSet(cmd, NO_TAINT, Settings.ANALYSIS_TAINT);
    disableIfSet(cmd, NO_SMT, Settings.VERIFY_SMT);
    disableIfSet(cmd, NO_CACHE, Settings.CACHE_ENABLED);
    setIfPresent(cmd, TIMEOUT, Settings.VERIFY_TIMEOUT_MS);
    setIfPresent(cmd, CACHE_DIR, Settings.CACHE_DIR);
    setIfPresent(cmd, POLICY, Settings.UNKNOWN_CALL_POLICY);
    setIfPresent(cmd, WORKERS, Settings.WORKERS);
    setIfPresent(cmd, DEADLINE, Settings.DEADLINE_MS);
    if (cmd.hasOption(VERBOSE)) {
      Settings.set(Settings.VERIFY_VERBOSE, "true");
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length != 1) {
      System.out.println("Expected one input file, but got "
              + remainingArgs.length + " arguments");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    Settings.set(Settings.INPUT_FILENAME, remainingArgs[0]);
    return new Args(remainingArgs[0], cmd.hasOption(JSON));
  }

  private static void disableIfSet(CommandLine cmd, String flag,
                                   String key) {
    if (cmd.hasOption(flag)) {
      Settings.set(key, "false");
    }
  }

  private static void setIfPresent(CommandLine cmd, String flag,
                                   String key) {
    if (cmd.hasOption(flag)) {
      Settings.set(key, cmd.getOptionValue(flag));
    }
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("ceva [options] <module.json>", opts, false);
  }

  private static class Args {
    public final String inputFilename;
    public final boolean json;

    public Args(String inputFilename, boolean json) {
      this.inputFilename = inputFilename;
      this.json = json;
    }
  }
}
