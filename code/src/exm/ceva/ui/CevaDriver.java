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
import java.io.IOException;
import java.io.PrintStream;

import org.apache.log4j.Logger;

import exm.ceva.analysis.AnalysisCoordinator;
import exm.ceva.analysis.AnalysisOptions;
import exm.ceva.analysis.AnalysisResult;
import exm.ceva.ast.Module;
import exm.ceva.ast.ModuleReader;
import exm.ceva.common.exceptions.CevaFatal;
import exm.ceva.common.exceptions.UserException;
import exm.ceva.common.util.Misc;

/**
 * Read a module, analyze it and print the results
 */
public class CevaDriver {

  private final Logger logger;

  public CevaDriver(Logger logger) {
    this.logger = logger;
  }

  /**
   * @return exit code to use
   * @throws CevaFatal if the module couldn't be analyzed
   */
  public ExitCode run(File input, boolean json, PrintStream out) {
    try {
      logger.info("ceva starting: " + Misc.timestamp());
      AnalysisOptions options = AnalysisOptions.fromSettings();
      Module module = new ModuleReader().read(input);

      AnalysisCoordinator coordinator = new AnalysisCoordinator(options);
      AnalysisResult result = coordinator.analyze(module);
      if (json) {
        ResultFormatter.printJson(result, out);
      } else {
        ResultFormatter.printText(result, out);
      }
      out.flush();
      logger.debug("ceva done: " + Misc.timestamp());
      return result.hasErrors() ? ExitCode.ERROR_FINDINGS : ExitCode.SUCCESS;
    }
    catch (UserException e) {
      System.err.println("ceva error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled())
        logger.debug(Misc.stackTrace(e));
      throw new CevaFatal(ExitCode.ERROR_USER.code());
    }
    catch (IOException e) {
      System.err.println("I/O error while writing results");
      System.err.println(e.getMessage());
      throw new CevaFatal(ExitCode.ERROR_IO.code());
    }
    catch (CevaFatal e) {
      throw e;
    }
    catch (Throwable e) {
      reportInternalError(e);
      throw new CevaFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("CEVA INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
