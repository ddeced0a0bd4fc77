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

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.ceva.common.util.Pair;

public class Logging {
  private static final String CEVA_LOGGER_NAME = "exm.ceva";

  private static final String LOG_PATTERN = "%-5p %d{HH:mm:ss,SSS} [%t] %c{1} %m%n";

  /**
   * Messages already emitted.
   */
  private static final Set<Pair<Level, String>> emitted =
          new HashSet<Pair<Level, String>>();

  public static Logger getCevaLogger() {
    return Logger.getLogger(CEVA_LOGGER_NAME);
  }

  /**
   * Direct the ceva logger to a file.  An empty or null logfile leaves
   * the logger with whatever log4j.properties configured, but at WARN
   * so analysis runs stay quiet.
   * @param logfile
   * @param trace log everything, not just debug output
   * @return the configured logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger cevaLogger = getCevaLogger();
    if (StringUtils.isBlank(logfile)) {
      cevaLogger.setLevel(Level.WARN);
      return cevaLogger;
    }

    Layout layout = new PatternLayout(LOG_PATTERN);
    try {
      FileAppender appender = new FileAppender(layout, logfile, false);
      cevaLogger.addAppender(appender);
      cevaLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } catch (IOException e) {
      // Even if logging is disabled, the logger must be valid
      System.err.println("Could not open log file: " + logfile + ": " +
                          e.getMessage());
      cevaLogger.setLevel(Level.WARN);
    }
    return cevaLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static synchronized boolean addEmitted(Level level, String msg) {
    return emitted.add(Pair.create(level, msg));
  }

  public static void uniqueWarn(String msg) {
    if (addEmitted(Level.WARN, msg)) {
      getCevaLogger().warn(msg);
    } else {
      getCevaLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
