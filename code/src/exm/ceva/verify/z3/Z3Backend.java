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

package exm.ceva.verify.z3;

import org.apache.log4j.Logger;

import com.microsoft.z3.Version;

import exm.ceva.common.Logging;
import exm.ceva.verify.SolverBackend;
import exm.ceva.verify.SolverSession;

/**
 * Z3 through its Java bindings.  The native library is loaded on first
 * use: if it can't be loaded the backend reports itself unavailable
 * rather than failing the analysis.
 */
public class Z3Backend implements SolverBackend {
  private static final Logger logger = Logging.getCevaLogger();

  private Boolean available = null;
  private String unavailableReason = null;

  @Override
  public String name() {
    return "z3";
  }

  @Override
  public synchronized boolean isAvailable() {
    if (available == null) {
      try {
        String version = Version.getFullVersion();
        logger.debug("Loaded " + version);
        available = true;
      } catch (LinkageError e) {
        unavailableReason = "could not load z3: " + e.getMessage();
        Logging.uniqueWarn(unavailableReason);
        available = false;
      }
    }
    return available;
  }

  @Override
  public synchronized String unavailableReason() {
    isAvailable();
    return unavailableReason;
  }

  @Override
  public SolverSession openSession(long timeoutMs) {
    if (!isAvailable()) {
      throw new IllegalStateException(unavailableReason);
    }
    return new Z3SolverSession(timeoutMs);
  }
}
