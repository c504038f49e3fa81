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
package exm.p4ir.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.p4ir.common.exceptions.IRInvariantError;

public class Logging {
  private static final String IR_LOGGER_NAME = "exm.p4ir";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted.
   */
  private static final Set<Pair<Level, String>> emitted =
          new HashSet<Pair<Level, String>>();

  /**
   * File appender added by setupLogging, replaced by the next call
   */
  private static FileAppender fileAppender = null;

  public static Logger getIRLogger() {
    return Logger.getLogger(IR_LOGGER_NAME);
  }

  /**
   * Set up the IR logger.  If logfile is empty, only the level is changed
   * and whatever appenders log4j was configured with are kept.  Otherwise
   * the file replaces the one set up by the previous call.
   * @param logfile
   * @param trace log at TRACE level rather than DEBUG
   * @return the IR logger
   */
  public static synchronized Logger setupLogging(String logfile,
                                                boolean trace) {
    Logger irLogger = getIRLogger();
    irLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    if (logfile != null && logfile.length() > 0) {
      if (fileAppender != null) {
        irLogger.removeAppender(fileAppender);
        fileAppender.close();
        fileAppender = null;
      }
      try {
        FileAppender appender = new FileAppender(new PatternLayout(LOG_PATTERN),
                                                 logfile, false);
        irLogger.addAppender(appender);
        fileAppender = appender;
      } catch (IOException e) {
        throw new IRInvariantError("Could not open log file " + logfile
                                   + ": " + e.getMessage());
      }
    }
    return irLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg) {
    return emitted.add(Pair.of(level, msg));
  }

  public static void uniqueWarn(String msg) {
    if (addEmitted(Level.WARN, msg)) {
      getIRLogger().warn(msg);
    } else {
      getIRLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
