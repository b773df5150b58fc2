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
package exm.iulia.common;

import java.io.IOException;
import java.util.HashSet;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.iulia.common.exceptions.InvalidOptionException;
import exm.iulia.common.exceptions.IuliaRuntimeError;
import exm.iulia.common.util.Pair;

public class Logging {
  private static final String IULIA_LOGGER_NAME = "exm.iulia";

  private static final String LOG_PATTERN = "%-5p %c{1}: %m%n";

  /**
   * Messages already emitted.
   */
  private static final HashSet<Pair<Level, String>> emitted =
          new HashSet<Pair<Level, String>>();

  public static Logger getIuliaLogger() {
    return Logger.getLogger(IULIA_LOGGER_NAME);
  }

  /**
   * Configure logging from {@link Settings#LOG_FILE} and
   * {@link Settings#LOG_TRACE}
   */
  public static Logger setupLogging() throws InvalidOptionException {
    return setupLogging(Settings.get(Settings.LOG_FILE),
                        Settings.getBoolean(Settings.LOG_TRACE));
  }

  /**
   * Configure the optimizer logger.  Any appenders added by a previous
   * call are replaced.
   * @param logfile file to log to.  If empty, only warnings and errors
   *                are logged, to stderr
   * @param trace if true, log at TRACE level, otherwise DEBUG
   * @return the configured logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger iuliaLogger = getIuliaLogger();
    iuliaLogger.removeAllAppenders();
    iuliaLogger.setAdditivity(false);
    Layout layout = new PatternLayout(LOG_PATTERN);

    if (StringUtils.isBlank(logfile)) {
      ConsoleAppender console = new ConsoleAppender(layout,
                                          ConsoleAppender.SYSTEM_ERR);
      console.setThreshold(Level.WARN);
      iuliaLogger.addAppender(console);
    } else {
      try {
        iuliaLogger.addAppender(new FileAppender(layout, logfile, false));
      } catch (IOException e) {
        throw new IuliaRuntimeError("Could not open log file " + logfile +
                                    ": " + e.getMessage());
      }
    }
    iuliaLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return iuliaLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg) {
    return emitted.add(Pair.create(level, msg));
  }

  public static void uniqueWarn(String msg) {
    if (Logging.addEmitted(Level.WARN, msg)) {
      Logging.getIuliaLogger().warn(msg);
    } else {
      Logging.getIuliaLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
