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

package exm.pvs.common;

import java.io.IOException;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

public class Logging
{
  private static final String PVS_LOGGER_NAME = "exm.pvs";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  public static Logger getPvsLogger()
  {
    return Logger.getLogger(PVS_LOGGER_NAME);
  }

  /**
   * Configure the project logger.  With a log file, everything down to
   * DEBUG (or TRACE) goes to the file; without one, only warnings and
   * errors reach the console.
   * @param logfile path of log file, or null/empty for console only
   * @param trace enable TRACE-level output in the log file
   * @return the configured logger
   * @throws IOException if the log file cannot be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
                                                  throws IOException
  {
    Logger pvsLogger = getPvsLogger();
    pvsLogger.removeAllAppenders();
    pvsLogger.setAdditivity(false);
    Layout layout = new PatternLayout(LOG_PATTERN);
    if (logfile != null && logfile.length() > 0) {
      pvsLogger.addAppender(new FileAppender(layout, logfile, false));
      pvsLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      ConsoleAppender console = new ConsoleAppender(layout,
                                        ConsoleAppender.SYSTEM_ERR);
      pvsLogger.addAppender(console);
      pvsLogger.setLevel(Level.WARN);
    }
    // Even if logging is disabled, this must be valid:
    return pvsLogger;
  }
}
