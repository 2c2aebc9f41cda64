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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.pvs.common.exceptions.InvalidOptionException;

/**
 * General parser settings, read from Java properties.
 *
 * The core lexer and parser never consult this class directly: the front
 * end snapshots it into an immutable ParserOptions value.
 * */
public class Settings
{
  public static final String LOG_FILE = "pvs.log.file";
  public static final String LOG_TRACE = "pvs.log.trace";

  /** Stop recording diagnostics beyond this many per parse */
  public static final String MAX_ERRORS = "pvs.parser.max-errors";
  /** Warn about repeated field names in one update or record literal */
  public static final String WARN_DUPLICATE_FIELDS =
                                  "pvs.parser.warn-duplicate-fields";
  public static final String TAB_WIDTH = "pvs.lexer.tab-width";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(MAX_ERRORS, "100");
    defaults.setProperty(WARN_DUPLICATE_FIELDS, "false");
    defaults.setProperty(TAB_WIDTH, "1");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initPvsProperties() throws InvalidOptionException {
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

  public static String get(String key) {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    List<String> keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(WARN_DUPLICATE_FIELDS);
    if (getInt(MAX_ERRORS) < 1) {
      throw new InvalidOptionException(MAX_ERRORS + " must be at least 1, "
                                      + "but was " + get(MAX_ERRORS));
    }
    if (getInt(TAB_WIDTH) < 1) {
      throw new InvalidOptionException(TAB_WIDTH + " must be at least 1, "
                                      + "but was " + get(TAB_WIDTH));
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
