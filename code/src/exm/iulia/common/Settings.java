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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.iulia.common.exceptions.InvalidOptionException;

/**
 * General optimizer settings
 *
 * Settings are held in a static property table with defaults.  Any key can
 * be overridden with a Java system property of the same name, which is
 * picked up by {@link #initProperties()}.
 * */
public class Settings
{
  public static final String OPT_FULL_INLINE = "iulia.opt.full-inline";
  /* Maximum number of inliner runs over the program */
  public static final String OPT_MAX_ITERATIONS = "iulia.opt.max-iterations";

  /* Validate tree between passes */
  public static final String COMPILER_DEBUG = "iulia.compiler-debug";

  public static final String LOG_FILE = "iulia.log.file";
  public static final String LOG_TRACE = "iulia.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(OPT_FULL_INLINE, "true");
    defaults.setProperty(OPT_MAX_ITERATIONS, "10");
    defaults.setProperty(COMPILER_DEBUG, "true");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initProperties() throws InvalidOptionException {
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

  /**
   * Drop any value set since startup, reverting to the default
   * @param key
   */
  public static void reset(String key) {
    properties.remove(key);
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
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(OPT_FULL_INLINE);
    getBoolean(COMPILER_DEBUG);
    getBoolean(LOG_TRACE);
    long maxIters = getLong(OPT_MAX_ITERATIONS);
    if (maxIters < 1) {
      throw new InvalidOptionException(OPT_MAX_ITERATIONS +
                  " must be at least 1, but was " + maxIters);
    }
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException ex) {
      throw new InvalidOptionException("Expected option " + key +
          " to be an integer, but was '" + strVal + "'");
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.toLowerCase();
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
