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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.p4ir.common.exceptions.IRInvariantError;
import exm.p4ir.common.exceptions.InvalidOptionException;

/**
 * General IR framework settings, stored as Java properties.  Defaults are
 * set here and can be overridden with system properties of the same name.
 */
public class Settings {

  /** Promote "at most one @name annotation" from convention to invariant */
  public static final String UNIQUE_NAME_ANNOTATION =
                                      "p4ir.annotations.unique-name";

  /** Visit shared subtrees once per traversal */
  public static final String VISIT_DAG_ONCE = "p4ir.visitor.dag-once";

  public static final String PASS_STOP_ON_ERROR = "p4ir.pass.stop-on-error";
  public static final String PASS_DUMP_AFTER = "p4ir.pass.dump-after";

  public static final String LOG_FILE = "p4ir.log.file";
  public static final String LOG_TRACE = "p4ir.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(UNIQUE_NAME_ANNOTATION, "false");
    defaults.setProperty(VISIT_DAG_ONCE, "true");
    defaults.setProperty(PASS_STOP_ON_ERROR, "true");
    defaults.setProperty(PASS_DUMP_AFTER, "false");
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
   * Drop any override for key so that the default applies again
   * @param key
   */
  public static void clear(String key) {
    properties.remove(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  private static void validateProperties() throws InvalidOptionException {
    getBoolean(UNIQUE_NAME_ANNOTATION);
    getBoolean(VISIT_DAG_ONCE);
    getBoolean(PASS_STOP_ON_ERROR);
    getBoolean(PASS_DUMP_AFTER);
    getBoolean(LOG_TRACE);
  }

  public static String get(String key) {
    return properties.getProperty(key);
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal);
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

  /**
   * Look up a boolean option that the framework itself depends on.
   * A bad value here means the settings were corrupted after validation.
   */
  public static boolean getBooleanInternal(String key) {
    try {
      return getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new IRInvariantError("Expected config key " + key +
                                 " to hold a boolean: " + e.getMessage());
    }
  }
}
