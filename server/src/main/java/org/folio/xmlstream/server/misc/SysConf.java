package org.folio.xmlstream.server.misc;

import io.vertx.core.json.JsonObject;

/**
 * Configuration lookup: system property first, then verticle configuration, then default.
 */
public final class SysConf {

  private SysConf() { }

  /**
   * Get configuration value.
   * @param key system property name
   * @param configKey key in verticle configuration; may be the same as key
   * @param def default value
   * @param config verticle configuration; may be null
   * @return value
   */
  public static String get(String key, String configKey, String def, JsonObject config) {
    String v = System.getProperty(key);
    if (v != null) {
      return v;
    }
    if (config != null) {
      Object o = config.getValue(configKey);
      if (o != null) {
        return o.toString();
      }
    }
    return def;
  }

  /**
   * Get integer configuration value.
   * @param key system property and configuration key
   * @param def default value
   * @param config verticle configuration; may be null
   * @return value
   * @throws NumberFormatException if the value is not an integer
   */
  public static int getInteger(String key, int def, JsonObject config) {
    return Integer.parseInt(get(key, key, Integer.toString(def), config));
  }

  public static boolean getBoolean(String key, boolean def, JsonObject config) {
    return Boolean.parseBoolean(get(key, key, Boolean.toString(def), config));
  }
}
