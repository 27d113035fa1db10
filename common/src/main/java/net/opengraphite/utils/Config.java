// This file is part of OpenGraphite.
// Copyright (C) 2024  The OpenGraphite Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.opengraphite.utils;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;

/**
 * Properties based configuration for the query engine. Values are loaded 
 * from a Java properties file, either given explicitly or found in one of 
 * the default locations, and any key left unset receives a default.
 * <p>
 * Values read on the hot path are parsed once into fields, so call 
 * {@link #overrideConfig(String, String)} instead of writing the map.
 * 
 * @since 1.0
 */
public class Config {
  private static final Logger LOG = LoggerFactory.getLogger(Config.class);

  public static final String CACHE_ENABLE_KEY = "og.query.cache.enable";
  public static final String CACHE_EXPIRATION_KEY = "og.query.cache.expiration";
  public static final String CACHE_OBJECTS_LIMIT_KEY = 
      "og.query.cache.limit.objects";
  public static final String CACHE_SIZE_LIMIT_KEY = "og.query.cache.limit.size";
  public static final String CACHE_SWEEP_INTERVAL_KEY = 
      "og.query.cache.sweep_interval";
  public static final String CACHE_WAIT_TIMEOUT_KEY = 
      "og.query.cache.wait_timeout";
  public static final String FETCH_TIMEOUT_KEY = "og.query.fetch.timeout";
  public static final String X_FILES_FACTOR_KEY = 
      "og.expression.default_x_files_factor";
  
  /** Whether or not the query cache is enabled. */
  private boolean enable_cache = true;
  
  /** How long to wait on a computer in ms. */
  private long cache_wait_timeout;
  
  /** How long to wait on fetches in ms. */
  private long fetch_timeout;
  
  /** The properties. */
  protected final Map<String, String> properties = 
      new ConcurrentHashMap<String, String>();

  /** Defaults for every key. */
  protected static final Map<String, String> default_map = 
      ImmutableMap.<String, String>builder()
        .put(CACHE_ENABLE_KEY, "true")
        .put(CACHE_EXPIRATION_KEY, "60")
        .put(CACHE_OBJECTS_LIMIT_KEY, "4096")
        .put(CACHE_SIZE_LIMIT_KEY, "104857600")
        .put(CACHE_SWEEP_INTERVAL_KEY, "10000")
        .put(CACHE_WAIT_TIMEOUT_KEY, "30000")
        .put(FETCH_TIMEOUT_KEY, "60000")
        .put(X_FILES_FACTOR_KEY, "0")
        .build();

  /** The file the config came from, may be null. */
  protected String config_location;

  /**
   * Ctor that initializes default values and optionally searches the default
   * locations for a config file.
   * @param auto_load_config Whether or not to search the default locations.
   * @throws IOException Thrown if a config file was found but couldn't be 
   * read.
   */
  public Config(final boolean auto_load_config) throws IOException {
    if (auto_load_config) {
      loadConfig();
    }
    setDefaults();
  }

  /**
   * Ctor that loads the given properties file.
   * @param file Path to the file to load.
   * @throws IOException Thrown if unable to read or parse the file.
   */
  public Config(final String file) throws IOException {
    loadConfig(file);
    setDefaults();
  }
  
  /**
   * Ctor that loads properties from a stream, e.g. a class path resource.
   * The stream is not closed.
   * @param stream A non-null stream.
   * @throws IOException Thrown if unable to read or parse the stream.
   */
  public Config(final InputStream stream) throws IOException {
    final Properties props = new Properties();
    props.load(stream);
    loadHashMap(props);
    setDefaults();
  }

  /** Creates a config with the defaults only. */
  public Config() {
    setDefaults();
  }
  
  /** @return The file that generated this config. May be null. */
  public String configLocation() {
    return config_location;
  }
  
  /** @return Whether or not the query cache is enabled. */
  public boolean enableCache() {
    return enable_cache;
  }
  
  /** @return How long a cache waiter blocks in ms. */
  public long cacheWaitTimeout() {
    return cache_wait_timeout;
  }
  
  /** @return How long to wait on the fetch collaborator in ms. */
  public long fetchTimeout() {
    return fetch_timeout;
  }

  /**
   * Sets or overwrites a property and reloads the parsed fields.
   * @param property The name of the property to override.
   * @param value The value to store.
   */
  public void overrideConfig(final String property, final String value) {
    properties.put(property, value);
    loadStaticVariables();
  }

  /**
   * @param property The property to load.
   * @return The value or null if the property did not exist.
   */
  public final String getString(final String property) {
    return properties.get(property);
  }

  /**
   * @param property The property to load.
   * @return The parsed integer.
   * @throws NumberFormatException if the property could not be parsed or 
   * did not exist.
   */
  public final int getInt(final String property) {
    return Integer.parseInt(sanitize(properties.get(property)));
  }

  /**
   * @param property The property to load.
   * @return The parsed long.
   * @throws NumberFormatException if the property could not be parsed or 
   * did not exist.
   */
  public final long getLong(final String property) {
    return Long.parseLong(sanitize(properties.get(property)));
  }

  /**
   * @param property The property to load.
   * @return The parsed float.
   * @throws NumberFormatException if the property could not be parsed.
   * @throws NullPointerException if the property did not exist.
   */
  public final float getFloat(final String property) {
    return Float.parseFloat(sanitize(properties.get(property)));
  }

  /**
   * @param property The property to load.
   * @return The parsed double.
   * @throws NumberFormatException if the property could not be parsed.
   * @throws NullPointerException if the property did not exist.
   */
  public final double getDouble(final String property) {
    return Double.parseDouble(sanitize(properties.get(property)));
  }

  /**
   * Returns the given property as a boolean. "1", "true" and "yes" in any 
   * case are true, anything else is false.
   * @param property The property to load.
   * @return The parsed boolean.
   * @throws NullPointerException if the property was not found.
   */
  public final boolean getBoolean(final String property) {
    final String val = properties.get(property).trim().toUpperCase();
    return val.equals("1") || val.equals("TRUE") || val.equals("YES");
  }

  /**
   * @param property The property to search for.
   * @return True if the property exists and is not an empty string.
   */
  public final boolean hasProperty(final String property) {
    final String val = properties.get(property);
    return val != null && !val.isEmpty();
  }

  /**
   * Returns a simple string with the configured properties for debugging.
   * Values of keys containing "PASS" are masked.
   * @return A string with information about the config.
   */
  public final String dumpConfiguration() {
    if (properties.isEmpty()) {
      return "No configuration settings stored";
    }

    final StringBuilder response = 
        new StringBuilder("OpenGraphite Configuration:\n");
    response.append("File [" + config_location + "]\n");
    int line = 0;
    for (final Map.Entry<String, String> entry : 
        new TreeMap<String, String>(properties).entrySet()) {
      if (line > 0) {
        response.append("\n");
      }
      response.append("Key [" + entry.getKey() + "]  Value [");
      if (entry.getKey().toUpperCase().contains("PASS")) {
        response.append("********");
      } else {
        response.append(entry.getValue());
      }
      response.append("]");
      line++;
    }
    return response.toString();
  }

  /** @return An immutable copy of the configuration map. */
  public final Map<String, String> getMap() {
    return ImmutableMap.copyOf(properties);
  }

  /** Fills in any key missing from the properties with its default. */
  protected void setDefaults() {
    for (final Map.Entry<String, String> entry : default_map.entrySet()) {
      if (!properties.containsKey(entry.getKey())) {
        properties.put(entry.getKey(), entry.getValue());
      }
    }
    loadStaticVariables();
  }

  /**
   * Searches the default locations for an opengraphite.conf file. Missing 
   * files are skipped and the defaults are used if none is found.
   * @throws IOException Thrown if there was an issue reading a file.
   */
  protected void loadConfig() throws IOException {
    if (config_location != null && !config_location.isEmpty()) {
      loadConfig(config_location);
      return;
    }

    final List<String> file_locations = new ArrayList<String>();
    file_locations.add("opengraphite.conf");
    file_locations.add("/etc/opengraphite.conf");
    file_locations.add("/etc/opengraphite/opengraphite.conf");
    file_locations.add("/opt/opengraphite/opengraphite.conf");

    for (final String file : file_locations) {
      try {
        loadConfig(file);
        return;
      } catch (FileNotFoundException e) {
        LOG.debug("Unable to find " + file, e);
      }
    }
    LOG.info("No configuration found, will use defaults");
  }

  /**
   * Loads the configuration from the given location.
   * @param file Path to the file to load.
   * @throws IOException Thrown if there was an issue reading the file.
   * @throws FileNotFoundException Thrown if the config file was not found.
   */
  protected void loadConfig(final String file) throws FileNotFoundException,
      IOException {
    final FileInputStream file_stream = new FileInputStream(file);
    try {
      final Properties props = new Properties();
      props.load(file_stream);
      loadHashMap(props);
      LOG.info("Successfully loaded configuration file: " + file);
      config_location = file;
    } finally {
      file_stream.close();
    }
  }

  /**
   * Parses the values read often into fields. Called whenever the 
   * configuration changes.
   */
  public void loadStaticVariables() {
    enable_cache = getBoolean(CACHE_ENABLE_KEY);
    cache_wait_timeout = getLong(CACHE_WAIT_TIMEOUT_KEY);
    fetch_timeout = getLong(FETCH_TIMEOUT_KEY);
  }
  
  private String sanitize(final String string) {
    if (string == null) {
      return null;
    }
    return string.trim();
  }
  
  /**
   * Copies the properties into the map.
   * @param props The loaded properties.
   */
  private void loadHashMap(final Properties props) {
    properties.clear();
    @SuppressWarnings("rawtypes")
    final Enumeration e = props.propertyNames();
    while (e.hasMoreElements()) {
      final String key = (String) e.nextElement();
      properties.put(key, props.getProperty(key));
    }
  }
}
