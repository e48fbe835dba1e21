/**
 * bitingest: Bitmap Index Ingestion.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of bitingest.
 *
 * bitingest is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.bitingest.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

import javax.annotation.PostConstruct;

import org.bitingest.context.AutoInstatiate;
import org.bitingest.context.Profiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;

/**
 * Provides the active configuration values, which are taken from an optional user supplied properties file and fall
 * back to the defaults on the classpath.
 * 
 * <p>
 * Both files may only contain keys defined in {@link ConfigKey}, and the defaults have to define every one of them.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
@Profile(Profiles.CONFIG)
public class ConfigurationManager {
  private static final Logger logger = LoggerFactory.getLogger(ConfigurationManager.class);

  public static final String TEST_CONFIG_CLASSPATH_FILENAME = "/bitingest-test.properties";

  public static final String DEFAULT_CONFIG_CLASSPATH_FILENAME = "/bitingest.properties";

  public static final String CUSTOM_PROPERTIES_SYSTEM_PROPERTY = "bitingest.properties";

  private Properties defaultProperties;
  private Properties customProperties;

  @PostConstruct
  public void initialize() {
    Set<String> validKeys = validKeys();

    defaultProperties = loadDefaults();
    Set<String> missing = new TreeSet<>(validKeys);
    missing.removeAll(defaultProperties.stringPropertyNames());
    if (!missing.isEmpty())
      throw new IllegalStateException("Default configuration lacks values for " + missing);
    checkKeys(defaultProperties, validKeys, "default configuration");

    String customFileName = System.getProperty(CUSTOM_PROPERTIES_SYSTEM_PROPERTY);
    if (customFileName == null) {
      customProperties = new Properties();
      logger.info("No custom configuration. Set system property '{}' to a properties file to change values.",
          CUSTOM_PROPERTIES_SYSTEM_PROPERTY);
      return;
    }
    try (InputStream is = new FileInputStream(customFileName)) {
      customProperties = load(is);
    } catch (IOException e) {
      throw new IllegalStateException("Could not load custom configuration from " + customFileName, e);
    }
    checkKeys(customProperties, validKeys, customFileName);
    logger.info("Loaded custom configuration from {}: {}", customFileName,
        new TreeSet<>(customProperties.stringPropertyNames()));
  }

  private Properties loadDefaults() {
    String classpathFile = TEST_CONFIG_CLASSPATH_FILENAME;
    InputStream classpathStream = getClass().getResourceAsStream(classpathFile);
    if (classpathStream == null) {
      classpathFile = DEFAULT_CONFIG_CLASSPATH_FILENAME;
      classpathStream = getClass().getResourceAsStream(classpathFile);
    }
    if (classpathStream == null)
      throw new IllegalStateException("Could not find default configuration " + DEFAULT_CONFIG_CLASSPATH_FILENAME);

    logger.debug("Loading default configuration from {}", classpathFile);
    try (InputStream is = classpathStream) {
      return load(is);
    } catch (IOException e) {
      throw new IllegalStateException("Could not load default configuration from " + classpathFile, e);
    }
  }

  private Properties load(InputStream is) throws IOException {
    Properties res = new Properties();
    res.load(new InputStreamReader(is, StandardCharsets.UTF_8));
    return res;
  }

  private void checkKeys(Properties properties, Set<String> validKeys, String source) {
    Set<String> unknown = new TreeSet<>(properties.stringPropertyNames());
    unknown.removeAll(validKeys);
    if (!unknown.isEmpty())
      throw new IllegalStateException("Unknown configuration keys in " + source + ": " + unknown);
  }

  /**
   * @return The values of all constants in {@link ConfigKey}.
   */
  /* package */ static Set<String> validKeys() {
    Set<String> res = new TreeSet<>();
    for (Field field : ConfigKey.class.getFields()) {
      if (Modifier.isStatic(field.getModifiers()) && field.getType().equals(String.class)) {
        try {
          res.add((String) field.get(null));
        } catch (IllegalAccessException e) {
          throw new IllegalStateException("Could not read config key " + field.getName(), e);
        }
      }
    }
    return res;
  }

  /**
   * @return The value of the given config key (see {@link ConfigKey}), either the one provided by the user or the
   *         default one.
   */
  public String getValue(String configKey) {
    return customProperties.getProperty(configKey, getDefaultValue(configKey));
  }

  /**
   * @return The default value for the given config key.
   */
  public String getDefaultValue(String configKey) {
    return defaultProperties.getProperty(configKey);
  }
}
