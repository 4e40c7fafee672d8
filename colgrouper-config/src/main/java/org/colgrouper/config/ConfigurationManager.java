/**
 * colgrouper: Column Grouping.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of colgrouper.
 *
 * colgrouper is free software: you can redistribute it and/or modify
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
package org.colgrouper.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import javax.annotation.PostConstruct;

import org.colgrouper.context.AutoInstatiate;
import org.colgrouper.context.Profiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;

/**
 * Provides the active configuration values of colgrouper.
 *
 * <p>
 * Values are looked up in three layers, the first one that has a value for a key wins:
 *
 * <ol>
 * <li>A user supplied file, whose path is given in the system property {@link #CUSTOM_PROPERTIES_SYSTEM_PROPERTY}.
 * <li>{@link #TEST_CONFIG_CLASSPATH_FILENAME} on the classpath, if available. Tests use this to adjust single values.
 * <li>{@link #DEFAULT_CONFIG_CLASSPATH_FILENAME} on the classpath, which holds a default value for each
 * {@link ConfigKey}.
 * </ol>
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
@Profile(Profiles.CONFIG)
public class ConfigurationManager {
  private static final Logger logger = LoggerFactory.getLogger(ConfigurationManager.class);

  public static final String TEST_CONFIG_CLASSPATH_FILENAME = "/colgrouper-test.properties";

  public static final String DEFAULT_CONFIG_CLASSPATH_FILENAME = "/colgrouper.properties";

  public static final String CUSTOM_PROPERTIES_SYSTEM_PROPERTY = "colgrouper.properties";

  /** Values from the classpath files, test values overlaying the defaults. */
  private Properties defaultProperties;
  /** Values from the user supplied file, <code>null</code> if there is none. */
  private Properties customProperties;

  @PostConstruct
  private void initialize() {
    defaultProperties = new Properties();
    if (!loadClasspathFile(DEFAULT_CONFIG_CLASSPATH_FILENAME, defaultProperties))
      throw new RuntimeException("Could not find default config " + DEFAULT_CONFIG_CLASSPATH_FILENAME);
    loadClasspathFile(TEST_CONFIG_CLASSPATH_FILENAME, defaultProperties);

    String customFileName = System.getProperty(CUSTOM_PROPERTIES_SYSTEM_PROPERTY);
    if (customFileName == null) {
      customProperties = null;
      logger.info(
          "Did not load custom properties. Use system property '{}' to point to a file containing custom properties.",
          CUSTOM_PROPERTIES_SYSTEM_PROPERTY);
      return;
    }

    customProperties = new Properties();
    try (Reader reader = new InputStreamReader(new FileInputStream(customFileName), StandardCharsets.UTF_8)) {
      customProperties.load(reader);
    } catch (IOException e) {
      throw new RuntimeException("Could not load custom properties from " + customFileName, e);
    }
    logger.info("Loaded custom properties from {}", customFileName);

    for (String key : customProperties.stringPropertyNames())
      if (!ConfigKey.ALL_KEYS.contains(key))
        logger.warn("Custom properties in {} contain unknown key '{}'.", customFileName, key);
  }

  /**
   * Loads the given classpath file into the given properties, overwriting values that are contained in the file.
   *
   * @return false if the file is not available.
   */
  private boolean loadClasspathFile(String classpathFile, Properties target) {
    InputStream classpathStream = this.getClass().getResourceAsStream(classpathFile);
    if (classpathStream == null)
      return false;

    logger.info("Loading config from classpath {}", classpathFile);
    try (Reader reader = new InputStreamReader(classpathStream, StandardCharsets.UTF_8)) {
      target.load(reader);
    } catch (IOException e) {
      throw new RuntimeException("Could not load config from classpath " + classpathFile, e);
    }
    return true;
  }

  /**
   * @return The value of the given config key (see {@link ConfigKey}), either the one provided by the user or the
   *         default one. <code>null</code> if the key is unknown.
   */
  public String getValue(String configKey) {
    if (customProperties != null && customProperties.getProperty(configKey) != null)
      return customProperties.getProperty(configKey);

    return getDefaultValue(configKey);
  }

  /**
   * @return The value of the given config key that is used if the user does not supply one.
   */
  public String getDefaultValue(String configKey) {
    return defaultProperties.getProperty(configKey);
  }
}
