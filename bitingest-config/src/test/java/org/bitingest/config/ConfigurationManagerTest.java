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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link ConfigurationManager}.
 *
 * @author Bastian Gloeckle
 */
public class ConfigurationManagerTest {
  @Test
  public void validKeysAreConfigKeyConstants() {
    Assert.assertTrue(ConfigurationManager.validKeys().contains(ConfigKey.TRANSLATOR_TYPE));
    Assert.assertTrue(ConfigurationManager.validKeys().contains(ConfigKey.PROXY_UPSTREAM));
  }

  @Test
  public void shippedDefaultsDefineExactlyTheValidKeys() throws IOException {
    // GIVEN
    Properties defaults = new Properties();
    try (InputStream is =
        ConfigurationManager.class.getResourceAsStream(ConfigurationManager.DEFAULT_CONFIG_CLASSPATH_FILENAME)) {
      defaults.load(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    // THEN
    Assert.assertEquals(defaults.stringPropertyNames(), ConfigurationManager.validKeys(),
        "Expected default configuration to define every key");
  }
}
