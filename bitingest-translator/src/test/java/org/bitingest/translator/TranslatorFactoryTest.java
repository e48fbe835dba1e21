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
package org.bitingest.translator;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

import org.bitingest.context.Profiles;
import org.bitingest.translator.memory.MapTranslator;
import org.bitingest.translator.rocksdb.BatchingRocksDbTranslator;
import org.bitingest.translator.rocksdb.RocksDbTranslator;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

/**
 * Tests {@link TranslatorFactory}.
 *
 * @author Bastian Gloeckle
 */
public class TranslatorFactoryTest {
  private AnnotationConfigApplicationContext dataContext;

  private TranslatorFactory factory;

  private File dir;

  @BeforeMethod
  public void before() throws IOException {
    dataContext = new AnnotationConfigApplicationContext();
    dataContext.getEnvironment().setActiveProfiles(Profiles.UNIT_TEST);
    dataContext.scan("org.bitingest.config", "org.bitingest.translator");
    dataContext.refresh();

    factory = dataContext.getBean(TranslatorFactory.class);
    dir = Files.createTempDirectory("bitingest-factory").toFile();
    factory.setDir(dir.getAbsolutePath());
  }

  @AfterMethod
  public void after() throws IOException {
    dataContext.close();
    MoreFiles.deleteRecursively(dir.toPath(), RecursiveDeleteOption.ALLOW_INSECURE);
  }

  @Test
  public void configuredTypeCreated() throws Exception {
    // WHEN
    try (Translator translator = factory.createTranslator("a")) {
      // THEN
      Assert.assertTrue(translator instanceof MapTranslator, "Expected type from test config");
      Assert.assertTrue(translator.getFrames().contains("a"), "Expected frame to be created");
    }
  }

  @Test
  public void rocksDbTypesCreated() throws Exception {
    // GIVEN
    factory.setType(TranslatorFactory.TYPE_ROCKSDB);

    // WHEN
    try (Translator translator = factory.createTranslator()) {
      // THEN
      Assert.assertTrue(translator instanceof RocksDbTranslator, "Expected rocksdb translator");
    }

    // GIVEN
    factory.setType(TranslatorFactory.TYPE_ROCKSDB_BATCHED);
    factory.setDir(new File(dir, "batched").getAbsolutePath());

    // WHEN
    try (Translator translator = factory.createTranslator()) {
      // THEN
      Assert.assertTrue(translator instanceof BatchingRocksDbTranslator, "Expected batching rocksdb translator");
    }
  }

  @Test(expectedExceptions = TranslatorException.class)
  public void unknownTypeFails() throws TranslatorException {
    factory.setType("unknown");
    factory.createTranslator();
  }
}
