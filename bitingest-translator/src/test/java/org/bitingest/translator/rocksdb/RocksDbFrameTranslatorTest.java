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
package org.bitingest.translator.rocksdb;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

import org.bitingest.translator.TranslatorException;
import org.bitingest.translator.lock.SingleValueLocker;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

/**
 * Tests {@link RocksDbFrameTranslator} when its stores fail.
 *
 * @author Bastian Gloeckle
 */
public class RocksDbFrameTranslatorTest {
  static {
    RocksDB.loadLibrary();
  }

  private File dir;
  private Options options;
  private RocksDB idDb;
  private RocksDB valDb;

  @BeforeMethod
  public void before() throws IOException, RocksDBException {
    dir = Files.createTempDirectory("bitingest-frame").toFile();
    options = new Options().setCreateIfMissing(true);
    idDb = RocksDB.open(options, new File(dir, "id").getAbsolutePath());
    String valPath = new File(dir, "val").getAbsolutePath();
    RocksDB.open(options, valPath).close();
    // writes to the value store fail.
    valDb = RocksDB.openReadOnly(options, valPath);
  }

  @AfterMethod
  public void after() throws IOException {
    idDb.close();
    valDb.close();
    options.close();
    MoreFiles.deleteRecursively(dir.toPath(), RecursiveDeleteOption.ALLOW_INSECURE);
  }

  @Test
  public void failedWriteLeavesNoOrphanAndNoHole() throws TranslatorException, RocksDBException {
    // GIVEN
    RocksDbFrameTranslator translator = new RocksDbFrameTranslator("f", idDb, valDb, new SingleValueLocker(), 10);

    // WHEN
    try {
      translator.getId("red");
      Assert.fail("Expected write to fail");
    } catch (TranslatorException e) {
      // expected
    }

    // THEN
    Assert.assertNull(idDb.get(RocksDbUtil.idToBytes(0L)), "Expected forward entry to be removed");
    Assert.assertEquals(translator.getNextId(), 0L, "Expected identifier to be handed back");
  }
}
