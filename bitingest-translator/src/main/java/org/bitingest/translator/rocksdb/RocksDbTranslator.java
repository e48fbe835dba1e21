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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.bitingest.translator.BulkAddingTranslator;
import org.bitingest.translator.Translator;
import org.bitingest.translator.TranslatorException;
import org.bitingest.translator.UnknownFrameException;
import org.bitingest.translator.lock.ValueLocker;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persistent {@link Translator} that stores each frame in two RocksDB databases inside a directory:
 * <code>&lt;frame&gt;-id</code> maps identifiers to values and <code>&lt;frame&gt;-val</code> maps values to
 * identifiers. Identifiers are stored as 8 byte big-endian values.
 * 
 * <p>
 * When opening a directory that contains data already, all frames found in it are opened and their identifier
 * sequences continue after the highest identifier stored.
 *
 * @author Bastian Gloeckle
 */
public class RocksDbTranslator implements BulkAddingTranslator {
  private static final Logger logger = LoggerFactory.getLogger(RocksDbTranslator.class);

  static {
    RocksDB.loadLibrary();
  }

  private final File dir;
  private final ValueLocker locker;
  private final int bulkAddBatchSize;
  private final Options options;

  private final Map<String, RocksDbFrameTranslator> frames = new ConcurrentHashMap<>();

  private final Object frameCreationSync = new Object();

  /**
   * @param dir
   *          Directory to store the data in, will be created if it does not exist.
   * @param locker
   *          Provides the locks to be held when assigning new identifiers.
   * @param bulkAddBatchSize
   *          Number of values written at once on {@link #bulkAdd(String, List)}.
   * @param frames
   *          Frames to open in addition to the ones found in the directory.
   * @throws TranslatorException
   *           if the data cannot be opened.
   */
  public RocksDbTranslator(File dir, ValueLocker locker, int bulkAddBatchSize, String... frames)
      throws TranslatorException {
    this.dir = dir;
    this.locker = locker;
    this.bulkAddBatchSize = bulkAddBatchSize;

    RocksDbUtil.ensureDirectory(dir);
    options = new Options().setCreateIfMissing(true);

    try {
      List<String> storeNames = new ArrayList<>();
      File[] children = dir.listFiles(File::isDirectory);
      if (children != null)
        for (File child : children)
          storeNames.add(child.getName());

      for (String frame : RocksDbUtil.framesOfStoreNames(storeNames))
        getFrameTranslator(frame);
      for (String frame : frames)
        getFrameTranslator(frame);
    } catch (TranslatorException | RuntimeException e) {
      try {
        close();
      } catch (IOException e2) {
        e.addSuppressed(e2);
      }
      throw e;
    }

    logger.info("Opened translator at {} with frames {}", dir.getAbsolutePath(), this.frames.keySet());
  }

  @Override
  public Object get(String frame, long id) throws TranslatorException, UnknownFrameException {
    RocksDbFrameTranslator frameTranslator = frames.get(frame);
    if (frameTranslator == null)
      throw new UnknownFrameException(frame);
    return frameTranslator.get(id);
  }

  @Override
  public long getId(String frame, Object value) throws TranslatorException {
    return getFrameTranslator(frame).getId(value);
  }

  @Override
  public void bulkAdd(String frame, List<?> values) throws TranslatorException {
    getFrameTranslator(frame).bulkAdd(values);
  }

  /**
   * @return The translator of the given frame, which is created if it does not exist.
   */
  public RocksDbFrameTranslator getFrameTranslator(String frame) throws TranslatorException {
    RocksDbFrameTranslator res = frames.get(frame);
    if (res != null)
      return res;

    synchronized (frameCreationSync) {
      res = frames.get(frame);
      if (res != null)
        return res;

      RocksDbUtil.validateFrameName(frame);
      RocksDB idDb = open(new File(dir, frame + RocksDbUtil.ID_SUFFIX));
      RocksDB valDb;
      try {
        valDb = open(new File(dir, frame + RocksDbUtil.VAL_SUFFIX));
      } catch (TranslatorException e) {
        idDb.close();
        throw e;
      }
      try {
        res = new RocksDbFrameTranslator(frame, idDb, valDb, locker, bulkAddBatchSize);
      } catch (TranslatorException e) {
        idDb.close();
        valDb.close();
        throw e;
      }
      frames.put(frame, res);
      return res;
    }
  }

  private RocksDB open(File path) throws TranslatorException {
    try {
      return RocksDB.open(options, path.getAbsolutePath());
    } catch (RocksDBException e) {
      throw new TranslatorException("Could not open RocksDB at " + path.getAbsolutePath(), e);
    }
  }

  @Override
  public Set<String> getFrames() {
    return Collections.unmodifiableSet(frames.keySet());
  }

  @Override
  public void close() throws IOException {
    IOException res = null;
    synchronized (frameCreationSync) {
      for (RocksDbFrameTranslator frameTranslator : frames.values()) {
        try {
          frameTranslator.close();
        } catch (IOException e) {
          if (res == null)
            res = e;
          else
            res.addSuppressed(e);
        }
      }
      frames.clear();
      options.close();
    }
    logger.info("Closed translator at {}", dir.getAbsolutePath());
    if (res != null)
      throw res;
  }
}
