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

import org.bitingest.config.Config;
import org.bitingest.config.ConfigKey;
import org.bitingest.context.AutoInstatiate;
import org.bitingest.translator.lock.BucketValueLocker;
import org.bitingest.translator.memory.MapTranslator;
import org.bitingest.translator.rocksdb.BatchingRocksDbTranslator;
import org.bitingest.translator.rocksdb.RocksDbTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the {@link Translator} that is configured in {@link ConfigKey#TRANSLATOR_TYPE}.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class TranslatorFactory {
  private static final Logger logger = LoggerFactory.getLogger(TranslatorFactory.class);

  public static final String TYPE_MEMORY = "memory";
  public static final String TYPE_ROCKSDB = "rocksdb";
  public static final String TYPE_ROCKSDB_BATCHED = "rocksdb-batched";

  @Config(ConfigKey.TRANSLATOR_TYPE)
  private String type;

  @Config(ConfigKey.TRANSLATOR_DIR)
  private String dir;

  @Config(ConfigKey.TRANSLATOR_LOCK_BUCKETS)
  private int lockBuckets;

  @Config(ConfigKey.TRANSLATOR_BATCH_MAX_SIZE)
  private int batchMaxSize;

  @Config(ConfigKey.TRANSLATOR_BATCH_MAX_DELAY_MICROS)
  private long batchMaxDelayMicros;

  @Config(ConfigKey.TRANSLATOR_BULK_ADD_BATCH_SIZE)
  private int bulkAddBatchSize;

  /**
   * Creates a new translator. The caller is responsible for closing it.
   * 
   * @param frames
   *          The frames to create right away.
   * @throws TranslatorException
   *           if the translator cannot be created or the configured type is unknown.
   */
  public Translator createTranslator(String... frames) throws TranslatorException {
    logger.info("Creating translator of type '{}'", type);
    switch (type) {
    case TYPE_MEMORY:
      return new MapTranslator(frames);
    case TYPE_ROCKSDB:
      return new RocksDbTranslator(new File(dir), new BucketValueLocker(lockBuckets), bulkAddBatchSize, frames);
    case TYPE_ROCKSDB_BATCHED:
      return new BatchingRocksDbTranslator(new File(dir), batchMaxSize, batchMaxDelayMicros, bulkAddBatchSize, frames);
    default:
      throw new TranslatorException("Unknown translator type '" + type + "'. Available types: " + TYPE_MEMORY + ", "
          + TYPE_ROCKSDB + ", " + TYPE_ROCKSDB_BATCHED);
    }
  }

  /* package */ void setType(String type) {
    this.type = type;
  }

  /* package */ void setDir(String dir) {
    this.dir = dir;
  }
}
