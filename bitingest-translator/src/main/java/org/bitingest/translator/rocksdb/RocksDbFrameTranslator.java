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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.bitingest.data.ValueCodec;
import org.bitingest.translator.FrameTranslator;
import org.bitingest.translator.TranslatorException;
import org.bitingest.translator.lock.ValueLocker;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FrameTranslator} of {@link RocksDbTranslator}, storing identifier to value in one RocksDB instance and value
 * to identifier in another one.
 * 
 * <p>
 * A new identifier is assigned while holding the lock of the value provided by the {@link ValueLocker}, so different
 * values can be assigned concurrently. Bulk adds exclude concurrent assignments in the same frame.
 *
 * @author Bastian Gloeckle
 */
public class RocksDbFrameTranslator implements FrameTranslator {
  private static final Logger logger = LoggerFactory.getLogger(RocksDbFrameTranslator.class);

  private final String frame;
  private final RocksDB idDb;
  private final RocksDB valDb;
  private final ValueLocker locker;
  private final int bulkAddBatchSize;

  private final AtomicLong nextId;

  /** Read lock held while assigning single identifiers, write lock held by bulk adds. */
  private final ReadWriteLock assignmentLock = new ReentrantReadWriteLock();

  /* package */ RocksDbFrameTranslator(String frame, RocksDB idDb, RocksDB valDb, ValueLocker locker,
      int bulkAddBatchSize) throws TranslatorException {
    this.frame = frame;
    this.idDb = idDb;
    this.valDb = valDb;
    this.locker = locker;
    this.bulkAddBatchSize = bulkAddBatchSize;
    this.nextId = new AtomicLong(findNextId());
    logger.debug("Opened frame '{}', next identifier is {}", frame, nextId.get());
  }

  private long findNextId() throws TranslatorException {
    try (RocksIterator it = idDb.newIterator()) {
      it.seekToLast();
      if (!it.isValid())
        return 0L;
      return RocksDbUtil.bytesToId(it.key()) + 1;
    }
  }

  @Override
  public Object get(long id) throws TranslatorException {
    byte[] value;
    try {
      value = idDb.get(RocksDbUtil.idToBytes(id));
    } catch (RocksDBException e) {
      throw new TranslatorException("Could not read identifier " + id + " of frame '" + frame + "'", e);
    }
    if (value == null)
      throw new TranslatorException("Identifier " + id + " was not assigned in frame '" + frame + "'");
    return ValueCodec.decode(value);
  }

  @Override
  public long getId(Object value) throws TranslatorException {
    byte[] key = ValueCodec.encode(value);

    Long res = lookup(key);
    if (res != null)
      return res;

    Lock sharedLock = assignmentLock.readLock();
    sharedLock.lock();
    try {
      Lock valueLock = locker.getLock(key);
      valueLock.lock();
      try {
        // someone might have added the value while we were waiting for the lock.
        res = lookup(key);
        if (res != null)
          return res;

        long id = nextId.getAndIncrement();
        byte[] idBytes = RocksDbUtil.idToBytes(id);
        try {
          idDb.put(idBytes, key);
        } catch (RocksDBException e) {
          releaseId(id);
          throw new TranslatorException("Could not store identifier " + id + " of frame '" + frame + "'", e);
        }
        try {
          valDb.put(key, idBytes);
        } catch (RocksDBException e) {
          TranslatorException failure =
              new TranslatorException("Could not store identifier " + id + " of frame '" + frame + "'", e);
          try {
            idDb.delete(idBytes);
          } catch (RocksDBException e2) {
            failure.addSuppressed(e2);
          }
          releaseId(id);
          throw failure;
        }
        return id;
      } finally {
        valueLock.unlock();
      }
    } finally {
      sharedLock.unlock();
    }
  }

  /**
   * Hands an identifier whose assignment failed back, if no other identifier was assigned in the meantime.
   */
  private void releaseId(long id) {
    if (!nextId.compareAndSet(id + 1, id))
      logger.warn("Identifier {} of frame '{}' stays unassigned after a failed write.", id, frame);
  }

  /* package */ void bulkAdd(List<?> values) throws TranslatorException {
    List<byte[]> keys = new ArrayList<>(values.size());
    for (Object value : values)
      keys.add(ValueCodec.encode(value));

    Lock exclusiveLock = assignmentLock.writeLock();
    exclusiveLock.lock();
    try {
      Set<ByteBuffer> seen = new HashSet<>();
      for (int i = 0; i < keys.size(); i++) {
        if (!seen.add(ByteBuffer.wrap(keys.get(i))))
          throw new TranslatorException("Value at index " + i + " is contained multiple times in the bulk.");
        if (lookup(keys.get(i)) != null)
          throw new TranslatorException("Value at index " + i + " has an identifier in frame '" + frame + "' already.");
      }

      long base = nextId.get();
      try (WriteOptions writeOptions = new WriteOptions()) {
        for (int batchStart = 0; batchStart < keys.size(); batchStart += bulkAddBatchSize) {
          int batchEnd = Math.min(keys.size(), batchStart + bulkAddBatchSize);
          try (WriteBatch idBatch = new WriteBatch(); WriteBatch valBatch = new WriteBatch()) {
            for (int i = batchStart; i < batchEnd; i++) {
              byte[] idBytes = RocksDbUtil.idToBytes(base + i);
              idBatch.put(idBytes, keys.get(i));
              valBatch.put(keys.get(i), idBytes);
            }
            idDb.write(writeOptions, idBatch);
            valDb.write(writeOptions, valBatch);
          } catch (RocksDBException e) {
            throw new TranslatorException("Could not store bulk of frame '" + frame + "'", e);
          }
          nextId.set(base + batchEnd);
          logger.trace("Stored bulk values {} to {} of frame '{}'", batchStart, batchEnd, frame);
        }
      }
    } finally {
      exclusiveLock.unlock();
    }
  }

  private Long lookup(byte[] key) throws TranslatorException {
    byte[] idBytes;
    try {
      idBytes = valDb.get(key);
    } catch (RocksDBException e) {
      throw new TranslatorException("Could not read value of frame '" + frame + "'", e);
    }
    if (idBytes == null)
      return null;
    return RocksDbUtil.bytesToId(idBytes);
  }

  /* package */ void close() throws IOException {
    IOException res = null;
    for (RocksDB db : new RocksDB[] { idDb, valDb }) {
      try {
        db.closeE();
      } catch (RocksDBException e) {
        if (res == null)
          res = new IOException("Could not close store of frame '" + frame + "'", e);
        else
          res.addSuppressed(e);
      }
    }
    if (res != null)
      throw res;
  }

  public String getFrame() {
    return frame;
  }

  /* package */ long getNextId() {
    return nextId.get();
  }
}
