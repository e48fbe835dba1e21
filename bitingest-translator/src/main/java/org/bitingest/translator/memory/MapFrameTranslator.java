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
package org.bitingest.translator.memory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.bitingest.data.ValueCodec;
import org.bitingest.translator.FrameTranslator;
import org.bitingest.translator.TranslatorException;

/**
 * In-memory {@link FrameTranslator}.
 * 
 * <p>
 * Identifiers are the indices into a list of values, the reverse mapping is a map keyed by the encoded value. Lookups of
 * existing values only need the read lock.
 *
 * @author Bastian Gloeckle
 */
public class MapFrameTranslator implements FrameTranslator {
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  private final Map<ByteBuffer, Long> ids = new HashMap<>();

  private final List<Object> values = new ArrayList<>();

  @Override
  public Object get(long id) throws TranslatorException {
    Lock readLock = lock.readLock();
    readLock.lock();
    try {
      if (id < 0 || id >= values.size())
        throw new TranslatorException("Identifier " + id + " was not assigned.");
      return values.get((int) id);
    } finally {
      readLock.unlock();
    }
  }

  @Override
  public long getId(Object value) {
    ByteBuffer key = ByteBuffer.wrap(ValueCodec.encode(value));

    Lock readLock = lock.readLock();
    readLock.lock();
    try {
      Long res = ids.get(key);
      if (res != null)
        return res;
    } finally {
      readLock.unlock();
    }

    Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      // someone might have added the value while we were waiting for the lock.
      Long res = ids.get(key);
      if (res != null)
        return res;

      long id = values.size();
      values.add(value);
      ids.put(key, id);
      return id;
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * @return Number of values known.
   */
  public int size() {
    Lock readLock = lock.readLock();
    readLock.lock();
    try {
      return values.size();
    } finally {
      readLock.unlock();
    }
  }
}
