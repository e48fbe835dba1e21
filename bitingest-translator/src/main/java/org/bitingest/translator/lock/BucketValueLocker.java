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
package org.bitingest.translator.lock;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * {@link ValueLocker} that stripes values across a fixed number of locks based on the hash of the value.
 *
 * @author Bastian Gloeckle
 */
public class BucketValueLocker implements ValueLocker {
  public static final int DEFAULT_BUCKETS = 1000;

  private static final HashFunction HASH = Hashing.murmur3_32_fixed();

  private final Lock[] locks;

  public BucketValueLocker() {
    this(DEFAULT_BUCKETS);
  }

  public BucketValueLocker(int buckets) {
    if (buckets < 1)
      throw new IllegalArgumentException("Need at least one bucket, but got " + buckets);
    locks = new Lock[buckets];
    for (int i = 0; i < buckets; i++)
      locks[i] = new ReentrantLock();
  }

  @Override
  public Lock getLock(byte[] encodedValue) {
    return locks[bucket(encodedValue)];
  }

  int bucket(byte[] encodedValue) {
    return Math.floorMod(HASH.hashBytes(encodedValue).asInt(), locks.length);
  }
}
