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
import java.util.Set;
import java.util.TreeSet;

import org.bitingest.translator.TranslatorException;

import com.google.common.primitives.Longs;

/**
 * Helpers of the RocksDB based translators.
 *
 * @author Bastian Gloeckle
 */
class RocksDbUtil {
  /** Suffix of the store name holding identifier to value. */
  static final String ID_SUFFIX = "-id";

  /** Suffix of the store name holding value to identifier. */
  static final String VAL_SUFFIX = "-val";

  private RocksDbUtil() {
  }

  /**
   * @return 8 byte big-endian representation of the identifier, so the order of the keys in RocksDB is numerical.
   */
  static byte[] idToBytes(long id) {
    return Longs.toByteArray(id);
  }

  static long bytesToId(byte[] bytes) throws TranslatorException {
    if (bytes.length != Long.BYTES)
      throw new TranslatorException("Stored identifier has invalid length " + bytes.length);
    return Longs.fromByteArray(bytes);
  }

  /**
   * @throws IllegalArgumentException
   *           if the frame name cannot be used as part of a store name.
   */
  static void validateFrameName(String frame) throws IllegalArgumentException {
    if (frame == null || frame.isEmpty() || frame.contains("/") || frame.contains(File.separator)
        || frame.equals(".") || frame.equals(".."))
      throw new IllegalArgumentException("Invalid frame name '" + frame + "'");
  }

  /**
   * Finds the frames in a set of store names: a frame exists if there is both, a store for identifiers and one for
   * values.
   */
  static Set<String> framesOfStoreNames(Iterable<String> storeNames) {
    Set<String> names = new TreeSet<>();
    for (String name : storeNames)
      names.add(name);

    Set<String> res = new TreeSet<>();
    for (String name : names) {
      if (name.endsWith(ID_SUFFIX)) {
        String frame = name.substring(0, name.length() - ID_SUFFIX.length());
        if (!frame.isEmpty() && names.contains(frame + VAL_SUFFIX))
          res.add(frame);
      }
    }
    return res;
  }

  /**
   * Creates the directory if it does not exist.
   */
  static void ensureDirectory(File dir) throws TranslatorException {
    try {
      Files.createDirectories(dir.toPath());
    } catch (IOException e) {
      throw new TranslatorException("Could not create directory " + dir.getAbsolutePath(), e);
    }
  }
}
