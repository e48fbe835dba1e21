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
package org.bitingest.data;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;

import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;

/**
 * Encodes values that are translated to identifiers into byte arrays and back.
 * 
 * <p>
 * The first byte of an encoded value is a tag denoting its type, the remaining bytes are the payload. Numbers are
 * encoded big-endian. Two values are considered equal by the translators if and only if their encodings are equal.
 * 
 * <p>
 * Supported are {@link String}, <code>byte[]</code>, integral numbers (decoded as {@link Long}), floating point numbers
 * (decoded as {@link Double}), {@link Boolean}, {@link Instant} and {@link Literal}s of these.
 *
 * @author Bastian Gloeckle
 */
public class ValueCodec {
  private static final byte TAG_STRING = 1;
  private static final byte TAG_BYTES = 2;
  private static final byte TAG_LONG = 3;
  private static final byte TAG_DOUBLE = 4;
  private static final byte TAG_BOOLEAN = 5;
  private static final byte TAG_TIME = 6;

  private ValueCodec() {
  }

  /**
   * @throws IllegalArgumentException
   *           if the type of the value is not supported.
   */
  public static byte[] encode(Object value) throws IllegalArgumentException {
    Literal literal = Literal.ofObject(value);
    switch (literal.getType()) {
    case STRING:
      return tagged(TAG_STRING, ((String) literal.getValue()).getBytes(StandardCharsets.UTF_8));
    case BYTES:
      return tagged(TAG_BYTES, (byte[]) literal.getValue());
    case LONG:
      return tagged(TAG_LONG, Longs.toByteArray((Long) literal.getValue()));
    case DOUBLE:
      return tagged(TAG_DOUBLE, Longs.toByteArray(Double.doubleToLongBits((Double) literal.getValue())));
    case BOOLEAN:
      return new byte[] { TAG_BOOLEAN, (byte) (((Boolean) literal.getValue()) ? 1 : 0) };
    case TIME:
      Instant instant = (Instant) literal.getValue();
      byte[] res = new byte[1 + Long.BYTES + Integer.BYTES];
      res[0] = TAG_TIME;
      System.arraycopy(Longs.toByteArray(instant.getEpochSecond()), 0, res, 1, Long.BYTES);
      System.arraycopy(Ints.toByteArray(instant.getNano()), 0, res, 1 + Long.BYTES, Integer.BYTES);
      return res;
    }
    throw new IllegalArgumentException("Unsupported literal type " + literal.getType());
  }

  /**
   * @return The decoded value.
   * @throws IllegalArgumentException
   *           if the bytes are no valid encoding.
   */
  public static Object decode(byte[] bytes) throws IllegalArgumentException {
    if (bytes == null || bytes.length == 0)
      throw new IllegalArgumentException("Cannot decode empty value.");

    byte[] payload = Arrays.copyOfRange(bytes, 1, bytes.length);
    switch (bytes[0]) {
    case TAG_STRING:
      return new String(payload, StandardCharsets.UTF_8);
    case TAG_BYTES:
      return payload;
    case TAG_LONG:
      checkLength(payload, Long.BYTES);
      return Longs.fromByteArray(payload);
    case TAG_DOUBLE:
      checkLength(payload, Long.BYTES);
      return Double.longBitsToDouble(Longs.fromByteArray(payload));
    case TAG_BOOLEAN:
      checkLength(payload, 1);
      return payload[0] != 0;
    case TAG_TIME:
      checkLength(payload, Long.BYTES + Integer.BYTES);
      return Instant.ofEpochSecond(Longs.fromByteArray(payload),
          Ints.fromByteArray(Arrays.copyOfRange(payload, Long.BYTES, payload.length)));
    default:
      throw new IllegalArgumentException("Unknown value type tag " + bytes[0]);
    }
  }

  private static byte[] tagged(byte tag, byte[] payload) {
    byte[] res = new byte[payload.length + 1];
    res[0] = tag;
    System.arraycopy(payload, 0, res, 1, payload.length);
    return res;
  }

  private static void checkLength(byte[] payload, int expected) {
    if (payload.length != expected)
      throw new IllegalArgumentException("Expected " + expected + " bytes of payload, but got " + payload.length);
  }
}
