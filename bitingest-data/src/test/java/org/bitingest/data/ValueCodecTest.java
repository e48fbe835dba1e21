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

import java.time.Instant;
import java.util.Arrays;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link ValueCodec}.
 *
 * @author Bastian Gloeckle
 */
public class ValueCodecTest {
  @Test
  public void integralNumbersNormalized() {
    // WHEN
    byte[] fromInt = ValueCodec.encode(5);
    byte[] fromLong = ValueCodec.encode(5L);

    // THEN
    Assert.assertEquals(fromInt, fromLong, "Expected int and long of same value to have same encoding");
    Assert.assertEquals(ValueCodec.decode(fromInt), 5L, "Expected integral values to be decoded as Long");
  }

  @Test
  public void typesDistinguished() {
    // WHEN
    byte[] string = ValueCodec.encode("1");
    byte[] number = ValueCodec.encode(1L);
    byte[] bytes = ValueCodec.encode("1".getBytes());

    // THEN
    Assert.assertFalse(Arrays.equals(string, number), "Expected string and number to have different encodings");
    Assert.assertFalse(Arrays.equals(string, bytes), "Expected string and byte array to have different encodings");
  }

  @Test
  public void literalEncodedLikeItsValue() {
    Assert.assertEquals(ValueCodec.encode(Literal.of("red")), ValueCodec.encode("red"),
        "Expected literal to be encoded like its value");
  }

  @Test
  public void timeDecoded() {
    // GIVEN
    Instant instant = Instant.ofEpochSecond(1500000000L, 42);

    // WHEN
    Object decoded = ValueCodec.decode(ValueCodec.encode(instant));

    // THEN
    Assert.assertEquals(decoded, instant, "Expected instant to be restored");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void unsupportedTypeRejected() {
    ValueCodec.encode(new Object());
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void unknownTagRejected() {
    ValueCodec.decode(new byte[] { 99, 1, 2 });
  }
}
