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
import java.util.Objects;

/**
 * A single value of an {@link Entity}, that is a leaf of the property graph of a record.
 * 
 * <p>
 * Integral numbers are normalized to {@link Long}, floating point numbers to {@link Double}.
 *
 * @author Bastian Gloeckle
 */
public final class Literal {
  public enum Type {
    STRING, BYTES, LONG, DOUBLE, BOOLEAN, TIME
  }

  private final Type type;
  private final Object value;

  private Literal(Type type, Object value) {
    this.type = type;
    this.value = value;
  }

  public static Literal of(String value) {
    return new Literal(Type.STRING, Objects.requireNonNull(value));
  }

  public static Literal of(long value) {
    return new Literal(Type.LONG, value);
  }

  public static Literal of(double value) {
    return new Literal(Type.DOUBLE, value);
  }

  public static Literal of(boolean value) {
    return new Literal(Type.BOOLEAN, value);
  }

  public static Literal of(Instant value) {
    return new Literal(Type.TIME, Objects.requireNonNull(value));
  }

  public static Literal of(byte[] value) {
    return new Literal(Type.BYTES, Objects.requireNonNull(value));
  }

  /**
   * Creates a literal from any supported java value.
   * 
   * @throws IllegalArgumentException
   *           if the type of the value is not supported.
   */
  public static Literal ofObject(Object value) throws IllegalArgumentException {
    if (value instanceof Literal)
      return (Literal) value;
    if (value instanceof String)
      return of((String) value);
    if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte)
      return of(((Number) value).longValue());
    if (value instanceof Double || value instanceof Float)
      return of(((Number) value).doubleValue());
    if (value instanceof Boolean)
      return of((boolean) (Boolean) value);
    if (value instanceof Instant)
      return of((Instant) value);
    if (value instanceof byte[])
      return of((byte[]) value);
    throw new IllegalArgumentException(
        "Cannot create literal from value of type " + (value == null ? "null" : value.getClass().getName()));
  }

  public Type getType() {
    return type;
  }

  public Object getValue() {
    return value;
  }

  public boolean isNumeric() {
    return type == Type.LONG || type == Type.DOUBLE;
  }

  /**
   * @return The numeric value, floating point values are truncated.
   * @throws IllegalStateException
   *           if this literal is not numeric.
   */
  public long longValue() throws IllegalStateException {
    if (!isNumeric())
      throw new IllegalStateException("Literal of type " + type + " is not numeric.");
    return ((Number) value).longValue();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Literal))
      return false;
    Literal other = (Literal) obj;
    if (type != other.type)
      return false;
    if (type == Type.BYTES)
      return Arrays.equals((byte[]) value, (byte[]) other.value);
    return value.equals(other.value);
  }

  @Override
  public int hashCode() {
    if (type == Type.BYTES)
      return 31 * type.hashCode() + Arrays.hashCode((byte[]) value);
    return 31 * type.hashCode() + value.hashCode();
  }

  @Override
  public String toString() {
    if (type == Type.BYTES)
      return type + ":" + Arrays.toString((byte[]) value);
    return type + ":" + value;
  }
}
