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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A parsed record: A property graph node which has an optional subject and a set of named properties.
 * 
 * <p>
 * The value of each property is either a {@link Literal}, another {@link Entity} or a {@link List} of these (the
 * elements of a list are handled as a set of values of the property).
 *
 * @author Bastian Gloeckle
 */
public class Entity {
  private String subject;

  private Map<String, Object> properties = new LinkedHashMap<>();

  public Entity() {
  }

  public Entity(String subject) {
    this.subject = subject;
  }

  /**
   * @return The subject identifying the record or <code>null</code>.
   */
  public String getSubject() {
    return subject;
  }

  public void setSubject(String subject) {
    this.subject = subject;
  }

  /**
   * Set the value of a property.
   * 
   * @throws IllegalArgumentException
   *           if the value is not a {@link Literal}, {@link Entity} or a {@link List} of them.
   */
  public void put(String property, Object value) throws IllegalArgumentException {
    validate(value);
    properties.put(property, value);
  }

  public Object get(String property) {
    return properties.get(property);
  }

  public Object remove(String property) {
    return properties.remove(property);
  }

  /**
   * @return Unmodifiable view on the properties, in the order they were added.
   */
  public Map<String, Object> getProperties() {
    return Collections.unmodifiableMap(properties);
  }

  private void validate(Object value) {
    if (value instanceof Literal || value instanceof Entity)
      return;
    if (value instanceof List) {
      for (Object element : (List<?>) value)
        validate(element);
      return;
    }
    throw new IllegalArgumentException("Unsupported property value: " + value);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Entity))
      return false;
    Entity other = (Entity) obj;
    return Objects.equals(subject, other.subject) && properties.equals(other.properties);
  }

  @Override
  public int hashCode() {
    return Objects.hash(subject, properties);
  }

  @Override
  public String toString() {
    return "Entity[subject=" + subject + ",properties=" + properties + "]";
  }
}
