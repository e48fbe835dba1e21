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
package org.bitingest.ingest.map;

import java.util.Objects;

/**
 * A field in a frame.
 *
 * @author Bastian Gloeckle
 */
public class FrameAndField {
  private final String frame;
  private final String field;

  public FrameAndField(String frame, String field) {
    this.frame = frame;
    this.field = field;
  }

  public String getFrame() {
    return frame;
  }

  public String getField() {
    return field;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof FrameAndField))
      return false;
    FrameAndField other = (FrameAndField) obj;
    return frame.equals(other.frame) && field.equals(other.field);
  }

  @Override
  public int hashCode() {
    return Objects.hash(frame, field);
  }

  @Override
  public String toString() {
    return frame + "." + field;
  }
}
