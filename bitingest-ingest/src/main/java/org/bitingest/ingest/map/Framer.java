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

import java.util.List;

/**
 * Derives frame and field names from the path of property names leading to a value in an entity.
 *
 * @author Bastian Gloeckle
 */
public interface Framer {
  /**
   * @return The frame name or <code>null</code> if values at the given path are not indexed.
   */
  public String frame(List<String> path);

  /**
   * @return Frame and field or <code>null</code> if values at the given path are not indexed.
   */
  public FrameAndField field(List<String> path);
}
