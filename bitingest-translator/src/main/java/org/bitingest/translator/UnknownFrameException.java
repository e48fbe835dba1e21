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
package org.bitingest.translator;

/**
 * Thrown when an identifier of a frame is requested that does not exist. As identifiers of such a frame can never have
 * been handed out, this denotes a bug of the caller.
 *
 * @author Bastian Gloeckle
 */
public class UnknownFrameException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String frame;

  public UnknownFrameException(String frame) {
    super("Unknown frame '" + frame + "'");
    this.frame = frame;
  }

  public String getFrame() {
    return frame;
  }
}
