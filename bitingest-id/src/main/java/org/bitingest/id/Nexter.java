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
package org.bitingest.id;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread safe monotonic counter that hands out one identifier after the other.
 *
 * @author Bastian Gloeckle
 */
public class Nexter {
  private final AtomicLong next;

  public Nexter() {
    this(0L);
  }

  /**
   * @param start
   *          The first identifier returned by {@link #next()}.
   */
  public Nexter(long start) {
    next = new AtomicLong(start);
  }

  /**
   * @return The next identifier, which was not returned before by this instance.
   */
  public long next() {
    return next.getAndIncrement();
  }

  /**
   * @return The identifier that was returned last by {@link #next()}, or <code>start - 1</code> if it was not called
   *         yet.
   */
  public long last() {
    return next.get() - 1;
  }
}
