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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * {@link Framer} joining the normalized elements of a path with dashes.
 * 
 * <p>
 * Paths containing an element that is configured to be ignored are not indexed at all. Elements configured to be
 * collapsed are removed from the path. All other elements are trimmed and lower-cased.
 *
 * @author Bastian Gloeckle
 */
public class DashFramer implements Framer {
  private static final Pattern INVALID_FIELD_CHARS = Pattern.compile("[^a-z0-9_]");

  private final Set<String> ignore = new HashSet<>();
  private final Set<String> collapse = new HashSet<>();

  public DashFramer() {
  }

  public DashFramer(Collection<String> ignore, Collection<String> collapse) {
    this.ignore.addAll(ignore);
    this.collapse.addAll(collapse);
  }

  @Override
  public String frame(List<String> path) {
    List<String> normalized = normalize(path);
    if (normalized == null)
      return null;
    return String.join("-", normalized);
  }

  @Override
  public FrameAndField field(List<String> path) {
    List<String> normalized = normalize(path);
    if (normalized == null || normalized.isEmpty())
      return null;
    return new FrameAndField(String.join("-", normalized.subList(0, normalized.size() - 1)),
        fieldName(normalized.get(normalized.size() - 1)));
  }

  /**
   * Field names end up as bare identifiers in queries: anything but letters, digits and underscores is replaced.
   */
  private String fieldName(String element) {
    String res = INVALID_FIELD_CHARS.matcher(element).replaceAll("_");
    if (res.isEmpty() || Character.isDigit(res.charAt(0)))
      res = "_" + res;
    return res;
  }

  private List<String> normalize(List<String> path) {
    List<String> res = new ArrayList<>(path.size());
    for (String element : path) {
      if (ignore.contains(element))
        return null;
      if (collapse.contains(element))
        continue;
      res.add(element.trim().toLowerCase(Locale.ROOT));
    }
    return res;
  }
}
