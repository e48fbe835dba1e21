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
package org.bitingest.proxy;

import org.bitingest.proxy.antlr.PqlBaseVisitor;
import org.bitingest.proxy.antlr.PqlParser.ArgContext;
import org.bitingest.proxy.antlr.PqlParser.CallContext;
import org.bitingest.proxy.antlr.PqlParser.KeyValueContext;
import org.bitingest.proxy.antlr.PqlParser.ValueContext;

/**
 * Visits a call and returns the value of its "frame" argument or an empty string. Arguments of nested calls are not
 * inspected.
 *
 * @author Bastian Gloeckle
 */
public class FrameArgumentVisitor extends PqlBaseVisitor<String> {
  public static final String FRAME_ARG = "frame";

  @Override
  public String visitCall(CallContext ctx) {
    for (ArgContext arg : ctx.arg()) {
      KeyValueContext keyValue = arg.keyValue();
      if (keyValue != null && FRAME_ARG.equals(keyValue.IDENT().getText()))
        return valueText(keyValue.value());
    }
    return "";
  }

  /* package */ static String valueText(ValueContext value) {
    if (value.STRING() == null)
      return value.getText();

    String quoted = value.STRING().getText();
    StringBuilder sb = new StringBuilder(quoted.length());
    for (int i = 1; i < quoted.length() - 1; i++) {
      char c = quoted.charAt(i);
      if (c == '\\' && i + 1 < quoted.length() - 1)
        c = quoted.charAt(++i);
      sb.append(c);
    }
    return sb.toString();
  }
}
