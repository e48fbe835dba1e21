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

import java.util.ArrayList;
import java.util.List;

import org.antlr.v4.runtime.ANTLRInputStream;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.bitingest.proxy.antlr.PqlLexer;
import org.bitingest.proxy.antlr.PqlParser;
import org.bitingest.proxy.antlr.PqlParser.CallContext;
import org.bitingest.proxy.antlr.PqlParser.PqlStmtContext;

/**
 * Utility that can parse a query string into ANTLR objects.
 *
 * @author Bastian Gloeckle
 */
public class PqlParseUtil {

  public static PqlStmtContext parseWithAntlr(String pql) throws PqlParseException {
    ANTLRInputStream input = new ANTLRInputStream(pql.toCharArray(), pql.length());
    PqlLexer lexer = new PqlLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(new BaseErrorListener() {

      @Override
      public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
          String msg, RecognitionException e) {
        throw new PqlParseException("Syntax error (" + line + ":" + charPositionInLine + "): " + msg);
      }

    });
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    PqlParser parser = new PqlParser(tokens);
    parser.setBuildParseTree(true);
    parser.removeErrorListeners();
    parser.addErrorListener(new BaseErrorListener() {

      @Override
      public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
          String msg, RecognitionException e) {
        throw new PqlParseException("Syntax error while parsing (" + line + ":" + charPositionInLine + "): " + msg);
      }

    });

    try {
      return parser.pqlStmt();
    } catch (RecognitionException e) {
      throw new PqlParseException("Exception while parsing: " + e.getMessage(), e);
    }
  }

  /**
   * @return The value of the "frame" argument of each top-level call of the query, in order. Empty string for calls
   *         that have no such argument.
   */
  public static List<String> topLevelFrames(String pql) throws PqlParseException {
    PqlStmtContext stmt = parseWithAntlr(pql);
    List<String> res = new ArrayList<>();
    FrameArgumentVisitor visitor = new FrameArgumentVisitor();
    for (CallContext call : stmt.call())
      res.add(visitor.visit(call));
    return res;
  }
}
