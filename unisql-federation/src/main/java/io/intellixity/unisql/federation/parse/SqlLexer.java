package io.intellixity.unisql.federation.parse;

import io.intellixity.unisql.query.QueryParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits query text into the few lexeme kinds the join grammar cares about.\n
 *
 * String literals, bracketed and double-quoted identifiers are single tokens, so keywords inside them
 * never end a clause.\n
 */
final class SqlLexer {
  private SqlLexer() {}

  static List<SqlToken> lex(String sql) {
    List<SqlToken> out = new ArrayList<>();
    int n = sql.length();
    int i = 0;
    while (i < n) {
      char c = sql.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
        continue;
      }
      int start = i;
      if (isWordChar(c)) {
        while (i < n && isWordChar(sql.charAt(i))) i++;
        out.add(new SqlToken(SqlToken.Kind.WORD, sql.substring(start, i), start, i));
        continue;
      }
      switch (c) {
        case '\'' -> {
          i = closeQuoted(sql, i, '\'', "string literal");
          out.add(new SqlToken(SqlToken.Kind.STRING, sql.substring(start, i), start, i));
        }
        case '"' -> {
          i = closeQuoted(sql, i, '"', "quoted identifier");
          out.add(new SqlToken(SqlToken.Kind.QUOTED, sql.substring(start, i), start, i));
        }
        case '[' -> {
          int close = sql.indexOf(']', i + 1);
          if (close < 0) throw QueryParseException.unsupported("unterminated bracketed identifier at offset " + start);
          i = close + 1;
          out.add(new SqlToken(SqlToken.Kind.BRACKETED, sql.substring(start, i), start, i));
        }
        default -> {
          i++;
          out.add(new SqlToken(single(c), String.valueOf(c), start, i));
        }
      }
    }
    return out;
  }

  private static SqlToken.Kind single(char c) {
    return switch (c) {
      case '.' -> SqlToken.Kind.DOT;
      case '=' -> SqlToken.Kind.EQ;
      case '(' -> SqlToken.Kind.LPAREN;
      case ')' -> SqlToken.Kind.RPAREN;
      case ',' -> SqlToken.Kind.COMMA;
      case ';' -> SqlToken.Kind.SEMI;
      default -> SqlToken.Kind.SYMBOL;
    };
  }

  /** Returns the offset just past the closing quote; a doubled quote is an escaped one. */
  private static int closeQuoted(String sql, int open, char quote, String what) {
    int i = open + 1;
    while (i < sql.length()) {
      if (sql.charAt(i) == quote) {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    throw QueryParseException.unsupported("unterminated " + what + " at offset " + open);
  }

  private static boolean isWordChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '#' || c == '@';
  }
}
