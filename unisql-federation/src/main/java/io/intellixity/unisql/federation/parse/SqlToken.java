package io.intellixity.unisql.federation.parse;

/** Lexeme with its [start, end) offsets in the normalized query text. */
record SqlToken(Kind kind, String text, int start, int end) {
  enum Kind {
    WORD,
    BRACKETED,
    QUOTED,
    STRING,
    DOT,
    EQ,
    LPAREN,
    RPAREN,
    COMMA,
    SEMI,
    SYMBOL
  }

  boolean isWord(String keyword) {
    return kind == Kind.WORD && text.equalsIgnoreCase(keyword);
  }

  boolean isNumber() {
    if (kind != Kind.WORD || text.isEmpty()) return false;
    for (int i = 0; i < text.length(); i++) {
      if (!Character.isDigit(text.charAt(i))) return false;
    }
    return true;
  }

  /** Content of a {@code [...]} token without the brackets. */
  String unbracketed() {
    return kind == Kind.BRACKETED ? text.substring(1, text.length() - 1) : text;
  }
}
