package io.intellixity.unisql.federation.parse;

import io.intellixity.unisql.query.QueryParseException;
import io.intellixity.unisql.query.SourcePrefix;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for the one join shape the federation supports:\n
 *
 * SELECT cols FROM rs.schema.table [AS] a [INNER|LEFT [OUTER]|RIGHT [OUTER]|FULL [OUTER]] JOIN
 * ss.[schema].table [AS] b ON a.col = b.col [WHERE cond (AND cond)*] [ORDER BY ...] [LIMIT n] [;]\n
 *
 * Keywords are case-insensitive and runs of whitespace are collapsed before parsing. ORDER BY is accepted
 * and ignored. Anything else is a {@link QueryParseException}.\n
 */
public final class CrossSourceJoinParser {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern IDENT = Pattern.compile("[A-Za-z0-9_]+");
  private static final Set<String> RESERVED = Set.of(
      "SELECT", "FROM", "AS", "JOIN", "INNER", "LEFT", "RIGHT", "FULL", "OUTER", "CROSS",
      "ON", "WHERE", "AND", "OR", "ORDER", "BY", "LIMIT");

  private final PredicateSplitter splitter;

  public CrossSourceJoinParser(PredicateSplitter splitter) {
    this.splitter = Objects.requireNonNull(splitter, "splitter");
  }

  public CrossSourceJoinParser() {
    this(new PredicateSplitter());
  }

  public JoinSpec parse(String sql) {
    Objects.requireNonNull(sql, "sql");
    String text = WHITESPACE.matcher(sql).replaceAll(" ").trim();
    if (text.isEmpty()) throw QueryParseException.unsupported("empty query");
    return new Cursor(text, SqlLexer.lex(text)).parse();
  }

  private final class Cursor {
    private final String text;
    private final List<SqlToken> tokens;
    private int pos;

    Cursor(String text, List<SqlToken> tokens) {
      this.text = text;
      this.tokens = tokens;
    }

    JoinSpec parse() {
      expectWord("SELECT", "query must start with SELECT");
      String select = selectList();

      expectWord("FROM", "missing FROM");
      TableRef warehouse = warehouseTable();
      JoinType joinType = joinType();
      TableRef transactional = transactionalTable();
      if (warehouse.hasAlias(transactional.alias())) {
        throw QueryParseException.unsupported("both tables use alias '" + warehouse.alias() + "'");
      }
      JoinPredicate predicate = onClause(warehouse, transactional);

      String where = null;
      if (acceptWord("WHERE")) where = whereClause();
      if (atWord("ORDER") && atWord(pos + 1, "BY")) skipOrderBy();
      OptionalInt limit = OptionalInt.empty();
      if (acceptWord("LIMIT")) limit = OptionalInt.of(limitValue());
      if (peek() != null && peek().kind() == SqlToken.Kind.SEMI) pos++;
      if (peek() != null) throw QueryParseException.unsupported("unexpected '" + peek().text() + "'");

      PredicateSplitter.Split split = splitter.split(where, warehouse.alias(), transactional.alias());
      return new JoinSpec(warehouse, transactional, joinType, predicate, select,
          Map.of(warehouse.alias(), split.left(), transactional.alias(), split.right()), limit);
    }

    private String selectList() {
      int start = pos;
      int depth = 0;
      while (pos < tokens.size()) {
        SqlToken t = tokens.get(pos);
        if (t.kind() == SqlToken.Kind.LPAREN) depth++;
        else if (t.kind() == SqlToken.Kind.RPAREN) depth--;
        else if (depth == 0 && t.isWord("FROM")) break;
        pos++;
      }
      if (pos == start) throw QueryParseException.unsupported("empty select list");
      return span(start, pos);
    }

    private TableRef warehouseTable() {
      String expected = "expected warehouse table " + SourcePrefix.WAREHOUSE.format() + " after FROM";
      if (!atWord(SourcePrefix.WAREHOUSE.token())) throw QueryParseException.unsupported(expected);
      pos++;
      expect(SqlToken.Kind.DOT, expected);
      String schema = identifier(expected);
      expect(SqlToken.Kind.DOT, expected);
      String table = identifier(expected);
      return new TableRef(schema, table, alias(SourcePrefix.WAREHOUSE.token() + "." + schema + "." + table));
    }

    private TableRef transactionalTable() {
      String expected = "expected transactional table ss.[schema].table after JOIN";
      if (!atWord(SourcePrefix.TRANSACTIONAL.token())) throw QueryParseException.unsupported(expected);
      pos++;
      expect(SqlToken.Kind.DOT, expected);
      SqlToken s = peek();
      String schema;
      if (s != null && s.kind() == SqlToken.Kind.BRACKETED && s.text().length() > 2) {
        schema = s.unbracketed();
        pos++;
      } else {
        schema = identifier(expected);
      }
      expect(SqlToken.Kind.DOT, expected);
      String table = identifier(expected);
      return new TableRef(schema, table, alias(SourcePrefix.TRANSACTIONAL.token() + "." + schema + "." + table));
    }

    private String alias(String tableText) {
      acceptWord("AS");
      SqlToken t = peek();
      if (t == null || t.kind() != SqlToken.Kind.WORD || !IDENT.matcher(t.text()).matches() || reserved(t)) {
        throw QueryParseException.unsupported("missing alias for " + tableText);
      }
      pos++;
      return t.text();
    }

    private JoinType joinType() {
      JoinType type = JoinType.INNER;
      if (acceptWord("INNER")) {
        type = JoinType.INNER;
      } else if (acceptWord("LEFT")) {
        type = JoinType.LEFT;
        acceptWord("OUTER");
      } else if (acceptWord("RIGHT")) {
        type = JoinType.RIGHT;
        acceptWord("OUTER");
      } else if (acceptWord("FULL")) {
        type = JoinType.FULL;
        acceptWord("OUTER");
      }
      expectWord("JOIN", "expected JOIN after the warehouse table");
      return type;
    }

    private JoinPredicate onClause(TableRef warehouse, TableRef transactional) {
      expectWord("ON", "missing ON clause");
      String expected = "expected join predicate ON <alias>.<col> = <alias>.<col>";
      String leftAlias = identifier(expected);
      expect(SqlToken.Kind.DOT, expected);
      String leftCol = identifier(expected);
      expect(SqlToken.Kind.EQ, expected);
      String rightAlias = identifier(expected);
      expect(SqlToken.Kind.DOT, expected);
      String rightCol = identifier(expected);

      if (warehouse.hasAlias(leftAlias) && transactional.hasAlias(rightAlias)) {
        return new JoinPredicate(leftCol, rightCol);
      }
      if (transactional.hasAlias(leftAlias) && warehouse.hasAlias(rightAlias)) {
        return new JoinPredicate(rightCol, leftCol);
      }
      throw QueryParseException.unsupported("join predicate must compare a column of "
          + warehouse.alias() + " with a column of " + transactional.alias());
    }

    private String whereClause() {
      int start = pos;
      int depth = 0;
      while (pos < tokens.size()) {
        SqlToken t = tokens.get(pos);
        if (t.kind() == SqlToken.Kind.LPAREN) depth++;
        else if (t.kind() == SqlToken.Kind.RPAREN) depth--;
        else if (depth == 0 && (t.isWord("LIMIT") || t.kind() == SqlToken.Kind.SEMI
            || (t.isWord("ORDER") && atWord(pos + 1, "BY")))) break;
        pos++;
      }
      if (pos == start) throw QueryParseException.unsupported("empty WHERE clause");
      return span(start, pos);
    }

    private void skipOrderBy() {
      pos += 2;
      int start = pos;
      while (pos < tokens.size() && !atWord("LIMIT") && tokens.get(pos).kind() != SqlToken.Kind.SEMI) pos++;
      if (pos == start) throw QueryParseException.unsupported("empty ORDER BY");
    }

    private int limitValue() {
      SqlToken t = peek();
      if (t == null || !t.isNumber()) throw QueryParseException.unsupported("LIMIT expects a non-negative integer");
      pos++;
      try {
        return Integer.parseInt(t.text());
      } catch (NumberFormatException e) {
        throw QueryParseException.unsupported("LIMIT " + t.text() + " is out of range");
      }
    }

    private String identifier(String expected) {
      SqlToken t = peek();
      if (t == null || t.kind() != SqlToken.Kind.WORD || !IDENT.matcher(t.text()).matches()) {
        throw QueryParseException.unsupported(expected);
      }
      pos++;
      return t.text();
    }

    private void expect(SqlToken.Kind kind, String expected) {
      SqlToken t = peek();
      if (t == null || t.kind() != kind) throw QueryParseException.unsupported(expected);
      pos++;
    }

    private void expectWord(String keyword, String problem) {
      if (!acceptWord(keyword)) throw QueryParseException.unsupported(problem);
    }

    private boolean acceptWord(String keyword) {
      if (!atWord(keyword)) return false;
      pos++;
      return true;
    }

    private boolean atWord(String keyword) {
      return atWord(pos, keyword);
    }

    private boolean atWord(int at, String keyword) {
      return at < tokens.size() && tokens.get(at).isWord(keyword);
    }

    private SqlToken peek() {
      return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private boolean reserved(SqlToken t) {
      return RESERVED.contains(t.text().toUpperCase(Locale.ROOT));
    }

    private String span(int from, int to) {
      return text.substring(tokens.get(from).start(), tokens.get(to - 1).end()).trim();
    }
  }
}
