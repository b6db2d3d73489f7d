package io.intellixity.unisql.federation.join;

import java.math.BigDecimal;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * Join-key normalisation shared by both sides of a hash join.\n
 *
 * Keys compare as case-insensitive strings. Numeric values are rendered in plain form without trailing
 * fractional zeros, so 1, 1.0d and BigDecimal 1.00 meet. Text is only lower-cased: "1.10" and "1.1" stay
 * distinct. Null becomes the empty string and therefore matches an empty string on the other side.\n
 */
public final class JoinKeys {
  private JoinKeys() {}

  public static String of(Object value) {
    if (value == null) return "";
    if (value instanceof BigDecimal d) return plain(d);
    if (value instanceof Double || value instanceof Float) {
      double x = ((Number) value).doubleValue();
      if (Double.isFinite(x)) return plain(BigDecimal.valueOf(x));
    }
    if (value instanceof byte[] b) return HexFormat.of().formatHex(b);
    return String.valueOf(value).toLowerCase(Locale.ROOT);
  }

  /**
   * Name of the result column a join column refers to: an exact match first, then a case-insensitive one.
   * Returns the requested name unchanged when no column matches, so every lookup yields null.
   */
  static String resolveColumn(List<String> columns, String requested) {
    if (columns.contains(requested)) return requested;
    for (String c : columns) {
      if (c.equalsIgnoreCase(requested)) return c;
    }
    return requested;
  }

  private static String plain(BigDecimal d) {
    if (d.signum() == 0) return "0";
    return d.stripTrailingZeros().toPlainString();
  }
}
