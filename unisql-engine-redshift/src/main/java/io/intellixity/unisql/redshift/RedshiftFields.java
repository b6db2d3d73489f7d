package io.intellixity.unisql.redshift;

import com.amazonaws.services.redshiftdataapi.model.ColumnMetadata;
import com.amazonaws.services.redshiftdataapi.model.Field;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Coerces Data API tagged-union fields into plain row values. */
final class RedshiftFields {
  private RedshiftFields() {}

  static List<String> columns(List<ColumnMetadata> metadata) {
    List<String> out = new ArrayList<>();
    if (metadata == null) return out;
    for (int i = 0; i < metadata.size(); i++) {
      String name = metadata.get(i) == null ? null : metadata.get(i).getName();
      out.add(name == null || name.isEmpty() ? "column_" + i : name);
    }
    return out;
  }

  static Map<String, Object> row(List<String> columns, List<Field> record) {
    Map<String, Object> row = new LinkedHashMap<>();
    if (record == null) return row;
    for (int i = 0; i < record.size(); i++) {
      String name = i < columns.size() ? columns.get(i) : "column_" + i;
      row.put(name, value(record.get(i)));
    }
    return row;
  }

  /** First non-null typed member wins; explicit isNull maps to null. */
  static Object value(Field f) {
    if (f == null || Boolean.TRUE.equals(f.getIsNull())) return null;
    if (f.getStringValue() != null) return f.getStringValue();
    if (f.getLongValue() != null) return f.getLongValue();
    if (f.getDoubleValue() != null) return f.getDoubleValue();
    if (f.getBooleanValue() != null) return f.getBooleanValue();
    if (f.getBlobValue() != null) return bytes(f.getBlobValue());
    return null;
  }

  private static byte[] bytes(ByteBuffer buf) {
    ByteBuffer b = buf.duplicate();
    byte[] out = new byte[b.remaining()];
    b.get(out);
    return out;
  }
}
