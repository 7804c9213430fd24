package se.alipsa.dbext.local;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import se.alipsa.dbext.udx.InputRow;

/**
 * The values of the partition columns of a row. Keys sort column by column with {@code null} last.
 */
final class GroupKey implements Comparable<GroupKey> {

  private final Object[] values;

  private GroupKey(Object[] values) {
    this.values = values;
  }

  static GroupKey of(InputRow row, List<Integer> columns) {
    Object[] values = new Object[columns.size()];
    for (int i = 0; i < values.length; i++) {
      Object value = row.getValue(columns.get(i));
      values[i] = value instanceof byte[] bytes ? new Bytes(bytes) : value;
    }
    return new GroupKey(values);
  }

  @Override
  public int compareTo(GroupKey other) {
    for (int i = 0; i < values.length; i++) {
      int cmp = compareValues(values[i], other.values[i]);
      if (cmp != 0) {
        return cmp;
      }
    }
    return 0;
  }

  @SuppressWarnings({
      "unchecked", "rawtypes"
  })
  static int compareValues(Object a, Object b) {
    if (a == null || b == null) {
      if (a == b) {
        return 0;
      }
      return a == null ? 1 : -1;
    }
    if (a instanceof Number na && b instanceof Number nb && a.getClass() != b.getClass()) {
      BigDecimal da = exact(na);
      BigDecimal db = exact(nb);
      if (da == null || db == null) {
        return Double.compare(na.doubleValue(), nb.doubleValue());
      }
      return da.compareTo(db);
    }
    if (a instanceof Comparable ca && a.getClass().isInstance(b)) {
      return ca.compareTo(b);
    }
    return a.toString().compareTo(b.toString());
  }

  // null for NaN and infinities
  private static BigDecimal exact(Number value) {
    if (value instanceof BigDecimal bd) {
      return bd;
    }
    if (value instanceof BigInteger bi) {
      return new BigDecimal(bi);
    }
    if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return BigDecimal.valueOf(value.longValue());
    }
    double d = value.doubleValue();
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      return null;
    }
    return new BigDecimal(d);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof GroupKey other && Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return Arrays.toString(values);
  }

  private record Bytes(byte[] data) implements Comparable<Bytes> {

    @Override
    public int compareTo(Bytes o) {
      return Arrays.compare(data, o.data);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Bytes other && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
      return Arrays.toString(data);
    }
  }
}
