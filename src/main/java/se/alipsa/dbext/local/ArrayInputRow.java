package se.alipsa.dbext.local;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import se.alipsa.dbext.udx.InputRow;

/**
 * {@link InputRow} over an array of Java values. Values are expected in their natural form
 * ({@link Timestamp}, {@link Date}, {@link BigDecimal}, boxed numbers, {@link String}). The integer
 * getters only accept values that fit the type exactly and throw {@link ArithmeticException}
 * otherwise.
 */
public final class ArrayInputRow implements InputRow {

  private final Object[] values;

  /**
   * Create a row.
   *
   * @param values
   *          the column values, copied
   */
  public ArrayInputRow(Object... values) {
    this.values = values == null ? new Object[0] : values.clone();
  }

  @Override
  public int columnCount() {
    return values.length;
  }

  @Override
  public boolean isNull(int column) {
    return values[column] == null;
  }

  @Override
  public Timestamp getTimestamp(int column) {
    Object value = nonNull(column);
    if (value instanceof Timestamp ts) {
      return ts;
    }
    if (value instanceof LocalDateTime ldt) {
      return Timestamp.valueOf(ldt);
    }
    if (value instanceof Date d) {
      return Timestamp.valueOf(d.toLocalDate().atStartOfDay());
    }
    throw new ClassCastException("Column " + column + " is not a timestamp: " + value.getClass().getName());
  }

  @Override
  public long getBigInt(int column) {
    Number num = number(column);
    if (num instanceof Long || num instanceof Integer || num instanceof Short || num instanceof Byte) {
      return num.longValue();
    }
    return exact(num).longValueExact();
  }

  @Override
  public BigDecimal getNumeric(int column) {
    Object value = nonNull(column);
    if (value instanceof BigDecimal bd) {
      return bd;
    }
    if (value instanceof BigInteger bi) {
      return new BigDecimal(bi);
    }
    if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
      return BigDecimal.valueOf(((Number) value).longValue());
    }
    if (value instanceof Number num) {
      return BigDecimal.valueOf(num.doubleValue());
    }
    return new BigDecimal(value.toString());
  }

  @Override
  public int getInt(int column) {
    Number num = number(column);
    if (num instanceof Integer || num instanceof Short || num instanceof Byte) {
      return num.intValue();
    }
    return exact(num).intValueExact();
  }

  @Override
  public Date getDate(int column) {
    Object value = nonNull(column);
    if (value instanceof Date d) {
      return d;
    }
    if (value instanceof LocalDate ld) {
      return Date.valueOf(ld);
    }
    if (value instanceof Timestamp ts) {
      return Date.valueOf(ts.toLocalDateTime().toLocalDate());
    }
    throw new ClassCastException("Column " + column + " is not a date: " + value.getClass().getName());
  }

  @Override
  public short getSmallInt(int column) {
    Number num = number(column);
    if (num instanceof Short || num instanceof Byte) {
      return num.shortValue();
    }
    return exact(num).shortValueExact();
  }

  @Override
  public float getFloat4(int column) {
    return number(column).floatValue();
  }

  @Override
  public double getFloat8(int column) {
    return number(column).doubleValue();
  }

  @Override
  public String getString(int column) {
    return nonNull(column).toString();
  }

  @Override
  public Object getValue(int column) {
    return values[column];
  }

  private Object nonNull(int column) {
    Object value = values[column];
    if (value == null) {
      throw new IllegalStateException("Column " + column + " is null");
    }
    return value;
  }

  private Number number(int column) {
    Object value = nonNull(column);
    if (value instanceof Number num) {
      return num;
    }
    if (value instanceof CharSequence text) {
      return new BigDecimal(text.toString().trim());
    }
    throw new ClassCastException("Column " + column + " is not numeric: " + value.getClass().getName());
  }

  private static BigDecimal exact(Number num) {
    if (num instanceof BigDecimal bd) {
      return bd;
    }
    if (num instanceof BigInteger bi) {
      return new BigDecimal(bi);
    }
    if (num instanceof Long || num instanceof Integer || num instanceof Short || num instanceof Byte) {
      return BigDecimal.valueOf(num.longValue());
    }
    double d = num.doubleValue();
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      throw new ArithmeticException("Not a finite number: " + d);
    }
    return new BigDecimal(d);
  }

  @Override
  public String toString() {
    return Arrays.toString(values);
  }
}
