package se.alipsa.dbext.udx;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;

/**
 * Read access to one row delivered by the host engine. Typed getters must only be called for
 * columns that are not {@code null}; callers check {@link #isNull(int)} first.
 */
public interface InputRow {

  /**
   * Number of columns in the row.
   *
   * @return the column count
   */
  int columnCount();

  /**
   * Whether the value in the given column is SQL {@code NULL}.
   *
   * @param column
   *          zero-based column index
   * @return {@code true} when the value is null
   */
  boolean isNull(int column);

  Timestamp getTimestamp(int column);

  long getBigInt(int column);

  BigDecimal getNumeric(int column);

  int getInt(int column);

  Date getDate(int column);

  short getSmallInt(int column);

  float getFloat4(int column);

  double getFloat8(int column);

  String getString(int column);

  /**
   * The value of the column in its natural Java representation, e.g. {@link Timestamp} for
   * timestamps and {@link BigDecimal} for numerics.
   *
   * @param column
   *          zero-based column index
   * @return the value, or {@code null}
   */
  Object getValue(int column);
}
