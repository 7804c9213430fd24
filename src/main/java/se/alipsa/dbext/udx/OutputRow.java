package se.alipsa.dbext.udx;

/**
 * A row buffer allocated from a {@link RowStore}. Values are addressed by zero-based output column
 * index.
 */
public interface OutputRow {

  /**
   * Number of output columns.
   *
   * @return the column count
   */
  int columnCount();

  /**
   * Set the column to SQL {@code NULL}.
   *
   * @param column
   *          zero-based output column index
   */
  void setNull(int column);

  /**
   * Whether the column currently holds {@code NULL}.
   *
   * @param column
   *          zero-based output column index
   * @return {@code true} when the column is null
   */
  boolean isNull(int column);

  /**
   * Copy a value from an input row into this row.
   *
   * @param source
   *          the input row
   * @param sourceColumn
   *          zero-based column index in {@code source}
   * @param column
   *          zero-based output column index
   */
  void copyFrom(InputRow source, int sourceColumn, int column);

  /**
   * The value currently held by the column.
   *
   * @param column
   *          zero-based output column index
   * @return the value, or {@code null}
   */
  Object getValue(int column);
}
