package se.alipsa.dbext.local;

import java.util.Arrays;
import se.alipsa.dbext.udx.InputRow;
import se.alipsa.dbext.udx.OutputRow;

/** {@link OutputRow} backed by an array, all columns start out {@code null}. */
public final class LocalOutputRow implements OutputRow {

  private final Object[] values;

  LocalOutputRow(int columnCount) {
    this.values = new Object[columnCount];
  }

  @Override
  public int columnCount() {
    return values.length;
  }

  @Override
  public void setNull(int column) {
    values[column] = null;
  }

  @Override
  public boolean isNull(int column) {
    return values[column] == null;
  }

  @Override
  public void copyFrom(InputRow source, int sourceColumn, int column) {
    values[column] = source.getValue(sourceColumn);
  }

  @Override
  public Object getValue(int column) {
    return values[column];
  }

  /**
   * A copy of all column values.
   *
   * @return the values in column order
   */
  public Object[] values() {
    return values.clone();
  }

  @Override
  public String toString() {
    return Arrays.toString(values);
  }
}
