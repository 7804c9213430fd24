package se.alipsa.dbext.udx;

import java.util.Objects;

/**
 * Describes one column of an input, catalog or output schema.
 *
 * @param name
 *          the column name
 * @param type
 *          the column type tag
 * @param length
 *          declared length for character and binary columns, {@code 0} when unspecified
 * @param nullable
 *          whether the column accepts {@code null}
 * @param precision
 *          numeric precision, {@code 0} when not applicable
 * @param scale
 *          numeric scale, {@code 0} when not applicable
 */
public record ColumnDesc(String name, ColumnType type, int length, boolean nullable, int precision, int scale) {

  /**
   * Validates the record components.
   */
  public ColumnDesc {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }

  /**
   * Create a nullable column without length, precision or scale.
   *
   * @param name
   *          the column name
   * @param type
   *          the column type
   * @return a new column description
   */
  public static ColumnDesc of(String name, ColumnType type) {
    return new ColumnDesc(name, type, 0, true, 0, 0);
  }

  /**
   * Copy this description under another name.
   *
   * @param newName
   *          the name of the copy
   * @return a column with the same type attributes and the supplied name
   */
  public ColumnDesc withName(String newName) {
    return new ColumnDesc(newName, type, length, nullable, precision, scale);
  }

  /**
   * Copy this description with nullability switched on.
   *
   * @return a nullable copy of this column
   */
  public ColumnDesc asNullable() {
    return nullable ? this : new ColumnDesc(name, type, length, true, precision, scale);
  }
}
