package se.alipsa.dbext.pivot;

import se.alipsa.dbext.udx.ColumnType;
import se.alipsa.dbext.udx.TableFunctionException;

/** Values of the given type cannot be used as pivot keys. */
public class UnsupportedKeyTypeException extends TableFunctionException {

  private static final long serialVersionUID = 1L;

  private final ColumnType type;

  /**
   * Create a new exception.
   *
   * @param type
   *          the offending column type
   */
  public UnsupportedKeyTypeException(ColumnType type) {
    super("Column type " + type + " is not supported as a pivot key", "0A000");
    this.type = type;
  }

  public ColumnType getType() {
    return type;
  }
}
