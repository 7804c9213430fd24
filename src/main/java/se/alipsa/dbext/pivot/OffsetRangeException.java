package se.alipsa.dbext.pivot;

import se.alipsa.dbext.udx.TableFunctionException;

/**
 * A derived output slot falls outside the pivot area of the output row. This indicates a mismatch
 * between the key map and the declared output schema.
 */
public class OffsetRangeException extends TableFunctionException {

  private static final long serialVersionUID = 1L;

  public OffsetRangeException(String message) {
    super(message, "XX000");
  }
}
