package se.alipsa.dbext.pivot;

import se.alipsa.dbext.udx.TableFunctionException;

/** An input row carries {@code NULL} in the pivot column. */
public class NullPivotKeyException extends TableFunctionException {

  private static final long serialVersionUID = 1L;

  public NullPivotKeyException(String message) {
    super(message, "22004");
  }
}
