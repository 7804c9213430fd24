package se.alipsa.dbext.udx;

import java.sql.SQLException;

/**
 * Base class for failures raised by table functions. Raising one aborts the current phase or row
 * and surfaces to the query caller.
 */
public class TableFunctionException extends SQLException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param message
   *          the message shown to the query caller
   * @param sqlState
   *          the SQLState code
   */
  public TableFunctionException(String message, String sqlState) {
    super(message, sqlState);
  }

  /**
   * Create a new exception with a cause.
   *
   * @param message
   *          the message shown to the query caller
   * @param sqlState
   *          the SQLState code
   * @param cause
   *          the underlying failure
   */
  public TableFunctionException(String message, String sqlState, Throwable cause) {
    super(message, sqlState, cause);
  }
}
