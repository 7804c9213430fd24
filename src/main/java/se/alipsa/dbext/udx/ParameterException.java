package se.alipsa.dbext.udx;

/**
 * A named parameter is missing or of the wrong kind.
 */
public class ParameterException extends TableFunctionException {

  private static final long serialVersionUID = 1L;

  public ParameterException(String message) {
    super(message, "42601");
  }

  public ParameterException(String message, Throwable cause) {
    super(message, "42601", cause);
  }
}
