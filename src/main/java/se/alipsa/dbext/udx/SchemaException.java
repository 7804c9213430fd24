package se.alipsa.dbext.udx;

/**
 * A catalog query result does not have the shape the table function requires.
 */
public class SchemaException extends TableFunctionException {

  private static final long serialVersionUID = 1L;

  public SchemaException(String message) {
    super(message, "42804");
  }

  public SchemaException(String message, Throwable cause) {
    super(message, "42804", cause);
  }
}
