package se.alipsa.dbext.pivot;

import se.alipsa.dbext.udx.TableFunctionException;

/** The encoded pivot value of an input row is not one of the keys returned by the catalog query. */
public class PivotKeyNotFoundException extends TableFunctionException {

  private static final long serialVersionUID = 1L;

  private final String key;

  /**
   * Create a new exception.
   *
   * @param key
   *          the encoded key that could not be found
   */
  public PivotKeyNotFoundException(String key) {
    super("Unexpected failure in finding pivot key '" + key + "' in map", "22023");
    this.key = key;
  }

  /**
   * The encoded key that was looked up.
   *
   * @return the missing key
   */
  public String getKey() {
    return key;
  }
}
