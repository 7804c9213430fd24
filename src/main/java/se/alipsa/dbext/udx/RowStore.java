package se.alipsa.dbext.udx;

/**
 * Allocates output rows and hands finished rows downstream.
 */
public interface RowStore {

  /**
   * Allocate a row sized to the declared output schema. All columns start out {@code NULL}.
   *
   * @return a new row owned by the caller until it is emitted or freed
   */
  OutputRow allocate();

  /**
   * Hand a finished row downstream. Ownership passes to the store.
   *
   * @param row
   *          the row to emit
   */
  void emit(OutputRow row);

  /**
   * Release a row that will never be emitted.
   *
   * @param row
   *          the row to release
   */
  void free(OutputRow row);
}
