package se.alipsa.dbext.udx;

import java.util.List;

/**
 * What the host exposes to a worker executing a table function.
 */
public interface ExecutionArg extends TableArg {

  /**
   * The store output rows are allocated from and emitted to.
   *
   * @return the worker's row store
   */
  RowStore rowStore();

  /**
   * The output schema fixed at Describe.
   *
   * @return the output columns
   */
  List<ColumnDesc> outputColumns();
}
