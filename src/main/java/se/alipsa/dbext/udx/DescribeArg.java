package se.alipsa.dbext.udx;

import java.util.List;

/**
 * The schema declaration API available while a table function is being described at plan time.
 */
public interface DescribeArg extends TableArg {

  void addPartitionByColumn(int inputColumn);

  void addOrderByColumn(int inputColumn);

  /**
   * Declare an output column that clones the schema of an input column.
   *
   * @param inputColumn
   *          zero-based input column index
   * @return the index of the new output column
   */
  int copyColumnSchema(int inputColumn);

  /**
   * Declare a new output column.
   *
   * @param column
   *          type, length, nullability, precision, scale and name of the column
   * @return the index of the new output column
   */
  int addOutputColumn(ColumnDesc column);

  /**
   * The output columns declared so far.
   *
   * @return the output schema
   */
  List<ColumnDesc> outputColumns();

  /**
   * Require grouped-session execution: Start runs once per session and the session store is
   * distributed to every worker.
   */
  void enableSessionCommands();
}
