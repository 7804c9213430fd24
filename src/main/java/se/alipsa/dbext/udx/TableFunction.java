package se.alipsa.dbext.udx;

import java.sql.SQLException;

/**
 * A worker's instance of a table function. Rows of one partition arrive sequentially through
 * {@link #process(InputRow)}; {@link #finalizePartition()} marks the end of the partition.
 */
public interface TableFunction {

  void process(InputRow row) throws SQLException;

  void finalizePartition() throws SQLException;

  /** Early termination: drop any partial state without emitting it. */
  void abort();

  /** Release everything the instance holds. */
  void destroy();
}
