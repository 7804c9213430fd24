package se.alipsa.dbext.udx;

import java.sql.SQLException;

/**
 * Session-level entry points of a table function. The host calls {@link #describe(DescribeArg)}
 * while planning, {@link #create(ExecutionArg)} once per worker, {@link #start(TableArg)} once per
 * session and {@link #shutdown(TableArg)} when the session ends normally.
 */
public interface TableFunctionFactory {

  void describe(DescribeArg arg) throws SQLException;

  TableFunction create(ExecutionArg arg) throws SQLException;

  void start(TableArg arg) throws SQLException;

  void shutdown(TableArg arg) throws SQLException;
}
