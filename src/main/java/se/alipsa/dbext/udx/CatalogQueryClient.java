package se.alipsa.dbext.udx;

import java.sql.SQLException;

/**
 * Executes SQL on behalf of a table function while it is being planned or started.
 */
@FunctionalInterface
public interface CatalogQueryClient {

  /**
   * Run the query and open a cursor over its result.
   *
   * @param sql
   *          the query text, interpreted entirely by the host
   * @return an open cursor, closed by the caller
   * @throws SQLException
   *           if the query fails
   */
  CatalogCursor open(String sql) throws SQLException;
}
