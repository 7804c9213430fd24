package se.alipsa.dbext.udx;

import java.sql.SQLException;
import java.util.List;

/**
 * Result of a catalog query: a schema and a forward-only sequence of rows.
 */
public interface CatalogCursor extends AutoCloseable {

  /**
   * The columns of the result.
   *
   * @return the result schema
   */
  List<ColumnDesc> schema();

  /**
   * Fetch the next row.
   *
   * @return the next row, or {@code null} when the result is exhausted
   * @throws SQLException
   *           if the row cannot be read
   */
  InputRow fetch() throws SQLException;

  @Override
  void close() throws SQLException;
}
