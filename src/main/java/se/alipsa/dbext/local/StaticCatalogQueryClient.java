package se.alipsa.dbext.local;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import se.alipsa.dbext.udx.CatalogCursor;
import se.alipsa.dbext.udx.CatalogQueryClient;
import se.alipsa.dbext.udx.ColumnDesc;
import se.alipsa.dbext.udx.InputRow;

/**
 * Catalog client answering registered queries with fixed results. Useful when the pivot labels come
 * from configuration rather than from a database.
 */
public final class StaticCatalogQueryClient implements CatalogQueryClient {

  private record Result(List<ColumnDesc> schema, List<Object[]> rows) {
  }

  private final Map<String, Result> results = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> executions = new ConcurrentHashMap<>();

  /**
   * Register the result of a query.
   *
   * @param query
   *          the query text, matched after trimming
   * @param schema
   *          the result columns
   * @param rows
   *          the result rows
   * @return this client
   */
  public StaticCatalogQueryClient register(String query, List<ColumnDesc> schema, List<Object[]> rows) {
    List<Object[]> copy = new ArrayList<>(rows.size());
    for (Object[] row : rows) {
      copy.add(row.clone());
    }
    results.put(query.trim(), new Result(List.copyOf(schema), copy));
    return this;
  }

  @Override
  public CatalogCursor open(String query) throws SQLException {
    String key = query == null ? "" : query.trim();
    Result result = results.get(key);
    if (result == null) {
      throw new SQLException("No result registered for catalog query: " + query, "42P01");
    }
    executions.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
    Iterator<Object[]> it = result.rows().iterator();
    return new CatalogCursor() {
      @Override
      public List<ColumnDesc> schema() {
        return result.schema();
      }

      @Override
      public InputRow fetch() {
        return it.hasNext() ? new ArrayInputRow(it.next()) : null;
      }

      @Override
      public void close() {
        // nothing to release
      }
    };
  }

  /**
   * How many times a query has been opened.
   *
   * @param query
   *          the query text
   * @return the number of executions
   */
  public int executionCount(String query) {
    AtomicInteger count = executions.get(query.trim());
    return count == null ? 0 : count.get();
  }
}
