package se.alipsa.dbext.local;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.dbext.udx.CatalogCursor;
import se.alipsa.dbext.udx.CatalogQueryClient;
import se.alipsa.dbext.udx.ColumnDesc;
import se.alipsa.dbext.udx.ColumnType;
import se.alipsa.dbext.udx.InputRow;

/**
 * Runs catalog queries through a JDBC {@link Connection}. The connection is borrowed, never closed.
 */
public final class JdbcCatalogQueryClient implements CatalogQueryClient {

  private static final Logger log = LoggerFactory.getLogger(JdbcCatalogQueryClient.class);

  private final Connection connection;

  /**
   * Create a client.
   *
   * @param connection
   *          the connection the queries run on
   */
  public JdbcCatalogQueryClient(Connection connection) {
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  @Override
  public CatalogCursor open(String sql) throws SQLException {
    log.debug("Executing catalog query: {}", sql);
    Statement stmt = connection.createStatement();
    try {
      ResultSet rs = stmt.executeQuery(sql);
      return new JdbcCursor(stmt, rs, describe(rs.getMetaData()));
    } catch (SQLException | RuntimeException e) {
      try {
        stmt.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
  }

  static List<ColumnDesc> describe(ResultSetMetaData md) throws SQLException {
    int count = md.getColumnCount();
    List<ColumnDesc> columns = new ArrayList<>(count);
    for (int i = 1; i <= count; i++) {
      String label = md.getColumnLabel(i);
      String name = label == null || label.isEmpty() ? md.getColumnName(i) : label;
      ColumnType type = ColumnType.fromJdbcType(md.getColumnType(i));
      int length = type.isCharacter() || type == ColumnType.VARBINARY ? Math.max(0, md.getPrecision(i)) : 0;
      boolean nullable = md.isNullable(i) != ResultSetMetaData.columnNoNulls;
      int precision = type == ColumnType.NUMERIC ? md.getPrecision(i) : 0;
      int scale = type == ColumnType.NUMERIC ? md.getScale(i) : 0;
      columns.add(new ColumnDesc(name, type, length, nullable, precision, scale));
    }
    return columns;
  }

  static Object normalize(Object value) {
    if (value instanceof LocalDate ld) {
      return java.sql.Date.valueOf(ld);
    }
    if (value instanceof LocalDateTime ldt) {
      return Timestamp.valueOf(ldt);
    }
    if (value instanceof OffsetDateTime odt) {
      return Timestamp.from(odt.toInstant());
    }
    if (value instanceof LocalTime lt) {
      return java.sql.Time.valueOf(lt);
    }
    return value;
  }

  private static final class JdbcCursor implements CatalogCursor {

    private final Statement stmt;
    private final ResultSet rs;
    private final List<ColumnDesc> schema;

    JdbcCursor(Statement stmt, ResultSet rs, List<ColumnDesc> schema) {
      this.stmt = stmt;
      this.rs = rs;
      this.schema = List.copyOf(schema);
    }

    @Override
    public List<ColumnDesc> schema() {
      return schema;
    }

    @Override
    public InputRow fetch() throws SQLException {
      if (!rs.next()) {
        return null;
      }
      Object[] values = new Object[schema.size()];
      for (int i = 0; i < values.length; i++) {
        values[i] = normalize(rs.getObject(i + 1));
      }
      return new ArrayInputRow(values);
    }

    @Override
    public void close() throws SQLException {
      try {
        rs.close();
      } finally {
        stmt.close();
      }
    }
  }
}
