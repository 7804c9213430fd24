package se.alipsa.dbext.pivot;

import java.sql.SQLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.dbext.udx.DescribeArg;
import se.alipsa.dbext.udx.ExecutionArg;
import se.alipsa.dbext.udx.TableArg;
import se.alipsa.dbext.udx.TableFunction;
import se.alipsa.dbext.udx.TableFunctionFactory;

/**
 * Session-level entry points of the pivot function.
 *
 * <ul>
 * <li>Describe: {@link PivotSchemaResolver}</li>
 * <li>Create: one {@link PivotTableFunction} per worker</li>
 * <li>Start: {@link PivotKeyMapLoader}</li>
 * <li>Shutdown: nothing to release</li>
 * </ul>
 */
public final class PivotTableFunctionFactory implements TableFunctionFactory {

  private static final Logger log = LoggerFactory.getLogger(PivotTableFunctionFactory.class);

  private final boolean reuseDescribeSnapshot;

  /** Create a factory that runs the catalog query again at Start. */
  public PivotTableFunctionFactory() {
    this(false);
  }

  /**
   * Create a factory.
   *
   * @param reuseDescribeSnapshot
   *          when {@code true} Start reuses the key map derived at Describe instead of running the
   *          catalog query a second time
   */
  public PivotTableFunctionFactory(boolean reuseDescribeSnapshot) {
    this.reuseDescribeSnapshot = reuseDescribeSnapshot;
  }

  @Override
  public void describe(DescribeArg arg) throws SQLException {
    PivotSchemaResolver.describe(arg, reuseDescribeSnapshot);
  }

  @Override
  public TableFunction create(ExecutionArg arg) throws SQLException {
    return new PivotTableFunction(PivotParameterResolver.resolve(arg, true), arg);
  }

  @Override
  public void start(TableArg arg) throws SQLException {
    PivotKeyMapLoader.start(arg, reuseDescribeSnapshot);
  }

  @Override
  public void shutdown(TableArg arg) {
    log.debug("Pivot session shut down");
  }

  public boolean isReuseDescribeSnapshot() {
    return reuseDescribeSnapshot;
  }
}
