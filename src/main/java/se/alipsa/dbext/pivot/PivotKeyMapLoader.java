package se.alipsa.dbext.pivot;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.dbext.udx.ColumnDesc;
import se.alipsa.dbext.udx.ColumnType;
import se.alipsa.dbext.udx.TableArg;

/**
 * Start phase of the pivot function: builds the session's {@link PivotKeyMap} and publishes it in
 * the session store, where every worker picks it up.
 */
public final class PivotKeyMapLoader {

  private static final Logger log = LoggerFactory.getLogger(PivotKeyMapLoader.class);

  private PivotKeyMapLoader() {
  }

  /**
   * Build and publish the key map.
   *
   * @param arg
   *          the host arguments
   * @param reuseDescribeSnapshot
   *          restore the map captured at Describe instead of running the catalog query again, when
   *          one was captured
   * @return the published map
   * @throws SQLException
   *           if the parameters or the catalog result are invalid, or the query fails
   */
  public static PivotKeyMap start(TableArg arg, boolean reuseDescribeSnapshot) throws SQLException {
    PivotParameters parameters = PivotParameterResolver.resolve(arg, false);
    CatalogQueryValidator.validate(parameters.catalogQuery(), parameters.valueColumnCount());

    PivotKeyMap map = null;
    if (reuseDescribeSnapshot) {
      map = PivotKeyMapCodec.restore(arg.sessionStore(), PivotKeyMapCodec.DESCRIBE_SNAPSHOT_SLOT);
      if (map != null) {
        log.debug("Reusing pivot key map captured at describe: {}", map);
      }
    }
    if (map == null) {
      CatalogSnapshot snapshot = CatalogSnapshot.fetch(arg.catalogClient(), parameters.catalogQuery(),
          parameters.valueColumnCount());
      map = snapshot.toKeyMap(valueColumnTypes(arg.inputColumns(), parameters));
    }
    PivotKeyMapCodec.store(arg.sessionStore(), PivotKeyMapCodec.KEY_MAP_SLOT, map);
    log.debug("Published pivot key map with {} keys", map.size());
    return map;
  }

  private static List<PivotKeyMap.TypeSpec> valueColumnTypes(List<ColumnDesc> input, PivotParameters parameters) {
    List<PivotKeyMap.TypeSpec> specs = new ArrayList<>(parameters.valueColumnCount());
    for (int column : parameters.valueColumns()) {
      // input types may not be known to every host at this phase
      if (input != null && column < input.size()) {
        specs.add(PivotKeyMap.TypeSpec.of(input.get(column)));
      } else {
        specs.add(new PivotKeyMap.TypeSpec(ColumnType.OTHER, 0));
      }
    }
    return specs;
  }
}
