package se.alipsa.dbext.pivot;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.dbext.udx.ColumnDesc;
import se.alipsa.dbext.udx.DescribeArg;

/**
 * Describe phase of the pivot function: validates the parameters, runs the catalog query and
 * declares the output schema, i.e. the group columns followed by one block of value columns per
 * catalog row.
 */
public final class PivotSchemaResolver {

  private static final Logger log = LoggerFactory.getLogger(PivotSchemaResolver.class);

  private PivotSchemaResolver() {
  }

  /**
   * Declare partitioning, ordering and the output columns of a pivot invocation.
   *
   * @param arg
   *          the host's describe arguments
   * @param captureSnapshot
   *          when {@code true} the key map derived from this catalog result is stored in the
   *          {@link PivotKeyMapCodec#DESCRIBE_SNAPSHOT_SLOT} for Start to reuse
   * @return the catalog snapshot the schema was derived from
   * @throws SQLException
   *           if the parameters or the catalog query result are invalid, or the query fails
   */
  public static CatalogSnapshot describe(DescribeArg arg, boolean captureSnapshot) throws SQLException {
    PivotParameters parameters = PivotParameterResolver.resolve(arg, true);
    CatalogQueryValidator.validate(parameters.catalogQuery(), parameters.valueColumnCount());

    List<ColumnDesc> input = arg.inputColumns();
    ColumnDesc pivotColumn = input.get(parameters.pivotColumn());
    PivotKeyKind rowKind = PivotKeyKind.of(pivotColumn.type());

    for (int column : parameters.groupColumns()) {
      arg.addPartitionByColumn(column);
      arg.addOrderByColumn(column);
      arg.copyColumnSchema(column);
    }

    CatalogSnapshot snapshot = CatalogSnapshot.fetch(arg.catalogClient(), parameters.catalogQuery(),
        parameters.valueColumnCount());
    PivotKeyKind catalogKind = PivotKeyKind.of(snapshot.keyColumn().type());
    if (catalogKind.family() != rowKind.family()) {
      log.warn("Pivot column '{}' is {} but the column catalog query returns {} keys; unmatched values will fail",
          pivotColumn.name(), pivotColumn.type(), snapshot.keyColumn().type());
    }

    List<ColumnDesc> valueColumns = valueColumns(input, parameters);
    for (CatalogSnapshot.Entry entry : snapshot.entries()) {
      for (int i = 0; i < valueColumns.size(); i++) {
        arg.addOutputColumn(valueColumns.get(i).withName(entry.labels().get(i)).asNullable());
      }
    }
    arg.enableSessionCommands();

    if (captureSnapshot) {
      PivotKeyMapCodec.store(arg.sessionStore(), PivotKeyMapCodec.DESCRIBE_SNAPSHOT_SLOT,
          snapshot.toKeyMap(typeSpecs(valueColumns)));
    }
    if (log.isDebugEnabled()) {
      log.debug("Pivot output declared with {} group columns and {} x {} pivot columns",
          parameters.groupColumnCount(), snapshot.entries().size(), parameters.valueColumnCount());
    }
    return snapshot;
  }

  static List<ColumnDesc> valueColumns(List<ColumnDesc> input, PivotParameters parameters) {
    List<ColumnDesc> columns = new ArrayList<>(parameters.valueColumnCount());
    for (int column : parameters.valueColumns()) {
      columns.add(input.get(column));
    }
    return columns;
  }

  static List<PivotKeyMap.TypeSpec> typeSpecs(List<ColumnDesc> columns) {
    List<PivotKeyMap.TypeSpec> specs = new ArrayList<>(columns.size());
    for (ColumnDesc column : columns) {
      specs.add(PivotKeyMap.TypeSpec.of(column));
    }
    return specs;
  }
}
