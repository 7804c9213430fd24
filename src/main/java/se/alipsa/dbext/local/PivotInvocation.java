package se.alipsa.dbext.local;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import se.alipsa.dbext.pivot.PivotParameterNames;
import se.alipsa.dbext.udx.NamedParameterValue;
import se.alipsa.dbext.udx.ParameterException;

/**
 * A pivot call expressed with column names, e.g.
 * {@code PIVOT(pivot_column(status) group_columns(id) value_columns(amount)
 * column_catalog_query('SELECT code, label FROM statuses'))}.
 *
 * @param pivotColumn
 *          the column whose values select the output block
 * @param groupColumns
 *          the columns identifying one output row
 * @param valueColumns
 *          the columns copied into the selected block
 * @param catalogQuery
 *          the query listing the pivot keys and their output column labels
 */
public record PivotInvocation(String pivotColumn, List<String> groupColumns, List<String> valueColumns,
    String catalogQuery) {

  /**
   * Validates and freezes the record components.
   */
  public PivotInvocation {
    Objects.requireNonNull(pivotColumn, "pivotColumn");
    groupColumns = List.copyOf(groupColumns);
    valueColumns = List.copyOf(valueColumns);
    Objects.requireNonNull(catalogQuery, "catalogQuery");
  }

  Map<String, NamedParameterValue> toParameters(ColumnResolver resolver) throws ParameterException {
    Map<String, NamedParameterValue> params = new LinkedHashMap<>();
    params.put(PivotParameterNames.PIVOT_COLUMN, NamedParameterValue.columnRef(resolver.indexOf(pivotColumn)));
    params.put(PivotParameterNames.GROUP_COLUMNS, NamedParameterValue.columnRefs(resolver.indexesOf(groupColumns)));
    params.put(PivotParameterNames.VALUE_COLUMNS, NamedParameterValue.columnRefs(resolver.indexesOf(valueColumns)));
    params.put(PivotParameterNames.COLUMN_CATALOG_QUERY, NamedParameterValue.constant(catalogQuery));
    return params;
  }
}
