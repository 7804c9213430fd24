package se.alipsa.dbext.pivot;

import java.util.List;
import java.util.Objects;

/**
 * The validated named parameters of one pivot invocation.
 *
 * @param pivotColumn
 *          input column holding the pivot key
 * @param groupColumns
 *          input columns identifying a group, in output order
 * @param valueColumns
 *          input columns copied into each key block, in output order
 * @param catalogQuery
 *          query returning the pivot keys and their output column labels
 */
public record PivotParameters(int pivotColumn, List<Integer> groupColumns, List<Integer> valueColumns,
    String catalogQuery) {

  /**
   * Validates and freezes the record components.
   */
  public PivotParameters {
    groupColumns = List.copyOf(groupColumns);
    valueColumns = List.copyOf(valueColumns);
    Objects.requireNonNull(catalogQuery, "catalogQuery");
  }

  public int groupColumnCount() {
    return groupColumns.size();
  }

  public int valueColumnCount() {
    return valueColumns.size();
  }
}
