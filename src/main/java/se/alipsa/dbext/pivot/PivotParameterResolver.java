package se.alipsa.dbext.pivot;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import se.alipsa.dbext.udx.NamedParameterValue;
import se.alipsa.dbext.udx.ParameterException;
import se.alipsa.dbext.udx.ParameterKind;
import se.alipsa.dbext.udx.TableArg;

/**
 * Reads and validates the named parameters of the pivot function. Used by Describe, Create and
 * Start so all phases agree on the same parameter set.
 */
public final class PivotParameterResolver {

  private PivotParameterResolver() {
  }

  /**
   * Resolve the parameters of an invocation.
   *
   * @param arg
   *          the host arguments
   * @param checkInputSchema
   *          when {@code true}, every referenced column must exist in the input schema
   * @return the validated parameters
   * @throws ParameterException
   *           if a parameter is missing, of the wrong kind, or references an unknown column
   */
  public static PivotParameters resolve(TableArg arg, boolean checkInputSchema) throws ParameterException {
    NamedParameterValue pivot = require(arg, PivotParameterNames.PIVOT_COLUMN);
    if (pivot.kind() != ParameterKind.COLUMN_REF) {
      throw new ParameterException("'" + PivotParameterNames.PIVOT_COLUMN + "' must be a column reference.");
    }

    NamedParameterValue group = require(arg, PivotParameterNames.GROUP_COLUMNS);
    List<Integer> groupColumns = columnList(group, PivotParameterNames.GROUP_COLUMNS, true);

    NamedParameterValue query = require(arg, PivotParameterNames.COLUMN_CATALOG_QUERY);
    if (query.kind() != ParameterKind.CONSTANT) {
      throw new ParameterException("'" + PivotParameterNames.COLUMN_CATALOG_QUERY + "' must be a string.");
    }
    String catalogQuery = query.constant();
    if (catalogQuery == null || catalogQuery.isBlank()) {
      throw new ParameterException("'" + PivotParameterNames.COLUMN_CATALOG_QUERY + "' must not be empty.");
    }

    NamedParameterValue value = require(arg, PivotParameterNames.VALUE_COLUMNS);
    List<Integer> valueColumns = columnList(value, PivotParameterNames.VALUE_COLUMNS, false);

    PivotParameters parameters = new PivotParameters(pivot.columnRef(), groupColumns, valueColumns,
        catalogQuery.trim());
    if (checkInputSchema) {
      int inputCount = arg.inputColumns().size();
      checkRange(parameters.pivotColumn(), inputCount, PivotParameterNames.PIVOT_COLUMN);
      for (int column : parameters.groupColumns()) {
        checkRange(column, inputCount, PivotParameterNames.GROUP_COLUMNS);
      }
      for (int column : parameters.valueColumns()) {
        checkRange(column, inputCount, PivotParameterNames.VALUE_COLUMNS);
      }
    }
    return parameters;
  }

  private static NamedParameterValue require(TableArg arg, String name) throws ParameterException {
    for (String spelling : PivotParameterNames.spellings(name)) {
      NamedParameterValue value = arg.getNamedParameter(spelling);
      if (value != null) {
        return value;
      }
    }
    throw new ParameterException("'" + name + "' must be specified.");
  }

  private static List<Integer> columnList(NamedParameterValue value, String name, boolean distinct)
      throws ParameterException {
    if (!value.isColumnReference()) {
      throw new ParameterException("'" + name + "' must be a column reference or list of column references.");
    }
    List<Integer> columns = value.columns();
    if (columns.isEmpty()) {
      throw new ParameterException("'" + name + "' must reference at least one column.");
    }
    if (!distinct) {
      return columns;
    }
    Set<Integer> seen = new HashSet<>();
    for (Integer column : columns) {
      if (!seen.add(column)) {
        throw new ParameterException("'" + name + "' references column " + column + " more than once.");
      }
    }
    return columns;
  }

  private static void checkRange(int column, int inputCount, String name) throws ParameterException {
    if (column < 0 || column >= inputCount) {
      throw new ParameterException(
          "'" + name + "' references column " + column + " but the input has " + inputCount + " columns.");
    }
  }
}
