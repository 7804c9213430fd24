package se.alipsa.dbext.pivot;

import java.util.List;

/**
 * Names of the named parameters of the pivot table function, e.g.
 *
 * <pre>
 * PIVOT(ON sales
 *   WITH pivot_column(status) group_columns(region) value_columns(amount)
 *   column_catalog_query('SELECT status, lower(status) || ''_amt'' FROM statuses ORDER BY 1'))
 * </pre>
 */
public final class PivotParameterNames {

  public static final String PIVOT_COLUMN = "pivot_column";
  public static final String GROUP_COLUMNS = "group_columns";
  public static final String VALUE_COLUMNS = "value_columns";
  public static final String COLUMN_CATALOG_QUERY = "column_catalog_query";

  private PivotParameterNames() {
  }

  /**
   * The accepted spellings of a parameter, canonical name first. The short names are the ones used by
   * earlier releases of the function.
   *
   * @param name
   *          the canonical parameter name
   * @return the canonical name followed by its aliases
   */
  public static List<String> spellings(String name) {
    return switch (name) {
      case PIVOT_COLUMN -> List.of(PIVOT_COLUMN, "pivotcol");
      case GROUP_COLUMNS -> List.of(GROUP_COLUMNS, "groupcol");
      case VALUE_COLUMNS -> List.of(VALUE_COLUMNS, "pivotval");
      case COLUMN_CATALOG_QUERY -> List.of(COLUMN_CATALOG_QUERY, "column_list");
      default -> List.of(name);
    };
  }
}
