package se.alipsa.dbext.udx;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The value of a named parameter passed to a table function, e.g. {@code pivot_column(status)} or
 * {@code column_catalog_query('SELECT ...')}.
 *
 * @param kind
 *          the parameter kind
 * @param columns
 *          zero-based input column indexes, empty for constants
 * @param constant
 *          the literal text for constants, {@code null} for column references
 */
public record NamedParameterValue(ParameterKind kind, List<Integer> columns, String constant) {

  /**
   * Validates and freezes the record components.
   */
  public NamedParameterValue {
    Objects.requireNonNull(kind, "kind");
    columns = columns == null ? List.of() : List.copyOf(columns);
  }

  /**
   * Create a reference to a single input column.
   *
   * @param column
   *          zero-based input column index
   * @return the parameter value
   */
  public static NamedParameterValue columnRef(int column) {
    return new NamedParameterValue(ParameterKind.COLUMN_REF, List.of(column), null);
  }

  /**
   * Create a reference to a list of input columns. A list with a single element is still reported as
   * {@link ParameterKind#COLUMN_REF}, as the host does.
   *
   * @param columns
   *          zero-based input column indexes
   * @return the parameter value
   */
  public static NamedParameterValue columnRefs(int... columns) {
    List<Integer> indexes = Arrays.stream(columns).boxed().toList();
    ParameterKind kind = indexes.size() == 1 ? ParameterKind.COLUMN_REF : ParameterKind.COLUMN_REF_LIST;
    return new NamedParameterValue(kind, indexes, null);
  }

  /**
   * Create a literal parameter.
   *
   * @param value
   *          the literal text
   * @return the parameter value
   */
  public static NamedParameterValue constant(String value) {
    return new NamedParameterValue(ParameterKind.CONSTANT, List.of(), value);
  }

  /**
   * Whether this parameter references one or more columns.
   *
   * @return {@code true} unless the parameter is a constant
   */
  public boolean isColumnReference() {
    return kind != ParameterKind.CONSTANT;
  }

  /**
   * The single referenced column.
   *
   * @return the zero-based column index
   * @throws IllegalStateException
   *           if the parameter is not a single column reference
   */
  public int columnRef() {
    if (kind != ParameterKind.COLUMN_REF || columns.size() != 1) {
      throw new IllegalStateException("Parameter is not a single column reference: " + this);
    }
    return columns.get(0);
  }

  /**
   * The parameter rendered as text; constants yield their literal, column references their indexes.
   *
   * @return a textual form of the value
   */
  public String valueAsString() {
    return kind == ParameterKind.CONSTANT ? constant : columns.toString();
  }
}
