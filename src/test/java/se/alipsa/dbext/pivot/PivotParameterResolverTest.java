package se.alipsa.dbext.pivot;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import se.alipsa.dbext.local.LocalSessionStore;
import se.alipsa.dbext.local.LocalTableArg;
import se.alipsa.dbext.udx.ColumnDesc;
import se.alipsa.dbext.udx.ColumnType;
import se.alipsa.dbext.udx.NamedParameterValue;
import se.alipsa.dbext.udx.ParameterException;

/** Unit tests for {@link PivotParameterResolver}. */
class PivotParameterResolverTest {

  private static final List<ColumnDesc> INPUT = List.of(ColumnDesc.of("id", ColumnType.INTEGER),
      ColumnDesc.of("status", ColumnType.VARCHAR), ColumnDesc.of("amount", ColumnType.NUMERIC));

  private static Map<String, NamedParameterValue> valid() {
    Map<String, NamedParameterValue> params = new HashMap<>();
    params.put("pivot_column", NamedParameterValue.columnRef(1));
    params.put("group_columns", NamedParameterValue.columnRefs(0));
    params.put("value_columns", NamedParameterValue.columnRefs(2));
    params.put("column_catalog_query", NamedParameterValue.constant("  SELECT code, label FROM statuses  "));
    return params;
  }

  private static LocalTableArg arg(Map<String, NamedParameterValue> params) {
    return new LocalTableArg(params, INPUT, sql -> {
      throw new AssertionError("no catalog query expected");
    }, new LocalSessionStore());
  }

  @Test
  void resolvesValidParameters() throws Exception {
    PivotParameters p = PivotParameterResolver.resolve(arg(valid()), true);
    assertEquals(1, p.pivotColumn());
    assertEquals(List.of(0), p.groupColumns());
    assertEquals(List.of(2), p.valueColumns());
    assertEquals("SELECT code, label FROM statuses", p.catalogQuery());
  }

  @Test
  void acceptsLegacyParameterNames() throws Exception {
    Map<String, NamedParameterValue> params = new HashMap<>();
    params.put("pivotcol", NamedParameterValue.columnRef(1));
    params.put("groupcol", NamedParameterValue.columnRefs(0));
    params.put("pivotval", NamedParameterValue.columnRefs(2, 0));
    params.put("column_list", NamedParameterValue.constant("SELECT a, b, c FROM t"));
    PivotParameters p = PivotParameterResolver.resolve(arg(params), true);
    assertEquals(2, p.valueColumnCount());
  }

  @Test
  void reportsMissingParameterByCanonicalName() {
    Map<String, NamedParameterValue> params = valid();
    params.remove("pivot_column");
    ParameterException e = assertThrows(ParameterException.class, () -> PivotParameterResolver.resolve(arg(params),
        true));
    assertEquals("'pivot_column' must be specified.", e.getMessage());
    assertEquals("42601", e.getSQLState());
  }

  @Test
  void rejectsWrongParameterKinds() {
    Map<String, NamedParameterValue> constantPivot = valid();
    constantPivot.put("pivot_column", NamedParameterValue.constant("status"));
    assertThrows(ParameterException.class, () -> PivotParameterResolver.resolve(arg(constantPivot), true));

    Map<String, NamedParameterValue> listPivot = valid();
    listPivot.put("pivot_column", NamedParameterValue.columnRefs(1, 2));
    assertThrows(ParameterException.class, () -> PivotParameterResolver.resolve(arg(listPivot), true));

    Map<String, NamedParameterValue> columnQuery = valid();
    columnQuery.put("column_catalog_query", NamedParameterValue.columnRef(1));
    assertThrows(ParameterException.class, () -> PivotParameterResolver.resolve(arg(columnQuery), true));

    Map<String, NamedParameterValue> constantValues = valid();
    constantValues.put("value_columns", NamedParameterValue.constant("amount"));
    assertThrows(ParameterException.class, () -> PivotParameterResolver.resolve(arg(constantValues), true));
  }

  @Test
  void rejectsBlankQuery() {
    Map<String, NamedParameterValue> params = valid();
    params.put("column_catalog_query", NamedParameterValue.constant("   "));
    assertThrows(ParameterException.class, () -> PivotParameterResolver.resolve(arg(params), true));
  }

  @Test
  void groupColumnsMustBeDistinctButValueColumnsMayRepeat() throws Exception {
    Map<String, NamedParameterValue> repeatedGroup = valid();
    repeatedGroup.put("group_columns", NamedParameterValue.columnRefs(0, 0));
    assertThrows(ParameterException.class, () -> PivotParameterResolver.resolve(arg(repeatedGroup), true));

    Map<String, NamedParameterValue> repeatedValue = valid();
    repeatedValue.put("value_columns", NamedParameterValue.columnRefs(2, 2));
    assertEquals(List.of(2, 2), PivotParameterResolver.resolve(arg(repeatedValue), true).valueColumns());
  }

  @Test
  void checksColumnRangeOnlyWhenAsked() throws Exception {
    Map<String, NamedParameterValue> params = valid();
    params.put("value_columns", NamedParameterValue.columnRefs(7));
    assertThrows(ParameterException.class, () -> PivotParameterResolver.resolve(arg(params), true));
    assertEquals(List.of(7), PivotParameterResolver.resolve(arg(params), false).valueColumns());
  }
}
