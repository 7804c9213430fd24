package se.alipsa.dbext.udx;

import static org.junit.jupiter.api.Assertions.*;

import java.sql.Types;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link NamedParameterValue} and {@link ColumnType}. */
class NamedParameterValueTest {

  @Test
  void singleElementListIsAColumnReference() {
    NamedParameterValue one = NamedParameterValue.columnRefs(4);
    assertEquals(ParameterKind.COLUMN_REF, one.kind());
    assertEquals(4, one.columnRef());

    NamedParameterValue many = NamedParameterValue.columnRefs(1, 2);
    assertEquals(ParameterKind.COLUMN_REF_LIST, many.kind());
    assertEquals(List.of(1, 2), many.columns());
    assertTrue(many.isColumnReference());
    assertThrows(IllegalStateException.class, many::columnRef);
  }

  @Test
  void constantsExposeTheirText() {
    NamedParameterValue c = NamedParameterValue.constant("SELECT 1, 'a'");
    assertFalse(c.isColumnReference());
    assertEquals("SELECT 1, 'a'", c.valueAsString());
    assertTrue(c.columns().isEmpty());
    assertThrows(IllegalStateException.class, c::columnRef);
  }

  @Test
  void mapsJdbcTypes() {
    assertEquals(ColumnType.NUMERIC, ColumnType.fromJdbcType(Types.DECIMAL));
    assertEquals(ColumnType.VARCHAR, ColumnType.fromJdbcType(Types.NVARCHAR));
    assertEquals(ColumnType.OTHER, ColumnType.fromJdbcType(Types.ARRAY));
    assertEquals(Types.REAL, ColumnType.FLOAT4.jdbcType());
    assertTrue(ColumnType.CHAR.isCharacter());
    assertFalse(ColumnType.VARBINARY.isCharacter());
  }
}
