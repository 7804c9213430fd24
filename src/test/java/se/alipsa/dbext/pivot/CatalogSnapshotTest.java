package se.alipsa.dbext.pivot;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.dbext.local.StaticCatalogQueryClient;
import se.alipsa.dbext.udx.ColumnDesc;
import se.alipsa.dbext.udx.ColumnType;
import se.alipsa.dbext.udx.SchemaException;

/** Unit tests for {@link CatalogSnapshot}. */
class CatalogSnapshotTest {

  private static final String QUERY = "SELECT k, l FROM catalog";

  private static StaticCatalogQueryClient client(List<ColumnDesc> schema, List<Object[]> rows) {
    return new StaticCatalogQueryClient().register(QUERY, schema, rows);
  }

  @Test
  void readsKeysAndLabelsInRowOrder() throws Exception {
    StaticCatalogQueryClient client = client(
        List.of(ColumnDesc.of("k", ColumnType.NUMERIC), ColumnDesc.of("l", ColumnType.VARCHAR)),
        List.of(new Object[] {
            new BigDecimal("2.50"), "two and a half"
        }, new Object[] {
            BigDecimal.ONE, "one"
        }));
    CatalogSnapshot snapshot = CatalogSnapshot.fetch(client, QUERY, 1);
    assertEquals(ColumnType.NUMERIC, snapshot.keyColumn().type());
    assertEquals(2, snapshot.entries().size());
    assertEquals("2.5", snapshot.entries().get(0).key());
    assertEquals(List.of("one"), snapshot.entries().get(1).labels());

    PivotKeyMap map = snapshot.toKeyMap(List.of(new PivotKeyMap.TypeSpec(ColumnType.INTEGER, 0)));
    assertEquals(1, map.offsetOf("1").getAsInt());
  }

  @Test
  void failsOnTooFewColumns() {
    StaticCatalogQueryClient client = client(
        List.of(ColumnDesc.of("k", ColumnType.VARCHAR), ColumnDesc.of("l", ColumnType.VARCHAR)),
        List.<Object[]>of(new Object[] {
            "a", "A"
        }));
    SchemaException e = assertThrows(SchemaException.class, () -> CatalogSnapshot.fetch(client, QUERY, 2));
    assertEquals("Invalid column catalog query, must have at least 3 columns", e.getMessage());
  }

  @Test
  void failsOnNonCharacterLabels() {
    StaticCatalogQueryClient client = client(
        List.of(ColumnDesc.of("k", ColumnType.VARCHAR), ColumnDesc.of("l", ColumnType.INTEGER)),
        List.<Object[]>of(new Object[] {
            "a", 1
        }));
    assertThrows(SchemaException.class, () -> CatalogSnapshot.fetch(client, QUERY, 1));
  }

  @Test
  void failsOnUnsupportedKeyType() {
    StaticCatalogQueryClient client = client(
        List.of(ColumnDesc.of("k", ColumnType.BOOLEAN), ColumnDesc.of("l", ColumnType.VARCHAR)),
        List.<Object[]>of(new Object[] {
            true, "yes"
        }));
    assertThrows(UnsupportedKeyTypeException.class, () -> CatalogSnapshot.fetch(client, QUERY, 1));
  }

  @Test
  void failsOnEmptyResultAndNulls() {
    List<ColumnDesc> schema = List.of(ColumnDesc.of("k", ColumnType.VARCHAR), ColumnDesc.of("l", ColumnType.VARCHAR));
    assertThrows(SchemaException.class, () -> CatalogSnapshot.fetch(client(schema, List.of()), QUERY, 1));
    assertThrows(SchemaException.class, () -> CatalogSnapshot.fetch(client(schema, List.<Object[]>of(new Object[] {
        null, "x"
    })), QUERY, 1));
    assertThrows(SchemaException.class, () -> CatalogSnapshot.fetch(client(schema, List.<Object[]>of(new Object[] {
        "x", null
    })), QUERY, 1));
  }
}
