package se.alipsa.dbext.pivot;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import se.alipsa.dbext.local.LocalSessionStore;
import se.alipsa.dbext.local.LocalTableArg;
import se.alipsa.dbext.local.StaticCatalogQueryClient;
import se.alipsa.dbext.udx.ColumnDesc;
import se.alipsa.dbext.udx.ColumnType;
import se.alipsa.dbext.udx.NamedParameterValue;

/** Unit tests for {@link PivotSchemaResolver}. */
class PivotSchemaResolverTest {

  static final String QUERY = "SELECT code, qty_label, note_label FROM statuses";

  static final List<ColumnDesc> INPUT = List.of(new ColumnDesc("region", ColumnType.VARCHAR, 10, false, 0, 0),
      new ColumnDesc("year", ColumnType.INTEGER, 0, false, 0, 0),
      new ColumnDesc("status", ColumnType.VARCHAR, 1, false, 0, 0),
      new ColumnDesc("qty", ColumnType.NUMERIC, 0, false, 12, 2), ColumnDesc.of("note", ColumnType.VARCHAR));

  static StaticCatalogQueryClient catalog() {
    return new StaticCatalogQueryClient().register(QUERY,
        List.of(ColumnDesc.of("code", ColumnType.VARCHAR), ColumnDesc.of("qty_label", ColumnType.VARCHAR),
            ColumnDesc.of("note_label", ColumnType.VARCHAR)),
        List.of(new Object[] {
            "A", "active_qty", "active_note"
        }, new Object[] {
            "I", "inactive_qty", "inactive_note"
        }, new Object[] {
            "P", "pending_qty", "pending_note"
        }));
  }

  static Map<String, NamedParameterValue> parameters() {
    return Map.of("pivot_column", NamedParameterValue.columnRef(2), "group_columns",
        NamedParameterValue.columnRefs(0, 1), "value_columns", NamedParameterValue.columnRefs(3, 4),
        "column_catalog_query", NamedParameterValue.constant(QUERY));
  }

  @Test
  void declaresGroupColumnsThenOneBlockPerCatalogRow() throws Exception {
    LocalTableArg arg = new LocalTableArg(parameters(), INPUT, catalog(), new LocalSessionStore());
    CatalogSnapshot snapshot = PivotSchemaResolver.describe(arg, false);

    assertEquals(3, snapshot.entries().size());
    List<ColumnDesc> out = arg.outputColumns();
    assertEquals(2 + 3 * 2, out.size());
    assertEquals(List.of("region", "year", "active_qty", "active_note", "inactive_qty", "inactive_note",
        "pending_qty", "pending_note"), out.stream().map(ColumnDesc::name).toList());
    assertEquals(INPUT.get(0), out.get(0));
    assertEquals(ColumnType.NUMERIC, out.get(4).type());
    assertEquals(12, out.get(4).precision());
    assertTrue(out.get(4).nullable(), "pivot columns are nullable even when the input is not");
    assertEquals(List.of(0, 1), arg.partitionByColumns());
    assertEquals(List.of(0, 1), arg.orderByColumns());
    assertTrue(arg.sessionCommandsEnabled());
  }

  @Test
  void capturesSnapshotOnlyWhenAsked() throws Exception {
    LocalSessionStore store = new LocalSessionStore();
    PivotSchemaResolver.describe(new LocalTableArg(parameters(), INPUT, catalog(), store), false);
    assertNull(store.get(PivotKeyMapCodec.DESCRIBE_SNAPSHOT_SLOT));

    PivotSchemaResolver.describe(new LocalTableArg(parameters(), INPUT, catalog(), store), true);
    PivotKeyMap map = PivotKeyMapCodec.restore(store, PivotKeyMapCodec.DESCRIBE_SNAPSHOT_SLOT);
    assertNotNull(map);
    assertEquals(2, map.offsetOf("P").getAsInt());
  }

  @Test
  void rejectsUnsupportedPivotColumnType() {
    List<ColumnDesc> input = List.of(ColumnDesc.of("region", ColumnType.VARCHAR), ColumnDesc.of("year",
        ColumnType.INTEGER), ColumnDesc.of("status", ColumnType.BOOLEAN), ColumnDesc.of("qty", ColumnType.NUMERIC),
        ColumnDesc.of("note", ColumnType.VARCHAR));
    LocalTableArg arg = new LocalTableArg(parameters(), input, catalog(), new LocalSessionStore());
    assertThrows(UnsupportedKeyTypeException.class, () -> PivotSchemaResolver.describe(arg, false));
  }
}
