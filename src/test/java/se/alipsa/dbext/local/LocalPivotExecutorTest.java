package se.alipsa.dbext.local;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.dbext.pivot.NullPivotKeyException;
import se.alipsa.dbext.pivot.PivotKeyNotFoundException;
import se.alipsa.dbext.udx.ColumnDesc;
import se.alipsa.dbext.udx.ColumnType;
import se.alipsa.dbext.udx.InputRow;
import se.alipsa.dbext.udx.ParameterException;

/** End to end tests of the pivot function through {@link LocalPivotExecutor}. */
class LocalPivotExecutorTest {

  private static final String QUERY = "SELECT code, label FROM order_status";

  private static final List<ColumnDesc> INPUT = List.of(ColumnDesc.of("region", ColumnType.VARCHAR),
      ColumnDesc.of("status", ColumnType.VARCHAR), ColumnDesc.of("amount", ColumnType.INTEGER));

  private static final PivotInvocation INVOCATION = new PivotInvocation("status", List.of("region"),
      List.of("amount"), QUERY);

  private static StaticCatalogQueryClient catalog() {
    return new StaticCatalogQueryClient().register(QUERY,
        List.of(ColumnDesc.of("code", ColumnType.VARCHAR), ColumnDesc.of("label", ColumnType.VARCHAR)),
        List.of(new Object[] {
            "OPEN", "open_amt"
        }, new Object[] {
            "CLOSED", "closed_amt"
        }));
  }

  private static LocalPivotExecutor executor(StaticCatalogQueryClient catalog, String settings) {
    return new LocalPivotExecutor(catalog, LocalExecutorConfig.parse(settings));
  }

  @Test
  void pivotsRowsOfOneGroup() throws Exception {
    List<InputRow> rows = List.of(new ArrayInputRow("east", "OPEN", 10), new ArrayInputRow("east", "CLOSED", 5));
    PivotResult result = executor(catalog(), "workers=1").execute(INPUT, rows, INVOCATION);

    assertEquals(List.of("region", "open_amt", "closed_amt"), result.columns().stream().map(ColumnDesc::name)
        .toList());
    assertEquals(1, result.rows().size());
    assertEquals("east", result.value(0, "region"));
    assertEquals(10, result.value(0, "open_amt"));
    assertEquals(5, result.value(0, "closed_amt"));
  }

  @Test
  void sameOutputForAnyNumberOfWorkers() throws Exception {
    List<InputRow> rows = new ArrayList<>();
    for (int i = 0; i < 40; i++) {
      String region = "r" + (char) ('a' + (i * 7) % 13);
      rows.add(new ArrayInputRow(region, i % 3 == 0 ? "OPEN" : "CLOSED", i));
    }
    PivotResult single = executor(catalog(), "workers=1").execute(INPUT, rows, INVOCATION);
    PivotResult parallel = executor(catalog(), "workers=4").execute(INPUT, rows, INVOCATION);

    assertEquals(13, single.rows().size());
    assertEquals(single.rows().size(), parallel.rows().size());
    for (int i = 0; i < single.rows().size(); i++) {
      assertArrayEquals(single.rows().get(i), parallel.rows().get(i), "row " + i);
    }
    assertEquals("ra", single.value(0, "region"));
    assertEquals("rm", single.value(12, "region"));
  }

  @Test
  void nullPivotValueFailsWholeQuery() {
    List<InputRow> rows = List.of(new ArrayInputRow("east", "OPEN", 1), new ArrayInputRow("west", null, 2),
        new ArrayInputRow("north", "CLOSED", 3));
    assertThrows(NullPivotKeyException.class, () -> executor(catalog(), "workers=2").execute(INPUT, rows,
        INVOCATION));
  }

  @Test
  void unknownPivotValueFailsWholeQuery() {
    List<InputRow> rows = List.of(new ArrayInputRow("east", "PENDING", 1));
    PivotKeyNotFoundException e = assertThrows(PivotKeyNotFoundException.class,
        () -> executor(catalog(), "workers=1").execute(INPUT, rows, INVOCATION));
    assertEquals("PENDING", e.getKey());
  }

  private static final String INT_QUERY = "SELECT bucket, label FROM buckets";

  private static StaticCatalogQueryClient integerCatalog() {
    return new StaticCatalogQueryClient().register(INT_QUERY,
        List.of(ColumnDesc.of("bucket", ColumnType.INTEGER), ColumnDesc.of("label", ColumnType.VARCHAR)),
        List.of(new Object[] {
            1, "one"
        }, new Object[] {
            10, "ten"
        }));
  }

  private static List<ColumnDesc> inputWithPivotType(ColumnType pivotType) {
    return List.of(ColumnDesc.of("g", ColumnType.VARCHAR), ColumnDesc.of("p", pivotType),
        ColumnDesc.of("v", ColumnType.INTEGER));
  }

  private static final PivotInvocation BUCKETS = new PivotInvocation("p", List.of("g"), List.of("v"), INT_QUERY);

  @Test
  void wideExactValuesMatchNarrowerCatalogKeys() throws Exception {
    PivotResult fromBigint = executor(integerCatalog(), "workers=1").execute(inputWithPivotType(ColumnType.BIGINT),
        List.of(new ArrayInputRow("a", 10L, 3), new ArrayInputRow("a", 1L, 4)), BUCKETS);
    assertEquals(3, fromBigint.value(0, "ten"));
    assertEquals(4, fromBigint.value(0, "one"));

    PivotResult fromNumeric = executor(integerCatalog(), "workers=1").execute(
        inputWithPivotType(ColumnType.NUMERIC), List.of(new ArrayInputRow("a", new BigDecimal("10.00"), 7)),
        BUCKETS);
    assertEquals(7, fromNumeric.value(0, "ten"));
    assertNull(fromNumeric.value(0, "one"));
  }

  @Test
  void bigintBeyondIntegerRangeIsNotFound() {
    List<InputRow> rows = List.of(new ArrayInputRow("a", 4294967297L, 99));
    PivotKeyNotFoundException e = assertThrows(PivotKeyNotFoundException.class,
        () -> executor(integerCatalog(), "workers=1").execute(inputWithPivotType(ColumnType.BIGINT), rows, BUCKETS));
    assertEquals("4294967297", e.getKey());
  }

  @Test
  void fractionalNumericIsNotFound() {
    List<InputRow> rows = List.of(new ArrayInputRow("a", new BigDecimal("10.7"), 7));
    PivotKeyNotFoundException e = assertThrows(PivotKeyNotFoundException.class,
        () -> executor(integerCatalog(), "workers=2").execute(inputWithPivotType(ColumnType.NUMERIC), rows,
            BUCKETS));
    assertEquals("10.7", e.getKey());
  }

  @Test
  void reuseDescribeSnapshotRunsCatalogQueryOnce() throws Exception {
    StaticCatalogQueryClient reusing = catalog();
    executor(reusing, "reuseDescribeSnapshot=true").execute(INPUT, List.of(new ArrayInputRow("a", "OPEN", 1)),
        INVOCATION);
    assertEquals(1, reusing.executionCount(QUERY));

    StaticCatalogQueryClient requerying = catalog();
    executor(requerying, "").execute(INPUT, List.of(new ArrayInputRow("a", "OPEN", 1)), INVOCATION);
    assertEquals(2, requerying.executionCount(QUERY));
  }

  @Test
  void resolvesColumnNamesCaseInsensitivelyUnlessConfigured() throws Exception {
    PivotInvocation upper = new PivotInvocation("STATUS", List.of("Region"), List.of("amount"), QUERY);
    List<InputRow> rows = List.of(new ArrayInputRow("east", "OPEN", 1));
    assertEquals(1, executor(catalog(), "").execute(INPUT, rows, upper).rows().size());
    assertThrows(ParameterException.class, () -> executor(catalog(), "caseSensitive=true").execute(INPUT, rows,
        upper));
    PivotInvocation quoted = new PivotInvocation("\"STATUS\"", List.of("region"), List.of("amount"), QUERY);
    assertThrows(ParameterException.class, () -> executor(catalog(), "").execute(INPUT, rows, quoted));
  }

  @Test
  void emptyInputProducesNoRows() throws Exception {
    PivotResult result = executor(catalog(), "workers=3").execute(INPUT, List.of(), INVOCATION);
    assertTrue(result.rows().isEmpty());
    assertEquals(3, result.columns().size());
  }

  @Test
  void resultConvertsToAvroRecords() throws Exception {
    List<InputRow> rows = List.of(new ArrayInputRow("east", "CLOSED", 7));
    PivotResult result = executor(catalog(), "workers=1").execute(INPUT, rows, INVOCATION);
    var record = result.toRecords().get(0);
    assertEquals("east", record.get("region").toString());
    assertNull(record.get("open_amt"));
    assertEquals(7, record.get("closed_amt"));
  }
}
