package se.alipsa.dbext.pivot;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;
import se.alipsa.dbext.udx.ColumnType;

/** Unit tests for {@link PivotKeyMap}. */
class PivotKeyMapTest {

  private static final PivotKeyMap.TypeSpec VARCHAR = new PivotKeyMap.TypeSpec(ColumnType.VARCHAR, 20);
  private static final List<PivotKeyMap.TypeSpec> ONE_INT = List.of(new PivotKeyMap.TypeSpec(ColumnType.INTEGER, 0));

  @Test
  void assignsOffsetsInInsertionOrder() throws Exception {
    PivotKeyMap map = PivotKeyMap.builder(VARCHAR, ONE_INT).add("a").add("b").add("c").build();
    assertEquals(OptionalInt.of(0), map.offsetOf("a"));
    assertEquals(OptionalInt.of(2), map.offsetOf("c"));
    assertTrue(map.offsetOf("d").isEmpty());
    assertEquals(3, map.size());
    assertEquals(3, map.blockCount());
    assertEquals(PivotKeyKind.VARCHAR, map.keyKind());
    assertEquals(List.of("a", "b", "c"), List.copyOf(map.entries().keySet()));
  }

  @Test
  void duplicateKeyKeepsLastOffsetAndBlockCount() throws Exception {
    PivotKeyMap map = PivotKeyMap.builder(VARCHAR, ONE_INT).add("a").add("b").add("a").build();
    assertEquals(OptionalInt.of(2), map.offsetOf("a"));
    assertEquals(2, map.size());
    assertEquals(3, map.blockCount());
  }

  @Test
  void rejectsUnsupportedPivotType() {
    PivotKeyMap.Builder builder = PivotKeyMap.builder(new PivotKeyMap.TypeSpec(ColumnType.BOOLEAN, 0), ONE_INT)
        .add("true");
    assertThrows(UnsupportedKeyTypeException.class, builder::build);
  }

  @Test
  void mapsWithSameContentAreEqual() throws Exception {
    PivotKeyMap first = PivotKeyMap.builder(VARCHAR, ONE_INT).add("x").add("y").build();
    PivotKeyMap second = PivotKeyMap.builder(VARCHAR, ONE_INT).put("x", 0).put("y", 1).build();
    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    assertNotEquals(first, PivotKeyMap.builder(VARCHAR, ONE_INT).add("y").add("x").build());
  }
}
