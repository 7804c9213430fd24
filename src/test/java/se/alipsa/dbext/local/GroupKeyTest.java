package se.alipsa.dbext.local;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;

class GroupKeyTest {

  @Test
  void largeMixedNumbersStayDistinct() {
    // both collapse to 9007199254740992.0 as doubles
    Long above = 9_007_199_254_740_993L;
    BigInteger below = BigInteger.valueOf(9_007_199_254_740_992L);
    assertTrue(GroupKey.compareValues(above, below) > 0);
    assertTrue(GroupKey.compareValues(below, above) < 0);
    assertEquals(0, GroupKey.compareValues(10L, new BigDecimal("10.0")));

    TreeMap<GroupKey, String> groups = new TreeMap<>();
    groups.put(GroupKey.of(new ArrayInputRow(above), List.of(0)), "above");
    groups.put(GroupKey.of(new ArrayInputRow(below), List.of(0)), "below");
    assertEquals(List.of("below", "above"), List.copyOf(groups.values()));
  }

  @Test
  void nullsSortLast() {
    assertTrue(GroupKey.compareValues(null, 1) > 0);
    assertTrue(GroupKey.compareValues("a", null) < 0);
    assertEquals(0, GroupKey.compareValues(null, null));
  }

  @Test
  void nonFiniteDoublesStillOrder() {
    assertTrue(GroupKey.compareValues(Double.POSITIVE_INFINITY, 5L) > 0);
    assertTrue(GroupKey.compareValues(1, Float.NaN) < 0);
  }
}
