package se.alipsa.dbext.pivot;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Date;
import java.sql.Timestamp;
import se.alipsa.dbext.udx.ColumnType;
import se.alipsa.dbext.udx.InputRow;

/**
 * Canonical, locale independent string forms of pivot key values. The same value always encodes to
 * the same string, whether it comes from a catalog row or from an input row.
 */
public final class PivotKeyEncoder {

  private static final long MICROS_PER_SECOND = 1_000_000L;
  private static final long MAX_EXACT_SECONDS = Long.MAX_VALUE / MICROS_PER_SECOND - 1;

  private PivotKeyEncoder() {
  }

  /**
   * Encode the value of a column using the encoding of the given type.
   *
   * @param row
   *          the row holding the value
   * @param column
   *          zero-based column index, the value must not be {@code null}
   * @param type
   *          the key type recorded for the pivot column
   * @return the encoded key
   * @throws UnsupportedKeyTypeException
   *           if {@code type} cannot be used as a pivot key
   */
  public static String encode(InputRow row, int column, ColumnType type) throws UnsupportedKeyTypeException {
    return PivotKeyKind.of(type).encode(row, column);
  }

  /**
   * Microseconds since the Unix epoch. Instants too far from the epoch for a signed 64-bit count are
   * rendered exactly.
   *
   * @param value
   *          the timestamp
   * @return the tick count in decimal
   */
  public static String encodeTimestamp(Timestamp value) {
    long seconds = Math.floorDiv(value.getTime(), 1000L);
    long micros = value.getNanos() / 1000L;
    if (Math.abs(seconds) <= MAX_EXACT_SECONDS) {
      return Long.toString(seconds * MICROS_PER_SECOND + micros);
    }
    return BigInteger.valueOf(seconds).multiply(BigInteger.valueOf(MICROS_PER_SECOND))
        .add(BigInteger.valueOf(micros)).toString();
  }

  /**
   * Days since the Unix epoch.
   *
   * @param value
   *          the date
   * @return the day count in decimal
   */
  public static String encodeDate(Date value) {
    return Long.toString(value.toLocalDate().toEpochDay());
  }

  /**
   * Plain decimal notation without trailing zeros, so numerically equal values of different scale
   * share a key.
   *
   * @param value
   *          the numeric value
   * @return the canonical decimal text
   */
  public static String encodeNumeric(BigDecimal value) {
    if (value.signum() == 0) {
      return "0";
    }
    return value.stripTrailingZeros().toPlainString();
  }

  public static String encodeFloat4(float value) {
    // -0.0 and 0.0 compare equal in SQL
    return value == 0.0f ? "0.0" : Float.toString(value);
  }

  public static String encodeFloat8(double value) {
    return value == 0.0d ? "0.0" : Double.toString(value);
  }
}
