package se.alipsa.dbext.pivot;

import java.math.BigDecimal;
import se.alipsa.dbext.udx.ColumnType;
import se.alipsa.dbext.udx.InputRow;

/**
 * The closed set of column types that can serve as pivot keys, each with its own encoding.
 */
public enum PivotKeyKind {

  TIMESTAMP(ColumnType.TIMESTAMP, Family.TEMPORAL) {
    @Override
    public String encode(InputRow row, int column) {
      return PivotKeyEncoder.encodeTimestamp(row.getTimestamp(column));
    }
  },
  DATE(ColumnType.DATE, Family.TEMPORAL) {
    @Override
    public String encode(InputRow row, int column) {
      return PivotKeyEncoder.encodeDate(row.getDate(column));
    }
  },
  BIGINT(ColumnType.BIGINT, Family.EXACT_NUMERIC) {
    @Override
    public String encode(InputRow row, int column) {
      return Long.toString(row.getBigInt(column));
    }
  },
  INTEGER(ColumnType.INTEGER, Family.EXACT_NUMERIC) {
    @Override
    public String encode(InputRow row, int column) {
      return Integer.toString(row.getInt(column));
    }
  },
  SMALLINT(ColumnType.SMALLINT, Family.EXACT_NUMERIC) {
    @Override
    public String encode(InputRow row, int column) {
      return Short.toString(row.getSmallInt(column));
    }
  },
  NUMERIC(ColumnType.NUMERIC, Family.EXACT_NUMERIC) {
    @Override
    public String encode(InputRow row, int column) {
      return PivotKeyEncoder.encodeNumeric(row.getNumeric(column));
    }
  },
  FLOAT4(ColumnType.FLOAT4, Family.APPROXIMATE_NUMERIC) {
    @Override
    public String encode(InputRow row, int column) {
      return PivotKeyEncoder.encodeFloat4(row.getFloat4(column));
    }
  },
  FLOAT8(ColumnType.FLOAT8, Family.APPROXIMATE_NUMERIC) {
    @Override
    public String encode(InputRow row, int column) {
      return PivotKeyEncoder.encodeFloat8(row.getFloat8(column));
    }
  },
  VARCHAR(ColumnType.VARCHAR, Family.CHARACTER) {
    @Override
    public String encode(InputRow row, int column) {
      return row.getString(column);
    }
  },
  CHAR(ColumnType.CHAR, Family.CHARACTER) {
    @Override
    public String encode(InputRow row, int column) {
      return row.getString(column);
    }
  };

  /** Groups of kinds whose values can be expected to encode alike. */
  public enum Family {
    TEMPORAL,
    EXACT_NUMERIC,
    APPROXIMATE_NUMERIC,
    CHARACTER
  }

  private final ColumnType columnType;
  private final Family family;

  PivotKeyKind(ColumnType columnType, Family family) {
    this.columnType = columnType;
    this.family = family;
  }

  /**
   * Encode a non-null value of this kind.
   *
   * @param row
   *          the row holding the value
   * @param column
   *          zero-based column index
   * @return the canonical key string
   */
  public abstract String encode(InputRow row, int column);

  /**
   * Encode a non-null value declared as {@code source} into the key form of this kind. The value is
   * read in its own type and converted only when the conversion is exact; values of another family,
   * and temporal values of the other temporal kind, have no key of this kind.
   *
   * @param source
   *          the declared kind of the column
   * @param row
   *          the row holding the value
   * @param column
   *          zero-based column index
   * @return the canonical key string, or {@code null} when the value has no exact key of this kind
   */
  public String encodeFrom(PivotKeyKind source, InputRow row, int column) {
    if (source == this) {
      return encode(row, column);
    }
    if (source.family != family) {
      return null;
    }
    switch (family) {
      case EXACT_NUMERIC:
        return exactKey(source.exactValue(row, column));
      case APPROXIMATE_NUMERIC:
        double value = source == FLOAT4 ? row.getFloat4(column) : row.getFloat8(column);
        if (this == FLOAT8) {
          return PivotKeyEncoder.encodeFloat8(value);
        }
        float narrowed = (float) value;
        return narrowed == value ? PivotKeyEncoder.encodeFloat4(narrowed) : null;
      case CHARACTER:
        return row.getString(column);
      default:
        return null;
    }
  }

  private BigDecimal exactValue(InputRow row, int column) {
    switch (this) {
      case BIGINT:
        return BigDecimal.valueOf(row.getBigInt(column));
      case INTEGER:
        return BigDecimal.valueOf(row.getInt(column));
      case SMALLINT:
        return BigDecimal.valueOf(row.getSmallInt(column));
      default:
        return row.getNumeric(column);
    }
  }

  private String exactKey(BigDecimal value) {
    try {
      switch (this) {
        case BIGINT:
          return Long.toString(value.longValueExact());
        case INTEGER:
          return Integer.toString(value.intValueExact());
        case SMALLINT:
          return Short.toString(value.shortValueExact());
        default:
          return PivotKeyEncoder.encodeNumeric(value);
      }
    } catch (ArithmeticException e) {
      return null;
    }
  }

  public ColumnType columnType() {
    return columnType;
  }

  public Family family() {
    return family;
  }

  /**
   * Resolve the key kind for a column type.
   *
   * @param type
   *          the column type
   * @return the matching kind
   * @throws UnsupportedKeyTypeException
   *           if values of {@code type} cannot be used as pivot keys
   */
  public static PivotKeyKind of(ColumnType type) throws UnsupportedKeyTypeException {
    for (PivotKeyKind kind : values()) {
      if (kind.columnType == type) {
        return kind;
      }
    }
    throw new UnsupportedKeyTypeException(type);
  }

  /**
   * Whether a column type can be used as a pivot key.
   *
   * @param type
   *          the column type
   * @return {@code true} when {@link #of(ColumnType)} succeeds for {@code type}
   */
  public static boolean supports(ColumnType type) {
    for (PivotKeyKind kind : values()) {
      if (kind.columnType == type) {
        return true;
      }
    }
    return false;
  }
}
