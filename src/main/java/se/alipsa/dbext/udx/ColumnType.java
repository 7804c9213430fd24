package se.alipsa.dbext.udx;

import java.sql.Types;

/**
 * Column type tags understood by table functions. The set mirrors the type system of the host
 * engine; only a subset of it can be used as a pivot key.
 */
public enum ColumnType {
  BOOLEAN(Types.BOOLEAN),
  SMALLINT(Types.SMALLINT),
  INTEGER(Types.INTEGER),
  BIGINT(Types.BIGINT),
  NUMERIC(Types.NUMERIC),
  FLOAT4(Types.REAL),
  FLOAT8(Types.DOUBLE),
  DATE(Types.DATE),
  TIME(Types.TIME),
  TIMESTAMP(Types.TIMESTAMP),
  CHAR(Types.CHAR),
  VARCHAR(Types.VARCHAR),
  VARBINARY(Types.VARBINARY),
  OTHER(Types.OTHER);

  private final int jdbcType;

  ColumnType(int jdbcType) {
    this.jdbcType = jdbcType;
  }

  /**
   * The {@link Types} constant closest to this column type.
   *
   * @return the JDBC type constant
   */
  public int jdbcType() {
    return jdbcType;
  }

  /**
   * Determine whether values of this type are character strings.
   *
   * @return {@code true} for {@link #CHAR} and {@link #VARCHAR}
   */
  public boolean isCharacter() {
    return this == CHAR || this == VARCHAR;
  }

  /**
   * Map a JDBC {@link Types} constant to a column type.
   *
   * @param jdbcType
   *          the JDBC type constant
   * @return the matching column type, {@link #OTHER} when there is no match
   */
  public static ColumnType fromJdbcType(int jdbcType) {
    return switch (jdbcType) {
      case Types.BIT, Types.BOOLEAN -> BOOLEAN;
      case Types.TINYINT, Types.SMALLINT -> SMALLINT;
      case Types.INTEGER -> INTEGER;
      case Types.BIGINT -> BIGINT;
      case Types.NUMERIC, Types.DECIMAL -> NUMERIC;
      case Types.REAL -> FLOAT4;
      case Types.FLOAT, Types.DOUBLE -> FLOAT8;
      case Types.DATE -> DATE;
      case Types.TIME, Types.TIME_WITH_TIMEZONE -> TIME;
      case Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE -> TIMESTAMP;
      case Types.CHAR, Types.NCHAR -> CHAR;
      case Types.VARCHAR, Types.NVARCHAR, Types.LONGVARCHAR, Types.LONGNVARCHAR, Types.CLOB, Types.NCLOB -> VARCHAR;
      case Types.BINARY, Types.VARBINARY, Types.LONGVARBINARY, Types.BLOB -> VARBINARY;
      default -> OTHER;
    };
  }
}
