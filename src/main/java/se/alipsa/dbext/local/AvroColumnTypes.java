package se.alipsa.dbext.local;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.sql.Date;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.avro.JsonProperties;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import se.alipsa.dbext.udx.ColumnDesc;
import se.alipsa.dbext.udx.ColumnType;

/**
 * Conversions between Avro schemas and values and the column model of the table function API.
 */
public final class AvroColumnTypes {

  /** Field property holding the column name when it is not a valid Avro name. */
  public static final String COLUMN_NAME_PROP = "dbext.columnName";

  private static final int DEFAULT_DECIMAL_PRECISION = 38;

  private AvroColumnTypes() {
  }

  /**
   * Collapse a nullable union to its non-null branch.
   *
   * @param schema
   *          the schema
   * @return the non-null branch, or {@code schema} itself when it is not a union
   */
  static Schema nonNullSchema(Schema schema) {
    if (schema.getType() == Schema.Type.UNION) {
      for (Schema s : schema.getTypes()) {
        if (s.getType() != Schema.Type.NULL) {
          return s;
        }
      }
    }
    return schema;
  }

  static boolean isNullable(Schema schema) {
    if (schema.getType() == Schema.Type.NULL) {
      return true;
    }
    if (schema.getType() == Schema.Type.UNION) {
      return schema.getTypes().stream().anyMatch(s -> s.getType() == Schema.Type.NULL);
    }
    return false;
  }

  /**
   * Describe every field of a record schema as a column.
   *
   * @param recordSchema
   *          an Avro record schema
   * @return the columns in field order
   */
  public static List<ColumnDesc> columns(Schema recordSchema) {
    List<ColumnDesc> columns = new ArrayList<>(recordSchema.getFields().size());
    for (Schema.Field field : recordSchema.getFields()) {
      String name = field.getProp(COLUMN_NAME_PROP);
      columns.add(column(name == null ? field.name() : name, field.schema()));
    }
    return columns;
  }

  /**
   * Describe one Avro field schema as a column.
   *
   * @param name
   *          the column name
   * @param fieldSchema
   *          the field schema, possibly a nullable union
   * @return the column description
   */
  public static ColumnDesc column(String name, Schema fieldSchema) {
    Schema base = nonNullSchema(fieldSchema);
    boolean nullable = isNullable(fieldSchema);
    LogicalType logical = base.getLogicalType();
    if (logical instanceof LogicalTypes.Decimal dec) {
      return new ColumnDesc(name, ColumnType.NUMERIC, 0, nullable, dec.getPrecision(), dec.getScale());
    }
    ColumnType type = switch (base.getType()) {
      case STRING, ENUM -> ColumnType.VARCHAR;
      case INT -> {
        if (logical instanceof LogicalTypes.Date) {
          yield ColumnType.DATE;
        }
        yield logical instanceof LogicalTypes.TimeMillis ? ColumnType.TIME : ColumnType.INTEGER;
      }
      case LONG -> {
        if (logical instanceof LogicalTypes.TimestampMillis || logical instanceof LogicalTypes.TimestampMicros) {
          yield ColumnType.TIMESTAMP;
        }
        yield logical instanceof LogicalTypes.TimeMicros ? ColumnType.TIME : ColumnType.BIGINT;
      }
      case FLOAT -> ColumnType.FLOAT4;
      case DOUBLE -> ColumnType.FLOAT8;
      case BOOLEAN -> ColumnType.BOOLEAN;
      case BYTES, FIXED -> ColumnType.VARBINARY;
      default -> ColumnType.OTHER;
    };
    return new ColumnDesc(name, type, 0, nullable, 0, 0);
  }

  /**
   * Build a record schema for a list of columns. Column names that are not valid Avro names are
   * sanitized and made unique; the original name is kept in the {@value #COLUMN_NAME_PROP} field
   * property so that {@link #columns(Schema)} restores it.
   *
   * @param recordName
   *          the name of the record
   * @param columns
   *          the columns
   * @return the record schema
   */
  public static Schema recordSchema(String recordName, List<ColumnDesc> columns) {
    List<Schema.Field> fields = new ArrayList<>(columns.size());
    Set<String> used = new HashSet<>();
    for (ColumnDesc column : columns) {
      String fieldName = uniqueName(sanitize(column.name()), used);
      Schema base = baseSchema(column);
      Schema fieldSchema = column.nullable()
          ? Schema.createUnion(Schema.create(Schema.Type.NULL), base)
          : base;
      Schema.Field field = new Schema.Field(fieldName, fieldSchema, null,
          column.nullable() ? JsonProperties.NULL_VALUE : null);
      if (!fieldName.equals(column.name())) {
        field.addProp(COLUMN_NAME_PROP, column.name());
      }
      fields.add(field);
    }
    return Schema.createRecord(sanitize(recordName), null, "se.alipsa.dbext", false, fields);
  }

  static Schema baseSchema(ColumnDesc column) {
    return switch (column.type()) {
      case BOOLEAN -> Schema.create(Schema.Type.BOOLEAN);
      case SMALLINT, INTEGER -> Schema.create(Schema.Type.INT);
      case BIGINT -> Schema.create(Schema.Type.LONG);
      case NUMERIC -> {
        int precision = column.precision() > 0 ? column.precision() : DEFAULT_DECIMAL_PRECISION;
        int scale = Math.min(column.scale(), precision);
        yield LogicalTypes.decimal(precision, scale).addToSchema(Schema.create(Schema.Type.BYTES));
      }
      case FLOAT4 -> Schema.create(Schema.Type.FLOAT);
      case FLOAT8 -> Schema.create(Schema.Type.DOUBLE);
      case DATE -> LogicalTypes.date().addToSchema(Schema.create(Schema.Type.INT));
      case TIME -> LogicalTypes.timeMillis().addToSchema(Schema.create(Schema.Type.INT));
      case TIMESTAMP -> LogicalTypes.timestampMillis().addToSchema(Schema.create(Schema.Type.LONG));
      case VARBINARY -> Schema.create(Schema.Type.BYTES);
      case CHAR, VARCHAR, OTHER -> Schema.create(Schema.Type.STRING);
    };
  }

  /**
   * Convert an Avro value to the Java value the table function API works with.
   *
   * @param value
   *          the Avro value
   * @param fieldSchema
   *          the field schema
   * @return the Java value, {@code null} for {@code null}
   */
  public static Object fromAvro(Object value, Schema fieldSchema) {
    if (value == null) {
      return null;
    }
    Schema base = nonNullSchema(fieldSchema);
    LogicalType logical = base.getLogicalType();
    switch (base.getType()) {
      case STRING, ENUM:
        return value.toString();
      case INT:
        if (logical instanceof LogicalTypes.Date) {
          return Date.valueOf(LocalDate.ofEpochDay(((Number) value).intValue()));
        }
        if (logical instanceof LogicalTypes.TimeMillis) {
          return Time.valueOf(LocalTime.ofNanoOfDay(((Number) value).intValue() * 1_000_000L));
        }
        return ((Number) value).intValue();
      case LONG: {
        long raw = ((Number) value).longValue();
        if (logical instanceof LogicalTypes.TimestampMillis) {
          return Timestamp.from(Instant.ofEpochMilli(raw));
        }
        if (logical instanceof LogicalTypes.TimestampMicros) {
          return Timestamp.from(Instant.ofEpochSecond(Math.floorDiv(raw, 1_000_000L),
              Math.floorMod(raw, 1_000_000L) * 1_000L));
        }
        return raw;
      }
      case FLOAT:
        return ((Number) value).floatValue();
      case DOUBLE:
        return ((Number) value).doubleValue();
      case BYTES, FIXED: {
        byte[] bytes = value instanceof GenericData.Fixed fixed ? fixed.bytes().clone() : copyBytes(value);
        if (logical instanceof LogicalTypes.Decimal dec) {
          return new BigDecimal(new BigInteger(bytes), dec.getScale());
        }
        return bytes;
      }
      default:
        return value;
    }
  }

  /**
   * Convert a Java value to the representation Avro expects for the field.
   *
   * @param value
   *          the Java value
   * @param fieldSchema
   *          the field schema
   * @return the Avro value, {@code null} for {@code null}
   */
  public static Object toAvro(Object value, Schema fieldSchema) {
    if (value == null) {
      return null;
    }
    Schema base = nonNullSchema(fieldSchema);
    LogicalType logical = base.getLogicalType();
    return switch (base.getType()) {
      case STRING, ENUM -> value.toString();
      case INT -> {
        if (logical instanceof LogicalTypes.Date) {
          yield (int) toLocalDate(value).toEpochDay();
        }
        if (logical instanceof LogicalTypes.TimeMillis) {
          yield (int) (((Time) value).toLocalTime().toNanoOfDay() / 1_000_000L);
        }
        yield ((Number) value).intValue();
      }
      case LONG -> {
        if (logical instanceof LogicalTypes.TimestampMillis) {
          yield ((Timestamp) value).getTime();
        }
        yield ((Number) value).longValue();
      }
      case FLOAT -> ((Number) value).floatValue();
      case DOUBLE -> ((Number) value).doubleValue();
      case BYTES -> {
        if (logical instanceof LogicalTypes.Decimal dec) {
          BigDecimal bd = value instanceof BigDecimal b ? b : new BigDecimal(value.toString());
          yield ByteBuffer.wrap(bd.setScale(dec.getScale(), RoundingMode.HALF_UP).unscaledValue().toByteArray());
        }
        if (value instanceof byte[] bytes) {
          yield ByteBuffer.wrap(bytes.clone());
        }
        yield ByteBuffer.wrap(value.toString().getBytes(StandardCharsets.UTF_8));
      }
      default -> value;
    };
  }

  private static LocalDate toLocalDate(Object value) {
    if (value instanceof Date d) {
      return d.toLocalDate();
    }
    if (value instanceof LocalDate ld) {
      return ld;
    }
    return LocalDate.parse(value.toString());
  }

  private static byte[] copyBytes(Object value) {
    if (value instanceof ByteBuffer buffer) {
      ByteBuffer duplicate = buffer.duplicate();
      byte[] bytes = new byte[duplicate.remaining()];
      duplicate.get(bytes);
      return bytes;
    }
    if (value instanceof byte[] bytes) {
      return bytes.clone();
    }
    return value.toString().getBytes(StandardCharsets.UTF_8);
  }

  static String sanitize(String name) {
    StringBuilder sb = new StringBuilder(name.length() + 1);
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      boolean valid = c == '_' || (c < 128 && Character.isLetterOrDigit(c));
      sb.append(valid ? c : '_');
    }
    if (sb.length() == 0 || Character.isDigit(sb.charAt(0))) {
      sb.insert(0, '_');
    }
    return sb.toString();
  }

  private static String uniqueName(String candidate, Set<String> used) {
    String name = candidate;
    int suffix = 2;
    while (!used.add(name)) {
      name = candidate + "_" + suffix++;
    }
    return name;
  }
}
