package se.alipsa.dbext.local;

import java.util.List;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import se.alipsa.dbext.udx.InputRow;

/** Moves rows between Avro records and the table function row API. */
public final class AvroRows {

  private AvroRows() {
  }

  /**
   * Wrap an Avro record as an input row, converting logical types to their Java form.
   *
   * @param record
   *          the record
   * @return the input row
   */
  public static InputRow toInputRow(GenericRecord record) {
    List<Schema.Field> fields = record.getSchema().getFields();
    Object[] values = new Object[fields.size()];
    for (Schema.Field field : fields) {
      values[field.pos()] = AvroColumnTypes.fromAvro(record.get(field.pos()), field.schema());
    }
    return new ArrayInputRow(values);
  }

  /**
   * Build an Avro record from Java values.
   *
   * @param schema
   *          the record schema
   * @param values
   *          the values in field order
   * @return the record
   */
  public static GenericRecord toRecord(Schema schema, Object[] values) {
    List<Schema.Field> fields = schema.getFields();
    if (values.length != fields.size()) {
      throw new IllegalArgumentException(
          "Expected " + fields.size() + " values for " + schema.getName() + " but got " + values.length);
    }
    GenericData.Record record = new GenericData.Record(schema);
    for (Schema.Field field : fields) {
      record.put(field.pos(), AvroColumnTypes.toAvro(values[field.pos()], field.schema()));
    }
    return record;
  }
}
