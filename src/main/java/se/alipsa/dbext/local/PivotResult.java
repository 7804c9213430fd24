package se.alipsa.dbext.local;

import java.util.ArrayList;
import java.util.List;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import se.alipsa.dbext.udx.ColumnDesc;

/**
 * Output of a pivot execution: the declared output columns and the emitted rows in group order.
 *
 * @param columns
 *          the output schema
 * @param rows
 *          the output rows, one value per column
 */
public record PivotResult(List<ColumnDesc> columns, List<Object[]> rows) {

  /**
   * Freezes the record components.
   */
  public PivotResult {
    columns = List.copyOf(columns);
    rows = List.copyOf(rows);
  }

  /**
   * Find an output column by name.
   *
   * @param name
   *          the exact column name
   * @return the zero-based index
   * @throws IllegalArgumentException
   *           if there is no such column
   */
  public int columnIndex(String name) {
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).name().equals(name)) {
        return i;
      }
    }
    throw new IllegalArgumentException("No output column named " + name);
  }

  /**
   * Read one value.
   *
   * @param row
   *          zero-based row index
   * @param column
   *          the output column name
   * @return the value, possibly {@code null}
   */
  public Object value(int row, String column) {
    return rows.get(row)[columnIndex(column)];
  }

  /**
   * The Avro schema of the output.
   *
   * @return a record schema with one field per output column
   */
  public Schema schema() {
    return AvroColumnTypes.recordSchema("PivotResult", columns);
  }

  /**
   * The output as Avro records.
   *
   * @return one record per output row
   */
  public List<GenericRecord> toRecords() {
    Schema schema = schema();
    List<GenericRecord> records = new ArrayList<>(rows.size());
    for (Object[] row : rows) {
      records.add(AvroRows.toRecord(schema, row));
    }
    return records;
  }
}
