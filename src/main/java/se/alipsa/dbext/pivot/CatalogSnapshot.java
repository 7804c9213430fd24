package se.alipsa.dbext.pivot;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.dbext.udx.CatalogCursor;
import se.alipsa.dbext.udx.CatalogQueryClient;
import se.alipsa.dbext.udx.ColumnDesc;
import se.alipsa.dbext.udx.InputRow;
import se.alipsa.dbext.udx.SchemaException;

/**
 * The result of one execution of the catalog query: the key column and, per catalog row, the
 * encoded key and the output column labels. Describe and Start both read the catalog through this
 * class so they derive keys the same way.
 *
 * @param keyColumn
 *          column 0 of the catalog result
 * @param entries
 *          one entry per catalog row, in row order
 */
public record CatalogSnapshot(ColumnDesc keyColumn, List<CatalogSnapshot.Entry> entries) {

  private static final Logger log = LoggerFactory.getLogger(CatalogSnapshot.class);

  /**
   * One catalog row.
   *
   * @param key
   *          the encoded pivot key
   * @param labels
   *          one output column name per value column
   */
  public record Entry(String key, List<String> labels) {

    /**
     * Validates and freezes the record components.
     */
    public Entry {
      Objects.requireNonNull(key, "key");
      labels = List.copyOf(labels);
    }
  }

  /**
   * Validates and freezes the record components.
   */
  public CatalogSnapshot {
    Objects.requireNonNull(keyColumn, "keyColumn");
    entries = List.copyOf(entries);
  }

  /**
   * Run the catalog query and read its result.
   *
   * @param client
   *          the host's catalog query facility
   * @param query
   *          the catalog query
   * @param valueColumnCount
   *          number of value columns, i.e. labels per catalog row
   * @return the snapshot
   * @throws SchemaException
   *           if the result has too few columns, non-character label columns, no rows, or
   *           {@code NULL} keys or labels
   * @throws UnsupportedKeyTypeException
   *           if column 0 is of a type that cannot be a pivot key
   * @throws SQLException
   *           if the host fails to run the query
   */
  public static CatalogSnapshot fetch(CatalogQueryClient client, String query, int valueColumnCount)
      throws SQLException {
    log.debug("Running column catalog query: {}", query);
    try (CatalogCursor cursor = client.open(query)) {
      List<ColumnDesc> schema = cursor.schema();
      int required = valueColumnCount + 1;
      if (schema.size() < required) {
        throw new SchemaException("Invalid column catalog query, must have at least " + required + " columns");
      }
      for (int i = 1; i <= valueColumnCount; i++) {
        if (!schema.get(i).type().isCharacter()) {
          throw new SchemaException("Invalid column catalog query, column " + i + " must be a string");
        }
      }
      ColumnDesc keyColumn = schema.get(0);
      PivotKeyKind kind = PivotKeyKind.of(keyColumn.type());

      List<Entry> entries = new ArrayList<>();
      InputRow row;
      while ((row = cursor.fetch()) != null) {
        int rowNumber = entries.size() + 1;
        if (row.isNull(0)) {
          throw new SchemaException("Column catalog query returned a NULL pivot key in row " + rowNumber);
        }
        List<String> labels = new ArrayList<>(valueColumnCount);
        for (int i = 1; i <= valueColumnCount; i++) {
          if (row.isNull(i)) {
            throw new SchemaException("Column catalog query returned a NULL column name in row " + rowNumber
                + ", column " + i);
          }
          labels.add(row.getString(i));
        }
        entries.add(new Entry(kind.encode(row, 0), labels));
      }
      if (entries.isEmpty()) {
        throw new SchemaException("Column catalog query returned no rows: " + query);
      }
      log.debug("Column catalog query returned {} pivot keys of type {}", entries.size(), keyColumn.type());
      return new CatalogSnapshot(keyColumn, entries);
    }
  }

  /**
   * Build the key map for this snapshot: each row's key gets the row's ordinal.
   *
   * @param valueColumnTypes
   *          types of the value columns to record in the map
   * @return the key map
   * @throws UnsupportedKeyTypeException
   *           if the key column type cannot be a pivot key
   */
  public PivotKeyMap toKeyMap(List<PivotKeyMap.TypeSpec> valueColumnTypes) throws UnsupportedKeyTypeException {
    PivotKeyMap.Builder builder = PivotKeyMap.builder(PivotKeyMap.TypeSpec.of(keyColumn), valueColumnTypes);
    for (Entry entry : entries) {
      builder.add(entry.key());
    }
    return builder.build();
  }
}
