package se.alipsa.dbext.pivot;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.avro.AvroRuntimeException;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.BinaryDecoder;
import org.apache.avro.io.BinaryEncoder;
import org.apache.avro.io.DecoderFactory;
import org.apache.avro.io.EncoderFactory;
import se.alipsa.dbext.udx.ColumnType;
import se.alipsa.dbext.udx.SessionStore;
import se.alipsa.dbext.udx.TableFunctionException;

/**
 * Serializes a {@link PivotKeyMap} to the opaque blob kept in the session store. The blob is an
 * Avro binary record holding the pivot column type and length, the value column types and lengths,
 * the entry and block counts, followed by the (key, offset) pairs.
 */
public final class PivotKeyMapCodec {

  /** Session slot holding the map published at Start. */
  public static final String KEY_MAP_SLOT = "pivot.keymap";

  /** Session slot holding the map captured at Describe, when snapshot reuse is enabled. */
  public static final String DESCRIBE_SNAPSHOT_SLOT = "pivot.describe-snapshot";

  private static final String NAMESPACE = "se.alipsa.dbext.pivot";

  private static final Schema TYPE_SPEC_SCHEMA = SchemaBuilder.record("TypeSpec").namespace(NAMESPACE).fields()
      .requiredString("type").requiredInt("length").endRecord();

  private static final Schema ENTRY_SCHEMA = SchemaBuilder.record("Entry").namespace(NAMESPACE).fields()
      .requiredString("key").requiredInt("offset").endRecord();

  /** The Avro schema of the session blob. */
  public static final Schema SCHEMA = SchemaBuilder.record("PivotKeyMap").namespace(NAMESPACE).fields()
      .requiredString("pivotColumnType").requiredInt("pivotColumnLength").name("valueColumns").type().array()
      .items(TYPE_SPEC_SCHEMA).noDefault().requiredInt("entryCount").requiredInt("blockCount").name("entries")
      .type().array().items(ENTRY_SCHEMA).noDefault().endRecord();

  private static final String STATE_ERROR = "58030";

  private PivotKeyMapCodec() {
  }

  /**
   * Serialize a map.
   *
   * @param map
   *          the map to serialize
   * @return the Avro binary encoding of the map
   * @throws TableFunctionException
   *           if encoding fails
   */
  public static byte[] serialize(PivotKeyMap map) throws TableFunctionException {
    GenericData.Record record = new GenericData.Record(SCHEMA);
    record.put("pivotColumnType", map.pivotColumnType().type().name());
    record.put("pivotColumnLength", map.pivotColumnType().length());
    List<GenericRecord> valueColumns = new ArrayList<>(map.valueColumnTypes().size());
    for (PivotKeyMap.TypeSpec spec : map.valueColumnTypes()) {
      GenericData.Record typeSpec = new GenericData.Record(TYPE_SPEC_SCHEMA);
      typeSpec.put("type", spec.type().name());
      typeSpec.put("length", spec.length());
      valueColumns.add(typeSpec);
    }
    record.put("valueColumns", valueColumns);
    record.put("entryCount", map.size());
    record.put("blockCount", map.blockCount());
    List<GenericRecord> entries = new ArrayList<>(map.size());
    for (Map.Entry<String, Integer> e : map.entries().entrySet()) {
      GenericData.Record entry = new GenericData.Record(ENTRY_SCHEMA);
      entry.put("key", e.getKey());
      entry.put("offset", e.getValue());
      entries.add(entry);
    }
    record.put("entries", entries);

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      BinaryEncoder encoder = EncoderFactory.get().binaryEncoder(out, null);
      new GenericDatumWriter<GenericRecord>(SCHEMA).write(record, encoder);
      encoder.flush();
    } catch (IOException | AvroRuntimeException e) {
      throw new TableFunctionException("Failed to serialize pivot key map: " + e.getMessage(), STATE_ERROR, e);
    }
    return out.toByteArray();
  }

  /**
   * Restore a map from its serialized form.
   *
   * @param blob
   *          bytes produced by {@link #serialize(PivotKeyMap)}
   * @return the restored map
   * @throws TableFunctionException
   *           if the blob is corrupt or names an unknown type
   */
  public static PivotKeyMap deserialize(byte[] blob) throws TableFunctionException {
    GenericRecord record;
    try {
      BinaryDecoder decoder = DecoderFactory.get().binaryDecoder(blob, null);
      record = new GenericDatumReader<GenericRecord>(SCHEMA).read(null, decoder);
    } catch (IOException | AvroRuntimeException e) {
      throw new TableFunctionException("Failed to deserialize pivot key map: " + e.getMessage(), STATE_ERROR, e);
    }
    PivotKeyMap.TypeSpec pivotType = new PivotKeyMap.TypeSpec(
        columnType(record.get("pivotColumnType")), (Integer) record.get("pivotColumnLength"));
    List<PivotKeyMap.TypeSpec> valueTypes = new ArrayList<>();
    for (Object o : (List<?>) record.get("valueColumns")) {
      GenericRecord spec = (GenericRecord) o;
      valueTypes.add(new PivotKeyMap.TypeSpec(columnType(spec.get("type")), (Integer) spec.get("length")));
    }
    int entryCount = (Integer) record.get("entryCount");
    int blockCount = (Integer) record.get("blockCount");
    List<?> entries = (List<?>) record.get("entries");
    if (entries.size() != entryCount) {
      throw new TableFunctionException(
          "Corrupt pivot key map: expected " + entryCount + " entries but found " + entries.size(), STATE_ERROR);
    }
    PivotKeyMap.Builder builder = PivotKeyMap.builder(pivotType, valueTypes);
    for (Object o : entries) {
      GenericRecord entry = (GenericRecord) o;
      int offset = (Integer) entry.get("offset");
      if (offset < 0 || offset >= blockCount) {
        throw new TableFunctionException(
            "Corrupt pivot key map: offset " + offset + " outside [0, " + blockCount + ")", STATE_ERROR);
      }
      builder.put(entry.get("key").toString(), offset);
    }
    return builder.blockCount(blockCount).build();
  }

  /**
   * Serialize a map into a session slot.
   *
   * @param store
   *          the session store
   * @param slot
   *          the slot name
   * @param map
   *          the map to store
   * @throws TableFunctionException
   *           if encoding fails
   */
  public static void store(SessionStore store, String slot, PivotKeyMap map) throws TableFunctionException {
    store.put(slot, serialize(map));
  }

  /**
   * Restore a map from a session slot.
   *
   * @param store
   *          the session store
   * @param slot
   *          the slot name
   * @return the map, or {@code null} when the slot is empty
   * @throws TableFunctionException
   *           if the stored blob cannot be decoded
   */
  public static PivotKeyMap restore(SessionStore store, String slot) throws TableFunctionException {
    byte[] blob = store.get(slot);
    return blob == null ? null : deserialize(blob);
  }

  private static ColumnType columnType(Object name) throws TableFunctionException {
    try {
      return ColumnType.valueOf(name.toString());
    } catch (IllegalArgumentException e) {
      throw new TableFunctionException("Corrupt pivot key map: unknown column type " + name, STATE_ERROR, e);
    }
  }
}
