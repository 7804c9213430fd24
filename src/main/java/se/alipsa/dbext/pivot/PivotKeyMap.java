package se.alipsa.dbext.pivot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.dbext.udx.ColumnDesc;
import se.alipsa.dbext.udx.ColumnType;

/**
 * Immutable mapping from encoded pivot key to the ordinal of its block of output columns. A map is
 * built once per session from the catalog query and shared read-only by every worker.
 *
 * <p>
 * Offsets are assigned in catalog row order. The number of offset blocks equals the number of
 * catalog rows, which is also the number of value column blocks declared at Describe.
 */
public final class PivotKeyMap {

  private static final Logger log = LoggerFactory.getLogger(PivotKeyMap.class);

  /**
   * Type and length of a column as recorded in the map.
   *
   * @param type
   *          the column type
   * @param length
   *          the declared length, {@code 0} when unspecified
   */
  public record TypeSpec(ColumnType type, int length) {

    /**
     * Validates the record components.
     */
    public TypeSpec {
      Objects.requireNonNull(type, "type");
    }

    /**
     * The type recorded for a column description.
     *
     * @param column
     *          the column
     * @return its type and length
     */
    public static TypeSpec of(ColumnDesc column) {
      return new TypeSpec(column.type(), column.length());
    }
  }

  private final TypeSpec pivotColumnType;
  private final List<TypeSpec> valueColumnTypes;
  private final Map<String, Integer> offsets;
  private final int blockCount;
  private final PivotKeyKind keyKind;

  private PivotKeyMap(Builder builder) throws UnsupportedKeyTypeException {
    this.pivotColumnType = builder.pivotColumnType;
    this.valueColumnTypes = List.copyOf(builder.valueColumnTypes);
    this.offsets = Collections.unmodifiableMap(new LinkedHashMap<>(builder.offsets));
    this.blockCount = builder.blockCount;
    this.keyKind = PivotKeyKind.of(pivotColumnType.type());
  }

  /**
   * Start building a map.
   *
   * @param pivotColumnType
   *          type of the key column of the catalog query
   * @param valueColumnTypes
   *          types of the value columns, in parameter order
   * @return a new builder
   */
  public static Builder builder(TypeSpec pivotColumnType, List<TypeSpec> valueColumnTypes) {
    return new Builder(pivotColumnType, valueColumnTypes);
  }

  /**
   * Look up the offset block of an encoded key.
   *
   * @param key
   *          the encoded key
   * @return the zero-based block ordinal, empty when the key is unknown
   */
  public OptionalInt offsetOf(String key) {
    Integer offset = offsets.get(key);
    return offset == null ? OptionalInt.empty() : OptionalInt.of(offset);
  }

  public TypeSpec pivotColumnType() {
    return pivotColumnType;
  }

  public List<TypeSpec> valueColumnTypes() {
    return valueColumnTypes;
  }

  /**
   * The encoding used for pivot values looked up in this map.
   *
   * @return the key kind of the pivot column type
   */
  public PivotKeyKind keyKind() {
    return keyKind;
  }

  /**
   * Number of distinct keys.
   *
   * @return the entry count
   */
  public int size() {
    return offsets.size();
  }

  /**
   * Number of offset blocks in an output row. Equal to {@link #size()} unless the catalog query
   * returned the same key more than once.
   *
   * @return the block count
   */
  public int blockCount() {
    return blockCount;
  }

  /**
   * All entries in insertion order.
   *
   * @return an unmodifiable view of key to offset
   */
  public Map<String, Integer> entries() {
    return offsets;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof PivotKeyMap other)) {
      return false;
    }
    return blockCount == other.blockCount && pivotColumnType.equals(other.pivotColumnType)
        && valueColumnTypes.equals(other.valueColumnTypes) && offsets.equals(other.offsets);
  }

  @Override
  public int hashCode() {
    return Objects.hash(pivotColumnType, valueColumnTypes, offsets, blockCount);
  }

  @Override
  public String toString() {
    return "PivotKeyMap{pivotColumnType=" + pivotColumnType + ", valueColumnTypes=" + valueColumnTypes + ", size="
        + offsets.size() + ", blockCount=" + blockCount + "}";
  }

  /** Collects entries for a {@link PivotKeyMap}. */
  public static final class Builder {

    private final TypeSpec pivotColumnType;
    private final List<TypeSpec> valueColumnTypes;
    private final Map<String, Integer> offsets = new LinkedHashMap<>();
    private int blockCount;

    private Builder(TypeSpec pivotColumnType, List<TypeSpec> valueColumnTypes) {
      this.pivotColumnType = Objects.requireNonNull(pivotColumnType, "pivotColumnType");
      this.valueColumnTypes = new ArrayList<>(Objects.requireNonNull(valueColumnTypes, "valueColumnTypes"));
    }

    /**
     * Append a key with the next ordinal. A key that was already added is remapped to the new
     * ordinal; its earlier block is left without a key.
     *
     * @param key
     *          the encoded key
     * @return this builder
     */
    public Builder add(String key) {
      Objects.requireNonNull(key, "key");
      int ordinal = blockCount++;
      Integer previous = offsets.put(key, ordinal);
      if (previous != null) {
        log.warn("Pivot key '{}' returned more than once by the catalog query, offset {} replaces {}", key, ordinal,
            previous);
      }
      return this;
    }

    /**
     * Put an entry with an explicit offset, used when restoring a serialized map.
     *
     * @param key
     *          the encoded key
     * @param offset
     *          the block ordinal
     * @return this builder
     */
    public Builder put(String key, int offset) {
      offsets.put(Objects.requireNonNull(key, "key"), offset);
      blockCount = Math.max(blockCount, offset + 1);
      return this;
    }

    /**
     * Set the block count explicitly, used when restoring a serialized map.
     *
     * @param count
     *          the number of offset blocks
     * @return this builder
     */
    public Builder blockCount(int count) {
      this.blockCount = count;
      return this;
    }

    /**
     * Freeze the collected entries.
     *
     * @return the immutable map
     * @throws UnsupportedKeyTypeException
     *           if the pivot column type cannot be used as a key
     */
    public PivotKeyMap build() throws UnsupportedKeyTypeException {
      return new PivotKeyMap(this);
    }
  }
}
