package se.alipsa.dbext.pivot;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import se.alipsa.dbext.udx.InputRow;
import se.alipsa.dbext.udx.OutputRow;
import se.alipsa.dbext.udx.RowStore;
import se.alipsa.dbext.udx.SchemaException;
import se.alipsa.dbext.udx.TableFunctionException;

/**
 * Turns the rows of one group into a single wide output row.
 *
 * <p>
 * The first row of a group allocates the accumulator, copies the group columns into the leading
 * slots and sets every pivot slot to {@code NULL}. Every row then writes its value columns into the
 * block of slots that belongs to its pivot key. {@link #flush()} emits the accumulator; the host
 * calls it once no more rows of the group will arrive. Rows must arrive grouped; nothing here sorts
 * or detects a change of group.
 *
 * <p>
 * Not thread safe, each worker owns its own processor.
 */
public final class RowPivotProcessor {

  private final int pivotColumn;
  private final int[] groupColumns;
  private final int[] valueColumns;
  private final PivotKeyKind rowKind;
  private final PivotKeyMap keyMap;
  private final RowStore rowStore;

  private GroupState state = GroupState.AWAITING_FIRST_ROW;
  private OutputRow accumulator;
  private long emittedGroups;

  /**
   * Create a processor for input whose pivot column has the catalog key type.
   *
   * @param parameters
   *          the validated invocation parameters
   * @param keyMap
   *          the session's key map
   * @param rowStore
   *          where accumulators are allocated and emitted
   */
  public RowPivotProcessor(PivotParameters parameters, PivotKeyMap keyMap, RowStore rowStore) {
    this(parameters, Objects.requireNonNull(keyMap, "keyMap").keyKind(), keyMap, rowStore);
  }

  /**
   * Create a processor.
   *
   * @param parameters
   *          the validated invocation parameters
   * @param rowKind
   *          the declared key kind of the input's pivot column
   * @param keyMap
   *          the session's key map
   * @param rowStore
   *          where accumulators are allocated and emitted
   */
  public RowPivotProcessor(PivotParameters parameters, PivotKeyKind rowKind, PivotKeyMap keyMap, RowStore rowStore) {
    Objects.requireNonNull(parameters, "parameters");
    this.pivotColumn = parameters.pivotColumn();
    this.groupColumns = toArray(parameters.groupColumns());
    this.valueColumns = toArray(parameters.valueColumns());
    this.rowKind = Objects.requireNonNull(rowKind, "rowKind");
    this.keyMap = Objects.requireNonNull(keyMap, "keyMap");
    this.rowStore = Objects.requireNonNull(rowStore, "rowStore");
  }

  /**
   * Add a row of the current group. A failure discards the accumulator, so nothing of the group is
   * emitted afterwards.
   *
   * @param row
   *          the input row
   * @throws NullPivotKeyException
   *           if the pivot column is {@code NULL}
   * @throws PivotKeyNotFoundException
   *           if the pivot value is not one of the catalog keys, or has no exact form in the catalog
   *           key type
   * @throws OffsetRangeException
   *           if the key's slots fall outside the pivot area of the output row, or the key map has
   *           more slots than the output row
   * @throws TableFunctionException
   *           if the pivot value cannot be read as the catalog key type
   */
  public void process(InputRow row) throws TableFunctionException {
    try {
      if (state != GroupState.ACCUMULATING) {
        beginGroup(row);
      }
      place(row);
    } catch (TableFunctionException e) {
      discard();
      throw e;
    }
  }

  /**
   * End the current group: emit the accumulated row and release it. Does nothing when no row of a
   * new group has arrived.
   */
  public void flush() {
    if (state != GroupState.ACCUMULATING) {
      return;
    }
    state = GroupState.FLUSHED;
    OutputRow finished = accumulator;
    accumulator = null;
    rowStore.emit(finished);
    emittedGroups++;
    state = GroupState.AWAITING_FIRST_ROW;
  }

  /**
   * Drop the accumulated row without emitting it.
   */
  public void discard() {
    if (accumulator != null) {
      rowStore.free(accumulator);
      accumulator = null;
    }
    state = GroupState.AWAITING_FIRST_ROW;
  }

  public GroupState state() {
    return state;
  }

  /**
   * Number of groups emitted by this processor.
   *
   * @return the count of flushed groups
   */
  public long emittedGroups() {
    return emittedGroups;
  }

  private void beginGroup(InputRow row) throws OffsetRangeException {
    OutputRow out = rowStore.allocate();
    accumulator = out;
    int pivotSlots = keyMap.blockCount() * valueColumns.length;
    if (groupColumns.length + pivotSlots > out.columnCount()) {
      throw new OffsetRangeException("Key map needs " + pivotSlots + " pivot positions after "
          + groupColumns.length + " group columns but the output row has " + out.columnCount() + " columns");
    }
    int outIdx = 0;
    for (int column : groupColumns) {
      out.copyFrom(row, column, outIdx++);
    }
    for (int i = 0; i < pivotSlots; i++) {
      out.setNull(outIdx++);
    }
    state = GroupState.ACCUMULATING;
  }

  private void place(InputRow row) throws TableFunctionException {
    if (row.isNull(pivotColumn)) {
      throw new NullPivotKeyException("Can't map NULL pivot column reference");
    }
    String key = encode(row);
    OptionalInt offset = keyMap.offsetOf(key);
    if (offset.isEmpty()) {
      throw new PivotKeyNotFoundException(key);
    }
    int first = groupColumns.length + offset.getAsInt() * valueColumns.length;
    for (int i = 0; i < valueColumns.length; i++) {
      int slot = first + i;
      if (slot < groupColumns.length || slot >= accumulator.columnCount()) {
        throw new OffsetRangeException("Derived offset " + slot + " does not map to a pivot position in ["
            + groupColumns.length + ", " + accumulator.columnCount() + ")");
      }
    }
    for (int i = 0; i < valueColumns.length; i++) {
      accumulator.copyFrom(row, valueColumns[i], first + i);
    }
  }

  private String encode(InputRow row) throws TableFunctionException {
    try {
      String key = keyMap.keyKind().encodeFrom(rowKind, row, pivotColumn);
      if (key == null) {
        throw new PivotKeyNotFoundException(rowKind.encode(row, pivotColumn));
      }
      return key;
    } catch (ClassCastException | IllegalArgumentException | ArithmeticException e) {
      throw new SchemaException("Pivot value in column " + pivotColumn + " cannot be read as "
          + rowKind.columnType() + ": " + e.getMessage(), e);
    }
  }

  private static int[] toArray(List<Integer> values) {
    int[] result = new int[values.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = values.get(i);
    }
    return result;
  }
}
