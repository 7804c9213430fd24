package se.alipsa.dbext.pivot;

/** Where a {@link RowPivotProcessor} is within the current group. */
public enum GroupState {
  /** No row of the next group has arrived yet, there is no accumulator. */
  AWAITING_FIRST_ROW,
  /** The accumulator holds the group columns and the slots written so far. */
  ACCUMULATING,
  /** The accumulated row is being handed downstream. */
  FLUSHED
}
