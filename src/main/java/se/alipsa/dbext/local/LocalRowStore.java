package se.alipsa.dbext.local;

import java.util.ArrayList;
import java.util.List;
import se.alipsa.dbext.udx.OutputRow;
import se.alipsa.dbext.udx.RowStore;

/**
 * {@link RowStore} that collects emitted rows in memory. One store per worker, not thread safe.
 */
public final class LocalRowStore implements RowStore {

  private final int columnCount;
  private final List<LocalOutputRow> emitted = new ArrayList<>();
  private int live;

  /**
   * Create a store.
   *
   * @param columnCount
   *          the number of output columns of every row
   */
  public LocalRowStore(int columnCount) {
    this.columnCount = columnCount;
  }

  @Override
  public OutputRow allocate() {
    live++;
    return new LocalOutputRow(columnCount);
  }

  @Override
  public void emit(OutputRow row) {
    emitted.add((LocalOutputRow) row);
    live--;
  }

  @Override
  public void free(OutputRow row) {
    live--;
  }

  /**
   * Rows emitted so far, in emission order.
   *
   * @return the emitted rows
   */
  public List<LocalOutputRow> emitted() {
    return List.copyOf(emitted);
  }

  /**
   * Rows emitted from a position onwards.
   *
   * @param fromIndex
   *          index of the first row to return
   * @return the rows emitted at or after {@code fromIndex}
   */
  public List<LocalOutputRow> emittedFrom(int fromIndex) {
    return List.copyOf(emitted.subList(fromIndex, emitted.size()));
  }

  public int emittedCount() {
    return emitted.size();
  }

  /**
   * Rows handed out by {@link #allocate()} that were neither emitted nor freed.
   *
   * @return the number of outstanding rows
   */
  public int liveRows() {
    return live;
  }
}
