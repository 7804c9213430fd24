package se.alipsa.dbext.local;

import java.io.IOException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.dbext.pivot.PivotTableFunctionFactory;
import se.alipsa.dbext.udx.CatalogQueryClient;
import se.alipsa.dbext.udx.ColumnDesc;
import se.alipsa.dbext.udx.InputRow;
import se.alipsa.dbext.udx.TableFunction;
import se.alipsa.dbext.udx.TableFunctionFactory;

/**
 * Runs the pivot function in-process the way the database host does: Describe, one Create per
 * worker, Start, then partitions of rows spread over a fixed pool of workers, each partition
 * processed sequentially and closed with {@link TableFunction#finalizePartition()}. Output is
 * returned in partition order regardless of the number of workers.
 */
public final class LocalPivotExecutor {

  private static final Logger log = LoggerFactory.getLogger(LocalPivotExecutor.class);

  private final CatalogQueryClient catalogClient;
  private final LocalExecutorConfig config;

  /**
   * Create an executor with default settings.
   *
   * @param catalogClient
   *          the client catalog queries run through
   */
  public LocalPivotExecutor(CatalogQueryClient catalogClient) {
    this(catalogClient, LocalExecutorConfig.defaults());
  }

  /**
   * Create an executor.
   *
   * @param catalogClient
   *          the client catalog queries run through
   * @param config
   *          the executor settings
   */
  public LocalPivotExecutor(CatalogQueryClient catalogClient, LocalExecutorConfig config) {
    this.catalogClient = Objects.requireNonNull(catalogClient, "catalogClient");
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Pivot the rows of a Parquet file.
   *
   * @param source
   *          the input file
   * @param invocation
   *          the pivot call
   * @return the pivoted rows
   * @throws SQLException
   *           if the file cannot be read or the pivot fails
   */
  public PivotResult execute(ParquetRowSource source, PivotInvocation invocation) throws SQLException {
    try {
      return execute(source.columns(), source.readRows(), invocation);
    } catch (IOException e) {
      throw new SQLException("Failed to read pivot input: " + e.getMessage(), "58030", e);
    }
  }

  /**
   * Pivot a list of rows.
   *
   * @param inputColumns
   *          the input schema
   * @param rows
   *          the input rows
   * @param invocation
   *          the pivot call
   * @return the pivoted rows
   * @throws SQLException
   *           if the pivot fails; no partial output is returned
   */
  public PivotResult execute(List<ColumnDesc> inputColumns, List<? extends InputRow> rows, PivotInvocation invocation)
      throws SQLException {
    ColumnResolver resolver = new ColumnResolver(inputColumns, config.caseSensitive());
    TableFunctionFactory factory = new PivotTableFunctionFactory(config.reuseDescribeSnapshot());
    LocalTableArg plan = new LocalTableArg(invocation.toParameters(resolver), inputColumns, catalogClient,
        new LocalSessionStore());

    log.debug("Describe {}", invocation);
    factory.describe(plan);
    List<ColumnDesc> outputColumns = plan.outputColumns();
    List<List<InputRow>> partitions = partition(rows, plan.partitionByColumns(), plan.orderByColumns());
    int workerCount = Math.max(1, Math.min(config.workers(), partitions.size()));

    List<Worker> workers = new ArrayList<>(workerCount);
    try {
      for (int w = 0; w < workerCount; w++) {
        LocalRowStore store = new LocalRowStore(outputColumns.size());
        workers.add(new Worker(w, factory.create(plan.forWorker(store)), store));
      }
      log.debug("Start with {} workers for {} partitions", workerCount, partitions.size());
      factory.start(plan);
      for (int p = 0; p < partitions.size(); p++) {
        workers.get(p % workerCount).partitions.add(p);
      }
      run(workers, partitions);
      factory.shutdown(plan);
    } catch (SQLException | RuntimeException e) {
      for (Worker worker : workers) {
        worker.function.abort();
      }
      throw e;
    } finally {
      for (Worker worker : workers) {
        worker.function.destroy();
      }
    }

    Map<Integer, List<Object[]>> byPartition = new TreeMap<>();
    for (Worker worker : workers) {
      byPartition.putAll(worker.output);
    }
    List<Object[]> output = new ArrayList<>();
    byPartition.values().forEach(output::addAll);
    log.debug("Pivot produced {} rows", output.size());
    return new PivotResult(outputColumns, output);
  }

  private void run(List<Worker> workers, List<List<InputRow>> partitions) throws SQLException {
    AtomicBoolean failed = new AtomicBoolean();
    AtomicReference<Throwable> firstFailure = new AtomicReference<>();
    AtomicInteger threadNo = new AtomicInteger();
    ExecutorService pool = Executors.newFixedThreadPool(workers.size(), r -> {
      Thread t = new Thread(r, "pivot-worker-" + threadNo.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
    try {
      List<Future<?>> futures = new ArrayList<>(workers.size());
      for (Worker worker : workers) {
        futures.add(pool.submit(() -> {
          try {
            worker.process(partitions, failed);
          } catch (SQLException | RuntimeException e) {
            failed.set(true);
            firstFailure.compareAndSet(null, e);
            log.error("Pivot worker {} failed: {}", worker.id, e.getMessage());
          }
          return null;
        }));
      }
      for (Future<?> future : futures) {
        await(future);
      }
    } finally {
      pool.shutdownNow();
    }
    Throwable failure = firstFailure.get();
    if (failure instanceof SQLException sqlException) {
      throw sqlException;
    }
    if (failure instanceof RuntimeException runtimeException) {
      throw runtimeException;
    }
  }

  private static void await(Future<?> future) throws SQLException {
    try {
      future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SQLException("Interrupted while waiting for pivot workers", "57014", e);
    } catch (ExecutionException e) {
      throw new SQLException("Pivot worker failed: " + e.getCause(), "XX000", e.getCause());
    }
  }

  static List<List<InputRow>> partition(List<? extends InputRow> rows, List<Integer> partitionBy,
      List<Integer> orderBy) {
    Map<GroupKey, List<InputRow>> groups = new TreeMap<>();
    for (InputRow row : rows) {
      groups.computeIfAbsent(GroupKey.of(row, partitionBy), k -> new ArrayList<>()).add(row);
    }
    List<List<InputRow>> partitions = new ArrayList<>(groups.size());
    Comparator<InputRow> order = Comparator.comparing(r -> GroupKey.of(r, orderBy));
    for (List<InputRow> group : groups.values()) {
      if (!orderBy.isEmpty()) {
        group.sort(order);
      }
      partitions.add(group);
    }
    return partitions;
  }

  private static final class Worker {

    private final int id;
    private final TableFunction function;
    private final LocalRowStore store;
    private final List<Integer> partitions = new ArrayList<>();
    private final Map<Integer, List<Object[]>> output = new TreeMap<>();

    Worker(int id, TableFunction function, LocalRowStore store) {
      this.id = id;
      this.function = function;
      this.store = store;
    }

    void process(List<List<InputRow>> all, AtomicBoolean failed) throws SQLException {
      for (int p : partitions) {
        if (failed.get()) {
          return;
        }
        int before = store.emittedCount();
        for (InputRow row : all.get(p)) {
          function.process(row);
        }
        function.finalizePartition();
        List<Object[]> rows = new ArrayList<>();
        for (LocalOutputRow out : store.emittedFrom(before)) {
          rows.add(out.values());
        }
        output.put(p, rows);
      }
    }
  }
}
