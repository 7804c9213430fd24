package se.alipsa.dbext.local;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import se.alipsa.dbext.udx.CatalogQueryClient;
import se.alipsa.dbext.udx.ColumnDesc;
import se.alipsa.dbext.udx.DescribeArg;
import se.alipsa.dbext.udx.ExecutionArg;
import se.alipsa.dbext.udx.NamedParameterValue;
import se.alipsa.dbext.udx.RowStore;
import se.alipsa.dbext.udx.SessionStore;

/**
 * The argument object the {@link LocalPivotExecutor} hands to a table function. The same class
 * serves the plan-time Describe phase, where output columns are declared, and the execution phases,
 * where the declared schema is frozen and each worker gets its own {@link RowStore}.
 */
public final class LocalTableArg implements DescribeArg, ExecutionArg {

  private final Map<String, NamedParameterValue> parameters;
  private final List<ColumnDesc> inputColumns;
  private final CatalogQueryClient catalogClient;
  private final SessionStore sessionStore;
  private final RowStore rowStore;
  private final List<ColumnDesc> outputColumns;
  private final List<Integer> partitionBy;
  private final List<Integer> orderBy;
  private final boolean describing;
  private boolean sessionCommandsEnabled;

  /**
   * Create a plan-time argument.
   *
   * @param parameters
   *          named parameters, looked up case insensitively
   * @param inputColumns
   *          the input schema
   * @param catalogClient
   *          the client catalog queries run through
   * @param sessionStore
   *          the session-state store
   */
  public LocalTableArg(Map<String, NamedParameterValue> parameters, List<ColumnDesc> inputColumns,
      CatalogQueryClient catalogClient, SessionStore sessionStore) {
    this(normalize(parameters), List.copyOf(inputColumns), catalogClient, sessionStore, null, new ArrayList<>(),
        new ArrayList<>(), new ArrayList<>(), true);
  }

  private LocalTableArg(Map<String, NamedParameterValue> parameters, List<ColumnDesc> inputColumns,
      CatalogQueryClient catalogClient, SessionStore sessionStore, RowStore rowStore, List<ColumnDesc> outputColumns,
      List<Integer> partitionBy, List<Integer> orderBy, boolean describing) {
    this.parameters = parameters;
    this.inputColumns = inputColumns;
    this.catalogClient = catalogClient;
    this.sessionStore = Objects.requireNonNull(sessionStore, "sessionStore");
    this.rowStore = rowStore;
    this.outputColumns = outputColumns;
    this.partitionBy = partitionBy;
    this.orderBy = orderBy;
    this.describing = describing;
  }

  private static Map<String, NamedParameterValue> normalize(Map<String, NamedParameterValue> parameters) {
    Map<String, NamedParameterValue> map = new LinkedHashMap<>();
    parameters.forEach((name, value) -> map.put(name.toLowerCase(Locale.ROOT), value));
    return Collections.unmodifiableMap(map);
  }

  /**
   * Derive the argument of one worker. The output schema declared so far is frozen.
   *
   * @param workerStore
   *          the worker's row store
   * @return the worker argument
   */
  public LocalTableArg forWorker(RowStore workerStore) {
    return new LocalTableArg(parameters, inputColumns, null, sessionStore, Objects.requireNonNull(workerStore),
        List.copyOf(outputColumns), List.copyOf(partitionBy), List.copyOf(orderBy), false);
  }

  @Override
  public NamedParameterValue getNamedParameter(String name) {
    return name == null ? null : parameters.get(name.toLowerCase(Locale.ROOT));
  }

  @Override
  public List<ColumnDesc> inputColumns() {
    return inputColumns;
  }

  @Override
  public CatalogQueryClient catalogClient() {
    if (catalogClient == null) {
      throw new IllegalStateException("Catalog queries are only available during Describe and Start");
    }
    return catalogClient;
  }

  @Override
  public SessionStore sessionStore() {
    return sessionStore;
  }

  @Override
  public RowStore rowStore() {
    if (rowStore == null) {
      throw new IllegalStateException("No row store outside of worker execution");
    }
    return rowStore;
  }

  @Override
  public void addPartitionByColumn(int inputColumn) {
    requireDescribing();
    checkInputColumn(inputColumn);
    partitionBy.add(inputColumn);
  }

  @Override
  public void addOrderByColumn(int inputColumn) {
    requireDescribing();
    checkInputColumn(inputColumn);
    orderBy.add(inputColumn);
  }

  @Override
  public int copyColumnSchema(int inputColumn) {
    requireDescribing();
    checkInputColumn(inputColumn);
    outputColumns.add(inputColumns.get(inputColumn));
    return outputColumns.size() - 1;
  }

  @Override
  public int addOutputColumn(ColumnDesc column) {
    requireDescribing();
    outputColumns.add(Objects.requireNonNull(column, "column"));
    return outputColumns.size() - 1;
  }

  @Override
  public List<ColumnDesc> outputColumns() {
    return Collections.unmodifiableList(outputColumns);
  }

  @Override
  public void enableSessionCommands() {
    requireDescribing();
    sessionCommandsEnabled = true;
  }

  public boolean sessionCommandsEnabled() {
    return sessionCommandsEnabled;
  }

  public List<Integer> partitionByColumns() {
    return Collections.unmodifiableList(partitionBy);
  }

  public List<Integer> orderByColumns() {
    return Collections.unmodifiableList(orderBy);
  }

  private void requireDescribing() {
    if (!describing) {
      throw new IllegalStateException("The output schema can only be changed during Describe");
    }
  }

  private void checkInputColumn(int inputColumn) {
    if (inputColumn < 0 || inputColumn >= inputColumns.size()) {
      throw new IndexOutOfBoundsException(
          "Input column " + inputColumn + " out of range, input has " + inputColumns.size() + " columns");
    }
  }
}
