package se.alipsa.dbext.pivot;

import java.sql.SQLException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.dbext.udx.ExecutionArg;
import se.alipsa.dbext.udx.InputRow;
import se.alipsa.dbext.udx.Phase;
import se.alipsa.dbext.udx.TableFunction;
import se.alipsa.dbext.udx.TableFunctionException;

/**
 * A worker's instance of the pivot function. It owns one {@link RowPivotProcessor}, bound to the
 * session's key map the first time a row arrives: the map is published by Start, which the host may
 * run after this instance was created.
 */
public final class PivotTableFunction implements TableFunction {

  private static final Logger log = LoggerFactory.getLogger(PivotTableFunction.class);

  private final PivotParameters parameters;
  private final ExecutionArg arg;
  private RowPivotProcessor processor;
  private Phase phase = Phase.CREATE;

  /**
   * Create the worker instance.
   *
   * @param parameters
   *          the validated parameters
   * @param arg
   *          the worker's execution arguments
   */
  public PivotTableFunction(PivotParameters parameters, ExecutionArg arg) {
    this.parameters = Objects.requireNonNull(parameters, "parameters");
    this.arg = Objects.requireNonNull(arg, "arg");
  }

  @Override
  public void process(InputRow row) throws SQLException {
    requireActive(Phase.PROCESS);
    if (processor == null) {
      PivotKeyMap keyMap = sessionKeyMap();
      PivotKeyKind rowKind = PivotKeyKind.of(arg.inputColumns().get(parameters.pivotColumn()).type());
      processor = new RowPivotProcessor(parameters, rowKind, keyMap, arg.rowStore());
    }
    phase = Phase.PROCESS;
    processor.process(row);
  }

  @Override
  public void finalizePartition() throws SQLException {
    requireActive(Phase.FINALIZE);
    if (processor != null) {
      processor.flush();
    }
    phase = Phase.FINALIZE;
  }

  @Override
  public void abort() {
    if (phase == Phase.DESTROY) {
      return;
    }
    if (processor != null) {
      processor.discard();
    }
    phase = Phase.ABORT;
    log.debug("Pivot function aborted");
  }

  @Override
  public void destroy() {
    if (phase == Phase.DESTROY) {
      return;
    }
    if (processor != null) {
      processor.discard();
      if (log.isDebugEnabled()) {
        log.debug("Pivot function destroyed after emitting {} groups", processor.emittedGroups());
      }
      processor = null;
    }
    phase = Phase.DESTROY;
  }

  /**
   * The phase this instance went through last.
   *
   * @return the current phase
   */
  public Phase phase() {
    return phase;
  }

  private PivotKeyMap sessionKeyMap() throws TableFunctionException {
    PivotKeyMap map = PivotKeyMapCodec.restore(arg.sessionStore(), PivotKeyMapCodec.KEY_MAP_SLOT);
    if (map == null) {
      throw new TableFunctionException("Pivot key map has not been published, the session was not started",
          "55000");
    }
    return map;
  }

  private void requireActive(Phase next) {
    if (phase == Phase.ABORT || phase == Phase.DESTROY) {
      throw new IllegalStateException("Cannot " + next + " a pivot function in phase " + phase);
    }
  }
}
