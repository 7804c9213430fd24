package se.alipsa.dbext.udx;

/**
 * The commands a host sends to a table function, in the order
 * {@code DESCRIBE -> CREATE -> START -> PROCESS* -> FINALIZE -> SHUTDOWN | ABORT -> DESTROY}.
 */
public enum Phase {
  DESCRIBE,
  CREATE,
  START,
  PROCESS,
  FINALIZE,
  SHUTDOWN,
  ABORT,
  DESTROY
}
