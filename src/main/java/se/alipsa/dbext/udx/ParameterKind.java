package se.alipsa.dbext.udx;

/** The kinds of values a named parameter can carry. */
public enum ParameterKind {
  /** A reference to exactly one input column. */
  COLUMN_REF,
  /** A list of references to input columns. */
  COLUMN_REF_LIST,
  /** A literal value. */
  CONSTANT
}
