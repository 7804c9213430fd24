package se.alipsa.dbext.udx;

import java.util.List;

/**
 * What the host exposes to a table function in every phase.
 */
public interface TableArg {

  /**
   * Look up a named parameter.
   *
   * @param name
   *          the parameter name
   * @return the parameter value, or {@code null} when the parameter was not supplied
   */
  NamedParameterValue getNamedParameter(String name);

  /**
   * The schema of the input rows.
   *
   * @return the input columns in order
   */
  List<ColumnDesc> inputColumns();

  /**
   * Access to SQL execution for catalog queries. Only available during Describe and Start.
   *
   * @return the catalog query client
   */
  CatalogQueryClient catalogClient();

  /**
   * The session-state store shared by all workers of the session.
   *
   * @return the session store
   */
  SessionStore sessionStore();
}
