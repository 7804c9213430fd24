package se.alipsa.dbext.pivot;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.dbext.udx.ParameterException;
import se.alipsa.dbext.udx.SchemaException;

/**
 * Checks the catalog query before it is handed to the host. The query runs once at Describe and
 * again at Start, so it has to be a plain read: a {@code SELECT} without {@code INTO}. Queries in a
 * dialect the parser does not know are passed on unchecked, the host engine is the judge of those.
 */
public final class CatalogQueryValidator {

  private static final Logger log = LoggerFactory.getLogger(CatalogQueryValidator.class);

  private CatalogQueryValidator() {
  }

  /**
   * Validate the catalog query text.
   *
   * @param query
   *          the catalog query
   * @param valueColumnCount
   *          number of value columns, the query must produce one more column than this
   * @throws ParameterException
   *           if the query is blank or parses as something other than a read-only {@code SELECT}
   * @throws SchemaException
   *           if the select list is visibly too short
   */
  public static void validate(String query, int valueColumnCount) throws ParameterException, SchemaException {
    if (query == null || query.isBlank()) {
      throw new ParameterException("'" + PivotParameterNames.COLUMN_CATALOG_QUERY + "' must not be empty.");
    }
    Statement statement;
    try {
      statement = CCJSqlParserUtil.parse(query);
    } catch (JSQLParserException e) {
      log.debug("Column catalog query not checked, it does not parse: {}", query, e);
      return;
    }
    if (!(statement instanceof Select select)) {
      throw new ParameterException("Column catalog query must be a SELECT statement: " + query);
    }
    Select body = select;
    while (body instanceof ParenthesedSelect parenthesed) {
      body = parenthesed.getSelect();
    }
    if (body instanceof PlainSelect plain) {
      if (plain.getIntoTables() != null && !plain.getIntoTables().isEmpty()) {
        throw new ParameterException("Column catalog query must not select INTO a table: " + query);
      }
      checkSelectList(plain, valueColumnCount);
    }
  }

  private static void checkSelectList(PlainSelect plain, int valueColumnCount) throws SchemaException {
    if (plain.getSelectItems() == null) {
      return;
    }
    for (SelectItem<?> item : plain.getSelectItems()) {
      if (item.getExpression() instanceof AllColumns) {
        // column count only known once the query has run
        return;
      }
    }
    int required = valueColumnCount + 1;
    if (plain.getSelectItems().size() < required) {
      throw new SchemaException("Invalid column catalog query, must have at least " + required + " columns");
    }
  }
}
