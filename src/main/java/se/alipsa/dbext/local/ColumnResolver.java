package se.alipsa.dbext.local;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import se.alipsa.dbext.udx.ColumnDesc;
import se.alipsa.dbext.udx.ParameterException;

/**
 * Maps column names to input column indexes. Quoted names always match exactly; unquoted names are
 * matched case insensitively unless the resolver is case sensitive.
 */
final class ColumnResolver {

  private final Map<String, Integer> exact = new HashMap<>();
  private final Map<String, Integer> folded = new HashMap<>();
  private final boolean caseSensitive;

  ColumnResolver(List<ColumnDesc> columns, boolean caseSensitive) {
    this.caseSensitive = caseSensitive;
    for (int i = 0; i < columns.size(); i++) {
      String name = columns.get(i).name();
      exact.putIfAbsent(name, i);
      folded.putIfAbsent(name.toLowerCase(Locale.ROOT), i);
    }
  }

  /**
   * Resolve a column name.
   *
   * @param raw
   *          the name as written, possibly quoted
   * @return the zero-based column index
   * @throws ParameterException
   *           if no column matches
   */
  int indexOf(String raw) throws ParameterException {
    if (raw == null || raw.isBlank()) {
      throw new ParameterException("Column name must not be blank");
    }
    String trimmed = raw.trim();
    boolean quoted = isQuoted(trimmed);
    String name = quoted ? trimmed.substring(1, trimmed.length() - 1) : trimmed;
    Integer idx = exact.get(name);
    if (idx == null && !quoted && !caseSensitive) {
      idx = folded.get(name.toLowerCase(Locale.ROOT));
    }
    if (idx == null) {
      throw new ParameterException("Unknown column '" + name + "', available columns are " + exact.keySet());
    }
    return idx;
  }

  private static boolean isQuoted(String name) {
    if (name.length() < 2) {
      return false;
    }
    char first = name.charAt(0);
    char last = name.charAt(name.length() - 1);
    return (first == '"' && last == '"') || (first == '`' && last == '`') || (first == '[' && last == ']');
  }

  int[] indexesOf(List<String> names) throws ParameterException {
    int[] idx = new int[names.size()];
    for (int i = 0; i < idx.length; i++) {
      idx[i] = indexOf(names.get(i));
    }
    return idx;
  }
}
