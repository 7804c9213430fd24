package se.alipsa.dbext.pivot;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import se.alipsa.dbext.udx.ParameterException;
import se.alipsa.dbext.udx.SchemaException;

/** Unit tests for {@link CatalogQueryValidator}. */
class CatalogQueryValidatorTest {

  @Test
  void acceptsReadOnlySelects() {
    assertDoesNotThrow(() -> CatalogQueryValidator.validate("SELECT code, label FROM statuses ORDER BY code", 1));
    assertDoesNotThrow(() -> CatalogQueryValidator.validate("SELECT * FROM statuses", 3));
    assertDoesNotThrow(() -> CatalogQueryValidator.validate("(SELECT k, a, b FROM t)", 2));
    assertDoesNotThrow(
        () -> CatalogQueryValidator.validate("SELECT k, l FROM a UNION ALL SELECT k, l FROM b", 1));
  }

  @Test
  void rejectsStatementsWithSideEffects() {
    assertThrows(ParameterException.class, () -> CatalogQueryValidator.validate("DELETE FROM statuses", 1));
    assertThrows(ParameterException.class,
        () -> CatalogQueryValidator.validate("INSERT INTO t (a, b) VALUES (1, 'x')", 1));
    assertThrows(ParameterException.class,
        () -> CatalogQueryValidator.validate("SELECT code, label INTO backup FROM statuses", 1));
  }

  @Test
  void leavesDialectQueriesToTheHost() {
    assertDoesNotThrow(() -> CatalogQueryValidator.validate(
        "SELECT status, status || '_amt' FROM statuses LIMIT 1 OVER (PARTITION BY status ORDER BY status)", 1));
    assertDoesNotThrow(() -> CatalogQueryValidator.validate(
        "SELECT slice_time, 'day_' || slice_time FROM events TIMESERIES slice_time AS '1 day' OVER (ORDER BY ts)",
        1));
  }

  @Test
  void rejectsBlankText() {
    assertThrows(ParameterException.class, () -> CatalogQueryValidator.validate(" ", 1));
    assertThrows(ParameterException.class, () -> CatalogQueryValidator.validate(null, 1));
  }

  @Test
  void rejectsVisiblyShortSelectList() {
    SchemaException e = assertThrows(SchemaException.class,
        () -> CatalogQueryValidator.validate("SELECT code, label FROM statuses", 2));
    assertEquals("42804", e.getSQLState());
  }
}
