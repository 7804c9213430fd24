package se.alipsa.dbext.local;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Properties;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link LocalExecutorConfig}. */
class LocalExecutorConfigTest {

  @Test
  void defaultsUseAvailableProcessors() {
    LocalExecutorConfig config = LocalExecutorConfig.defaults();
    assertEquals(Runtime.getRuntime().availableProcessors(), config.workers());
    assertFalse(config.reuseDescribeSnapshot());
    assertFalse(config.caseSensitive());
  }

  @Test
  void readsProperties() {
    Properties props = new Properties();
    props.setProperty("workers", " 3 ");
    props.setProperty("reuseDescribeSnapshot", "true");
    LocalExecutorConfig config = LocalExecutorConfig.fromProperties(props);
    assertEquals(3, config.workers());
    assertTrue(config.reuseDescribeSnapshot());
  }

  @Test
  void parsesUrlQueryStrings() {
    LocalExecutorConfig config = LocalExecutorConfig.parse("?workers=2&caseSensitive=TRUE&&unknown=x");
    assertEquals(2, config.workers());
    assertTrue(config.caseSensitive());
    assertFalse(config.reuseDescribeSnapshot());
    assertEquals(LocalExecutorConfig.defaults(), LocalExecutorConfig.parse(""));
    assertTrue(LocalExecutorConfig.parse("REUSEDESCRIBESNAPSHOT=true").reuseDescribeSnapshot());
  }

  @Test
  void rejectsInvalidWorkerCounts() {
    assertThrows(IllegalArgumentException.class, () -> LocalExecutorConfig.parse("workers=0"));
    assertThrows(IllegalArgumentException.class, () -> LocalExecutorConfig.parse("workers=many"));
  }
}
