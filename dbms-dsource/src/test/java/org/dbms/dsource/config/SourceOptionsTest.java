package org.dbms.dsource.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

public class SourceOptionsTest {

  @Test
  void defaultsLeaveEverythingUnset() {
    SourceOptions options = SourceOptions.defaults();
    assertNull(options.batchSize());
    assertNull(options.strictProjection());
    assertEquals(SourceOptions.DEFAULT_BATCH_SIZE, options.effectiveBatchSize());
    assertTrue(options.effectiveStrictProjection());
    assertTrue(options.toOptionsMap().isEmpty());
  }

  @Test
  void builderSetsValues() {
    SourceOptions options = SourceOptions.builder().batchSize(128).strictProjection(false).build();
    assertEquals(128, options.effectiveBatchSize());
    assertFalse(options.effectiveStrictProjection());
    assertEquals(
        Map.of("dbms.source.batch_size", "128", "dbms.source.strict_projection", "false"),
        options.toOptionsMap());
  }

  @Test
  void parsesDottedKeys() {
    SourceOptions options =
        SourceOptions.fromStringMap(
            Map.of(
                "dbms.source.batch_size", " 64 ",
                "dbms.source.strict_projection", "FALSE",
                "dbms.other", "ignored"));
    assertEquals(new SourceOptions(64, false), options);
    assertEquals(options, SourceOptions.fromStringMap(options.toOptionsMap()));
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(
        IllegalArgumentException.class,
        () -> SourceOptions.fromStringMap(Map.of("dbms.source.batch_size", "lots")));
    assertThrows(
        IllegalArgumentException.class,
        () -> SourceOptions.fromStringMap(Map.of("dbms.source.batch_size", "-1")));
    assertThrows(
        IllegalArgumentException.class,
        () -> SourceOptions.fromStringMap(Map.of("dbms.source.strict_projection", "yes")));
    assertThrows(
        IllegalArgumentException.class, () -> SourceOptions.builder().batchSize(0).build());
  }
}
