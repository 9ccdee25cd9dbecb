package com.hirewise.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void orNewKeepsProvidedValue() {
    assertThat(TraceIds.orNew(" req-1 ")).isEqualTo("req-1");
  }

  @Test
  void orNewGeneratesWhenBlank() {
    assertThat(TraceIds.orNew(" ")).isNotBlank().isNotEqualTo(" ");
    assertThat(TraceIds.orNew(null)).hasSize(36);
  }

  @Test
  void timestampConversionIsSymmetricAndNullSafe() {
    final Instant instant = Instant.parse("2026-03-01T10:15:30Z");

    final Timestamp timestamp = JdbcTimestampUtils.toTimestamp(instant);

    assertThat(JdbcTimestampUtils.toInstant(timestamp)).isEqualTo(instant);
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
  }
}
