package io.b2mash.b2b.datasync.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SyncParamsTest {

  private static final Instant MAY_1 = Instant.parse("2026-05-01T00:00:00Z");
  private static final Instant MAY_2 = Instant.parse("2026-05-02T00:00:00Z");

  @Test
  void nullFilterValues_areKeptThroughTheJobRow() {
    var filters = new HashMap<String, Object>();
    filters.put("status", null);

    var params = new SyncParams(MAY_1, null, filters);
    var restored = SyncParams.fromMap(params.toMap());

    assertThat(restored.filters()).containsEntry("status", null);
    assertThat(restored.since()).isEqualTo(MAY_1);
  }

  @Test
  void filters_areCopiedAndReadOnly() {
    var filters = new HashMap<String, Object>(Map.of("status", "paid"));
    var params = new SyncParams(null, null, filters);
    filters.put("status", "refunded");

    assertThat(params.filters()).containsEntry("status", "paid");
    assertThatThrownBy(() -> params.filters().put("x", 1))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void hasValidRange_rejectsOnlyReversedBounds() {
    assertThat(new SyncParams(MAY_1, MAY_2, null).hasValidRange()).isTrue();
    assertThat(new SyncParams(MAY_1, MAY_1, null).hasValidRange()).isTrue();
    assertThat(new SyncParams(null, MAY_1, null).hasValidRange()).isTrue();
    assertThat(new SyncParams(MAY_2, null, null).hasValidRange()).isTrue();
    assertThat(new SyncParams(MAY_2, MAY_1, null).hasValidRange()).isFalse();
  }
}
