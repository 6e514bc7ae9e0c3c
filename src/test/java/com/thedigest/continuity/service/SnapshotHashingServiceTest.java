package com.thedigest.continuity.service;

import com.thedigest.continuity.model.Depth;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotHashingServiceTest {

    private final SnapshotHashingService hashingService = new SnapshotHashingService();
    private final OffsetDateTime since = OffsetDateTime.of(2026, 2, 17, 8, 0, 0, 0, ZoneOffset.UTC);

    @Test
    void identicalInputsGiveIdenticalHashes() {
        String first = hashingService.snapshotHash("client", Depth.SHALLOW, since, List.of("a", "b"));
        String second = hashingService.snapshotHash("client", Depth.SHALLOW, since, List.of("a", "b"));

        assertThat(first).isEqualTo(second).hasSize(24).matches("[0-9a-f]{24}");
    }

    @Test
    void sameInstantInAnotherOffsetGivesTheSameHash() {
        OffsetDateTime shifted = since.withOffsetSameInstant(ZoneOffset.ofHours(2));

        assertThat(hashingService.snapshotHash("client", Depth.DEEP, shifted, List.of("a")))
                .isEqualTo(hashingService.snapshotHash("client", Depth.DEEP, since, List.of("a")));
    }

    @Test
    void everyInputChangesTheHash() {
        String base = hashingService.snapshotHash("client", Depth.SHALLOW, since, List.of("a", "b"));

        assertThat(hashingService.snapshotHash("other", Depth.SHALLOW, since, List.of("a", "b"))).isNotEqualTo(base);
        assertThat(hashingService.snapshotHash("client", Depth.MEDIUM, since, List.of("a", "b"))).isNotEqualTo(base);
        assertThat(hashingService.snapshotHash("client", Depth.SHALLOW, since.minusMinutes(1), List.of("a", "b"))).isNotEqualTo(base);
        assertThat(hashingService.snapshotHash("client", Depth.SHALLOW, since, List.of("b", "a"))).isNotEqualTo(base);
        assertThat(hashingService.snapshotHash("client", Depth.SHALLOW, since, List.of("a", "b", "c"))).isNotEqualTo(base);
    }
}
