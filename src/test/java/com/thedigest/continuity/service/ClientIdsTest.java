package com.thedigest.continuity.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClientIdsTest {

    @Test
    void stripsUnsafeCharacters() {
        assertThat(ClientIds.normalize(" device_01-ab!@# ")).isEqualTo("device_01-ab");
    }

    @Test
    void emptyOrMissingBecomesAnonymous() {
        assertThat(ClientIds.normalize(null)).isEqualTo("anonymous");
        assertThat(ClientIds.normalize("   ")).isEqualTo("anonymous");
        assertThat(ClientIds.normalize("$$$")).isEqualTo("anonymous");
    }

    @Test
    void capsLength() {
        assertThat(ClientIds.normalize("x".repeat(500))).hasSize(120);
    }
}
