package com.daoindexer.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentHashTest {

    @Test
    void sha256HexOfText() {
        assertThat(ContentHash.of("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void sameTextSameHash() {
        assertThat(ContentHash.of("Build a landing page")).isEqualTo(ContentHash.of("Build a landing page"));
        assertThat(ContentHash.of("Build a landing page")).isNotEqualTo(ContentHash.of("Build a landing page!"));
    }

    @Test
    void blankTextHasNoHash() {
        assertThat(ContentHash.of(null)).isNull();
        assertThat(ContentHash.of("")).isNull();
        assertThat(ContentHash.of("   ")).isNull();
    }
}
