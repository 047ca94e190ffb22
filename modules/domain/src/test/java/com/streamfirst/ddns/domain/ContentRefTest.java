package com.streamfirst.ddns.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentRefTest {

    @Test
    void zeroHashAndBlankAreEmpty() {
        assertThat(ContentRef.of(null).isEmpty()).isTrue();
        assertThat(ContentRef.of("  ").isEmpty()).isTrue();
        assertThat(ContentRef.of("0x" + "0".repeat(64)).isEmpty()).isTrue();
    }

    @Test
    void anythingElseIsPresent() {
        assertThat(ContentRef.of("0xe301").isPresent()).isTrue();
        assertThat(ContentRef.of("QmRAQB6YaCyidP37UdDnjFY5vQuiBrcqdyoW1CuDgwxkD4").isPresent()).isTrue();
    }
}
