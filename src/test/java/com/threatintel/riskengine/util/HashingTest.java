package com.threatintel.riskengine.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HashingTest {

    @Test
    void sha256Hex() {
        assertThat(Hashing.sha256Hex("hello"))
                .isEqualTo("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824");
    }

    @Test
    void shortIdKeepsPrefixAndLength() {
        assertThat(Hashing.shortId("thr-", "hello", 16)).isEqualTo("thr-2cf24dba5fb0a30e");
    }

    @Test
    void shortIdIsStable() {
        assertThat(Hashing.shortId("run-", "a,b,c", 16)).isEqualTo(Hashing.shortId("run-", "a,b,c", 16));
        assertThat(Hashing.shortId("run-", "a,b,c", 16)).isNotEqualTo(Hashing.shortId("run-", "a,b,d", 16));
    }
}
