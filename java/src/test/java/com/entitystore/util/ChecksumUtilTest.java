package com.entitystore.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ChecksumUtilTest {

    @Test
    void md5Checksum_KnownValue() {
        assertThat(ChecksumUtil.md5Checksum("hello")).isEqualTo("5d41402abc4b2a76b9719d911017c592");
    }

    @Test
    void md5Checksum_StringAndBytesAgree() {
        String content = "Refunds are processed within 5 days";

        assertThat(ChecksumUtil.md5Checksum(content))
                .isEqualTo(ChecksumUtil.md5Checksum(content.getBytes(StandardCharsets.UTF_8)))
                .hasSize(32)
                .matches("[0-9a-f]+");
    }

    @Test
    void sha256_Is32Bytes() {
        assertThat(ChecksumUtil.sha256("anything")).hasSize(32);
    }
}
