package com.entitystore.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VersionTest {

    @Test
    void fromString_RoundTrips() {
        Version version = Version.fromString("0.3.0");

        assertThat(version).isEqualTo(Version.of(0, 3, 0));
        assertThat(version.toString()).isEqualTo("0.3.0");
    }

    @Test
    void isNewerThan_ComparesNumerically() {
        assertThat(Version.fromString("0.10.0").isNewerThan(Version.fromString("0.9.5"))).isTrue();
        assertThat(Version.fromString("1.0.0").isNewerThan(Version.fromString("1.0.0"))).isFalse();
        assertThat(Version.fromString("0.2.1").compareTo(Version.fromString("0.2.3"))).isNegative();
    }

    @Test
    void fromString_Invalid() {
        assertThatThrownBy(() -> Version.fromString("1.2")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Version.fromString("a.b.c")).isInstanceOf(IllegalArgumentException.class);
    }
}
