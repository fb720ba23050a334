package com.entitystore.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IdGeneratorTest {

    @Test
    void generate_ContentAddressed_IsDeterministic() {
        IdGenerator generator = new IdGenerator(IdPolicy.CONTENT_ADDRESSED);
        String checksum = ChecksumUtil.md5Checksum("same content");

        String first = generator.generate(checksum);
        String second = generator.generate(checksum);

        assertThat(first).isEqualTo(second).hasSize(IdGenerator.ID_LENGTH);
        assertThat(generator.generate(ChecksumUtil.md5Checksum("other content"))).isNotEqualTo(first);
    }

    @Test
    void generate_Random_IgnoresChecksum() {
        IdGenerator generator = new IdGenerator(IdPolicy.RANDOM);
        String checksum = ChecksumUtil.md5Checksum("same content");

        String first = generator.generate(checksum);
        String second = generator.generate(checksum);

        assertThat(first).isNotEqualTo(second);
        assertThat(first).hasSize(IdGenerator.ID_LENGTH).matches("[A-Za-z0-9_-]+");
    }
}
