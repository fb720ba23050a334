package com.entitystore.util;

import lombok.Getter;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * Issues identifiers according to an {@link IdPolicy}.
 */
public class IdGenerator {

    static final int ID_LENGTH = 10;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    @Getter
    private final IdPolicy policy;

    public IdGenerator(IdPolicy policy) {
        this.policy = policy;
    }

    /**
     * Generate an identifier for content with the given checksum.
     * The checksum is ignored by {@link IdPolicy#RANDOM}.
     *
     * @param checksum Content checksum
     * @return New identifier
     */
    public String generate(String checksum) {
        if (policy == IdPolicy.CONTENT_ADDRESSED) {
            return fromChecksum(checksum);
        }
        return randomId();
    }

    public static String randomId() {
        byte[] randomBytes = new byte[ID_LENGTH];
        SECURE_RANDOM.nextBytes(randomBytes);
        return ENCODER.encodeToString(randomBytes).substring(0, ID_LENGTH);
    }

    public static String fromChecksum(String checksum) {
        byte[] digest = ChecksumUtil.sha256(checksum);
        return ENCODER.encodeToString(Arrays.copyOf(digest, ID_LENGTH)).substring(0, ID_LENGTH);
    }
}
