package com.studioledger.backup.util;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Utility class for secure random generation.
 */
@Component
public class SecureRandomUtils {

    private static final SecureRandom RANDOM = new SecureRandom();

    /**
     * Generate a random token rendered as lowercase hex.
     *
     * @param byteLength number of random bytes; the result has twice as many characters
     * @return a random hex string
     */
    public String generateHexToken(int byteLength) {
        if (byteLength <= 0) {
            throw new IllegalArgumentException("Token length must be positive");
        }
        byte[] bytes = new byte[byteLength];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
