package io.kvlink.field;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Digest used for hashed indexes: MD5, lower-case hex.
 * <p>
 * The algorithm is part of the stored index format and must not change for a
 * model that already has data.
 */
public final class IndexHashing {

    public static final String ALGORITHM = "MD5";

    private static final HexFormat HEX = HexFormat.of();

    private IndexHashing() {
    }

    public static String md5Hex(byte[] data) {
        try {
            return HEX.formatHex(MessageDigest.getInstance(ALGORITHM).digest(data));
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships MD5
            throw new IllegalStateException(ALGORITHM + " digest unavailable", e);
        }
    }

    /**
     * Whether a filter argument already is a digest produced by {@link #md5Hex(byte[])}.
     */
    public static boolean looksLikeDigest(String value) {
        if (value.length() != 32) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                return false;
            }
        }
        return true;
    }
}
