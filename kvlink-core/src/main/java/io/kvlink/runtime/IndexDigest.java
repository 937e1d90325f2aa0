package io.kvlink.runtime;

import io.kvlink.field.IndexHashing;

/**
 * Filter value that already is the digest of a hash-indexed field's storage
 * form, used as the index key without further conversion.
 */
public record IndexDigest(String hex) {
    public IndexDigest {
        if (hex == null || !IndexHashing.looksLikeDigest(hex)) {
            throw new IllegalArgumentException("hex digest required, got " + hex);
        }
    }

    /**
     * Digest a raw storage form, for callers that precompute filter keys.
     */
    public static IndexDigest of(byte[] storageForm) {
        return new IndexDigest(IndexHashing.md5Hex(storageForm));
    }
}
