package com.rulesync.core.model;

import java.util.HexFormat;
import java.util.Objects;

/**
 * Fixed-size summary of one subpath's file set. Two equal digests mean that
 * republication of that subpath may be skipped.
 *
 * @since 1.0.0
 */
public final class ContentDigest {

    private final String hex;

    private ContentDigest(String hex) {
        this.hex = hex;
    }

    public static ContentDigest of(byte[] digest) {
        Objects.requireNonNull(digest, "digest must not be null");
        return new ContentDigest(HexFormat.of().formatHex(digest));
    }

    public String toHex() {
        return hex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ContentDigest that))
            return false;
        return hex.equals(that.hex);
    }

    @Override
    public int hashCode() {
        return hex.hashCode();
    }

    @Override
    public String toString() {
        return hex.length() > 12 ? hex.substring(0, 12) : hex;
    }
}
