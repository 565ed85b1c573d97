package com.libragraph.unlock.formats.api;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A magic byte sequence and the format label it identifies.
 *
 * @param magicBytes fixed prefix that identifies the format (never empty)
 * @param label      format label, e.g. "flac" or "image/png"
 */
public record HeaderEntry(byte[] magicBytes, String label) {

    public HeaderEntry {
        Objects.requireNonNull(magicBytes, "magic bytes cannot be null");
        Objects.requireNonNull(label, "label cannot be null");
        if (magicBytes.length == 0) {
            throw new IllegalArgumentException("Magic bytes cannot be empty for label: " + label);
        }
        magicBytes = Arrays.copyOf(magicBytes, magicBytes.length);
    }

    /**
     * Entry whose magic bytes are the ISO-8859-1 encoding of {@code magic}.
     */
    public static HeaderEntry ofAscii(String magic, String label) {
        return new HeaderEntry(magic.getBytes(StandardCharsets.ISO_8859_1), label);
    }

    /**
     * Entry whose magic bytes are given as a hex string.
     */
    public static HeaderEntry ofHex(String hex, String label) {
        return new HeaderEntry(HexFormat.of().parseHex(hex), label);
    }

    @Override
    public byte[] magicBytes() {
        return Arrays.copyOf(magicBytes, magicBytes.length);
    }

    public int length() {
        return magicBytes.length;
    }

    /**
     * Checks whether {@code data} starts with this entry's magic bytes.
     * A null or shorter buffer never matches.
     */
    public boolean matches(byte[] data) {
        if (data == null || data.length < magicBytes.length) {
            return false;
        }
        return Arrays.equals(data, 0, magicBytes.length, magicBytes, 0, magicBytes.length);
    }

    /**
     * Checks whether this entry's magic bytes equal {@code other}.
     */
    public boolean hasMagic(byte[] other) {
        return Arrays.equals(magicBytes, other);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof HeaderEntry other)) return false;
        return label.equals(other.label) && Arrays.equals(magicBytes, other.magicBytes);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(magicBytes) + label.hashCode();
    }

    @Override
    public String toString() {
        return label + "=" + HexFormat.of().formatHex(magicBytes);
    }
}
