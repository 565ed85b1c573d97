package com.libragraph.unlock.util;

import java.util.Objects;

/**
 * Fixed-length byte-wise XOR, the only cipher primitive shared by the decoders.
 */
public final class ByteXor {

    private ByteXor() {
    }

    /**
     * Returns a new array where {@code result[i] = a[i] ^ b[i]}.
     *
     * @throws LengthMismatchException if the operands differ in length
     */
    public static byte[] xor(byte[] a, byte[] b) {
        requireSameLength(a, b);
        byte[] result = new byte[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = (byte) (a[i] ^ b[i]);
        }
        return result;
    }

    /**
     * XORs {@code key} into {@code target}, overwriting it.
     * Same contract as {@link #xor(byte[], byte[])} without the allocation.
     *
     * @return {@code target}
     */
    public static byte[] xorInPlace(byte[] target, byte[] key) {
        requireSameLength(target, key);
        for (int i = 0; i < target.length; i++) {
            target[i] ^= key[i];
        }
        return target;
    }

    private static void requireSameLength(byte[] a, byte[] b) {
        Objects.requireNonNull(a, "left operand cannot be null");
        Objects.requireNonNull(b, "right operand cannot be null");
        if (a.length != b.length) {
            throw new LengthMismatchException(a.length, b.length);
        }
    }
}
