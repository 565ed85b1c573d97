package com.libragraph.unlock.util;

/**
 * Thrown when two byte sequences that must be combined element-wise differ in length.
 */
public class LengthMismatchException extends IllegalArgumentException {

    private final int leftLength;
    private final int rightLength;

    public LengthMismatchException(int leftLength, int rightLength) {
        super("Only byte sequences of equal length can be xored, got: "
                + leftLength + " and " + rightLength);
        this.leftLength = leftLength;
        this.rightLength = rightLength;
    }

    public int leftLength() {
        return leftLength;
    }

    public int rightLength() {
        return rightLength;
    }
}
