package com.libragraph.unlock.types;

/**
 * I/O operations a decoder may require from a stream handle.
 * Declaration order is the order in which they are checked.
 */
public enum Capability {
    READ("read"),
    SEEK("seek"),
    WRITE("write");

    private final String label;

    Capability(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
