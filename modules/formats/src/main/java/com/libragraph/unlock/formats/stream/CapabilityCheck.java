package com.libragraph.unlock.formats.stream;

/**
 * Which capabilities to check. Enabled checks always run read → seek → write.
 */
public record CapabilityCheck(boolean read, boolean seek, boolean write) {

    /** Read and seek, no write: what decoders need from an input handle. */
    public static final CapabilityCheck DEFAULT = new CapabilityCheck(true, true, false);

    /** Read, seek and write. */
    public static final CapabilityCheck ALL = new CapabilityCheck(true, true, true);

    public CapabilityCheck withRead(boolean read) {
        return new CapabilityCheck(read, seek, write);
    }

    public CapabilityCheck withSeek(boolean seek) {
        return new CapabilityCheck(read, seek, write);
    }

    public CapabilityCheck withWrite(boolean write) {
        return new CapabilityCheck(read, seek, write);
    }
}
