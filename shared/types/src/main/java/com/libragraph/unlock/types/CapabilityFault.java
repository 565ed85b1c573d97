package com.libragraph.unlock.types;

public enum CapabilityFault {
    /** The handle does not expose the operation at all. */
    MISSING,

    /** The operation exists but failed, or produced text instead of bytes. */
    FAULTY
}
