package com.libragraph.unlock.formats.stream;

import com.libragraph.unlock.types.Capability;
import com.libragraph.unlock.types.CapabilityFault;

/**
 * Thrown when a stream handle lacks, or fails at, an operation a decoder needs.
 */
public class CapabilityException extends RuntimeException {

    private final Capability capability;
    private final CapabilityFault fault;

    public CapabilityException(Capability capability, CapabilityFault fault, String message, Throwable cause) {
        super(message, cause);
        this.capability = capability;
        this.fault = fault;
    }

    public CapabilityException(Capability capability, CapabilityFault fault, String message) {
        this(capability, fault, message, null);
    }

    public Capability capability() {
        return capability;
    }

    public CapabilityFault fault() {
        return fault;
    }
}
